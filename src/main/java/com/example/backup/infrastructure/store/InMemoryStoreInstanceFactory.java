package com.example.backup.infrastructure.store;

import lombok.RequiredArgsConstructor;

import java.time.Clock;

@RequiredArgsConstructor
public class InMemoryStoreInstanceFactory implements StoreInstanceFactory {

    private final Clock clock;

    @Override
    public StoreInstance create(String name) {
        return new InMemoryStoreInstance(name, clock);
    }
}
