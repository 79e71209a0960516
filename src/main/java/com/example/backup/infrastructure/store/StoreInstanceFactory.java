package com.example.backup.infrastructure.store;

public interface StoreInstanceFactory {
    StoreInstance create(String name);
}
