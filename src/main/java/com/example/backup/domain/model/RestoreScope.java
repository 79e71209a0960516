package com.example.backup.domain.model;

import lombok.AccessLevel;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * 복구 범위: 전체 스토어 또는 단일 컬렉션(table:&lt;name&gt;)
 */
@Getter
@EqualsAndHashCode
@RequiredArgsConstructor(access = AccessLevel.PRIVATE)
public class RestoreScope {

    private static final String TABLE_PREFIX = "table:";

    private final String collection;

    public static RestoreScope full() {
        return new RestoreScope(null);
    }

    public static RestoreScope table(String collection) {
        if (collection == null || collection.isBlank()) {
            throw new IllegalArgumentException("Table scope requires a collection name");
        }
        return new RestoreScope(collection.trim());
    }

    public static RestoreScope parse(String raw) {
        if (raw == null || raw.isBlank() || "full".equalsIgnoreCase(raw.trim())) {
            return full();
        }
        String value = raw.trim();
        if (value.regionMatches(true, 0, TABLE_PREFIX, 0, TABLE_PREFIX.length())) {
            return table(value.substring(TABLE_PREFIX.length()));
        }
        throw new IllegalArgumentException("Scope must be 'full' or 'table:<name>': " + raw);
    }

    public boolean isFull() {
        return collection == null;
    }

    public String describe() {
        return isFull() ? "full" : TABLE_PREFIX + collection;
    }

    @Override
    public String toString() {
        return describe();
    }
}
