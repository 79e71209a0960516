package com.example.backup.infrastructure.store;

import com.fasterxml.jackson.databind.JsonNode;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 로그 세그먼트에 담기는 단일 변경
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class LogMutation {

    public enum Operation {
        PUT,
        DELETE
    }

    private String collection;
    private String key;
    private Operation op;
    private JsonNode value; // DELETE 인 경우 null

    public static LogMutation put(String collection, String key, JsonNode value) {
        return new LogMutation(collection, key, Operation.PUT, value);
    }

    public static LogMutation delete(String collection, String key) {
        return new LogMutation(collection, key, Operation.DELETE, null);
    }
}
