package com.example.backup.presentation.dto.request;

import com.example.backup.infrastructure.store.LogMutation;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.databind.JsonNode;
import jakarta.validation.Valid;
import jakarta.validation.constraints.AssertTrue;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;
import java.util.stream.Collectors;

/**
 * 내장 스토어 쓰기 요청 (하나의 세그먼트로 커밋)
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CommitRequest {

    @NotEmpty(message = "at least one mutation is required")
    @Valid
    private List<Mutation> mutations;

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Mutation {
        @NotBlank(message = "collection is required")
        private String collection;
        @NotBlank(message = "key is required")
        private String key;
        @NotNull(message = "op is required")
        private LogMutation.Operation op;
        private JsonNode value;

        @JsonIgnore
        @AssertTrue(message = "PUT requires a value")
        public boolean isValuePresentForPut() {
            return op != LogMutation.Operation.PUT || (value != null && !value.isNull());
        }
    }

    public List<LogMutation> toMutations() {
        return mutations.stream()
                .map(m -> new LogMutation(m.getCollection(), m.getKey(), m.getOp(), m.getValue()))
                .collect(Collectors.toList());
    }
}
