package com.example.backup.presentation.dto.request;

import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RestoreRunRequest {

    @NotBlank(message = "store is required")
    private String store;

    private String target; // latest | ISO-8601 | sequence id (기본 latest)

    private String scope;  // full | table:<name> (기본 full)

    private boolean force;
}
