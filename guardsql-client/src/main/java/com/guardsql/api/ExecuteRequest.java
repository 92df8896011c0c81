package com.guardsql.api;

import com.guardsql.parser.QueryModifiers;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Data;

@Data
public class ExecuteRequest {
    @NotBlank(message = "SQL is required")
    private String sql;

    /** Exact text as submitted, before interpolation. */
    private String sourceText;

    @NotNull
    private QueryModifiers modifiers = QueryModifiers.none();

    @Valid
    @NotNull(message = "Options are required")
    private ExecuteOptions options = new ExecuteOptions();

    @Data
    public static class ExecuteOptions {
        /** Maximum rows kept; 0 keeps everything. */
        @Min(0)
        private int limit = 0;
        @Min(0)
        private int fetchSize = 500;
        @Min(0)
        private int queryTimeoutMs = 0;
    }
}
