package com.guardsql.api;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Data;

@Data
public class ConnectRequest {
    /** Bare database name, connection URL, or SQLite file. */
    @NotBlank(message = "Connection target is required")
    private String target;

    @Valid
    @NotNull(message = "Options are required")
    private ConnectOptions options = new ConnectOptions();

    @Data
    public static class ConnectOptions {
        private int maximumPoolSize = 4;
        private int minimumIdle = 1;
        private int connectionTimeoutMs = 10000;
    }
}
