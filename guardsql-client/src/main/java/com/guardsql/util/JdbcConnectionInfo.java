package com.guardsql.util;

import lombok.Builder;
import lombok.Data;
import lombok.ToString;

import java.util.Map;

@Data
@Builder(toBuilder = true)
public class JdbcConnectionInfo {
    private String url;
    private String username;
    @ToString.Exclude
    private String password;
    private String dbType;
    private String database;
    /** libpq-style sslmode: disable | prefer | require | verify-ca | verify-full. Null for SQLite. */
    private String sslMode;
    /** Extra driver properties from the target's query string. */
    private Map<String, String> properties;
    /** Target with the password masked, safe to log and display. */
    private String displayTarget;
}
