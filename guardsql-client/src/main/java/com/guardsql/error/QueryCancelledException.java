package com.guardsql.error;

/**
 * The user interrupted the query in flight. Normal control flow, not a failure.
 */
public class QueryCancelledException extends RuntimeException {
    public QueryCancelledException() {
        super("Query cancelled.");
    }
}
