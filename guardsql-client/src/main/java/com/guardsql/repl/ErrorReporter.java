package com.guardsql.repl;

import com.guardsql.api.ErrorResponse;
import com.guardsql.audit.AuditEntry;
import com.guardsql.error.ErrorKind;
import com.guardsql.error.GuardsqlException;
import com.guardsql.error.QueryCancelledException;
import com.guardsql.error.StatementException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.PrintStream;

/**
 * Turns any failure of a submission into an {@link ErrorResponse} and prints it. Nothing thrown
 * while processing input escapes to the read loop.
 */
@Slf4j
@Component
public class ErrorReporter {

    public ErrorResponse toResponse(Throwable ex) {
        if (ex instanceof StatementException) {
            StatementException se = (StatementException) ex;
            return ErrorResponse.builder()
                    .code(ErrorKind.STATEMENT.getCode())
                    .message(se.getMessage())
                    .details(statementDetails(se))
                    .traceId(TraceIds.current())
                    .build();
        }
        if (ex instanceof GuardsqlException) {
            GuardsqlException ge = (GuardsqlException) ex;
            if (ge.getKind() == ErrorKind.INTERNAL) {
                log.error("Internal failure", ex);
            }
            return ErrorResponse.builder()
                    .code(ge.getKind().getCode())
                    .message(ge.getMessage())
                    .traceId(TraceIds.current())
                    .build();
        }
        log.error("Unhandled exception occurred", ex);
        return ErrorResponse.builder()
                .code(ErrorKind.INTERNAL.getCode())
                .message("An unexpected error occurred")
                .details(ex.getMessage())
                .traceId(TraceIds.current())
                .build();
    }

    /**
     * Print the failure. Cancellation is normal control flow and prints its message only.
     *
     * @param ex failure
     * @param err error stream
     * @return the response that was printed
     */
    public ErrorResponse report(Throwable ex, PrintStream err) {
        ErrorResponse response = toResponse(ex);
        if (ex instanceof QueryCancelledException) {
            err.println(ex.getMessage());
            return response;
        }
        err.println(response.getCode() + ": " + response.getMessage());
        if (response.getDetails() != null && !response.getDetails().isBlank()) {
            err.println(response.getDetails());
        }
        if (response.getCode().equals(ErrorKind.INTERNAL.getCode()) && response.getTraceId() != null) {
            err.println("trace_id: " + response.getTraceId());
        }
        err.flush();
        return response;
    }

    /**
     * Outcome string stored in the audit log for a failed item.
     *
     * @param ex failure
     * @return outcome
     */
    public static String outcome(Throwable ex) {
        if (ex instanceof QueryCancelledException) {
            return AuditEntry.CANCELLED;
        }
        ErrorKind kind = ex instanceof GuardsqlException ? ((GuardsqlException) ex).getKind() : ErrorKind.INTERNAL;
        return AuditEntry.errorOutcome(kind.getCode(), ex.getMessage());
    }

    private static String statementDetails(StatementException se) {
        StringBuilder sb = new StringBuilder();
        if (se.getSqlState() != null) {
            sb.append("SQLSTATE ").append(se.getSqlState());
        }
        if (se.getDetail() != null) {
            append(sb, "DETAIL: " + se.getDetail());
        }
        if (se.getHint() != null) {
            append(sb, "HINT: " + se.getHint());
        }
        if (se.getPosition() != null) {
            append(sb, "POSITION: " + se.getPosition());
        }
        return sb.toString();
    }

    private static void append(StringBuilder sb, String line) {
        if (sb.length() > 0) {
            sb.append('\n');
        }
        sb.append(line);
    }
}
