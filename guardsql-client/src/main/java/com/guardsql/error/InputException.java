package com.guardsql.error;

/**
 * Thrown for client-side input problems: bad syntax, unbound variables, bad arguments.
 */
public class InputException extends GuardsqlException {
    /**
     * Create a new exception.
     *
     * @param message error message
     */
    public InputException(String message) {
        super(ErrorKind.INPUT, message);
    }

    /**
     * Create an exception naming the offending token and the expected form.
     *
     * @param token offending token
     * @param expected expected form
     * @return exception
     */
    public static InputException badArgument(String token, String expected) {
        return new InputException("Invalid argument '" + token + "'. Expected: " + expected);
    }
}
