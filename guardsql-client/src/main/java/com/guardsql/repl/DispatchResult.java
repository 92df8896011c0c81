package com.guardsql.repl;

/**
 * How the read loop continues after a metacommand.
 */
public final class DispatchResult {
    public static final DispatchResult CONTINUE = new DispatchResult(false, null);
    public static final DispatchResult QUIT = new DispatchResult(true, null);

    private final boolean quit;
    private final String buffer;

    private DispatchResult(boolean quit, String buffer) {
        this.quit = quit;
        this.buffer = buffer;
    }

    /**
     * Replace the query buffer with edited text.
     *
     * @param text new buffer contents
     * @return result
     */
    public static DispatchResult replaceBuffer(String text) {
        return new DispatchResult(false, text == null ? "" : text);
    }

    public boolean isQuit() {
        return quit;
    }

    /**
     * @return the new buffer, or null to keep the current one
     */
    public String getBuffer() {
        return buffer;
    }
}
