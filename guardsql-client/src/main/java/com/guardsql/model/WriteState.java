package com.guardsql.model;

/**
 * Session states of the write-access protocol.
 */
public enum WriteState {
    READ_ONLY,
    WRITE_IDLE,
    WRITE_ACTIVE,
    WRITE_FAILED;

    public boolean isWrite() {
        return this != READ_ONLY;
    }

    /**
     * Quitting abandons uncommitted work in these states, so it is refused.
     *
     * @return true if quit must be refused
     */
    public boolean blocksQuit() {
        return this == WRITE_ACTIVE || this == WRITE_FAILED;
    }
}
