package com.guardsql.service;

import com.guardsql.model.TransactionStatus;
import com.guardsql.model.WriteState;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;

class SessionStateMachineTest {

    @Test
    void deriveFromObservedStatus() {
        assertEquals(WriteState.WRITE_IDLE, SessionStateMachine.derive(TransactionStatus.NONE, false));
        assertEquals(WriteState.WRITE_IDLE, SessionStateMachine.derive(TransactionStatus.IDLE, false));
        assertEquals(WriteState.WRITE_ACTIVE, SessionStateMachine.derive(TransactionStatus.ACTIVE, false));
        assertEquals(WriteState.WRITE_FAILED, SessionStateMachine.derive(TransactionStatus.ERROR, false));
    }

    @Test
    void clientErrorFlagWins() {
        assertEquals(WriteState.WRITE_FAILED, SessionStateMachine.derive(TransactionStatus.IDLE, true));
        assertEquals(WriteState.WRITE_FAILED, SessionStateMachine.derive(TransactionStatus.ACTIVE, true));
    }
}
