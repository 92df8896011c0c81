package com.guardsql.service;

import org.junit.jupiter.api.Test;

import static com.guardsql.service.StatementClassifier.Kind.COMMIT;
import static com.guardsql.service.StatementClassifier.Kind.OTHER;
import static com.guardsql.service.StatementClassifier.Kind.ROLLBACK;
import static org.junit.jupiter.api.Assertions.assertEquals;

class StatementClassifierTest {

    @Test
    void commitForms() {
        assertEquals(COMMIT, StatementClassifier.classify("COMMIT"));
        assertEquals(COMMIT, StatementClassifier.classify("commit work"));
        assertEquals(COMMIT, StatementClassifier.classify("End Transaction"));
        assertEquals(COMMIT, StatementClassifier.classify("COMMIT;"));
    }

    @Test
    void rollbackForms() {
        assertEquals(ROLLBACK, StatementClassifier.classify("rollback"));
        assertEquals(ROLLBACK, StatementClassifier.classify("ABORT WORK"));
        assertEquals(ROLLBACK, StatementClassifier.classify("ROLLBACK TRANSACTION"));
    }

    @Test
    void leadingCommentsAreSkipped() {
        assertEquals(COMMIT, StatementClassifier.classify("-- done\n/* really */ COMMIT"));
    }

    @Test
    void otherStatements() {
        assertEquals(OTHER, StatementClassifier.classify("ROLLBACK TO SAVEPOINT a"));
        assertEquals(OTHER, StatementClassifier.classify("COMMIT PREPARED 'x'"));
        assertEquals(OTHER, StatementClassifier.classify("SELECT 1"));
        assertEquals(OTHER, StatementClassifier.classify("   "));
        assertEquals(OTHER, StatementClassifier.classify(null));
    }
}
