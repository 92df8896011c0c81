package com.guardsql.model;

import java.util.ArrayList;
import java.util.Deque;
import java.util.LinkedList;
import java.util.List;

/**
 * Recently entered justification values, most recent first, without duplicates.
 * Offered for recall only; never applied without explicit re-submission.
 */
public class JustificationHistory {
    static final int DEFAULT_CAPACITY = 10;

    private final int capacity;
    private final Deque<String> values = new LinkedList<>();

    public JustificationHistory() {
        this(DEFAULT_CAPACITY);
    }

    public JustificationHistory(int capacity) {
        this.capacity = capacity;
    }

    public synchronized void remember(String value) {
        values.remove(value);
        values.addFirst(value);
        while (values.size() > capacity) {
            values.removeLast();
        }
    }

    public synchronized List<String> recent() {
        return new ArrayList<>(values);
    }
}
