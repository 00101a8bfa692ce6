package com.reference.matching.ratelimit;

/**
 * Fixed-capacity ring buffer of fetch outcomes. Appending to a full window
 * evicts the oldest outcome. Not thread-safe; the owner synchronizes.
 */
final class OutcomeWindow {

    private final boolean[] failures;
    private int head;
    private int size;
    private int failureCount;

    OutcomeWindow(int capacity) {
        this.failures = new boolean[capacity];
    }

    void append(boolean success) {
        boolean failure = !success;
        if (size == failures.length) {
            if (failures[head]) {
                failureCount--;
            }
        } else {
            size++;
        }
        failures[head] = failure;
        if (failure) {
            failureCount++;
        }
        head = (head + 1) % failures.length;
    }

    double failureRate() {
        return size == 0 ? 0.0 : (double) failureCount / size;
    }

    int size() {
        return size;
    }

    int capacity() {
        return failures.length;
    }
}
