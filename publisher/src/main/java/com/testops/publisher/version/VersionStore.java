package com.testops.publisher.version;

/**
 * Monotonic report-artifact version counter that survives process restarts.
 */
public interface VersionStore {

    /**
     * Read the stored value (0 if absent or unreadable), add one, store and
     * return the result. The read-increment-write is a single critical
     * section: two callers never receive the same number.
     */
    int allocateNext();

    /**
     * The most recently allocated version, without changing it.
     * Returns 1 when nothing usable is stored.
     */
    int current();
}
