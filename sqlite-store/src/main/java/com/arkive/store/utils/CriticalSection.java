package com.arkive.store.utils;

import java.util.concurrent.locks.ReentrantLock;

/**
 * Fair mutual exclusion usable with try-with-resources.
 * <pre>
 * try (var ignored = criticalSection.enter()) {
 *     ...
 * }
 * </pre>
 */
public class CriticalSection {

    private final ReentrantLock lock = new ReentrantLock(true);

    public Held enter() {
        lock.lock();
        return lock::unlock;
    }

    public interface Held extends AutoCloseable {
        @Override
        void close();
    }
}
