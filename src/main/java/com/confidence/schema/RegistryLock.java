package com.confidence.schema;

import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * Guards the schema store of a {@link DimensionRegistry}. Lookups take the shared half,
 * register/unregister/reset the exclusive half. Each acquisition returns a {@link Scope}
 * meant for try-with-resources.
 */
final class RegistryLock {

    private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();

    /** A held lock half; closing it releases the lock. */
    interface Scope extends AutoCloseable {
        @Override
        void close();
    }

    Scope shared() {
        return hold(lock.readLock());
    }

    Scope exclusive() {
        return hold(lock.writeLock());
    }

    private static Scope hold(Lock half) {
        half.lock();
        return half::unlock;
    }
}
