package com.confidence.schema;

import org.junit.jupiter.api.Test;

import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class RegistryLockTest {

    @Test
    void exclusiveScope_blocksSharedUntilClosed() throws InterruptedException {
        RegistryLock lock = new RegistryLock();
        CountDownLatch acquired = new CountDownLatch(1);
        Thread reader = new Thread(() -> {
            try (RegistryLock.Scope ignored = lock.shared()) {
                acquired.countDown();
            }
        });

        try (RegistryLock.Scope ignored = lock.exclusive()) {
            reader.start();
            assertFalse(acquired.await(100, TimeUnit.MILLISECONDS));
        }

        assertTrue(acquired.await(5, TimeUnit.SECONDS));
        reader.join();
    }

    @Test
    void sharedScopes_canBeHeldTogether() throws InterruptedException {
        RegistryLock lock = new RegistryLock();
        CountDownLatch acquired = new CountDownLatch(1);
        Thread reader = new Thread(() -> {
            try (RegistryLock.Scope ignored = lock.shared()) {
                acquired.countDown();
            }
        });

        try (RegistryLock.Scope ignored = lock.shared()) {
            reader.start();
            assertTrue(acquired.await(5, TimeUnit.SECONDS));
        }
        reader.join();
    }
}
