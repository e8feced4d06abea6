package io.commandgate.storage;

import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * One lock per execution id, created on demand and dropped when its last user leaves.
 * Work on different execution ids never shares a lock.
 */
public final class ExecutionLocks {
    private final ConcurrentHashMap<String, LockRef> locks = new ConcurrentHashMap<>();

    public <T> T withLock(String executionId, Supplier<T> action) {
        LockRef ref = locks.compute(executionId, (id, current) -> {
            LockRef out = current == null ? new LockRef() : current;
            out.users++;
            return out;
        });
        ref.lock.lock();
        try {
            return action.get();
        } finally {
            ref.lock.unlock();
            locks.computeIfPresent(executionId, (id, current) -> --current.users == 0 ? null : current);
        }
    }

    int activeKeys() {
        return locks.size();
    }

    private static final class LockRef {
        private final ReentrantLock lock = new ReentrantLock();
        private int users;
    }
}
