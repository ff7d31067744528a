package org.example.driver_ledger.conversation;

import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * Один замок на пользователя: два сообщения от одного юзера не обрабатываются
 * одновременно, а разные юзеры друг друга не ждут.
 * <p>
 * Замок живёт, пока его кто-то держит или ждёт, потом удаляется из карты.
 */
@Component
public class UserLockRegistry {

    private final Map<Long, UserLock> locks = new ConcurrentHashMap<>();

    public void runExclusively(Long userId, Runnable action) {
        callExclusively(userId, () -> {
            action.run();
            return null;
        });
    }

    public <T> T callExclusively(Long userId, Supplier<T> action) {
        // holders меняется только внутри compute - атомарно для этого ключа
        UserLock entry = locks.compute(userId, (id, existing) -> {
            UserLock lock = existing != null ? existing : new UserLock();
            lock.holders++;
            return lock;
        });
        entry.lock.lock();
        try {
            return action.get();
        } finally {
            entry.lock.unlock();
            locks.computeIfPresent(userId, (id, lock) -> --lock.holders == 0 ? null : lock);
        }
    }

    /** Сколько пользователей сейчас держат или ждут замок */
    int activeLocks() {
        return locks.size();
    }

    private static final class UserLock {
        private final ReentrantLock lock = new ReentrantLock();
        private int holders;
    }
}
