package com.example.audiobook.service;

import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * Per-item mutual exclusion for check-then-act sequences on the download engine and the
 * manual-pause ledger.
 */
@Component
public class ItemLockRegistry {
    private final Map<String, ReentrantLock> locks = new ConcurrentHashMap<>();

    public <T> T withLock(String itemId, Supplier<T> action) {
        ReentrantLock lock = locks.computeIfAbsent(itemId, e -> new ReentrantLock());
        lock.lock();
        try {
            return action.get();
        } finally {
            lock.unlock();
        }
    }
}
