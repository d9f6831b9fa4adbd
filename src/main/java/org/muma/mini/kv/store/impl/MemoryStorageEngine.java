package org.muma.mini.kv.store.impl;

import org.muma.mini.kv.store.StorageEngine;

import java.util.HashMap;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;

/**
 * 内存存储: 一把锁保护的 {@link HashMap}。
 * 锁只在单次 Map 操作期间持有，不跨越网络 I/O
 */
public class MemoryStorageEngine implements StorageEngine {

    private final Map<String, byte[]> memoryDb = new HashMap<>();
    private final ReentrantLock lock = new ReentrantLock();

    @Override
    public Optional<byte[]> get(String key) {
        lock.lock();
        try {
            return Optional.ofNullable(memoryDb.get(key));
        } finally {
            lock.unlock();
        }
    }

    @Override
    public void set(String key, byte[] value) {
        // 写入后 value 不再修改
        lock.lock();
        try {
            memoryDb.put(key, value);
        } finally {
            lock.unlock();
        }
    }

    @Override
    public boolean remove(String key) {
        lock.lock();
        try {
            return memoryDb.remove(key) != null;
        } finally {
            lock.unlock();
        }
    }

    @Override
    public boolean exists(String key) {
        lock.lock();
        try {
            return memoryDb.containsKey(key);
        } finally {
            lock.unlock();
        }
    }

    @Override
    public int size() {
        lock.lock();
        try {
            return memoryDb.size();
        } finally {
            lock.unlock();
        }
    }
}
