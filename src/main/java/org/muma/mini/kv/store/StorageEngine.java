package org.muma.mini.kv.store;

import java.util.Optional;

/**
 * 所有连接共享的 Key 空间，每次调用相对其他调用都是原子的。
 * Key 由原始字节按 ISO-8859-1 逐字节映射而来
 */
public interface StorageEngine {

    // 基础 KV 操作
    Optional<byte[]> get(String key);

    void set(String key, byte[] value);

    boolean remove(String key);

    boolean exists(String key);

    int size();
}
