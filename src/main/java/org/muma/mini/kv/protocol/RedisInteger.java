package org.muma.mini.kv.protocol;

// 3. Integer (:)
public record RedisInteger(long value) implements RedisMessage {
}
