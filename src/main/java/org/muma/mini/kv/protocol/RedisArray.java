package org.muma.mini.kv.protocol;

import java.util.Arrays;

/**
 * 5. Array (*)
 * 元素数组为 {@code null} 时表示 Null Array ({@code *-1})
 */
public record RedisArray(RedisMessage[] elements) implements RedisMessage {

    public static final RedisArray NULL = new RedisArray(null);
    public static final RedisArray EMPTY = new RedisArray(new RedisMessage[0]);

    public RedisArray {
        elements = elements == null ? null : elements.clone();
    }

    public static RedisArray of(RedisMessage... elements) {
        return new RedisArray(elements);
    }

    @Override
    public RedisMessage[] elements() {
        return elements == null ? null : elements.clone();
    }

    public boolean isNull() {
        return elements == null;
    }

    public int size() {
        return elements == null ? -1 : elements.length;
    }

    public RedisMessage get(int index) {
        return elements[index];
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        return o instanceof RedisArray other && Arrays.equals(elements, other.elements);
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(elements);
    }

    @Override
    public String toString() {
        return elements == null ? "RedisArray[null]" : "RedisArray" + Arrays.toString(elements);
    }
}
