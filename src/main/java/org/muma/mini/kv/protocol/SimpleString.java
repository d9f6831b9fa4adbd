package org.muma.mini.kv.protocol;

// 1. Simple string (+)
public record SimpleString(String content) implements RedisMessage {

    public static final SimpleString OK = new SimpleString("OK");
    public static final SimpleString PONG = new SimpleString("PONG");

    public SimpleString {
        RedisMessage.requireSingleLine(content, "Simple string");
    }
}
