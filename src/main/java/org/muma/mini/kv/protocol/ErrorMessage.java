package org.muma.mini.kv.protocol;

// 2. Error (-)
public record ErrorMessage(String content) implements RedisMessage {

    public ErrorMessage {
        RedisMessage.requireSingleLine(content, "Error");
    }
}
