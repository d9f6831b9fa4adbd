package org.muma.mini.kv.command.impl.connection;

import org.muma.mini.kv.command.RedisCommand;
import org.muma.mini.kv.protocol.BulkString;
import org.muma.mini.kv.protocol.RedisArray;
import org.muma.mini.kv.protocol.RedisMessage;
import org.muma.mini.kv.protocol.SimpleString;
import org.muma.mini.kv.server.RedisContext;
import org.muma.mini.kv.store.StorageEngine;

/**
 * PING [message]: 返回 PONG，带参数时把参数作为 BulkString 原样返回
 */
public class PingCommand implements RedisCommand {

    @Override
    public RedisMessage execute(StorageEngine storage, RedisArray args, RedisContext context) {
        return switch (args.size()) {
            case 1 -> SimpleString.PONG;
            case 2 -> new BulkString(argBytes(args, 1));
            default -> errorArgs();
        };
    }

    @Override
    public String name() {
        return "ping";
    }
}
