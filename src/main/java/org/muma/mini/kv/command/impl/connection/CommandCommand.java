package org.muma.mini.kv.command.impl.connection;

import org.muma.mini.kv.command.RedisCommand;
import org.muma.mini.kv.protocol.RedisArray;
import org.muma.mini.kv.protocol.RedisMessage;
import org.muma.mini.kv.server.RedisContext;
import org.muma.mini.kv.store.StorageEngine;

/**
 * redis-cli 连接时会发送 COMMAND，返回空数组即可
 */
public class CommandCommand implements RedisCommand {

    @Override
    public RedisMessage execute(StorageEngine storage, RedisArray args, RedisContext context) {
        return RedisArray.EMPTY;
    }

    @Override
    public String name() {
        return "command";
    }
}
