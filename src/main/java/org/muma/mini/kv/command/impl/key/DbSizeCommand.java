package org.muma.mini.kv.command.impl.key;

import org.muma.mini.kv.command.RedisCommand;
import org.muma.mini.kv.protocol.RedisArray;
import org.muma.mini.kv.protocol.RedisInteger;
import org.muma.mini.kv.protocol.RedisMessage;
import org.muma.mini.kv.server.RedisContext;
import org.muma.mini.kv.store.StorageEngine;

public class DbSizeCommand implements RedisCommand {

    @Override
    public RedisMessage execute(StorageEngine storage, RedisArray args, RedisContext context) {
        if (args.size() != 1) {
            return errorArgs();
        }
        return new RedisInteger(storage.size());
    }

    @Override
    public String name() {
        return "dbsize";
    }
}
