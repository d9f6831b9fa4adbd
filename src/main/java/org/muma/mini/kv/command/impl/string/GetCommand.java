package org.muma.mini.kv.command.impl.string;

import org.muma.mini.kv.command.RedisCommand;
import org.muma.mini.kv.protocol.BulkString;
import org.muma.mini.kv.protocol.RedisArray;
import org.muma.mini.kv.protocol.RedisMessage;
import org.muma.mini.kv.server.RedisContext;
import org.muma.mini.kv.store.StorageEngine;

public class GetCommand implements RedisCommand {

    @Override
    public RedisMessage execute(StorageEngine storage, RedisArray args, RedisContext context) {
        if (args.size() != 2) {
            return errorArgs();
        }

        String key = argKey(args, 1);
        return storage.get(key)
                .map(BulkString::new)
                .orElse(BulkString.NULL); // Nil
    }

    @Override
    public String name() {
        return "get";
    }
}
