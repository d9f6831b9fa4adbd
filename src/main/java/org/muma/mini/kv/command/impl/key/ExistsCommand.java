package org.muma.mini.kv.command.impl.key;

import org.muma.mini.kv.command.RedisCommand;
import org.muma.mini.kv.protocol.RedisArray;
import org.muma.mini.kv.protocol.RedisInteger;
import org.muma.mini.kv.protocol.RedisMessage;
import org.muma.mini.kv.server.RedisContext;
import org.muma.mini.kv.store.StorageEngine;

import java.util.ArrayList;
import java.util.List;

/**
 * EXISTS key [key ...]，同一个 Key 出现两次就计数两次
 */
public class ExistsCommand implements RedisCommand {

    @Override
    public RedisMessage execute(StorageEngine storage, RedisArray args, RedisContext context) {
        if (args.size() < 2) {
            return errorArgs();
        }

        List<String> keys = new ArrayList<>(args.size() - 1);
        for (int i = 1; i < args.size(); i++) {
            keys.add(argKey(args, i));
        }

        long count = 0;
        for (String key : keys) {
            if (storage.exists(key)) {
                count++;
            }
        }
        return new RedisInteger(count);
    }

    @Override
    public String name() {
        return "exists";
    }
}
