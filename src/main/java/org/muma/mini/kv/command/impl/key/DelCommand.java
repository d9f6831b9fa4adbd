package org.muma.mini.kv.command.impl.key;

import org.muma.mini.kv.command.RedisCommand;
import org.muma.mini.kv.protocol.RedisArray;
import org.muma.mini.kv.protocol.RedisInteger;
import org.muma.mini.kv.protocol.RedisMessage;
import org.muma.mini.kv.server.RedisContext;
import org.muma.mini.kv.store.StorageEngine;

import java.util.ArrayList;
import java.util.List;

public class DelCommand implements RedisCommand {

    @Override
    public RedisMessage execute(StorageEngine storage, RedisArray args, RedisContext context) {
        if (args.size() < 2) {
            return errorArgs();
        }

        // 先校验全部参数，出错时不删除任何 Key
        List<String> keys = new ArrayList<>(args.size() - 1);
        for (int i = 1; i < args.size(); i++) {
            keys.add(argKey(args, i));
        }

        int deleted = 0;
        for (String key : keys) {
            if (storage.remove(key)) {
                deleted++;
            }
        }
        return new RedisInteger(deleted);
    }

    @Override
    public String name() {
        return "del";
    }
}
