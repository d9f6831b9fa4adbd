package org.muma.mini.kv.command.impl.string;

import org.muma.mini.kv.command.RedisCommand;
import org.muma.mini.kv.protocol.ErrorMessage;
import org.muma.mini.kv.protocol.RedisArray;
import org.muma.mini.kv.protocol.RedisMessage;
import org.muma.mini.kv.protocol.SimpleString;
import org.muma.mini.kv.server.RedisContext;
import org.muma.mini.kv.store.StorageEngine;

/**
 * SET key value，不支持 NX/XX/EX/PX 等选项，带多余参数时返回 syntax error
 */
public class SetCommand implements RedisCommand {

    @Override
    public RedisMessage execute(StorageEngine storage, RedisArray args, RedisContext context) {
        if (args.size() < 3) {
            return errorArgs();
        }
        if (args.size() > 3) {
            return new ErrorMessage("ERR syntax error");
        }

        String key = argKey(args, 1);
        byte[] value = argBytes(args, 2);
        storage.set(key, value);
        return SimpleString.OK;
    }

    @Override
    public String name() {
        return "set";
    }
}
