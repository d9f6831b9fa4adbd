package org.muma.mini.kv.command;

import org.muma.mini.kv.protocol.BulkString;
import org.muma.mini.kv.protocol.ErrorMessage;
import org.muma.mini.kv.protocol.RedisArray;
import org.muma.mini.kv.protocol.RedisMessage;
import org.muma.mini.kv.server.RedisContext;
import org.muma.mini.kv.store.StorageEngine;

import java.nio.charset.StandardCharsets;

public interface RedisCommand {

    /**
     * 执行命令。{@code args} 是完整的请求，第 0 个元素是命令名
     */
    RedisMessage execute(StorageEngine storage, RedisArray args, RedisContext context);

    // 小写命令名，用于注册和错误信息
    String name();

    default ErrorMessage errorArgs() {
        return new ErrorMessage("ERR wrong number of arguments for '" + name() + "' command");
    }

    /**
     * 第 {@code index} 个参数的原始字节。
     * 不是非空 BulkString 时抛出 {@link IllegalArgumentException}，由 Dispatcher 转成错误回复
     */
    default byte[] argBytes(RedisArray args, int index) {
        if (args.get(index) instanceof BulkString bulk && !bulk.isNull()) {
            return bulk.content();
        }
        throw new IllegalArgumentException("wrong type of argument for '" + name() + "' command");
    }

    /**
     * 参数作为 Key: 每个字节对应一个 ISO-8859-1 字符，不同的字节序列永远得到不同的 Key
     */
    default String argKey(RedisArray args, int index) {
        return new String(argBytes(args, index), StandardCharsets.ISO_8859_1);
    }
}
