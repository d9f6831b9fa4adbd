package org.muma.mini.kv.command;

import org.muma.mini.kv.command.impl.connection.CommandCommand;
import org.muma.mini.kv.command.impl.connection.EchoCommand;
import org.muma.mini.kv.command.impl.connection.PingCommand;
import org.muma.mini.kv.command.impl.connection.QuitCommand;
import org.muma.mini.kv.command.impl.key.DbSizeCommand;
import org.muma.mini.kv.command.impl.key.DelCommand;
import org.muma.mini.kv.command.impl.key.ExistsCommand;
import org.muma.mini.kv.command.impl.string.GetCommand;
import org.muma.mini.kv.command.impl.string.SetCommand;
import org.muma.mini.kv.protocol.BulkString;
import org.muma.mini.kv.protocol.ErrorMessage;
import org.muma.mini.kv.protocol.RedisArray;
import org.muma.mini.kv.protocol.RedisMessage;
import org.muma.mini.kv.protocol.SimpleString;
import org.muma.mini.kv.server.RedisContext;
import org.muma.mini.kv.store.StorageEngine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.HashMap;
import java.util.Locale;
import java.util.Map;

/**
 * 把解码后的请求帧映射到 {@link RedisCommand} 并在共享存储上执行。
 * 所有失败 (包括格式不对的请求) 都以 {@link ErrorMessage} 返回
 */
public class CommandDispatcher {

    private static final Logger log = LoggerFactory.getLogger(CommandDispatcher.class);

    private static final long SLOW_COMMAND_MILLIS = 10;

    private final Map<String, RedisCommand> commandMap = new HashMap<>();
    private final StorageEngine storage;

    public CommandDispatcher(StorageEngine storage) {
        this.storage = storage;
        this.initCommandRegistry();
    }

    /**
     * 初始化命令注册表，按命令包分类注册
     */
    private void initCommandRegistry() {
        registerConnectionCommands();
        registerStringCommands();
        registerKeyCommands();

        log.info("CommandDispatcher initialized. Total commands registered: {}", commandMap.size());
    }

    private void registerConnectionCommands() {
        register(new PingCommand());
        register(new EchoCommand());
        register(new QuitCommand());
        register(new CommandCommand());
    }

    private void registerStringCommands() {
        register(new GetCommand());
        register(new SetCommand());
    }

    private void registerKeyCommands() {
        register(new DelCommand());
        register(new ExistsCommand());
        register(new DbSizeCommand());
    }

    private void register(RedisCommand command) {
        commandMap.put(command.name(), command);
    }

    public RedisMessage dispatch(RedisMessage frame) {
        return dispatch(frame, new RedisContext("local"));
    }

    /**
     * 核心分发逻辑
     */
    public RedisMessage dispatch(RedisMessage frame, RedisContext context) {
        // 1. 校验请求格式
        String commandName = extractCommandName(frame);
        if (commandName == null) {
            log.warn("Unexpected command format from {}: {}", context.getClientAddress(), singleLine(String.valueOf(frame)));
            return new ErrorMessage("ERR unexpected command format");
        }

        // 2. 查找命令
        RedisCommand command = commandMap.get(commandName.toLowerCase(Locale.ROOT));
        if (command == null) {
            log.warn("Command not found: {}", singleLine(commandName));
            return new ErrorMessage("ERR unknown command '" + singleLine(commandName) + "'");
        }

        // 3. 执行并监控耗时
        long startTime = System.nanoTime();
        try {
            RedisMessage response = command.execute(storage, (RedisArray) frame, context);

            long duration = (System.nanoTime() - startTime) / 1_000_000;
            if (duration > SLOW_COMMAND_MILLIS) {
                log.warn("Slow command detected: {} cost {}ms", command.name(), duration);
            } else if (log.isDebugEnabled()) {
                log.debug("Command executed: {} cost {}ms", command.name(), duration);
            }
            return response;

        } catch (IllegalArgumentException e) {
            // 预期内的业务错误 (如参数类型错误)
            log.warn("Command execution failed (Client Error): {} - {}", command.name(), e.getMessage());
            return new ErrorMessage("ERR " + singleLine(String.valueOf(e.getMessage())));

        } catch (RuntimeException e) {
            // 意料之外的系统错误 (如 NPE)
            log.error("Internal Server Error processing command: {}", command.name(), e);
            return new ErrorMessage("ERR internal server error");
        }
    }

    /**
     * @return 命令名，请求不是命令格式时返回 {@code null}
     */
    private String extractCommandName(RedisMessage frame) {
        if (!(frame instanceof RedisArray array) || array.isNull() || array.size() == 0) {
            return null;
        }
        RedisMessage first = array.get(0);
        if (first instanceof BulkString bulk && !bulk.isNull()) {
            return bulk.asString();
        }
        if (first instanceof SimpleString simple) {
            return simple.content();
        }
        return null;
    }

    // 错误回复和日志都是单行，客户端传来的文本不能带换行
    static String singleLine(String text) {
        return text.replace('\r', ' ').replace('\n', ' ');
    }
}
