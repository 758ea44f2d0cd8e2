package org.muma.mini.kv.command;

import org.muma.mini.kv.command.impl.connection.EchoCommand;
import org.muma.mini.kv.command.impl.connection.PingCommand;
import org.muma.mini.kv.command.impl.hash.HGetAllCommand;
import org.muma.mini.kv.command.impl.hash.HGetCommand;
import org.muma.mini.kv.command.impl.hash.HMGetCommand;
import org.muma.mini.kv.command.impl.hash.HSetCommand;
import org.muma.mini.kv.command.impl.set.SAddCommand;
import org.muma.mini.kv.command.impl.set.SIsMemberCommand;
import org.muma.mini.kv.command.impl.set.SMembersCommand;
import org.muma.mini.kv.command.impl.string.GetCommand;
import org.muma.mini.kv.command.impl.string.SetCommand;
import org.muma.mini.kv.protocol.RespArray;
import org.muma.mini.kv.protocol.RespFrame;
import org.muma.mini.kv.protocol.SimpleError;
import org.muma.mini.kv.store.StorageEngine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.HashMap;
import java.util.Locale;
import java.util.Map;

/**
 * 命令分发：请求数组 -> 解析校验 -> 执行 -> 结果帧。
 * 解析与执行是两个有序阶段，解析失败时不会触碰存储引擎。
 * 所有连接共享同一个实例 (注册表初始化后只读)。
 */
public class CommandDispatcher {

    private static final Logger log = LoggerFactory.getLogger(CommandDispatcher.class);

    private static final long SLOW_COMMAND_MILLIS = 10;

    private final Map<String, CommandParser> parserMap = new HashMap<>();
    private final StorageEngine storage;

    public CommandDispatcher(StorageEngine storage) {
        this.storage = storage;
        this.initCommandRegistry();
    }

    /**
     * 初始化命令注册表，按数据结构分类注册
     */
    private void initCommandRegistry() {
        registerConnectionCommands();
        registerStringCommands();
        registerHashCommands();
        registerSetCommands();

        log.info("CommandDispatcher initialized. Total commands registered: {}", parserMap.size());
    }

    private void registerConnectionCommands() {
        parserMap.put("PING", PingCommand::parse);
        parserMap.put("ECHO", EchoCommand::parse);
    }

    private void registerStringCommands() {
        parserMap.put("GET", GetCommand::parse);
        parserMap.put("SET", SetCommand::parse);
    }

    private void registerHashCommands() {
        parserMap.put("HSET", HSetCommand::parse);
        parserMap.put("HGET", HGetCommand::parse);
        parserMap.put("HGETALL", HGetAllCommand::parse);
        parserMap.put("HMGET", HMGetCommand::parse);
    }

    private void registerSetCommands() {
        parserMap.put("SADD", SAddCommand::parse);
        parserMap.put("SISMEMBER", SIsMemberCommand::parse);
        parserMap.put("SMEMBERS", SMembersCommand::parse);
    }

    /**
     * 只做解析与校验，不执行
     *
     * @throws CommandException 未知命令、参数个数不符或参数类型错误
     */
    public RedisCommand parse(RespFrame request) {
        String commandName = CommandArgs.commandName(request);
        CommandParser parser = parserMap.get(commandName.toUpperCase(Locale.ROOT));
        if (parser == null) {
            throw new InvalidCommandException("unknown command '" + commandName + "'");
        }
        return parser.parse((RespArray) request);
    }

    /**
     * 核心分发逻辑，错误统一转换为 ERR 回复，不向上抛出
     */
    public RespFrame dispatch(RespFrame request) {
        // 1. 解析
        RedisCommand command;
        try {
            command = parse(request);
        } catch (CommandException e) {
            log.warn("Invalid request ({}): {}", e.getClass().getSimpleName(), e.getMessage());
            return SimpleError.err(e.getMessage());
        }

        // 2. 执行并监控耗时
        long startTime = System.nanoTime();
        try {
            RespFrame response = command.execute(storage);

            long duration = (System.nanoTime() - startTime) / 1000_000; // ms
            if (duration > SLOW_COMMAND_MILLIS) {
                log.warn("Slow command detected: {} cost {}ms", command, duration);
            } else if (log.isDebugEnabled()) {
                log.debug("Command executed: {} cost {}ms", command, duration);
            }
            return response;
        } catch (RuntimeException e) {
            // 意料之外的系统错误
            log.error("Internal Server Error processing command: {}", command, e);
            return SimpleError.err("internal server error");
        }
    }
}
