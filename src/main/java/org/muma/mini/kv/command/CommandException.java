package org.muma.mini.kv.command;

/**
 * 命令解析阶段的错误，发生在执行之前，不会修改存储
 */
public class CommandException extends RuntimeException {

    public CommandException(String message) {
        super(message);
    }

    public CommandException(String message, Throwable cause) {
        super(message, cause);
    }
}
