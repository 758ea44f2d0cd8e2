package org.muma.mini.kv.command;

/**
 * 未知命令，或参数个数不符合命令要求
 */
public class InvalidCommandException extends CommandException {

    public InvalidCommandException(String message) {
        super(message);
    }
}
