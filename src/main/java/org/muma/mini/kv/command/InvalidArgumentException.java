package org.muma.mini.kv.command;

/**
 * 参数存在但类型不对 (不是 Bulk String，或不是合法的 UTF-8 文本)
 */
public class InvalidArgumentException extends CommandException {

    public InvalidArgumentException(String message) {
        super(message);
    }

    public InvalidArgumentException(String message, Throwable cause) {
        super(message, cause);
    }
}
