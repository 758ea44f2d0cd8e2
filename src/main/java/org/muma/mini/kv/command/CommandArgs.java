package org.muma.mini.kv.command;

import org.muma.mini.kv.protocol.BulkString;
import org.muma.mini.kv.protocol.RespArray;
import org.muma.mini.kv.protocol.RespFrame;

import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

/**
 * 命令参数校验与提取。
 * 命令名不计入参数个数，按大小写不敏感匹配。
 */
public final class CommandArgs {

    private CommandArgs() {
    }

    /**
     * 请求中的命令名 (原样返回，不做大小写转换)
     */
    public static String commandName(RespFrame request) {
        if (!(request instanceof RespArray array) || array.isNull() || array.size() == 0) {
            throw new InvalidCommandException("command must be a non-empty array");
        }
        if (!(array.get(0) instanceof BulkString name) || name.isNull()) {
            throw new InvalidCommandException("command name must be a bulk string");
        }
        return name.asString();
    }

    /**
     * 固定参数个数
     */
    public static void validateCommand(RespArray request, String name, int nArgs) {
        int actual = argCount(request, name);
        if (actual != nArgs) {
            throw new InvalidCommandException(name + " command needs " + nArgs + " argument(s), got " + actual);
        }
    }

    /**
     * 最少参数个数 (变长命令，如 SADD key member [member ...])
     */
    public static void validateMinArgs(RespArray request, String name, int minArgs) {
        int actual = argCount(request, name);
        if (actual < minArgs) {
            throw new InvalidCommandException(name + " command needs at least " + minArgs + " argument(s), got " + actual);
        }
    }

    public static void validateArgRange(RespArray request, String name, int minArgs, int maxArgs) {
        int actual = argCount(request, name);
        if (actual < minArgs || actual > maxArgs) {
            throw new InvalidCommandException(name + " command needs " + minArgs + " to " + maxArgs
                    + " argument(s), got " + actual);
        }
    }

    /**
     * 第 index 个元素 (0 为命令名) 作为 UTF-8 文本
     */
    public static String stringArg(RespArray request, int index) {
        return toUtf8(bulkArg(request, index).content(), index);
    }

    /**
     * 从 from 开始的所有元素作为 UTF-8 文本，保持原有顺序
     */
    public static List<String> stringArgs(RespArray request, int from) {
        List<String> args = new ArrayList<>(Math.max(request.size() - from, 0));
        for (int i = from; i < request.size(); i++) {
            args.add(stringArg(request, i));
        }
        return args;
    }

    /**
     * 值类参数只要求是非 null 的 Bulk String，允许任意二进制内容
     */
    public static BulkString bulkArg(RespArray request, int index) {
        RespFrame frame = request.get(index);
        if (!(frame instanceof BulkString bulk) || bulk.isNull()) {
            throw new InvalidArgumentException("argument #" + index + " must be a bulk string");
        }
        return bulk;
    }

    private static int argCount(RespArray request, String name) {
        String actual = commandName(request);
        if (!name.equalsIgnoreCase(actual)) {
            throw new InvalidCommandException("Invalid command: expected " + name + ", got " + actual);
        }
        return request.size() - 1;
    }

    private static String toUtf8(byte[] bytes, int index) {
        try {
            return StandardCharsets.UTF_8.newDecoder()
                    .onMalformedInput(CodingErrorAction.REPORT)
                    .onUnmappableCharacter(CodingErrorAction.REPORT)
                    .decode(ByteBuffer.wrap(bytes))
                    .toString();
        } catch (CharacterCodingException e) {
            throw new InvalidArgumentException("argument #" + index + " is not valid UTF-8", e);
        }
    }
}
