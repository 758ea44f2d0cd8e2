package org.muma.mini.kv.protocol;

import io.netty.buffer.ByteBuf;
import org.muma.mini.kv.utils.RespCodecUtil;

import java.util.regex.Pattern;

import static org.muma.mini.kv.utils.RespCodecUtil.CRLF_LEN;

/**
 * RESP3 双精度浮点 (,)
 * 正负无穷编码为 inf / -inf，NaN 编码为 nan
 */
public record RespDouble(double value) implements RespFrame {

    static final byte PREFIX = ',';

    // [+|-]整数部分[.小数部分][E|e[+|-]指数]
    private static final Pattern DECIMAL = Pattern.compile("[+-]?\\d+(\\.\\d+)?([eE][+-]?\\d+)?");

    @Override
    public void encode(ByteBuf out) {
        RespCodecUtil.writeLine(out, PREFIX, format(value));
    }

    public static RespDouble decode(ByteBuf in) {
        int index = in.readerIndex();
        int end = RespCodecUtil.lineEnd(in, index, PREFIX, "Double");
        double value = parse(RespCodecUtil.lineContent(in, index, end));
        in.readerIndex(end + CRLF_LEN);
        return new RespDouble(value);
    }

    static int expectLength(ByteBuf in, int index) {
        return RespCodecUtil.lineEnd(in, index, PREFIX, "Double") + CRLF_LEN - index;
    }

    static String format(double value) {
        if (Double.isNaN(value)) return "nan";
        if (value == Double.POSITIVE_INFINITY) return "inf";
        if (value == Double.NEGATIVE_INFINITY) return "-inf";
        return Double.toString(value);
    }

    static double parse(String text) {
        return switch (text) {
            case "inf", "+inf" -> Double.POSITIVE_INFINITY;
            case "-inf" -> Double.NEGATIVE_INFINITY;
            case "nan" -> Double.NaN;
            default -> {
                if (!DECIMAL.matcher(text).matches()) {
                    throw new RespFormatException("invalid Double value: '" + text + "'");
                }
                yield Double.parseDouble(text);
            }
        };
    }
}
