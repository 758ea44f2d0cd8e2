package org.muma.mini.kv.protocol;

import io.netty.buffer.ByteBuf;
import org.muma.mini.kv.utils.RespCodecUtil.LengthHeader;

import java.util.ArrayList;
import java.util.List;

/**
 * RESP 解码入口：按前缀字节分发到具体的帧类型。
 * <p>
 * 约定：
 * <ul>
 *     <li>{@link #decode(ByteBuf)} 只有在返回完整帧时才推进 readerIndex；
 *     半包抛出 {@link RespNotCompleteException}，格式错误抛出 {@link RespFormatException}</li>
 *     <li>{@link #expectLength(ByteBuf)} 只看头部计算整帧字节数，不创建任何帧对象，
 *     供连接层在真正解码前判断数据是否足够</li>
 * </ul>
 */
public final class RespCodec {

    // 聚合类型 (Array / Set / Map) 允许的最大嵌套层数
    public static final int MAX_NESTING_DEPTH = 512;

    private RespCodec() {
    }

    public static RespFrame decode(ByteBuf in) {
        if (!in.isReadable()) {
            throw RespNotCompleteException.INSTANCE;
        }
        int start = in.readerIndex();
        byte prefix = in.getByte(start);
        try {
            return switch (prefix) {
                case SimpleString.PREFIX -> SimpleString.decode(in);
                case SimpleError.PREFIX -> SimpleError.decode(in);
                case RespInteger.PREFIX -> RespInteger.decode(in);
                case BulkString.PREFIX -> BulkString.decode(in);
                case RespArray.PREFIX -> RespArray.decode(in);
                case RespNull.PREFIX -> RespNull.decode(in);
                case RespBoolean.PREFIX -> RespBoolean.decode(in);
                case RespDouble.PREFIX -> RespDouble.decode(in);
                case RespMap.PREFIX -> RespMap.decode(in);
                case RespSet.PREFIX -> RespSet.decode(in);
                default -> throw unknownPrefix(prefix);
            };
        } catch (RespException e) {
            // 聚合类型可能已经读过部分元素，失败时整帧回退
            in.readerIndex(start);
            throw e;
        }
    }

    /**
     * 从 readerIndex 开始的帧需要占用的总字节数。
     * 返回值可能大于当前可读字节数 (payload 尚未到齐)；头部本身不完整时抛出半包信号。
     */
    public static int expectLength(ByteBuf in) {
        return expectLength(in, in.readerIndex(), 0);
    }

    /**
     * 缓冲区中是否已经有一个完整的帧
     */
    public static boolean hasCompleteFrame(ByteBuf in) {
        try {
            return expectLength(in) <= in.readableBytes();
        } catch (RespNotCompleteException e) {
            return false;
        }
    }

    /**
     * @param depth 当前帧所在的嵌套层数，顶层为 0
     */
    static int expectLength(ByteBuf in, int index, int depth) {
        if (depth > MAX_NESTING_DEPTH) {
            throw new RespFormatException("frame nesting is too deep (> " + MAX_NESTING_DEPTH + ")");
        }
        if (index >= in.writerIndex()) {
            throw RespNotCompleteException.INSTANCE;
        }
        byte prefix = in.getByte(index);
        return switch (prefix) {
            case SimpleString.PREFIX -> SimpleString.expectLength(in, index);
            case SimpleError.PREFIX -> SimpleError.expectLength(in, index);
            case RespInteger.PREFIX -> RespInteger.expectLength(in, index);
            case BulkString.PREFIX -> BulkString.expectLength(in, index);
            case RespArray.PREFIX -> RespArray.expectLength(in, index, depth);
            case RespNull.PREFIX -> RespNull.expectLength(in, index);
            case RespBoolean.PREFIX -> RespBoolean.expectLength(in, index);
            case RespDouble.PREFIX -> RespDouble.expectLength(in, index);
            case RespMap.PREFIX -> RespMap.expectLength(in, index, depth);
            case RespSet.PREFIX -> RespSet.expectLength(in, index, depth);
            default -> throw unknownPrefix(prefix);
        };
    }

    // --- 聚合类型 (Array / Set) 共用 ---

    /**
     * 头部 + count 个连续帧的总长度，元素位于 depth + 1 层。
     * 任一元素的头部还没到达都会抛出半包信号。
     */
    static int expectFramesLength(ByteBuf in, int index, LengthHeader header, int count, int depth) {
        long total = header.headerLength();
        for (int i = 0; i < count; i++) {
            total += expectLength(in, (int) (index + total), depth + 1);
            checkFrameLength(total);
        }
        return (int) total;
    }

    static List<RespFrame> decodeFrames(ByteBuf in, int count) {
        List<RespFrame> frames = new ArrayList<>(count);
        for (int i = 0; i < count; i++) {
            frames.add(decode(in));
        }
        return frames;
    }

    static void requireComplete(ByteBuf in, int expectLength) {
        if (in.readableBytes() < expectLength) {
            throw RespNotCompleteException.INSTANCE;
        }
    }

    static void checkFrameLength(long total) {
        if (total > Integer.MAX_VALUE) {
            throw new RespFormatException("frame is too large: " + total + " bytes");
        }
    }

    private static RespFormatException unknownPrefix(byte prefix) {
        return new RespFormatException("unknown frame prefix: '" + (char) prefix + "'");
    }
}
