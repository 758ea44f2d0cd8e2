package org.muma.mini.kv.protocol;

/**
 * 半包信号：缓冲区中是一个合法但不完整的帧前缀。
 * 不是错误，调用方应当等待更多字节后重试。
 * 与 Netty ReplayingDecoder 的 Signal 一样，使用无堆栈的共享实例。
 */
public final class RespNotCompleteException extends RespException {

    public static final RespNotCompleteException INSTANCE = new RespNotCompleteException();

    private RespNotCompleteException() {
        super("frame is not complete", false);
    }
}
