package org.muma.mini.kv.protocol;

/**
 * RESP 编解码异常的基类
 */
public class RespException extends RuntimeException {

    public RespException(String message) {
        super(message);
    }

    protected RespException(String message, boolean writableStackTrace) {
        super(message, null, false, writableStackTrace);
    }
}
