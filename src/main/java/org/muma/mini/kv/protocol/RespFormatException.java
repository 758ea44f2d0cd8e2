package org.muma.mini.kv.protocol;

/**
 * 帧格式错误 (前缀、长度字段或 CRLF 不合法)，等待更多数据也无法恢复
 */
public class RespFormatException extends RespException {

    public RespFormatException(String message) {
        super(message);
    }
}
