package org.muma.mini.kv.protocol;

/**
 * RESP 解析器报告的非法输入类型
 */
public enum RespError {
    UNKNOWN_TYPE,
    MALFORMED_LINE,
    INVALID_INTEGER,
    INVALID_LENGTH,
    MALFORMED_BULK_STRING,
    LIMIT_EXCEEDED
}
