package org.muma.mini.kv.protocol;

// 密封接口: 编解码只处理这几种类型
public sealed interface RedisMessage permits
        SimpleString, ErrorMessage, RedisInteger, BulkString, RedisArray {

    /**
     * 简单字符串和错误都是以 CRLF 结尾的单行
     */
    static String requireSingleLine(String content, String variant) {
        if (content == null) {
            throw new IllegalArgumentException(variant + " content must not be null");
        }
        if (content.indexOf('\r') >= 0 || content.indexOf('\n') >= 0) {
            throw new IllegalArgumentException(variant + " must not contain CR or LF");
        }
        return content;
    }
}
