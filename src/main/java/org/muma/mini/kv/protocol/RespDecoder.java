package org.muma.mini.kv.protocol;

import io.netty.buffer.ByteBuf;
import io.netty.channel.ChannelHandlerContext;
import io.netty.handler.codec.ByteToMessageDecoder;

import java.util.List;

/**
 * RESP 协议解码器
 * Netty 的 cumulation 缓冲区就是连接缓冲区: 半包留在里面，直到 {@link RespParser} 扫描到完整的帧，
 * 才构建消息并跳过对应的字节。
 */
public class RespDecoder extends ByteToMessageDecoder {

    private final RespParser parser;
    // 未完成帧的扫描进度，每次读事件只检查新到达的元素
    private final RespParser.ScanState scanState = new RespParser.ScanState();

    public RespDecoder(RespParser parser) {
        this.parser = parser;
    }

    @Override
    protected void decode(ChannelHandlerContext ctx, ByteBuf in, List<Object> out) {
        ParseResult result;
        try {
            if (parser.scan(in, scanState) < 0) {
                return;
            }
            result = parser.parse(in);
        } catch (RespProtocolException e) {
            // 帧边界已经丢失，丢弃这个连接缓冲的全部数据
            scanState.reset();
            in.skipBytes(in.readableBytes());
            throw e;
        }

        in.skipBytes(result.consumed());
        out.add(result.message());
    }
}
