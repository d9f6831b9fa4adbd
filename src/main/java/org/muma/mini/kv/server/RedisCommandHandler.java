package org.muma.mini.kv.server;

import io.netty.channel.ChannelFutureListener;
import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.SimpleChannelInboundHandler;
import io.netty.handler.codec.DecoderException;
import io.netty.handler.timeout.ReadTimeoutException;
import org.muma.mini.kv.command.CommandDispatcher;
import org.muma.mini.kv.protocol.ErrorMessage;
import org.muma.mini.kv.protocol.RedisMessage;
import org.muma.mini.kv.protocol.RespProtocolException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * 每个连接一个实例，运行在该连接的 EventLoop 上，
 * 所以同一连接的请求严格按到达顺序执行和回复
 */
public class RedisCommandHandler extends SimpleChannelInboundHandler<RedisMessage> {

    private static final Logger log = LoggerFactory.getLogger(RedisCommandHandler.class);

    // 记录连接的客户端数量
    private static final AtomicInteger connectedClients = new AtomicInteger();

    private final CommandDispatcher dispatcher;
    private RedisContext context;

    public RedisCommandHandler(CommandDispatcher dispatcher) {
        this.dispatcher = dispatcher;
    }

    @Override
    public void channelActive(ChannelHandlerContext ctx) throws Exception {
        int total = connectedClients.incrementAndGet();
        log.info("Client connected: {}, total clients: {}", ctx.channel().remoteAddress(), total);
        super.channelActive(ctx);
    }

    @Override
    public void channelInactive(ChannelHandlerContext ctx) throws Exception {
        int total = connectedClients.decrementAndGet();
        log.info("Client disconnected: {}, total clients: {}", ctx.channel().remoteAddress(), total);
        super.channelInactive(ctx);
    }

    @Override
    protected void channelRead0(ChannelHandlerContext ctx, RedisMessage msg) {
        RedisContext redisContext = context(ctx);
        if (redisContext.isCloseRequested()) {
            // QUIT 之后同一批到达的请求不再执行
            log.debug("Dropping request after QUIT from {}", redisContext.getClientAddress());
            return;
        }

        RedisMessage response = dispatcher.dispatch(msg, redisContext);

        if (redisContext.isCloseRequested()) {
            ctx.writeAndFlush(response).addListener(ChannelFutureListener.CLOSE);
        } else {
            ctx.writeAndFlush(response);
        }
    }

    @Override
    public void exceptionCaught(ChannelHandlerContext ctx, Throwable cause) {
        Throwable root = cause instanceof DecoderException && cause.getCause() != null ? cause.getCause() : cause;

        if (root instanceof RespProtocolException e) {
            // 回复一次错误后断开: 字节流已经无法再分帧
            log.warn("Protocol error from {} ({}): {}", ctx.channel().remoteAddress(), e.getError(), e.getMessage());
            ctx.writeAndFlush(new ErrorMessage("ERR Protocol error: " + e.getMessage()))
                    .addListener(ChannelFutureListener.CLOSE);
        } else if (root instanceof ReadTimeoutException) {
            log.info("Read timeout, closing {}", ctx.channel().remoteAddress());
            ctx.close();
        } else if (root instanceof IOException) {
            log.debug("Connection {} failed: {}", ctx.channel().remoteAddress(), root.getMessage());
            ctx.close();
        } else {
            log.error("Unexpected error on connection {}", ctx.channel().remoteAddress(), root);
            ctx.close();
        }
    }

    private RedisContext context(ChannelHandlerContext ctx) {
        if (context == null) {
            context = new RedisContext(String.valueOf(ctx.channel().remoteAddress()));
        }
        return context;
    }
}
