package org.muma.mini.kv.server;

import io.netty.bootstrap.ServerBootstrap;
import io.netty.channel.Channel;
import io.netty.channel.ChannelInitializer;
import io.netty.channel.ChannelOption;
import io.netty.channel.ChannelPipeline;
import io.netty.channel.EventLoopGroup;
import io.netty.channel.nio.NioEventLoopGroup;
import io.netty.channel.socket.SocketChannel;
import io.netty.channel.socket.nio.NioServerSocketChannel;
import io.netty.handler.logging.LogLevel;
import io.netty.handler.logging.LoggingHandler;
import io.netty.handler.timeout.ReadTimeoutHandler;
import org.muma.mini.kv.command.CommandDispatcher;
import org.muma.mini.kv.config.MiniKvConfig;
import org.muma.mini.kv.protocol.RespDecoder;
import org.muma.mini.kv.protocol.RespEncoder;
import org.muma.mini.kv.protocol.RespParser;
import org.muma.mini.kv.store.impl.MemoryStorageEngine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.InetSocketAddress;

public class MiniKvServer {

    private static final Logger log = LoggerFactory.getLogger(MiniKvServer.class);

    private final MiniKvConfig config;
    private final CommandDispatcher dispatcher;

    private EventLoopGroup bossGroup;
    private EventLoopGroup workerGroup;
    private Channel serverChannel;

    public MiniKvServer(MiniKvConfig config) {
        this.config = config;
        // 整个进程只有一个存储实例，所有连接共享
        this.dispatcher = new CommandDispatcher(new MemoryStorageEngine());
    }

    /**
     * 绑定监听端口，返回时服务端已经可以接受连接
     */
    public void start() throws InterruptedException {
        bossGroup = new NioEventLoopGroup(1);
        workerGroup = new NioEventLoopGroup(config.getWorkerThreads());

        var bootstrap = new ServerBootstrap();
        bootstrap.group(bossGroup, workerGroup)
                .channel(NioServerSocketChannel.class)
                // Boss 通道上的连接日志
                .handler(new LoggingHandler(LogLevel.INFO))
                .childOption(ChannelOption.TCP_NODELAY, true)
                .childOption(ChannelOption.SO_KEEPALIVE, true)
                .childHandler(new ChannelInitializer<SocketChannel>() {
                    @Override
                    protected void initChannel(SocketChannel ch) {
                        initPipeline(ch.pipeline());
                    }
                });

        log.info("Starting Mini-KV server on port {}", config.getPort());
        try {
            serverChannel = bootstrap.bind(config.getPort()).sync().channel();
        } catch (Exception e) {
            // sync() 可能直接抛出未声明的受检异常 (如 BindException)
            log.error("Failed to bind port {}", config.getPort(), e);
            stop();
            throw e;
        }
        log.info("Mini-KV started successfully.");
    }

    /**
     * 编解码器和 Handler 每个连接一份，Dispatcher (以及它持有的存储) 全局共享
     */
    void initPipeline(ChannelPipeline pipeline) {
        if (config.getReadTimeoutSeconds() > 0) {
            pipeline.addLast(new ReadTimeoutHandler(config.getReadTimeoutSeconds()));
        }
        pipeline.addLast(new RespDecoder(new RespParser(config)))
                .addLast(new RespEncoder())
                .addLast(new RedisCommandHandler(dispatcher));
    }

    public int getBoundPort() {
        return ((InetSocketAddress) serverChannel.localAddress()).getPort();
    }

    public void blockUntilShutdown() throws InterruptedException {
        if (serverChannel != null) {
            serverChannel.closeFuture().sync();
        }
    }

    boolean isShuttingDown() {
        return bossGroup != null && bossGroup.isShuttingDown()
                && workerGroup != null && workerGroup.isShuttingDown();
    }

    public void stop() {
        if (serverChannel != null) {
            serverChannel.close().syncUninterruptibly();
        }
        if (bossGroup != null) {
            bossGroup.shutdownGracefully();
        }
        if (workerGroup != null) {
            workerGroup.shutdownGracefully();
        }
        log.info("Mini-KV stopped.");
    }

    public static void main(String[] args) throws InterruptedException {
        MiniKvConfig config = MiniKvConfig.getInstance();
        config.load(args);

        MiniKvServer server = new MiniKvServer(config);
        server.start();
        Runtime.getRuntime().addShutdownHook(new Thread(server::stop, "minikv-shutdown"));
        server.blockUntilShutdown();
    }
}
