package flowescrow.escrow.server;

import flowescrow.escrow.config.Dependencies;
import io.netty.bootstrap.ServerBootstrap;
import io.netty.channel.Channel;
import io.netty.channel.ChannelInitializer;
import io.netty.channel.ChannelOption;
import io.netty.channel.ChannelPipeline;
import io.netty.channel.EventLoopGroup;
import io.netty.channel.nio.NioEventLoopGroup;
import io.netty.channel.socket.SocketChannel;
import io.netty.channel.socket.nio.NioServerSocketChannel;
import io.netty.handler.codec.http.HttpObjectAggregator;
import io.netty.handler.codec.http.HttpServerCodec;
import io.netty.handler.timeout.IdleStateHandler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.TimeUnit;

/**
 * Netty HTTP server in front of the escrow controllers.
 */
public final class EscrowNettyServer {

    private static final Logger log = LoggerFactory.getLogger(EscrowNettyServer.class);

    private static final int MAX_CONTENT_LENGTH = 64 * 1024;

    private final Dependencies dependencies;

    private volatile boolean running = false;
    private Channel serverChannel;
    private EventLoopGroup bossGroup;
    private EventLoopGroup workerGroup;

    public EscrowNettyServer(Dependencies dependencies) {
        this.dependencies = dependencies;
    }

    /** HTTP pipeline: codec, aggregation, routing */
    private ChannelInitializer<SocketChannel> pipelineInitializer(RouterHandler router) {
        return new ChannelInitializer<SocketChannel>() {
            @Override
            protected void initChannel(SocketChannel ch) {
                ChannelPipeline p = ch.pipeline();
                p.addLast(new IdleStateHandler(60, 0, 0, TimeUnit.SECONDS));
                p.addLast(new HttpServerCodec());
                p.addLast(new HttpObjectAggregator(MAX_CONTENT_LENGTH));
                p.addLast(router);
            }
        };
    }

    /**
     * Bind and start serving. Returns immediately; calling again while running is a no-op.
     *
     * @return true if the server is running
     */
    public synchronized boolean start(String host, int port) {
        if (running) {
            return true;
        }
        try {
            bossGroup = new NioEventLoopGroup(1);
            workerGroup = new NioEventLoopGroup();

            ServerBootstrap b = new ServerBootstrap()
                    .group(bossGroup, workerGroup)
                    .channel(NioServerSocketChannel.class)
                    .childOption(ChannelOption.TCP_NODELAY, true)
                    .childHandler(pipelineInitializer(dependencies.routerHandler()));

            serverChannel = b.bind(host, port).syncUninterruptibly().channel();
            running = true;
            log.info("Escrow server started on {}:{}", host, port);
            return true;
        } catch (Throwable t) {
            log.error("Start error: {}", t.getMessage(), t);
            stop();
            return false;
        }
    }

    public synchronized void stop() {
        try {
            if (serverChannel != null) {
                serverChannel.close().syncUninterruptibly();
                serverChannel = null;
            }
        } finally {
            if (workerGroup != null) {
                workerGroup.shutdownGracefully();
                workerGroup = null;
            }
            if (bossGroup != null) {
                bossGroup.shutdownGracefully();
                bossGroup = null;
            }
            if (running) {
                log.info("Escrow server stopped");
            }
            running = false;
        }
    }

    public boolean isRunning() {
        return running;
    }

    /** Blocks until the server channel is closed */
    public void awaitClose() throws InterruptedException {
        Channel channel = serverChannel;
        if (channel != null) {
            channel.closeFuture().sync();
        }
    }
}
