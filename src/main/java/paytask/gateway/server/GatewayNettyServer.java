package paytask.gateway.server;

import io.netty.bootstrap.ServerBootstrap;
import io.netty.channel.*;
import io.netty.channel.nio.NioEventLoopGroup;
import io.netty.channel.socket.SocketChannel;
import io.netty.channel.socket.nio.NioServerSocketChannel;
import io.netty.handler.codec.http.HttpObjectAggregator;
import io.netty.handler.codec.http.HttpServerCodec;
import io.netty.handler.timeout.IdleStateHandler;
import paytask.gateway.config.Dependencies;
import paytask.gateway.config.GatewayConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.InetSocketAddress;
import java.util.concurrent.TimeUnit;

/**
 * HTTP front of the gateway. One server per JVM.
 */
public final class GatewayNettyServer {

    private static final Logger log = LoggerFactory.getLogger(GatewayNettyServer.class);

    private static volatile boolean running = false;
    private static Channel serverChannel;
    private static EventLoopGroup bossGroup;
    private static EventLoopGroup workerGroup;
    private static Dependencies dependencies;

    private GatewayNettyServer() {
    }

    /** HTTP pipeline: codec, aggregator, router */
    public static ChannelHandler pipelineInitializer(RouterHandler router) {
        return new ChannelInitializer<SocketChannel>() {
            @Override
            protected void initChannel(SocketChannel ch) {
                ChannelPipeline p = ch.pipeline();
                p.addLast(new IdleStateHandler(60, 0, 0, TimeUnit.SECONDS));
                p.addLast(new HttpServerCodec());
                p.addLast(new HttpObjectAggregator(1024 * 1024));
                p.addLast(router);
            }
        };
    }

    public static synchronized boolean start(int port, GatewayConfig config) {
        if (running) {
            return true;
        }
        Dependencies deps;
        try {
            deps = Dependencies.create(config);
        } catch (RuntimeException e) {
            log.error("Cannot initialize dependencies: {}", e.getMessage(), e);
            return false;
        }
        return start(port, deps);
    }

    /**
     * Start serving with already wired dependencies. The server owns them from here on
     * and closes them on {@link #stop()}.
     */
    public static synchronized boolean start(int port, Dependencies deps) {
        if (running) {
            return true;
        }
        try {
            dependencies = deps;
            bossGroup = new NioEventLoopGroup(1);
            workerGroup = new NioEventLoopGroup();

            ServerBootstrap b = new ServerBootstrap()
                    .group(bossGroup, workerGroup)
                    .channel(NioServerSocketChannel.class)
                    .childOption(ChannelOption.TCP_NODELAY, true)
                    .childHandler(pipelineInitializer(deps.routerHandler()));

            String host = deps.config().serverHost();
            serverChannel = b.bind(new InetSocketAddress(host, port)).syncUninterruptibly().channel();
            deps.startScheduler();
            running = true;
            log.info("Gateway started on {}:{}", host, port);
            return true;
        } catch (Throwable t) {
            log.error("Start error: {}", t.getMessage(), t);
            shutdown();
            return false;
        }
    }

    public static synchronized void stop() {
        if (!running) {
            return;
        }
        shutdown();
        log.info("Gateway stopped");
    }

    private static void shutdown() {
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
            if (dependencies != null) {
                dependencies.close();
                dependencies = null;
            }
            running = false;
        }
    }

    public static boolean isRunning() {
        return running;
    }

    /** Dependencies of the running server, null when stopped */
    public static Dependencies dependencies() {
        return dependencies;
    }

    /** Block until the server channel closes. */
    public static void awaitTermination() throws InterruptedException {
        Channel channel = serverChannel;
        if (channel != null) {
            channel.closeFuture().sync();
        }
    }
}
