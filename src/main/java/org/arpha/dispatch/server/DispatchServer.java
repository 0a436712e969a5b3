package org.arpha.dispatch.server;

import io.netty.bootstrap.ServerBootstrap;
import io.netty.channel.Channel;
import io.netty.channel.ChannelInitializer;
import io.netty.channel.ChannelPipeline;
import io.netty.channel.EventLoopGroup;
import io.netty.channel.nio.NioEventLoopGroup;
import io.netty.channel.socket.nio.NioServerSocketChannel;
import io.netty.handler.codec.http.HttpObjectAggregator;
import io.netty.handler.codec.http.HttpServerCodec;
import io.netty.util.concurrent.DefaultEventExecutorGroup;
import io.netty.util.concurrent.DefaultThreadFactory;
import io.netty.util.concurrent.EventExecutorGroup;
import io.netty.util.concurrent.Future;
import lombok.extern.slf4j.Slf4j;
import org.arpha.dispatch.configuration.ServerProperties;
import org.arpha.dispatch.handler.Handler;

import java.net.InetSocketAddress;
import java.util.ArrayList;
import java.util.List;

/**
 * Netty HTTP/1.1 listener feeding aggregated requests to a {@link Handler}.
 * Handlers run on a separate executor group so a blocking handler does not
 * stall the event loop.
 */
@Slf4j
public class DispatchServer implements AutoCloseable {

    static final String THREAD_PREFIX = "dispatch-";

    private final Handler handler;
    private final ServerProperties properties;

    private EventLoopGroup bossGroup;
    private EventLoopGroup workerGroup;
    private EventExecutorGroup handlerGroup;
    private Channel channel;

    public DispatchServer(Handler handler, ServerProperties properties) {
        this.handler = handler;
        this.properties = properties;
    }

    /**
     * Binds the listener and returns once it accepts connections.
     */
    public synchronized void start() throws InterruptedException {
        if (channel != null) {
            throw new IllegalStateException("Server already started");
        }
        bossGroup = new NioEventLoopGroup(1, new DefaultThreadFactory(THREAD_PREFIX + "boss"));
        workerGroup = new NioEventLoopGroup(0, new DefaultThreadFactory(THREAD_PREFIX + "io"));
        handlerGroup = new DefaultEventExecutorGroup(properties.getWorkerThreads(),
                new DefaultThreadFactory(THREAD_PREFIX + "handler"));
        DispatcherHandler dispatcherHandler = new DispatcherHandler(handler);

        ServerBootstrap bootstrap = new ServerBootstrap();
        bootstrap.group(bossGroup, workerGroup)
                .channel(NioServerSocketChannel.class)
                .childHandler(new ChannelInitializer<>() {
                    @Override
                    protected void initChannel(Channel ch) {
                        ChannelPipeline pipeline = ch.pipeline();
                        pipeline.addLast("codec", new HttpServerCodec());
                        pipeline.addLast("aggregator", new HttpObjectAggregator(properties.getMaxContentLength()));
                        pipeline.addLast(handlerGroup, "handler", dispatcherHandler);
                    }
                });

        try {
            channel = bootstrap.bind(properties.getHost(), properties.getPort()).sync().channel();
        } catch (Exception e) {
            log.error("Failed to bind {}:{}", properties.getHost(), properties.getPort(), e);
            shutdownGroups();
            throw e;
        }
        log.info("Dispatch server listening on {}", channel.localAddress());
    }

    public synchronized int port() {
        if (channel == null) {
            throw new IllegalStateException("Server not started");
        }
        return ((InetSocketAddress) channel.localAddress()).getPort();
    }

    /**
     * Blocks until the listening channel is closed.
     */
    public void awaitTermination() throws InterruptedException {
        Channel current;
        synchronized (this) {
            current = channel;
        }
        if (current != null) {
            current.closeFuture().sync();
        }
    }

    @Override
    public synchronized void close() {
        if (channel != null) {
            channel.close().syncUninterruptibly();
            channel = null;
        }
        shutdownGroups();
        log.info("Dispatch server stopped");
    }

    /**
     * Shuts the thread groups down and waits for their threads to finish.
     */
    private void shutdownGroups() {
        List<Future<?>> terminations = new ArrayList<>();
        if (bossGroup != null) {
            terminations.add(bossGroup.shutdownGracefully());
            bossGroup = null;
        }
        if (workerGroup != null) {
            terminations.add(workerGroup.shutdownGracefully());
            workerGroup = null;
        }
        if (handlerGroup != null) {
            terminations.add(handlerGroup.shutdownGracefully());
            handlerGroup = null;
        }
        terminations.forEach(Future::syncUninterruptibly);
    }
}
