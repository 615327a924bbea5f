package com.questrail.push.protocol.apns.transport.tcp.netty;

import com.questrail.push.protocol.apns.config.ApnsEndpoint;
import com.questrail.push.protocol.apns.transport.StreamEndpoint;
import com.questrail.push.protocol.apns.transport.StreamEndpointFactory;

import io.netty.channel.EventLoopGroup;
import io.netty.channel.nio.NioEventLoopGroup;
import io.netty.handler.ssl.SslContext;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.TimeUnit;

/**
 * Creates {@link NettyStreamEndpoint}s that share one event loop group and one
 * client {@link SslContext}.
 *
 * <p>A {@code null} SSL context produces plaintext connections, which only a
 * local test gateway will accept.</p>
 *
 * <p>The factory owns the event loop group; {@link #close()} shuts it down and
 * with it every endpoint created here.</p>
 */
public final class NettyStreamEndpointFactory implements StreamEndpointFactory, AutoCloseable
{
    private final EventLoopGroup group;
    private final SslContext sslContext;
    private final Duration connectTimeout;

    public NettyStreamEndpointFactory(SslContext sslContext, Duration connectTimeout, int ioThreads)
    {
        if (ioThreads < 1) {
            throw new IllegalArgumentException("ioThreads must be >= 1");
        }
        this.sslContext = sslContext;
        this.connectTimeout = Objects.requireNonNull(connectTimeout, "connectTimeout");
        this.group = new NioEventLoopGroup(ioThreads);
    }

    @Override
    public StreamEndpoint create(ApnsEndpoint remote)
    {
        return new NettyStreamEndpoint(remote, group, sslContext, connectTimeout);
    }

    @Override
    public void close()
    {
        group.shutdownGracefully(0, 2, TimeUnit.SECONDS).syncUninterruptibly();
    }
}
