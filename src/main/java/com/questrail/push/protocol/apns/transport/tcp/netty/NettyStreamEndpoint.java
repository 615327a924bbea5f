package com.questrail.push.protocol.apns.transport.tcp.netty;

import com.questrail.push.protocol.apns.config.ApnsEndpoint;
import com.questrail.push.protocol.apns.transport.StreamEndpoint;
import com.questrail.push.protocol.apns.transport.StreamEndpointListener;

import io.netty.bootstrap.Bootstrap;
import io.netty.buffer.ByteBuf;
import io.netty.buffer.Unpooled;
import io.netty.channel.*;
import io.netty.channel.socket.SocketChannel;
import io.netty.channel.socket.nio.NioSocketChannel;
import io.netty.handler.ssl.SslContext;
import io.netty.handler.ssl.SslHandler;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;

/**
 * NettyStreamEndpoint
 * =============================================================================
 * Netty-backed implementation of the {@link StreamEndpoint} port.
 *
 * <h2>Architectural Role</h2>
 * This class is a <strong>pure transport adapter</strong>.
 *
 * It MUST NOT:
 * <ul>
 *   <li>Decode error frames or feedback records</li>
 *   <li>Interpret a close as success or failure of any notification</li>
 *   <li>Reconnect or retry writes</li>
 * </ul>
 *
 * <h2>Netty containment rule</h2>
 * Netty types (e.g., {@code Channel}, {@code EventLoopGroup}, {@code ByteBuf})
 * MUST NOT escape this package.
 *
 * <p>Inbound bytes are copied into {@code byte[]} and emitted to the port
 * listener. Netty futures are bridged to {@link CompletableFuture}.</p>
 *
 * <h2>Lifecycle</h2>
 * - {@link #connect()} opens the socket and, when an {@link SslContext} is
 *   configured, completes only after the TLS handshake.
 * - {@link #close()} closes the channel, including one whose connect is still
 *   pending; a connect that completes after {@code close()} is closed at once
 *   and reported as failed. The event loop group belongs to the
 *   {@link NettyStreamEndpointFactory} and outlives the endpoint.
 */
public final class NettyStreamEndpoint implements StreamEndpoint
{
    private final ApnsEndpoint remote;
    private final EventLoopGroup group;
    private final SslContext sslContext;
    private final Duration connectTimeout;

    private final AtomicBoolean connectCalled = new AtomicBoolean(false);
    private final AtomicBoolean closeSignalled = new AtomicBoolean(false);
    private final AtomicBoolean closeRequested = new AtomicBoolean(false);
    private final AtomicReference<Throwable> failure = new AtomicReference<>();

    private volatile StreamEndpointListener listener;
    private volatile ChannelFuture connecting;
    private volatile Channel channel;

    NettyStreamEndpoint(ApnsEndpoint remote,
                        EventLoopGroup group,
                        SslContext sslContext,
                        Duration connectTimeout)
    {
        this.remote = Objects.requireNonNull(remote, "remote");
        this.group = Objects.requireNonNull(group, "group");
        this.sslContext = sslContext;
        this.connectTimeout = Objects.requireNonNull(connectTimeout, "connectTimeout");
    }

    @Override
    public void setListener(StreamEndpointListener listener)
    {
        this.listener = Objects.requireNonNull(listener, "listener");
    }

    @Override
    public CompletableFuture<Void> connect()
    {
        if (listener == null) {
            throw new IllegalStateException("StreamEndpointListener must be set before connect()");
        }
        if (!connectCalled.compareAndSet(false, true)) {
            throw new IllegalStateException("endpoint already connected once: " + remote);
        }

        final CompletableFuture<Void> ready = new CompletableFuture<>();

        Bootstrap bootstrap = new Bootstrap()
                .group(group)
                .channel(NioSocketChannel.class)
                .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, (int) Math.min(Integer.MAX_VALUE, connectTimeout.toMillis()))
                .option(ChannelOption.TCP_NODELAY, true)
                .option(ChannelOption.SO_KEEPALIVE, true)
                .handler(new ChannelInitializer<SocketChannel>() {
                    @Override
                    protected void initChannel(SocketChannel ch)
                    {
                        ChannelPipeline p = ch.pipeline();
                        if (sslContext != null) {
                            p.addLast(sslContext.newHandler(ch.alloc(), remote.host(), remote.port()));
                        }
                        p.addLast(new InboundHandler());
                    }
                });

        ChannelFuture f = bootstrap.connect(remote.host(), remote.port());
        connecting = f;
        if (closeRequested.get()) {
            f.channel().close();
        }

        f.addListener((ChannelFutureListener) future -> {
            if (!future.isSuccess()) {
                ready.completeExceptionally(future.cause());
                return;
            }

            Channel ch = future.channel();
            if (closeRequested.get()) {
                ch.close();
                ready.completeExceptionally(new IllegalStateException("closed while connecting: " + remote));
                return;
            }
            channel = ch;

            SslHandler ssl = ch.pipeline().get(SslHandler.class);
            if (ssl == null) {
                ready.complete(null);
                return;
            }

            ssl.handshakeFuture().addListener(handshake -> {
                if (handshake.isSuccess()) {
                    ready.complete(null);
                }
                else {
                    ready.completeExceptionally(handshake.cause());
                    ch.close();
                }
            });
        });

        return ready;
    }

    @Override
    public CompletableFuture<Void> write(byte[] frame)
    {
        Objects.requireNonNull(frame, "frame");

        final CompletableFuture<Void> written = new CompletableFuture<>();
        Channel ch = channel;
        if (ch == null || !ch.isActive()) {
            written.completeExceptionally(new IllegalStateException("stream is not open: " + remote));
            return written;
        }

        ch.writeAndFlush(Unpooled.wrappedBuffer(frame)).addListener((ChannelFutureListener) future -> {
            if (future.isSuccess()) {
                written.complete(null);
            }
            else {
                written.completeExceptionally(future.cause());
            }
        });
        return written;
    }

    @Override
    public void close()
    {
        closeRequested.set(true);
        ChannelFuture f = connecting;
        if (f != null) {
            f.channel().close();
        }
    }

    @Override
    public boolean isOpen()
    {
        Channel ch = channel;
        return ch != null && ch.isActive();
    }

    private void signalClosed()
    {
        StreamEndpointListener l = listener;
        if (l != null && closeSignalled.compareAndSet(false, true)) {
            l.onClosed(failure.get());
        }
    }

    /**
     * InboundHandler
     * -------------------------------------------------------------------------
     * Copies inbound {@link ByteBuf}s out to the port listener and turns
     * channel deactivation into a single close signal.
     */
    private final class InboundHandler extends SimpleChannelInboundHandler<ByteBuf>
    {
        @Override
        protected void channelRead0(ChannelHandlerContext ctx, ByteBuf content)
        {
            StreamEndpointListener l = listener;
            if (l == null || content.readableBytes() == 0) {
                return;
            }

            byte[] bytes = new byte[content.readableBytes()];
            content.getBytes(content.readerIndex(), bytes);
            l.onBytes(bytes);
        }

        @Override
        public void channelInactive(ChannelHandlerContext ctx)
        {
            signalClosed();
        }

        @Override
        public void exceptionCaught(ChannelHandlerContext ctx, Throwable cause)
        {
            failure.compareAndSet(null, cause);
            ctx.close();
        }
    }
}
