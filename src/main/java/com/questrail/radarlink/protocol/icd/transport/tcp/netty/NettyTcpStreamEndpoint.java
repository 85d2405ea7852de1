package com.questrail.radarlink.protocol.icd.transport.tcp.netty;

import com.questrail.radarlink.protocol.icd.transport.StreamEndpoint;
import com.questrail.radarlink.protocol.icd.transport.StreamEndpointListener;

import io.netty.bootstrap.Bootstrap;
import io.netty.buffer.ByteBuf;
import io.netty.buffer.Unpooled;
import io.netty.channel.*;
import io.netty.channel.nio.NioEventLoopGroup;
import io.netty.channel.socket.SocketChannel;
import io.netty.channel.socket.nio.NioSocketChannel;

import java.net.InetSocketAddress;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * NettyTcpStreamEndpoint
 * =============================================================================
 * Netty-backed TCP client implementation of the {@link StreamEndpoint} port.
 *
 * <h2>Architectural Role</h2>
 * A <strong>pure transport adapter</strong>. It connects to the radar
 * controller, copies inbound bytes out of Netty buffers, and writes outbound
 * bytes. It does not frame, decode, or reconnect.
 *
 * <h2>Netty containment rule</h2>
 * Netty types ({@code Channel}, {@code EventLoopGroup}, {@code ByteBuf}) do not
 * escape this package. Inbound bytes are copied into {@code byte[]}; reference
 * counted buffers are released by {@link SimpleChannelInboundHandler}.
 *
 * <h2>Lifecycle</h2>
 * <ul>
 *   <li>{@link #start()} connects asynchronously and reports up or down.</li>
 *   <li>{@link #stop()} closes the channel and shuts the event loop down; the
 *       endpoint cannot be restarted afterwards.</li>
 * </ul>
 * Down is reported at most once per successful connection.
 */
public final class NettyTcpStreamEndpoint implements StreamEndpoint
{
    private final InetSocketAddress remoteAddress;

    private final EventLoopGroup group;
    private final Bootstrap bootstrap;

    private final AtomicBoolean connected = new AtomicBoolean(false);

    private volatile StreamEndpointListener listener;
    private volatile Channel channel;

    public NettyTcpStreamEndpoint(InetSocketAddress remoteAddress)
    {
        this.remoteAddress = Objects.requireNonNull(remoteAddress, "remoteAddress");

        this.group = new NioEventLoopGroup(1);
        this.bootstrap = new Bootstrap();

        bootstrap.group(group)
                .channel(NioSocketChannel.class)
                .option(ChannelOption.TCP_NODELAY, true)
                .option(ChannelOption.SO_KEEPALIVE, true)
                .handler(new ChannelInitializer<SocketChannel>() {
                    @Override
                    protected void initChannel(SocketChannel ch)
                    {
                        ch.pipeline().addLast(new InboundHandler());
                    }
                });
    }

    @Override
    public void setListener(StreamEndpointListener listener)
    {
        this.listener = Objects.requireNonNull(listener, "listener");
    }

    @Override
    public void start()
    {
        StreamEndpointListener l = requireListener();

        ChannelFuture f = bootstrap.connect(remoteAddress);
        f.addListener((ChannelFutureListener) future -> {
            if (future.isSuccess()) {
                channel = future.channel();
                connected.set(true);
                l.onTransportUp();
            }
            else {
                l.onTransportDown(future.cause());
            }
        });
    }

    @Override
    public void stop()
    {
        Channel ch = channel;
        channel = null;
        if (ch != null) {
            ch.close();
        }

        group.shutdownGracefully();

        notifyDown(null);
    }

    @Override
    public void send(byte[] bytes)
    {
        Objects.requireNonNull(bytes, "bytes");

        Channel ch = channel;
        if (ch == null || !ch.isActive()) {
            return;
        }

        ch.writeAndFlush(Unpooled.wrappedBuffer(bytes));
    }

    /**
     * Address this endpoint connects to.
     */
    public InetSocketAddress remoteAddress()
    {
        return remoteAddress;
    }

    private void notifyDown(Throwable cause)
    {
        if (!connected.compareAndSet(true, false)) {
            return;
        }
        StreamEndpointListener l = listener;
        if (l != null) {
            l.onTransportDown(cause);
        }
    }

    private StreamEndpointListener requireListener()
    {
        StreamEndpointListener l = listener;
        if (l == null) {
            throw new IllegalStateException("StreamEndpointListener must be set before start()");
        }
        return l;
    }

    /**
     * InboundHandler
     * -------------------------------------------------------------------------
     * Copies each inbound {@link ByteBuf} into a {@code byte[]} for the listener.
     */
    private final class InboundHandler extends SimpleChannelInboundHandler<ByteBuf>
    {
        @Override
        protected void channelRead0(ChannelHandlerContext ctx, ByteBuf content)
        {
            StreamEndpointListener l = listener;
            if (l == null) {
                return;
            }

            byte[] bytes = new byte[content.readableBytes()];
            content.getBytes(content.readerIndex(), bytes);
            l.onBytes(bytes);
        }

        @Override
        public void channelInactive(ChannelHandlerContext ctx)
        {
            notifyDown(null);
        }

        @Override
        public void exceptionCaught(ChannelHandlerContext ctx, Throwable cause)
        {
            notifyDown(cause);
            ctx.close();
        }
    }
}
