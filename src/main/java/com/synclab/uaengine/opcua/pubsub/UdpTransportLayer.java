package com.synclab.uaengine.opcua.pubsub;

import io.netty.bootstrap.Bootstrap;
import io.netty.buffer.ByteBuf;
import io.netty.channel.Channel;
import io.netty.channel.ChannelFuture;
import io.netty.channel.ChannelInboundHandlerAdapter;
import io.netty.channel.EventLoopGroup;
import io.netty.channel.nio.NioEventLoopGroup;
import io.netty.channel.socket.DatagramPacket;
import io.netty.channel.socket.nio.NioDatagramChannel;
import io.netty.util.concurrent.DefaultThreadFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.InetSocketAddress;
import java.net.URI;
import java.net.URISyntaxException;
import java.util.concurrent.TimeUnit;

/**
 * {@code opc.udp://host:port} 로 UADP 메시지를 보내는 UDP 전송 계층 (Netty datagram 채널).
 */
public class UdpTransportLayer implements PubSubTransportLayer {

    private static final Logger log = LoggerFactory.getLogger(UdpTransportLayer.class);

    static final String SCHEME = "opc.udp";
    static final int DEFAULT_PORT = 4840;

    @Override
    public TransportProfile profile() {
        return TransportProfile.UDP_UADP;
    }

    @Override
    public PubSubChannel open(String address) throws IOException {
        InetSocketAddress target = parse(address);
        EventLoopGroup group = new NioEventLoopGroup(1, new DefaultThreadFactory("pubsub-udp", true));
        Bootstrap bootstrap = new Bootstrap()
                .group(group)
                .channel(NioDatagramChannel.class)
                .handler(new ChannelInboundHandlerAdapter());

        ChannelFuture bound = bootstrap.bind(0).awaitUninterruptibly();
        if (!bound.isSuccess()) {
            group.shutdownGracefully(0, 1, TimeUnit.SECONDS);
            throw new IOException("Failed to open UDP channel for " + address, bound.cause());
        }
        log.info("UDP pubsub channel opened: {} -> {}", bound.channel().localAddress(), target);
        return new UdpChannel(bound.channel(), group, target);
    }

    static InetSocketAddress parse(String address) throws IOException {
        try {
            URI uri = new URI(address);
            if (!SCHEME.equalsIgnoreCase(uri.getScheme()) || uri.getHost() == null) {
                throw new IOException("Not an " + SCHEME + " address: " + address);
            }
            int port = uri.getPort() < 0 ? DEFAULT_PORT : uri.getPort();
            return new InetSocketAddress(uri.getHost(), port);
        } catch (URISyntaxException e) {
            throw new IOException("Malformed address: " + address, e);
        }
    }

    private static final class UdpChannel implements PubSubChannel {

        private final Channel channel;
        private final EventLoopGroup group;
        private final InetSocketAddress target;

        private UdpChannel(Channel channel, EventLoopGroup group, InetSocketAddress target) {
            this.channel = channel;
            this.group = group;
            this.target = target;
        }

        @Override
        public void send(ByteBuf message) throws IOException {
            if (!channel.isActive()) {
                message.release();
                throw new IOException("UDP channel is closed");
            }
            ChannelFuture sent = channel.writeAndFlush(new DatagramPacket(message, target)).awaitUninterruptibly();
            if (!sent.isSuccess()) {
                throw new IOException("Failed to send to " + target, sent.cause());
            }
        }

        @Override
        public void close() {
            channel.close().awaitUninterruptibly();
            group.shutdownGracefully(0, 1, TimeUnit.SECONDS);
        }
    }
}
