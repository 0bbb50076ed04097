package com.synclab.uaengine.opcua.pubsub;

import io.netty.buffer.ByteBuf;

import java.io.IOException;

/**
 * 전송 채널 하나와 publisher id 를 묶은 연결.
 */
public final class PubSubConnection {

    private final String name;
    private final long publisherId;
    private final TransportProfile profile;
    private final String address;
    private final PubSubChannel channel;

    PubSubConnection(String name, long publisherId, TransportProfile profile, String address, PubSubChannel channel) {
        this.name = name;
        this.publisherId = publisherId;
        this.profile = profile;
        this.address = address;
        this.channel = channel;
    }

    void send(ByteBuf message) throws IOException {
        channel.send(message);
    }

    void close() {
        channel.close();
    }

    public String getName() {
        return name;
    }

    public long getPublisherId() {
        return publisherId;
    }

    public TransportProfile getProfile() {
        return profile;
    }

    public String getAddress() {
        return address;
    }
}
