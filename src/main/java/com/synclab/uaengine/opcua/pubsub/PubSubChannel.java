package com.synclab.uaengine.opcua.pubsub;

import io.netty.buffer.ByteBuf;

import java.io.IOException;

/**
 * 열린 전송 채널. 보낸 버퍼의 소유권은 채널로 넘어간다.
 */
public interface PubSubChannel extends AutoCloseable {

    void send(ByteBuf message) throws IOException;

    @Override
    void close();
}
