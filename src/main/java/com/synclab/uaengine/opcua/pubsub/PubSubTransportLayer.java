package com.synclab.uaengine.opcua.pubsub;

import java.io.IOException;

/**
 * 전송 프로파일 하나를 구현하는 전송 계층.
 */
public interface PubSubTransportLayer {

    TransportProfile profile();

    /**
     * @param address 예: {@code opc.udp://224.0.0.22:4840}
     */
    PubSubChannel open(String address) throws IOException;
}
