package com.synclab.uaengine.opcua.pubsub;

/**
 * PubSub 전송 프로파일.
 */
public enum TransportProfile {
    UDP_UADP("http://opcfoundation.org/UA-Profile/Transport/pubsub-udp-uadp"),
    MQTT_UADP("http://opcfoundation.org/UA-Profile/Transport/pubsub-mqtt-uadp"),
    MQTT_JSON("http://opcfoundation.org/UA-Profile/Transport/pubsub-mqtt-json");

    private final String uri;

    TransportProfile(String uri) {
        this.uri = uri;
    }

    public String getUri() {
        return uri;
    }
}
