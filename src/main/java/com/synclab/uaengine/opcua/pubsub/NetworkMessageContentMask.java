package com.synclab.uaengine.opcua.pubsub;

import java.util.EnumSet;
import java.util.Set;

/**
 * UADP NetworkMessage 에 넣을 헤더 항목 (UadpNetworkMessageContentMask 비트).
 */
public enum NetworkMessageContentMask {
    PUBLISHER_ID(0x01),
    GROUP_HEADER(0x02),
    WRITER_GROUP_ID(0x04),
    GROUP_VERSION(0x08),
    NETWORK_MESSAGE_NUMBER(0x10),
    SEQUENCE_NUMBER(0x20),
    PAYLOAD_HEADER(0x40);

    private final int bit;

    NetworkMessageContentMask(int bit) {
        this.bit = bit;
    }

    public int getBit() {
        return bit;
    }

    public static int toValue(Set<NetworkMessageContentMask> mask) {
        int value = 0;
        for (NetworkMessageContentMask item : mask) {
            value |= item.bit;
        }
        return value;
    }

    /** publisher id, group header, writer group id, payload header */
    public static EnumSet<NetworkMessageContentMask> defaults() {
        return EnumSet.of(PUBLISHER_ID, GROUP_HEADER, WRITER_GROUP_ID, PAYLOAD_HEADER);
    }
}
