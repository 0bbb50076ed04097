package com.synclab.uaengine.opcua.pubsub;

import com.google.common.hash.Hashing;

import java.nio.charset.StandardCharsets;

/**
 * 이름에서 PubSub 식별자를 만든다. murmur3 해시를 식별자 범위로 나눈 나머지이며
 * 충돌은 검사하지 않는다.
 */
public final class PubSubIds {

    /** 2^27, publisher id (connection) */
    public static final long PUBLISHER_ID_MODULUS = 0x8000000L;

    /** 2^15, writer group id / data set writer id */
    public static final long WRITER_ID_MODULUS = 0x8000L;

    private PubSubIds() {
    }

    public static long of(String name, long modulus) {
        if (modulus <= 0) {
            throw new IllegalArgumentException("modulus must be positive: " + modulus);
        }
        int hash = Hashing.murmur3_128().hashString(name, StandardCharsets.UTF_8).asInt();
        return Integer.toUnsignedLong(hash) % modulus;
    }

    public static long publisherId(String name) {
        return of(name, PUBLISHER_ID_MODULUS);
    }

    public static int writerId(String name) {
        return (int) of(name, WRITER_ID_MODULUS);
    }
}
