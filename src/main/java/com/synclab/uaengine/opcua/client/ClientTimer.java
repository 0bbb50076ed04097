package com.synclab.uaengine.opcua.client;

import java.util.Objects;
import java.util.concurrent.TimeUnit;

/**
 * 클라이언트 이벤트 루프에서 주기적으로 실행되는 타이머.
 * {@link #cancel()} 은 여러 번 불러도 되고 콜백 안에서 불러도 된다.
 */
public final class ClientTimer implements AutoCloseable {

    private final UaClient client;
    private final long periodNanos;
    private final TimerCallback callback;
    private long nextFire;
    private volatile boolean active = true;

    public ClientTimer(UaClient client, long periodMillis, TimerCallback callback) {
        if (periodMillis <= 0) {
            throw new IllegalArgumentException("timer period must be positive: " + periodMillis);
        }
        this.client = Objects.requireNonNull(client, "client");
        this.callback = Objects.requireNonNull(callback, "callback");
        this.periodNanos = TimeUnit.MILLISECONDS.toNanos(periodMillis);
        this.nextFire = System.nanoTime() + periodNanos;
        client.register(this);
    }

    /** 주기가 되었으면 실행. 이벤트 루프 스레드 전용 */
    boolean fireIfDue(long now) {
        if (!active || now - nextFire < 0) {
            return false;
        }
        nextFire = now + periodNanos;
        callback.onTimer(client);
        return true;
    }

    public void cancel() {
        if (active) {
            active = false;
            client.unregister(this);
        }
    }

    public boolean isActive() {
        return active;
    }

    public long getPeriodMillis() {
        return TimeUnit.NANOSECONDS.toMillis(periodNanos);
    }

    @Override
    public void close() {
        cancel();
    }
}
