package com.synclab.uaengine.opcua.client;

import java.util.ArrayDeque;

/**
 * 크기가 정해진 알림 큐. 가득 차면 가장 오래된 알림을 버리고 새 알림을 넣는다.
 * Milo 수신 스레드가 넣고 이벤트 루프 스레드가 꺼낸다.
 */
final class NotificationQueue<T> {

    private final int capacity;
    private final ArrayDeque<T> items;
    private long dropped;

    NotificationQueue(int capacity) {
        if (capacity < 1) {
            throw new IllegalArgumentException("queue size must be positive: " + capacity);
        }
        this.capacity = capacity;
        this.items = new ArrayDeque<>(capacity);
    }

    /** @return 오래된 알림을 덮어썼으면 true */
    synchronized boolean offer(T item) {
        boolean overwritten = false;
        if (items.size() == capacity) {
            items.pollFirst();
            dropped++;
            overwritten = true;
        }
        items.addLast(item);
        return overwritten;
    }

    synchronized T poll() {
        return items.pollFirst();
    }

    synchronized int size() {
        return items.size();
    }

    synchronized void clear() {
        items.clear();
    }

    synchronized long getDropped() {
        return dropped;
    }

    int capacity() {
        return capacity;
    }
}
