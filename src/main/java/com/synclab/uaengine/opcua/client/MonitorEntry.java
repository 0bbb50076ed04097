package com.synclab.uaengine.opcua.client;

import org.eclipse.milo.opcua.sdk.client.api.subscriptions.UaMonitoredItem;
import org.eclipse.milo.opcua.stack.core.types.builtin.NodeId;
import org.eclipse.milo.opcua.stack.core.types.builtin.unsigned.UInteger;

import java.util.function.BiConsumer;

/**
 * 감시 중인 노드 하나의 등록 정보: (subscription id, monitored item id) 와 소유한 콜백.
 * 삭제가 확인된 뒤 비활성화되며, 비활성 항목에는 더 이상 알림을 전달하지 않는다.
 */
final class MonitorEntry<T> {

    private final NodeId nodeId;
    private final NotificationQueue<T> queue;
    private final BiConsumer<ClientView, T> dispatcher;
    private UInteger subscriptionId;
    private UaMonitoredItem item;
    private volatile boolean active = true;

    MonitorEntry(NodeId nodeId, int queueSize, BiConsumer<ClientView, T> dispatcher) {
        this.nodeId = nodeId;
        this.queue = new NotificationQueue<>(queueSize);
        this.dispatcher = dispatcher;
    }

    void bind(UInteger subscriptionId, UaMonitoredItem item) {
        this.subscriptionId = subscriptionId;
        this.item = item;
    }

    /** Milo 수신 스레드에서 호출 */
    void enqueue(T notification) {
        if (active) {
            queue.offer(notification);
        }
    }

    /**
     * 호출 시점에 쌓여 있던 알림만 전달한다. 콜백 안에서 제거되면 즉시 멈춘다.
     *
     * @return 전달한 알림 수
     */
    int drain(ClientView view) {
        int pending = queue.size();
        int delivered = 0;
        while (delivered < pending && active) {
            T notification = queue.poll();
            if (notification == null) {
                break;
            }
            dispatcher.accept(view, notification);
            delivered++;
        }
        return delivered;
    }

    void deactivate() {
        active = false;
        queue.clear();
    }

    boolean isActive() {
        return active;
    }

    NodeId getNodeId() {
        return nodeId;
    }

    UInteger getSubscriptionId() {
        return subscriptionId;
    }

    UInteger getMonitoredItemId() {
        return item == null ? null : item.getMonitoredItemId();
    }

    UaMonitoredItem getItem() {
        return item;
    }

    NotificationQueue<T> getQueue() {
        return queue;
    }
}
