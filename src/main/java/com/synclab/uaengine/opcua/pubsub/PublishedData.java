package com.synclab.uaengine.opcua.pubsub;

import org.eclipse.milo.opcua.stack.core.types.builtin.NodeId;

import java.util.Objects;

/**
 * 발행할 변수 하나: 필드 이름과 원본 변수 노드.
 */
public final class PublishedData {

    private final String name;
    private final NodeId nodeId;

    public PublishedData(String name, NodeId nodeId) {
        this.name = Objects.requireNonNull(name, "name");
        this.nodeId = Objects.requireNonNull(nodeId, "nodeId");
    }

    public String getName() {
        return name;
    }

    public NodeId getNodeId() {
        return nodeId;
    }

    @Override
    public String toString() {
        return name + "@" + nodeId;
    }
}
