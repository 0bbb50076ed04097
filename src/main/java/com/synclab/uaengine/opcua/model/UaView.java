package com.synclab.uaengine.opcua.model;

import org.eclipse.milo.opcua.stack.core.types.builtin.NodeId;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * ViewsFolder 아래에 만들 뷰. 포함할 노드를 Organizes 로 묶는다.
 */
public class UaView extends UaNodeDescriptor {

    private final List<NodeId> nodes = new ArrayList<>();

    public UaView() {
    }

    public UaView(String name) {
        super(name);
    }

    public UaView add(NodeId nodeId) {
        nodes.add(nodeId);
        return this;
    }

    public List<NodeId> getNodes() {
        return Collections.unmodifiableList(nodes);
    }
}
