package com.synclab.uaengine.opcua;

import org.eclipse.milo.opcua.stack.core.types.builtin.NodeId;

import java.util.Arrays;
import java.util.List;

/**
 * 시작 노드에서 여러 단계를 차례로 찾는다.
 */
public final class NodePath {

    private NodePath() {
    }

    public static NodeId resolve(NodeId start, FindNode... hops) {
        return resolve(start, Arrays.asList(hops));
    }

    public static NodeId resolve(NodeId start, List<? extends FindNode> hops) {
        NodeId current = start == null ? NodeId.NULL_VALUE : start;
        for (FindNode hop : hops) {
            if (current.isNull()) {
                return NodeId.NULL_VALUE;
            }
            current = hop.resolve(current);
            if (current == null) {
                current = NodeId.NULL_VALUE;
            }
        }
        return current;
    }
}
