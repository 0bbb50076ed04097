package com.synclab.uaengine.opcua;

import org.eclipse.milo.opcua.stack.core.types.builtin.NodeId;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class NodePathTest {

    private static final NodeId ROOT = new NodeId(1, "root");
    private static final NodeId CHILD = new NodeId(1, "child");
    private static final NodeId LEAF = new NodeId(1, "leaf");

    private static FindNode hop(NodeId from, NodeId to, List<NodeId> visited) {
        return parent -> {
            visited.add(parent);
            return from.equals(parent) ? to : NodeId.NULL_VALUE;
        };
    }

    @Test
    void resolvesHopsLeftToRight() {
        List<NodeId> visited = new ArrayList<>();

        NodeId resolved = NodePath.resolve(ROOT, hop(ROOT, CHILD, visited), hop(CHILD, LEAF, visited));

        assertEquals(LEAF, resolved);
        assertEquals(List.of(ROOT, CHILD), visited);
    }

    @Test
    void stopsAtFirstMissingHop() {
        List<NodeId> visited = new ArrayList<>();

        NodeId resolved = NodePath.resolve(ROOT, hop(CHILD, LEAF, visited), hop(CHILD, LEAF, visited));

        assertTrue(resolved.isNull());
        assertEquals(List.of(ROOT), visited);
    }

    @Test
    void thenComposesSameAsPath() {
        List<NodeId> visited = new ArrayList<>();
        FindNode path = hop(ROOT, CHILD, visited).then(hop(CHILD, LEAF, visited));

        assertEquals(LEAF, path.resolve(ROOT));
        assertTrue(path.resolve(LEAF).isNull());
    }

    @Test
    void nullResultBecomesNullNodeId() {
        assertTrue(NodePath.resolve(ROOT, parent -> null).isNull());
        assertTrue(NodePath.resolve(null, parent -> LEAF).isNull());
    }
}
