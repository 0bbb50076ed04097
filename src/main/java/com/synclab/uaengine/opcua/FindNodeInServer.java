package com.synclab.uaengine.opcua;

import org.eclipse.milo.opcua.sdk.core.Reference;
import org.eclipse.milo.opcua.sdk.server.OpcUaServer;
import org.eclipse.milo.opcua.sdk.server.nodes.UaNode;
import org.eclipse.milo.opcua.stack.core.Identifiers;
import org.eclipse.milo.opcua.stack.core.types.builtin.NodeId;
import org.eclipse.milo.opcua.stack.core.types.builtin.QualifiedName;

import java.util.Optional;
import java.util.Set;

/**
 * 서버 주소 공간에서 browse name 으로 자식 노드를 찾는 경로 단계.
 */
public final class FindNodeInServer implements FindNode {

    static final Set<NodeId> HIERARCHICAL_REFERENCES = Set.of(
            Identifiers.Organizes,
            Identifiers.HasComponent,
            Identifiers.HasProperty,
            Identifiers.HasSubtype,
            Identifiers.HasOrderedComponent,
            Identifiers.HasEventSource,
            Identifiers.HasNotifier
    );

    private final OpcUaServer server;
    private final QualifiedName browseName;

    public FindNodeInServer(OpcUaServer server, String browseName, int namespaceIndex) {
        this.server = server;
        this.browseName = new QualifiedName(namespaceIndex, browseName);
    }

    public QualifiedName getBrowseName() {
        return browseName;
    }

    @Override
    public NodeId resolve(NodeId parent) {
        if (server == null || parent == null || parent.isNull()) {
            return NodeId.NULL_VALUE;
        }
        for (Reference reference : server.getAddressSpaceManager().getManagedReferences(parent)) {
            if (!reference.isForward() || !HIERARCHICAL_REFERENCES.contains(reference.getReferenceTypeId())) {
                continue;
            }
            Optional<NodeId> target = reference.getTargetNodeId().toNodeId(server.getNamespaceTable());
            if (target.isEmpty()) {
                continue;
            }
            Optional<UaNode> node = server.getAddressSpaceManager().getManagedNode(target.get());
            if (node.isPresent() && browseName.equals(node.get().getBrowseName())) {
                return target.get();
            }
        }
        return NodeId.NULL_VALUE;
    }

    @Override
    public String toString() {
        return "FindNodeInServer{" + browseName.toParseableString() + "}";
    }
}
