package com.synclab.uaengine.opcua;

import org.eclipse.milo.opcua.sdk.client.OpcUaClient;
import org.eclipse.milo.opcua.stack.core.Identifiers;
import org.eclipse.milo.opcua.stack.core.types.builtin.NodeId;
import org.eclipse.milo.opcua.stack.core.types.builtin.QualifiedName;
import org.eclipse.milo.opcua.stack.core.types.enumerated.BrowseDirection;
import org.eclipse.milo.opcua.stack.core.types.enumerated.BrowseResultMask;
import org.eclipse.milo.opcua.stack.core.types.structured.BrowseDescription;
import org.eclipse.milo.opcua.stack.core.types.structured.BrowseResult;
import org.eclipse.milo.opcua.stack.core.types.structured.ReferenceDescription;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;
import java.util.concurrent.ExecutionException;

import static org.eclipse.milo.opcua.stack.core.types.builtin.unsigned.Unsigned.uint;

/**
 * 원격 서버에 Browse 요청을 보내 browse name 으로 자식 노드를 찾는 경로 단계.
 * 호출 스레드는 응답이 올 때까지 대기한다.
 */
public final class FindNodeInClient implements FindNode {

    private static final Logger log = LoggerFactory.getLogger(FindNodeInClient.class);

    private final OpcUaClient client;
    private final QualifiedName browseName;

    public FindNodeInClient(OpcUaClient client, String browseName, int namespaceIndex) {
        this.client = client;
        this.browseName = new QualifiedName(namespaceIndex, browseName);
    }

    public QualifiedName getBrowseName() {
        return browseName;
    }

    @Override
    public NodeId resolve(NodeId parent) {
        if (client == null || parent == null || parent.isNull()) {
            return NodeId.NULL_VALUE;
        }
        BrowseDescription browse = new BrowseDescription(
                parent,
                BrowseDirection.Forward,
                Identifiers.HierarchicalReferences,
                true,
                uint(0),
                uint(BrowseResultMask.All.getValue())
        );
        try {
            BrowseResult result = client.browse(browse).get();
            if (!result.getStatusCode().isGood()) {
                log.warn("browse {} failed: {}", parent, UaStatus.name(result.getStatusCode()));
                return NodeId.NULL_VALUE;
            }
            ReferenceDescription[] references = result.getReferences();
            if (references == null) {
                return NodeId.NULL_VALUE;
            }
            for (ReferenceDescription reference : references) {
                if (browseName.equals(reference.getBrowseName())) {
                    Optional<NodeId> target = reference.getNodeId().toNodeId(client.getNamespaceTable());
                    return target.orElse(NodeId.NULL_VALUE);
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        } catch (ExecutionException e) {
            log.error("browse {} failed: {}", parent, UaStatus.describe(e));
        }
        return NodeId.NULL_VALUE;
    }

    @Override
    public String toString() {
        return "FindNodeInClient{" + browseName.toParseableString() + "}";
    }
}
