package com.synclab.uaengine.opcua;

import org.eclipse.milo.opcua.stack.core.types.builtin.NodeId;

/**
 * 지연된 한 단계 경로. 시작 노드가 주어졌을 때만 browse name 으로 자식 하나를 찾는다.
 * 실패하면 예외 대신 {@link NodeId#NULL_VALUE} 를 돌려준다.
 */
@FunctionalInterface
public interface FindNode {

    NodeId resolve(NodeId parent);

    /**
     * 왼쪽에서 오른쪽으로 이어지는 경로. 앞 단계가 실패하면 다음 단계는 실행되지 않는다.
     */
    default FindNode then(FindNode next) {
        return parent -> {
            NodeId child = resolve(parent);
            if (child == null || child.isNull()) {
                return NodeId.NULL_VALUE;
            }
            return next.resolve(child);
        };
    }
}
