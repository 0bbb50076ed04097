package com.synclab.uaengine.opcua.pubsub;

import org.eclipse.milo.opcua.stack.core.types.builtin.NodeId;

/**
 * PublishedDataSet 의 필드. 변수 노드의 Value 속성을 가리킨다.
 */
public final class DataSetField {

    private final String alias;
    private final NodeId publishedVariable;

    DataSetField(String alias, NodeId publishedVariable) {
        this.alias = alias;
        this.publishedVariable = publishedVariable;
    }

    public String getAlias() {
        return alias;
    }

    public NodeId getPublishedVariable() {
        return publishedVariable;
    }
}
