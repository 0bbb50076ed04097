package com.synclab.uaengine.opcua.pubsub;

import java.util.Collections;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * 발행할 필드의 순서 있는 목록.
 */
public final class PublishedDataSet {

    private final String name;
    private final List<DataSetField> fields = new CopyOnWriteArrayList<>();

    PublishedDataSet(String name) {
        this.name = name;
    }

    void addField(DataSetField field) {
        fields.add(field);
    }

    public String getName() {
        return name;
    }

    public List<DataSetField> getFields() {
        return Collections.unmodifiableList(fields);
    }
}
