package com.synclab.uaengine.opcua.pubsub;

import com.synclab.uaengine.variable.Variable;

import java.util.Collections;
import java.util.SortedMap;

/**
 * DataSetWriter 한 주기의 결과. key frame 이면 모든 필드, 아니면 바뀐 필드만 가진다.
 */
public final class DataSetMessage {

    private final int dataSetWriterId;
    private final int sequenceNumber;
    private final boolean keyFrame;
    private final SortedMap<Integer, Variable> fields;

    DataSetMessage(int dataSetWriterId, int sequenceNumber, boolean keyFrame, SortedMap<Integer, Variable> fields) {
        this.dataSetWriterId = dataSetWriterId;
        this.sequenceNumber = sequenceNumber;
        this.keyFrame = keyFrame;
        this.fields = Collections.unmodifiableSortedMap(fields);
    }

    public int getDataSetWriterId() {
        return dataSetWriterId;
    }

    public int getSequenceNumber() {
        return sequenceNumber;
    }

    public boolean isKeyFrame() {
        return keyFrame;
    }

    /** 필드 인덱스 → 값 */
    public SortedMap<Integer, Variable> getFields() {
        return fields;
    }
}
