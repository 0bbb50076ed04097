package com.synclab.uaengine.opcua.pubsub;

import com.synclab.uaengine.variable.Variable;
import org.eclipse.milo.opcua.stack.core.types.builtin.NodeId;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.SortedMap;
import java.util.TreeMap;
import java.util.function.Function;

/**
 * PublishedDataSet 을 주기마다 DataSetMessage 로 만든다.
 * keyFrameCount 주기마다 전체 필드를, 그 사이에는 바뀐 필드만 싣는다.
 */
public class DataSetWriter {

    private final String name;
    private final int dataSetWriterId;
    private final int keyFrameCount;
    private final PublishedDataSet dataSet;

    private final List<Variable> lastValues = new ArrayList<>();
    private long cycle;
    private int sequenceNumber;

    DataSetWriter(String name, int dataSetWriterId, int keyFrameCount, PublishedDataSet dataSet) {
        this.name = name;
        this.dataSetWriterId = dataSetWriterId;
        this.keyFrameCount = Math.max(1, keyFrameCount);
        this.dataSet = dataSet;
    }

    /**
     * 필드 값을 읽어 다음 메시지를 만든다. 필드 목록은 호출 시점의 스냅샷을 쓰므로
     * 도중에 추가된 필드는 다음 주기(key frame)부터 실린다.
     */
    synchronized DataSetMessage nextMessage(Function<NodeId, Variable> reader) {
        List<DataSetField> fields = List.copyOf(dataSet.getFields());
        boolean keyFrame = cycle % keyFrameCount == 0 || lastValues.size() != fields.size();
        SortedMap<Integer, Variable> payload = new TreeMap<>();
        List<Variable> current = new ArrayList<>(fields.size());
        for (int i = 0; i < fields.size(); i++) {
            Variable value = reader.apply(fields.get(i).getPublishedVariable());
            current.add(value);
            if (keyFrame || !Objects.equals(lastValues.get(i), value)) {
                payload.put(i, value);
            }
        }
        lastValues.clear();
        lastValues.addAll(current);
        cycle++;
        int sequence = sequenceNumber;
        sequenceNumber = (sequenceNumber + 1) & 0xFFFF;
        return new DataSetMessage(dataSetWriterId, sequence, keyFrame, payload);
    }

    public String getName() {
        return name;
    }

    public int getDataSetWriterId() {
        return dataSetWriterId;
    }

    public int getKeyFrameCount() {
        return keyFrameCount;
    }

    public PublishedDataSet getDataSet() {
        return dataSet;
    }
}
