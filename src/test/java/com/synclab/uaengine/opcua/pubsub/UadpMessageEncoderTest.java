package com.synclab.uaengine.opcua.pubsub;

import com.synclab.uaengine.variable.Variable;
import io.netty.buffer.ByteBuf;
import io.netty.buffer.Unpooled;
import org.eclipse.milo.opcua.stack.core.types.builtin.NodeId;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.util.EnumSet;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

import static org.eclipse.milo.opcua.stack.core.types.builtin.unsigned.Unsigned.uint;
import static org.eclipse.milo.opcua.stack.core.types.builtin.unsigned.Unsigned.ulong;
import static org.junit.jupiter.api.Assertions.*;

class UadpMessageEncoderTest {

    private static final NodeId SPEED = new NodeId(2, "speed");
    private static final NodeId LABEL = new NodeId(2, "label");

    @Test
    void writesDefaultHeaders() {
        DataSetMessage message = singleFieldMessage(7, new Variable(1.5));
        ByteBuf buffer = new UadpMessageEncoder().encode(0x01020304L, 0x0506, 0, List.of(message));
        try {
            assertEquals(0xF1, buffer.readUnsignedByte());
            assertEquals(UadpMessageEncoder.PUBLISHER_ID_UINT32, buffer.readUnsignedByte());
            assertEquals(0x01020304L, buffer.readUnsignedIntLE());
            assertEquals(UadpMessageEncoder.GROUP_WRITER_GROUP_ID, buffer.readUnsignedByte());
            assertEquals(0x0506, buffer.readUnsignedShortLE());
            assertEquals(1, buffer.readUnsignedByte());
            assertEquals(7, buffer.readUnsignedShortLE());

            assertEquals(0x89, buffer.readUnsignedByte());
            assertEquals(UadpMessageEncoder.DATASET_KEY_FRAME, buffer.readUnsignedByte());
            assertEquals(0, buffer.readUnsignedShortLE());
            assertEquals(1, buffer.readUnsignedShortLE());
            assertEquals(11, buffer.readUnsignedByte());
            assertEquals(1.5, buffer.readDoubleLE());
            assertFalse(buffer.isReadable());
        } finally {
            buffer.release();
        }
    }

    @Test
    void writesStringAndArrayVariants() {
        UadpMessageEncoder encoder = new UadpMessageEncoder();
        ByteBuf buffer = Unpooled.buffer();
        try {
            encoder.writeVariant(buffer, new Variable("ok"));
            encoder.writeVariant(buffer, new Variable(new short[]{3, -1}));
            encoder.writeVariant(buffer, new Variable());

            assertEquals(12, buffer.readUnsignedByte());
            assertEquals(2, buffer.readIntLE());
            assertEquals("ok", buffer.readCharSequence(2, StandardCharsets.UTF_8).toString());

            assertEquals(4 | UadpMessageEncoder.VARIANT_ARRAY, buffer.readUnsignedByte());
            assertEquals(2, buffer.readIntLE());
            assertEquals(3, buffer.readShortLE());
            assertEquals(-1, buffer.readShortLE());

            assertEquals(0, buffer.readUnsignedByte());
        } finally {
            buffer.release();
        }
    }

    @Test
    void writesUnsignedAndBooleanVariants() {
        UadpMessageEncoder encoder = new UadpMessageEncoder();
        ByteBuf buffer = Unpooled.buffer();
        try {
            encoder.writeVariant(buffer, new Variable(uint(4000000000L)));
            encoder.writeVariant(buffer, new Variable(ulong(42L)));
            encoder.writeVariant(buffer, new Variable(Boolean.TRUE));

            assertEquals(7, buffer.readUnsignedByte());
            assertEquals(4000000000L, buffer.readUnsignedIntLE());
            assertEquals(9, buffer.readUnsignedByte());
            assertEquals(42L, buffer.readLongLE());
            assertEquals(1, buffer.readUnsignedByte());
            assertEquals(1, buffer.readUnsignedByte());
            assertFalse(buffer.isReadable());
        } finally {
            buffer.release();
        }
    }

    @Test
    void fieldAddedBetweenCyclesForcesKeyFrame() {
        PublishedDataSet dataSet = new PublishedDataSet("growing");
        dataSet.addField(new DataSetField("speed", SPEED));
        DataSetWriter writer = new DataSetWriter("growingWriter", 2, 10, dataSet);
        Map<NodeId, Variable> values = new HashMap<>();
        values.put(SPEED, new Variable(1.0));
        values.put(LABEL, new Variable("A"));

        DataSetMessage first = writer.nextMessage(node -> {
            // 읽는 도중 다른 publish 가 필드를 추가한 경우
            dataSet.addField(new DataSetField("label", LABEL));
            return values.get(node);
        });
        assertTrue(first.isKeyFrame());
        assertEquals(1, first.getFields().size());

        DataSetMessage second = writer.nextMessage(values::get);
        assertTrue(second.isKeyFrame());
        assertEquals(2, second.getFields().size());
        assertEquals(new Variable("A"), second.getFields().get(1));
    }

    @Test
    void writerSendsKeyFramesThenDeltas() {
        PublishedDataSet dataSet = new PublishedDataSet("lineDataSet");
        dataSet.addField(new DataSetField("speed", SPEED));
        dataSet.addField(new DataSetField("label", LABEL));
        DataSetWriter writer = new DataSetWriter("lineWriter", 11, 3, dataSet);

        Map<NodeId, Variable> values = new HashMap<>();
        values.put(SPEED, new Variable(1.0));
        values.put(LABEL, new Variable("A"));

        DataSetMessage first = writer.nextMessage(values::get);
        assertTrue(first.isKeyFrame());
        assertEquals(2, first.getFields().size());

        values.put(SPEED, new Variable(2.0));
        DataSetMessage second = writer.nextMessage(values::get);
        assertFalse(second.isKeyFrame());
        assertEquals(1, second.getFields().size());
        assertEquals(new Variable(2.0), second.getFields().get(0));
        assertEquals(1, second.getSequenceNumber());

        DataSetMessage third = writer.nextMessage(values::get);
        assertFalse(third.isKeyFrame());
        assertTrue(third.getFields().isEmpty());

        DataSetMessage fourth = writer.nextMessage(values::get);
        assertTrue(fourth.isKeyFrame());
        assertEquals(2, fourth.getFields().size());
    }

    @Test
    void deltaFrameCarriesFieldIndex() {
        PublishedDataSet dataSet = new PublishedDataSet("ds");
        dataSet.addField(new DataSetField("speed", SPEED));
        dataSet.addField(new DataSetField("label", LABEL));
        DataSetWriter writer = new DataSetWriter("w", 1, 10, dataSet);
        Map<NodeId, Variable> values = new HashMap<>();
        values.put(SPEED, new Variable(1));
        values.put(LABEL, new Variable("A"));
        writer.nextMessage(values::get);
        values.put(LABEL, new Variable("B"));

        DataSetMessage delta = writer.nextMessage(values::get);
        ByteBuf buffer = new UadpMessageEncoder(EnumSet.noneOf(NetworkMessageContentMask.class))
                .encode(1, 1, 0, List.of(delta));
        try {
            assertEquals(UadpMessageEncoder.UADP_VERSION, buffer.readUnsignedByte());
            assertEquals(0x89, buffer.readUnsignedByte());
            assertEquals(UadpMessageEncoder.DATASET_DELTA_FRAME, buffer.readUnsignedByte());
            assertEquals(1, buffer.readUnsignedShortLE());
            assertEquals(1, buffer.readUnsignedShortLE());
            assertEquals(1, buffer.readUnsignedShortLE());
            assertEquals(12, buffer.readUnsignedByte());
        } finally {
            buffer.release();
        }
    }

    private static DataSetMessage singleFieldMessage(int writerId, Variable value) {
        TreeMap<Integer, Variable> fields = new TreeMap<>();
        fields.put(0, value);
        return new DataSetMessage(writerId, 0, true, fields);
    }
}
