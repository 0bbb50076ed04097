package com.synclab.uaengine.opcua.pubsub;

import com.synclab.uaengine.variable.Variable;
import com.synclab.uaengine.variable.Variants;
import io.netty.buffer.ByteBuf;
import io.netty.buffer.Unpooled;
import org.eclipse.milo.opcua.stack.core.NamespaceTable;
import org.eclipse.milo.opcua.stack.core.channel.EncodingLimits;
import org.eclipse.milo.opcua.stack.core.serialization.OpcUaBinaryStreamEncoder;
import org.eclipse.milo.opcua.stack.core.serialization.SerializationContext;
import org.eclipse.milo.opcua.stack.core.types.DataTypeManager;
import org.eclipse.milo.opcua.stack.core.types.OpcUaDataTypeManager;

import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * UADP NetworkMessage 인코더 (little endian).
 * <p>
 * publisher id 는 UInt32, 필드는 OPC UA 바이너리 Variant 인코딩을 쓴다.
 */
public class UadpMessageEncoder {

    static final int UADP_VERSION = 0x01;

    static final int FLAG_PUBLISHER_ID = 0x10;
    static final int FLAG_GROUP_HEADER = 0x20;
    static final int FLAG_PAYLOAD_HEADER = 0x40;
    static final int FLAG_EXTENDED_FLAGS1 = 0x80;

    static final int PUBLISHER_ID_UINT32 = 0x02;

    static final int GROUP_WRITER_GROUP_ID = 0x01;
    static final int GROUP_VERSION = 0x02;
    static final int GROUP_NETWORK_MESSAGE_NUMBER = 0x04;
    static final int GROUP_SEQUENCE_NUMBER = 0x08;

    static final int DATASET_VALID = 0x01;
    static final int DATASET_SEQUENCE_NUMBER = 0x08;
    static final int DATASET_FLAGS2 = 0x80;

    static final int DATASET_KEY_FRAME = 0x00;
    static final int DATASET_DELTA_FRAME = 0x01;

    static final int VARIANT_ARRAY = 0x80;

    /** 내장 타입 필드만 인코딩할 때 쓰는 문맥 */
    static final SerializationContext BUILTIN_CONTEXT = new SerializationContext() {
        private final NamespaceTable namespaceTable = new NamespaceTable();

        @Override
        public EncodingLimits getEncodingLimits() {
            return EncodingLimits.DEFAULT;
        }

        @Override
        public NamespaceTable getNamespaceTable() {
            return namespaceTable;
        }

        @Override
        public DataTypeManager getDataTypeManager() {
            return OpcUaDataTypeManager.getInstance();
        }
    };

    private final SerializationContext context;
    private final Set<NetworkMessageContentMask> contentMask;

    public UadpMessageEncoder() {
        this(BUILTIN_CONTEXT, NetworkMessageContentMask.defaults());
    }

    public UadpMessageEncoder(Set<NetworkMessageContentMask> contentMask) {
        this(BUILTIN_CONTEXT, contentMask);
    }

    public UadpMessageEncoder(SerializationContext context, Set<NetworkMessageContentMask> contentMask) {
        this.context = context;
        this.contentMask = contentMask.isEmpty()
                ? EnumSet.noneOf(NetworkMessageContentMask.class)
                : EnumSet.copyOf(contentMask);
    }

    public ByteBuf encode(long publisherId, int writerGroupId, int sequenceNumber, List<DataSetMessage> messages) {
        if (messages.size() > 0xFF) {
            throw new IllegalArgumentException("too many data set messages: " + messages.size());
        }
        ByteBuf buffer = Unpooled.buffer();
        boolean publisher = contentMask.contains(NetworkMessageContentMask.PUBLISHER_ID);
        boolean groupHeader = contentMask.contains(NetworkMessageContentMask.GROUP_HEADER);
        boolean payloadHeader = contentMask.contains(NetworkMessageContentMask.PAYLOAD_HEADER);

        int flags = UADP_VERSION;
        if (publisher) {
            flags |= FLAG_PUBLISHER_ID | FLAG_EXTENDED_FLAGS1;
        }
        if (groupHeader) {
            flags |= FLAG_GROUP_HEADER;
        }
        if (payloadHeader) {
            flags |= FLAG_PAYLOAD_HEADER;
        }
        buffer.writeByte(flags);
        if (publisher) {
            buffer.writeByte(PUBLISHER_ID_UINT32);
            buffer.writeIntLE((int) publisherId);
        }

        if (groupHeader) {
            writeGroupHeader(buffer, writerGroupId, sequenceNumber);
        }

        if (payloadHeader) {
            buffer.writeByte(messages.size());
            for (DataSetMessage message : messages) {
                buffer.writeShortLE(message.getDataSetWriterId());
            }
        }

        if (messages.size() > 1 && payloadHeader) {
            int sizesIndex = buffer.writerIndex();
            buffer.writeZero(2 * messages.size());
            for (int i = 0; i < messages.size(); i++) {
                int start = buffer.writerIndex();
                writeDataSetMessage(buffer, messages.get(i));
                buffer.setShortLE(sizesIndex + 2 * i, buffer.writerIndex() - start);
            }
        } else {
            for (DataSetMessage message : messages) {
                writeDataSetMessage(buffer, message);
            }
        }
        return buffer;
    }

    private void writeGroupHeader(ByteBuf buffer, int writerGroupId, int sequenceNumber) {
        int groupFlags = 0;
        if (contentMask.contains(NetworkMessageContentMask.WRITER_GROUP_ID)) {
            groupFlags |= GROUP_WRITER_GROUP_ID;
        }
        if (contentMask.contains(NetworkMessageContentMask.GROUP_VERSION)) {
            groupFlags |= GROUP_VERSION;
        }
        if (contentMask.contains(NetworkMessageContentMask.NETWORK_MESSAGE_NUMBER)) {
            groupFlags |= GROUP_NETWORK_MESSAGE_NUMBER;
        }
        if (contentMask.contains(NetworkMessageContentMask.SEQUENCE_NUMBER)) {
            groupFlags |= GROUP_SEQUENCE_NUMBER;
        }
        buffer.writeByte(groupFlags);
        if ((groupFlags & GROUP_WRITER_GROUP_ID) != 0) {
            buffer.writeShortLE(writerGroupId);
        }
        if ((groupFlags & GROUP_VERSION) != 0) {
            buffer.writeIntLE(0);
        }
        if ((groupFlags & GROUP_NETWORK_MESSAGE_NUMBER) != 0) {
            buffer.writeShortLE(1);
        }
        if ((groupFlags & GROUP_SEQUENCE_NUMBER) != 0) {
            buffer.writeShortLE(sequenceNumber);
        }
    }

    private void writeDataSetMessage(ByteBuf buffer, DataSetMessage message) {
        buffer.writeByte(DATASET_VALID | DATASET_SEQUENCE_NUMBER | DATASET_FLAGS2);
        buffer.writeByte(message.isKeyFrame() ? DATASET_KEY_FRAME : DATASET_DELTA_FRAME);
        buffer.writeShortLE(message.getSequenceNumber());
        buffer.writeShortLE(message.getFields().size());
        for (Map.Entry<Integer, Variable> field : message.getFields().entrySet()) {
            if (!message.isKeyFrame()) {
                buffer.writeShortLE(field.getKey());
            }
            writeVariant(buffer, field.getValue());
        }
    }

    /** 필드 값은 Milo 바이너리 인코더로 Variant 인코딩한다 */
    void writeVariant(ByteBuf buffer, Variable value) {
        new OpcUaBinaryStreamEncoder(context)
                .setBuffer(buffer)
                .writeVariant(Variants.toVariant(value));
    }
}
