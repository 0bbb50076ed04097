package com.synclab.uaengine.opcua.pubsub;

import com.synclab.uaengine.config.UaEngineProperties;
import com.synclab.uaengine.variable.Variables;
import org.eclipse.milo.opcua.stack.core.types.builtin.NodeId;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.net.DatagramPacket;
import java.net.DatagramSocket;
import java.net.InetAddress;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class UaPublisherTest {

    private UaPublisher publisher;

    private static UaEngineProperties loopback() {
        UaEngineProperties properties = new UaEngineProperties();
        properties.getServer().setBindAddress("127.0.0.1");
        properties.getServer().setHostname("127.0.0.1");
        properties.getPubsub().setKeyFrameCount(5);
        return properties;
    }

    @AfterEach
    void tearDown() {
        if (publisher != null) {
            publisher.close();
        }
    }

    @Test
    void publishWithoutConnectionFails() {
        publisher = new UaPublisher("plant", "opc.mqtt://127.0.0.1:1883", 14870,
                TransportProfile.MQTT_UADP, List.of(), loopback(), List.of(new UdpTransportLayer()));
        NodeId id = publisher.addVariableNode(Variables.named("temperature", 21.0));

        assertFalse(publisher.isConnectionEstablished());
        assertFalse(publisher.publish(List.of(new PublishedData("temperature", id)), 100));
        assertTrue(publisher.getWriterGroups().isEmpty());
        assertTrue(publisher.getDataSetWriters().isEmpty());
    }

    @Test
    void publishesUadpOverUdp() throws Exception {
        try (DatagramSocket socket = new DatagramSocket(0, InetAddress.getLoopbackAddress())) {
            socket.setSoTimeout(3000);
            publisher = new UaPublisher("plant", "opc.udp://127.0.0.1:" + socket.getLocalPort(), 14871,
                    TransportProfile.UDP_UADP, List.of(), loopback(), List.of(new UdpTransportLayer()));
            NodeId id = publisher.addVariableNode(Variables.named("temperature", 21.0));

            assertTrue(publisher.publish(List.of(new PublishedData("temperature", id)), 50));

            DatagramPacket packet = new DatagramPacket(new byte[1500], 1500);
            socket.receive(packet);
            ByteBuffer message = ByteBuffer.wrap(packet.getData(), 0, packet.getLength()).order(ByteOrder.LITTLE_ENDIAN);

            assertEquals((byte) 0xF1, message.get());
            assertEquals(UadpMessageEncoder.PUBLISHER_ID_UINT32, message.get());
            assertEquals(PubSubIds.publisherId("plantConnection"), Integer.toUnsignedLong(message.getInt()));
            assertEquals(UadpMessageEncoder.GROUP_WRITER_GROUP_ID, message.get());
            assertEquals(PubSubIds.writerId("plantWriterGroup"), Short.toUnsignedInt(message.getShort()));
            assertEquals(1, message.get());
            assertEquals(PubSubIds.writerId("plantDataSetWriter"), Short.toUnsignedInt(message.getShort()));
        }
    }

    @Test
    void pipelineIsBuiltInOrder() {
        publisher = new UaPublisher("line", "opc.udp://127.0.0.1:4999", 14872,
                TransportProfile.UDP_UADP, List.of(), loopback(), List.of(new UdpTransportLayer()));
        NodeId speed = publisher.addVariableNode(Variables.named("speed", 1.0));
        NodeId state = publisher.addVariableNode(Variables.named("state", "RUN"));

        assertTrue(publisher.publish(List.of(new PublishedData("speed", speed), new PublishedData("state", state)), 100));

        assertEquals("lineConnection", publisher.getConnection().getName());
        assertEquals(List.of("speed", "state"), publisher.getPublishedDataSet().getFields().stream()
                .map(DataSetField::getAlias).toList());
        WriterGroup group = publisher.getWriterGroups().get(0);
        assertEquals("lineWriterGroup", group.getName());
        assertTrue(group.isOperational());
        DataSetWriter writer = publisher.getDataSetWriters().get(0);
        assertEquals(PubSubIds.writerId("lineDataSetWriter"), writer.getDataSetWriterId());
        assertEquals(5, writer.getKeyFrameCount());
        assertEquals(List.of(writer), group.getWriters());
    }

    @Test
    void unknownFieldAbortsPublish() {
        publisher = new UaPublisher("cell", "opc.udp://127.0.0.1:4998", 14873,
                TransportProfile.UDP_UADP, List.of(), loopback(), List.of(new UdpTransportLayer()));
        NodeId known = publisher.addVariableNode(Variables.named("known", 1));
        NodeId unknown = new NodeId(publisher.getNamespaceIndex(), "ghost");

        assertFalse(publisher.publish(List.of(new PublishedData("known", known), new PublishedData("ghost", unknown)), 100));

        assertTrue(publisher.getWriterGroups().isEmpty());
        assertEquals(1, publisher.getPublishedDataSet().getFields().size());
    }

    @Test
    void closedPublisherRejectsPublish() {
        publisher = new UaPublisher("closed", "opc.udp://127.0.0.1:4997", 14874,
                TransportProfile.UDP_UADP, List.of(), loopback(), List.of(new UdpTransportLayer()));
        publisher.close();

        assertThrows(IllegalStateException.class, () -> publisher.publish(List.of(), 100));
        publisher = null;
    }

    @Test
    void nonPositivePeriodFails() {
        publisher = new UaPublisher("slow", "opc.udp://127.0.0.1:4996", 14875,
                TransportProfile.UDP_UADP, List.of(), loopback(), List.of(new UdpTransportLayer()));

        assertFalse(publisher.publish(List.of(), 0));
        assertTrue(publisher.getWriterGroups().isEmpty());
    }
}
