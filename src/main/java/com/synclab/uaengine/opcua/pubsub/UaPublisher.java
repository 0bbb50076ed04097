package com.synclab.uaengine.opcua.pubsub;

import com.synclab.uaengine.config.UaEngineProperties;
import com.synclab.uaengine.opcua.UaServer;
import com.synclab.uaengine.opcua.UaStatus;
import com.synclab.uaengine.opcua.UserConfig;
import org.eclipse.milo.opcua.sdk.server.nodes.UaNode;
import org.eclipse.milo.opcua.sdk.server.nodes.UaVariableNode;
import org.eclipse.milo.opcua.stack.core.StatusCodes;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.Collection;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * PubSub 발행 기능을 가진 OPC UA 서버.
 * <p>
 * 생성 시 connection 과 published data set 을 만들고, {@link #publish} 에서
 * field → writer group → data set writer 순서로 구성한다.
 * 중간 단계가 실패해도 앞에서 만든 구성은 되돌리지 않는다.
 */
public class UaPublisher extends UaServer {

    private static final Logger log = LoggerFactory.getLogger(UaPublisher.class);

    private final String name;
    private final int keyFrameCount;
    private final PubSubConnection connection;
    private final PublishedDataSet publishedDataSet;
    private final List<WriterGroup> writerGroups = new CopyOnWriteArrayList<>();
    private final List<DataSetWriter> dataSetWriters = new CopyOnWriteArrayList<>();
    private volatile boolean closed;

    public UaPublisher(String name, String address, int port) {
        this(name, address, port, TransportProfile.UDP_UADP, List.of(), new UaEngineProperties(),
                List.of(new UdpTransportLayer()));
    }

    public UaPublisher(String name,
                       String address,
                       int port,
                       TransportProfile profile,
                       List<UserConfig> users,
                       UaEngineProperties properties,
                       Collection<? extends PubSubTransportLayer> layers) {
        super(properties, port, users);
        this.name = name;
        this.keyFrameCount = properties.getPubsub().getKeyFrameCount();

        Map<TransportProfile, PubSubTransportLayer> available = new EnumMap<>(TransportProfile.class);
        for (PubSubTransportLayer layer : layers) {
            available.put(layer.profile(), layer);
        }
        this.connection = openConnection(name + "Connection", address, profile, available.get(profile));
        this.publishedDataSet = new PublishedDataSet(name + "PublishedDataSet");
    }

    private static PubSubConnection openConnection(String connectionName, String address,
                                                   TransportProfile profile, PubSubTransportLayer layer) {
        if (layer == null) {
            log.error("pubsub connection {} not established: no transport layer for {}", connectionName, profile);
            return null;
        }
        try {
            PubSubChannel channel = layer.open(address);
            long publisherId = PubSubIds.publisherId(connectionName);
            log.info("pubsub connection {} established. publisherId={}, address={}", connectionName, publisherId, address);
            return new PubSubConnection(connectionName, publisherId, profile, address, channel);
        } catch (IOException e) {
            log.error("pubsub connection {} not established: {}", connectionName, e.getMessage());
            return null;
        }
    }

    /**
     * 주어진 변수들을 periodMillis 주기로 발행한다.
     *
     * @return 구성 성공 여부. connection 이 없거나 필드 등록에 실패하면 false
     * @throws IllegalStateException 서버가 이미 닫힌 경우
     */
    public boolean publish(List<PublishedData> data, double periodMillis) {
        if (closed) {
            throw new IllegalStateException("publisher " + name + " is closed");
        }
        if (connection == null) {
            log.error("publish {} failed: pubsub connection is not established", name);
            return false;
        }

        for (PublishedData field : data) {
            if (variableNode(field).isEmpty()) {
                log.error("publish {} failed: field {} {}", name, field, UaStatus.name(StatusCodes.Bad_NodeIdUnknown));
                return false;
            }
            publishedDataSet.addField(new DataSetField(field.getName(), field.getNodeId()));
        }

        String groupName = name + "WriterGroup";
        WriterGroup group;
        try {
            group = new WriterGroup(groupName, PubSubIds.writerId(groupName), periodMillis,
                    connection,
                    new UadpMessageEncoder(server.getSerializationContext(), NetworkMessageContentMask.defaults()));
        } catch (IllegalArgumentException e) {
            log.error("publish {} failed: {}", name, e.getMessage());
            return false;
        }
        writerGroups.add(group);

        String writerName = name + "DataSetWriter";
        DataSetWriter writer = new DataSetWriter(writerName, PubSubIds.writerId(writerName), keyFrameCount, publishedDataSet);
        group.addWriter(writer);
        dataSetWriters.add(writer);
        group.setOperational(this::read);
        log.info("publishing {} field(s) every {}ms via {}", publishedDataSet.getFields().size(), periodMillis, groupName);
        return true;
    }

    private Optional<UaVariableNode> variableNode(PublishedData field) {
        Optional<UaNode> node = server.getAddressSpaceManager().getManagedNode(field.getNodeId());
        return node.filter(UaVariableNode.class::isInstance).map(UaVariableNode.class::cast);
    }

    public boolean isConnectionEstablished() {
        return connection != null;
    }

    /** connection, 수립되지 않았으면 null */
    public PubSubConnection getConnection() {
        return connection;
    }

    public PublishedDataSet getPublishedDataSet() {
        return publishedDataSet;
    }

    public List<WriterGroup> getWriterGroups() {
        return Collections.unmodifiableList(writerGroups);
    }

    public List<DataSetWriter> getDataSetWriters() {
        return Collections.unmodifiableList(dataSetWriters);
    }

    public String getName() {
        return name;
    }

    @Override
    public void close() {
        closed = true;
        for (WriterGroup group : writerGroups) {
            group.disable();
        }
        if (connection != null) {
            connection.close();
        }
        super.close();
    }
}
