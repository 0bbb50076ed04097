package com.synclab.uaengine.opcua;

import com.synclab.uaengine.config.UaEngineProperties;
import com.synclab.uaengine.opcua.model.UaEvent;
import com.synclab.uaengine.opcua.model.UaEventType;
import com.synclab.uaengine.opcua.model.UaMethod;
import com.synclab.uaengine.opcua.model.UaObject;
import com.synclab.uaengine.opcua.model.UaView;
import com.synclab.uaengine.variable.DataType;
import com.synclab.uaengine.variable.Variable;
import com.synclab.uaengine.variable.VariableType;
import com.synclab.uaengine.variable.Variants;
import org.eclipse.milo.opcua.sdk.core.QualifiedProperty;
import org.eclipse.milo.opcua.sdk.core.ValueRanks;
import org.eclipse.milo.opcua.sdk.server.OpcUaServer;
import org.eclipse.milo.opcua.sdk.server.api.config.OpcUaServerConfig;
import org.eclipse.milo.opcua.sdk.server.identity.UsernameIdentityValidator;
import org.eclipse.milo.opcua.sdk.server.model.nodes.objects.BaseEventTypeNode;
import org.eclipse.milo.opcua.sdk.server.nodes.UaNode;
import org.eclipse.milo.opcua.sdk.server.nodes.UaVariableNode;
import org.eclipse.milo.opcua.stack.core.Identifiers;
import org.eclipse.milo.opcua.stack.core.StatusCodes;
import org.eclipse.milo.opcua.stack.core.UaException;
import org.eclipse.milo.opcua.stack.core.UaRuntimeException;
import org.eclipse.milo.opcua.stack.core.security.SecurityPolicy;
import org.eclipse.milo.opcua.stack.core.types.builtin.ByteString;
import org.eclipse.milo.opcua.stack.core.types.builtin.DateTime;
import org.eclipse.milo.opcua.stack.core.types.builtin.LocalizedText;
import org.eclipse.milo.opcua.stack.core.types.builtin.NodeId;
import org.eclipse.milo.opcua.stack.core.types.enumerated.UserTokenType;
import org.eclipse.milo.opcua.stack.core.types.structured.UserTokenPolicy;
import org.eclipse.milo.opcua.stack.server.EndpointConfiguration;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.ByteBuffer;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;

import static org.eclipse.milo.opcua.stack.core.types.builtin.unsigned.Unsigned.ushort;

/**
 * OPC UA 서버.
 * <p>
 * 주소 공간 구성(변수, 변수 타입, 객체, 메서드, 이벤트 타입, 뷰 추가), 이벤트 발생,
 * 그리고 전용 처리 스레드 하나의 수명(start / stop / join)을 담당한다.
 * 추가 연산은 실패 시 로그를 남기고 {@link NodeId#NULL_VALUE} 를 반환한다.
 * <p>
 * 주소 공간 구성은 한 소유자 스레드에서 하는 것을 전제로 한다.
 */
public class UaServer implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(UaServer.class);

    /** 서버 인증서 없이 받는 사용자 이름 토큰. 비밀번호는 암호화되지 않는다. */
    static final UserTokenPolicy USER_TOKEN_POLICY_USERNAME = new UserTokenPolicy(
            "username",
            UserTokenType.UserName,
            null,
            null,
            SecurityPolicy.None.getUri()
    );

    protected final OpcUaServer server;
    protected final EngineNamespace namespace;
    private final int port;
    private final Map<String, NodeId> variableTypes = new ConcurrentHashMap<>();
    private final Map<String, NodeId> eventTypes = new ConcurrentHashMap<>();

    private final Object lifecycleLock = new Object();
    private Thread task;
    private CountDownLatch stopSignal;
    private volatile boolean running;

    public UaServer(int port) {
        this(new UaEngineProperties(), port, List.of());
    }

    public UaServer(int port, List<UserConfig> users) {
        this(new UaEngineProperties(), port, users);
    }

    public UaServer(UaEngineProperties properties, int port, List<UserConfig> users) {
        this.port = port;
        UaEngineProperties.Server settings = properties.getServer();

        EndpointConfiguration endpoint = new EndpointConfiguration.Builder()
                .setBindAddress(settings.getBindAddress())
                .setHostname(settings.getHostname())
                .setPath(settings.getPath())
                .setSecurityPolicy(SecurityPolicy.None)
                .setBindPort(port)
                .addTokenPolicies(OpcUaServerConfig.USER_TOKEN_POLICY_ANONYMOUS, USER_TOKEN_POLICY_USERNAME)
                .build();

        List<UserConfig> accounts = List.copyOf(users);
        UsernameIdentityValidator identityValidator = new UsernameIdentityValidator(
                accounts.isEmpty(),
                challenge -> accounts.stream()
                        .anyMatch(user -> user.matches(challenge.getUsername(), challenge.getPassword()))
        );

        OpcUaServerConfig config = OpcUaServerConfig.builder()
                .setApplicationUri(settings.getApplicationUri())
                .setProductUri(settings.getProductUri())
                .setApplicationName(LocalizedText.english(settings.getApplicationName()))
                .setEndpoints(Set.of(endpoint))
                .setIdentityValidator(identityValidator)
                .build();

        this.server = new OpcUaServer(config);
        this.namespace = new EngineNamespace(server, properties.getNamespaceUri());
        namespace.startup();
        log.info("OPC UA server created. port={}, namespace[{}]={}, users={}",
                port, namespace.getNamespaceIndex(), properties.getNamespaceUri(), accounts.size());
    }

    /* ---------- 경로 탐색 ---------- */

    /** 엔진 네임스페이스의 browse name 으로 한 단계 찾기 */
    public FindNode find(String browseName) {
        return find(browseName, getNamespaceIndex());
    }

    public FindNode find(String browseName, int namespaceIndex) {
        return new FindNodeInServer(server, browseName, namespaceIndex);
    }

    /* ---------- 노드 추가 ---------- */

    public NodeId addVariableTypeNode(VariableType type) {
        if (!checkName("variable type", type.getBrowseName(), Identifiers.BaseDataVariableType)) {
            return NodeId.NULL_VALUE;
        }
        try {
            NodeId id = namespace.addVariableTypeNode(type).getNodeId();
            variableTypes.put(type.getBrowseName(), id);
            log.info("variable type added: {} -> {}", type.getBrowseName(), id);
            return id;
        } catch (UaRuntimeException e) {
            log.error("Failed to add variable type {}: {}", type.getBrowseName(), UaStatus.name(e.getStatusCode()));
            return NodeId.NULL_VALUE;
        }
    }

    /** ObjectsFolder 아래에 변수 추가 */
    public NodeId addVariableNode(Variable variable) {
        return addVariableNode(variable, Identifiers.ObjectsFolder);
    }

    public NodeId addVariableNode(Variable variable, NodeId parent) {
        if (!checkName("variable", variable.getBrowseName(), parent)) {
            return NodeId.NULL_VALUE;
        }
        NodeId typeDefinition = Identifiers.BaseDataVariableType;
        if (variable.hasType()) {
            NodeId registered = variableTypes.get(variable.getType().getBrowseName());
            if (registered != null) {
                typeDefinition = registered;
            }
        }
        try {
            NodeId id = namespace.addVariableNode(parent, Identifiers.Organizes, variable, typeDefinition).getNodeId();
            log.info("variable added: {} = {} -> {}", variable.getBrowseName(), variable, id);
            return id;
        } catch (UaRuntimeException e) {
            log.error("Failed to add variable {}: {}", variable.getBrowseName(), UaStatus.name(e.getStatusCode()));
            return NodeId.NULL_VALUE;
        }
    }

    /** ObjectsFolder 아래에 객체와 그 자식 변수, 메서드 추가 */
    public NodeId addObjectNode(UaObject object) {
        if (!checkName("object", object.getBrowseName(), Identifiers.ObjectsFolder)) {
            return NodeId.NULL_VALUE;
        }
        try {
            NodeId id = namespace.addObjectNode(Identifiers.ObjectsFolder, object).getNodeId();
            log.info("object added: {} ({} variables, {} methods) -> {}",
                    object.getBrowseName(), object.getVariables().size(), object.getMethods().size(), id);
            return id;
        } catch (UaRuntimeException e) {
            log.error("Failed to add object {}: {}", object.getBrowseName(), UaStatus.name(e.getStatusCode()));
            return NodeId.NULL_VALUE;
        }
    }

    /** ObjectsFolder 아래에 메서드 추가 */
    public NodeId addMethodNode(UaMethod method) {
        return addMethodNode(method, Identifiers.ObjectsFolder);
    }

    public NodeId addMethodNode(UaMethod method, NodeId parent) {
        if (!checkName("method", method.getBrowseName(), parent)) {
            return NodeId.NULL_VALUE;
        }
        try {
            NodeId id = namespace.addMethodNode(parent, method).getNodeId();
            log.info("method added: {}({} in, {} out) -> {}",
                    method.getBrowseName(), method.getInputs().size(), method.getOutputs().size(), id);
            return id;
        } catch (UaRuntimeException e) {
            log.error("Failed to add method {}: {}", method.getBrowseName(), UaStatus.name(e.getStatusCode()));
            return NodeId.NULL_VALUE;
        }
    }

    /** BaseEventType 의 하위 타입으로 이벤트 타입 추가 */
    public NodeId addEventTypeNode(UaEventType eventType) {
        if (!checkName("event type", eventType.getBrowseName(), Identifiers.BaseEventType)) {
            return NodeId.NULL_VALUE;
        }
        try {
            NodeId id = namespace.addEventTypeNode(eventType).getNodeId();
            server.getObjectTypeManager().registerObjectType(id, BaseEventTypeNode.class, BaseEventTypeNode::new);
            eventTypes.put(eventType.getBrowseName(), id);
            log.info("event type added: {} fields={} -> {}", eventType.getBrowseName(), eventType.getFields().keySet(), id);
            return id;
        } catch (UaRuntimeException e) {
            log.error("Failed to add event type {}: {}", eventType.getBrowseName(), UaStatus.name(e.getStatusCode()));
            return NodeId.NULL_VALUE;
        }
    }

    /** ViewsFolder 아래에 뷰 추가 */
    public NodeId addViewNode(UaView view) {
        if (!checkName("view", view.getBrowseName(), Identifiers.ViewsFolder)) {
            return NodeId.NULL_VALUE;
        }
        try {
            NodeId id = namespace.addViewNode(view).getNodeId();
            log.info("view added: {} nodes={} -> {}", view.getBrowseName(), view.getNodes().size(), id);
            return id;
        } catch (UaRuntimeException e) {
            log.error("Failed to add view {}: {}", view.getBrowseName(), UaStatus.name(e.getStatusCode()));
            return NodeId.NULL_VALUE;
        }
    }

    private boolean checkName(String kind, String browseName, NodeId parent) {
        if (browseName == null || browseName.isEmpty()) {
            log.error("Failed to add {}: {}", kind, UaStatus.name(StatusCodes.Bad_BrowseNameInvalid));
            return false;
        }
        if (server.getAddressSpaceManager().getManagedNode(parent).isEmpty()) {
            log.error("Failed to add {} {}: {}", kind, browseName, UaStatus.name(StatusCodes.Bad_ParentNodeIdInvalid));
            return false;
        }
        if (!find(browseName).resolve(parent).isNull()) {
            log.error("Failed to add {} {}: {}", kind, browseName, UaStatus.name(StatusCodes.Bad_BrowseNameDuplicated));
            return false;
        }
        return true;
    }

    /* ---------- 이벤트 ---------- */

    /**
     * 이벤트를 만들어 서버 이벤트 버스에 올린다. 기동 전에는 false.
     *
     * @param origin 이벤트 발생 노드, 보통 {@link Identifiers#Server}
     */
    public boolean triggerEvent(NodeId origin, UaEvent event) {
        UaEventType type = event.getType();
        NodeId typeId = eventTypes.get(type.getBrowseName());
        if (typeId == null) {
            log.error("Failed to trigger event: type {} is not registered", type.getBrowseName());
            return false;
        }
        if (!isRunning()) {
            log.error("Failed to trigger event {}: {} (server on port {} is not running)",
                    type.getBrowseName(), UaStatus.name(StatusCodes.Bad_InvalidState), port);
            return false;
        }
        BaseEventTypeNode node = null;
        try {
            node = server.getEventFactory().createEvent(
                    new NodeId(namespace.getNamespaceIndex(), UUID.randomUUID()), typeId);

            node.setBrowseName(namespace.qualified(type.getBrowseName()));
            node.setDisplayName(LocalizedText.english(type.getDisplayName()));
            node.setEventId(ByteString.of(eventId()));
            node.setEventType(typeId);
            node.setSourceNode(origin);
            node.setSourceName(event.getSourceName());
            node.setTime(DateTime.now());
            node.setReceiveTime(DateTime.NULL_VALUE);
            node.setMessage(LocalizedText.english(event.getMessage()));
            node.setSeverity(ushort(event.getSeverity()));

            for (Map.Entry<String, Variable> field : event.getFields().entrySet()) {
                Variable value = field.getValue();
                if (value.empty()) {
                    continue;
                }
                node.setProperty(propertyOf(field.getKey(), value), value.getValue());
            }

            server.getEventBus().post(node);
            log.debug("event triggered: type={} origin={} severity={}", type.getBrowseName(), origin, event.getSeverity());
            return true;
        } catch (UaException e) {
            log.error("Failed to trigger event {}: {}", type.getBrowseName(), UaStatus.name(e.getStatusCode()));
            return false;
        } catch (RuntimeException e) {
            log.error("Failed to trigger event {}: {}", type.getBrowseName(),
                    UaStatus.name(StatusCodes.Bad_InternalError), e);
            return false;
        } finally {
            if (node != null) {
                node.delete();
            }
        }
    }

    private QualifiedProperty<Object> propertyOf(String name, Variable value) {
        DataType dataType = value.getDataType();
        return new QualifiedProperty<>(
                server.getNamespaceTable().getUri(namespace.getNamespaceIndex()),
                name,
                dataType.getNodeId().expanded(),
                value.isArray() ? ValueRanks.OneDimension : ValueRanks.Scalar,
                Object.class
        );
    }

    private static byte[] eventId() {
        UUID uuid = UUID.randomUUID();
        return ByteBuffer.allocate(16)
                .putLong(uuid.getMostSignificantBits())
                .putLong(uuid.getLeastSignificantBits())
                .array();
    }

    /* ---------- 값 읽기/쓰기 ---------- */

    /** 변수 노드의 현재 값. 없거나 변수가 아니면 빈 Variable */
    public Variable read(NodeId nodeId) {
        return variableNode(nodeId)
                .map(node -> Variants.toVariable(node.getValue()))
                .orElseGet(Variable::new);
    }

    public boolean write(NodeId nodeId, Variable value) {
        Optional<UaVariableNode> found = variableNode(nodeId);
        if (found.isEmpty()) {
            log.warn("write {} failed: {}", nodeId, UaStatus.name(StatusCodes.Bad_NodeIdUnknown));
            return false;
        }
        UaVariableNode node = found.get();
        if (value == null || value.empty()) {
            log.warn("write {} failed: {}", nodeId, UaStatus.name(StatusCodes.Bad_TypeMismatch));
            return false;
        }
        NodeId declared = node.getDataType();
        if (!Identifiers.BaseDataType.equals(declared) && !value.getDataType().getNodeId().equals(declared)) {
            log.warn("write {} failed: {} (declared {}, given {})",
                    nodeId, UaStatus.name(StatusCodes.Bad_TypeMismatch), declared, value.getDataType());
            return false;
        }
        node.setValue(Variants.toDataValue(value));
        return true;
    }

    private Optional<UaVariableNode> variableNode(NodeId nodeId) {
        if (nodeId == null || nodeId.isNull()) {
            return Optional.empty();
        }
        Optional<UaNode> node = server.getAddressSpaceManager().getManagedNode(nodeId);
        return node.filter(UaVariableNode.class::isInstance).map(UaVariableNode.class::cast);
    }

    /* ---------- 수명 ---------- */

    /**
     * 전용 처리 스레드를 띄워 서버를 기동한다. 엔드포인트가 바인드된 뒤 반환한다.
     *
     * @throws IllegalStateException 기동 실패 (포트 사용 중 등)
     */
    public void start() {
        CompletableFuture<Void> started = new CompletableFuture<>();
        synchronized (lifecycleLock) {
            if (task != null && task.isAlive()) {
                log.warn("server on port {} is already running", port);
                return;
            }
            CountDownLatch signal = new CountDownLatch(1);
            stopSignal = signal;
            task = new Thread(() -> run(started, signal), "ua-server-" + port);
            task.setDaemon(true);
            task.start();
        }
        try {
            started.get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            stop();
        } catch (ExecutionException e) {
            join();
            throw new IllegalStateException("Failed to start OPC UA server on port " + port
                    + ": " + UaStatus.describe(e), e.getCause());
        }
    }

    private void run(CompletableFuture<Void> started, CountDownLatch signal) {
        try {
            server.startup().get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            started.completeExceptionally(e);
            return;
        } catch (ExecutionException e) {
            log.error("OPC UA server startup failed on port {}: {}", port, UaStatus.describe(e));
            shutdownQuietly();
            started.completeExceptionally(e.getCause());
            return;
        }
        running = true;
        log.info("OPC UA server started on port {}", port);
        started.complete(null);
        try {
            signal.await();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        } finally {
            running = false;
            shutdownQuietly();
            log.info("OPC UA server stopped on port {}", port);
        }
    }

    private void shutdownQuietly() {
        try {
            server.shutdown().get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        } catch (ExecutionException e) {
            log.warn("OPC UA server shutdown on port {} reported {}", port, UaStatus.describe(e));
        }
    }

    /** 처리 스레드에 종료를 알린다. 기다리지 않는다. */
    public void stop() {
        CountDownLatch signal;
        synchronized (lifecycleLock) {
            signal = stopSignal;
        }
        if (signal != null) {
            signal.countDown();
        }
    }

    /** 처리 스레드 종료를 기다린다. 처리 스레드 자신이 호출하면 바로 반환한다. */
    public void join() {
        Thread current;
        synchronized (lifecycleLock) {
            current = task;
        }
        if (current == null || current == Thread.currentThread()) {
            return;
        }
        try {
            current.join();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    public boolean isRunning() {
        return running;
    }

    @Override
    public void close() {
        stop();
        join();
        namespace.shutdown();
    }

    /* ---------- 접근자 ---------- */

    public int getNamespaceIndex() {
        return namespace.getNamespaceIndex().intValue();
    }

    public int getPort() {
        return port;
    }

    public OpcUaServer getServer() {
        return server;
    }
}
