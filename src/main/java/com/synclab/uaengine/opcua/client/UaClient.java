package com.synclab.uaengine.opcua.client;

import com.synclab.uaengine.config.UaEngineProperties;
import com.synclab.uaengine.opcua.FindNode;
import com.synclab.uaengine.opcua.FindNodeInClient;
import com.synclab.uaengine.opcua.UaStatus;
import com.synclab.uaengine.opcua.UserConfig;
import com.synclab.uaengine.opcua.model.UaView;
import com.synclab.uaengine.variable.Variable;
import com.synclab.uaengine.variable.Variants;
import org.eclipse.milo.opcua.sdk.client.OpcUaClient;
import org.eclipse.milo.opcua.sdk.client.api.config.OpcUaClientConfig;
import org.eclipse.milo.opcua.sdk.client.api.identity.AnonymousProvider;
import org.eclipse.milo.opcua.sdk.client.api.identity.IdentityProvider;
import org.eclipse.milo.opcua.sdk.client.api.identity.UsernameProvider;
import org.eclipse.milo.opcua.sdk.client.api.subscriptions.UaMonitoredItem;
import org.eclipse.milo.opcua.sdk.client.api.subscriptions.UaSubscription;
import org.eclipse.milo.opcua.stack.client.DiscoveryClient;
import org.eclipse.milo.opcua.stack.core.AttributeId;
import org.eclipse.milo.opcua.stack.core.Identifiers;
import org.eclipse.milo.opcua.stack.core.StatusCodes;
import org.eclipse.milo.opcua.stack.core.UaException;
import org.eclipse.milo.opcua.stack.core.security.SecurityPolicy;
import org.eclipse.milo.opcua.stack.core.types.builtin.DataValue;
import org.eclipse.milo.opcua.stack.core.types.builtin.ExpandedNodeId;
import org.eclipse.milo.opcua.stack.core.types.builtin.ExtensionObject;
import org.eclipse.milo.opcua.stack.core.types.builtin.LocalizedText;
import org.eclipse.milo.opcua.stack.core.types.builtin.NodeId;
import org.eclipse.milo.opcua.stack.core.types.builtin.QualifiedName;
import org.eclipse.milo.opcua.stack.core.types.builtin.StatusCode;
import org.eclipse.milo.opcua.stack.core.types.builtin.Variant;
import org.eclipse.milo.opcua.stack.core.types.builtin.unsigned.UInteger;
import org.eclipse.milo.opcua.stack.core.types.enumerated.MonitoringMode;
import org.eclipse.milo.opcua.stack.core.types.enumerated.NodeAttributesMask;
import org.eclipse.milo.opcua.stack.core.types.enumerated.NodeClass;
import org.eclipse.milo.opcua.stack.core.types.enumerated.TimestampsToReturn;
import org.eclipse.milo.opcua.stack.core.types.structured.AddNodesItem;
import org.eclipse.milo.opcua.stack.core.types.structured.AddNodesResponse;
import org.eclipse.milo.opcua.stack.core.types.structured.AddNodesResult;
import org.eclipse.milo.opcua.stack.core.types.structured.AddReferencesItem;
import org.eclipse.milo.opcua.stack.core.types.structured.AddReferencesResponse;
import org.eclipse.milo.opcua.stack.core.types.structured.CallMethodRequest;
import org.eclipse.milo.opcua.stack.core.types.structured.CallMethodResult;
import org.eclipse.milo.opcua.stack.core.types.structured.ContentFilter;
import org.eclipse.milo.opcua.stack.core.types.structured.EndpointDescription;
import org.eclipse.milo.opcua.stack.core.types.structured.EventFilter;
import org.eclipse.milo.opcua.stack.core.types.structured.MonitoredItemCreateRequest;
import org.eclipse.milo.opcua.stack.core.types.structured.MonitoringParameters;
import org.eclipse.milo.opcua.stack.core.types.structured.ReadValueId;
import org.eclipse.milo.opcua.stack.core.types.structured.SimpleAttributeOperand;
import org.eclipse.milo.opcua.stack.core.types.structured.ViewAttributes;
import org.eclipse.milo.opcua.stack.core.util.EndpointUtil;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;

import static org.eclipse.milo.opcua.stack.core.types.builtin.unsigned.Unsigned.ubyte;
import static org.eclipse.milo.opcua.stack.core.types.builtin.unsigned.Unsigned.uint;

/**
 * OPC UA 클라이언트.
 * <p>
 * 감시 항목 레지스트리(NodeId → subscription id, monitored item id, 콜백)를 관리하고
 * {@link #spinOnce()} / {@link #spin()} 을 호출한 스레드에서 알림과 타이머 콜백을 실행한다.
 * Milo 수신 스레드는 항목별 큐에 알림을 넣기만 하므로 콜백끼리, 혹은 같은 루프에서 보낸
 * 동기 요청과 콜백이 동시에 실행되는 일은 없다.
 * <p>
 * 한 인스턴스는 한 소유자 스레드에서만 사용해야 한다. 레지스트리에는 잠금이 없다.
 */
public class UaClient implements ClientView, AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(UaClient.class);

    public static final int DEFAULT_QUEUE_SIZE = 10;

    private static final int EVENT_QUEUE_SIZE = 10;

    /** BaseEventType 에 정의된 필드, 네임스페이스 0 으로 찾는다 */
    private static final Set<String> BASE_EVENT_FIELDS = Set.of(
            "EventId", "EventType", "SourceNode", "SourceName", "Time",
            "ReceiveTime", "LocalTime", "Message", "Severity");

    private final String address;
    private final UaEngineProperties.Client settings;
    private final String namespaceUri;
    private final OpcUaClient client;
    private final int namespaceIndex;

    private final Map<NodeId, MonitorEntry<?>> registry = new LinkedHashMap<>();
    private final List<ClientTimer> timers = new ArrayList<>();
    private final Semaphore signal = new Semaphore(0);
    private UaSubscription subscription;
    private volatile boolean shutdown;

    public UaClient(String address) {
        this(address, null, new UaEngineProperties());
    }

    public UaClient(String address, UserConfig user) {
        this(address, user, new UaEngineProperties());
    }

    /**
     * 연결에 실패해도 예외를 던지지 않는다. {@link #ok()} 로 확인한다.
     */
    public UaClient(String address, UserConfig user, UaEngineProperties properties) {
        this.address = address;
        this.settings = properties.getClient();
        this.namespaceUri = properties.getNamespaceUri();
        this.client = connect(address, user);
        this.namespaceIndex = client == null ? 1 : resolveNamespaceIndex();
    }

    private OpcUaClient connect(String address, UserConfig user) {
        try {
            List<EndpointDescription> endpoints = DiscoveryClient.getEndpoints(address).get();
            EndpointDescription endpoint = endpoints.stream()
                    .filter(e -> SecurityPolicy.None.getUri().equals(e.getSecurityPolicyUri()))
                    .findFirst()
                    .orElseThrow(() -> new UaException(
                            StatusCodes.Bad_SecurityPolicyRejected,
                            "No endpoint without security at " + address));
            EndpointDescription reachable = EndpointUtil.updateUrl(
                    endpoint, EndpointUtil.getHost(address), EndpointUtil.getPort(address));

            IdentityProvider identity = user == null
                    ? new AnonymousProvider()
                    : new UsernameProvider(user.getUsername(), user.getPassword());

            OpcUaClientConfig config = OpcUaClientConfig.builder()
                    .setApplicationName(LocalizedText.english(settings.getApplicationName()))
                    .setApplicationUri(settings.getApplicationUri())
                    .setEndpoint(reachable)
                    .setIdentityProvider(identity)
                    .setRequestTimeout(uint(settings.getRequestTimeout()))
                    .build();

            OpcUaClient created = OpcUaClient.create(config);
            created.connect().get();
            log.info("OPC UA client connected to {}", address);
            return created;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.error("OPC UA client connect to {} interrupted", address);
        } catch (ExecutionException | UaException e) {
            log.error("Failed to connect to {}: {}", address, UaStatus.describe(e));
        }
        return null;
    }

    /** 서버 NamespaceArray 에서 엔진 네임스페이스 인덱스를 찾는다. 없으면 1 */
    private int resolveNamespaceIndex() {
        Variable array = read(Identifiers.Server_NamespaceArray);
        if (!array.empty() && array.isArray()) {
            List<String> uris = Arrays.asList(array.cast(String[].class));
            int index = uris.indexOf(namespaceUri);
            if (index >= 0) {
                return index;
            }
        }
        log.warn("namespace {} not found on {}, using 1", namespaceUri, address);
        return 1;
    }

    /** 연결되어 있고 종료되지 않았으면 true */
    public boolean ok() {
        return client != null && !shutdown;
    }

    public int getNamespaceIndex() {
        return namespaceIndex;
    }

    /* ---------- 동기 요청 ---------- */

    @Override
    public FindNode find(String browseName) {
        return find(browseName, namespaceIndex);
    }

    @Override
    public FindNode find(String browseName, int namespaceIndex) {
        return new FindNodeInClient(ok() ? client : null, browseName, namespaceIndex);
    }

    @Override
    public Variable read(NodeId nodeId) {
        if (client == null || shutdown) {
            return new Variable();
        }
        Optional<DataValue> value = await("read " + nodeId,
                client.readValue(0.0, TimestampsToReturn.Both, nodeId));
        if (value.isEmpty()) {
            return new Variable();
        }
        StatusCode status = value.get().getStatusCode();
        if (status != null && !status.isGood()) {
            log.warn("read {} failed: {}", nodeId, UaStatus.name(status));
            return new Variable();
        }
        return Variants.toVariable(value.get());
    }

    @Override
    public boolean write(NodeId nodeId, Variable value) {
        if (!ok()) {
            return false;
        }
        if (value == null || value.empty()) {
            log.warn("write {} skipped: empty value", nodeId);
            return false;
        }
        DataValue dataValue = new DataValue(Variants.toVariant(value), null, null);
        Optional<StatusCode> status = await("write " + nodeId, client.writeValue(nodeId, dataValue));
        if (status.isEmpty()) {
            return false;
        }
        if (!status.get().isGood()) {
            log.warn("write {} failed: {}", nodeId, UaStatus.name(status.get()));
            return false;
        }
        return true;
    }

    @Override
    public boolean call(NodeId objectId, String methodName, List<Variable> inputs, List<Variable> outputs) {
        if (!ok()) {
            return false;
        }
        NodeId methodId = find(methodName).resolve(objectId);
        if (methodId.isNull()) {
            log.warn("call {} failed: method not found under {}", methodName, objectId);
            return false;
        }
        Variant[] arguments = inputs.stream().map(Variants::toVariant).toArray(Variant[]::new);
        Optional<CallMethodResult> result = await("call " + methodName,
                client.call(new CallMethodRequest(objectId, methodId, arguments)));
        if (result.isEmpty()) {
            return false;
        }
        if (!result.get().getStatusCode().isGood()) {
            log.warn("call {} failed: {}", methodName, UaStatus.name(result.get().getStatusCode()));
            return false;
        }
        outputs.clear();
        Variant[] values = result.get().getOutputArguments();
        if (values != null) {
            for (Variant value : values) {
                outputs.add(Variants.toVariable(value));
            }
        }
        return true;
    }

    @Override
    public boolean call(String methodName, List<Variable> inputs, List<Variable> outputs) {
        return call(Identifiers.ObjectsFolder, methodName, inputs, outputs);
    }

    /**
     * AddNodes 서비스로 ViewsFolder 아래에 뷰를 만들고, 포함할 노드를 AddReferences 로
     * Organizes 참조에 묶는다.
     *
     * @return 새 뷰의 NodeId, 실패하면 {@link NodeId#NULL_VALUE}
     */
    public NodeId addViewNode(UaView view) {
        if (!ok()) {
            return NodeId.NULL_VALUE;
        }
        String name = view.getBrowseName();
        if (name == null || name.isEmpty()) {
            log.error("add view failed: {}", UaStatus.name(StatusCodes.Bad_BrowseNameInvalid));
            return NodeId.NULL_VALUE;
        }
        ViewAttributes attributes = new ViewAttributes(
                uint(NodeAttributesMask.View.getValue()),
                LocalizedText.english(view.getDisplayName()),
                LocalizedText.english(view.getDescription()),
                uint(0),
                uint(0),
                true,
                ubyte(0)
        );
        AddNodesItem item = new AddNodesItem(
                Identifiers.ViewsFolder.expanded(),
                Identifiers.Organizes,
                new NodeId(namespaceIndex, "view:" + name).expanded(),
                new QualifiedName(namespaceIndex, name),
                NodeClass.View,
                ExtensionObject.encode(client.getStaticSerializationContext(), attributes),
                ExpandedNodeId.NULL_VALUE
        );
        Optional<AddNodesResponse> added = await("add view " + name, client.addNodes(List.of(item)));
        if (added.isEmpty()) {
            return NodeId.NULL_VALUE;
        }
        AddNodesResult[] results = added.get().getResults();
        if (results == null || results.length == 0) {
            log.error("add view {} failed: no result", name);
            return NodeId.NULL_VALUE;
        }
        if (!results[0].getStatusCode().isGood()) {
            log.error("add view {} failed: {}", name, UaStatus.name(results[0].getStatusCode()));
            return NodeId.NULL_VALUE;
        }
        NodeId viewId = results[0].getAddedNodeId();
        if (view.getNodes().isEmpty()) {
            return viewId;
        }

        List<AddReferencesItem> references = new ArrayList<>();
        for (NodeId member : view.getNodes()) {
            references.add(new AddReferencesItem(
                    viewId, Identifiers.Organizes, true, null, member.expanded(), NodeClass.Unspecified));
        }
        Optional<AddReferencesResponse> linked = await("organize view " + name, client.addReferences(references));
        if (linked.isEmpty()) {
            return NodeId.NULL_VALUE;
        }
        StatusCode[] statuses = linked.get().getResults();
        for (int i = 0; statuses != null && i < statuses.length; i++) {
            if (!statuses[i].isGood()) {
                log.warn("view {} could not organize {}: {}",
                        name, view.getNodes().get(i), UaStatus.name(statuses[i]));
            }
        }
        log.info("view added: {} nodes={} -> {}", name, view.getNodes().size(), viewId);
        return viewId;
    }

    private <T> Optional<T> await(String operation, CompletableFuture<T> future) {
        try {
            return Optional.ofNullable(future.get());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("{} interrupted", operation);
        } catch (ExecutionException e) {
            log.error("{} failed: {}", operation, UaStatus.describe(e));
        }
        return Optional.empty();
    }

    /* ---------- 감시 항목 ---------- */

    public boolean monitor(NodeId nodeId, DataChangeNotificationCallback callback) {
        return monitor(nodeId, callback, DEFAULT_QUEUE_SIZE);
    }

    /**
     * 데이터 변경 감시 등록.
     *
     * @param queueSize 항목별 알림 큐 크기. 가득 차면 가장 오래된 알림을 덮어쓴다.
     *                  0 은 서버가 1 로 조정한다
     * @return 이미 감시 중이거나 등록이 실패하면 false
     */
    public boolean monitor(NodeId nodeId, DataChangeNotificationCallback callback, int queueSize) {
        if (!ok() || rejectDuplicate(nodeId)) {
            return false;
        }
        if (queueSize < 0) {
            log.warn("monitor {} rejected: queue size {} is negative", nodeId, queueSize);
            return false;
        }
        MonitorEntry<Variable> entry = new MonitorEntry<>(nodeId, Math.max(1, queueSize), callback::onDataChange);
        return register(entry, subscription -> {
            MonitoringParameters parameters = new MonitoringParameters(
                    subscription.nextClientHandle(),
                    settings.getSamplingInterval(),
                    null,
                    uint(queueSize),
                    true
            );
            ReadValueId readValueId = new ReadValueId(nodeId, AttributeId.Value.uid(), null, QualifiedName.NULL_VALUE);
            return new MonitoredItemCreateRequest(readValueId, MonitoringMode.Reporting, parameters);
        }, item -> item.setValueConsumer(value -> {
            entry.enqueue(Variants.toVariable(value));
            signal.release();
        }));
    }

    /**
     * 이벤트 감시 등록. 지정한 필드만 선택하는 이벤트 필터를 건다.
     *
     * @param nodeId 이벤트 알림 노드, 보통 {@link Identifiers#Server}
     * @param names  선택할 이벤트 필드 이름
     */
    public boolean monitor(NodeId nodeId, List<String> names, EventNotificationCallback callback) {
        if (!ok() || rejectDuplicate(nodeId)) {
            return false;
        }
        SimpleAttributeOperand[] selects = names.stream()
                .map(name -> new SimpleAttributeOperand(
                        Identifiers.BaseEventType,
                        new QualifiedName[]{eventField(name)},
                        AttributeId.Value.uid(),
                        null))
                .toArray(SimpleAttributeOperand[]::new);
        EventFilter filter = new EventFilter(selects, new ContentFilter(null));

        MonitorEntry<List<Variable>> entry = new MonitorEntry<>(nodeId, EVENT_QUEUE_SIZE, callback::onEvent);
        return register(entry, subscription -> {
            MonitoringParameters parameters = new MonitoringParameters(
                    subscription.nextClientHandle(),
                    0.0,
                    ExtensionObject.encode(client.getStaticSerializationContext(), filter),
                    uint(EVENT_QUEUE_SIZE),
                    true
            );
            ReadValueId readValueId = new ReadValueId(
                    nodeId, AttributeId.EventNotifier.uid(), null, QualifiedName.NULL_VALUE);
            return new MonitoredItemCreateRequest(readValueId, MonitoringMode.Reporting, parameters);
        }, item -> item.setEventConsumer(values -> {
            List<Variable> fields = new ArrayList<>(values.length);
            for (Variant value : values) {
                fields.add(Variants.toVariable(value));
            }
            entry.enqueue(fields);
            signal.release();
        }));
    }

    private QualifiedName eventField(String name) {
        return BASE_EVENT_FIELDS.contains(name)
                ? new QualifiedName(0, name)
                : new QualifiedName(namespaceIndex, name);
    }

    private boolean rejectDuplicate(NodeId nodeId) {
        if (registry.containsKey(nodeId)) {
            log.warn("monitor {} rejected: node is already monitored", nodeId);
            return true;
        }
        return false;
    }

    @FunctionalInterface
    private interface RequestFactory {
        MonitoredItemCreateRequest create(UaSubscription subscription);
    }

    @FunctionalInterface
    private interface ItemBinder {
        void bind(UaMonitoredItem item);
    }

    private boolean register(MonitorEntry<?> entry, RequestFactory requestFactory, ItemBinder binder) {
        UaSubscription current = ensureSubscription();
        if (current == null) {
            return false;
        }
        MonitoredItemCreateRequest request = requestFactory.create(current);
        Optional<List<UaMonitoredItem>> created = await("monitor " + entry.getNodeId(),
                current.createMonitoredItems(TimestampsToReturn.Both, List.of(request),
                        (item, index) -> binder.bind(item)));
        if (created.isEmpty() || created.get().isEmpty()) {
            releaseSubscriptionIfUnused();
            return false;
        }
        UaMonitoredItem item = created.get().get(0);
        if (!item.getStatusCode().isGood()) {
            log.error("monitor {} failed: {}", entry.getNodeId(), UaStatus.name(item.getStatusCode()));
            releaseSubscriptionIfUnused();
            return false;
        }
        entry.bind(current.getSubscriptionId(), item);
        registry.put(entry.getNodeId(), entry);
        log.debug("monitor {} registered: subscription={} item={}",
                entry.getNodeId(), entry.getSubscriptionId(), entry.getMonitoredItemId());
        return true;
    }

    private UaSubscription ensureSubscription() {
        if (subscription == null) {
            subscription = await("create subscription",
                    client.getSubscriptionManager().createSubscription(settings.getPublishingInterval()))
                    .orElse(null);
        }
        return subscription;
    }

    private void releaseSubscriptionIfUnused() {
        if (subscription != null && registry.isEmpty()) {
            UaSubscription current = subscription;
            subscription = null;
            await("delete subscription", client.getSubscriptionManager().deleteSubscription(current.getSubscriptionId()));
        }
    }

    /**
     * 감시 해제. 서버 쪽 항목 삭제가 확인된 뒤에 콜백을 놓으므로, true 를 반환한 뒤에는
     * 해당 노드의 콜백이 다시 실행되지 않는다. 콜백 안에서 호출해도 된다.
     *
     * @return 감시 중이 아니거나 삭제가 실패하면 false
     */
    public boolean remove(NodeId nodeId) {
        MonitorEntry<?> entry = registry.get(nodeId);
        if (entry == null) {
            return false;
        }
        if (client == null || subscription == null) {
            return false;
        }
        Optional<List<StatusCode>> deleted = await("remove " + nodeId,
                subscription.deleteMonitoredItems(List.of(entry.getItem())));
        if (deleted.isEmpty()) {
            return false;
        }
        StatusCode status = deleted.get().isEmpty() ? StatusCode.GOOD : deleted.get().get(0);
        if (!status.isGood()) {
            log.warn("remove {} failed: {}", nodeId, UaStatus.name(status));
            return false;
        }
        entry.deactivate();
        registry.remove(nodeId);
        releaseSubscriptionIfUnused();
        log.debug("monitor {} removed", nodeId);
        return true;
    }

    public boolean isMonitored(NodeId nodeId) {
        return registry.containsKey(nodeId);
    }

    /** 등록된 (subscription id, monitored item id), 없으면 empty */
    public Optional<UInteger[]> registrationOf(NodeId nodeId) {
        MonitorEntry<?> entry = registry.get(nodeId);
        if (entry == null) {
            return Optional.empty();
        }
        return Optional.of(new UInteger[]{entry.getSubscriptionId(), entry.getMonitoredItemId()});
    }

    /* ---------- 이벤트 루프 ---------- */

    void register(ClientTimer timer) {
        timers.add(timer);
    }

    void unregister(ClientTimer timer) {
        timers.remove(timer);
    }

    /**
     * 호출 시점에 쌓인 알림을 모두 전달하고 주기가 된 타이머를 실행한 뒤 반환한다.
     *
     * @return 실행한 콜백 수
     */
    public int spinOnce() {
        if (shutdown) {
            return 0;
        }
        int fired = 0;
        for (MonitorEntry<?> entry : new ArrayList<>(registry.values())) {
            if (entry.isActive()) {
                fired += entry.drain(this);
            }
        }
        long now = System.nanoTime();
        for (ClientTimer timer : new ArrayList<>(timers)) {
            if (timer.fireIfDue(now)) {
                fired++;
            }
        }
        return fired;
    }

    /** {@link #shutdown()} 또는 인터럽트 전까지 알림을 처리한다. */
    public void spin() {
        while (!shutdown && !Thread.currentThread().isInterrupted()) {
            spinOnce();
            try {
                if (signal.tryAcquire(settings.getSpinTimeout(), TimeUnit.MILLISECONDS)) {
                    signal.drainPermits();
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }
    }

    /**
     * 모든 감시 항목과 타이머를 정리하고 연결을 끊는다. 반환 후에는 콜백이 실행되지 않는다.
     */
    public void shutdown() {
        if (shutdown) {
            return;
        }
        shutdown = true;
        registry.values().forEach(MonitorEntry::deactivate);
        registry.clear();
        new ArrayList<>(timers).forEach(ClientTimer::cancel);
        if (client != null) {
            if (subscription != null) {
                UaSubscription current = subscription;
                subscription = null;
                await("delete subscription",
                        client.getSubscriptionManager().deleteSubscription(current.getSubscriptionId()));
            }
            await("disconnect " + address, client.disconnect());
            log.info("OPC UA client disconnected from {}", address);
        }
        signal.release();
    }

    @Override
    public void close() {
        shutdown();
    }

    public String getAddress() {
        return address;
    }
}
