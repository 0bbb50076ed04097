package com.synclab.uaengine.opcua;

import com.synclab.uaengine.opcua.model.MethodArgument;
import com.synclab.uaengine.opcua.model.UaEventType;
import com.synclab.uaengine.opcua.model.UaMethod;
import com.synclab.uaengine.opcua.model.UaObject;
import com.synclab.uaengine.opcua.model.UaView;
import com.synclab.uaengine.variable.DataType;
import com.synclab.uaengine.variable.Variable;
import com.synclab.uaengine.variable.VariableType;
import com.synclab.uaengine.variable.Variants;
import org.eclipse.milo.opcua.sdk.core.AccessLevel;
import org.eclipse.milo.opcua.sdk.core.Reference;
import org.eclipse.milo.opcua.sdk.core.ValueRanks;
import org.eclipse.milo.opcua.sdk.server.OpcUaServer;
import org.eclipse.milo.opcua.sdk.server.api.DataItem;
import org.eclipse.milo.opcua.sdk.server.api.ManagedNamespaceWithLifecycle;
import org.eclipse.milo.opcua.sdk.server.api.MonitoredItem;
import org.eclipse.milo.opcua.sdk.server.api.methods.AbstractMethodInvocationHandler;
import org.eclipse.milo.opcua.sdk.server.api.services.NodeManagementServices.AddNodesContext;
import org.eclipse.milo.opcua.sdk.server.api.services.NodeManagementServices.AddReferencesContext;
import org.eclipse.milo.opcua.sdk.server.nodes.UaMethodNode;
import org.eclipse.milo.opcua.sdk.server.nodes.UaObjectNode;
import org.eclipse.milo.opcua.sdk.server.nodes.UaObjectTypeNode;
import org.eclipse.milo.opcua.sdk.server.nodes.UaVariableNode;
import org.eclipse.milo.opcua.sdk.server.nodes.UaVariableTypeNode;
import org.eclipse.milo.opcua.sdk.server.nodes.UaViewNode;
import org.eclipse.milo.opcua.sdk.server.util.SubscriptionModel;
import org.eclipse.milo.opcua.stack.core.Identifiers;
import org.eclipse.milo.opcua.stack.core.NamespaceTable;
import org.eclipse.milo.opcua.stack.core.StatusCodes;
import org.eclipse.milo.opcua.stack.core.UaException;
import org.eclipse.milo.opcua.stack.core.UaSerializationException;
import org.eclipse.milo.opcua.stack.core.types.builtin.DataValue;
import org.eclipse.milo.opcua.stack.core.types.builtin.DateTime;
import org.eclipse.milo.opcua.stack.core.types.builtin.ExpandedNodeId;
import org.eclipse.milo.opcua.stack.core.types.builtin.LocalizedText;
import org.eclipse.milo.opcua.stack.core.types.builtin.NodeId;
import org.eclipse.milo.opcua.stack.core.types.builtin.QualifiedName;
import org.eclipse.milo.opcua.stack.core.types.builtin.StatusCode;
import org.eclipse.milo.opcua.stack.core.types.builtin.Variant;
import org.eclipse.milo.opcua.stack.core.types.builtin.unsigned.UByte;
import org.eclipse.milo.opcua.stack.core.types.builtin.unsigned.UInteger;
import org.eclipse.milo.opcua.stack.core.types.enumerated.NodeClass;
import org.eclipse.milo.opcua.stack.core.types.structured.AddNodesItem;
import org.eclipse.milo.opcua.stack.core.types.structured.AddNodesResult;
import org.eclipse.milo.opcua.stack.core.types.structured.AddReferencesItem;
import org.eclipse.milo.opcua.stack.core.types.structured.Argument;
import org.eclipse.milo.opcua.stack.core.types.structured.ViewAttributes;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

import static org.eclipse.milo.opcua.stack.core.types.builtin.unsigned.Unsigned.ubyte;
import static org.eclipse.milo.opcua.stack.core.types.builtin.unsigned.Unsigned.uint;

/**
 * 엔진이 추가하는 모든 노드를 담는 네임스페이스.
 * 노드 생성과 참조 연결만 담당하고, 이름 충돌 검사나 부모 검증은 {@link UaServer} 가 한다.
 */
public class EngineNamespace extends ManagedNamespaceWithLifecycle {

    private static final Logger log = LoggerFactory.getLogger(EngineNamespace.class);

    private final SubscriptionModel subscriptionModel;
    private final AtomicInteger nodeCounter = new AtomicInteger(1);

    public EngineNamespace(OpcUaServer server, String namespaceUri) {
        super(server, namespaceUri);
        this.subscriptionModel = new SubscriptionModel(server, this);
        getLifecycleManager().addLifecycle(subscriptionModel);
    }

    public NodeId nextNodeId() {
        return new NodeId(getNamespaceIndex(), uint(nodeCounter.getAndIncrement()));
    }

    public QualifiedName qualified(String name) {
        return new QualifiedName(getNamespaceIndex(), name);
    }

    /** parent → child 정방향과 역방향 참조를 함께 등록 */
    public void link(NodeId parent, NodeId referenceType, NodeId child) {
        getNodeContext().getNodeManager().addReference(
                new Reference(parent, referenceType, child.expanded(), true));
        getNodeContext().getNodeManager().addReference(
                new Reference(child, referenceType, parent.expanded(), false));
    }

    UaVariableTypeNode addVariableTypeNode(VariableType type) {
        DataType dataType = type.getDataType();
        UaVariableTypeNode node = new UaVariableTypeNode(
                getNodeContext(),
                nextNodeId(),
                qualified(type.getBrowseName()),
                LocalizedText.english(displayName(type.getDisplayName(), type.getBrowseName())),
                LocalizedText.english(type.getDescription()),
                uint(0),
                uint(0),
                new DataValue(Variants.toVariant(type), StatusCode.GOOD, DateTime.now()),
                dataType == null ? Identifiers.BaseDataType : dataType.getNodeId(),
                type.isArray() ? ValueRanks.OneDimension : ValueRanks.Scalar,
                type.isArray() ? new UInteger[]{uint(0)} : null,
                false
        );
        getNodeContext().getNodeManager().addNode(node);
        link(Identifiers.BaseDataVariableType, Identifiers.HasSubtype, node.getNodeId());
        return node;
    }

    UaVariableNode addVariableNode(NodeId parent, NodeId referenceType, Variable variable, NodeId typeDefinition) {
        UaVariableNode node = buildVariableNode(variable, typeDefinition);
        getNodeContext().getNodeManager().addNode(node);
        link(parent, referenceType, node.getNodeId());
        log.debug("[variable] {} = {}", variable.getBrowseName(), variable);
        return node;
    }

    private UaVariableNode buildVariableNode(Variable variable, NodeId typeDefinition) {
        DataType dataType = variable.getDataType();
        EnumSet<AccessLevel> access = EnumSet.noneOf(AccessLevel.class);
        if ((variable.getAccessLevel() & Variable.READ) != 0) {
            access.add(AccessLevel.CurrentRead);
        }
        if ((variable.getAccessLevel() & Variable.WRITE) != 0) {
            access.add(AccessLevel.CurrentWrite);
        }
        UaVariableNode.UaVariableNodeBuilder builder = UaVariableNode.builder(getNodeContext())
                .setNodeId(nextNodeId())
                .setBrowseName(qualified(variable.getBrowseName()))
                .setDisplayName(LocalizedText.english(displayName(variable.getDisplayName(), variable.getBrowseName())))
                .setDescription(LocalizedText.english(variable.getDescription()))
                .setTypeDefinition(typeDefinition)
                .setDataType(dataType == null ? Identifiers.BaseDataType : dataType.getNodeId())
                .setValueRank(variable.isArray() ? ValueRanks.OneDimension : ValueRanks.Scalar)
                .setMinimumSamplingInterval(0.0)
                .setAccessLevel(AccessLevel.toValue(access))
                .setUserAccessLevel(AccessLevel.toValue(access))
                .setValue(Variants.toDataValue(variable));
        if (variable.isArray()) {
            builder.setArrayDimensions(new UInteger[]{uint(0)});
        }
        return builder.build();
    }

    UaObjectNode addObjectNode(NodeId parent, UaObject object) {
        UaObjectNode node = UaObjectNode.builder(getNodeContext())
                .setNodeId(nextNodeId())
                .setBrowseName(qualified(object.getBrowseName()))
                .setDisplayName(LocalizedText.english(object.getDisplayName()))
                .setDescription(LocalizedText.english(object.getDescription()))
                .setTypeDefinition(Identifiers.BaseObjectType)
                .build();
        getNodeContext().getNodeManager().addNode(node);
        link(parent, Identifiers.Organizes, node.getNodeId());

        for (Variable variable : object.getVariables()) {
            addVariableNode(node.getNodeId(), Identifiers.HasComponent, variable, Identifiers.BaseDataVariableType);
        }
        for (UaMethod method : object.getMethods()) {
            addMethodNode(node.getNodeId(), method);
        }
        return node;
    }

    UaMethodNode addMethodNode(NodeId parent, UaMethod method) {
        UaMethodNode node = UaMethodNode.builder(getNodeContext())
                .setNodeId(nextNodeId())
                .setBrowseName(qualified(method.getBrowseName()))
                .setDisplayName(LocalizedText.english(method.getDisplayName()))
                .setDescription(LocalizedText.english(method.getDescription()))
                .setExecutable(true)
                .setUserExecutable(true)
                .build();

        CallbackInvocationHandler handler = new CallbackInvocationHandler(node, method);
        node.setInputArguments(handler.getInputArguments());
        node.setOutputArguments(handler.getOutputArguments());
        node.setInvocationHandler(handler);

        getNodeContext().getNodeManager().addNode(node);
        link(parent, Identifiers.HasComponent, node.getNodeId());
        return node;
    }

    UaObjectTypeNode addEventTypeNode(UaEventType eventType) {
        UaObjectTypeNode node = UaObjectTypeNode.builder(getNodeContext())
                .setNodeId(nextNodeId())
                .setBrowseName(qualified(eventType.getBrowseName()))
                .setDisplayName(LocalizedText.english(eventType.getDisplayName()))
                .setDescription(LocalizedText.english(eventType.getDescription()))
                .setIsAbstract(false)
                .build();
        getNodeContext().getNodeManager().addNode(node);
        link(Identifiers.BaseEventType, Identifiers.HasSubtype, node.getNodeId());

        // 필드마다 Mandatory property, 이벤트 인스턴스 생성 시 복제된다
        eventType.getFields().forEach((name, value) -> {
            Variable field = new Variable(value.getValue());
            field.setBrowseName(name);
            field.setDisplayName(name);
            UaVariableNode property = buildVariableNode(field, Identifiers.PropertyType);
            getNodeContext().getNodeManager().addNode(property);
            link(node.getNodeId(), Identifiers.HasProperty, property.getNodeId());
            getNodeContext().getNodeManager().addReference(new Reference(
                    property.getNodeId(),
                    Identifiers.HasModellingRule,
                    Identifiers.ModellingRule_Mandatory.expanded(),
                    true
            ));
        });
        return node;
    }

    UaViewNode addViewNode(UaView view) {
        UaViewNode node = createViewNode(
                nextNodeId(),
                qualified(view.getBrowseName()),
                LocalizedText.english(view.getDisplayName()),
                LocalizedText.english(view.getDescription()),
                true,
                ubyte(0)
        );
        link(Identifiers.ViewsFolder, Identifiers.Organizes, node.getNodeId());
        for (NodeId member : view.getNodes()) {
            organize(node.getNodeId(), member.expanded());
        }
        return node;
    }

    private UaViewNode createViewNode(NodeId nodeId, QualifiedName browseName, LocalizedText displayName,
                                      LocalizedText description, boolean containsNoLoops, UByte eventNotifier) {
        UaViewNode node = new UaViewNode(
                getNodeContext(),
                nodeId,
                browseName,
                displayName == null ? LocalizedText.english(browseName.getName()) : displayName,
                description == null ? LocalizedText.NULL_VALUE : description,
                uint(0),
                uint(0),
                containsNoLoops,
                eventNotifier == null ? ubyte(0) : eventNotifier
        );
        getNodeContext().getNodeManager().addNode(node);
        return node;
    }

    private void organize(NodeId view, ExpandedNodeId member) {
        getNodeContext().getNodeManager().addReference(
                new Reference(view, Identifiers.Organizes, member, true));
    }

    /* ---------- NodeManagementServices ---------- */

    /**
     * 클라이언트의 AddNodes 요청. 이 네임스페이스의 NodeId 를 요청한 뷰 노드만 만든다.
     */
    @Override
    public void addNodes(AddNodesContext context, List<AddNodesItem> nodesToAdd) {
        List<AddNodesResult> results = new ArrayList<>(nodesToAdd.size());
        for (AddNodesItem item : nodesToAdd) {
            results.add(addNode(item));
        }
        context.success(results);
    }

    private AddNodesResult addNode(AddNodesItem item) {
        NamespaceTable namespaceTable = getServer().getNamespaceTable();
        String name = item.getBrowseName() == null ? null : item.getBrowseName().getName();
        if (item.getNodeClass() != NodeClass.View) {
            return rejected(name, StatusCodes.Bad_NodeClassInvalid);
        }
        if (name == null || name.isEmpty()) {
            return rejected(name, StatusCodes.Bad_BrowseNameInvalid);
        }
        NodeId parent = item.getParentNodeId() == null
                ? NodeId.NULL_VALUE
                : item.getParentNodeId().toNodeId(namespaceTable).orElse(NodeId.NULL_VALUE);
        if (parent.isNull() || getServer().getAddressSpaceManager().getManagedNode(parent).isEmpty()) {
            return rejected(name, StatusCodes.Bad_ParentNodeIdInvalid);
        }
        NodeId nodeId = item.getRequestedNewNodeId().toNodeId(namespaceTable).orElse(NodeId.NULL_VALUE);
        if (nodeId.isNull()) {
            nodeId = nextNodeId();
        } else if (getNodeContext().getNodeManager().containsNode(nodeId)) {
            return rejected(name, StatusCodes.Bad_NodeIdExists);
        }
        FindNodeInServer sibling = new FindNodeInServer(
                getServer(), name, item.getBrowseName().getNamespaceIndex().intValue());
        if (!sibling.resolve(parent).isNull()) {
            return rejected(name, StatusCodes.Bad_BrowseNameDuplicated);
        }

        ViewAttributes attributes;
        try {
            Object decoded = item.getNodeAttributes() == null
                    ? null
                    : item.getNodeAttributes().decode(getServer().getSerializationContext());
            if (!(decoded instanceof ViewAttributes)) {
                return rejected(name, StatusCodes.Bad_NodeAttributesInvalid);
            }
            attributes = (ViewAttributes) decoded;
        } catch (UaSerializationException e) {
            return rejected(name, e.getStatusCode().getValue());
        }

        UaViewNode node = createViewNode(
                nodeId,
                item.getBrowseName(),
                attributes.getDisplayName(),
                attributes.getDescription(),
                !Boolean.FALSE.equals(attributes.getContainsNoLoops()),
                attributes.getEventNotifier()
        );
        NodeId referenceType = item.getReferenceTypeId() == null ? Identifiers.Organizes : item.getReferenceTypeId();
        link(parent, referenceType, node.getNodeId());
        log.info("[AddNodes] view {} -> {}", name, node.getNodeId());
        return new AddNodesResult(StatusCode.GOOD, node.getNodeId());
    }

    private static AddNodesResult rejected(String name, long status) {
        log.warn("[AddNodes] {} rejected: {}", name, UaStatus.name(status));
        return new AddNodesResult(new StatusCode(status), NodeId.NULL_VALUE);
    }

    /**
     * 클라이언트의 AddReferences 요청. 원본 노드가 이 네임스페이스에 있는 정방향 참조만 받는다.
     */
    @Override
    public void addReferences(AddReferencesContext context, List<AddReferencesItem> referencesToAdd) {
        List<StatusCode> results = new ArrayList<>(referencesToAdd.size());
        for (AddReferencesItem item : referencesToAdd) {
            results.add(new StatusCode(addReference(item)));
        }
        context.success(results);
    }

    private long addReference(AddReferencesItem item) {
        if (!getNodeContext().getNodeManager().containsNode(item.getSourceNodeId())) {
            return StatusCodes.Bad_SourceNodeIdInvalid;
        }
        NodeId target = item.getTargetNodeId().toNodeId(getServer().getNamespaceTable()).orElse(NodeId.NULL_VALUE);
        if (target.isNull() || getServer().getAddressSpaceManager().getManagedNode(target).isEmpty()) {
            return StatusCodes.Bad_TargetNodeIdInvalid;
        }
        if (!Boolean.TRUE.equals(item.getIsForward())) {
            return StatusCodes.Bad_NotSupported;
        }
        getNodeContext().getNodeManager().addReference(
                new Reference(item.getSourceNodeId(), item.getReferenceTypeId(), item.getTargetNodeId(), true));
        log.debug("[AddReferences] {} -> {}", item.getSourceNodeId(), target);
        return StatusCode.GOOD.getValue();
    }

    private static String displayName(String displayName, String browseName) {
        return displayName == null || displayName.isEmpty() ? browseName : displayName;
    }

    /**
     * MethodCallback 을 Milo 호출 처리기로 감싼다.
     */
    private static final class CallbackInvocationHandler extends AbstractMethodInvocationHandler {

        private final UaMethod method;

        CallbackInvocationHandler(UaMethodNode node, UaMethod method) {
            super(node);
            this.method = method;
        }

        @Override
        public Argument[] getInputArguments() {
            return toArguments(method.getInputs());
        }

        @Override
        public Argument[] getOutputArguments() {
            return toArguments(method.getOutputs());
        }

        @Override
        protected Variant[] invoke(InvocationContext invocationContext, Variant[] inputValues) throws UaException {
            List<Variable> inputs = new ArrayList<>(inputValues.length);
            for (Variant value : inputValues) {
                inputs.add(Variants.toVariable(value));
            }
            List<Variable> outputs;
            try {
                outputs = method.getCallback().invoke(invocationContext.getObjectId(), inputs);
            } catch (RuntimeException e) {
                log.error("[method] {} failed", method.getBrowseName(), e);
                throw new UaException(StatusCodes.Bad_InternalError, e);
            }
            if (outputs == null) {
                return new Variant[0];
            }
            return outputs.stream().map(Variants::toVariant).toArray(Variant[]::new);
        }

        private static Argument[] toArguments(List<MethodArgument> arguments) {
            return arguments.stream()
                    .map(arg -> new Argument(
                            arg.getName(),
                            arg.getDataType().getNodeId(),
                            arg.isArray() ? ValueRanks.OneDimension : ValueRanks.Scalar,
                            arg.isArray() ? new UInteger[]{uint(0)} : null,
                            LocalizedText.english(arg.getDescription())
                    ))
                    .toArray(Argument[]::new);
        }
    }

    /* ---------- MonitoredItemServices ---------- */
    @Override
    public void onDataItemsCreated(List<DataItem> items) {
        items.forEach(item -> log.debug("[SubscriptionModel] created id={} sampling={}",
                item.getId(), item.getSamplingInterval()));
        subscriptionModel.onDataItemsCreated(items);
    }

    @Override
    public void onDataItemsModified(List<DataItem> items) {
        log.debug("[SubscriptionModel] modified: {}", items.size());
        subscriptionModel.onDataItemsModified(items);
    }

    @Override
    public void onDataItemsDeleted(List<DataItem> items) {
        items.forEach(item -> log.debug("[SubscriptionModel] deleted id={}", item.getId()));
        subscriptionModel.onDataItemsDeleted(items);
    }

    @Override
    public void onMonitoringModeChanged(List<MonitoredItem> items) {
        subscriptionModel.onMonitoringModeChanged(items);
    }
}
