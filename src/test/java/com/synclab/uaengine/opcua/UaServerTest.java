package com.synclab.uaengine.opcua;

import com.synclab.uaengine.config.UaEngineProperties;
import com.synclab.uaengine.opcua.model.MethodArgument;
import com.synclab.uaengine.opcua.model.UaEvent;
import com.synclab.uaengine.opcua.model.UaEventType;
import com.synclab.uaengine.opcua.model.UaMethod;
import com.synclab.uaengine.opcua.model.UaObject;
import com.synclab.uaengine.opcua.model.UaView;
import com.synclab.uaengine.variable.DataType;
import com.synclab.uaengine.variable.Variable;
import com.synclab.uaengine.variable.VariableType;
import com.synclab.uaengine.variable.Variables;
import org.eclipse.milo.opcua.stack.core.Identifiers;
import org.eclipse.milo.opcua.stack.core.types.builtin.NodeId;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class UaServerTest {

    private static final int PORT = 14841;

    private UaServer server;

    static UaEngineProperties loopback() {
        UaEngineProperties properties = new UaEngineProperties();
        properties.getServer().setBindAddress("127.0.0.1");
        properties.getServer().setHostname("127.0.0.1");
        return properties;
    }

    @BeforeEach
    void setUp() {
        server = new UaServer(loopback(), PORT, List.of());
    }

    @AfterEach
    void tearDown() {
        server.close();
    }

    @Test
    void addedObjectIsFoundUnderObjectsFolder() {
        UaObject object = new UaObject("test_object").add(Variables.named("test_val1", 1.0));

        NodeId objectId = server.addObjectNode(object);

        assertFalse(objectId.isNull());
        assertEquals(objectId, server.find("test_object").resolve(Identifiers.ObjectsFolder));
        NodeId childId = NodePath.resolve(Identifiers.ObjectsFolder, server.find("test_object"), server.find("test_val1"));
        assertFalse(childId.isNull());
        assertEquals(1.0, server.read(childId).cast(Double.class));
    }

    @Test
    void duplicateBrowseNameIsRejected() {
        assertFalse(server.addVariableNode(Variables.named("speed", 1)).isNull());

        assertTrue(server.addVariableNode(Variables.named("speed", 2)).isNull());
        assertTrue(server.addObjectNode(new UaObject("speed")).isNull());
        assertEquals(1, server.read(server.find("speed").resolve(Identifiers.ObjectsFolder)).cast(Integer.class));
    }

    @Test
    void emptyNameAndMissingParentAreRejected() {
        assertTrue(server.addVariableNode(new Variable(1)).isNull());
        assertTrue(server.addVariableNode(Variables.named("orphan", 1), new NodeId(server.getNamespaceIndex(), "missing")).isNull());
    }

    @Test
    void variableLinkedToVariableType() {
        VariableType type = VariableType.named("Point", new double[]{0.0, 0.0});
        assertFalse(server.addVariableTypeNode(type).isNull());
        assertTrue(server.addVariableTypeNode(VariableType.named("Point", 1)).isNull());

        NodeId id = server.addVariableNode(Variables.named("origin", type));

        assertFalse(id.isNull());
        Variable value = server.read(id);
        assertTrue(value.isArray());
        assertEquals(2, value.size());
    }

    @Test
    void writeChecksDeclaredType() {
        NodeId id = server.addVariableNode(Variables.named("level", 10));

        assertTrue(server.write(id, new Variable(11)));
        assertEquals(11, server.read(id).cast(Integer.class));
        assertFalse(server.write(id, new Variable("eleven")));
        assertFalse(server.write(new NodeId(server.getNamespaceIndex(), "nothing"), new Variable(1)));
        assertTrue(server.read(new NodeId(server.getNamespaceIndex(), "nothing")).empty());
    }

    @Test
    void methodIsAddedUnderObject() {
        UaMethod add = new UaMethod("add", (objectId, inputs) -> List.of(
                new Variable(inputs.get(0).cast(Integer.class) + inputs.get(1).cast(Integer.class))))
                .input(MethodArgument.scalar("a", DataType.INT32))
                .input(MethodArgument.scalar("b", DataType.INT32))
                .output(MethodArgument.scalar("sum", DataType.INT32));
        NodeId objectId = server.addObjectNode(new UaObject("calculator").add(add));

        assertFalse(objectId.isNull());
        assertFalse(server.find("add").resolve(objectId).isNull());
        assertFalse(server.addMethodNode(new UaMethod("reset", (o, in) -> List.of())).isNull());
    }

    @Test
    void eventTypeMustBeRegisteredBeforeTrigger() {
        UaEventType alarm = new UaEventType("OverheatEvent").add("temperature", 0.0);
        UaEventType unknown = new UaEventType("UnknownEvent");

        assertFalse(server.addEventTypeNode(alarm).isNull());
        assertFalse(server.find("OverheatEvent").resolve(Identifiers.BaseEventType).isNull());

        UaEvent event = new UaEvent(alarm).set("temperature", 98.5);
        event.setMessage("too hot");
        server.start();
        assertTrue(server.triggerEvent(Identifiers.Server, event));
        assertFalse(server.triggerEvent(Identifiers.Server, new UaEvent(unknown)));
    }

    @Test
    void eventIsNotTriggeredBeforeStart() {
        UaEventType alarm = new UaEventType("OverheatEvent").add("temperature", 0.0);
        assertFalse(server.addEventTypeNode(alarm).isNull());

        UaEvent event = new UaEvent(alarm).set("temperature", 98.5);
        assertFalse(server.triggerEvent(Identifiers.Server, event));

        server.start();
        assertTrue(server.triggerEvent(Identifiers.Server, event));
    }

    @Test
    void eventRejectsUndeclaredField() {
        UaEvent event = new UaEvent(new UaEventType("DoorEvent").add("open", Boolean.TRUE));

        assertThrows(IllegalArgumentException.class, () -> event.set("closed", Boolean.TRUE));
        assertEquals(Boolean.TRUE, event.get("open").cast(Boolean.class));
    }

    @Test
    void viewIsAddedUnderViewsFolder() {
        NodeId a = server.addVariableNode(Variables.named("a", 1));
        NodeId view = server.addViewNode(new UaView("overview").add(a));

        assertFalse(view.isNull());
        assertEquals(view, server.find("overview").resolve(Identifiers.ViewsFolder));
        assertEquals(a, server.find("a").resolve(view));
    }

    @Test
    void pathResolutionIsDeterministic() {
        server.addObjectNode(new UaObject("line").add(Variables.named("state", "IDLE")));

        NodeId first = NodePath.resolve(Identifiers.ObjectsFolder, server.find("line"), server.find("state"));
        NodeId second = NodePath.resolve(Identifiers.ObjectsFolder, server.find("line"), server.find("state"));

        assertEquals(first, second);
        assertTrue(NodePath.resolve(Identifiers.ObjectsFolder, server.find("line"), server.find("missing")).isNull());
        assertTrue(NodePath.resolve(Identifiers.ObjectsFolder, server.find("missing"), server.find("state")).isNull());
    }

    @Test
    void startStopJoin() {
        server.start();
        assertTrue(server.isRunning());

        server.start();
        assertTrue(server.isRunning());

        server.stop();
        server.join();
        assertFalse(server.isRunning());
    }
}
