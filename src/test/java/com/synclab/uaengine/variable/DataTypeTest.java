package com.synclab.uaengine.variable;

import org.eclipse.milo.opcua.stack.core.Identifiers;
import org.eclipse.milo.opcua.stack.core.types.builtin.unsigned.UInteger;
import org.eclipse.milo.opcua.stack.core.types.builtin.unsigned.UShort;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class DataTypeTest {

    @Test
    void resolvesBoxedAndPrimitiveClasses() {
        assertEquals(DataType.INT16, DataType.of(Short.class).orElseThrow());
        assertEquals(DataType.INT16, DataType.of(short.class).orElseThrow());
        assertEquals(DataType.UINT32, DataType.of(UInteger.class).orElseThrow());
        assertTrue(DataType.of(Object.class).isEmpty());
        assertTrue(DataType.of(null).isEmpty());
    }

    @Test
    void mapsMiloDataTypeIds() {
        assertEquals(Identifiers.Double, DataType.DOUBLE.getNodeId());
        assertEquals(DataType.STRING, DataType.fromNodeId(Identifiers.String).orElseThrow());
        assertTrue(DataType.fromNodeId(Identifiers.DateTime).isEmpty());
    }

    @Test
    void builtinIdsFollowEncodingTable() {
        assertEquals(1, DataType.BOOLEAN.getBuiltinId());
        assertEquals(11, DataType.DOUBLE.getBuiltinId());
        assertEquals(12, DataType.STRING.getBuiltinId());
    }

    @Test
    void parsesText() {
        assertEquals(Boolean.TRUE, DataType.BOOLEAN.parse("TRUE"));
        assertEquals(Boolean.FALSE, DataType.BOOLEAN.parse("0"));
        assertEquals(12, DataType.INT32.parse(" 12 "));
        assertEquals(UShort.valueOf(7), DataType.UINT16.parse("7"));
        assertEquals(2.5, DataType.DOUBLE.parse("2.5"));
        assertEquals(" padded ", DataType.STRING.parse(" padded "));
    }

    @Test
    void rejectsBadText() {
        assertThrows(IllegalArgumentException.class, () -> DataType.INT32.parse("abc"));
        assertThrows(IllegalArgumentException.class, () -> DataType.BOOLEAN.parse("yes"));
        assertThrows(IllegalArgumentException.class, () -> DataType.DOUBLE.parse(null));
    }

    @Test
    void onlyBooleanCannotBeArray() {
        for (DataType type : DataType.values()) {
            assertEquals(type != DataType.BOOLEAN, type.isArrayCapable(), type.name());
        }
    }
}
