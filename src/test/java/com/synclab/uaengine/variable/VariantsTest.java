package com.synclab.uaengine.variable;

import org.eclipse.milo.opcua.stack.core.StatusCodes;
import org.eclipse.milo.opcua.stack.core.types.builtin.DataValue;
import org.eclipse.milo.opcua.stack.core.types.builtin.DateTime;
import org.eclipse.milo.opcua.stack.core.types.builtin.LocalizedText;
import org.eclipse.milo.opcua.stack.core.types.builtin.StatusCode;
import org.eclipse.milo.opcua.stack.core.types.builtin.Variant;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class VariantsTest {

    @Test
    void emptyVariableBecomesNullVariant() {
        assertTrue(Variants.toVariant(new Variable()).isNull());
        assertTrue(Variants.toVariant((Variable) null).isNull());
    }

    @Test
    void arraysTravelAsBoxedArrays() {
        Variant variant = Variants.toVariant(new Variable(new int[]{4, 5}));

        assertArrayEquals(new Integer[]{4, 5}, (Integer[]) variant.getValue());
        assertEquals(new Variable(new int[]{4, 5}), Variants.toVariable(variant));
    }

    @Test
    void localizedTextIsReadAsString() {
        Variable variable = Variants.toVariable(new Variant(LocalizedText.english("alarm")));

        assertEquals("alarm", variable.cast(String.class));
    }

    @Test
    void unsupportedWireTypeIsEmpty() {
        assertTrue(Variants.toVariable(new Variant(DateTime.now())).empty());
    }

    @Test
    void badStatusIsEmpty() {
        DataValue bad = new DataValue(new Variant(1.0), new StatusCode(StatusCodes.Bad_NodeIdUnknown));

        assertTrue(Variants.toVariable(bad).empty());
        assertEquals(1.0, Variants.toVariable(new DataValue(new Variant(1.0))).cast(Double.class));
    }

    @Test
    void dataValueIsGood() {
        DataValue value = Variants.toDataValue(new Variable("on"));

        assertTrue(value.getStatusCode().isGood());
        assertEquals("on", value.getValue().getValue());
    }
}
