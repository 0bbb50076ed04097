package com.synclab.uaengine.variable;

import org.eclipse.milo.opcua.stack.core.types.builtin.DataValue;
import org.eclipse.milo.opcua.stack.core.types.builtin.DateTime;
import org.eclipse.milo.opcua.stack.core.types.builtin.LocalizedText;
import org.eclipse.milo.opcua.stack.core.types.builtin.StatusCode;
import org.eclipse.milo.opcua.stack.core.types.builtin.Variant;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Variable 과 Milo Variant / DataValue 사이의 변환.
 * 지원하지 않는 wire 타입은 빈 Variable 로 읽힌다.
 */
public final class Variants {

    private static final Logger log = LoggerFactory.getLogger(Variants.class);

    private Variants() {
    }

    public static Variant toVariant(Variable variable) {
        if (variable == null || variable.empty()) {
            return Variant.NULL_VALUE;
        }
        return new Variant(variable.getValue());
    }

    public static Variant toVariant(VariableType type) {
        if (type == null || type.empty()) {
            return Variant.NULL_VALUE;
        }
        return new Variant(type.getValue());
    }

    /** 현재 시각, GOOD 상태의 DataValue */
    public static DataValue toDataValue(Variable variable) {
        return new DataValue(toVariant(variable), StatusCode.GOOD, DateTime.now());
    }

    public static Variable toVariable(Variant variant) {
        if (variant == null || variant.isNull()) {
            return new Variable();
        }
        Object raw = variant.getValue();
        if (raw instanceof LocalizedText) {
            String text = ((LocalizedText) raw).getText();
            return text == null ? new Variable() : new Variable(text);
        }
        try {
            return new Variable(raw);
        } catch (IllegalArgumentException e) {
            log.debug("unsupported variant value {}: {}", raw.getClass().getSimpleName(), e.getMessage());
            return new Variable();
        }
    }

    /** 상태가 GOOD 이 아니면 빈 Variable */
    public static Variable toVariable(DataValue dataValue) {
        if (dataValue == null) {
            return new Variable();
        }
        StatusCode status = dataValue.getStatusCode();
        if (status != null && !status.isGood()) {
            return new Variable();
        }
        return toVariable(dataValue.getValue());
    }
}
