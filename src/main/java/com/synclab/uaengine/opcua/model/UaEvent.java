package com.synclab.uaengine.opcua.model;

import com.synclab.uaengine.variable.Variable;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * 발생시킬 이벤트. 필드는 원래 이벤트 타입이 선언한 이름만 쓸 수 있다.
 */
public class UaEvent {

    private final UaEventType type;
    private final Map<String, Variable> fields = new LinkedHashMap<>();
    private String sourceName = "";
    private String message = "";
    private int severity = 500;

    public UaEvent(UaEventType type) {
        this.type = Objects.requireNonNull(type, "type");
        fields.putAll(type.getFields());
    }

    /**
     * @throws IllegalArgumentException 타입에 선언되지 않은 필드
     */
    public UaEvent set(String name, Object value) {
        if (!type.declares(name)) {
            throw new IllegalArgumentException("field " + name + " is not declared by " + type.getBrowseName());
        }
        Variable variable = value instanceof Variable ? (Variable) value : new Variable(value);
        variable.setBrowseName(name);
        fields.put(name, variable);
        return this;
    }

    public Variable get(String name) {
        Variable value = fields.get(name);
        if (value == null) {
            throw new IllegalArgumentException("field " + name + " is not declared by " + type.getBrowseName());
        }
        return value;
    }

    public Map<String, Variable> getFields() {
        return Collections.unmodifiableMap(fields);
    }

    public UaEventType getType() {
        return type;
    }

    public String getSourceName() {
        return sourceName;
    }

    public void setSourceName(String sourceName) {
        this.sourceName = sourceName == null ? "" : sourceName;
    }

    public String getMessage() {
        return message;
    }

    public void setMessage(String message) {
        this.message = message == null ? "" : message;
    }

    public int getSeverity() {
        return severity;
    }

    /** 1 ~ 1000 */
    public void setSeverity(int severity) {
        if (severity < 1 || severity > 1000) {
            throw new IllegalArgumentException("severity must be within 1..1000: " + severity);
        }
        this.severity = severity;
    }
}
