package com.synclab.uaengine.opcua.model;

import com.synclab.uaengine.variable.Variable;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 이벤트 타입 설명. BaseEventType 의 하위 타입으로 등록되고
 * 선언한 필드마다 필수 property 하나를 가진다.
 */
public class UaEventType extends UaNodeDescriptor {

    private final Map<String, Variable> fields = new LinkedHashMap<>();

    public UaEventType() {
    }

    public UaEventType(String name) {
        super(name);
    }

    /** 필드 선언. 기본값이 필드의 타입을 정한다. */
    public UaEventType add(String name, Object defaultValue) {
        if (name == null || name.isEmpty()) {
            throw new IllegalArgumentException("event field name is required");
        }
        Variable value = new Variable(defaultValue);
        if (value.empty()) {
            throw new IllegalArgumentException("event field " + name + " needs a default value");
        }
        value.setBrowseName(name);
        fields.put(name, value);
        return this;
    }

    public boolean declares(String name) {
        return fields.containsKey(name);
    }

    public Map<String, Variable> getFields() {
        return Collections.unmodifiableMap(fields);
    }
}
