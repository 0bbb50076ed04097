package com.synclab.uaengine.opcua.model;

import com.synclab.uaengine.variable.Variable;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 객체 노드 설명. 변수와 메서드를 HasComponent 자식으로 가진다.
 */
public class UaObject extends UaNodeDescriptor {

    private final Map<String, Variable> variables = new LinkedHashMap<>();
    private final Map<String, UaMethod> methods = new LinkedHashMap<>();

    public UaObject() {
    }

    public UaObject(String name) {
        super(name);
    }

    /**
     * @throws IllegalArgumentException browse name 이 비었거나 이미 있는 이름
     */
    public UaObject add(Variable variable) {
        String name = variable.getBrowseName();
        if (name.isEmpty()) {
            throw new IllegalArgumentException("object variables need a browse name");
        }
        if (variables.containsKey(name) || methods.containsKey(name)) {
            throw new IllegalArgumentException("duplicate child browse name: " + name);
        }
        variables.put(name, variable);
        return this;
    }

    public UaObject add(UaMethod method) {
        String name = method.getBrowseName();
        if (name.isEmpty()) {
            throw new IllegalArgumentException("object methods need a browse name");
        }
        if (variables.containsKey(name) || methods.containsKey(name)) {
            throw new IllegalArgumentException("duplicate child browse name: " + name);
        }
        methods.put(name, method);
        return this;
    }

    public Variable get(String name) {
        return variables.get(name);
    }

    public Collection<Variable> getVariables() {
        return Collections.unmodifiableCollection(variables.values());
    }

    public Collection<UaMethod> getMethods() {
        return Collections.unmodifiableCollection(methods.values());
    }
}
