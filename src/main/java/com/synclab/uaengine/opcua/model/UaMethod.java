package com.synclab.uaengine.opcua.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * 메서드 노드 설명. 인자 개수와 타입은 여기 선언한 대로 스택이 검사한다.
 */
public class UaMethod extends UaNodeDescriptor {

    private final List<MethodArgument> inputs = new ArrayList<>();
    private final List<MethodArgument> outputs = new ArrayList<>();
    private final MethodCallback callback;

    public UaMethod(String name, MethodCallback callback) {
        super(name);
        this.callback = Objects.requireNonNull(callback, "callback");
    }

    public UaMethod input(MethodArgument argument) {
        inputs.add(argument);
        return this;
    }

    public UaMethod output(MethodArgument argument) {
        outputs.add(argument);
        return this;
    }

    public List<MethodArgument> getInputs() {
        return Collections.unmodifiableList(inputs);
    }

    public List<MethodArgument> getOutputs() {
        return Collections.unmodifiableList(outputs);
    }

    public MethodCallback getCallback() {
        return callback;
    }
}
