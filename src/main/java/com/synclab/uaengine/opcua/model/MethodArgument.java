package com.synclab.uaengine.opcua.model;

import com.synclab.uaengine.variable.DataType;

import java.util.Objects;

/**
 * 메서드 입력/출력 인자 선언.
 */
public final class MethodArgument {

    private final String name;
    private final DataType dataType;
    private final boolean array;
    private final String description;

    public MethodArgument(String name, DataType dataType, boolean array, String description) {
        this.name = Objects.requireNonNull(name, "name");
        this.dataType = Objects.requireNonNull(dataType, "dataType");
        if (array && !dataType.isArrayCapable()) {
            throw new IllegalArgumentException("Boolean arrays are not supported: " + name);
        }
        this.array = array;
        this.description = description == null ? "" : description;
    }

    public static MethodArgument scalar(String name, DataType dataType) {
        return new MethodArgument(name, dataType, false, name);
    }

    public static MethodArgument array(String name, DataType dataType) {
        return new MethodArgument(name, dataType, true, name);
    }

    public String getName() {
        return name;
    }

    public DataType getDataType() {
        return dataType;
    }

    public boolean isArray() {
        return array;
    }

    public String getDescription() {
        return description;
    }

    @Override
    public String toString() {
        return name + ":" + dataType + (array ? "[]" : "");
    }
}
