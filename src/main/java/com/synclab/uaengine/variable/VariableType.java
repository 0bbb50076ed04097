package com.synclab.uaengine.variable;

/**
 * OPC UA 변수 타입. 변수의 형태(기본값, 타입 태그, 원소 수)와 이름 정보를 가진다.
 * browse name 은 같은 네임스페이스 안에서 중복될 수 없다.
 */
public final class VariableType {

    private String browseName = "";
    private String displayName = "";
    private String description = "";
    private final TypedValue value;

    public VariableType() {
        this.value = TypedValue.EMPTY;
    }

    /**
     * @param defaultValue 기본값. 지원 타입의 스칼라 또는 (boolean 제외) 배열
     * @throws IllegalArgumentException 지원하지 않는 값
     */
    public VariableType(Object defaultValue) {
        this.value = TypedValue.of(defaultValue);
    }

    /** browse name, display name, description 을 모두 같은 이름으로 지정한 변수 타입 */
    public static VariableType named(String name, Object defaultValue) {
        VariableType type = new VariableType(defaultValue);
        type.setBrowseName(name);
        type.setDisplayName(name);
        type.setDescription(name);
        return type;
    }

    public <T> T cast(Class<T> type) {
        return value.cast(type);
    }

    public Object getValue() {
        return value.copy();
    }

    public DataType getDataType() {
        return value.dataType();
    }

    public boolean isArray() {
        return value.isArray();
    }

    public boolean empty() {
        return value.size() == 0;
    }

    /** 원소 수, 값이 없으면 0 */
    public int size() {
        return value.size();
    }

    TypedValue typedValue() {
        return value;
    }

    public String getBrowseName() {
        return browseName;
    }

    public void setBrowseName(String browseName) {
        this.browseName = browseName == null ? "" : browseName;
    }

    public String getDisplayName() {
        return displayName;
    }

    public void setDisplayName(String displayName) {
        this.displayName = displayName == null ? "" : displayName;
    }

    public String getDescription() {
        return description;
    }

    public void setDescription(String description) {
        this.description = description == null ? "" : description;
    }

    @Override
    public String toString() {
        return "VariableType{" + browseName + "=" + value + "}";
    }
}
