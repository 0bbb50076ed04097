package com.synclab.uaengine.variable;

/**
 * OPC UA 변수 값.
 * <p>
 * 스칼라 또는 동일 원소 타입의 배열을 타입 태그와 함께 보관한다. 두 변수는 타입 태그,
 * 원소 수, 값이 모두 같을 때 같은 것으로 보며 이름과 설명은 비교하지 않는다.
 * {@link VariableType} 에서 만든 경우 생성 시점에 값이 복사되고 이후에는 서로 독립이다.
 */
public final class Variable {

    public static final int READ = 1;
    public static final int WRITE = 2;

    private static final VariableType NO_TYPE = new VariableType();

    private String browseName = "";
    private String displayName = "";
    private String description = "";
    private int accessLevel;
    private final VariableType type;
    private final TypedValue value;

    /** 빈 변수. 읽기 실패 결과로도 쓰인다. */
    public Variable() {
        this.type = NO_TYPE;
        this.value = TypedValue.EMPTY;
    }

    /**
     * @param value 지원 타입의 스칼라 또는 (boolean 제외) 배열
     * @throws IllegalArgumentException 지원하지 않는 값
     */
    public Variable(Object value) {
        this.type = NO_TYPE;
        this.value = TypedValue.of(value);
        this.accessLevel = READ | WRITE;
    }

    private Variable(VariableType type) {
        this.type = type;
        this.value = type.typedValue();
        this.accessLevel = READ | WRITE;
    }

    public static Variable from(VariableType type) {
        if (type == null) {
            throw new IllegalArgumentException("variable type is required");
        }
        return new Variable(type);
    }

    public <T> T cast(Class<T> type) {
        return value.cast(type);
    }

    /** 저장된 값의 사본, 비어 있으면 null */
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

    public int size() {
        return value.size();
    }

    /** 원래의 변수 타입, 직접 만든 변수면 빈 타입 */
    public VariableType getType() {
        return type;
    }

    public boolean hasType() {
        return type != NO_TYPE;
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

    public int getAccessLevel() {
        return accessLevel;
    }

    public void setAccessLevel(int accessLevel) {
        this.accessLevel = accessLevel & (READ | WRITE);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Variable)) {
            return false;
        }
        return value.equals(((Variable) o).value);
    }

    @Override
    public int hashCode() {
        return value.hashCode();
    }

    @Override
    public String toString() {
        return browseName.isEmpty() ? value.toString() : browseName + "=" + value;
    }
}
