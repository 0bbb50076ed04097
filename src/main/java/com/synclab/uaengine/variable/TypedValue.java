package com.synclab.uaengine.variable;

import com.google.common.primitives.Primitives;

import java.util.Arrays;
import java.util.Objects;

/**
 * 타입 태그와 함께 보관되는 값. 배열은 항상 boxed 배열로 정규화해서 보관하고,
 * 들어오고 나갈 때 복사한다.
 */
final class TypedValue {

    static final TypedValue EMPTY = new TypedValue(null, null, false, 0);

    private final Object value;
    private final DataType dataType;
    private final boolean array;
    private final int size;

    private TypedValue(Object value, DataType dataType, boolean array, int size) {
        this.value = value;
        this.dataType = dataType;
        this.array = array;
        this.size = size;
    }

    static TypedValue of(Object value) {
        if (value == null) {
            return EMPTY;
        }
        Class<?> type = value.getClass();
        if (!type.isArray()) {
            DataType dataType = DataType.of(type)
                    .orElseThrow(() -> new IllegalArgumentException("Unsupported value type: " + type.getName()));
            return new TypedValue(value, dataType, false, 1);
        }
        DataType dataType = DataType.of(type.getComponentType())
                .orElseThrow(() -> new IllegalArgumentException("Unsupported array type: " + type.getName()));
        if (!dataType.isArrayCapable()) {
            throw new IllegalArgumentException("Boolean arrays are not supported");
        }
        Object[] boxed = dataType.boxArray(value);
        for (Object element : boxed) {
            if (element == null) {
                throw new IllegalArgumentException("Array elements must not be null");
            }
        }
        return new TypedValue(boxed, dataType, true, boxed.length);
    }

    <T> T cast(Class<T> requested) {
        if (size == 0 || requested == null) {
            throw new TypeMismatchException(dataType, array, requested);
        }
        if (!array) {
            if (requested == dataType.getJavaType() || requested == dataType.getPrimitiveType()) {
                return Primitives.wrap(requested).cast(value);
            }
            throw new TypeMismatchException(dataType, false, requested);
        }
        if (!requested.isArray()) {
            throw new TypeMismatchException(dataType, true, requested);
        }
        Class<?> component = requested.getComponentType();
        if (component == dataType.getJavaType()) {
            return requested.cast(((Object[]) value).clone());
        }
        if (component.isPrimitive() && component == dataType.getPrimitiveType()) {
            return requested.cast(dataType.unboxArray((Object[]) value));
        }
        throw new TypeMismatchException(dataType, true, requested);
    }

    /** 외부에 넘길 사본 */
    Object copy() {
        return array ? ((Object[]) value).clone() : value;
    }

    DataType dataType() {
        return dataType;
    }

    boolean isArray() {
        return array;
    }

    int size() {
        return size;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof TypedValue)) {
            return false;
        }
        TypedValue other = (TypedValue) o;
        if (dataType != other.dataType || array != other.array || size != other.size) {
            return false;
        }
        return array
                ? Arrays.equals((Object[]) value, (Object[]) other.value)
                : Objects.equals(value, other.value);
    }

    @Override
    public int hashCode() {
        int hash = Objects.hash(dataType, array, size);
        return 31 * hash + (array ? Arrays.hashCode((Object[]) value) : Objects.hashCode(value));
    }

    @Override
    public String toString() {
        if (size == 0) {
            return "<empty>";
        }
        return array ? dataType + Arrays.toString((Object[]) value) : dataType + "(" + value + ")";
    }
}
