package com.synclab.uaengine.variable;

/**
 * 저장된 타입 태그와 다른 타입으로 값을 꺼내려 할 때 발생.
 */
public class TypeMismatchException extends RuntimeException {

    private final DataType actual;
    private final Class<?> requested;

    public TypeMismatchException(DataType actual, boolean array, Class<?> requested) {
        super(String.format("Stored %s%s cannot be read as %s",
                actual == null ? "nothing" : actual,
                array ? "[]" : "",
                requested == null ? "null" : requested.getSimpleName()));
        this.actual = actual;
        this.requested = requested;
    }

    public DataType getActual() {
        return actual;
    }

    public Class<?> getRequested() {
        return requested;
    }
}
