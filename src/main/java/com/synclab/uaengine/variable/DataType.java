package com.synclab.uaengine.variable;

import org.eclipse.milo.opcua.stack.core.Identifiers;
import org.eclipse.milo.opcua.stack.core.types.builtin.NodeId;
import org.eclipse.milo.opcua.stack.core.types.builtin.unsigned.UByte;
import org.eclipse.milo.opcua.stack.core.types.builtin.unsigned.UInteger;
import org.eclipse.milo.opcua.stack.core.types.builtin.unsigned.ULong;
import org.eclipse.milo.opcua.stack.core.types.builtin.unsigned.UShort;

import com.google.common.primitives.Bytes;
import com.google.common.primitives.Doubles;
import com.google.common.primitives.Floats;
import com.google.common.primitives.Ints;
import com.google.common.primitives.Longs;
import com.google.common.primitives.Shorts;

import java.math.BigInteger;
import java.util.Arrays;
import java.util.List;
import java.util.Optional;

/**
 * 변수 값이 가질 수 있는 기본 타입 목록 (런타임 타입 태그).
 * OPC UA built-in type id, Milo 데이터 타입 NodeId, Java 전달 클래스를 함께 가진다.
 */
public enum DataType {
    BOOLEAN(1, Identifiers.Boolean, Boolean.class, boolean.class),
    SBYTE(2, Identifiers.SByte, Byte.class, byte.class),
    BYTE(3, Identifiers.Byte, UByte.class, null),
    INT16(4, Identifiers.Int16, Short.class, short.class),
    UINT16(5, Identifiers.UInt16, UShort.class, null),
    INT32(6, Identifiers.Int32, Integer.class, int.class),
    UINT32(7, Identifiers.UInt32, UInteger.class, null),
    INT64(8, Identifiers.Int64, Long.class, long.class),
    UINT64(9, Identifiers.UInt64, ULong.class, null),
    FLOAT(10, Identifiers.Float, Float.class, float.class),
    DOUBLE(11, Identifiers.Double, Double.class, double.class),
    STRING(12, Identifiers.String, String.class, null);

    private final int builtinId;
    private final NodeId nodeId;
    private final Class<?> javaType;
    private final Class<?> primitiveType;

    DataType(int builtinId, NodeId nodeId, Class<?> javaType, Class<?> primitiveType) {
        this.builtinId = builtinId;
        this.nodeId = nodeId;
        this.javaType = javaType;
        this.primitiveType = primitiveType;
    }

    public int getBuiltinId() {
        return builtinId;
    }

    public NodeId getNodeId() {
        return nodeId;
    }

    public Class<?> getJavaType() {
        return javaType;
    }

    /** primitive 대응 타입, 없으면 null */
    public Class<?> getPrimitiveType() {
        return primitiveType;
    }

    public boolean isArrayCapable() {
        return this != BOOLEAN;
    }

    public static Optional<DataType> of(Class<?> type) {
        if (type == null) {
            return Optional.empty();
        }
        for (DataType dataType : values()) {
            if (dataType.javaType == type || (dataType.primitiveType != null && dataType.primitiveType == type)) {
                return Optional.of(dataType);
            }
        }
        return Optional.empty();
    }

    public static Optional<DataType> fromNodeId(NodeId dataTypeId) {
        for (DataType dataType : values()) {
            if (dataType.nodeId.equals(dataTypeId)) {
                return Optional.of(dataType);
            }
        }
        return Optional.empty();
    }

    /**
     * 배열 값을 전달 클래스 배열로 만든다. primitive 배열은 boxing 하고, 전달 클래스 배열은 복사한다.
     *
     * @throws IllegalArgumentException 이 타입의 배열이 아님
     */
    Object[] boxArray(Object array) {
        if (array instanceof Object[] && array.getClass().getComponentType() == javaType) {
            return ((Object[]) array).clone();
        }
        return switch (this) {
            case SBYTE -> Bytes.asList((byte[]) array).toArray(new Byte[0]);
            case INT16 -> Shorts.asList((short[]) array).toArray(new Short[0]);
            case INT32 -> Ints.asList((int[]) array).toArray(new Integer[0]);
            case INT64 -> Longs.asList((long[]) array).toArray(new Long[0]);
            case FLOAT -> Floats.asList((float[]) array).toArray(new Float[0]);
            case DOUBLE -> Doubles.asList((double[]) array).toArray(new Double[0]);
            default -> throw new IllegalArgumentException("Not a " + this + " array: " + array.getClass().getName());
        };
    }

    /**
     * 전달 클래스 배열을 primitive 배열로 만든다.
     *
     * @throws IllegalArgumentException primitive 대응 타입이 없음
     */
    Object unboxArray(Object[] boxed) {
        List<Number> numbers = Arrays.asList((Number[]) boxed);
        return switch (this) {
            case SBYTE -> Bytes.toArray(numbers);
            case INT16 -> Shorts.toArray(numbers);
            case INT32 -> Ints.toArray(numbers);
            case INT64 -> Longs.toArray(numbers);
            case FLOAT -> Floats.toArray(numbers);
            case DOUBLE -> Doubles.toArray(numbers);
            default -> throw new IllegalArgumentException(this + " has no primitive array");
        };
    }

    /**
     * 문자열을 이 타입의 전달 클래스 값으로 변환한다. 설정 시드값과 REST 쓰기에서 사용.
     *
     * @throws IllegalArgumentException 변환할 수 없는 문자열
     */
    public Object parse(String text) {
        if (text == null) {
            throw new IllegalArgumentException("value text is required for " + this);
        }
        String raw = text.trim();
        try {
            return switch (this) {
                case BOOLEAN -> parseBoolean(raw);
                case SBYTE -> Byte.parseByte(raw);
                case BYTE -> UByte.valueOf(Short.parseShort(raw));
                case INT16 -> Short.parseShort(raw);
                case UINT16 -> UShort.valueOf(Integer.parseInt(raw));
                case INT32 -> Integer.parseInt(raw);
                case UINT32 -> UInteger.valueOf(Long.parseLong(raw));
                case INT64 -> Long.parseLong(raw);
                case UINT64 -> ULong.valueOf(new BigInteger(raw));
                case FLOAT -> Float.parseFloat(raw);
                case DOUBLE -> Double.parseDouble(raw);
                case STRING -> text;
            };
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Cannot parse '" + text + "' as " + this, e);
        }
    }

    private static Boolean parseBoolean(String raw) {
        if ("true".equalsIgnoreCase(raw) || "1".equals(raw)) {
            return Boolean.TRUE;
        }
        if ("false".equalsIgnoreCase(raw) || "0".equals(raw)) {
            return Boolean.FALSE;
        }
        throw new IllegalArgumentException("Cannot parse '" + raw + "' as BOOLEAN");
    }
}
