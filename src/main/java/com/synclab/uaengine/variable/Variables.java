package com.synclab.uaengine.variable;

/**
 * Variable 생성 헬퍼.
 */
public final class Variables {

    private Variables() {
    }

    /** browse name, display name, description 을 같은 이름으로 채운 변수 */
    public static Variable named(String name, Object value) {
        Variable variable = new Variable(value);
        variable.setBrowseName(name);
        variable.setDisplayName(name);
        variable.setDescription(name);
        return variable;
    }

    /** 변수 타입으로부터 만든 이름 있는 변수 */
    public static Variable named(String name, VariableType type) {
        Variable variable = Variable.from(type);
        variable.setBrowseName(name);
        variable.setDisplayName(name);
        variable.setDescription(name);
        return variable;
    }
}
