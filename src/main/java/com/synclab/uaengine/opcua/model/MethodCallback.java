package com.synclab.uaengine.opcua.model;

import com.synclab.uaengine.variable.Variable;
import org.eclipse.milo.opcua.stack.core.UaException;
import org.eclipse.milo.opcua.stack.core.types.builtin.NodeId;

import java.util.List;

/**
 * 클라이언트가 메서드를 호출했을 때 서버에서 실행되는 처리기.
 * 던진 UaException 의 상태 코드가 호출 결과가 된다.
 */
@FunctionalInterface
public interface MethodCallback {

    List<Variable> invoke(NodeId objectId, List<Variable> inputs) throws UaException;
}
