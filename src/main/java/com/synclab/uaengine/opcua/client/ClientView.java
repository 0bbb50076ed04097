package com.synclab.uaengine.opcua.client;

import com.synclab.uaengine.opcua.FindNode;
import com.synclab.uaengine.variable.Variable;
import org.eclipse.milo.opcua.stack.core.types.builtin.NodeId;

import java.util.List;

/**
 * 콜백에 넘겨지는 클라이언트 뷰. 소유권 없이 동기 요청만 할 수 있다.
 */
public interface ClientView {

    FindNode find(String browseName);

    FindNode find(String browseName, int namespaceIndex);

    /** 실패하면 빈 Variable */
    Variable read(NodeId nodeId);

    boolean write(NodeId nodeId, Variable value);

    /**
     * @param outputs 성공했을 때만 결과로 채워진다
     */
    boolean call(NodeId objectId, String methodName, List<Variable> inputs, List<Variable> outputs);

    /** ObjectsFolder 아래 메서드 호출 */
    boolean call(String methodName, List<Variable> inputs, List<Variable> outputs);
}
