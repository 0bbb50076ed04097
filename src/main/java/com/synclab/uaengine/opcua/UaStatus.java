package com.synclab.uaengine.opcua;

import org.eclipse.milo.opcua.stack.core.StatusCodes;
import org.eclipse.milo.opcua.stack.core.UaException;
import org.eclipse.milo.opcua.stack.core.types.builtin.StatusCode;

/**
 * 로그에 남길 상태 코드 이름 변환.
 */
public final class UaStatus {

    private UaStatus() {
    }

    /** 예: {@code Bad_NodeIdUnknown} */
    public static String name(StatusCode status) {
        if (status == null) {
            return "null";
        }
        return name(status.getValue());
    }

    public static String name(long code) {
        return StatusCodes.lookup(code)
                .map(desc -> desc[0])
                .orElse(String.format("0x%08X", code));
    }

    /** 예외 체인에서 UaException 을 찾아 상태 코드를 꺼낸다. 없으면 Bad_UnexpectedError */
    public static StatusCode of(Throwable error) {
        Throwable cause = error;
        while (cause != null) {
            if (cause instanceof UaException) {
                return ((UaException) cause).getStatusCode();
            }
            cause = cause.getCause();
        }
        return new StatusCode(StatusCodes.Bad_UnexpectedError);
    }

    public static String describe(Throwable error) {
        StatusCode status = of(error);
        Throwable root = error;
        while (root.getCause() != null && root.getCause() != root) {
            root = root.getCause();
        }
        return name(status) + " (" + root.getMessage() + ")";
    }
}
