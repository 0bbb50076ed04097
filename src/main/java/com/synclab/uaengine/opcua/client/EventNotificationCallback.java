package com.synclab.uaengine.opcua.client;

import com.synclab.uaengine.variable.Variable;

import java.util.List;

/**
 * 이벤트 알림 콜백. 값은 monitor 에 넘긴 필드 이름 순서를 따른다.
 */
@FunctionalInterface
public interface EventNotificationCallback {

    void onEvent(ClientView client, List<Variable> fields);
}
