package com.synclab.uaengine.opcua.client;

import com.synclab.uaengine.variable.Variable;

@FunctionalInterface
public interface DataChangeNotificationCallback {

    void onDataChange(ClientView client, Variable value);
}
