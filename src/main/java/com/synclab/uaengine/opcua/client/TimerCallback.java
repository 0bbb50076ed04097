package com.synclab.uaengine.opcua.client;

@FunctionalInterface
public interface TimerCallback {

    void onTimer(ClientView client);
}
