package com.synclab.uaengine.opcua.model;

/**
 * 주소 공간에 추가할 노드의 공통 이름 정보.
 */
public abstract class UaNodeDescriptor {

    private String browseName = "";
    private String displayName = "";
    private String description = "";

    protected UaNodeDescriptor() {
    }

    protected UaNodeDescriptor(String name) {
        setBrowseName(name);
        setDisplayName(name);
        setDescription(name);
    }

    public String getBrowseName() {
        return browseName;
    }

    public void setBrowseName(String browseName) {
        this.browseName = browseName == null ? "" : browseName;
    }

    /** 비어 있으면 browse name */
    public String getDisplayName() {
        return displayName.isEmpty() ? browseName : displayName;
    }

    public void setDisplayName(String displayName) {
        this.displayName = displayName == null ? "" : displayName;
    }

    public String getDescription() {
        return description;
    }

    public void setDescription(String description) {
        this.description = description == null ? "" : description;
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "{" + browseName + "}";
    }
}
