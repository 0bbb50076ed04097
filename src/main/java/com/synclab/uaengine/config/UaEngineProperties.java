package com.synclab.uaengine.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.ArrayList;
import java.util.List;

/**
 * {@code ua-engine.*} 설정. Spring 밖에서는 기본값 그대로 생성해서 쓴다.
 */
@ConfigurationProperties(prefix = "ua-engine")
public class UaEngineProperties {

    private String namespaceUri = "urn:synclab:ua-engine:namespace";
    private final Server server = new Server();
    private final Client client = new Client();
    private final PubSub pubsub = new PubSub();

    public String getNamespaceUri() {
        return namespaceUri;
    }

    public void setNamespaceUri(String namespaceUri) {
        this.namespaceUri = namespaceUri;
    }

    public Server getServer() {
        return server;
    }

    public Client getClient() {
        return client;
    }

    public PubSub getPubsub() {
        return pubsub;
    }

    public static class Server {
        private int port = 4840;
        private String bindAddress = "0.0.0.0";
        private String hostname = "localhost";
        private String path = "/";
        private String applicationUri = "urn:synclab:ua-engine:server";
        private String productUri = "urn:synclab:ua-engine:product";
        private String applicationName = "SyncLab UA Engine";
        private List<User> users = new ArrayList<>();
        private List<SeedVariable> variables = new ArrayList<>();

        public int getPort() {
            return port;
        }

        public void setPort(int port) {
            this.port = port;
        }

        public String getBindAddress() {
            return bindAddress;
        }

        public void setBindAddress(String bindAddress) {
            this.bindAddress = bindAddress;
        }

        public String getHostname() {
            return hostname;
        }

        public void setHostname(String hostname) {
            this.hostname = hostname;
        }

        public String getPath() {
            return path;
        }

        public void setPath(String path) {
            this.path = path;
        }

        public String getApplicationUri() {
            return applicationUri;
        }

        public void setApplicationUri(String applicationUri) {
            this.applicationUri = applicationUri;
        }

        public String getProductUri() {
            return productUri;
        }

        public void setProductUri(String productUri) {
            this.productUri = productUri;
        }

        public String getApplicationName() {
            return applicationName;
        }

        public void setApplicationName(String applicationName) {
            this.applicationName = applicationName;
        }

        public List<User> getUsers() {
            return users;
        }

        public void setUsers(List<User> users) {
            this.users = users;
        }

        public List<SeedVariable> getVariables() {
            return variables;
        }

        public void setVariables(List<SeedVariable> variables) {
            this.variables = variables;
        }
    }

    public static class User {
        private String username;
        private String password;

        public String getUsername() {
            return username;
        }

        public void setUsername(String username) {
            this.username = username;
        }

        public String getPassword() {
            return password;
        }

        public void setPassword(String password) {
            this.password = password;
        }
    }

    /** 기동 시 ObjectsFolder 아래에 추가할 변수 */
    public static class SeedVariable {
        private String browseName;
        private String dataType = "DOUBLE";
        private String value;

        public String getBrowseName() {
            return browseName;
        }

        public void setBrowseName(String browseName) {
            this.browseName = browseName;
        }

        public String getDataType() {
            return dataType;
        }

        public void setDataType(String dataType) {
            this.dataType = dataType;
        }

        public String getValue() {
            return value;
        }

        public void setValue(String value) {
            this.value = value;
        }
    }

    public static class Client {
        private String applicationUri = "urn:synclab:ua-engine:client";
        private String applicationName = "SyncLab UA Engine Client";
        private long requestTimeout = 5000;
        private double samplingInterval = 10;
        private double publishingInterval = 20;
        private long spinTimeout = 10;

        public String getApplicationUri() {
            return applicationUri;
        }

        public void setApplicationUri(String applicationUri) {
            this.applicationUri = applicationUri;
        }

        public String getApplicationName() {
            return applicationName;
        }

        public void setApplicationName(String applicationName) {
            this.applicationName = applicationName;
        }

        public long getRequestTimeout() {
            return requestTimeout;
        }

        public void setRequestTimeout(long requestTimeout) {
            this.requestTimeout = requestTimeout;
        }

        public double getSamplingInterval() {
            return samplingInterval;
        }

        public void setSamplingInterval(double samplingInterval) {
            this.samplingInterval = samplingInterval;
        }

        public double getPublishingInterval() {
            return publishingInterval;
        }

        public void setPublishingInterval(double publishingInterval) {
            this.publishingInterval = publishingInterval;
        }

        public long getSpinTimeout() {
            return spinTimeout;
        }

        public void setSpinTimeout(long spinTimeout) {
            this.spinTimeout = spinTimeout;
        }
    }

    public static class PubSub {
        private boolean enabled;
        private String name = "ua-engine";
        private String address = "opc.udp://224.0.0.22:4840";
        private String profile = "UDP_UADP";
        private double period = 100;
        private int keyFrameCount = 10;
        private List<String> fields = new ArrayList<>();

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public String getName() {
            return name;
        }

        public void setName(String name) {
            this.name = name;
        }

        public String getAddress() {
            return address;
        }

        public void setAddress(String address) {
            this.address = address;
        }

        public String getProfile() {
            return profile;
        }

        public void setProfile(String profile) {
            this.profile = profile;
        }

        public double getPeriod() {
            return period;
        }

        public void setPeriod(double period) {
            this.period = period;
        }

        public int getKeyFrameCount() {
            return keyFrameCount;
        }

        public void setKeyFrameCount(int keyFrameCount) {
            this.keyFrameCount = keyFrameCount;
        }

        public List<String> getFields() {
            return fields;
        }

        public void setFields(List<String> fields) {
            this.fields = fields;
        }
    }
}
