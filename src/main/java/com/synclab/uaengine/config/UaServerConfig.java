package com.synclab.uaengine.config;

import com.synclab.uaengine.opcua.UaServer;
import com.synclab.uaengine.opcua.UserConfig;
import com.synclab.uaengine.opcua.pubsub.TransportProfile;
import com.synclab.uaengine.opcua.pubsub.UaPublisher;
import com.synclab.uaengine.opcua.pubsub.UdpTransportLayer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.List;
import java.util.stream.Collectors;

@Configuration
public class UaServerConfig {

    private static final Logger log = LoggerFactory.getLogger(UaServerConfig.class);

    /** pubsub 이 켜져 있으면 발행 서버, 아니면 일반 서버. 기동은 {@link UaServerInitializer} 가 한다. */
    @Bean(destroyMethod = "close")
    public UaServer uaServer(UaEngineProperties properties) {
        UaEngineProperties.Server settings = properties.getServer();
        List<UserConfig> users = settings.getUsers().stream()
                .map(user -> new UserConfig(user.getUsername(), user.getPassword()))
                .collect(Collectors.toList());

        UaEngineProperties.PubSub pubsub = properties.getPubsub();
        if (!pubsub.isEnabled()) {
            return new UaServer(properties, settings.getPort(), users);
        }
        TransportProfile profile = TransportProfile.valueOf(pubsub.getProfile());
        log.info("pubsub enabled: name={}, profile={}, address={}", pubsub.getName(), profile, pubsub.getAddress());
        return new UaPublisher(pubsub.getName(), pubsub.getAddress(), settings.getPort(), profile,
                users, properties, List.of(new UdpTransportLayer()));
    }
}
