package com.synclab.uaengine.config;

import com.synclab.uaengine.opcua.UaServer;
import com.synclab.uaengine.opcua.pubsub.PublishedData;
import com.synclab.uaengine.opcua.pubsub.UaPublisher;
import com.synclab.uaengine.variable.DataType;
import com.synclab.uaengine.variable.Variable;
import com.synclab.uaengine.variable.Variables;
import org.eclipse.milo.opcua.stack.core.types.builtin.NodeId;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * 애플리케이션 기동 후 시드 변수를 추가하고 서버를 띄운 뒤, 설정된 필드를 발행한다.
 */
@Component
public class UaServerInitializer {

    private static final Logger log = LoggerFactory.getLogger(UaServerInitializer.class);

    private final UaServer server;
    private final UaEngineProperties properties;

    public UaServerInitializer(UaServer server, UaEngineProperties properties) {
        this.server = server;
        this.properties = properties;
    }

    @EventListener(ApplicationReadyEvent.class)
    public void initAfterSpringContext() {
        Map<String, NodeId> seeded = seedVariables();
        server.start();
        if (server instanceof UaPublisher) {
            publishFields((UaPublisher) server, seeded);
        }
    }

    Map<String, NodeId> seedVariables() {
        Map<String, NodeId> seeded = new LinkedHashMap<>();
        for (UaEngineProperties.SeedVariable seed : properties.getServer().getVariables()) {
            try {
                DataType dataType = DataType.valueOf(String.valueOf(seed.getDataType()).trim().toUpperCase(Locale.ROOT));
                Variable variable = Variables.named(seed.getBrowseName(), dataType.parse(seed.getValue()));
                NodeId nodeId = server.addVariableNode(variable);
                if (!nodeId.isNull()) {
                    seeded.put(seed.getBrowseName(), nodeId);
                }
            } catch (IllegalArgumentException e) {
                log.error("seed variable {} skipped: {}", seed.getBrowseName(), e.getMessage());
            }
        }
        log.info("seeded {} variable(s)", seeded.size());
        return seeded;
    }

    private void publishFields(UaPublisher publisher, Map<String, NodeId> seeded) {
        UaEngineProperties.PubSub pubsub = properties.getPubsub();
        List<PublishedData> data = new ArrayList<>();
        for (String field : pubsub.getFields()) {
            NodeId nodeId = seeded.get(field);
            if (nodeId == null) {
                log.warn("pubsub field {} is not a seeded variable", field);
                continue;
            }
            data.add(new PublishedData(field, nodeId));
        }
        if (data.isEmpty()) {
            log.info("no pubsub fields configured");
            return;
        }
        if (!publisher.publish(data, pubsub.getPeriod())) {
            log.error("pubsub publishing could not be configured");
        }
    }
}
