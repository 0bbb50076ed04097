package com.synclab.uaengine.controller;

import com.synclab.uaengine.config.UaEngineProperties;
import com.synclab.uaengine.opcua.UaServer;
import com.synclab.uaengine.variable.Variables;
import org.eclipse.milo.opcua.stack.core.types.builtin.NodeId;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

class NodeControllerTest {

    private UaServer server;
    private MockMvc mockMvc;
    private NodeId temperature;

    @BeforeEach
    void setUp() {
        UaEngineProperties properties = new UaEngineProperties();
        properties.getServer().setBindAddress("127.0.0.1");
        server = new UaServer(properties, 14880, List.of());
        temperature = server.addVariableNode(Variables.named("temperature", 21.5));
        server.addVariableNode(Variables.named("samples", new int[]{1, 2}));
        mockMvc = MockMvcBuilders.standaloneSetup(new NodeController(server)).build();
    }

    @AfterEach
    void tearDown() {
        server.close();
    }

    @Test
    void readsVariable() throws Exception {
        mockMvc.perform(get("/nodes/temperature"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.dataType").value("DOUBLE"))
                .andExpect(jsonPath("$.value").value("21.5"));
    }

    @Test
    void readsArrayAsList() throws Exception {
        mockMvc.perform(get("/nodes/samples"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.dataType").value("INT32"))
                .andExpect(jsonPath("$.value[1]").value("2"));
    }

    @Test
    void missingNodeIsNotFound() throws Exception {
        mockMvc.perform(get("/nodes/pressure"))
                .andExpect(status().isNotFound());
    }

    @Test
    void writesParsedValue() throws Exception {
        mockMvc.perform(post("/nodes/temperature").param("value", "30.25"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.value").value("30.25"));

        assertEquals(30.25, server.read(temperature).cast(Double.class));
    }

    @Test
    void badValueIsRejected() throws Exception {
        mockMvc.perform(post("/nodes/temperature").param("value", "warm"))
                .andExpect(status().isBadRequest());
        mockMvc.perform(post("/nodes/samples").param("value", "3"))
                .andExpect(status().isBadRequest());
    }
}
