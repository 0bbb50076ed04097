package com.synclab.uaengine.controller;

import com.synclab.uaengine.opcua.UaServer;
import com.synclab.uaengine.variable.Variable;
import org.eclipse.milo.opcua.stack.core.Identifiers;
import org.eclipse.milo.opcua.stack.core.types.builtin.NodeId;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.server.ResponseStatusException;

import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * ObjectsFolder 바로 아래 변수 노드 읽기/쓰기.
 */
@RestController
@RequestMapping("/nodes")
public class NodeController {

    private static final Logger log = LoggerFactory.getLogger(NodeController.class);

    private final UaServer server;

    public NodeController(UaServer server) {
        this.server = server;
    }

    @GetMapping("/{browseName}")
    public Map<String, Object> read(@PathVariable String browseName) {
        NodeId nodeId = resolve(browseName);
        Variable value = server.read(nodeId);
        if (value.empty()) {
            throw new ResponseStatusException(HttpStatus.NOT_FOUND, "No value for " + browseName);
        }
        return body(browseName, nodeId, value);
    }

    @PostMapping("/{browseName}")
    public Map<String, Object> write(@PathVariable String browseName, @RequestParam String value) {
        NodeId nodeId = resolve(browseName);
        Variable current = server.read(nodeId);
        if (current.empty()) {
            throw new ResponseStatusException(HttpStatus.NOT_FOUND, "No value for " + browseName);
        }
        if (current.isArray()) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "Array values cannot be written as text");
        }

        Variable next;
        try {
            next = new Variable(current.getDataType().parse(value));
        } catch (IllegalArgumentException e) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, e.getMessage());
        }
        log.info("REST WRITE node={}, value={}", browseName, value);
        if (!server.write(nodeId, next)) {
            throw new ResponseStatusException(HttpStatus.CONFLICT, "Write rejected for " + browseName);
        }
        return body(browseName, nodeId, server.read(nodeId));
    }

    private NodeId resolve(String browseName) {
        NodeId nodeId = server.find(browseName).resolve(Identifiers.ObjectsFolder);
        if (nodeId == null || nodeId.isNull()) {
            throw new ResponseStatusException(HttpStatus.NOT_FOUND, "Node not found: " + browseName);
        }
        return nodeId;
    }

    private static Map<String, Object> body(String browseName, NodeId nodeId, Variable value) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("browseName", browseName);
        body.put("nodeId", nodeId.toParseableString());
        body.put("dataType", value.getDataType().name());
        if (value.isArray()) {
            body.put("value", Arrays.stream((Object[]) value.getValue()).map(String::valueOf).collect(Collectors.toList()));
        } else {
            body.put("value", String.valueOf(value.getValue()));
        }
        return body;
    }
}
