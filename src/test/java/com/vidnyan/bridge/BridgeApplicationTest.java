package com.vidnyan.bridge;

import com.vidnyan.bridge.application.port.in.ParseCodeUseCase;
import com.vidnyan.bridge.application.port.in.ParseCodeUseCase.ParseRequest;
import com.vidnyan.bridge.application.port.in.ParseCodeUseCase.ParseResponse;
import com.vidnyan.bridge.domain.model.Dialect;
import com.vidnyan.bridge.domain.model.NodeType;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;

import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

@SpringBootTest(properties = "bridge.parser.max-declarations=2")
class BridgeApplicationTest {

    @Autowired
    private ParseCodeUseCase parseCodeUseCase;

    @Autowired
    private ParserProperties properties;

    @Test
    void context_ShouldWireEveryDialectAndBindParserProperties() {
        assertEquals(2, properties.getMaxDeclarations());

        ParseResponse response = parseCodeUseCase.parse(ParseRequest.auto(
                "use bevy::prelude::*;\n@compute @workgroup_size(1) fn main() {}"));

        assertEquals(Set.of(Dialect.BEVY, Dialect.WGSL), response.dialects());
        assertTrue(response.nodes().stream().anyMatch(n -> n.type() == NodeType.BEVY_USE));
        assertTrue(response.nodes().stream().anyMatch(n -> n.type() == NodeType.WGSL_COMPUTE_SHADER));
    }
}
