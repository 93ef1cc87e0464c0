package com.vidnyan.bridge.api;

import com.vidnyan.bridge.ParserProperties;
import com.vidnyan.bridge.adapter.out.interchange.BlocklyXmlSerializer;
import com.vidnyan.bridge.adapter.out.parser.BevyDialectParser;
import com.vidnyan.bridge.adapter.out.parser.BiospheresDialectParser;
import com.vidnyan.bridge.adapter.out.parser.RustDialectParser;
import com.vidnyan.bridge.adapter.out.parser.WgslDialectParser;
import com.vidnyan.bridge.application.port.out.DialectParser;
import com.vidnyan.bridge.application.service.CodeParsingApplicationService;
import com.vidnyan.bridge.application.service.MixedModeMerger;
import com.vidnyan.bridge.application.service.MultiFileOrchestrator;
import com.vidnyan.bridge.domain.mode.ModeDetector;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import java.util.List;

import static org.hamcrest.Matchers.containsString;
import static org.hamcrest.Matchers.startsWith;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.content;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

class ParseControllerTest {

    private MockMvc mockMvc;

    @BeforeEach
    void setUp() {
        ParserProperties properties = new ParserProperties();
        List<DialectParser> parsers = List.of(
                new RustDialectParser(properties),
                new WgslDialectParser(properties),
                new BevyDialectParser(properties),
                new BiospheresDialectParser(properties));
        ModeDetector detector = new ModeDetector();
        CodeParsingApplicationService service = new CodeParsingApplicationService(parsers, detector,
                new MixedModeMerger(parsers), new MultiFileOrchestrator(parsers, detector),
                new BlocklyXmlSerializer(), properties);
        mockMvc = MockMvcBuilders.standaloneSetup(new ParseController(service)).build();
    }

    @Test
    void parse_ShouldReturnNodesAsJson() throws Exception {
        mockMvc.perform(post("/api/parse")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"code\": \"fn add(a: i32, b: i32) -> i32 { a + b }\", \"mode\": \"auto\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.nodes[0].type").value("rust_function"))
                .andExpect(jsonPath("$.nodes[0].fields.NAME").value("add"))
                .andExpect(jsonPath("$.dialects[0]").value("rust"))
                .andExpect(jsonPath("$.errors").isEmpty());
    }

    @Test
    void parse_ShouldReportUnknownModeInTheBody() throws Exception {
        mockMvc.perform(post("/api/parse")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"code\": \"fn f() {}\", \"mode\": \"cobol\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.nodes").isEmpty())
                .andExpect(jsonPath("$.errors[0].message").value("Unknown mode: cobol"));
    }

    @Test
    void parseToBlocks_ShouldReturnInterchangeDocument() throws Exception {
        mockMvc.perform(post("/api/parse/blocks")
                        .param("filename", "lib.rs")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"code\": \"use std::io;\"}"))
                .andExpect(status().isOk())
                .andExpect(content().string(startsWith("<xml xmlns=\"https://developers.google.com/blockly/xml\">")))
                .andExpect(content().string(containsString("<field name=\"FILENAME\">lib.rs</field>")))
                .andExpect(content().string(containsString("<field name=\"PATH\">std::io</field>")));
    }

    @Test
    void parseBatch_ShouldReturnReferences() throws Exception {
        mockMvc.perform(post("/api/parse/batch")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"files\": {\"main.rs\": \"use crate::physics::Body;\", "
                                + "\"physics.rs\": \"pub struct Body { mass: f32 }\"}}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.results['physics.rs'].nodes[0].type").value("rust_struct"))
                .andExpect(jsonPath("$.references[0].kind").value("IMPORT"))
                .andExpect(jsonPath("$.references[0].resolvedFile").value("physics.rs"));
    }

    @Test
    void readInterchange_ShouldRejectInvalidDocumentWithBadRequest() throws Exception {
        mockMvc.perform(post("/api/parse/interchange")
                        .contentType(MediaType.APPLICATION_XML)
                        .content("<xml><block type=\"rust_class\"/></xml>"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.errors[0].message")
                        .value("Invalid interchange document: Unknown block type: rust_class"));
    }

    @Test
    void readInterchange_ShouldLoadValidDocument() throws Exception {
        String document = "<xml><block type=\"file_container\"><field name=\"FILENAME\">a.rs</field>"
                + "<statement name=\"CONTENTS\"><block type=\"rust_use\" id=\"u\"><field name=\"PATH\">a::b</field>"
                + "</block></statement></block></xml>";

        mockMvc.perform(post("/api/parse/interchange")
                        .contentType(MediaType.TEXT_PLAIN)
                        .content(document))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.filename").value("a.rs"))
                .andExpect(jsonPath("$.nodes[0].id").value("u"));
    }

    @Test
    void health_ShouldReturnOk() throws Exception {
        mockMvc.perform(get("/api/parse/health"))
                .andExpect(status().isOk())
                .andExpect(content().string("OK - Block Bridge parser"));
    }
}
