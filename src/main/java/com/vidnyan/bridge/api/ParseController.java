package com.vidnyan.bridge.api;

import com.vidnyan.bridge.application.port.in.ParseCodeUseCase;
import com.vidnyan.bridge.application.port.in.ParseCodeUseCase.BatchParseRequest;
import com.vidnyan.bridge.application.port.in.ParseCodeUseCase.BatchParseResponse;
import com.vidnyan.bridge.application.port.in.ParseCodeUseCase.InterchangeResponse;
import com.vidnyan.bridge.application.port.in.ParseCodeUseCase.ParseRequest;
import com.vidnyan.bridge.application.port.in.ParseCodeUseCase.ParseResponse;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

/**
 * REST API used by the block editor to import source text.
 */
@Slf4j
@RestController
@RequestMapping("/api/parse")
@RequiredArgsConstructor
public class ParseController {

    private final ParseCodeUseCase parseCodeUseCase;

    @PostMapping
    public ParseResponse parse(@RequestBody ParseRequest request) {
        log.info("Received parse request: {} characters, mode {}", request.code().length(), request.mode());
        return parseCodeUseCase.parse(request);
    }

    /**
     * Parse text and return it directly as an editor document.
     */
    @PostMapping(value = "/blocks", produces = MediaType.APPLICATION_XML_VALUE)
    public String parseToBlocks(
            @RequestBody ParseRequest request,
            @RequestParam(value = "filename", required = false) String filename
    ) {
        ParseResponse response = parseCodeUseCase.parse(request);
        return parseCodeUseCase.toInterchange(response.nodes(), filename);
    }

    @PostMapping("/batch")
    public BatchParseResponse parseBatch(@RequestBody BatchParseRequest request) {
        log.info("Received batch parse request: {} files", request.files().size());
        return parseCodeUseCase.parseFiles(request);
    }

    /**
     * Load an editor document back into nodes; an invalid document is a bad request.
     */
    @PostMapping(value = "/interchange", consumes = {MediaType.APPLICATION_XML_VALUE, MediaType.TEXT_XML_VALUE,
            MediaType.TEXT_PLAIN_VALUE})
    public ResponseEntity<InterchangeResponse> readInterchange(@RequestBody String document) {
        InterchangeResponse response = parseCodeUseCase.fromInterchange(document);
        if (!response.isValid()) {
            log.warn("Rejected interchange document: {}", response.errors().get(0).message());
            return ResponseEntity.badRequest().body(response);
        }
        return ResponseEntity.ok(response);
    }

    @GetMapping("/health")
    public String health() {
        return "OK - Block Bridge parser";
    }
}
