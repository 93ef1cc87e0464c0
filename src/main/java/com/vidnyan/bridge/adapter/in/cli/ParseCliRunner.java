package com.vidnyan.bridge.adapter.in.cli;

import com.vidnyan.bridge.application.port.in.ParseCodeUseCase;
import com.vidnyan.bridge.application.port.in.ParseCodeUseCase.BatchParseRequest;
import com.vidnyan.bridge.application.port.in.ParseCodeUseCase.BatchParseResponse;
import com.vidnyan.bridge.domain.model.CrossFileReference;
import com.vidnyan.bridge.domain.model.FileParseResult;
import com.vidnyan.bridge.domain.model.ParseError;
import com.vidnyan.bridge.scanner.SourceFileScanner;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.SpringApplication;
import org.springframework.context.ConfigurableApplicationContext;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;

/**
 * CLI Runner for converting a source tree to block documents.
 * Runs when the bridge.parse.path property is set; writes one .blocks.xml per
 * file when bridge.parse.output is set as well.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ParseCliRunner implements CommandLineRunner {

    private static final int MAX_LISTED_DIAGNOSTICS = 50;

    private final ParseCodeUseCase parseCodeUseCase;
    private final SourceFileScanner sourceFileScanner;
    private final ConfigurableApplicationContext context;

    @Value("${bridge.parse.path:}")
    private String sourcePath;

    @Value("${bridge.parse.output:}")
    private String outputPath;

    @Override
    public void run(String... args) throws Exception {
        if (sourcePath == null || sourcePath.isBlank()) {
            log.info("No source path specified. Set bridge.parse.path property.");
            return;
        }

        try {
            log.info("══════════════════════════════════════════════════════════════");
            log.info(" Block Bridge - parsing {}", sourcePath);
            log.info("══════════════════════════════════════════════════════════════");

            Map<String, String> sources = sourceFileScanner.readSources(Path.of(sourcePath));
            log.info("Found {} source files", sources.size());
            BatchParseResponse response = parseCodeUseCase.parseFiles(new BatchParseRequest(sources));

            printResults(response);
            if (outputPath != null && !outputPath.isBlank()) {
                writeDocuments(response, Path.of(outputPath));
            }
            log.info("Parsing complete!");
        } finally {
            SpringApplication.exit(context, () -> 0);
        }
    }

    private void printResults(BatchParseResponse response) {
        log.info("");
        log.info(" RESULTS");
        log.info("──────────────────────────────────────────────────────────────");
        for (FileParseResult result : response.results().values()) {
            log.info(" {} [{}]: {} declarations", result.filename(), result.dialect().tag(), result.nodes().size());
        }
        log.info("──────────────────────────────────────────────────────────────");
        log.info(" Files:       {}", response.results().size());
        log.info(" Nodes:       {}", response.nodeCount());
        log.info(" References:  {}", response.references().size());
        log.info(" Diagnostics: {}", response.errors().size());

        for (CrossFileReference ref : response.references()) {
            log.info("   {} -> {} ({}){}", ref.sourceFile(), ref.targetPath(), ref.kind(),
                    ref.isResolved() ? " resolves to " + ref.resolvedFile() : "");
        }
        int listed = 0;
        for (ParseError error : response.errors()) {
            if (++listed > MAX_LISTED_DIAGNOSTICS) {
                log.info("   ... and {} more diagnostics", response.errors().size() - MAX_LISTED_DIAGNOSTICS);
                break;
            }
            log.info("   {}", error.format());
        }
    }

    private void writeDocuments(BatchParseResponse response, Path outputRoot) throws IOException {
        for (FileParseResult result : response.results().values()) {
            Path target = outputRoot.resolve(result.filename() + ".blocks.xml");
            Files.createDirectories(target.getParent());
            String xml = parseCodeUseCase.toInterchange(result.nodes(), Path.of(result.filename()).getFileName().toString());
            Files.writeString(target, xml, StandardCharsets.UTF_8);
            log.debug("Wrote {}", target);
        }
        log.info("Wrote {} block documents to {}", response.results().size(), outputRoot);
    }
}
