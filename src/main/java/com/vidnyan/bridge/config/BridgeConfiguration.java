package com.vidnyan.bridge.config;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.vidnyan.bridge.ParserProperties;
import com.vidnyan.bridge.application.port.out.DialectParser;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.List;

/**
 * Spring configuration for the bridge components.
 */
@Slf4j
@Configuration
public class BridgeConfiguration {

    /**
     * ObjectMapper for the REST layer.
     */
    @Bean
    public ObjectMapper objectMapper() {
        return new ObjectMapper()
                .findAndRegisterModules()
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false)
                .configure(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS, false)
                .configure(SerializationFeature.INDENT_OUTPUT, true);
    }

    /**
     * Log available dialect parsers and limits on startup.
     */
    @Bean
    public String logDialectParsers(List<DialectParser> parsers, ParserProperties properties) {
        log.info("Registered {} dialect parsers:", parsers.size());
        parsers.forEach(p -> log.info("  - {} ({})", p.dialect().displayName(), p.getClass().getSimpleName()));
        log.info("Limits: {} declarations per parse, nesting depth {}",
                properties.getMaxDeclarations(), properties.getMaxNestingDepth());
        return "parsers-logged";
    }
}
