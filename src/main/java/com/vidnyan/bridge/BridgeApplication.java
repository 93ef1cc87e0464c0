package com.vidnyan.bridge;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Block Bridge - converts Rust, WGSL, Bevy and Biospheres source into
 * visual editor blocks and back into the editor's interchange format.
 */
@SpringBootApplication
public class BridgeApplication {

    public static void main(String[] args) {
        SpringApplication.run(BridgeApplication.class, args);
    }
}
