package com.mcpbridge;

import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.builder.SpringApplicationBuilder;

@SpringBootApplication
public class McpBridgeApplication {

    public static void main(String[] args) {
        new SpringApplicationBuilder(McpBridgeApplication.class)
                .properties(
                        "spring.main.web-application-type=none",
                        "spring.main.banner-mode=off"
                )
                .run(args);
    }
}
