package io.contextrunr;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * ContextRunr: memory-aware chat runtime powered by Spring AI.
 * Builds every prompt from four memory tiers fitted into a fixed token budget.
 */
@SpringBootApplication
public class ContextRunrApplication {

    public static void main(String[] args) {
        SpringApplication.run(ContextRunrApplication.class, args);
    }
}
