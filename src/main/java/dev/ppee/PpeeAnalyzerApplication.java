package dev.ppee;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.retry.annotation.EnableRetry;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * Entry point for the PPEE document analyzer.
 *
 * <p>Serves the asynchronous search and checklist analysis API over REST and MCP on port 8080.
 */
@SpringBootApplication
@EnableRetry
@EnableScheduling
public class PpeeAnalyzerApplication {
    public static void main(String[] args) {
        SpringApplication.run(PpeeAnalyzerApplication.class, args);
    }
}
