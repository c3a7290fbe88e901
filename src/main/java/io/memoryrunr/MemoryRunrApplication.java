package io.memoryrunr;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * MemoryRunr: semantic memory for agent runtimes, powered by Spring AI and SQLite.
 */
@SpringBootApplication
public class MemoryRunrApplication {

    public static void main(String[] args) {
        SpringApplication.run(MemoryRunrApplication.class, args);
    }
}
