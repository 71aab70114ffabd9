package com.vidnyan.depscope;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * depscope - dependency graph analysis engine.
 *
 * Extracts references from module and infrastructure sources and
 * derives cycles, centrality and closures from the resulting graph.
 */
@SpringBootApplication
public class DepscopeApplication {

    public static void main(String[] args) {
        SpringApplication.run(DepscopeApplication.class, args);
    }
}
