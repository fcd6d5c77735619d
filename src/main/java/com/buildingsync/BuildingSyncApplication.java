package com.buildingsync;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Building Sync Server
 * Keeps an in-memory, queryable snapshot of building energy data fresh by
 * adaptive polling of the remote source
 */
@SpringBootApplication
public class BuildingSyncApplication {
    public static void main(String[] args) {
        SpringApplication.run(BuildingSyncApplication.class, args);
    }
}
