package com.syncbridge.api;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Main application entry point for SyncBridge.
 */
@SpringBootApplication
public class SyncBridgeApplication {

    public static void main(String[] args) {
        SpringApplication.run(SyncBridgeApplication.class, args);
    }
}
