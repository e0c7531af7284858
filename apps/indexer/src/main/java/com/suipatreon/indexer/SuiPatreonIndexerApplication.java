package com.suipatreon.indexer;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * Sui Patreon event indexer
 * Polls contract events from a Sui fullnode and indexes them into PostgreSQL
 */
@SpringBootApplication
@EnableScheduling
public class SuiPatreonIndexerApplication {

    private static final Logger logger = LoggerFactory.getLogger(SuiPatreonIndexerApplication.class);

    public static void main(String[] args) {
        logger.info("Starting Sui Patreon Indexer...");
        SpringApplication.run(SuiPatreonIndexerApplication.class, args);
    }
}
