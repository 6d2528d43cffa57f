package com.quantumskylink.orchestration.repository;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.EnableScheduling;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Periodically evicts expired execution contexts and index entries.
 *
 * Reads already treat expired entries as absent; this sweep only bounds
 * memory for executions nobody looks up again.
 */
@Component
@EnableScheduling
public class ExpiredContextSweeper {

    private static final Logger log = LoggerFactory.getLogger(ExpiredContextSweeper.class);

    private final ExecutionContextStore store;

    public ExpiredContextSweeper(ExecutionContextStore store) {
        this.store = store;
    }

    @Scheduled(fixedDelayString = "${skylink.execution.purge-interval-ms:300000}")
    public void sweep() {
        int removed = store.purgeExpired();
        if (removed > 0) {
            log.info("Purged {} expired execution entries", removed);
        }
    }
}
