package com.suipatreon.indexer.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.suipatreon.indexer.sui.SuiNetwork;
import com.suipatreon.indexer.sui.SuiRpcClient;
import com.suipatreon.indexer.sync.EventType;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;
import org.springframework.web.client.RestTemplate;

/**
 * Ledger client and the scheduler the per-event-type poll jobs run on.
 */
@Slf4j
@Configuration
public class IndexerConfig {

    private static final int CONNECT_TIMEOUT_MS = 10_000;
    private static final int READ_TIMEOUT_MS = 30_000;

    @Bean
    public SuiRpcClient suiRpcClient(IndexerProperties properties, ObjectMapper objectMapper) {
        String rpcUrl = properties.getRpcUrl() != null && !properties.getRpcUrl().isBlank()
                ? properties.getRpcUrl()
                : SuiNetwork.fromName(properties.getNetwork()).getFullnodeUrl();
        log.info("Using Sui fullnode {}", rpcUrl);

        SimpleClientHttpRequestFactory requestFactory = new SimpleClientHttpRequestFactory();
        requestFactory.setConnectTimeout(CONNECT_TIMEOUT_MS);
        requestFactory.setReadTimeout(READ_TIMEOUT_MS);
        return new SuiRpcClient(rpcUrl, new RestTemplate(requestFactory), objectMapper);
    }

    /**
     * One thread per tracked event type keeps the poll cycles independent.
     * Shutdown waits for running pages to finish.
     */
    @Bean
    public ThreadPoolTaskScheduler indexerTaskScheduler(IndexerProperties properties) {
        ThreadPoolTaskScheduler scheduler = new ThreadPoolTaskScheduler();
        scheduler.setPoolSize(EventType.values().length + 1);
        scheduler.setThreadNamePrefix("indexer-");
        scheduler.setRemoveOnCancelPolicy(true);
        scheduler.setWaitForTasksToCompleteOnShutdown(true);
        scheduler.setAwaitTerminationSeconds(properties.getShutdownTimeoutSeconds());
        return scheduler;
    }
}
