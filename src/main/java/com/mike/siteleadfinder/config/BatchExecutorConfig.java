package com.mike.siteleadfinder.config;

import com.mike.siteleadfinder.util.MdcAwareExecutor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

@Configuration
@Slf4j
public class BatchExecutorConfig {

    @Bean(destroyMethod = "shutdown")
    public ExecutorService batchExecutorService(LeadFinderProperties properties) {
        int concurrency = Math.max(1, properties.getBatch().getConcurrency());
        log.info("BatchExecutorConfig: batch pool with concurrency={}", concurrency);
        return Executors.newFixedThreadPool(concurrency);
    }

    @Bean
    public MdcAwareExecutor batchExecutor(ExecutorService batchExecutorService) {
        return new MdcAwareExecutor(batchExecutorService);
    }
}
