package com.grantlens.search.execution;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class SearchExecutionConfig {

    @Bean(destroyMethod = "shutdown")
    public ExecutorService searchExecutor(@Value("${search.execution.pool-size:8}") int poolSize) {
        return Executors.newFixedThreadPool(Math.max(2, poolSize));
    }

    // lexical fan-out runs on its own pool so stage tasks never wait on their own sub-queries
    @Bean(destroyMethod = "shutdown")
    public ExecutorService subQueryExecutor(@Value("${search.execution.sub-query-pool-size:32}") int poolSize) {
        return Executors.newFixedThreadPool(Math.max(2, poolSize));
    }
}
