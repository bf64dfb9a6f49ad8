package com.baufi.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.concurrent.Executor;

/**
 * Named thread pool for portfolio fan-out: each mortgage's progress is computed independently and joined.
 */
@Configuration
public class AsyncConfig {

    public static final String PORTFOLIO_EXECUTOR = "portfolio-executor";

    @Bean(name = PORTFOLIO_EXECUTOR)
    public Executor portfolioExecutor() {
        ThreadPoolTaskExecutor e = new ThreadPoolTaskExecutor();
        e.setCorePoolSize(4);
        e.setMaxPoolSize(4);
        e.setThreadNamePrefix("portfolio-");
        e.initialize();
        return e;
    }
}
