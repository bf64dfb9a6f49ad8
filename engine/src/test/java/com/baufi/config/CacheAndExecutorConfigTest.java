package com.baufi.config;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.cache.CacheManager;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.time.Clock;
import java.util.concurrent.Executor;

import static org.assertj.core.api.Assertions.assertThat;

@SpringBootTest(classes = {
        CaffeineConfig.class,
        AsyncConfig.class,
        ClockConfig.class
})
class CacheAndExecutorConfigTest {

    @Autowired
    CacheManager cacheManager;

    @Autowired
    @Qualifier(AsyncConfig.PORTFOLIO_EXECUTOR)
    Executor portfolioExecutor;

    @Autowired
    Clock clock;

    @Test
    @DisplayName("all 3 Caffeine caches are created and usable")
    void cachesCreatedAndUsed() {
        assertThat(cacheManager.getCache(CaffeineConfig.LOAN_ANALYSIS_CACHE)).isNotNull();
        assertThat(cacheManager.getCache(CaffeineConfig.AMORTIZATION_SCHEDULE_CACHE)).isNotNull();
        assertThat(cacheManager.getCache(CaffeineConfig.PORTFOLIO_SUMMARY_CACHE)).isNotNull();

        cacheManager.getCache(CaffeineConfig.LOAN_ANALYSIS_CACHE).put("key1", "value1");
        assertThat(cacheManager.getCache(CaffeineConfig.LOAN_ANALYSIS_CACHE).get("key1").get()).isEqualTo("value1");
    }

    @Test
    @DisplayName("portfolio executor is created with 4 threads")
    void executorCreated() {
        assertThat(portfolioExecutor).isInstanceOf(ThreadPoolTaskExecutor.class);
        ThreadPoolTaskExecutor executor = (ThreadPoolTaskExecutor) portfolioExecutor;
        assertThat(executor.getCorePoolSize()).isEqualTo(4);
        assertThat(executor.getMaxPoolSize()).isEqualTo(4);
        assertThat(executor.getThreadNamePrefix()).isEqualTo("portfolio-");
    }

    @Test
    void systemClock() {
        assertThat(clock).isNotNull();
    }
}
