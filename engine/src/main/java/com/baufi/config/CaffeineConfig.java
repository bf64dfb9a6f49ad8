package com.baufi.config;

import com.github.benmanes.caffeine.cache.Caffeine;
import org.springframework.cache.CacheManager;
import org.springframework.cache.annotation.EnableCaching;
import org.springframework.cache.caffeine.CaffeineCacheManager;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.concurrent.TimeUnit;

/**
 * Caffeine in-process caches. Calculation results are pure functions of immutable inputs, so only the
 * portfolio summary needs explicit eviction (see PortfolioCacheEvictionListener).
 */
@Configuration
@EnableCaching
public class CaffeineConfig {

    public static final String LOAN_ANALYSIS_CACHE = "loanAnalysisCache";
    public static final String AMORTIZATION_SCHEDULE_CACHE = "amortizationScheduleCache";
    public static final String PORTFOLIO_SUMMARY_CACHE = "portfolioSummaryCache";

    @Bean
    public CacheManager caffeineCacheManager() {
        CaffeineCacheManager manager = new CaffeineCacheManager();
        manager.registerCustomCache(LOAN_ANALYSIS_CACHE, Caffeine.newBuilder()
                .expireAfterWrite(60, TimeUnit.MINUTES)
                .maximumSize(1_000)
                .build());
        // schedules hold up to 480 entries each
        manager.registerCustomCache(AMORTIZATION_SCHEDULE_CACHE, Caffeine.newBuilder()
                .expireAfterWrite(60, TimeUnit.MINUTES)
                .maximumSize(200)
                .build());
        manager.registerCustomCache(PORTFOLIO_SUMMARY_CACHE, Caffeine.newBuilder()
                .expireAfterWrite(5, TimeUnit.MINUTES)
                .maximumSize(10)
                .build());
        return manager;
    }
}
