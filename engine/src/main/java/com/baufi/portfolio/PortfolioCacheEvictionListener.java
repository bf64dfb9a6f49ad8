package com.baufi.portfolio;

import com.baufi.config.CaffeineConfig;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.cache.Cache;
import org.springframework.cache.CacheManager;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
@Slf4j
public class PortfolioCacheEvictionListener {

    private final CacheManager cacheManager;

    @EventListener
    public void onPortfolioChanged(PortfolioChangedEvent event) {
        Cache cache = cacheManager.getCache(CaffeineConfig.PORTFOLIO_SUMMARY_CACHE);
        if (cache != null) {
            cache.clear();
            log.debug("Portfolio summary cache cleared after {} of {}", event.getChangeType(), event.getMortgageId());
        }
    }
}
