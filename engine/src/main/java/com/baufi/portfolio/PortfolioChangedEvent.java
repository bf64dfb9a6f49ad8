package com.baufi.portfolio;

import lombok.Getter;
import org.springframework.context.ApplicationEvent;

/**
 * Published after a mortgage is saved or deleted. PortfolioCacheEvictionListener drops the cached summaries.
 */
@Getter
public class PortfolioChangedEvent extends ApplicationEvent {

    public enum ChangeType {
        SAVED,
        DELETED
    }

    private final String mortgageId;
    private final ChangeType changeType;

    public PortfolioChangedEvent(Object source, String mortgageId, ChangeType changeType) {
        super(source);
        this.mortgageId = mortgageId;
        this.changeType = changeType;
    }
}
