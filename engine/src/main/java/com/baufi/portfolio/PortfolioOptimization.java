package com.baufi.portfolio;

/**
 * One suggestion for a single mortgage. A mortgage may appear under several types.
 */
public record PortfolioOptimization(String mortgageId, String mortgageName, Type type, String description) {

    public enum Type {
        REFINANCING("Umschuldung prüfen"),
        CONSOLIDATION("Zusammenlegung prüfen"),
        HIGH_INTEREST("Hoher Zinssatz");

        private final String label;

        Type(String label) {
            this.label = label;
        }

        public String getLabel() {
            return label;
        }
    }
}
