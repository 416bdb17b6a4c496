package com.eventspotter.catalog.infrastructure.cache;

public enum FacetType {
    CATEGORIES("categories"),
    RAW_TAGS("raw-tags");

    private final String keySuffix;

    FacetType(String keySuffix) {
        this.keySuffix = keySuffix;
    }

    public String keySuffix() {
        return keySuffix;
    }
}
