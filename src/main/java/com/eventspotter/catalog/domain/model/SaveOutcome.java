package com.eventspotter.catalog.domain.model;

public enum SaveOutcome {
    CREATED,
    ALREADY_EXISTS
}
