package com.eventspotter.catalog.infrastructure.web;

/**
 * Headers set by the authentication layer in front of the catalog.
 */
final class CallerHeaders {

    static final String USER_ID = "X-User-Id";

    private CallerHeaders() {
    }
}
