package com.eventspotter.catalog.infrastructure.web.dto;

import java.util.List;

public record TagsResponse(List<String> tags) {}
