package com.eventspotter.catalog.infrastructure.web.dto;

import java.util.List;

public record CategoriesResponse(List<String> categories) {}
