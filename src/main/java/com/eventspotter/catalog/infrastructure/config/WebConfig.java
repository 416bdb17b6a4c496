package com.eventspotter.catalog.infrastructure.config;

import com.eventspotter.catalog.infrastructure.web.RateLimitInterceptor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.servlet.config.annotation.CorsRegistry;
import org.springframework.web.servlet.config.annotation.InterceptorRegistry;
import org.springframework.web.servlet.config.annotation.WebMvcConfigurer;

/**
 * CORS mapping and request rate limiting for everything under {@code /api}.
 */
@Configuration
@EnableConfigurationProperties({CorsProperties.class, RateLimitProperties.class})
public class WebConfig implements WebMvcConfigurer {

    private static final Logger logger = LoggerFactory.getLogger(WebConfig.class);

    private final CorsProperties corsProperties;
    private final RateLimitProperties rateLimitProperties;

    public WebConfig(CorsProperties corsProperties, RateLimitProperties rateLimitProperties) {
        this.corsProperties = corsProperties;
        this.rateLimitProperties = rateLimitProperties;
    }

    @Override
    public void addCorsMappings(CorsRegistry registry) {
        String[] origins = corsProperties.getAllowedOrigins().stream()
                .map(String::trim)
                .filter(origin -> !origin.isEmpty())
                .toArray(String[]::new);

        // Credentialed CORS only accepts "*" as an origin pattern
        registry.addMapping("/api/**")
                .allowedOriginPatterns(origins)
                .allowedMethods("GET", "POST", "PUT", "PATCH", "DELETE", "OPTIONS")
                .allowedHeaders("*")
                .allowCredentials(true)
                .maxAge(corsProperties.getMaxAgeSeconds());
    }

    @Override
    public void addInterceptors(InterceptorRegistry registry) {
        if (!rateLimitProperties.isEnabled()) {
            logger.info("API rate limiting disabled");
            return;
        }
        logger.info("API rate limiting at {} requests per {}",
                rateLimitProperties.getMaxRequests(), rateLimitProperties.getWindow());
        registry.addInterceptor(new RateLimitInterceptor(rateLimitProperties))
                .addPathPatterns("/api/**");
    }
}
