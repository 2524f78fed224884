package com.photodb.archiver.config;

import com.photodb.archiver.service.GeocodeThrottle;
import io.github.resilience4j.ratelimiter.RateLimiter;
import io.github.resilience4j.ratelimiter.RateLimiterRegistry;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.client.RestTemplate;

@Configuration
public class GeocoderConfig {

    public static final String RATE_LIMITER_NAME = "geocoder";

    @Bean
    public RestTemplate geocoderRestTemplate(RestTemplateBuilder builder, ArchiverProperties properties) {
        ArchiverProperties.Geocoder geocoder = properties.getGeocoder();
        return builder
                .rootUri(geocoder.getBaseUrl())
                .defaultHeader("User-Agent", geocoder.getUserAgent())
                .setConnectTimeout(geocoder.getConnectTimeout())
                .setReadTimeout(geocoder.getReadTimeout())
                .build();
    }

    /**
     * One process-wide limiter for every reverse-geocode call, whichever worker
     * makes it. Period and wait timeout come from resilience4j.ratelimiter.instances.geocoder.
     */
    @Bean
    public RateLimiter geocoderRateLimiter(RateLimiterRegistry registry) {
        return registry.rateLimiter(RATE_LIMITER_NAME);
    }

    /** Keeps consecutive reverse-geocode calls one full refresh period apart. */
    @Bean
    public GeocodeThrottle geocodeThrottle(RateLimiter geocoderRateLimiter) {
        return new GeocodeThrottle(geocoderRateLimiter);
    }
}
