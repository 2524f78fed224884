package com.photodb.archiver.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.photodb.archiver.store.FingerprintRepository;
import com.photodb.archiver.store.GeocodeCache;
import com.photodb.archiver.store.KeyValueStore;
import com.photodb.archiver.store.WatermarkRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.nio.file.Paths;

/**
 * Opens the two key-value tables once at startup and closes them on shutdown.
 * A table that cannot be opened fails the context, which aborts the run.
 */
@Configuration
@RequiredArgsConstructor
public class StoreConfig {

    private final ArchiverProperties properties;
    private final ObjectMapper objectMapper;

    @Bean(destroyMethod = "close")
    public KeyValueStore fingerprintStore() {
        return KeyValueStore.open("fingerprint",
                Paths.get(properties.getStore().getFingerprintDb()), objectMapper);
    }

    @Bean(destroyMethod = "close")
    public KeyValueStore geocodeStore() {
        return KeyValueStore.open("geocode",
                Paths.get(properties.getStore().getGeocodeDb()), objectMapper);
    }

    @Bean
    public FingerprintRepository fingerprintRepository() {
        return new FingerprintRepository(fingerprintStore());
    }

    @Bean
    public WatermarkRepository watermarkRepository() {
        return new WatermarkRepository(fingerprintStore());
    }

    @Bean
    public GeocodeCache geocodeCache() {
        return new GeocodeCache(geocodeStore());
    }
}
