package com.example.brsr.service;

import com.example.brsr.config.ExtractionProperties;
import com.example.brsr.model.IndicatorDefinition;
import com.example.brsr.repository.IndicatorDefinitionRepository;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.io.Resource;
import org.springframework.core.io.ResourceLoader;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.util.List;

/**
 * Loads the BRSR Core indicator seed into an empty catalog collection.
 */
@Component
public class IndicatorCatalogSeeder {

    private static final Logger log = LoggerFactory.getLogger(IndicatorCatalogSeeder.class);

    private final IndicatorDefinitionRepository repository;
    private final ResourceLoader resourceLoader;
    private final ObjectMapper objectMapper;
    private final String seedLocation;

    public IndicatorCatalogSeeder(IndicatorDefinitionRepository repository, ResourceLoader resourceLoader,
                                  ObjectMapper objectMapper, ExtractionProperties properties) {
        this.repository = repository;
        this.resourceLoader = resourceLoader;
        this.objectMapper = objectMapper;
        this.seedLocation = properties.catalog().seedLocation();
    }

    /**
     * @return number of definitions inserted, 0 if the catalog already had entries
     */
    public int seedIfEmpty() {
        long existing = repository.count();
        if (existing > 0) {
            log.info("Indicator catalog already holds {} definitions, seed skipped", existing);
            return 0;
        }
        List<IndicatorDefinition> definitions = readSeed();
        repository.saveAll(definitions);
        log.info("Seeded {} indicator definitions from {}", definitions.size(), seedLocation);
        return definitions.size();
    }

    List<IndicatorDefinition> readSeed() {
        Resource resource = resourceLoader.getResource(seedLocation);
        try (InputStream in = resource.getInputStream()) {
            return objectMapper.readValue(in, new TypeReference<List<IndicatorDefinition>>() {});
        } catch (IOException e) {
            throw new IllegalStateException("Cannot read indicator seed " + seedLocation, e);
        }
    }
}
