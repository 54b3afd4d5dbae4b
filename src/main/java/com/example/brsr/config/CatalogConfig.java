package com.example.brsr.config;

import com.example.brsr.model.IndicatorCatalog;
import com.example.brsr.repository.ExtractionStore;
import com.example.brsr.service.IndicatorCatalogSeeder;
import com.example.brsr.service.NumericRangeTable;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.io.ResourceLoader;

import java.io.IOException;

/**
 * Reference data loaded once per worker: the indicator catalog and the numeric range table.
 */
@Configuration
public class CatalogConfig {

    private static final Logger log = LoggerFactory.getLogger(CatalogConfig.class);

    @Bean
    public IndicatorCatalog indicatorCatalog(ExtractionProperties properties,
                                             IndicatorCatalogSeeder seeder,
                                             ExtractionStore store) {
        if (properties.catalog().seedOnStartup()) {
            seeder.seedIfEmpty();
        }
        IndicatorCatalog catalog = store.loadIndicatorCatalog();
        if (catalog.isEmpty()) {
            log.warn("Indicator catalog is empty: every document will fail until it is populated");
        } else {
            log.info("Indicator catalog loaded: {} definitions", catalog.size());
        }
        return catalog;
    }

    @Bean
    public NumericRangeTable numericRangeTable(ExtractionProperties properties,
                                               ResourceLoader resourceLoader,
                                               ObjectMapper objectMapper) throws IOException {
        String location = properties.validation().rangeTable();
        NumericRangeTable table = NumericRangeTable.load(resourceLoader.getResource(location), objectMapper);
        log.info("Numeric range table loaded from {}: {} entries", location, table.size());
        return table;
    }
}
