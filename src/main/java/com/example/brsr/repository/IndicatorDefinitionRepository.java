package com.example.brsr.repository;

import com.example.brsr.model.IndicatorDefinition;
import org.springframework.data.mongodb.repository.MongoRepository;

import java.util.List;

/**
 * BRSR Core indicator catalog (collection brsr_indicators).
 */
public interface IndicatorDefinitionRepository extends MongoRepository<IndicatorDefinition, String> {

    List<IndicatorDefinition> findAllByOrderByAttributeNumberAscIndicatorCodeAsc();
}
