package com.example.brsr.model;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * Immutable view of the indicator catalog, loaded once per worker.
 */
public final class IndicatorCatalog {

    private static final Comparator<IndicatorDefinition> CATALOG_ORDER = Comparator
            .comparingInt(IndicatorDefinition::attributeNumber)
            .thenComparing(IndicatorDefinition::indicatorCode);

    private final List<IndicatorDefinition> definitions;
    private final Map<String, IndicatorDefinition> byCode;

    private IndicatorCatalog(List<IndicatorDefinition> definitions) {
        Map<String, IndicatorDefinition> index = new LinkedHashMap<>();
        for (IndicatorDefinition d : definitions) {
            if (index.putIfAbsent(d.indicatorCode(), d) != null) {
                throw new IllegalArgumentException("Duplicate indicator code in catalog: " + d.indicatorCode());
            }
        }
        this.definitions = List.copyOf(definitions);
        this.byCode = Collections.unmodifiableMap(index);
    }

    public static IndicatorCatalog of(Collection<IndicatorDefinition> definitions) {
        List<IndicatorDefinition> sorted = new ArrayList<>(definitions);
        sorted.sort(CATALOG_ORDER);
        return new IndicatorCatalog(sorted);
    }

    public List<IndicatorDefinition> all() {
        return definitions;
    }

    public Optional<IndicatorDefinition> find(String indicatorCode) {
        return Optional.ofNullable(byCode.get(indicatorCode));
    }

    public int size() {
        return definitions.size();
    }

    public boolean isEmpty() {
        return definitions.isEmpty();
    }

    /**
     * Groups definitions by BRSR attribute number, ascending; catalog order is kept inside a group.
     */
    public static SortedMap<Integer, List<IndicatorDefinition>> groupByAttribute(
            Collection<IndicatorDefinition> definitions) {
        SortedMap<Integer, List<IndicatorDefinition>> groups = new TreeMap<>();
        for (IndicatorDefinition d : definitions) {
            groups.computeIfAbsent(d.attributeNumber(), k -> new ArrayList<>()).add(d);
        }
        return groups;
    }
}
