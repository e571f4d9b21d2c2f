package com.tarterware.cvi.models;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

import lombok.Getter;
import lombok.ToString;

/**
 * The per-dimension threshold tables plus the table for the composite index.
 * Dimension order follows the configuration.
 */
@Getter
@ToString
public class ThresholdTableSet
{
    private final Map<String, ThresholdTable> dimensionTables;

    private final ThresholdTable compositeTable;

    public ThresholdTableSet(Map<String, ThresholdTable> dimensionTables, ThresholdTable compositeTable)
    {
        if (compositeTable == null)
        {
            throw new IllegalArgumentException("compositeTable cannot be null!");
        }
        this.dimensionTables = Collections.unmodifiableMap(new LinkedHashMap<>(dimensionTables));
        this.compositeTable = compositeTable;
    }

    public Set<String> getDimensions()
    {
        return dimensionTables.keySet();
    }

    public ThresholdTable getDimensionTable(String dimension)
    {
        return dimensionTables.get(dimension);
    }
}
