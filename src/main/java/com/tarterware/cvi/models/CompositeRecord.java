package com.tarterware.cvi.models;

import java.util.Map;
import java.util.OptionalDouble;

import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.ToString;

/**
 * The composite index of one transect: the raw value, its dataset-normalized
 * counterpart, the classification of the raw value, and the classification of
 * each contributing dimension score.
 */
@Getter
@ToString
@AllArgsConstructor
public class CompositeRecord
{
    private final String label;

    private final OptionalDouble raw;

    private final OptionalDouble normalized;

    private final Classification classification;

    private final Map<String, Classification> dimensionClassifications;
}
