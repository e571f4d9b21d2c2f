package com.tarterware.cvi.models;

import java.util.Collections;
import java.util.Set;
import java.util.TreeSet;

import com.fasterxml.jackson.databind.annotation.JsonSerialize;
import com.tarterware.cvi.models.serialization.UnboundedAsNullSerializer;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/**
 * One rule of a {@link ThresholdTable}: values in {@code [min, max)} map to
 * {@code rank}, {@code label} and {@code color}. Either bound may be infinite.
 * Bins of categorical dimensions may also list the category {@code codes}
 * they cover.
 */
@Getter
@ToString
@EqualsAndHashCode
public class ThresholdBin
{
    private final int rank;

    @JsonSerialize(using = UnboundedAsNullSerializer.class)
    private final double min;

    @JsonSerialize(using = UnboundedAsNullSerializer.class)
    private final double max;

    private final String label;

    private final String color;

    private final Set<Integer> codes;

    public ThresholdBin(int rank, double min, double max, String label, String color)
    {
        this(rank, min, max, label, color, Collections.emptySet());
    }

    public ThresholdBin(int rank, double min, double max, String label, String color, Set<Integer> codes)
    {
        this.rank = rank;
        this.min = min;
        this.max = max;
        this.label = label;
        this.color = color;
        this.codes = Collections.unmodifiableSet(new TreeSet<>(codes));
    }

    /**
     * Lower-inclusive, upper-exclusive containment test.
     */
    public boolean contains(double value)
    {
        return value >= min && value < max;
    }

    public Classification toClassification()
    {
        return Classification.of(rank, label, color);
    }
}
