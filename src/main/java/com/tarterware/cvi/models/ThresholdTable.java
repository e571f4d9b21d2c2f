package com.tarterware.cvi.models;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.OptionalDouble;
import java.util.Set;
import java.util.TreeMap;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/**
 * An ordered, validated sequence of {@link ThresholdBin}s for one scoring
 * dimension, ascending by rank. Ranks are unique and every bin has
 * {@code min < max}.
 *
 * <p>
 * A table may also carry a rescale map that converts raw categorical classes
 * from an external source into the CVI rank scale before classification.
 * </p>
 */
@Getter
@ToString
@EqualsAndHashCode
public class ThresholdTable
{
    private final String name;

    private final List<ThresholdBin> bins;

    private final Map<Integer, Integer> rescale;

    public ThresholdTable(String name, List<ThresholdBin> bins)
    {
        this(name, bins, Collections.emptyMap());
    }

    public ThresholdTable(String name, List<ThresholdBin> bins, Map<Integer, Integer> rescale)
    {
        if (bins == null)
        {
            throw new IllegalArgumentException("bins cannot be null!");
        }

        Set<Integer> ranks = new HashSet<>();
        for (ThresholdBin bin : bins)
        {
            if (!ranks.add(bin.getRank()))
            {
                throw new IllegalArgumentException("Duplicate rank " + bin.getRank() + " in table " + name);
            }
            if (!(bin.getMin() < bin.getMax()))
            {
                throw new IllegalArgumentException("Bin " + bin.getRank() + " in table " + name
                        + " has min " + bin.getMin() + " not below max " + bin.getMax());
            }
        }

        List<ThresholdBin> sorted = new ArrayList<>(bins);
        sorted.sort(Comparator.comparingInt(ThresholdBin::getRank));

        this.name = name;
        this.bins = Collections.unmodifiableList(sorted);
        this.rescale = Collections.unmodifiableMap(new TreeMap<>(rescale));
    }

    public int size()
    {
        return bins.size();
    }

    /**
     * Map a raw class onto the CVI scale using the configured rescale map. With
     * no rescale map the value passes through unchanged. A value with no
     * mapping, or one that is not a whole number, becomes absent.
     *
     * @param value Raw value.
     * @return The rescaled value.
     */
    public OptionalDouble rescale(OptionalDouble value)
    {
        if (rescale.isEmpty() || !value.isPresent())
        {
            return value;
        }

        double v = value.getAsDouble();
        if (Double.isNaN(v) || v != Math.rint(v))
        {
            return OptionalDouble.empty();
        }

        Integer mapped = rescale.get((int) v);
        return mapped == null ? OptionalDouble.empty() : OptionalDouble.of(mapped);
    }
}
