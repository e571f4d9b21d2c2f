package com.tarterware.cvi.models;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.OptionalDouble;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/**
 * Per-transect scores keyed by dimension name. A dimension without a score is
 * absent; NaN is never stored.
 */
@ToString
@EqualsAndHashCode
public class ScoreRecord
{
    @Getter
    private final String label;

    private final Map<String, Double> scores = new LinkedHashMap<>();

    public ScoreRecord(String label)
    {
        this.label = label;
    }

    /**
     * Set a dimension's score. Null or NaN clears it.
     */
    public void putScore(String dimension, Double score)
    {
        if (score == null || Double.isNaN(score))
        {
            scores.remove(dimension);
        }
        else
        {
            scores.put(dimension, score);
        }
    }

    public void putScore(String dimension, OptionalDouble score)
    {
        putScore(dimension, score.isPresent() ? score.getAsDouble() : null);
    }

    public OptionalDouble getScore(String dimension)
    {
        Double score = scores.get(dimension);
        return score == null ? OptionalDouble.empty() : OptionalDouble.of(score);
    }

    public Map<String, Double> getScores()
    {
        return Collections.unmodifiableMap(scores);
    }
}
