package com.tarterware.cvi.components;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.tarterware.cvi.geometry.Transect;
import com.tarterware.cvi.models.ScoreRecord;

/**
 * The transects of one pipeline run keyed by their label, together with the
 * score records attached to them.
 *
 * <p>
 * Labels are unique within a set. Scores are joined purely by label: an
 * attachment naming a label that is not in the set is ignored and never
 * creates a transect, and a transect that receives no score for a dimension
 * simply has that dimension absent.
 * </p>
 */
public class TransectSet
{
    private final Map<String, Transect> transects = new LinkedHashMap<>();

    private final Map<String, ScoreRecord> scoreRecords = new LinkedHashMap<>();

    private static final Logger logger = LoggerFactory.getLogger(TransectSet.class);

    public TransectSet(Collection<Transect> transects)
    {
        for (Transect transect : transects)
        {
            if (this.transects.putIfAbsent(transect.getLabel(), transect) != null)
            {
                throw new IllegalArgumentException("Duplicate transect label: " + transect.getLabel());
            }
            scoreRecords.put(transect.getLabel(), new ScoreRecord(transect.getLabel()));
        }
    }

    /**
     * Attaches one dimension's scores, keyed by transect label.
     *
     * @param dimension     Dimension name, e.g. "slope".
     * @param scoresByLabel Score per label; null or NaN scores are absent.
     * @return The number of scores that matched a transect.
     */
    public int attachScores(String dimension, Map<String, Double> scoresByLabel)
    {
        int matched = 0;
        int unknown = 0;
        for (Map.Entry<String, Double> entry : scoresByLabel.entrySet())
        {
            ScoreRecord record = scoreRecords.get(entry.getKey());
            if (record == null)
            {
                logger.debug("Ignoring {} score for unknown transect {}", dimension, entry.getKey());
                unknown++;
                continue;
            }
            record.putScore(dimension, entry.getValue());
            matched++;
        }

        if (unknown > 0)
        {
            logger.info("{} of {} {} scores referenced unknown transects and were ignored.", unknown,
                    scoresByLabel.size(), dimension);
        }

        return matched;
    }

    public boolean contains(String label)
    {
        return transects.containsKey(label);
    }

    public Transect getTransect(String label)
    {
        return transects.get(label);
    }

    public ScoreRecord getScoreRecord(String label)
    {
        return scoreRecords.get(label);
    }

    /**
     * @return Transects in insertion order.
     */
    public List<Transect> getTransects()
    {
        return Collections.unmodifiableList(new ArrayList<>(transects.values()));
    }

    /**
     * @return Score records in transect order.
     */
    public List<ScoreRecord> getScoreRecords()
    {
        return Collections.unmodifiableList(new ArrayList<>(scoreRecords.values()));
    }

    public int size()
    {
        return transects.size();
    }
}
