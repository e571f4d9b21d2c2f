package com.tarterware.cvi.components;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.OptionalDouble;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import com.tarterware.cvi.geometry.Transect;
import com.tarterware.cvi.models.Classification;
import com.tarterware.cvi.models.CompositeRecord;
import com.tarterware.cvi.models.ScoreRecord;
import com.tarterware.cvi.models.ThresholdTable;
import com.tarterware.cvi.models.ThresholdTableSet;
import com.tarterware.cvi.utilities.ScoreStatistics;

/**
 * Combines the per-dimension scores of every transect into a composite
 * vulnerability index.
 *
 * <p>
 * For each transect the present scores of the configured dimensions are
 * gathered and combined as {@code sqrt(product / count)}. This is the index
 * formula of the CVI method, not {@code product^(1/count)}. A
 * transect with no present score has no raw value.
 * </p>
 *
 * <p>
 * Raw values are then min-max normalized across the whole dataset. When every
 * present raw value is equal the normalized value is 0. The composite
 * classification is taken from the raw value, not the normalized one.
 * </p>
 *
 * <p>
 * The transformation is pure and independent of transect order; the dataset
 * range is the only cross-transect dependency.
 * </p>
 */
@Component
public class CompositeScorer
{
    private static final Logger logger = LoggerFactory.getLogger(CompositeScorer.class);

    /**
     * Scores every transect in the set against the given tables.
     *
     * @param transectSet Transects with their attached scores.
     * @param tables      Dimension tables and composite table.
     * @return One record per transect, in transect order.
     */
    public List<CompositeRecord> score(TransectSet transectSet, ThresholdTableSet tables)
    {
        Map<String, ScoreRecord> records = new LinkedHashMap<>();
        for (ScoreRecord record : transectSet.getScoreRecords())
        {
            records.put(record.getLabel(), record);
        }

        return score(transectSet.getTransects(), records, tables.getDimensionTables(), tables.getCompositeTable());
    }

    /**
     * Scores every transect against the given tables.
     *
     * @param transects       Transects to score.
     * @param scoreRecords    Score records by transect label. A transect without
     *                        a record has every dimension absent.
     * @param dimensionTables Tables of the dimensions that contribute to the
     *                        composite.
     * @param compositeTable  Table used to classify the raw composite.
     * @return One record per transect, in transect order.
     */
    public List<CompositeRecord> score(Collection<Transect> transects, Map<String, ScoreRecord> scoreRecords,
            Map<String, ThresholdTable> dimensionTables, ThresholdTable compositeTable)
    {
        if (compositeTable == null)
        {
            throw new IllegalArgumentException("compositeTable cannot be null!");
        }

        // Per-transect raw values and dimension classifications.
        List<String> labels = new ArrayList<>(transects.size());
        List<OptionalDouble> raws = new ArrayList<>(transects.size());
        List<Map<String, Classification>> dimensionClassifications = new ArrayList<>(transects.size());
        ScoreStatistics statistics = new ScoreStatistics();

        for (Transect transect : transects)
        {
            ScoreRecord record = scoreRecords.get(transect.getLabel());
            if (record == null)
            {
                record = new ScoreRecord(transect.getLabel());
            }

            Map<String, Classification> classifications = new LinkedHashMap<>();
            List<Double> present = new ArrayList<>();
            for (Map.Entry<String, ThresholdTable> entry : dimensionTables.entrySet())
            {
                OptionalDouble score = record.getScore(entry.getKey());
                classifications.put(entry.getKey(), Classifier.classifyExact(score, entry.getValue()));
                if (score.isPresent())
                {
                    present.add(score.getAsDouble());
                }
            }

            OptionalDouble raw = computeRaw(present);
            if (!raw.isPresent() && !present.isEmpty())
            {
                logger.warn("Composite for transect {} is undefined for scores {}", transect.getLabel(), present);
            }

            statistics.recordMeasurement(raw);
            labels.add(transect.getLabel());
            raws.add(raw);
            dimensionClassifications.add(classifications);
        }

        // Every raw value is known; normalize and classify.
        List<CompositeRecord> compositeRecords = new ArrayList<>(labels.size());
        for (int i = 0; i < labels.size(); ++i)
        {
            OptionalDouble raw = raws.get(i);
            compositeRecords.add(new CompositeRecord(labels.get(i), raw, statistics.normalize(raw),
                    Classifier.classify(raw, compositeTable), dimensionClassifications.get(i)));
        }

        logger.info("Scored {} transects; {} without data; composite range [{}, {}].", compositeRecords.size(),
                statistics.getAbsentCount(), statistics.getMin(), statistics.getMax());

        return compositeRecords;
    }

    /**
     * Compute {@code sqrt(product / count)} of the present scores.
     *
     * @param present Present scores.
     * @return The raw composite, or empty if there are no scores or the result
     *         is not finite.
     */
    public static OptionalDouble computeRaw(List<Double> present)
    {
        if (present.isEmpty())
        {
            return OptionalDouble.empty();
        }

        double product = 1.0;
        for (double score : present)
        {
            product *= score;
        }

        double raw = Math.sqrt(product / present.size());
        return Double.isFinite(raw) ? OptionalDouble.of(raw) : OptionalDouble.empty();
    }
}
