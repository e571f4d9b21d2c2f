package com.tarterware.cvi.services;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.OptionalDouble;
import java.util.OptionalInt;
import java.util.Set;
import java.util.concurrent.atomic.AtomicReference;

import org.locationtech.jts.geom.Coordinate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import com.tarterware.cvi.components.Classifier;
import com.tarterware.cvi.components.CompositeScorer;
import com.tarterware.cvi.components.TransectSampler;
import com.tarterware.cvi.components.TransectSet;
import com.tarterware.cvi.geometry.Transect;
import com.tarterware.cvi.models.Classification;
import com.tarterware.cvi.models.CompositeRecord;
import com.tarterware.cvi.models.CviRequest;
import com.tarterware.cvi.models.ThresholdTable;
import com.tarterware.cvi.models.ThresholdTableSet;
import com.tarterware.cvi.models.geojson.Feature;
import com.tarterware.cvi.models.geojson.FeatureCollection;
import com.tarterware.cvi.utilities.StringUtilities;

import io.micrometer.core.instrument.MeterRegistry;

/**
 * Computes the Coastal Vulnerability Index for a set of transects.
 *
 * <p>
 * Each configured dimension is read from its score layer by transect label:
 * the {@code <dimension>_score} property is used as the dimension's rank, and
 * when only a raw {@code <dimension>_value} is present it is classified into a
 * rank with the dimension's threshold table. Layers that are missing, labels
 * that match no transect, and features without a score all leave the dimension
 * absent for the affected transects.
 * </p>
 *
 * <p>
 * The composite is added to every transect as {@code CVI_equal} (raw),
 * {@code CVI_equal_norm}, {@code CVI_equal_class}, {@code CVI_equal_label} and
 * {@code CVI_equal_color}. Absent values are written as null.
 * </p>
 */
@Service
public class CviService
{
    public static final String SCORE_SUFFIX = "_score";
    public static final String VALUE_SUFFIX = "_value";
    public static final String LABEL_SUFFIX = "_label";
    public static final String COLOR_SUFFIX = "_color";

    public static final String CVI_PROPERTY = "CVI_equal";
    public static final String CVI_NORM_PROPERTY = "CVI_equal_norm";
    public static final String CVI_CLASS_PROPERTY = "CVI_equal_class";
    public static final String CVI_LABEL_PROPERTY = "CVI_equal_label";
    public static final String CVI_COLOR_PROPERTY = "CVI_equal_color";

    public static final String ENDPOINT_COMPOSITE_SCORED = "cvi.composite.scored";

    private final ThresholdConfigService thresholdConfigService;

    private final CompositeScorer compositeScorer;

    private final AtomicReference<Double> compositeScored = new AtomicReference<>(0.0);

    private static final Logger logger = LoggerFactory.getLogger(CviService.class);

    public CviService(ThresholdConfigService thresholdConfigService, CompositeScorer compositeScorer,
            MeterRegistry meterRegistry)
    {
        this.thresholdConfigService = thresholdConfigService;
        this.compositeScorer = compositeScorer;

        meterRegistry.gauge(ENDPOINT_COMPOSITE_SCORED, compositeScored, AtomicReference::get);
    }

    /**
     * Joins the score layers onto the transects and computes the composite.
     *
     * @param request Transects and per-dimension score layers.
     * @return The transects with dimension and composite properties added.
     */
    public FeatureCollection computeCvi(CviRequest request)
    {
        if (request == null || request.getTransects() == null || request.getTransects().getFeatures() == null)
        {
            throw new IllegalArgumentException("CviRequest has no transects!");
        }

        ThresholdTableSet tables = thresholdConfigService.getTableSet();

        // Copies of the input features, in input order.
        List<Feature> features = new ArrayList<>();
        Set<String> usedLabels = new HashSet<>();
        for (Feature input : request.getTransects().getFeatures())
        {
            Feature feature = copyOf(input);
            if (!StringUtilities.isNullEmptyOrBlank(feature.getLabel()))
            {
                usedLabels.add(feature.getLabel());
            }
            features.add(feature);
        }

        // Unlabelled features take the next T<n> that no other feature uses.
        List<Transect> transects = new ArrayList<>();
        int nextLabel = 1;
        for (Feature feature : features)
        {
            if (StringUtilities.isNullEmptyOrBlank(feature.getLabel()))
            {
                while (usedLabels.contains(TransectSampler.LABEL_PREFIX + nextLabel))
                {
                    nextLabel++;
                }
                String label = TransectSampler.LABEL_PREFIX + nextLabel;
                usedLabels.add(label);
                feature.putProperty(Feature.LABEL_PROPERTY, label);
                logger.debug("Labelled unlabelled transect {} as {}", transects.size(), label);
            }
            transects.add(toTransect(feature, transects.size()));
        }

        TransectSet transectSet = new TransectSet(transects);

        Map<String, FeatureCollection> scoreLayers = request.getScoreLayers() == null ? new LinkedHashMap<>()
                : request.getScoreLayers();
        for (String layerName : scoreLayers.keySet())
        {
            if (tables.getDimensionTable(layerName) == null)
            {
                logger.warn("Ignoring score layer {}; no threshold table is configured for it.", layerName);
            }
        }

        for (Map.Entry<String, ThresholdTable> entry : tables.getDimensionTables().entrySet())
        {
            FeatureCollection layer = scoreLayers.get(entry.getKey());
            if (layer == null || layer.getFeatures() == null)
            {
                logger.info("No {} score layer; dimension is absent for every transect.", entry.getKey());
                continue;
            }
            transectSet.attachScores(entry.getKey(), extractScores(entry.getKey(), entry.getValue(), layer));
        }

        List<CompositeRecord> records = compositeScorer.score(transectSet, tables);

        for (int i = 0; i < records.size(); ++i)
        {
            CompositeRecord record = records.get(i);
            Feature feature = features.get(i);

            for (String dimension : tables.getDimensions())
            {
                OptionalDouble score = transectSet.getScoreRecord(record.getLabel()).getScore(dimension);
                Classification classification = record.getDimensionClassifications().get(dimension);
                feature.putProperty(dimension + SCORE_SUFFIX, toNullable(score));
                feature.putProperty(dimension + LABEL_SUFFIX, classification.getLabel());
                feature.putProperty(dimension + COLOR_SUFFIX, classification.getColor());
            }

            feature.putProperty(CVI_PROPERTY, toNullable(record.getRaw()));
            feature.putProperty(CVI_NORM_PROPERTY, toNullable(record.getNormalized()));
            feature.putProperty(CVI_CLASS_PROPERTY, toNullable(record.getClassification().getRank()));
            feature.putProperty(CVI_LABEL_PROPERTY, record.getClassification().getLabel());
            feature.putProperty(CVI_COLOR_PROPERTY, record.getClassification().getColor());
        }

        compositeScored.set((double) records.size());

        FeatureCollection result = new FeatureCollection();
        result.setFeatures(features);
        return result;
    }

    /**
     * Read one dimension's scores from a layer, keyed by label.
     */
    Map<String, Double> extractScores(String dimension, ThresholdTable table, FeatureCollection layer)
    {
        Map<String, Double> scores = new LinkedHashMap<>();
        int unlabelled = 0;
        for (Feature feature : layer.getFeatures())
        {
            if (feature == null || StringUtilities.isNullEmptyOrBlank(feature.getLabel()))
            {
                unlabelled++;
                continue;
            }

            Double score = feature.getNumericProperty(dimension + SCORE_SUFFIX);
            if (score == null)
            {
                Double value = feature.getNumericProperty(dimension + VALUE_SUFFIX);
                if (value != null)
                {
                    OptionalInt rank = Classifier.classifyRaw(OptionalDouble.of(value), table).getRank();
                    score = rank.isPresent() ? Double.valueOf(rank.getAsInt()) : null;
                }
            }
            scores.put(feature.getLabel(), score);
        }

        if (unlabelled > 0)
        {
            logger.warn("{} features of the {} layer have no label and were ignored.", unlabelled, dimension);
        }

        return scores;
    }

    private static Transect toTransect(Feature feature, int index)
    {
        if (feature.getGeometry() == null || feature.getGeometry().getCoordinates() == null
                || feature.getGeometry().getCoordinates().size() < 2)
        {
            throw new IllegalArgumentException("Transect " + feature.getLabel() + " has no line geometry!");
        }

        List<List<Double>> positions = feature.getGeometry().getCoordinates();
        List<Double> first = positions.get(0);
        List<Double> last = positions.get(positions.size() - 1);
        if (first == null || first.size() < 2 || last == null || last.size() < 2)
        {
            throw new IllegalArgumentException("Transect " + feature.getLabel() + " has a malformed position!");
        }

        return new Transect(feature.getLabel(), index, Double.NaN, new Coordinate(first.get(0), first.get(1)),
                new Coordinate(last.get(0), last.get(1)));
    }

    private static Feature copyOf(Feature input)
    {
        if (input == null)
        {
            throw new IllegalArgumentException("Transect collection contains a null feature!");
        }

        Feature copy = new Feature(input.getGeometry());
        if (input.getProperties() != null)
        {
            copy.getProperties().putAll(input.getProperties());
        }
        return copy;
    }

    private static Double toNullable(OptionalDouble value)
    {
        return value.isPresent() ? value.getAsDouble() : null;
    }

    private static Integer toNullable(OptionalInt value)
    {
        return value.isPresent() ? value.getAsInt() : null;
    }
}
