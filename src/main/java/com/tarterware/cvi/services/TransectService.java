package com.tarterware.cvi.services;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.concurrent.atomic.AtomicReference;

import org.locationtech.jts.geom.Coordinate;
import org.locationtech.proj4j.CoordinateTransform;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import com.tarterware.cvi.components.SegmentStitcher;
import com.tarterware.cvi.components.TransectSampler;
import com.tarterware.cvi.exceptions.EmptyInputException;
import com.tarterware.cvi.geometry.LineSegment;
import com.tarterware.cvi.geometry.Polyline;
import com.tarterware.cvi.geometry.Transect;
import com.tarterware.cvi.models.TransectRequest;
import com.tarterware.cvi.models.TransectSampling;
import com.tarterware.cvi.models.geojson.Feature;
import com.tarterware.cvi.models.geojson.FeatureCollection;
import com.tarterware.cvi.models.geojson.Geometry;
import com.tarterware.cvi.utilities.TopologyUtilities;

import io.micrometer.core.instrument.MeterRegistry;

/**
 * Generates coastline transects from geodetic coastline geometry.
 *
 * <p>
 * The {@code TransectService} class:
 * <ul>
 * <li>Projects WGS84 coastline line strings into the UTM zone of the first
 * coordinate, so that spacing and lengths are in meters.</li>
 * <li>Stitches the segments into one polyline and samples transects along
 * it.</li>
 * <li>Projects the transects back to WGS84 as a GeoJSON feature
 * collection.</li>
 * </ul>
 * </p>
 */
@Service
public class TransectService
{
    // Default distance between transects, in meters.
    @Value("${com.tarterware.cvi.transect-spacing:50}")
    private double defaultSpacing = 50.0;

    // Default transect length, in meters.
    @Value("${com.tarterware.cvi.transect-length:400}")
    private double defaultTransectLength = 400.0;

    // Default maximum coastline length processed, in meters.
    @Value("${com.tarterware.cvi.max-total-length:15000}")
    private double defaultMaxTotalLength = 15000.0;

    private final SegmentStitcher segmentStitcher;

    private final TransectSampler transectSampler;

    private final AtomicReference<Double> transectsGenerated = new AtomicReference<>(0.0);
    private final AtomicReference<Double> processedMeters = new AtomicReference<>(0.0);

    public static final String ENDPOINT_TRANSECTS_GENERATED = "cvi.transects.generated";
    public static final String ENDPOINT_PROCESSED_METERS = "cvi.coastline.processed.meters";

    public static final String PROCESSED_LENGTH_PROPERTY = "processed_length_km";

    private static final Logger logger = LoggerFactory.getLogger(TransectService.class);

    /**
     * @param segmentStitcher Orders coastline segments into one polyline.
     * @param transectSampler Samples transects along the polyline.
     * @param meterRegistry   Creates and manages application's set of meters.
     */
    public TransectService(SegmentStitcher segmentStitcher, TransectSampler transectSampler,
            MeterRegistry meterRegistry)
    {
        this.segmentStitcher = segmentStitcher;
        this.transectSampler = transectSampler;

        meterRegistry.gauge(ENDPOINT_TRANSECTS_GENERATED, transectsGenerated, AtomicReference::get);
        meterRegistry.gauge(ENDPOINT_PROCESSED_METERS, processedMeters, AtomicReference::get);
    }

    /**
     * Generates transects for a geodetic coastline.
     *
     * @param request Coastline line strings and optional sampling parameters.
     * @return Transects in WGS84, each with a {@code label} and the processed
     *         coastline length.
     * @throws EmptyInputException if the request holds no usable line string.
     */
    public FeatureCollection generateTransects(TransectRequest request)
    {
        if (request == null || request.getCoastline() == null)
        {
            throw new EmptyInputException("TransectRequest has no coastline!");
        }

        // Keep line strings that have a length to speak of.
        List<List<List<Double>>> lineStrings = new ArrayList<>();
        for (List<List<Double>> lineString : request.getCoastline())
        {
            if (lineString != null && lineString.size() >= 2)
            {
                lineStrings.add(lineString);
            }
            else
            {
                logger.warn("Ignoring coastline line string with fewer than 2 positions.");
            }
        }
        if (lineStrings.isEmpty())
        {
            throw new EmptyInputException("Coastline is empty!");
        }

        // Project into the UTM zone of the first coordinate.
        List<Double> firstPosition = lineStrings.get(0).get(0);
        if (firstPosition == null || firstPosition.size() < 2)
        {
            throw new IllegalArgumentException("Position needs at least 2 ordinates: " + firstPosition);
        }
        Coordinate reference = new Coordinate(firstPosition.get(0), firstPosition.get(1));
        CoordinateTransform wgs84ToUtmCoordinateTransformer = TopologyUtilities
                .getWgs84ToUtmCoordinateTransformer(reference);
        CoordinateTransform utmToWgs84CoordinateTransformer = TopologyUtilities
                .getUtmToWgs84CoordinateTransformer(reference);

        List<LineSegment> segments = new ArrayList<>(lineStrings.size());
        boolean zoneWarningLogged = false;
        for (List<List<Double>> lineString : lineStrings)
        {
            segments.add(new LineSegment(
                    TopologyUtilities.transformPositions(wgs84ToUtmCoordinateTransformer, lineString)));

            if (!zoneWarningLogged && TopologyUtilities.isNewTransformerNeeded(reference.x, lineString.get(0).get(0)))
            {
                logger.warn("Coastline crosses a UTM zone boundary; projecting in the zone of {}", reference);
                zoneWarningLogged = true;
            }
        }

        TransectSampling sampling = sampleTransects(segments, valueOr(request.getSpacing(), defaultSpacing),
                valueOr(request.getTransectLength(), defaultTransectLength),
                valueOr(request.getMaxTotalLength(), defaultMaxTotalLength));

        double processedKm = TopologyUtilities.convertMetersToKilometers(sampling.getUsableLength());
        FeatureCollection featureCollection = new FeatureCollection();
        for (Transect transect : sampling.getTransects())
        {
            Coordinate start = TopologyUtilities.transform(utmToWgs84CoordinateTransformer, transect.getStart());
            Coordinate end = TopologyUtilities.transform(utmToWgs84CoordinateTransformer, transect.getEnd());

            Feature feature = new Feature(Geometry.lineString(Arrays.asList(start, end)));
            feature.putProperty(Feature.LABEL_PROPERTY, transect.getLabel());
            feature.putProperty(PROCESSED_LENGTH_PROPERTY, processedKm);
            featureCollection.getFeatures().add(feature);
        }

        logger.info("Saved {} transects", featureCollection.getFeatures().size());

        return featureCollection;
    }

    /**
     * Stitches planar segments and samples transects along the result.
     *
     * @param segments       Coastline segments in a metric planar frame.
     * @param spacing        Distance between transects.
     * @param transectLength Length of each transect.
     * @param maxTotalLength Maximum coastline length processed.
     * @return The sampled transects.
     */
    public TransectSampling sampleTransects(List<LineSegment> segments, double spacing, double transectLength,
            double maxTotalLength)
    {
        Polyline polyline = segmentStitcher.stitch(segments);
        TransectSampling sampling = transectSampler.sample(polyline, spacing, transectLength, maxTotalLength);

        transectsGenerated.set((double) sampling.getTransects().size());
        processedMeters.set(sampling.getUsableLength());

        return sampling;
    }

    private static double valueOr(Double value, double defaultValue)
    {
        return value == null ? defaultValue : value;
    }
}
