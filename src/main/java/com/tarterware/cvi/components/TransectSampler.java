package com.tarterware.cvi.components;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import org.locationtech.jts.geom.Coordinate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import com.tarterware.cvi.geometry.Polyline;
import com.tarterware.cvi.geometry.Transect;
import com.tarterware.cvi.models.TransectSampling;
import com.tarterware.cvi.utilities.TopologyUtilities;

/**
 * Walks a polyline at a fixed arc-length spacing and emits a transect
 * perpendicular to the line at each station.
 *
 * <p>
 * The procedure is:
 * <ol>
 * <li>Cap the processed length at {@code maxTotalLength}.</li>
 * <li>Resample the capped portion into {@code floor(usableLength / spacing)}
 * equal arc-length steps, giving a truncated working line.</li>
 * <li>At each station {@code d = i * spacing} short of the truncated line's
 * end, take the point at {@code d} and a probe one unit further along. The
 * normalized difference is the local tangent; its left-hand perpendicular is
 * the transect direction.</li>
 * <li>Emit a transect of {@code transectLength} centered on the point.</li>
 * </ol>
 * Stations whose tangent has zero length are skipped without error, and do not
 * consume a label: labels run {@code T1, T2, ...} in emission order.
 * </p>
 *
 * <p>
 * The output is deterministic for identical input.
 * </p>
 */
@Component
public class TransectSampler
{
    // Forward probe distance for the tangent, in coordinate units.
    public static final double PROBE_DISTANCE = 1.0;

    public static final String LABEL_PREFIX = "T";

    private static final Logger logger = LoggerFactory.getLogger(TransectSampler.class);

    /**
     * Samples transects along the given polyline.
     *
     * @param polyline       The stitched coastline.
     * @param spacing        Arc-length distance between stations.
     * @param transectLength Full length of each transect.
     * @param maxTotalLength Maximum length of coastline to process.
     * @return Transects in emission order along with the processed lengths.
     */
    public TransectSampling sample(Polyline polyline, double spacing, double transectLength, double maxTotalLength)
    {
        if (polyline == null)
        {
            throw new IllegalArgumentException("polyline cannot be null!");
        }
        if (!(spacing > 0.0))
        {
            throw new IllegalArgumentException("spacing must be a positive number: " + spacing);
        }
        if (!(transectLength > 0.0))
        {
            throw new IllegalArgumentException("transectLength must be a positive number: " + transectLength);
        }
        if (!(maxTotalLength > 0.0))
        {
            throw new IllegalArgumentException("maxTotalLength must be a positive number: " + maxTotalLength);
        }

        double totalLength = polyline.getLength();
        double usableLength = Math.min(maxTotalLength, totalLength);
        int numPoints = (int) Math.floor(usableLength / spacing);

        logger.info("Processed coastline distance: {} km (of total {} km)",
                String.format("%.2f", TopologyUtilities.convertMetersToKilometers(usableLength)),
                String.format("%.2f", TopologyUtilities.convertMetersToKilometers(totalLength)));

        // Not even one step fits; there is no line to sample.
        if (numPoints < 1)
        {
            logger.warn("Coastline length {} m is shorter than the spacing {} m; no transects produced.",
                    usableLength, spacing);
            return new TransectSampling(Collections.emptyList(), usableLength, totalLength, 0);
        }

        Polyline truncated = truncate(polyline, usableLength, numPoints);
        double truncatedLength = truncated.getLength();
        double halfLength = transectLength / 2.0;

        List<Transect> transects = new ArrayList<>();
        int skippedCount = 0;
        for (int i = 0; i <= numPoints; ++i)
        {
            double d = i * spacing;
            if (d >= truncatedLength)
            {
                continue;
            }

            Coordinate point = truncated.pointAt(d);
            Coordinate lookahead = truncated.pointAt(Math.min(d + PROBE_DISTANCE, truncatedLength));

            double dx = lookahead.x - point.x;
            double dy = lookahead.y - point.y;
            double norm = Math.hypot(dx, dy);
            if (norm == 0.0)
            {
                logger.debug("Skipping station at {} m; tangent has zero length.", d);
                skippedCount++;
                continue;
            }
            dx /= norm;
            dy /= norm;

            // Left-hand normal.
            double nx = -dy;
            double ny = dx;

            Coordinate start = new Coordinate(point.x - nx * halfLength, point.y - ny * halfLength);
            Coordinate end = new Coordinate(point.x + nx * halfLength, point.y + ny * halfLength);

            int index = transects.size();
            transects.add(new Transect(LABEL_PREFIX + (index + 1), index, d, start, end));
        }

        logger.info("Generated {} transects every {} m ({} stations skipped).", transects.size(), spacing,
                skippedCount);

        return new TransectSampling(transects, usableLength, totalLength, skippedCount);
    }

    /**
     * Resample the first {@code usableLength} of the polyline at
     * {@code numPoints} equal arc-length steps.
     */
    Polyline truncate(Polyline polyline, double usableLength, int numPoints)
    {
        List<Coordinate> coordinates = new ArrayList<>(numPoints + 1);
        double step = usableLength / numPoints;
        for (int j = 0; j <= numPoints; ++j)
        {
            double d = (j == numPoints) ? usableLength : j * step;
            coordinates.add(polyline.pointAt(d));
        }
        return new Polyline(coordinates);
    }
}
