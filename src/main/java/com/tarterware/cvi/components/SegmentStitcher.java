package com.tarterware.cvi.components;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;

import org.locationtech.jts.geom.Coordinate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import com.tarterware.cvi.exceptions.EmptyInputException;
import com.tarterware.cvi.geometry.LineSegment;
import com.tarterware.cvi.geometry.Polyline;

/**
 * Reconstructs one continuous coastline from an unordered set of line
 * segments.
 *
 * <p>
 * The chain is built by greedy nearest-neighbor joining:
 * <ol>
 * <li>The segment whose first coordinate has the smallest x (the westernmost
 * start) seeds the chain in its original orientation.</li>
 * <li>While segments remain, the distance from the chain's current end to the
 * first and to the last coordinate of every remaining segment is measured. The
 * overall closest candidate wins; the first minimum encountered wins ties, and a
 * segment's first coordinate is checked before its last.</li>
 * <li>The winner is appended, reversed if its last coordinate was the closest.
 * Its leading coordinate is the shared joint and is dropped.</li>
 * </ol>
 * </p>
 *
 * <p>
 * The result is not globally optimal, and the cost is O(n^2) in the number of
 * segments.
 * </p>
 */
@Component
public class SegmentStitcher
{
    // Segment count above which the quadratic cost is worth a warning.
    @Value("${com.tarterware.cvi.stitch-warning-threshold:5000}")
    private int stitchWarningThreshold = 5000;

    private static final Logger logger = LoggerFactory.getLogger(SegmentStitcher.class);

    /**
     * Orders the given segments into a single polyline.
     *
     * @param segments Unordered segments in a shared planar frame.
     * @return The stitched polyline.
     * @throws EmptyInputException if there are no segments.
     */
    public Polyline stitch(Collection<LineSegment> segments)
    {
        if (segments == null || segments.isEmpty())
        {
            throw new EmptyInputException("No coastline segments to stitch!");
        }

        if (segments.size() > stitchWarningThreshold)
        {
            logger.warn("Stitching {} segments; greedy ordering is quadratic in segment count.", segments.size());
        }

        List<LineSegment> remaining = new ArrayList<>(segments);

        // Seed with the westernmost start.
        int seedIndex = 0;
        for (int i = 1; i < remaining.size(); ++i)
        {
            if (remaining.get(i).getFirst().x < remaining.get(seedIndex).getFirst().x)
            {
                seedIndex = i;
            }
        }

        LineSegment seed = remaining.remove(seedIndex);
        List<Coordinate> chain = new ArrayList<>(seed.getCoordinates());

        while (!remaining.isEmpty())
        {
            Coordinate endPoint = chain.get(chain.size() - 1);

            int bestIndex = -1;
            double bestDistance = Double.POSITIVE_INFINITY;
            boolean bestFlip = false;

            for (int i = 0; i < remaining.size(); ++i)
            {
                LineSegment candidate = remaining.get(i);

                double startDistance = endPoint.distance(candidate.getFirst());
                if (startDistance < bestDistance)
                {
                    bestIndex = i;
                    bestDistance = startDistance;
                    bestFlip = false;
                }

                double endDistance = endPoint.distance(candidate.getLast());
                if (endDistance < bestDistance)
                {
                    bestIndex = i;
                    bestDistance = endDistance;
                    bestFlip = true;
                }
            }

            // Only reachable with non-finite coordinates; keep input order.
            if (bestIndex < 0)
            {
                bestIndex = 0;
            }

            LineSegment winner = remaining.remove(bestIndex);
            if (bestFlip)
            {
                winner = winner.reversed();
            }

            List<Coordinate> coordinates = winner.getCoordinates();
            chain.addAll(coordinates.subList(1, coordinates.size()));

            logger.debug("Joined segment at distance {} (reversed: {}); {} remaining.", bestDistance, bestFlip,
                    remaining.size());
        }

        logger.info("Stitched {} segments into a polyline of {} points.", segments.size(), chain.size());

        return new Polyline(chain);
    }

    public void setStitchWarningThreshold(int stitchWarningThreshold)
    {
        this.stitchWarningThreshold = stitchWarningThreshold;
    }
}
