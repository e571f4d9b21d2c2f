package com.tarterware.cvi.models;

import java.util.List;

import com.tarterware.cvi.geometry.Transect;

import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.ToString;

/**
 * Transects emitted along a coastline, with the distances that were processed.
 */
@Getter
@ToString
@AllArgsConstructor
public class TransectSampling
{
    // Transects in emission order.
    private final List<Transect> transects;

    // Length of coastline actually sampled, capped by the maximum total length.
    private final double usableLength;

    // Length of the whole stitched coastline.
    private final double totalLength;

    // Sampling stations skipped because the local tangent was degenerate.
    private final int skippedCount;
}
