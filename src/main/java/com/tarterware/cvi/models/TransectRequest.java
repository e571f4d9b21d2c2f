package com.tarterware.cvi.models;

import java.util.ArrayList;
import java.util.List;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import lombok.Data;
import lombok.NoArgsConstructor;

@NoArgsConstructor
@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public class TransectRequest
{
    // Coastline line strings, each a list of [longitude, latitude] positions.
    private List<List<List<Double>>> coastline = new ArrayList<>();

    // Sampling parameters in meters; service defaults apply when null.
    private Double spacing;
    private Double transectLength;
    private Double maxTotalLength;
}
