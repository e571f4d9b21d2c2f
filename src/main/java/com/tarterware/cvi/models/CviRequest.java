package com.tarterware.cvi.models;

import java.util.LinkedHashMap;
import java.util.Map;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.tarterware.cvi.models.geojson.FeatureCollection;

import lombok.Data;
import lombok.NoArgsConstructor;

@NoArgsConstructor
@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public class CviRequest
{
    // Transects as produced by the transect generator.
    private FeatureCollection transects;

    // Scored transects by dimension name; joined on the "label" property.
    private Map<String, FeatureCollection> scoreLayers = new LinkedHashMap<>();
}
