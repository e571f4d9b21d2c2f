package com.tarterware.cvi.models.geojson;

import java.util.ArrayList;
import java.util.List;

import org.locationtech.jts.geom.Coordinate;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * GeoJSON LineString geometry: a list of [longitude, latitude] positions.
 */
@NoArgsConstructor
@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public class Geometry
{
    public static final String LINE_STRING = "LineString";

    @JsonProperty("type")
    String theType = LINE_STRING;

    List<List<Double>> coordinates = new ArrayList<>();

    public static Geometry lineString(List<Coordinate> coordinates)
    {
        Geometry geometry = new Geometry();
        for (Coordinate c : coordinates)
        {
            List<Double> position = new ArrayList<>(2);
            position.add(c.x);
            position.add(c.y);
            geometry.getCoordinates().add(position);
        }
        return geometry;
    }
}
