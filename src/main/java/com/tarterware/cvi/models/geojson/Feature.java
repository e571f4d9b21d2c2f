package com.tarterware.cvi.models.geojson;

import java.util.LinkedHashMap;
import java.util.Map;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import lombok.Data;
import lombok.NoArgsConstructor;

@NoArgsConstructor
@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public class Feature
{
    public static final String LABEL_PROPERTY = "label";

    @JsonProperty("type")
    String theType = "Feature";

    Geometry geometry;

    Map<String, Object> properties = new LinkedHashMap<>();

    public Feature(Geometry geometry)
    {
        this.geometry = geometry;
    }

    /**
     * @return The transect label, or null if the feature has none.
     */
    @JsonIgnore
    public String getLabel()
    {
        Object label = properties == null ? null : properties.get(LABEL_PROPERTY);
        return label == null ? null : label.toString();
    }

    public void putProperty(String name, Object value)
    {
        if (properties == null)
        {
            properties = new LinkedHashMap<>();
        }
        properties.put(name, value);
    }

    /**
     * Read a numeric property. Missing, null, non-numeric and NaN values are
     * all treated as absent.
     */
    public Double getNumericProperty(String name)
    {
        Object value = properties == null ? null : properties.get(name);
        if (value instanceof Number)
        {
            double d = ((Number) value).doubleValue();
            return Double.isNaN(d) ? null : d;
        }
        return null;
    }
}
