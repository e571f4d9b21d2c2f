package com.tarterware.cvi.models.config;

import java.util.LinkedHashMap;
import java.util.Map;

import com.fasterxml.jackson.annotation.JsonAnySetter;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Root of the scoring configuration document. Every top-level key other than
 * {@code meta} is a dimension; {@code total_cvi} is the composite dimension.
 */
@NoArgsConstructor
@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public class CviConfig
{
    public static final String COMPOSITE_DIMENSION = "total_cvi";

    @JsonProperty("meta")
    private MetaConfig meta;

    private Map<String, DimensionConfig> dimensions = new LinkedHashMap<>();

    @JsonAnySetter
    public void putDimension(String name, DimensionConfig dimension)
    {
        dimensions.put(name, dimension);
    }
}
