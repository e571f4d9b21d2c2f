package com.tarterware.cvi.models.config;

import java.util.Map;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Threshold classes of one dimension, keyed by rank. Ordinary dimensions list
 * them under {@code classes}; the composite dimension under {@code fixed}.
 */
@NoArgsConstructor
@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public class DimensionConfig
{
    private Map<String, ClassSpec> classes;

    private Map<String, ClassSpec> fixed;

    // Raw class -> CVI rank
    private Map<String, Integer> rescale;

    public Map<String, ClassSpec> getEntries()
    {
        return classes != null ? classes : fixed;
    }
}
