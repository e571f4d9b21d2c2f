package com.tarterware.cvi.models.config;

import java.util.Map;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import lombok.Data;
import lombok.NoArgsConstructor;

@NoArgsConstructor
@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public class MetaConfig
{
    // Palette reference -> display color
    @JsonProperty("default_palette")
    private Map<String, PaletteEntry> defaultPalette;
}
