package com.tarterware.cvi.models.config;

import java.util.List;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import lombok.Data;
import lombok.NoArgsConstructor;

@NoArgsConstructor
@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public class ClassSpec
{
    // Null means unbounded
    private Double min;
    private Double max;

    private String label;

    // Palette reference; defaults to the rank
    private String palette;

    // Literal color, used when no palette reference is given
    private String color;

    // Category codes covered by this class
    private List<Integer> codes;
}
