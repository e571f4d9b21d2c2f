package com.tarterware.cvi.models.geojson;

import java.util.ArrayList;
import java.util.List;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import lombok.Data;
import lombok.NoArgsConstructor;

@NoArgsConstructor
@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public class FeatureCollection {
	@JsonProperty("type")
	String theType = "FeatureCollection";
	
	List<Feature> features = new ArrayList<>();
}
