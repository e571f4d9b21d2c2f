package com.tarterware.cvi.controllers;

import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import com.tarterware.cvi.models.CviRequest;
import com.tarterware.cvi.models.ThresholdTableSet;
import com.tarterware.cvi.models.geojson.FeatureCollection;
import com.tarterware.cvi.services.CviService;
import com.tarterware.cvi.services.ThresholdConfigService;

@RestController
@RequestMapping("/api/cvi")
public class CviController
{
    @Autowired
    CviService cviService;

    @Autowired
    ThresholdConfigService thresholdConfigService;

    @PostMapping("/compute")
    ResponseEntity<FeatureCollection> computeCvi(@RequestBody CviRequest cviRequest)
    {
        FeatureCollection transects = null;
        try
        {
            transects = cviService.computeCvi(cviRequest);
        }
        catch (IllegalArgumentException ex)
        {
            return new ResponseEntity<FeatureCollection>(HttpStatus.BAD_REQUEST);
        }

        return new ResponseEntity<FeatureCollection>(transects, HttpStatus.OK);
    }

    @GetMapping("/thresholds")
    ResponseEntity<ThresholdTableSet> getThresholds()
    {
        return new ResponseEntity<ThresholdTableSet>(thresholdConfigService.getTableSet(), HttpStatus.OK);
    }
}
