package com.tarterware.cvi.controllers;

import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import com.tarterware.cvi.models.TransectRequest;
import com.tarterware.cvi.models.geojson.FeatureCollection;
import com.tarterware.cvi.services.TransectService;

@RestController
@RequestMapping("/api/transects")
public class TransectController
{
    @Autowired
    TransectService transectService;
    
    @PostMapping("/generate")
    ResponseEntity<FeatureCollection> generateTransects(@RequestBody TransectRequest transectRequest)
    {
        FeatureCollection transects = null;
        try
        {
            transects = transectService.generateTransects(transectRequest);
        }
        catch(IllegalArgumentException ex)
        {
            return new ResponseEntity<FeatureCollection>(HttpStatus.BAD_REQUEST);
        }
        
        return new ResponseEntity<FeatureCollection>(transects, HttpStatus.OK);
    }
}
