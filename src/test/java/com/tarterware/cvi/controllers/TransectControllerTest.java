package com.tarterware.cvi.controllers;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

import org.junit.jupiter.api.Test;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;

import com.tarterware.cvi.exceptions.EmptyInputException;
import com.tarterware.cvi.models.TransectRequest;
import com.tarterware.cvi.models.geojson.FeatureCollection;
import com.tarterware.cvi.services.TransectService;

class TransectControllerTest
{
    @Test
    void testGenerateTransects()
    {
        FeatureCollection transects = new FeatureCollection();
        TransectController controller = new TransectController();
        controller.transectService = mock(TransectService.class);
        when(controller.transectService.generateTransects(any(TransectRequest.class))).thenReturn(transects);

        ResponseEntity<FeatureCollection> response = controller.generateTransects(new TransectRequest());

        assertEquals(HttpStatus.OK, response.getStatusCode());
        assertSame(transects, response.getBody());
    }

    @Test
    void testEmptyCoastlineIsBadRequest()
    {
        TransectController controller = new TransectController();
        controller.transectService = mock(TransectService.class);
        when(controller.transectService.generateTransects(any(TransectRequest.class)))
                .thenThrow(new EmptyInputException("Coastline is empty!"));

        ResponseEntity<FeatureCollection> response = controller.generateTransects(new TransectRequest());

        assertEquals(HttpStatus.BAD_REQUEST, response.getStatusCode());
    }
}
