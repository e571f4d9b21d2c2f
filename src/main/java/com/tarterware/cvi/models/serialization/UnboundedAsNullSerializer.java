package com.tarterware.cvi.models.serialization;

import java.io.IOException;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.JsonSerializer;
import com.fasterxml.jackson.databind.SerializerProvider;

/**
 * Serialize an infinite bin bound as null, the same way an unbounded end is
 * written in the threshold configuration.
 */
public class UnboundedAsNullSerializer extends JsonSerializer<Double>
{
    @Override
    public void serialize(Double value, JsonGenerator jsonGenerator, SerializerProvider serializerProvider)
            throws IOException
    {
        if (value == null || value.isInfinite())
        {
            jsonGenerator.writeNull();
        }
        else
        {
            jsonGenerator.writeNumber(value);
        }
    }
}
