package com.buildingsync.config.serializer;

import com.buildingsync.model.Footprint;
import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.JsonSerializer;
import com.fasterxml.jackson.databind.SerializerProvider;
import org.locationtech.jts.geom.Coordinate;
import org.locationtech.jts.geom.Envelope;

import java.io.IOException;
import java.util.List;

/**
 * Custom Jackson serializer for building footprints.
 * Writes {@code {"rings":[[[x,y],...]],"bounds":{...}}} for the renderer.
 */
public class FootprintSerializer extends JsonSerializer<Footprint> {
    
    @Override
    public void serialize(Footprint footprint, JsonGenerator gen, SerializerProvider serializers)
            throws IOException {
        if (footprint == null) {
            gen.writeNull();
            return;
        }
        
        gen.writeStartObject();
        gen.writeArrayFieldStart("rings");
        for (List<Coordinate> ring : footprint.getRings()) {
            gen.writeStartArray();
            for (Coordinate c : ring) {
                gen.writeStartArray();
                gen.writeNumber(c.x);
                gen.writeNumber(c.y);
                gen.writeEndArray();
            }
            gen.writeEndArray();
        }
        gen.writeEndArray();
        
        Envelope envelope = footprint.getEnvelope();
        if (!envelope.isNull()) {
            gen.writeObjectFieldStart("bounds");
            gen.writeNumberField("minX", envelope.getMinX());
            gen.writeNumberField("minY", envelope.getMinY());
            gen.writeNumberField("maxX", envelope.getMaxX());
            gen.writeNumberField("maxY", envelope.getMaxY());
            gen.writeEndObject();
        }
        gen.writeBooleanField("usable", footprint.isUsable());
        gen.writeEndObject();
    }
}
