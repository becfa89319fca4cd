package com.geotable.config.serializer;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.JsonDeserializer;
import com.fasterxml.jackson.databind.JsonNode;
import org.locationtech.jts.geom.Envelope;
import org.locationtech.jts.geom.Geometry;
import org.locationtech.jts.geom.GeometryFactory;
import org.locationtech.jts.io.ParseException;
import org.locationtech.jts.io.WKTReader;

import java.io.IOException;

/**
 * Custom Jackson deserializer for query areas.
 * Supports WKT and a {@code [lonMin, latMin, lonMax, latMax]} bounding box.
 */
public class GeometryDeserializer extends JsonDeserializer<Geometry> {

    private final GeometryFactory geometryFactory = new GeometryFactory();
    private final WKTReader wktReader = new WKTReader(geometryFactory);

    @Override
    public Geometry deserialize(JsonParser parser, DeserializationContext context) throws IOException {
        JsonNode node = parser.getCodec().readTree(parser);

        if (node.isNull()) {
            return null;
        }

        if (node.has("wkt")) {
            String wkt = node.get("wkt").asText();
            try {
                return wktReader.read(wkt);
            } catch (ParseException e) {
                throw new IOException("Invalid WKT format: " + wkt, e);
            }
        }

        if (node.has("bbox")) {
            JsonNode bbox = node.get("bbox");
            if (!bbox.isArray() || bbox.size() != 4) {
                throw new IOException("bbox must be [lonMin, latMin, lonMax, latMax]");
            }
            for (JsonNode value : bbox) {
                if (!value.isNumber()) {
                    throw new IOException("bbox values must be numbers: " + bbox);
                }
            }
            Envelope envelope = new Envelope(
                    bbox.get(0).asDouble(), bbox.get(2).asDouble(),
                    bbox.get(1).asDouble(), bbox.get(3).asDouble());
            return geometryFactory.toGeometry(envelope);
        }

        throw new IOException("Unsupported geometry format. Expected WKT or bbox format.");
    }
}
