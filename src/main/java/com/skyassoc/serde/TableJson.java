package com.skyassoc.serde;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.skyassoc.metrics.AssociationStats;
import com.skyassoc.model.AssociatedSource;
import com.skyassoc.model.AssociationResult;
import com.skyassoc.model.DiaObject;

import java.io.IOException;
import java.io.OutputStream;
import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * JSON rendering of association outputs, one JSON object per table row.
 *
 * Source rows keep the catalog column names ({@code diaSourceId},
 * {@code ccdVisitId}, {@code ra}, {@code decl}), followed by any extra
 * measurement columns and finally {@code diaObjectId}.
 */
public final class TableJson {

    private static final ObjectMapper MAPPER = new ObjectMapper()
        .disable(SerializationFeature.FAIL_ON_EMPTY_BEANS);

    public static Map<String, Object> toRow(AssociatedSource row) {
        var columns = new LinkedHashMap<String, Object>();
        columns.put("diaSourceId", row.diaSourceId());
        columns.put("ccdVisitId", row.visitId());
        columns.put("ra", row.ra());
        columns.put("decl", row.dec());
        row.source().columns().forEach(columns::putIfAbsent);
        columns.put("diaObjectId", row.diaObjectId());
        return columns;
    }

    public static List<Map<String, Object>> toRows(List<AssociatedSource> rows) {
        var out = new ArrayList<Map<String, Object>>(rows.size());
        for (AssociatedSource row : rows) out.add(toRow(row));
        return out;
    }

    public static byte[] sourcesToJson(List<AssociatedSource> rows) {
        return write(toRows(rows));
    }

    public static byte[] objectsToJson(List<DiaObject> objects) {
        return write(objects);
    }

    public static String statsToJson(AssociationStats stats) {
        try {
            return MAPPER.writerWithDefaultPrettyPrinter().writeValueAsString(stats);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize stats: " + stats, e);
        }
    }

    /** Writes {@code {"diaSources": [...], "diaObjects": [...], "stats": {...}}}. */
    public static void writeResult(AssociationResult result, OutputStream out) {
        var document = new LinkedHashMap<String, Object>();
        document.put("diaSources", toRows(result.assocDiaSources()));
        document.put("diaObjects", result.diaObjects());
        document.put("stats", result.stats());
        try {
            MAPPER.writeValue(out, document);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to write association result", e);
        }
    }

    /** Parses JSON produced by this class back into generic rows. */
    @SuppressWarnings("unchecked")
    public static List<Map<String, Object>> readRows(byte[] json) {
        try {
            return MAPPER.readValue(json, List.class);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to parse table JSON", e);
        }
    }

    private static byte[] write(Object value) {
        try {
            return MAPPER.writeValueAsBytes(value);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize: " + value, e);
        }
    }

    private TableJson() {}
}
