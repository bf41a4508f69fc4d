package com.skyassoc.model;

import com.fasterxml.jackson.annotation.JsonAnyGetter;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Persistent entity built from repeated detections.
 *
 * Only the id, mean position and source count are computed by the
 * association core. The remaining columns are zero-initialised summary
 * slots filled by later, out-of-core stages.
 */
@JsonPropertyOrder({"diaObjectId", "ra", "decl", "nDiaSources", "pmParallaxNdata",
    "nearbyObj1", "nearbyObj2", "nearbyObj3", "flags"})
public record DiaObject(
    @JsonProperty("diaObjectId")     long diaObjectId,
    @JsonProperty("ra")              double ra,
    @JsonProperty("decl")            double dec,
    @JsonProperty("nDiaSources")     int nDiaSources,
    @JsonProperty("pmParallaxNdata") int pmParallaxNdata,
    @JsonProperty("nearbyObj1")      long nearbyObj1,
    @JsonProperty("nearbyObj2")      long nearbyObj2,
    @JsonProperty("nearbyObj3")      long nearbyObj3,
    @JsonProperty("flags")           long flags,
    @JsonIgnore                      Map<Band, Integer> psFluxNdata
) {
    public DiaObject {
        var counts = new EnumMap<Band, Integer>(Band.class);
        for (Band b : Band.values()) counts.put(b, 0);
        if (psFluxNdata != null) {
            psFluxNdata.forEach((band, n) -> counts.put(
                Objects.requireNonNull(band, "band"),
                Objects.requireNonNull(n, () -> "psFluxNdata count for band " + band)));
        }
        psFluxNdata = Collections.unmodifiableMap(counts);
    }

    /** Object with the given position and count and every auxiliary column at zero. */
    public static DiaObject of(long diaObjectId, double ra, double dec, int nDiaSources) {
        return new DiaObject(diaObjectId, ra, dec, nDiaSources, 0, 0L, 0L, 0L, 0L, Map.of());
    }

    public int psFluxNdata(Band band) {
        return psFluxNdata.get(band);
    }

    @JsonAnyGetter
    public Map<String, Integer> bandColumns() {
        var columns = new LinkedHashMap<String, Integer>();
        psFluxNdata.forEach((band, n) -> columns.put(band.psFluxNdataColumn(), n));
        return columns;
    }
}
