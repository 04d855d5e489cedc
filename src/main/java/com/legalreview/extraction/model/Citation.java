package com.legalreview.extraction.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * Located, quoted evidence for a cell value.
 */
@Value
@Builder
@Jacksonized
@JsonIgnoreProperties(value = "coordinates", allowGetters = true)
public class Citation {

    String documentId;
    String documentIdentifier;
    LocationType locationType;
    int location;
    String snippet;
    int charStart;
    int charEnd;

    /**
     * Reserved for bounding-box support. Always null.
     */
    @JsonProperty("coordinates")
    @JsonInclude(JsonInclude.Include.ALWAYS)
    public Object getCoordinates() {
        return null;
    }
}
