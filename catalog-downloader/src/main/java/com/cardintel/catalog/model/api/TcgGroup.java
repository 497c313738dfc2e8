package com.cardintel.catalog.model.api;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.Data;

/**
 * Raw group (set) DTO from /{categoryId}/groups.
 */
@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public class TcgGroup {

    private Integer groupId;
    private String name;
    private String abbreviation;
    private Boolean isSupplemental;
    private String publishedOn;
    private String modifiedOn;
    private Integer categoryId;
}
