package com.cardintel.catalog.model.api;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.Data;

/**
 * Raw category DTO from the catalog API's /categories endpoint.
 */
@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public class TcgCategory {

    private Integer categoryId;
    private String name;
    private String displayName;
    private String modifiedOn;
}
