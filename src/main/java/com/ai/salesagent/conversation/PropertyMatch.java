package com.ai.salesagent.conversation;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** A project returned by a property search, trimmed for prompts and responses. */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
@JsonIgnoreProperties(ignoreUnknown = true)
public class PropertyMatch {

    public static final int DESCRIPTION_LIMIT = 500;

    private String id;
    private String projectName;
    private String city;
    private String country;
    private Double priceUsd;
    private Integer bedrooms;
    private String propertyType;
    private String description;
}
