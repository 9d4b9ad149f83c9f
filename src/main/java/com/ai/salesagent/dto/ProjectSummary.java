package com.ai.salesagent.dto;

import com.ai.salesagent.conversation.PropertyMatch;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;

@Getter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ProjectSummary {

    private String id;
    private String projectName;
    private String city;
    private String country;
    private Double priceUsd;
    private Integer bedrooms;
    private String propertyType;

    public static ProjectSummary from(PropertyMatch match) {
        return ProjectSummary.builder()
                .id(match.getId())
                .projectName(match.getProjectName() != null ? match.getProjectName() : "")
                .city(match.getCity())
                .country(match.getCountry())
                .priceUsd(match.getPriceUsd())
                .bedrooms(match.getBedrooms())
                .propertyType(match.getPropertyType())
                .build();
    }
}
