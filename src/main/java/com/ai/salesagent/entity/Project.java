package com.ai.salesagent.entity;

import com.ai.salesagent.entity.converter.StringListConverter;
import jakarta.persistence.*;
import lombok.*;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

@Entity
@Table(name = "projects", indexes = {
    @Index(name = "idx_projects_name", columnList = "project_name"),
    @Index(name = "idx_projects_city", columnList = "city"),
    @Index(name = "idx_projects_country", columnList = "country"),
    @Index(name = "idx_projects_price", columnList = "price_usd"),
    @Index(name = "idx_projects_developer", columnList = "developer_name")
})
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class Project {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @Column(name = "project_name", nullable = false, length = 500)
    private String projectName;

    private Integer bedrooms;

    private Integer bathrooms;

    @Column(name = "completion_status", length = 50)
    private String completionStatus;

    @Column(name = "unit_type", length = 100)
    private String unitType;

    @Column(name = "developer_name")
    private String developerName;

    @Column(name = "price_usd")
    private Double priceUsd;

    @Column(name = "area_sqm")
    private Double areaSqm;

    @Column(name = "property_type", length = 50)
    private String propertyType;

    @Column(length = 100)
    private String city;

    @Column(length = 10)
    private String country;

    @Column(name = "completion_date", length = 50)
    private String completionDate;

    @Convert(converter = StringListConverter.class)
    @Column(columnDefinition = "TEXT")
    @Builder.Default
    private List<String> features = new ArrayList<>();

    @Convert(converter = StringListConverter.class)
    @Column(columnDefinition = "TEXT")
    @Builder.Default
    private List<String> facilities = new ArrayList<>();

    @Column(columnDefinition = "TEXT")
    private String description;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    @PrePersist
    protected void onCreate() {
        Instant now = Instant.now();
        if (createdAt == null) createdAt = now;
        updatedAt = now;
    }

    @PreUpdate
    protected void onUpdate() {
        updatedAt = Instant.now();
    }
}
