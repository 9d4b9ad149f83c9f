package com.ai.salesagent.conversation;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.apache.commons.lang3.StringUtils;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Search criteria collected from the buyer across turns.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder(toBuilder = true)
@JsonIgnoreProperties(ignoreUnknown = true)
public class PropertyPreferences {

    public static final String MISSING_CITY = "preferred city/location";
    public static final String MISSING_BUDGET = "budget range";
    public static final String MISSING_BEDROOMS = "number of bedrooms";

    private String city;
    private Double minBudget;
    private Double maxBudget;
    private Integer bedrooms;
    private String propertyType;

    /**
     * Overwrites fields for which {@code update} carries a usable value. Applying the
     * same update twice leaves the preferences unchanged.
     */
    public PropertyPreferences merge(PropertyPreferences update) {
        if (update == null) return this;
        if (isUsable(update.city)) city = update.city.trim();
        if (update.minBudget != null) minBudget = update.minBudget;
        if (update.maxBudget != null) maxBudget = update.maxBudget;
        if (update.bedrooms != null) bedrooms = update.bedrooms;
        if (isUsable(update.propertyType)) propertyType = update.propertyType.trim().toLowerCase(Locale.ROOT);
        return this;
    }

    @JsonIgnore
    public List<String> getMissing() {
        List<String> missing = new ArrayList<>();
        if (StringUtils.isBlank(city)) missing.add(MISSING_CITY);
        if (minBudget == null && maxBudget == null) missing.add(MISSING_BUDGET);
        if (bedrooms == null) missing.add(MISSING_BEDROOMS);
        return missing;
    }

    @JsonIgnore
    public boolean isEmpty() {
        return StringUtils.isBlank(city) && minBudget == null && maxBudget == null
                && bedrooms == null && StringUtils.isBlank(propertyType);
    }

    /** Non-null fields keyed the way they are stored on a lead. */
    public Map<String, Object> toMap() {
        Map<String, Object> map = new LinkedHashMap<>();
        if (city != null) map.put("city", city);
        if (minBudget != null) map.put("min_budget", minBudget);
        if (maxBudget != null) map.put("max_budget", maxBudget);
        if (bedrooms != null) map.put("bedrooms", bedrooms);
        if (propertyType != null) map.put("property_type", propertyType);
        return map;
    }

    public PropertyPreferences copy() {
        return toBuilder().build();
    }

    static boolean isUsable(String value) {
        return StringUtils.isNotBlank(value) && !"null".equalsIgnoreCase(value.trim());
    }
}
