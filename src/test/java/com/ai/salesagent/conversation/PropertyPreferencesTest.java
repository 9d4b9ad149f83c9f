package com.ai.salesagent.conversation;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class PropertyPreferencesTest {

    @Test
    void mergeOverwritesOnlyUsableValues() {
        PropertyPreferences prefs = PropertyPreferences.builder().city("Dubai").bedrooms(2).build();

        prefs.merge(PropertyPreferences.builder().city("null").maxBudget(500_000d).propertyType(" Villa ").build());

        assertThat(prefs.getCity()).isEqualTo("Dubai");
        assertThat(prefs.getBedrooms()).isEqualTo(2);
        assertThat(prefs.getMaxBudget()).isEqualTo(500_000d);
        assertThat(prefs.getPropertyType()).isEqualTo("villa");
    }

    @Test
    void mergeIsIdempotent() {
        PropertyPreferences update = PropertyPreferences.builder().city("Bali").minBudget(100_000d).build();
        PropertyPreferences once = new PropertyPreferences().merge(update);
        PropertyPreferences twice = new PropertyPreferences().merge(update).merge(update);

        assertThat(twice).isEqualTo(once);
    }

    @Test
    void missingListsCityBudgetAndBedrooms() {
        assertThat(new PropertyPreferences().getMissing()).containsExactly(
                PropertyPreferences.MISSING_CITY, PropertyPreferences.MISSING_BUDGET, PropertyPreferences.MISSING_BEDROOMS);

        PropertyPreferences partial = PropertyPreferences.builder().city("Dubai").maxBudget(1d).build();
        assertThat(partial.getMissing()).containsExactly(PropertyPreferences.MISSING_BEDROOMS);
    }

    @Test
    void toMapUsesSnakeCaseKeysAndSkipsNulls() {
        PropertyPreferences prefs = PropertyPreferences.builder().city("Dubai").minBudget(10d).propertyType("villa").build();

        assertThat(prefs.toMap())
                .containsEntry("city", "Dubai")
                .containsEntry("min_budget", 10d)
                .containsEntry("property_type", "villa")
                .doesNotContainKeys("max_budget", "bedrooms");
    }

    @Test
    void copyIsIndependent() {
        PropertyPreferences original = PropertyPreferences.builder().city("Dubai").build();
        PropertyPreferences copy = original.copy();
        copy.setCity("Bali");

        assertThat(original.getCity()).isEqualTo("Dubai");
    }
}
