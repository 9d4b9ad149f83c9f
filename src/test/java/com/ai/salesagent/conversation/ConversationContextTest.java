package com.ai.salesagent.conversation;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class ConversationContextTest {

    @Test
    void mergeReplacesOnlyNonNullTopLevelFields() {
        ConversationContext current = ConversationContext.builder()
                .preferences(PropertyPreferences.builder().city("Dubai").build())
                .recommendedProperties(List.of(PropertyMatch.builder().projectName("Marina Heights").build()))
                .bookingProject("Marina Heights")
                .build();

        ConversationContext merged = current.mergedWith(ConversationContext.builder()
                .preferences(PropertyPreferences.builder().city("Bali").build())
                .recommendedProperties(null)
                .bookingProject(null)
                .build());

        assertThat(merged.getPreferences().getCity()).isEqualTo("Bali");
        assertThat(merged.getRecommendedProperties()).extracting(PropertyMatch::getProjectName)
                .containsExactly("Marina Heights");
        assertThat(merged.getBookingProject()).isEqualTo("Marina Heights");
        assertThat(current.getPreferences().getCity()).isEqualTo("Dubai");
    }

    @Test
    void mergeWithNullReturnsCopy() {
        ConversationContext current = new ConversationContext();
        ConversationContext merged = current.mergedWith(null);

        assertThat(merged).isNotSameAs(current).isEqualTo(current);
    }
}
