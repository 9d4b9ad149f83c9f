package com.ai.salesagent.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.util.List;
import java.util.UUID;

/**
 * Reply to a chat turn. {@code recommendedProjects} is null when the turn produced no matches.
 */
@Getter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ChatResponse {

    private String response;
    private UUID conversationId;
    private List<ProjectSummary> recommendedProjects;
    private ChatMetadata metadata;
}
