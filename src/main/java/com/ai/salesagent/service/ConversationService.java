package com.ai.salesagent.service;

import com.ai.salesagent.conversation.ChatMessage;
import com.ai.salesagent.conversation.ConversationContext;
import com.ai.salesagent.conversation.LeadInfo;
import com.ai.salesagent.entity.Booking;
import com.ai.salesagent.entity.Conversation;
import com.ai.salesagent.entity.Lead;
import com.ai.salesagent.entity.Message;
import com.ai.salesagent.entity.Project;
import com.ai.salesagent.exception.ConversationNotFoundException;
import com.ai.salesagent.repository.BookingRepository;
import com.ai.salesagent.repository.ConversationRepository;
import com.ai.salesagent.repository.LeadRepository;
import com.ai.salesagent.repository.MessageRepository;
import com.ai.salesagent.repository.ProjectRepository;
import lombok.RequiredArgsConstructor;
import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.stream.Collectors;

/**
 * Conversations, their messages, leads and viewing bookings.
 */
@Service
@RequiredArgsConstructor
public class ConversationService {

    private static final Logger log = LoggerFactory.getLogger(ConversationService.class);

    public static final int DEFAULT_HISTORY_LIMIT = 20;

    private final ConversationRepository conversationRepository;
    private final MessageRepository messageRepository;
    private final LeadRepository leadRepository;
    private final BookingRepository bookingRepository;
    private final ProjectRepository projectRepository;

    @Transactional
    public Conversation create() {
        Conversation conversation = conversationRepository.save(Conversation.builder().build());
        log.info("Created conversation {}", conversation.getId());
        return conversation;
    }

    @Transactional(readOnly = true)
    public Optional<Conversation> get(UUID conversationId) {
        return conversationRepository.findById(conversationId);
    }

    @Transactional(readOnly = true)
    public Conversation require(UUID conversationId) {
        return conversationRepository.findById(conversationId)
                .orElseThrow(() -> new ConversationNotFoundException(conversationId));
    }

    /** Last {@code limit} messages as role/content pairs, oldest first. */
    @Transactional(readOnly = true)
    public List<ChatMessage> getMessages(UUID conversationId, int limit) {
        List<Message> latest = new ArrayList<>(
                messageRepository.findLatest(conversationId, PageRequest.of(0, Math.max(1, limit))));
        Collections.reverse(latest);
        return latest.stream()
                .map(m -> new ChatMessage(m.getRole(), m.getContent()))
                .collect(Collectors.toList());
    }

    @Transactional(readOnly = true)
    public List<Message> listMessages(UUID conversationId) {
        require(conversationId);
        return messageRepository.findByConversationIdOrderByCreatedAtAsc(conversationId);
    }

    @Transactional
    public Message addMessage(UUID conversationId, String role, String content, Map<String, Object> extraData) {
        Conversation conversation = require(conversationId);
        return messageRepository.save(Message.builder()
                .conversation(conversation)
                .role(role)
                .content(content != null ? content : "")
                .extraData(extraData != null ? new HashMap<>(extraData) : new HashMap<>())
                .build());
    }

    /**
     * Shallow-merges {@code update} into the stored context. Returns empty when the
     * conversation does not exist.
     */
    @Transactional
    public Optional<Conversation> updateContext(UUID conversationId, ConversationContext update) {
        Optional<Conversation> found = conversationRepository.findById(conversationId);
        found.ifPresent(conversation -> {
            ConversationContext current = conversation.getContext() != null
                    ? conversation.getContext() : new ConversationContext();
            // a new instance so the converter sees the change as dirty
            conversation.setContext(current.mergedWith(update));
            conversationRepository.save(conversation);
        });
        return found;
    }

    /**
     * The conversation's lead, created on first use. Non-blank fields of {@code info}
     * overwrite the stored ones.
     */
    @Transactional
    public Lead getOrCreateLead(UUID conversationId, LeadInfo info) {
        LeadInfo update = info != null ? info : new LeadInfo();
        Optional<Lead> existing = leadRepository.findByConversationId(conversationId);
        if (existing.isPresent()) {
            Lead lead = existing.get();
            if (StringUtils.isNotBlank(update.getFirstName())) lead.setFirstName(update.getFirstName());
            if (StringUtils.isNotBlank(update.getLastName())) lead.setLastName(update.getLastName());
            if (StringUtils.isNotBlank(update.getEmail())) lead.setEmail(update.getEmail());
            if (StringUtils.isNotBlank(update.getPhone())) lead.setPhone(update.getPhone());
            return leadRepository.save(lead);
        }

        Lead lead = leadRepository.save(Lead.builder()
                .conversation(require(conversationId))
                .firstName(update.getFirstName())
                .lastName(update.getLastName())
                .email(update.getEmail())
                .phone(update.getPhone())
                .build());
        log.info("Created lead {} for conversation {}", lead.getId(), conversationId);
        return lead;
    }

    @Transactional
    public void updateLeadPreferences(UUID leadId, Map<String, Object> preferences) {
        leadRepository.findById(leadId).ifPresent(lead -> {
            Map<String, Object> merged = lead.getPreferences() != null
                    ? new HashMap<>(lead.getPreferences()) : new HashMap<>();
            if (preferences != null) merged.putAll(preferences);
            lead.setPreferences(merged);
            leadRepository.save(lead);
        });
    }

    /**
     * A pending viewing for the lead and project. An open booking for the same pair is
     * returned instead of creating a duplicate.
     */
    @Transactional
    public Booking createBooking(UUID leadId, UUID projectId, String notes) {
        Optional<Booking> open = bookingRepository.findFirstByLeadIdAndProjectIdAndStatusNot(
                leadId, projectId, Booking.Status.CANCELLED);
        if (open.isPresent()) {
            log.info("Booking already exists for lead {} and project {}", leadId, projectId);
            return open.get();
        }

        Lead lead = leadRepository.findById(leadId)
                .orElseThrow(() -> new IllegalArgumentException("Unknown lead " + leadId));
        Project project = projectRepository.findById(projectId)
                .orElseThrow(() -> new IllegalArgumentException("Unknown project " + projectId));

        Booking booking = bookingRepository.save(Booking.builder()
                .lead(lead)
                .project(project)
                .status(Booking.Status.PENDING)
                .notes(notes)
                .build());
        log.info("Booking {} created: lead={}, project={}", booking.getId(), leadId, project.getProjectName());
        return booking;
    }

    @Transactional(readOnly = true)
    public Optional<Project> findProjectByName(String name) {
        if (StringUtils.isBlank(name)) return Optional.empty();
        return projectRepository.findFirstByProjectNameContainingIgnoreCaseOrderByProjectNameAsc(name.trim());
    }
}
