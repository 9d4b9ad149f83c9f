package com.ai.salesagent.service;

import com.ai.salesagent.conversation.ChatMessage;
import com.ai.salesagent.conversation.ConversationContext;
import com.ai.salesagent.conversation.LeadInfo;
import com.ai.salesagent.conversation.PropertyMatch;
import com.ai.salesagent.conversation.PropertyPreferences;
import com.ai.salesagent.entity.Booking;
import com.ai.salesagent.entity.Conversation;
import com.ai.salesagent.entity.Lead;
import com.ai.salesagent.entity.Message;
import com.ai.salesagent.entity.Project;
import com.ai.salesagent.exception.ConversationNotFoundException;
import com.ai.salesagent.repository.BookingRepository;
import com.ai.salesagent.repository.MessageRepository;
import com.ai.salesagent.repository.ProjectRepository;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.jdbc.AutoConfigureTestDatabase;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.boot.test.autoconfigure.orm.jpa.TestEntityManager;
import org.springframework.context.annotation.Import;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DataJpaTest
@AutoConfigureTestDatabase(replace = AutoConfigureTestDatabase.Replace.NONE)
@Import(ConversationService.class)
class ConversationServiceTest {

    @Autowired
    private ConversationService service;

    @Autowired
    private MessageRepository messageRepository;

    @Autowired
    private ProjectRepository projectRepository;

    @Autowired
    private BookingRepository bookingRepository;

    @Autowired
    private TestEntityManager entityManager;

    @Test
    void createdConversationIsActiveWithEmptyContext() {
        Conversation conversation = service.create();

        assertThat(conversation.getId()).isNotNull();
        assertThat(conversation.getStatus()).isEqualTo(Conversation.STATUS_ACTIVE);
        assertThat(conversation.getContext().getPreferences().isEmpty()).isTrue();
        assertThat(conversation.getContext().getRecommendedProperties()).isEmpty();
        assertThat(service.get(conversation.getId())).isPresent();
    }

    @Test
    void unknownConversation() {
        UUID id = UUID.randomUUID();

        assertThat(service.get(id)).isEmpty();
        assertThatThrownBy(() -> service.require(id)).isInstanceOf(ConversationNotFoundException.class);
        assertThatThrownBy(() -> service.addMessage(id, Message.ROLE_USER, "hi", null))
                .isInstanceOf(ConversationNotFoundException.class);
        assertThat(service.updateContext(id, new ConversationContext())).isEmpty();
    }

    @Test
    void historyIsTheLatestMessagesOldestFirst() {
        Conversation conversation = service.create();
        Instant base = Instant.parse("2024-01-01T10:00:00Z");
        for (int i = 0; i < 5; i++) {
            messageRepository.save(Message.builder()
                    .conversation(conversation)
                    .role(i % 2 == 0 ? Message.ROLE_USER : Message.ROLE_ASSISTANT)
                    .content("m" + i)
                    .createdAt(base.plusSeconds(i))
                    .build());
        }

        List<ChatMessage> history = service.getMessages(conversation.getId(), 3);

        assertThat(history).extracting(ChatMessage::getContent).containsExactly("m2", "m3", "m4");
        assertThat(history.get(0).getRole()).isEqualTo(Message.ROLE_USER);
        assertThat(service.listMessages(conversation.getId())).hasSize(5);
    }

    @Test
    void addMessageStoresExtraData() {
        Conversation conversation = service.create();

        Message saved = service.addMessage(conversation.getId(), Message.ROLE_ASSISTANT, "Hello",
                Map.of("intent", "greeting"));
        entityManager.flush();
        entityManager.clear();

        Message loaded = messageRepository.findById(saved.getId()).orElseThrow();
        assertThat(loaded.getExtraData()).containsEntry("intent", "greeting");
        assertThat(loaded.getCreatedAt()).isNotNull();
    }

    @Test
    void updateContextMergesTopLevelFieldsAndSurvivesReload() {
        Conversation conversation = service.create();
        service.updateContext(conversation.getId(), ConversationContext.builder()
                .preferences(PropertyPreferences.builder().city("Dubai").bedrooms(2).build())
                .leadInfo(null)
                .recommendedProperties(List.of(PropertyMatch.builder().projectName("Marina Heights").build()))
                .build());
        entityManager.flush();
        entityManager.clear();

        service.updateContext(conversation.getId(), ConversationContext.builder()
                .preferences(null)
                .leadInfo(LeadInfo.builder().firstName("John").build())
                .recommendedProperties(null)
                .bookingProject("Marina Heights")
                .build());
        entityManager.flush();
        entityManager.clear();

        ConversationContext context = service.require(conversation.getId()).getContext();
        assertThat(context.getPreferences().getCity()).isEqualTo("Dubai");
        assertThat(context.getPreferences().getBedrooms()).isEqualTo(2);
        assertThat(context.getLeadInfo().getFirstName()).isEqualTo("John");
        assertThat(context.getRecommendedProperties()).extracting(PropertyMatch::getProjectName)
                .containsExactly("Marina Heights");
        assertThat(context.getBookingProject()).isEqualTo("Marina Heights");
    }

    @Test
    void leadIsCreatedOnceAndUpdatedWithNonBlankFields() {
        Conversation conversation = service.create();

        Lead first = service.getOrCreateLead(conversation.getId(),
                LeadInfo.builder().firstName("John").email("john@example.com").build());
        Lead second = service.getOrCreateLead(conversation.getId(),
                LeadInfo.builder().firstName("").lastName("Doe").phone("+971 50 000 0000").build());

        assertThat(second.getId()).isEqualTo(first.getId());
        assertThat(second.getFirstName()).isEqualTo("John");
        assertThat(second.getLastName()).isEqualTo("Doe");
        assertThat(second.getEmail()).isEqualTo("john@example.com");
        assertThat(second.getPhone()).isEqualTo("+971 50 000 0000");
    }

    @Test
    void leadPreferencesAreMerged() {
        Conversation conversation = service.create();
        Lead lead = service.getOrCreateLead(conversation.getId(), LeadInfo.builder().email("a@b.co").build());

        service.updateLeadPreferences(lead.getId(), Map.of("city", "Dubai"));
        service.updateLeadPreferences(lead.getId(), Map.of("bedrooms", 2));
        service.updateLeadPreferences(UUID.randomUUID(), Map.of("city", "ignored"));
        entityManager.flush();
        entityManager.clear();

        Lead reloaded = entityManager.find(Lead.class, lead.getId());
        assertThat(reloaded.getPreferences()).containsEntry("city", "Dubai").containsEntry("bedrooms", 2);
    }

    @Test
    void bookingIsPendingAndNotDuplicated() {
        Conversation conversation = service.create();
        Lead lead = service.getOrCreateLead(conversation.getId(),
                LeadInfo.builder().firstName("John").email("john@example.com").build());
        Project project = projectRepository.save(Project.builder().projectName("Marina Heights").city("Dubai").build());

        Booking booking = service.createBooking(lead.getId(), project.getId(), null);
        Booking again = service.createBooking(lead.getId(), project.getId(), "second request");

        assertThat(booking.getStatus()).isEqualTo(Booking.Status.PENDING);
        assertThat(again.getId()).isEqualTo(booking.getId());
        assertThat(bookingRepository.findByLeadIdOrderByCreatedAtDesc(lead.getId())).hasSize(1);
    }

    @Test
    void findsProjectByCaseInsensitiveSubstring() {
        projectRepository.save(Project.builder().projectName("Marina Heights Tower").build());

        assertThat(service.findProjectByName("marina heights")).map(Project::getProjectName)
                .contains("Marina Heights Tower");
        assertThat(service.findProjectByName("Unknown")).isEmpty();
        assertThat(service.findProjectByName(" ")).isEmpty();
    }
}
