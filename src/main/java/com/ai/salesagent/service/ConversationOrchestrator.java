package com.ai.salesagent.service;

import com.ai.salesagent.conversation.AgentState;
import com.ai.salesagent.conversation.ConversationIntent;
import com.ai.salesagent.conversation.LeadInfo;
import com.ai.salesagent.conversation.PropertyMatch;
import com.ai.salesagent.conversation.PropertyPreferences;
import com.ai.salesagent.conversation.StreamEvent;
import com.ai.salesagent.conversation.TurnRequest;
import com.ai.salesagent.conversation.TurnResult;
import com.ai.salesagent.tools.PropertySearchTool;
import com.ai.salesagent.tools.SqlQueryResult;
import com.ai.salesagent.tools.TextToSqlTool;
import com.ai.salesagent.tools.WebSearchTool;
import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.function.Consumer;

/**
 * Single entry for a conversation turn. Walks a fixed graph:
 * classify_intent, then the node(s) routed by intent, then generate_response.
 * <pre>
 * greeting               -> handle_greeting
 * gathering_preferences  -> gather_preferences -> search_properties
 * searching_properties   -> search_properties
 * answering_question     -> answer_question
 * booking_visit          -> handle_booking
 * collecting_lead_info   -> collect_lead_info
 * general_conversation   -> (none)
 * </pre>
 */
@Service
public class ConversationOrchestrator {

    private static final Logger log = LoggerFactory.getLogger(ConversationOrchestrator.class);

    static final int CLASSIFIER_CONTEXT_MESSAGES = 4;

    private static final List<String> WEB_SEARCH_KEYWORDS =
            List.of("near", "school", "transport", "area", "neighborhood", "around");

    private final IntentClassifier intentClassifier;
    private final SlotExtractionService slotExtractionService;
    private final PropertySearchTool propertySearchTool;
    private final TextToSqlTool textToSqlTool;
    private final WebSearchTool webSearchTool;
    private final ResponseComposer responseComposer;
    private final LlmService llmService;
    private final PromptTemplates prompts;

    private final Map<ConversationIntent, List<Node>> routes = new EnumMap<>(ConversationIntent.class);

    public ConversationOrchestrator(IntentClassifier intentClassifier,
                                    SlotExtractionService slotExtractionService,
                                    PropertySearchTool propertySearchTool,
                                    TextToSqlTool textToSqlTool,
                                    WebSearchTool webSearchTool,
                                    ResponseComposer responseComposer,
                                    LlmService llmService,
                                    PromptTemplates prompts) {
        this.intentClassifier = intentClassifier;
        this.slotExtractionService = slotExtractionService;
        this.propertySearchTool = propertySearchTool;
        this.textToSqlTool = textToSqlTool;
        this.webSearchTool = webSearchTool;
        this.responseComposer = responseComposer;
        this.llmService = llmService;
        this.prompts = prompts;

        routes.put(ConversationIntent.GREETING, List.of(this::handleGreeting));
        routes.put(ConversationIntent.GATHERING_PREFERENCES, List.of(this::gatherPreferences, this::searchProperties));
        routes.put(ConversationIntent.SEARCHING_PROPERTIES, List.of(this::searchProperties));
        routes.put(ConversationIntent.ANSWERING_QUESTION, List.of(this::answerQuestion));
        routes.put(ConversationIntent.BOOKING_VISIT, List.of(this::handleBooking));
        routes.put(ConversationIntent.COLLECTING_LEAD_INFO, List.of(this::collectLeadInfo));
        routes.put(ConversationIntent.GENERAL_CONVERSATION, Collections.emptyList());
    }

    /** A graph node: reads and updates the turn state. */
    @FunctionalInterface
    interface Node {
        void apply(AgentState state);
    }

    public TurnResult process(TurnRequest request) {
        AgentState state = new AgentState(request);
        try {
            classifyIntent(state);
            runRoute(state);
            generateResponse(state);
            return state.toResult();
        } catch (RuntimeException e) {
            log.error("[{}] Agent processing error", request.getConversationId(), e);
            return TurnResult.failed(prompts.apology(), e.getMessage());
        }
    }

    /**
     * Same graph as {@link #process}, emitting intent, properties, content chunks and a
     * final done event. A failure emits a single error event instead of done.
     */
    public TurnResult processStream(TurnRequest request, Consumer<StreamEvent> sink) {
        AgentState state = new AgentState(request);
        // content already sent to the client, kept if the turn fails mid-stream
        StringBuilder streamed = new StringBuilder();
        try {
            classifyIntent(state);
            sink.accept(StreamEvent.intent(state.getIntent()));

            if (state.getIntent() == ConversationIntent.GREETING) {
                handleGreeting(state);
                sink.accept(StreamEvent.content(state.getResponse()));
                TurnResult result = state.toResult();
                sink.accept(new StreamEvent(StreamEvent.Type.DONE, doneSummary(result)));
                return result;
            }

            runRoute(state);
            if (state.isSearchPerformed() && !state.getRecommendedProperties().isEmpty()) {
                sink.accept(new StreamEvent(StreamEvent.Type.PROPERTIES, state.getRecommendedProperties()));
            }

            String full = llmService.stream(responseComposer.buildMessages(state), chunk -> {
                streamed.append(chunk);
                sink.accept(StreamEvent.content(chunk));
            });
            state.setResponse(full);

            TurnResult result = state.toResult();
            sink.accept(new StreamEvent(StreamEvent.Type.DONE, doneSummary(result)));
            return result;
        } catch (RuntimeException e) {
            log.error("[{}] Streaming error", request.getConversationId(), e);
            sink.accept(StreamEvent.error(e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName()));
            String partial = streamed.length() > 0 ? streamed.toString() : state.getResponse();
            return TurnResult.failed(partial, String.valueOf(e.getMessage()));
        }
    }

    void classifyIntent(AgentState state) {
        ConversationIntent intent = intentClassifier.classify(
                state.getUserMessage(), state.recentTranscript(CLASSIFIER_CONTEXT_MESSAGES));
        state.setIntent(intent);
    }

    private void runRoute(AgentState state) {
        for (Node node : routes.getOrDefault(state.getIntent(), Collections.emptyList())) {
            node.apply(state);
        }
    }

    void handleGreeting(AgentState state) {
        state.setResponse(prompts.greeting());
    }

    void gatherPreferences(AgentState state) {
        PropertyPreferences extracted = slotExtractionService.extractPreferences(
                state.getUserMessage(), state.getPreferences());
        PropertyPreferences merged = state.getPreferences().merge(extracted);

        List<String> missing = merged.getMissing();
        state.setMissingInfo(missing);
        log.info("[{}] Preferences: {}, missing: {}", state.getConversationId(), merged, missing);
    }

    void searchProperties(AgentState state) {
        PropertyPreferences prefs = state.getPreferences();
        List<PropertyMatch> results = propertySearchTool.searchProperties(
                prefs.getCity(), prefs.getMinBudget(), prefs.getMaxBudget(),
                prefs.getBedrooms(), prefs.getPropertyType(), PropertySearchTool.DEFAULT_LIMIT);
        state.setRecommendedProperties(results != null ? new ArrayList<>(results) : new ArrayList<>());
        state.setSearchPerformed(true);
        log.info("[{}] Found {} matching properties", state.getConversationId(), state.getRecommendedProperties().size());
    }

    void answerQuestion(AgentState state) {
        String message = state.getUserMessage();

        SqlQueryResult sql = textToSqlTool.query(message);
        state.setSqlResults(sql.getResults());

        if (needsWebSearch(message) && webSearchTool.isEnabled()) {
            state.setWebSearchResults(webSearchTool.searchContext(
                    message, state.firstRecommendedProjectName(), state.getPreferences().getCity()));
        } else {
            state.setWebSearchResults(null);
        }
    }

    /** Picks the project to book and lists missing lead fields; never confirms. */
    void handleBooking(AgentState state) {
        defaultBookingProject(state);
        state.setMissingInfo(state.getLeadInfo().getMissing());
    }

    void collectLeadInfo(AgentState state) {
        LeadInfo extracted = slotExtractionService.extractLeadInfo(state.getUserMessage(), state.getLeadInfo());
        state.getLeadInfo().merge(extracted);
        defaultBookingProject(state);
        LeadInfo lead = state.getLeadInfo();
        state.setMissingInfo(lead.getMissing());
        state.setBookingConfirmed(lead.isComplete());
    }

    /**
     * Final node. Keeps a response already set by an earlier node, otherwise asks the LLM.
     */
    void generateResponse(AgentState state) {
        if (state.hasResponse()) return;
        state.setResponse(llmService.complete(responseComposer.buildMessages(state)));
    }

    private void defaultBookingProject(AgentState state) {
        if (StringUtils.isBlank(state.getBookingProject())) {
            state.setBookingProject(state.firstRecommendedProjectName());
        }
    }

    static boolean needsWebSearch(String message) {
        if (message == null) return false;
        String lower = message.toLowerCase(Locale.ROOT);
        for (String keyword : WEB_SEARCH_KEYWORDS) {
            if (lower.contains(keyword)) return true;
        }
        return false;
    }

    private static Map<String, Object> doneSummary(TurnResult result) {
        Map<String, Object> done = new LinkedHashMap<>();
        done.put("intent", result.getIntent() != null ? result.getIntent().getKey() : null);
        done.put("preferences", result.getPreferences());
        done.put("lead_info", result.getLeadInfo());
        done.put("recommended_properties", result.getRecommendedProperties());
        done.put("booking_confirmed", result.isBookingConfirmed());
        done.put("booking_project", result.getBookingProject());
        return done;
    }
}
