package com.ai.salesagent.service;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Prompt texts for every LLM call the agent makes. Placeholders are filled with
 * {@link String#format}.
 */
@Component
public class PromptTemplates {

    private static final String SYSTEM =
            "You are %s, a friendly property sales assistant at %s.\n\n"
            + "CRITICAL RULES:\n"
            + "- Never re-introduce yourself after the first message\n"
            + "- Never ask for information the user already gave\n"
            + "- Never loop on the same question\n"
            + "- Reply in the same language the user writes in (English or Indonesian)\n"
            + "- Keep the conversation context in mind\n\n"
            + "Your role:\n"
            + "- Help the user find a property (location, budget, bedrooms)\n"
            + "- Recommend properties from the database\n"
            + "- Book property viewings\n\n"
            + "Common Indonesian: \"mau\" = want, \"dong\" = please, \"iya\" = yes, \"tidak\" = no, \"berapa\" = how much\n\n"
            + "Guidelines:\n"
            + "- Be concise and natural\n"
            + "- When booking, only ask for name or email if it is still missing\n"
            + "- If a property was just shown and the user wants it, move on to booking\n";

    private static final String INTENT =
            "Classify the user's intent. The user may write in English or Indonesian.\n\n"
            + "User message: %s\n\n"
            + "Context:\n%s\n\n"
            + "Intents:\n"
            + "- greeting: hello, hi, halo, hai\n"
            + "- gathering_preferences: mentions a city, budget, bedrooms or property type\n"
            + "- searching_properties: asks to see or find properties, \"show me\", \"cari\"\n"
            + "- answering_question: asks about amenities, features, dates, the surroundings\n"
            + "- booking_visit: wants to book (yes, sure, book it, I want, saya mau, mau dong, iya, boleh, ok, oke)\n"
            + "- collecting_lead_info: gives a name, email or phone number\n"
            + "- general_conversation: anything else\n\n"
            + "PRIORITY RULES:\n"
            + "1. Contains @ -> collecting_lead_info\n"
            + "2. \"mau\", \"want\", \"yes\", \"iya\", \"boleh\", \"ok\", \"book\" -> booking_visit\n"
            + "3. City, budget or bedrooms mentioned -> gathering_preferences\n"
            + "4. \"anything\", \"any\", \"terserah\", \"apa saja\" after being asked for bedrooms -> gathering_preferences\n\n"
            + "Return ONLY one intent keyword:";

    private static final String PREFERENCE_EXTRACTION =
            "Extract ONLY the property preferences the user explicitly mentions.\n\n"
            + "User message: \"%s\"\n\n"
            + "Previous preferences: %s\n\n"
            + "Return ONLY a valid JSON object with these fields (null when not mentioned):\n"
            + "{\n"
            + "  \"city\": \"city name or null\",\n"
            + "  \"min_budget\": number or null,\n"
            + "  \"max_budget\": number or null,\n"
            + "  \"bedrooms\": number or null,\n"
            + "  \"property_type\": \"apartment\" or \"villa\" or \"house\" or null\n"
            + "}\n\n"
            + "STRICT RULES:\n"
            + "- Only extract values mentioned in THIS message\n"
            + "- Do not invent or assume values\n"
            + "- \"okay with X\", \"X sounds good\", \"I like X\" means city is X and nothing else\n"
            + "- Budget only when the user gives numbers or a range\n"
            + "- Bedrooms only when the user gives a number\n"
            + "- Convert budgets: \"500k\" = 500000, \"1M\" = 1000000\n\n"
            + "JSON:";

    private static final String LEAD_EXTRACTION =
            "Extract contact information from the user message.\n\n"
            + "User message: \"%s\"\n\n"
            + "Previous lead info: %s\n\n"
            + "Return ONLY a valid JSON object:\n"
            + "{\n"
            + "  \"first_name\": \"name or null\",\n"
            + "  \"last_name\": \"name or null\",\n"
            + "  \"email\": \"email@example.com or null\",\n"
            + "  \"phone\": \"phone number or null\"\n"
            + "}\n\n"
            + "JSON:";

    private static final String RECOMMENDATION =
            "Recommend properties based on the preferences.\n\n"
            + "Preferences: %s\n\n"
            + "Matching properties:\n%s\n\n"
            + "Instructions:\n"
            + "- Do not introduce yourself again\n"
            + "- Present 1-3 properties with name, location, price, bedrooms and highlights\n"
            + "- Use markdown (bold names, bullets for features)\n"
            + "- End by asking whether they want to book a visit\n"
            + "- Be concise\n\n"
            + "Response:";

    private static final String ASK_MISSING =
            "The user is looking for a property.\n"
            + "Current preferences: %s\n"
            + "We still need: %s\n\n"
            + "Ask about the missing information in a friendly, conversational way.";

    private static final String NO_RESULTS =
            "No properties match the criteria.\n"
            + "Apologize and ask whether they would like to adjust their requirements or explore other locations.";

    private static final String QUESTION =
            "Answer the user's question directly using the search results.\n\n"
            + "Question: %s\n\n"
            + "Database results:\n%s\n\n"
            + "Web search results:\n%s\n\n"
            + "Instructions:\n"
            + "- If the user asked to find something, list what they are looking for\n"
            + "- Use specific names from the results (schools, gyms, markets, stations, restaurants)\n"
            + "- Give the list first, then offer to show nearby properties\n\n"
            + "Response:";

    private static final String BOOKING =
            "The user wants to book a property visit.\n\n"
            + "Property: %s\n"
            + "Lead info already collected: %s\n"
            + "Still needed: %s\n\n"
            + "Instructions:\n"
            + "- Do not introduce yourself\n"
            + "- Do not ask for anything already in the lead info\n"
            + "- If nothing is still needed, the booking is confirmed: thank them\n"
            + "- Be brief and direct\n\n"
            + "Response:";

    private static final String BOOKING_CONFIRMED =
            "Booking confirmed!\n"
            + "Property: %s\n"
            + "Name: %s\n"
            + "Email: %s\n\n"
            + "Confirm the booking enthusiastically. Let them know a representative will contact them soon.";

    private static final String GENERAL =
            "Respond to the user naturally.\n\n"
            + "User message: %s\n\n"
            + "Conversation context:\n%s\n\n"
            + "Rules:\n"
            + "- Do not re-introduce yourself if the context shows a prior conversation\n"
            + "- If the user gives a name or email, acknowledge it and continue with the booking\n"
            + "- Be concise and helpful\n"
            + "- Guide the user towards their property needs when it fits\n\n"
            + "Response:";

    private static final String SEARCH_QUERY =
            "Extract the best web search query from this user question.\n\n"
            + "User question: \"%s\"\n"
            + "City context: %s\n\n"
            + "Rules:\n"
            + "- Keep only the key search terms\n"
            + "- Drop filler words (find me, give me, show me, before I choose)\n"
            + "- Keep the main topic (school, gym, restaurant, transport)\n"
            + "- Output ONLY the search query\n\n"
            + "Examples:\n"
            + "- \"find me a gym near the property\" -> \"gyms\"\n"
            + "- \"what are the transport options nearby\" -> \"public transport stations\"\n\n"
            + "Search query:";

    private static final String TEXT_TO_SQL =
            "You write PostgreSQL queries for a property database.\n\n"
            + "Schema:\n%s\n\n"
            + "Question: %s\n\n"
            + "Rules:\n"
            + "- Write exactly one SELECT statement against the projects table\n"
            + "- Use ILIKE for text matching on names and cities\n"
            + "- Never modify data\n"
            + "- Return at most %d rows\n"
            + "- Output ONLY the SQL, no explanation and no code fences\n\n"
            + "SQL:";

    private final String assistantName;
    private final String companyName;

    public PromptTemplates(@Value("${agent.assistant-name:Silvy}") String assistantName,
                           @Value("${agent.company-name:Silver Land Properties}") String companyName) {
        this.assistantName = assistantName;
        this.companyName = companyName;
    }

    public String system() {
        return String.format(SYSTEM, assistantName, companyName);
    }

    public String greeting() {
        return "Hello! I'm **" + assistantName + "**, your property assistant at " + companyName + ". "
                + "I'm here to help you find your perfect home!\n\n"
                + "To get started, could you tell me:\n"
                + "- Which **city** are you interested in?\n"
                + "- What's your **budget range**?\n"
                + "- How many **bedrooms** do you need?";
    }

    public String apology() {
        return "I apologize, but I encountered an issue. Could you please try again?";
    }

    public String intentClassification(String message, String context) {
        return String.format(INTENT, message, context);
    }

    public String preferenceExtraction(String message, String previousPreferencesJson) {
        return String.format(PREFERENCE_EXTRACTION, message, previousPreferencesJson);
    }

    public String leadExtraction(String message, String previousLeadJson) {
        return String.format(LEAD_EXTRACTION, message, previousLeadJson);
    }

    public String recommendation(String preferencesJson, String propertiesText) {
        return String.format(RECOMMENDATION, preferencesJson, propertiesText);
    }

    public String askMissing(String preferencesJson, List<String> missing) {
        return String.format(ASK_MISSING, preferencesJson, String.join(", ", missing));
    }

    public String noResults() {
        return NO_RESULTS;
    }

    public String question(String question, String propertyInfo, String webResults) {
        return String.format(QUESTION, question, propertyInfo, webResults);
    }

    public String booking(String propertyName, String leadJson, String missing) {
        return String.format(BOOKING, propertyName, leadJson, missing);
    }

    public String bookingConfirmed(String propertyName, String fullName, String email) {
        return String.format(BOOKING_CONFIRMED, propertyName, fullName, email);
    }

    public String general(String message, String context) {
        return String.format(GENERAL, message, context);
    }

    public String searchQuery(String question, String city) {
        return String.format(SEARCH_QUERY, question, city != null ? city : "unknown");
    }

    public String textToSql(String schema, String question, int maxRows) {
        return String.format(TEXT_TO_SQL, schema, question, maxRows);
    }
}
