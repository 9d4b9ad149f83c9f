package com.ai.salesagent.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.apache.commons.lang3.StringUtils;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.math.BigDecimal;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Pulls a JSON object out of an LLM reply that may wrap it in prose or code fences.
 */
@Component
public class JsonReplyParser {

    /** Flat object only; nested braces are not supported. */
    private static final Pattern FLAT_OBJECT = Pattern.compile("\\{[^{}]*\\}", Pattern.DOTALL);

    private static final Pattern MAGNITUDE = Pattern.compile("^([0-9]+(?:\\.[0-9]+)?)\\s*([kKmMbB])?$");

    private final ObjectMapper mapper = new ObjectMapper();

    /**
     * @return the parsed object, or an empty object when the reply holds none
     */
    public ObjectNode extractObject(String reply) {
        if (StringUtils.isBlank(reply)) return mapper.createObjectNode();
        String text = reply.trim();
        ObjectNode whole = tryParse(text);
        if (whole != null) return whole;

        Matcher m = FLAT_OBJECT.matcher(text);
        if (m.find()) {
            ObjectNode embedded = tryParse(m.group());
            if (embedded != null) return embedded;
        }
        return mapper.createObjectNode();
    }

    /** Text value of a field, or null when missing, JSON null, blank or the word "null". */
    public String text(JsonNode node, String field) {
        JsonNode v = node.path(field);
        if (v.isMissingNode() || v.isNull()) return null;
        String s = v.asText("").trim();
        if (s.isEmpty() || "null".equalsIgnoreCase(s) || "none".equalsIgnoreCase(s)) return null;
        return s;
    }

    /**
     * Numeric value of a field. Accepts JSON numbers and strings such as "500k",
     * "1.2M" or "$750,000".
     */
    public Double number(JsonNode node, String field) {
        JsonNode v = node.path(field);
        if (v.isNumber()) return v.asDouble();
        String s = text(node, field);
        if (s == null) return null;
        String cleaned = s.replace("$", "").replace(",", "").replace("_", "").trim();
        Matcher m = MAGNITUDE.matcher(cleaned);
        if (!m.matches()) return null;
        BigDecimal value = new BigDecimal(m.group(1));
        String unit = m.group(2);
        if (unit != null) {
            switch (unit.toLowerCase(Locale.ROOT)) {
                case "k":
                    value = value.multiply(BigDecimal.valueOf(1_000));
                    break;
                case "m":
                    value = value.multiply(BigDecimal.valueOf(1_000_000));
                    break;
                case "b":
                    value = value.multiply(BigDecimal.valueOf(1_000_000_000));
                    break;
                default:
                    break;
            }
        }
        return value.doubleValue();
    }

    public Integer integer(JsonNode node, String field) {
        Double d = number(node, field);
        return d != null ? (int) Math.round(d) : null;
    }

    private ObjectNode tryParse(String text) {
        try {
            JsonNode node = mapper.readTree(text);
            return node instanceof ObjectNode ? (ObjectNode) node : null;
        } catch (IOException e) {
            return null;
        }
    }
}
