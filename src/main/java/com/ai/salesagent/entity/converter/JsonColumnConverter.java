package com.ai.salesagent.entity.converter;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JavaType;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import jakarta.persistence.AttributeConverter;
import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Stores a value as a JSON document in a TEXT column. Keys are snake_case so the
 * stored documents match the REST payloads.
 */
public abstract class JsonColumnConverter<T> implements AttributeConverter<T, String> {

    private static final Logger log = LoggerFactory.getLogger(JsonColumnConverter.class);

    static final ObjectMapper MAPPER = new ObjectMapper()
            .setPropertyNamingStrategy(PropertyNamingStrategies.SNAKE_CASE)
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false)
            .findAndRegisterModules();

    protected abstract JavaType type(ObjectMapper mapper);

    /** Value used for NULL or unreadable columns. */
    protected abstract T empty();

    @Override
    public String convertToDatabaseColumn(T attribute) {
        try {
            return MAPPER.writeValueAsString(attribute != null ? attribute : empty());
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Cannot serialize column value", e);
        }
    }

    @Override
    public T convertToEntityAttribute(String dbData) {
        if (StringUtils.isBlank(dbData)) return empty();
        try {
            T value = MAPPER.readValue(dbData, type(MAPPER));
            return value != null ? value : empty();
        } catch (JsonProcessingException e) {
            log.warn("Unreadable JSON column, using empty value: {}", e.getOriginalMessage());
            return empty();
        }
    }
}
