package com.ai.salesagent.entity.converter;

import com.fasterxml.jackson.databind.JavaType;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.persistence.Converter;

import java.util.LinkedHashMap;
import java.util.Map;

@Converter
public class JsonMapConverter extends JsonColumnConverter<Map<String, Object>> {

    @Override
    protected JavaType type(ObjectMapper mapper) {
        return mapper.getTypeFactory().constructMapType(LinkedHashMap.class, String.class, Object.class);
    }

    @Override
    protected Map<String, Object> empty() {
        return new LinkedHashMap<>();
    }
}
