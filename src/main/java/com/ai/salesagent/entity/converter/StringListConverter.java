package com.ai.salesagent.entity.converter;

import com.fasterxml.jackson.databind.JavaType;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.persistence.Converter;

import java.util.ArrayList;
import java.util.List;

@Converter
public class StringListConverter extends JsonColumnConverter<List<String>> {

    @Override
    protected JavaType type(ObjectMapper mapper) {
        return mapper.getTypeFactory().constructCollectionType(ArrayList.class, String.class);
    }

    @Override
    protected List<String> empty() {
        return new ArrayList<>();
    }
}
