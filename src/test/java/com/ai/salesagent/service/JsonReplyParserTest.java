package com.ai.salesagent.service;

import com.fasterxml.jackson.databind.node.ObjectNode;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class JsonReplyParserTest {

    private final JsonReplyParser parser = new JsonReplyParser();

    @Test
    void parsesPlainObject() {
        ObjectNode node = parser.extractObject("{\"city\": \"Dubai\", \"bedrooms\": 2}");

        assertThat(parser.text(node, "city")).isEqualTo("Dubai");
        assertThat(parser.integer(node, "bedrooms")).isEqualTo(2);
    }

    @Test
    void findsObjectInsideProseAndCodeFences() {
        ObjectNode node = parser.extractObject("Sure! Here you go:\n```json\n{\"city\": \"Bali\"}\n```\nAnything else?");

        assertThat(parser.text(node, "city")).isEqualTo("Bali");
    }

    @Test
    void garbageYieldsEmptyObject() {
        assertThat(parser.extractObject("no json here")).isEmpty();
        assertThat(parser.extractObject("{broken")).isEmpty();
        assertThat(parser.extractObject(null)).isEmpty();
        assertThat(parser.extractObject("[1, 2]")).isEmpty();
    }

    @Test
    void nullLikeTextsAreNull() {
        ObjectNode node = parser.extractObject("{\"a\": null, \"b\": \"null\", \"c\": \"None\", \"d\": \"  \"}");

        assertThat(parser.text(node, "a")).isNull();
        assertThat(parser.text(node, "b")).isNull();
        assertThat(parser.text(node, "c")).isNull();
        assertThat(parser.text(node, "d")).isNull();
        assertThat(parser.text(node, "missing")).isNull();
    }

    @Test
    void numbersAcceptMagnitudeSuffixesAndCurrency() {
        ObjectNode node = parser.extractObject(
                "{\"a\": 750000, \"b\": \"500k\", \"c\": \"1.2M\", \"d\": \"$750,000\", \"e\": \"cheap\"}");

        assertThat(parser.number(node, "a")).isEqualTo(750_000d);
        assertThat(parser.number(node, "b")).isEqualTo(500_000d);
        assertThat(parser.number(node, "c")).isEqualTo(1_200_000d);
        assertThat(parser.number(node, "d")).isEqualTo(750_000d);
        assertThat(parser.number(node, "e")).isNull();
    }
}
