package com.partfinder.client;

import com.google.gson.JsonArray;
import com.partfinder.exception.MalformedResponseException;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class OracleJsonExtractorTest {

    @Test
    void extractsArrayFromMarkdownFence() throws Exception {
        JsonArray array = OracleJsonExtractor.firstArray("```json\n[\"hardware_store\", \"home_goods_store\"]\n```");

        assertEquals(2, array.size());
        assertEquals("hardware_store", array.get(0).getAsString());
    }

    @Test
    void skipsBracketedProseBeforeThePayload() throws Exception {
        JsonArray array = OracleJsonExtractor.firstArray(
                "Based on the part [a door seal], I suggest: [\"hardware_store\"] as the best fit.");

        assertEquals(1, array.size());
        assertEquals("hardware_store", array.get(0).getAsString());
    }

    @Test
    void bracketsInsideStringsDoNotEndTheArray() throws Exception {
        JsonArray array = OracleJsonExtractor.firstArray(
                "[{\"index\": 1, \"likelihood\": 80, \"reason\": \"sells parts ] and [ more\"}]");

        assertEquals(1, array.size());
        assertEquals("sells parts ] and [ more", array.get(0).getAsJsonObject().get("reason").getAsString());
    }

    @Test
    void nestedArraysAreReturnedWhole() throws Exception {
        JsonArray array = OracleJsonExtractor.firstArray("x [[1, 2], [3]] y");

        assertEquals(2, array.size());
    }

    @Test
    void answersWithoutAnArrayAreMalformed() {
        assertThrows(MalformedResponseException.class, () -> OracleJsonExtractor.firstArray("no json here"));
        assertThrows(MalformedResponseException.class, () -> OracleJsonExtractor.firstArray("[unclosed"));
        assertThrows(MalformedResponseException.class, () -> OracleJsonExtractor.firstArray("   "));
        assertThrows(MalformedResponseException.class, () -> OracleJsonExtractor.firstArray(null));
    }

    @Test
    void matchingBracketRejectsMismatchedClosers() {
        assertEquals(-1, OracleJsonExtractor.matchingBracket("[1, 2}", 0));
        assertEquals(4, OracleJsonExtractor.matchingBracket("[1,2] tail", 0));
    }

    @Test
    void callerCanSkipArraysItCannotUse() throws Exception {
        String answer = "See [1] and [2]. [{\"index\": 1, \"likelihood\": 80}]";

        assertEquals(1, OracleJsonExtractor.firstArray(answer).get(0).getAsInt());
        JsonArray verdicts = OracleJsonExtractor.firstArray(answer, OracleJsonExtractor::containsObject);
        assertTrue(verdicts.get(0).isJsonObject());
        assertThrows(MalformedResponseException.class,
                () -> OracleJsonExtractor.firstArray("only [1] here", OracleJsonExtractor::containsString));
    }
}
