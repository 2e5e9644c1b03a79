package com.partfinder.client;

import com.google.gson.Gson;
import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonParseException;
import com.google.gson.TypeAdapter;
import com.google.gson.stream.JsonReader;
import com.google.gson.stream.JsonToken;
import com.partfinder.exception.MalformedResponseException;

import java.io.IOException;
import java.io.StringReader;
import java.util.function.Predicate;

/**
 * Finds the first well-formed JSON array in free text. Model answers often wrap
 * their JSON in prose or markdown fences, and sometimes emit a bracketed phrase
 * before the real payload, so every candidate opening bracket is tried in turn.
 */
public final class OracleJsonExtractor {

    // strict: a bracketed phrase like [draft] is not an array of strings
    private static final TypeAdapter<JsonElement> JSON = new Gson().getAdapter(JsonElement.class);

    private OracleJsonExtractor() {
    }

    public static JsonArray firstArray(String text) throws MalformedResponseException {
        return firstArray(text, array -> true);
    }

    /**
     * First well-formed array that {@code accepts} allows. Arrays the caller cannot
     * use, such as a {@code [1]} footnote ahead of the payload, are skipped.
     */
    public static JsonArray firstArray(String text, Predicate<JsonArray> accepts) throws MalformedResponseException {
        if (text == null || text.isBlank()) {
            throw new MalformedResponseException("Oracle returned an empty answer");
        }
        int from = 0;
        while (true) {
            int start = text.indexOf('[', from);
            if (start < 0) {
                throw new MalformedResponseException("No usable JSON array found in oracle answer");
            }
            int end = matchingBracket(text, start);
            if (end > start) {
                JsonElement parsed = tryParse(text.substring(start, end + 1));
                if (parsed != null && parsed.isJsonArray() && accepts.test(parsed.getAsJsonArray())) {
                    return parsed.getAsJsonArray();
                }
            }
            from = start + 1;
        }
    }

    public static boolean containsString(JsonArray array) {
        for (JsonElement element : array) {
            if (element.isJsonPrimitive() && element.getAsJsonPrimitive().isString()) {
                return true;
            }
        }
        return false;
    }

    public static boolean containsObject(JsonArray array) {
        for (JsonElement element : array) {
            if (element.isJsonObject()) {
                return true;
            }
        }
        return false;
    }

    /**
     * Index of the bracket closing the one at {@code start}, or -1. Brackets inside
     * string literals are ignored.
     */
    static int matchingBracket(String text, int start) {
        int depth = 0;
        boolean inString = false;
        boolean escaped = false;
        for (int i = start; i < text.length(); i++) {
            char c = text.charAt(i);
            if (inString) {
                if (escaped) {
                    escaped = false;
                } else if (c == '\\') {
                    escaped = true;
                } else if (c == '"') {
                    inString = false;
                }
                continue;
            }
            switch (c) {
                case '"' -> inString = true;
                case '[', '{' -> depth++;
                case ']', '}' -> {
                    depth--;
                    if (depth == 0) {
                        return c == ']' ? i : -1;
                    }
                    if (depth < 0) {
                        return -1;
                    }
                }
                default -> {
                }
            }
        }
        return -1;
    }

    private static JsonElement tryParse(String candidate) {
        try (JsonReader reader = new JsonReader(new StringReader(candidate))) {
            reader.setLenient(false);
            JsonElement element = JSON.read(reader);
            return reader.peek() == JsonToken.END_DOCUMENT ? element : null;
        } catch (IOException | JsonParseException | IllegalStateException e) {
            return null;
        }
    }
}
