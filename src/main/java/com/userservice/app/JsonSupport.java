package com.userservice.app;

import com.google.gson.FieldNamingPolicy;
import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonElement;
import com.google.gson.JsonPrimitive;
import com.google.gson.JsonSerializer;
import com.google.gson.JsonSyntaxException;
import com.google.gson.stream.JsonReader;
import com.google.gson.stream.JsonToken;

import java.io.IOException;
import java.io.StringReader;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;

// Shared Gson instance: snake_case field names, ISO-8601 local timestamps
final class JsonSupport {

    static final Gson GSON = new GsonBuilder()
            .setFieldNamingPolicy(FieldNamingPolicy.LOWER_CASE_WITH_UNDERSCORES)
            .registerTypeAdapter(LocalDateTime.class, (JsonSerializer<LocalDateTime>) (src, type, context) ->
                    new JsonPrimitive(DateTimeFormatter.ISO_LOCAL_DATE_TIME.format(src)))
            .serializeNulls()
            .disableHtmlEscaping()
            .create();

    private JsonSupport() {}

    /**
     * Parse a request body as strict RFC 8259 JSON. {@code Gson.fromJson(String, ...)}
     * forces lenient mode, which would accept unquoted names and single quotes.
     *
     * @return the parsed value, or null for a blank body or a literal {@code null}
     * @throws JsonSyntaxException if the body is not well-formed JSON or does not fit {@code type}
     */
    static <T> T parseStrict(String body, Class<T> type) {
        if (body == null || body.isBlank()) {
            return null;
        }
        try {
            JsonReader reader = new JsonReader(new StringReader(body));
            reader.setLenient(false);
            // The JsonElement adapter reads with the reader's own strictness
            JsonElement element = GSON.getAdapter(JsonElement.class).read(reader);
            if (reader.peek() != JsonToken.END_DOCUMENT) {
                throw new JsonSyntaxException("Trailing content after JSON value");
            }
            return GSON.fromJson(element, type);
        } catch (IOException | IllegalStateException e) {
            throw new JsonSyntaxException(e);
        }
    }
}
