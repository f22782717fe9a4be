package com.onechance.courier.queue.store;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonDeserializationContext;
import com.google.gson.JsonDeserializer;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import com.google.gson.JsonSerializationContext;
import com.google.gson.JsonSerializer;
import com.google.gson.TypeAdapter;
import com.google.gson.reflect.TypeToken;
import com.google.gson.stream.JsonReader;
import com.google.gson.stream.JsonWriter;
import com.onechance.courier.queue.Channel;
import com.onechance.courier.queue.QueuedMessage;
import com.onechance.courier.queue.payload.MessagePayload;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.lang.reflect.Type;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;

/**
 * JSON codec for queued messages.
 * <p>Timestamps are written as ISO-8601 strings.
 * <br>Payloads carry a {@code channel} discriminator used to pick the variant on read.
 */
public final class QueueJson {
    private static final Logger log = LogManager.getLogger(QueueJson.class);

    private static final Type MESSAGE_LIST_TYPE = new TypeToken<List<QueuedMessage>>() {}.getType();

    /**
     * Shared Gson instance.
     */
    public static final Gson GSON = new GsonBuilder()
            .registerTypeAdapter(Instant.class, new InstantAdapter().nullSafe())
            .registerTypeAdapter(MessagePayload.class, new PayloadAdapter())
            .disableHtmlEscaping()
            .create();

    private QueueJson() {
        throw new IllegalStateException("Static class");
    }

    /**
     * Serializes messages to a JSON array.
     *
     * @param messages Messages.
     * @return JSON string.
     */
    public static String toJson(List<QueuedMessage> messages) {
        return GSON.toJson(messages, MESSAGE_LIST_TYPE);
    }

    /**
     * Parses a JSON array of messages.
     * <p>Null entries and entries the queue cannot schedule are dropped.
     *
     * @param json JSON string.
     * @return List of messages.
     * @throws JsonParseException On malformed input.
     */
    public static List<QueuedMessage> fromJson(String json) {
        List<QueuedMessage> parsed = GSON.fromJson(json, MESSAGE_LIST_TYPE);
        List<QueuedMessage> messages = new ArrayList<>();
        if (parsed != null) {
            for (QueuedMessage message : parsed) {
                if (message == null) {
                    continue;
                }
                String problem = validate(message);
                if (problem != null) {
                    log.warn("Dropping unusable queued message: id={}, reason={}", message.getId(), problem);
                    continue;
                }
                messages.add(message);
            }
        }
        return messages;
    }

    /**
     * Checks the fields scheduling depends on.
     *
     * @param message Parsed message.
     * @return Problem description or null when usable.
     */
    static String validate(QueuedMessage message) {
        if (message.getId() == null) {
            return "missing id";
        }
        if (message.getPayload() == null) {
            return "missing payload";
        }
        if (message.getChannel() == null) {
            return "missing or unknown channel";
        }
        if (message.getPayload().channel() != message.getChannel()) {
            return "payload channel " + message.getPayload().channel().getKey()
                    + " does not match " + message.getChannel().getKey();
        }
        if (message.getStatus() == null) {
            return "missing or unknown status";
        }
        if (message.getPriority() == null) {
            return "missing or unknown priority";
        }
        if (message.getCreatedAt() == null) {
            return "missing createdAt";
        }
        if (message.getMaxAttempts() < 1) {
            return "maxAttempts below 1";
        }
        return null;
    }

    /**
     * ISO-8601 adapter for Instant.
     */
    static class InstantAdapter extends TypeAdapter<Instant> {
        @Override
        public void write(JsonWriter out, Instant value) throws IOException {
            out.value(value.toString());
        }

        @Override
        public Instant read(JsonReader in) throws IOException {
            try {
                return Instant.parse(in.nextString());
            } catch (DateTimeParseException e) {
                throw new JsonParseException("Invalid timestamp: " + e.getParsedString(), e);
            }
        }
    }

    /**
     * Payload adapter keyed by channel.
     */
    static class PayloadAdapter implements JsonSerializer<MessagePayload>, JsonDeserializer<MessagePayload> {
        @Override
        public JsonElement serialize(MessagePayload src, Type typeOfSrc, JsonSerializationContext context) {
            JsonObject json = context.serialize(src, src.getClass()).getAsJsonObject();
            json.addProperty("channel", src.channel().getKey());
            return json;
        }

        @Override
        public MessagePayload deserialize(JsonElement json, Type typeOfT, JsonDeserializationContext context) {
            if (!json.isJsonObject()) {
                throw new JsonParseException("Payload is not an object");
            }
            JsonElement key = json.getAsJsonObject().get("channel");
            if (key == null || !key.isJsonPrimitive() || !key.getAsJsonPrimitive().isString()) {
                throw new JsonParseException("Payload without channel");
            }

            Channel channel;
            try {
                channel = Channel.fromKey(key.getAsString());
            } catch (IllegalArgumentException e) {
                throw new JsonParseException(e.getMessage(), e);
            }
            return context.deserialize(json, channel.getPayloadType());
        }
    }
}
