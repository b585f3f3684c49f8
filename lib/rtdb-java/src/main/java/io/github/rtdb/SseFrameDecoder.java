package io.github.rtdb;

import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import com.google.gson.JsonParser;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Turns event-stream lines into change events.
 * <p>
 * Frames are {@code event:} and {@code data:} lines closed by a blank line. Unknown event
 * names and malformed payloads are skipped, never fatal: the service interleaves control
 * frames that carry no payload at all.
 */
final class SseFrameDecoder {

    private static final Logger LOGGER = LoggerFactory.getLogger(SseFrameDecoder.class);

    private String eventName;
    private final StringBuilder data = new StringBuilder();
    private boolean hasData;

    /**
     * Feeds one line without its terminator.
     *
     * @return the completed event, or null if the line did not complete a usable frame
     */
    ChangeEvent accept(String line) {
        if (line.isEmpty()) {
            return dispatch();
        }
        if (line.startsWith(":")) {
            return null;
        }
        if (line.startsWith("event:")) {
            eventName = line.substring(6).trim();
        } else if (line.startsWith("data:")) {
            if (hasData) {
                data.append('\n');
            }
            data.append(line.substring(5).trim());
            hasData = true;
        }
        // id:, retry: and anything else are not used by the service
        return null;
    }

    /**
     * Flushes a frame left open when the stream ended.
     *
     * @return the pending event, or null
     */
    ChangeEvent finish() {
        return dispatch();
    }

    private ChangeEvent dispatch() {
        String name = eventName;
        String payload = hasData ? data.toString() : null;
        eventName = null;
        data.setLength(0);
        hasData = false;

        if (name == null) {
            return null;
        }
        EventType type = EventType.fromWireName(name);
        if (type == null) {
            LOGGER.debug("skipping unrecognized event '{}'", name);
            return null;
        }
        if (!type.hasPayload()) {
            return new ChangeEvent(type, null, payload);
        }
        return decodePayload(type, payload);
    }

    private static ChangeEvent decodePayload(EventType type, String payload) {
        if (payload == null) {
            LOGGER.warn("skipping {} frame without data", type.getWireName());
            return null;
        }
        try {
            JsonElement element = JsonParser.parseString(payload);
            if (!element.isJsonObject()) {
                LOGGER.warn("skipping {} frame, payload is not an object: {}", type.getWireName(), payload);
                return null;
            }
            JsonObject object = element.getAsJsonObject();
            JsonElement path = object.get("path");
            if (path == null || !path.isJsonPrimitive()) {
                LOGGER.warn("skipping {} frame without path: {}", type.getWireName(), payload);
                return null;
            }
            JsonElement value = object.get("data");
            return new ChangeEvent(type, path.getAsString(), value == null ? "null" : value.toString());
        } catch (JsonParseException e) {
            LOGGER.warn("skipping malformed {} frame: {}", type.getWireName(), e.getMessage());
            return null;
        }
    }
}
