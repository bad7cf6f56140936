package com.phillippitts.callagent.service.streaming;

import org.json.JSONException;
import org.json.JSONObject;

import java.util.Base64;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

/**
 * Builds and parses media-stream JSON frames (Twilio Media Streams protocol).
 *
 * <p>Inbound events: {@code connected}, {@code start}, {@code media}, {@code mark}, {@code stop}.
 * Outbound events: {@code media}, {@code clear}, {@code stop}. Audio payloads are base64 mu-law.
 */
public final class MediaStreamFrames {

    /** Event type of an inbound frame. */
    public enum Event {
        CONNECTED, START, MEDIA, MARK, STOP, UNKNOWN;

        static Event of(String name) {
            if (name == null) {
                return UNKNOWN;
            }
            try {
                return Event.valueOf(name.trim().toUpperCase(Locale.ROOT));
            } catch (IllegalArgumentException e) {
                return UNKNOWN;
            }
        }
    }

    /**
     * A parsed inbound frame. Fields not carried by the event are empty strings or empty arrays.
     *
     * @param event event type
     * @param streamSid stream identifier
     * @param callSid call identifier ({@code start} only)
     * @param customParameters TwiML {@code <Parameter>} values ({@code start} only)
     * @param payload decoded audio ({@code media} only)
     * @param markName mark label ({@code mark} only)
     */
    public record InboundFrame(Event event,
                               String streamSid,
                               String callSid,
                               Map<String, String> customParameters,
                               byte[] payload,
                               String markName) {

        public String parameter(String name) {
            return customParameters.getOrDefault(name, "");
        }
    }

    private MediaStreamFrames() {}

    public static String media(String streamSid, byte[] ulaw) {
        return new JSONObject()
                .put("event", "media")
                .put("streamSid", streamSid)
                .put("media", new JSONObject().put("payload", Base64.getEncoder().encodeToString(ulaw)))
                .toString();
    }

    public static String clear(String streamSid) {
        return new JSONObject()
                .put("event", "clear")
                .put("streamSid", streamSid)
                .toString();
    }

    public static String stop(String streamSid) {
        return new JSONObject()
                .put("event", "stop")
                .put("streamSid", streamSid)
                .toString();
    }

    /**
     * Parses an inbound frame.
     *
     * @throws IllegalArgumentException if the text is not a JSON object or the payload is not base64
     */
    public static InboundFrame parse(String json) {
        JSONObject root;
        try {
            root = new JSONObject(json);
        } catch (JSONException e) {
            throw new IllegalArgumentException("Malformed media-stream frame: " + e.getMessage(), e);
        }

        Event event = Event.of(root.optString("event", null));
        String streamSid = root.optString("streamSid", "");
        String callSid = "";
        Map<String, String> custom = new LinkedHashMap<>();
        byte[] payload = new byte[0];
        String markName = "";

        switch (event) {
            case START -> {
                JSONObject start = root.optJSONObject("start");
                if (start != null) {
                    callSid = start.optString("callSid", "");
                    if (streamSid.isEmpty()) {
                        streamSid = start.optString("streamSid", "");
                    }
                    JSONObject params = start.optJSONObject("customParameters");
                    if (params != null) {
                        for (String key : params.keySet()) {
                            custom.put(key, params.optString(key, ""));
                        }
                    }
                }
            }
            case MEDIA -> {
                JSONObject media = root.optJSONObject("media");
                String encoded = media == null ? "" : media.optString("payload", "");
                payload = Base64.getDecoder().decode(encoded);
            }
            case MARK -> {
                JSONObject mark = root.optJSONObject("mark");
                markName = mark == null ? "" : mark.optString("name", "");
            }
            case STOP -> {
                JSONObject stop = root.optJSONObject("stop");
                callSid = stop == null ? "" : stop.optString("callSid", "");
            }
            default -> {
                // connected and unknown events carry nothing we use
            }
        }
        return new InboundFrame(event, streamSid, callSid, Map.copyOf(custom), payload, markName);
    }
}
