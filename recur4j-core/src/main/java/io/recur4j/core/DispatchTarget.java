package io.recur4j.core;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * Where and what a job dispatches. Opaque to scheduling; only validated and stored.
 *
 * @param channel     HTTP or MQTT
 * @param destination request URL for HTTP, topic for MQTT
 * @param httpMethod  GET or POST (HTTP only)
 * @param contentType payload content type (HTTP only)
 * @param headers     extra request headers (HTTP only)
 * @param payload     request body or message payload
 * @param qos         MQTT quality of service, 0..2
 * @param retained    MQTT retained flag
 */
public record DispatchTarget(
        Channel channel,
        String destination,
        String httpMethod,
        String contentType,
        Map<String, String> headers,
        String payload,
        int qos,
        boolean retained
) {

    public static final String DEFAULT_HTTP_METHOD = "POST";
    public static final String DEFAULT_CONTENT_TYPE = "text/plain";

    public DispatchTarget {
        Objects.requireNonNull(channel, "channel must not be null");
        httpMethod = (httpMethod == null || httpMethod.isBlank())
                ? DEFAULT_HTTP_METHOD
                : httpMethod.trim().toUpperCase(Locale.ROOT);
        contentType = (contentType == null || contentType.isBlank()) ? DEFAULT_CONTENT_TYPE : contentType.trim();
        headers = (headers == null || headers.isEmpty())
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(headers));
        payload = payload == null ? "" : payload;
        destination = destination == null ? null : destination.trim();
    }

    public static DispatchTarget http(String url, String method, String contentType, Map<String, String> headers,
                                      String payload) {
        return new DispatchTarget(Channel.HTTP, url, method, contentType, headers, payload, 0, false);
    }

    public static DispatchTarget mqtt(String topic, String payload, int qos, boolean retained) {
        return new DispatchTarget(Channel.MQTT, topic, null, null, null, payload, qos, retained);
    }

    /**
     * @throws InvalidScheduleException when the channel's required destination is missing
     */
    public DispatchTarget validate() {
        boolean missing = destination == null || destination.isEmpty();
        switch (channel) {
            case HTTP -> {
                if (missing) {
                    throw new InvalidScheduleException("HTTP requires http_url");
                }
            }
            case MQTT -> {
                if (missing) {
                    throw new InvalidScheduleException("MQTT requires mqtt_topic");
                }
                if (qos < 0 || qos > 2) {
                    throw new InvalidScheduleException("qos must be 0, 1 or 2: " + qos);
                }
            }
        }
        return this;
    }
}
