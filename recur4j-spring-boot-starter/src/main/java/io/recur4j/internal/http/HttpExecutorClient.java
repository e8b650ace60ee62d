package io.recur4j.internal.http;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.recur4j.ExecutorClient;
import io.recur4j.core.TriggerResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestClientResponseException;
import org.springframework.web.util.UriComponentsBuilder;

import java.net.URI;
import java.time.Duration;
import java.util.Objects;

/**
 * {@link ExecutorClient} talking to the executor's control endpoint.
 *
 * <p>Sends {@code GET {controlUrl}?job_id=ID}. The signal counts as accepted only when the reply is 2xx
 * and its JSON body carries {@code "ok": true}. No retries.
 */
public class HttpExecutorClient implements ExecutorClient {

    private static final Logger log = LoggerFactory.getLogger(HttpExecutorClient.class);

    static final String TOKEN_HEADER = "X-Token";
    // placeholder shipped in sample configs; never sent
    static final String PLACEHOLDER_TOKEN = "CHANGE_ME";

    private final RestClient restClient;
    private final ObjectMapper objectMapper;
    private final String controlUrl;
    private final String token;

    public HttpExecutorClient(String controlUrl, String token, Duration connectTimeout, Duration readTimeout,
                              ObjectMapper objectMapper) {
        this(RestClient.builder().requestFactory(requestFactory(connectTimeout, readTimeout)),
                controlUrl, token, objectMapper);
    }

    /**
     * @param builder pre-configured builder; its request factory is used as is
     */
    public HttpExecutorClient(RestClient.Builder builder, String controlUrl, String token, ObjectMapper objectMapper) {
        Objects.requireNonNull(builder, "builder must not be null");
        if (controlUrl == null || controlUrl.isBlank()) {
            throw new IllegalArgumentException("controlUrl must not be blank");
        }
        this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper must not be null");
        this.controlUrl = controlUrl.trim();
        this.token = (token == null || token.isBlank() || PLACEHOLDER_TOKEN.equals(token.trim()))
                ? null
                : token.trim();
        this.restClient = builder.build();
    }

    private static SimpleClientHttpRequestFactory requestFactory(Duration connectTimeout, Duration readTimeout) {
        SimpleClientHttpRequestFactory factory = new SimpleClientHttpRequestFactory();
        factory.setConnectTimeout(Objects.requireNonNull(connectTimeout, "connectTimeout must not be null"));
        factory.setReadTimeout(Objects.requireNonNull(readTimeout, "readTimeout must not be null"));
        return factory;
    }

    @Override
    public TriggerResult runNow(String jobId) {
        Objects.requireNonNull(jobId, "jobId must not be null");
        URI uri = UriComponentsBuilder.fromHttpUrl(controlUrl)
                .queryParam("job_id", jobId)
                .encode()
                .build()
                .toUri();

        ResponseEntity<String> response;
        try {
            response = restClient.get()
                    .uri(uri)
                    .accept(MediaType.APPLICATION_JSON)
                    .headers(h -> {
                        if (token != null) {
                            h.set(TOKEN_HEADER, token);
                        }
                    })
                    .retrieve()
                    .toEntity(String.class);
        } catch (RestClientResponseException e) {
            int code = e.getStatusCode().value();
            return TriggerResult.rejected(code, "HTTP=" + code + " resp=" + e.getResponseBodyAsString());
        } catch (RestClientException e) {
            log.debug("recur4j executor unreachable url={}", controlUrl, e);
            return TriggerResult.unreachable("executor unreachable: " + e.getMessage());
        }

        int code = response.getStatusCode().value();
        String body = response.getBody() == null ? "" : response.getBody();
        if (response.getStatusCode().is2xxSuccessful() && isOk(body)) {
            return TriggerResult.accepted(code, "queued job " + jobId);
        }
        return TriggerResult.rejected(code, "HTTP=" + code + " resp=" + body);
    }

    private boolean isOk(String body) {
        if (body.isBlank()) {
            return false;
        }
        try {
            JsonNode node = objectMapper.readTree(body);
            return node != null && node.path("ok").asBoolean(false);
        } catch (JsonProcessingException e) {
            return false;
        }
    }
}
