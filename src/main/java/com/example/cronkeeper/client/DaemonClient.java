package com.example.cronkeeper.client;

import com.example.cronkeeper.config.CronkeeperProperties;
import com.example.cronkeeper.domain.entity.DaemonConfig;
import com.example.cronkeeper.domain.entity.Entry;
import com.example.cronkeeper.domain.entity.EntryIdentifier;
import com.example.cronkeeper.dto.ControlRequest;
import com.example.cronkeeper.dto.ControlResponse;
import com.example.cronkeeper.exception.DaemonResponseException;
import com.example.cronkeeper.exception.DaemonUnreachableException;
import com.example.cronkeeper.util.ListenAddress;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.resilience4j.retry.annotation.Retry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.annotation.Profile;
import org.springframework.core.ParameterizedTypeReference;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import reactor.core.Exceptions;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.TimeoutException;

/**
 * Client for the daemon's control plane.
 * <p>
 * Uses:
 * - Retry for transport failures (the daemon may still be starting)
 * - WebClient for the HTTP calls
 * <p>
 * Error envelopes are returned, not thrown; only a failure to talk to the
 * daemon at all, or a body that is not an envelope, raises an exception.
 * Request bodies are written with their declared payload type so polymorphic
 * payloads keep their type wrapper.
 */
@Slf4j
@Component
@Profile("cli")
public class DaemonClient {

    private static final ParameterizedTypeReference<ControlResponse<JsonNode>> RESPONSE_TYPE = new ParameterizedTypeReference<>() {
    };
    private static final TypeReference<ControlRequest<Void>> EMPTY_REQUEST = new TypeReference<>() {
    };
    private static final TypeReference<ControlRequest<EntryIdentifier>> IDENTIFIER_REQUEST = new TypeReference<>() {
    };
    private static final TypeReference<ControlRequest<List<Entry>>> ENTRIES_REQUEST = new TypeReference<>() {
    };

    private final WebClient webClient;
    private final ObjectMapper objectMapper;
    private final Duration timeout;

    public DaemonClient(@Qualifier("daemonWebClient") WebClient webClient,
                        ObjectMapper objectMapper,
                        CronkeeperProperties properties) {
        this.webClient = webClient;
        this.objectMapper = objectMapper;
        this.timeout = Duration.ofSeconds(properties.getClientTimeoutSeconds());
    }

    /**
     * Send a request without payload, e.g. {@code /api/listEntries}.
     *
     * @return the response envelope, whatever its code
     * @throws DaemonUnreachableException if the daemon cannot be reached
     * @throws DaemonResponseException    if the response is not an envelope
     */
    @Retry(name = "daemon")
    public ControlResponse<JsonNode> call(DaemonConfig daemon, String path) {
        return send(daemon, path, encode(EMPTY_REQUEST, new ControlRequest<>(daemon.getToken(), null)));
    }

    /**
     * Send a request selecting entries by id or name.
     */
    @Retry(name = "daemon")
    public ControlResponse<JsonNode> call(DaemonConfig daemon, String path, EntryIdentifier identifier) {
        return send(daemon, path, encode(IDENTIFIER_REQUEST, new ControlRequest<>(daemon.getToken(), identifier)));
    }

    /**
     * Send a request carrying entries.
     */
    @Retry(name = "daemon")
    public ControlResponse<JsonNode> call(DaemonConfig daemon, String path, List<Entry> entries) {
        return send(daemon, path, encode(ENTRIES_REQUEST, new ControlRequest<>(daemon.getToken(), entries)));
    }

    private <T> byte[] encode(TypeReference<ControlRequest<T>> type, ControlRequest<T> request) {
        try {
            return objectMapper.writerFor(type).writeValueAsBytes(request);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Cannot encode request: " + e.getOriginalMessage(), e);
        }
    }

    private ControlResponse<JsonNode> send(DaemonConfig daemon, String path, byte[] body) {
        var address = daemon.getAddress();
        var url = ListenAddress.parse(address).clientUrl() + path;
        log.debug("Calling daemon at {}", url);

        try {
            return webClient.post()
                    .uri(url)
                    .contentType(MediaType.APPLICATION_JSON)
                    .bodyValue(body)
                    .exchangeToMono(response -> response.bodyToMono(RESPONSE_TYPE)
                            .switchIfEmpty(Mono.error(() -> new DaemonResponseException(address,
                                    "empty response with status " + response.statusCode().value()))))
                    .timeout(timeout)
                    .block();
        } catch (DaemonResponseException e) {
            throw e;
        } catch (WebClientRequestException e) {
            throw new DaemonUnreachableException(address, e);
        } catch (Exception e) {
            var cause = Exceptions.unwrap(e);
            if (cause instanceof TimeoutException timeoutException) {
                throw new DaemonUnreachableException(address, timeoutException);
            }
            throw new DaemonResponseException(address, e);
        }
    }
}
