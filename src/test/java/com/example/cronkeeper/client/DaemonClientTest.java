package com.example.cronkeeper.client;

import com.example.cronkeeper.config.CronkeeperProperties;
import com.example.cronkeeper.domain.entity.DaemonConfig;
import com.example.cronkeeper.domain.entity.Entry;
import com.example.cronkeeper.domain.entity.EntryIdentifier;
import com.example.cronkeeper.domain.time.Duration;
import com.example.cronkeeper.domain.trigger.Timer;
import com.example.cronkeeper.domain.trigger.Trigger;
import com.example.cronkeeper.dto.ControlRequest;
import com.example.cronkeeper.exception.DaemonResponseException;
import com.example.cronkeeper.exception.DaemonUnreachableException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.codec.HttpMessageWriter;
import org.springframework.http.server.reactive.ServerHttpRequest;
import org.springframework.mock.http.client.reactive.MockClientHttpRequest;
import org.springframework.web.reactive.function.BodyInserter;
import org.springframework.web.reactive.function.client.ClientRequest;
import org.springframework.web.reactive.function.client.ClientResponse;
import org.springframework.web.reactive.function.client.ExchangeStrategies;
import org.springframework.web.reactive.function.client.ExchangeFunction;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import reactor.core.publisher.Mono;

import java.net.ConnectException;
import java.net.URI;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("DaemonClient Tests")
class DaemonClientTest {

    private final DaemonConfig daemon = new DaemonConfig(List.of(), "0.0.0.0:6472", "secret");

    private final List<ClientRequest> requests = new ArrayList<>();

    private final ObjectMapper objectMapper = new ObjectMapper();

    private CronkeeperProperties properties;

    @BeforeEach
    void setUp() {
        properties = new CronkeeperProperties();
        properties.setClientTimeoutSeconds(1);
    }

    private DaemonClient client(ExchangeFunction exchange) {
        ExchangeFunction recording = request -> {
            requests.add(request);
            return exchange.exchange(request);
        };
        return new DaemonClient(WebClient.builder().exchangeFunction(recording).build(), objectMapper, properties);
    }

    private static String bodyOf(ClientRequest request) {
        var written = new MockClientHttpRequest(request.method(), request.url());
        request.body().insert(written, new BodyInserter.Context() {
            @Override
            public List<HttpMessageWriter<?>> messageWriters() {
                return ExchangeStrategies.withDefaults().messageWriters();
            }

            @Override
            public Optional<ServerHttpRequest> serverRequest() {
                return Optional.empty();
            }

            @Override
            public Map<String, Object> hints() {
                return Map.of();
            }
        }).block();
        return written.getBodyAsString().block();
    }

    private static Mono<ClientResponse> json(HttpStatus status, String body) {
        return Mono.just(ClientResponse.create(status)
                .header(HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_JSON_VALUE)
                .body(body)
                .build());
    }

    @Nested
    @DisplayName("Envelope Tests")
    class EnvelopeTests {

        @Test
        @DisplayName("Should decode a success envelope")
        void shouldDecodeSuccess() {
            var client = client(request -> json(HttpStatus.OK, "{\"code\":200,\"data\":[\"backup\",\"report\"]}"));

            var response = client.call(daemon, "/api/addEntries", List.<Entry>of());

            assertThat(response.isSuccess()).isTrue();
            assertThat(response.getData().size()).isEqualTo(2);
            assertThat(response.getData().get(0).asText()).isEqualTo("backup");
        }

        @Test
        @DisplayName("Should return an error envelope instead of throwing")
        void shouldReturnErrorEnvelope() {
            var client = client(request -> json(HttpStatus.UNAUTHORIZED, "{\"code\":401,\"data\":\"Invalid token\"}"));

            var response = client.call(daemon, "/api/listEntries");

            assertThat(response.isSuccess()).isFalse();
            assertThat(response.getCode()).isEqualTo(401);
            assertThat(response.getData().asText()).isEqualTo("Invalid token");
        }

        @Test
        @DisplayName("Should reach a wildcard bind address through loopback")
        void shouldUseLoopbackForWildcard() {
            var client = client(request -> json(HttpStatus.OK, "{\"code\":200,\"data\":\"Daemon stopping\"}"));

            client.call(daemon, "/api/stopDaemon");

            assertThat(requests).singleElement().satisfies(request -> {
                assertThat(request.method()).isEqualTo(HttpMethod.POST);
                assertThat(request.url()).isEqualTo(URI.create("http://127.0.0.1:6472/api/stopDaemon"));
            });
        }
    }

    @Nested
    @DisplayName("Request Body Tests")
    class RequestBodyTests {

        private final List<String> bodies = new ArrayList<>();

        private DaemonClient capturingClient() {
            return client(request -> {
                bodies.add(bodyOf(request));
                return json(HttpStatus.OK, "{\"code\":200,\"data\":\"ok\"}");
            });
        }

        @Test
        @DisplayName("Should send an id identifier the daemon can read back")
        void shouldSendIdIdentifier() throws Exception {
            capturingClient().call(daemon, "/api/startEntries", new EntryIdentifier.Id(3));

            var request = objectMapper.readValue(bodies.get(0), new TypeReference<ControlRequest<EntryIdentifier>>() {
            });
            assertThat(request.getToken()).isEqualTo("secret");
            assertThat(request.getData()).isEqualTo(new EntryIdentifier.Id(3));
            assertThat(bodies.get(0)).contains("\"Id\":{\"id\":3}");
        }

        @Test
        @DisplayName("Should send a name identifier the daemon can read back")
        void shouldSendNameIdentifier() throws Exception {
            capturingClient().call(daemon, "/api/deleteEntries", new EntryIdentifier.Name("backup"));

            var request = objectMapper.readValue(bodies.get(0), new TypeReference<ControlRequest<EntryIdentifier>>() {
            });
            assertThat(request.getData()).isEqualTo(new EntryIdentifier.Name("backup"));
        }

        @Test
        @DisplayName("Should send entries with their trigger wrapper")
        void shouldSendEntries() throws Exception {
            var entry = Entry.builder()
                    .name("backup")
                    .trigger(Trigger.timer(new Timer.Repeat(Duration.ofDays(1))))
                    .build();

            capturingClient().call(daemon, "/api/addEntries", List.of(entry));

            var request = objectMapper.readValue(bodies.get(0), new TypeReference<ControlRequest<List<Entry>>>() {
            });
            assertThat(request.getData()).singleElement().satisfies(sent -> {
                assertThat(sent.getName()).isEqualTo("backup");
                assertThat(sent.getTrigger()).isEqualTo(entry.getTrigger());
            });
        }

        @Test
        @DisplayName("Should send a null payload with the token")
        void shouldSendEmptyPayload() throws Exception {
            capturingClient().call(daemon, "/api/listEntries");

            var request = objectMapper.readTree(bodies.get(0));
            assertThat(request.get("token").asText()).isEqualTo("secret");
            assertThat(request.get("data").isNull()).isTrue();
        }
    }

    @Nested
    @DisplayName("Failure Tests")
    class FailureTests {

        @Test
        @DisplayName("Should report an unreachable daemon")
        void shouldReportUnreachable() {
            var client = client(request -> Mono.error(new WebClientRequestException(
                    new ConnectException("Connection refused"), HttpMethod.POST, request.url(), new HttpHeaders())));

            assertThatThrownBy(() -> client.call(daemon, "/api/listEntries"))
                    .isInstanceOf(DaemonUnreachableException.class)
                    .hasMessageContaining("0.0.0.0:6472");
        }

        @Test
        @DisplayName("Should report a daemon that does not answer in time")
        void shouldReportTimeout() {
            var client = client(request -> Mono.never());

            assertThatThrownBy(() -> client.call(daemon, "/api/listEntries"))
                    .isInstanceOf(DaemonUnreachableException.class);
        }

        @Test
        @DisplayName("Should reject a body that is not an envelope")
        void shouldRejectMalformedBody() {
            var client = client(request -> json(HttpStatus.OK, "not json"));

            assertThatThrownBy(() -> client.call(daemon, "/api/listEntries"))
                    .isInstanceOf(DaemonResponseException.class);
        }

        @Test
        @DisplayName("Should reject an empty body")
        void shouldRejectEmptyBody() {
            var client = client(request -> Mono.just(ClientResponse.create(HttpStatus.BAD_GATEWAY)
                    .header(HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_JSON_VALUE)
                    .build()));

            assertThatThrownBy(() -> client.call(daemon, "/api/listEntries"))
                    .isInstanceOf(DaemonResponseException.class)
                    .hasMessageContaining("502");
        }

        @Test
        @DisplayName("Should reject an invalid address before sending")
        void shouldRejectInvalidAddress() {
            var client = client(request -> json(HttpStatus.OK, "{\"code\":200}"));
            var broken = new DaemonConfig(List.of(), "localhost", "secret");

            assertThatThrownBy(() -> client.call(broken, "/api/listEntries"))
                    .isInstanceOf(IllegalArgumentException.class);
            assertThat(requests).isEmpty();
        }
    }
}
