package com.example.clustermonitor.mcp;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class McpExchangeTest {

    private static final Duration TIMEOUT = Duration.ofSeconds(2);

    private final ObjectMapper mapper = new ObjectMapper();
    private InMemoryFrameChannel channel;
    private McpExchange exchange;

    @BeforeEach
    void setUp() {
        channel = new InMemoryFrameChannel();
        exchange = new McpExchange(channel, new McpMessageCodec(mapper));
    }

    private long idOf(String frame) {
        try {
            return mapper.readTree(frame).path("id").asLong();
        } catch (Exception e) {
            throw new IllegalStateException(e);
        }
    }

    private static McpClientException.Kind kindOf(Throwable e) {
        return ((McpClientException) e).getKind();
    }

    @Test
    void pingReturnsIdMatchedResult() {
        channel.respondWith(frame -> List.of("{\"jsonrpc\":\"2.0\",\"id\":" + idOf(frame) + ",\"result\":\"pong\"}"));

        JsonNode result = exchange.call("ping", Map.of(), TIMEOUT);

        assertThat(result.asText()).isEqualTo("pong");
        assertThat(channel.written).hasSize(1);
        assertThat(channel.written.get(0)).contains("\"method\":\"ping\"").contains("\"id\":1");
    }

    @Test
    void idsStartAtOneAndStrictlyIncrease() {
        channel.respondWith(frame -> List.of("{\"id\":" + idOf(frame) + ",\"result\":" + idOf(frame) + "}"));

        assertThat(exchange.peekNextId()).isEqualTo(1);
        assertThat(exchange.call("a", Map.of(), TIMEOUT).asLong()).isEqualTo(1);
        assertThat(exchange.call("b", Map.of(), TIMEOUT).asLong()).isEqualTo(2);
        assertThat(exchange.call("c", Map.of(), TIMEOUT).asLong()).isEqualTo(3);
        assertThat(exchange.peekNextId()).isEqualTo(4);
    }

    @Test
    void mismatchedIdIsProtocolFailure() {
        channel.respondWith(frame -> List.of("{\"id\":" + (idOf(frame) + 1) + ",\"result\":\"pong\"}"));

        assertThatThrownBy(() -> exchange.call("ping", Map.of(), TIMEOUT))
                .isInstanceOf(McpClientException.class)
                .satisfies(e -> assertThat(kindOf(e)).isEqualTo(McpClientException.Kind.PROTOCOL))
                .hasMessageContaining("does not match request id 1");
    }

    @Test
    void missingIdIsProtocolFailure() {
        channel.respondWith(frame -> List.of("{\"result\":\"pong\"}"));

        assertThatThrownBy(() -> exchange.call("ping", Map.of(), TIMEOUT))
                .satisfies(e -> assertThat(kindOf(e)).isEqualTo(McpClientException.Kind.PROTOCOL));
    }

    @Test
    void malformedFrameIsProtocolFailure() {
        channel.respondWith(frame -> List.of("not json at all"));

        assertThatThrownBy(() -> exchange.call("ping", Map.of(), TIMEOUT))
                .isInstanceOf(McpClientException.class)
                .hasCauseInstanceOf(MalformedFrameException.class)
                .satisfies(e -> assertThat(kindOf(e)).isEqualTo(McpClientException.Kind.PROTOCOL));
    }

    @Test
    void errorEnvelopeIsRemoteFailureWithCode() {
        channel.respondWith(frame -> List.of(
                "{\"id\":" + idOf(frame) + ",\"error\":{\"code\":-32000,\"message\":\"Server busy\"}}"));

        assertThatThrownBy(() -> exchange.call("tools/call", Map.of("name", "x"), TIMEOUT))
                .isInstanceOf(McpClientException.class)
                .hasMessageContaining("Server busy")
                .satisfies(e -> {
                    assertThat(kindOf(e)).isEqualTo(McpClientException.Kind.REMOTE);
                    assertThat(((McpClientException) e).getRemoteCode()).isEqualTo(-32000);
                });
    }

    @Test
    void noFrameBeforeDeadlineIsTimeoutAndChannelStaysUsable() {
        assertThatThrownBy(() -> exchange.call("ping", Map.of(), Duration.ofMillis(50)))
                .satisfies(e -> assertThat(kindOf(e)).isEqualTo(McpClientException.Kind.TIMEOUT));
        assertThat(channel.isAlive()).isTrue();

        channel.respondWith(frame -> List.of("{\"id\":" + idOf(frame) + ",\"result\":\"pong\"}"));
        assertThat(exchange.call("ping", Map.of(), TIMEOUT).asText()).isEqualTo("pong");
    }

    @Test
    void staleFramesAreDiscardedBeforeTheNextRequest() {
        channel.offer("{\"id\":99,\"result\":\"late\"}");
        channel.respondWith(frame -> List.of("{\"id\":" + idOf(frame) + ",\"result\":\"fresh\"}"));

        assertThat(exchange.call("ping", Map.of(), TIMEOUT).asText()).isEqualTo("fresh");
    }

    @Test
    void lateReplyToAnEarlierRequestIsSkippedWhileWaiting() {
        assertThatThrownBy(() -> exchange.call("slow", Map.of(), Duration.ofMillis(20)))
                .satisfies(e -> assertThat(kindOf(e)).isEqualTo(McpClientException.Kind.TIMEOUT));

        channel.respondWith(frame -> List.of(
                "{\"id\":" + (idOf(frame) - 1) + ",\"result\":\"late\"}",
                "{\"id\":" + idOf(frame) + ",\"result\":\"fresh\"}"));

        assertThat(exchange.call("ping", Map.of(), TIMEOUT).asText()).isEqualTo("fresh");
    }

    @Test
    void onlyALateReplyBeforeTheDeadlineIsTimeout() {
        channel.respondWith(frame -> List.of("{\"id\":" + (idOf(frame) - 1) + ",\"result\":\"late\"}"));

        assertThatThrownBy(() -> exchange.call("ping", Map.of(), Duration.ofMillis(50)))
                .satisfies(e -> assertThat(kindOf(e)).isEqualTo(McpClientException.Kind.TIMEOUT));
    }

    @Test
    void deadChannelFailsBeforeAnyIo() {
        channel.kill();

        assertThatThrownBy(() -> exchange.call("ping", Map.of(), TIMEOUT))
                .satisfies(e -> assertThat(kindOf(e)).isEqualTo(McpClientException.Kind.NOT_CONNECTED));
        assertThat(channel.written).isEmpty();
        assertThat(exchange.peekNextId()).isEqualTo(1);
    }
}
