package apimonitor.cooldown;

import apimonitor.support.MutableClock;
import co.elastic.clients.elasticsearch.ElasticsearchClient;
import co.elastic.clients.elasticsearch._types.ElasticsearchException;
import co.elastic.clients.elasticsearch._types.ErrorResponse;
import co.elastic.clients.elasticsearch.core.GetResponse;
import co.elastic.clients.elasticsearch.indices.ElasticsearchIndicesClient;
import co.elastic.clients.transport.endpoints.BooleanResponse;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.time.Duration;
import java.time.Instant;
import java.util.function.Function;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@SuppressWarnings({"unchecked", "rawtypes"})
class ElasticsearchCooldownGateTest {

    private static final Instant NOW = Instant.parse("2024-01-01T00:00:00Z");

    private ElasticsearchClient client;
    private MutableClock clock;
    private ElasticsearchCooldownGate gate;

    @BeforeEach
    void setUp() throws IOException {
        client = mock(ElasticsearchClient.class);
        ElasticsearchIndicesClient indices = mock(ElasticsearchIndicesClient.class);
        when(client.indices()).thenReturn(indices);
        when(indices.exists(any(Function.class))).thenReturn(new BooleanResponse(true));
        clock = new MutableClock(NOW);
        gate = new ElasticsearchCooldownGate(client, "cooldown", Duration.ofMinutes(5), clock);
    }

    private static ElasticsearchException esError(int status) {
        return new ElasticsearchException("test", ErrorResponse.of(r -> r
                .status(status)
                .error(e -> e.type("version_conflict_engine_exception").reason("conflict"))));
    }

    private GetResponse<CooldownDocument> existing(Instant expiresAt) {
        return existing(expiresAt.toString());
    }

    private GetResponse<CooldownDocument> existing(String expiresAt) {
        GetResponse<CooldownDocument> response = mock(GetResponse.class);
        when(response.found()).thenReturn(true);
        when(response.source()).thenReturn(new CooldownDocument(1, NOW.minusSeconds(60).toString(), expiresAt));
        when(response.seqNo()).thenReturn(3L);
        when(response.primaryTerm()).thenReturn(1L);
        return response;
    }

    @Test
    void firstNotificationCreatesRecord() throws IOException {
        assertThat(gate.tryAcquire(1)).isTrue();

        verify(client).create(any(Function.class));
        assertThat(gate.isDisabled()).isFalse();
    }

    @Test
    void activeRecordSuppressesNotification() throws IOException {
        when(client.create(any(Function.class))).thenThrow(esError(409));
        GetResponse<CooldownDocument> response = existing(NOW.plusSeconds(120));
        when(client.get(any(Function.class), eq(CooldownDocument.class))).thenReturn((GetResponse) response);

        assertThat(gate.tryAcquire(1)).isFalse();
        verify(client, never()).index(any(Function.class));
    }

    @Test
    void expiredRecordIsReplaced() throws IOException {
        when(client.create(any(Function.class))).thenThrow(esError(409));
        GetResponse<CooldownDocument> response = existing(NOW.minusSeconds(1));
        when(client.get(any(Function.class), eq(CooldownDocument.class))).thenReturn((GetResponse) response);

        assertThat(gate.tryAcquire(1)).isTrue();
        verify(client).index(any(Function.class));
    }

    @Test
    void losingConcurrentReplaceSuppressesNotification() throws IOException {
        when(client.create(any(Function.class))).thenThrow(esError(409));
        GetResponse<CooldownDocument> response = existing(NOW.minusSeconds(1));
        when(client.get(any(Function.class), eq(CooldownDocument.class))).thenReturn((GetResponse) response);
        when(client.index(any(Function.class))).thenThrow(esError(409));

        assertThat(gate.tryAcquire(1)).isFalse();
        assertThat(gate.isDisabled()).isFalse();
    }

    @Test
    void backendFailureFailsOpenAndFallsBackToLocalGate() throws IOException {
        when(client.create(any(Function.class))).thenThrow(new IOException("connection refused"));

        assertThat(gate.tryAcquire(1)).isTrue();
        assertThat(gate.isDisabled()).isTrue();

        assertThat(gate.tryAcquire(1)).isFalse();
        assertThat(gate.tryAcquire(2)).isTrue();
        verify(client, times(1)).create(any(Function.class));
    }

    @Test
    void unexpectedClientErrorFailsOpenAndDisablesGate() throws IOException {
        when(client.create(any(Function.class))).thenThrow(new IllegalStateException("malformed response"));

        assertThat(gate.tryAcquire(1)).isTrue();
        assertThat(gate.isDisabled()).isTrue();
        assertThat(gate.tryAcquire(1)).isFalse();
    }

    @Test
    void epochMillisExpiryIsHonoured() throws IOException {
        when(client.create(any(Function.class))).thenThrow(esError(409));
        GetResponse<CooldownDocument> response = existing(String.valueOf(NOW.plusSeconds(120).toEpochMilli()));
        when(client.get(any(Function.class), eq(CooldownDocument.class))).thenReturn((GetResponse) response);

        assertThat(gate.tryAcquire(1)).isFalse();
        assertThat(gate.isDisabled()).isFalse();
    }

    @Test
    void unreadableExpiryIsTreatedAsExpired() throws IOException {
        when(client.create(any(Function.class))).thenThrow(esError(409));
        GetResponse<CooldownDocument> response = existing("not-a-date");
        when(client.get(any(Function.class), eq(CooldownDocument.class))).thenReturn((GetResponse) response);

        assertThat(gate.tryAcquire(1)).isTrue();
        verify(client).index(any(Function.class));
    }

    @Test
    void parseExpiresAtAcceptsIsoAndEpochMillis() {
        assertThat(ElasticsearchCooldownGate.parseExpiresAt("2024-01-01T00:05:00Z"))
                .isEqualTo(NOW.plusSeconds(300));
        assertThat(ElasticsearchCooldownGate.parseExpiresAt(String.valueOf(NOW.toEpochMilli()))).isEqualTo(NOW);
        assertThat(ElasticsearchCooldownGate.parseExpiresAt(null)).isEqualTo(Instant.EPOCH);
    }

    @Test
    void revalidateReenablesBackend() throws IOException {
        when(client.create(any(Function.class))).thenThrow(new IOException("down"));
        gate.tryAcquire(1);
        when(client.ping()).thenReturn(new BooleanResponse(true));

        assertThat(gate.revalidate()).isTrue();
        assertThat(gate.isDisabled()).isFalse();
    }

    @Test
    void revalidateKeepsGateDisabledWhileBackendDown() throws IOException {
        when(client.ping()).thenThrow(new IOException("down"));

        assertThat(gate.revalidate()).isFalse();
        assertThat(gate.isDisabled()).isTrue();
    }

    @Test
    void missingIndexClientDisablesGate() {
        ElasticsearchCooldownGate unavailable = new ElasticsearchCooldownGate(
                mock(ElasticsearchClient.class), "cooldown", Duration.ofMinutes(5), clock);

        assertThat(unavailable.isDisabled()).isTrue();
        assertThat(unavailable.tryAcquire(1)).isTrue();
        assertThat(unavailable.tryAcquire(1)).isFalse();
    }

    @Test
    void documentIdIsPerEndpoint() {
        assertThat(ElasticsearchCooldownGate.documentId(42)).isEqualTo("endpoint_42");
    }
}
