package com.koni.historyinjector.application.ingest;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.koni.historyinjector.application.port.RejectionPublisher;
import com.koni.historyinjector.domain.event.RecordRejected;
import com.koni.historyinjector.domain.exception.EntityNotFoundException;
import com.koni.historyinjector.domain.exception.FatalSchemaMismatchException;
import com.koni.historyinjector.domain.model.AttributeBlob;
import com.koni.historyinjector.domain.model.DispatchReport;
import com.koni.historyinjector.domain.model.EntityMetadata;
import com.koni.historyinjector.domain.model.RecordOutcome;
import com.koni.historyinjector.domain.model.RecordStage;
import com.koni.historyinjector.domain.model.RejectionReason;
import com.koni.historyinjector.infrastructure.observability.InjectionMetrics;
import com.koni.historyinjector.tags.UnitTest;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;
import org.springframework.transaction.support.TransactionCallback;

import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * Unit tests for HistoryIngestionDispatcher.
 * Tests the per-record state machine, rejection reporting and per-entity locking.
 */
@UnitTest
@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
class HistoryIngestionDispatcherTest {

    private static final Instant NOW = Instant.parse("2023-04-20T00:00:00Z");
    private static final String TOPIC = "homeassistant/history/sensor.bedroom_temperature";
    private static final String ENTITY_ID = "sensor.bedroom_temperature";

    @Mock
    private EntityResolver entityResolver;

    @Mock
    private AttributeCodec attributeCodec;

    @Mock
    private HistoryWriter historyWriter;

    @Mock
    private StoreTransactions storeTransactions;

    @Mock
    private RejectionPublisher rejectionPublisher;

    private MeterRegistry meterRegistry;
    private HistoryIngestionDispatcher dispatcher;

    @BeforeEach
    void setUp() {
        meterRegistry = new SimpleMeterRegistry();
        Clock clock = Clock.fixed(NOW, ZoneOffset.UTC);
        dispatcher = new HistoryIngestionDispatcher(
                new MessageDecoder(new ObjectMapper(), "homeassistant/history/", "sensor."),
                new TimestampValidator(clock, 30, Duration.ZERO),
                entityResolver,
                attributeCodec,
                historyWriter,
                storeTransactions,
                rejectionPublisher,
                new InjectionMetrics(meterRegistry),
                clock,
                Duration.ofMillis(200));

        when(storeTransactions.execute(anyString(), any())).thenAnswer(invocation -> {
            TransactionCallback<?> work = invocation.getArgument(1);
            return work.doInTransaction(null);
        });
        when(entityResolver.resolve(eq(ENTITY_ID), anyMap()))
                .thenReturn(new EntityMetadata(ENTITY_ID, 1L, EntityMetadata.Origin.EXISTING));
        when(attributeCodec.encode(anyMap())).thenReturn(new AttributeBlob(9L, 123L, "{}", false));
        when(historyWriter.write(anyLong(), anyLong(), anyString(), any()))
                .thenReturn(HistoryWriter.WriteResult.INSERTED);
    }

    @Test
    void shouldCommitValidRecord() {
        // When
        DispatchReport report = dispatcher.dispatch(TOPIC,
                bytes("{\"state\":\"23.5\",\"timestamp\":\"2023-04-15T02:30:00Z\",\"attributes\":{}}"));

        // Then
        assertThat(report.committedCount()).isEqualTo(1);
        assertThat(report.getOutcomes().get(0).getStage()).isEqualTo(RecordStage.COMMITTED);
        verify(historyWriter).write(1L, 9L, "23.5", Instant.parse("2023-04-15T02:30:00Z"));
        verify(rejectionPublisher, never()).publish(any());
        assertThat(meterRegistry.get("history.records.committed.total").counter().count()).isEqualTo(1.0);
    }

    @Test
    void shouldDropMalformedMessageAndReportIt() {
        // When
        DispatchReport report = dispatcher.dispatch(TOPIC, bytes("{not json"));

        // Then
        assertThat(report.isMessageRejected()).isTrue();
        assertThat(report.getMessageRejection()).isEqualTo(RejectionReason.DECODE_ERROR);
        assertThat(report.getOutcomes()).isEmpty();

        ArgumentCaptor<RecordRejected> event = ArgumentCaptor.forClass(RecordRejected.class);
        verify(rejectionPublisher).publish(event.capture());
        assertThat(event.getValue().getRecordIndex()).isEqualTo(-1);
        assertThat(event.getValue().getReason()).isEqualTo(RejectionReason.DECODE_ERROR);
        assertThat(event.getValue().getTopic()).isEqualTo(TOPIC);
        assertThat(event.getValue().getRejectedAt()).isEqualTo(NOW);
        verify(entityResolver, never()).resolve(anyString(), anyMap());
    }

    @Test
    void shouldRejectOutOfWindowRecordWithoutAffectingSiblings() {
        // Given: middle record is 40 days old
        String payload = "{\"records\":["
                + "{\"state\":\"1\",\"timestamp\":\"2023-04-15T00:00:00Z\"},"
                + "{\"state\":\"2\",\"timestamp\":\"2023-03-01T00:00:00Z\"},"
                + "{\"state\":\"3\",\"timestamp\":\"2023-04-16T00:00:00Z\"}]}";

        // When
        DispatchReport report = dispatcher.dispatch(TOPIC, bytes(payload));

        // Then
        assertThat(report.committedCount()).isEqualTo(2);
        assertThat(report.rejectedCount()).isEqualTo(1);
        RecordOutcome rejected = report.getOutcomes().get(1);
        assertThat(rejected.getStage()).isEqualTo(RecordStage.REJECTED);
        assertThat(rejected.getLastReachedStage()).isEqualTo(RecordStage.DECODED);
        assertThat(rejected.getReason()).isEqualTo(RejectionReason.TIMESTAMP_OUT_OF_WINDOW);
        assertThat(meterRegistry.get("history.records.rejected.total")
                .tag("reason", "TIMESTAMP_OUT_OF_WINDOW").counter().count()).isEqualTo(1.0);
        verify(historyWriter, never()).write(anyLong(), anyLong(), eq("2"), any());
    }

    @Test
    void shouldRecordStageReachedBeforeEntityRejection() {
        // Given
        when(entityResolver.resolve(eq(ENTITY_ID), anyMap()))
                .thenThrow(new EntityNotFoundException("unknown entity"));

        // When
        DispatchReport report = dispatcher.dispatch(TOPIC,
                bytes("{\"state\":\"1\",\"timestamp\":\"2023-04-15T00:00:00Z\"}"));

        // Then
        RecordOutcome outcome = report.getOutcomes().get(0);
        assertThat(outcome.getReason()).isEqualTo(RejectionReason.ENTITY_NOT_FOUND);
        assertThat(outcome.getLastReachedStage()).isEqualTo(RecordStage.TIMESTAMP_CHECKED);

        ArgumentCaptor<RecordRejected> event = ArgumentCaptor.forClass(RecordRejected.class);
        verify(rejectionPublisher).publish(event.capture());
        assertThat(event.getValue().getEntityId()).isEqualTo(ENTITY_ID);
        assertThat(event.getValue().getRecordIndex()).isZero();
    }

    @Test
    void shouldRejectRecordWhenEntityLockIsHeldTooLong() throws Exception {
        // Given: the first dispatch blocks inside the store write while holding the entity lock
        CountDownLatch writing = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        when(historyWriter.write(anyLong(), anyLong(), eq("1"), any())).thenAnswer(invocation -> {
            writing.countDown();
            release.await(5, TimeUnit.SECONDS);
            return HistoryWriter.WriteResult.INSERTED;
        });
        CompletableFuture<DispatchReport> first = CompletableFuture.supplyAsync(() -> dispatcher.dispatch(TOPIC,
                bytes("{\"state\":\"1\",\"timestamp\":\"2023-04-15T00:00:00Z\"}")));
        assertThat(writing.await(5, TimeUnit.SECONDS)).isTrue();

        // When
        DispatchReport second = dispatcher.dispatch(TOPIC,
                bytes("{\"state\":\"2\",\"timestamp\":\"2023-04-16T00:00:00Z\"}"));
        release.countDown();

        // Then
        RecordOutcome timedOut = second.getOutcomes().get(0);
        assertThat(timedOut.getReason()).isEqualTo(RejectionReason.LOCK_TIMEOUT);
        assertThat(timedOut.getLastReachedStage()).isEqualTo(RecordStage.ENTITY_RESOLVED);
        assertThat(first.get(5, TimeUnit.SECONDS).committedCount()).isEqualTo(1);
    }

    @Test
    void shouldResolveEntityWithoutHoldingEntityLock() throws Exception {
        // Given: resolution of the first record is slower than the lock timeout
        CountDownLatch resolving = new CountDownLatch(1);
        when(entityResolver.resolve(eq(ENTITY_ID), anyMap())).thenAnswer(invocation -> {
            resolving.countDown();
            Thread.sleep(600);
            return new EntityMetadata(ENTITY_ID, 1L, EntityMetadata.Origin.API_CREATED);
        });
        CompletableFuture<DispatchReport> first = CompletableFuture.supplyAsync(() -> dispatcher.dispatch(TOPIC,
                bytes("{\"state\":\"1\",\"timestamp\":\"2023-04-15T00:00:00Z\"}")));
        assertThat(resolving.await(5, TimeUnit.SECONDS)).isTrue();

        // When
        DispatchReport second = dispatcher.dispatch(TOPIC,
                bytes("{\"state\":\"2\",\"timestamp\":\"2023-04-16T00:00:00Z\"}"));

        // Then
        assertThat(second.committedCount()).isEqualTo(1);
        assertThat(first.get(5, TimeUnit.SECONDS).committedCount()).isEqualTo(1);
    }

    @Test
    void shouldPropagateFatalSchemaMismatch() {
        // Given
        when(historyWriter.write(anyLong(), anyLong(), anyString(), any()))
                .thenThrow(new FatalSchemaMismatchException("no such table: states"));

        // When / Then
        assertThatThrownBy(() -> dispatcher.dispatch(TOPIC,
                bytes("{\"state\":\"1\",\"timestamp\":\"2023-04-15T00:00:00Z\"}")))
                .isInstanceOf(FatalSchemaMismatchException.class);
        verify(rejectionPublisher, never()).publish(any());
    }

    private static byte[] bytes(String text) {
        return text.getBytes(StandardCharsets.UTF_8);
    }
}
