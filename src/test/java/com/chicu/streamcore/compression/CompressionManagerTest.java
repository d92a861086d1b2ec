package com.chicu.streamcore.compression;

import com.chicu.streamcore.audit.AuditEventEntity;
import com.chicu.streamcore.audit.AuditEventType;
import com.chicu.streamcore.config.StreamCoreProperties;
import com.chicu.streamcore.orders.OrderRecordEntity;
import com.chicu.streamcore.orders.OrderStatus;
import com.chicu.streamcore.support.ManualStreamScheduler;
import com.chicu.streamcore.support.MutableClock;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.data.domain.Pageable;

import java.math.BigDecimal;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class CompressionManagerTest {

    private static final Instant NOW = Instant.parse("2024-05-20T03:00:00Z");

    @Mock private CompressionRecordRepository recordRepository;
    @Mock private CompressionRunRepository runRepository;

    private final ObjectMapper mapper = new ObjectMapper().findAndRegisterModules();
    private final MutableClock clock = new MutableClock(NOW);
    private final ManualStreamScheduler scheduler = new ManualStreamScheduler(clock);

    private StreamCoreProperties props;
    private CompressionManager manager;

    @BeforeEach
    void setUp() {
        props = new StreamCoreProperties();
        props.getCompression().setBatchSize(50);
        manager = new CompressionManager(recordRepository, runRepository, mapper, clock, scheduler, props);
    }

    private static AuditEventEntity event(String id, Instant ts) {
        return AuditEventEntity.builder()
                .id(id)
                .aggregateId("wallet:abc")
                .eventType(AuditEventType.ORDER_PLACED)
                .payload("{\"orderId\":\"o1\",\"side\":\"BUY\",\"symbol\":\"SOL\",\"quantity\":2}")
                .sequence(1L)
                .timestamp(ts)
                .build();
    }

    @Test
    void compressOldEvents_shouldStoreCompressedCopy_andLogRun() throws Exception {
        AuditEventEntity old = event("e-1", NOW.minus(Duration.ofDays(10)));
        when(recordRepository.findUncompressedEvents(eq(NOW.minus(Duration.ofDays(7))), any(Pageable.class)))
                .thenReturn(List.of(old));

        int n = manager.compressOldEvents();

        assertEquals(1, n);
        ArgumentCaptor<CompressionRecordEntity> saved = ArgumentCaptor.forClass(CompressionRecordEntity.class);
        verify(recordRepository).save(saved.capture());
        CompressionRecordEntity rec = saved.getValue();
        assertEquals("e-1", rec.getRecordId());
        assertEquals(CompressedRecordType.EVENT, rec.getRecordType());
        assertEquals(CompressionAlgorithm.DEFLATE, rec.getAlgorithm());
        assertEquals(old.getTimestamp(), rec.getOriginalTimestamp());
        assertEquals(rec.getData().length, rec.getCompressedSize());

        JsonNode restored = mapper.readTree(CompressionAlgorithm.DEFLATE.decompress(rec.getData()));
        assertEquals("order_placed", restored.get("eventType").asText());
        assertEquals(rec.getOriginalSize(), (long) mapper.writeValueAsBytes(restored).length);

        ArgumentCaptor<CompressionRunEntity> run = ArgumentCaptor.forClass(CompressionRunEntity.class);
        verify(runRepository).save(run.capture());
        assertEquals(1, run.getValue().getRecordsCompressed());
        assertNull(run.getValue().getErrorMessage());
    }

    @Test
    void compressOldEvents_withNothingToDo_shouldNotLogRun() {
        when(recordRepository.findUncompressedEvents(any(), any())).thenReturn(List.of());

        assertEquals(0, manager.compressOldEvents());

        verify(recordRepository, never()).save(any());
        verifyNoInteractions(runRepository);
    }

    @Test
    void failedSave_shouldStopBatch_andRecordError() {
        when(recordRepository.findUncompressedEvents(any(), any()))
                .thenReturn(List.of(event("e-1", NOW.minus(Duration.ofDays(9))), event("e-2", NOW.minus(Duration.ofDays(8)))));
        when(recordRepository.save(any(CompressionRecordEntity.class)))
                .thenThrow(new DataAccessResourceFailureException("disk full"));

        assertEquals(0, manager.compressOldEvents());

        verify(recordRepository, times(1)).save(any(CompressionRecordEntity.class));
        ArgumentCaptor<CompressionRunEntity> run = ArgumentCaptor.forClass(CompressionRunEntity.class);
        verify(runRepository).save(run.capture());
        assertNotNull(run.getValue().getErrorMessage());
    }

    @Test
    void compressOldTrades_shouldAskOnlyForClosedOrders() {
        OrderRecordEntity order = OrderRecordEntity.builder()
                .id("ord-1")
                .symbol("SOL")
                .side("BUY")
                .status(OrderStatus.FILLED)
                .quantity(new BigDecimal("2"))
                .createdAt(NOW.minus(Duration.ofDays(40)))
                .build();
        when(recordRepository.findUncompressedClosedOrders(eq(OrderStatus.CLOSED), eq(NOW.minus(Duration.ofDays(30))), any()))
                .thenReturn(List.of(order));

        assertEquals(1, manager.compressOldTrades());

        verify(recordRepository).save(argThat(r -> r.getRecordType() == CompressedRecordType.TRADE
                && r.getRecordId().equals("ord-1")));
    }

    @Test
    void disabled_shouldSkipEverything() {
        manager.updateConfig(new CompressionConfig(false, false, 7, 30, CompressionAlgorithm.GZIP, 6));

        assertEquals(new CompressionManager.RunResult(0, 0), manager.runAll());

        verifyNoInteractions(recordRepository, runRepository);
    }

    @Test
    void decompress_shouldServeRepeatedReadsFromCache_untilTtl() throws Exception {
        byte[] original = "{\"id\":\"e-1\"}".getBytes();
        CompressionRecordEntity rec = CompressionRecordEntity.builder()
                .recordId("e-1")
                .recordType(CompressedRecordType.EVENT)
                .algorithm(CompressionAlgorithm.GZIP)
                .data(CompressionAlgorithm.GZIP.compress(original, 6))
                .build();
        CompressionRecordId id = new CompressionRecordId(CompressedRecordType.EVENT, "e-1");
        when(recordRepository.findById(id)).thenReturn(Optional.of(rec));

        assertArrayEquals(original, manager.decompress(CompressedRecordType.EVENT, "e-1").orElseThrow());
        assertArrayEquals(original, manager.decompress(CompressedRecordType.EVENT, "e-1").orElseThrow());
        verify(recordRepository, times(1)).findById(id);

        clock.advance(CompressionManager.DECOMPRESS_CACHE_TTL);
        manager.decompress(CompressedRecordType.EVENT, "e-1");
        verify(recordRepository, times(2)).findById(id);
    }

    @Test
    void decompress_shouldNotMixTypesWithSameId() throws Exception {
        byte[] event = "{\"kind\":\"event\"}".getBytes();
        byte[] trade = "{\"kind\":\"trade\"}".getBytes();
        when(recordRepository.findById(new CompressionRecordId(CompressedRecordType.EVENT, "x-1")))
                .thenReturn(Optional.of(CompressionRecordEntity.builder()
                        .recordId("x-1").recordType(CompressedRecordType.EVENT)
                        .algorithm(CompressionAlgorithm.DEFLATE)
                        .data(CompressionAlgorithm.DEFLATE.compress(event, 6))
                        .build()));
        when(recordRepository.findById(new CompressionRecordId(CompressedRecordType.TRADE, "x-1")))
                .thenReturn(Optional.of(CompressionRecordEntity.builder()
                        .recordId("x-1").recordType(CompressedRecordType.TRADE)
                        .algorithm(CompressionAlgorithm.DEFLATE)
                        .data(CompressionAlgorithm.DEFLATE.compress(trade, 6))
                        .build()));

        assertArrayEquals(event, manager.decompress(CompressedRecordType.EVENT, "x-1").orElseThrow());
        assertArrayEquals(trade, manager.decompress(CompressedRecordType.TRADE, "x-1").orElseThrow(),
                "кэш распаковки различает тип записи");
    }

    @Test
    void decompress_unknownRecord_shouldBeEmpty() {
        when(recordRepository.findById(new CompressionRecordId(CompressedRecordType.TRADE, "missing")))
                .thenReturn(Optional.empty());

        assertTrue(manager.decompress(CompressedRecordType.TRADE, "missing").isEmpty());
    }

    @Test
    void stats_shouldComputeRatio_andCacheFor30Seconds() {
        when(recordRepository.totals()).thenReturn(List.<Object[]>of(new Object[]{1000L, 250L, 4L}));
        when(runRepository.findFirstByOrderByRunAtDesc()).thenReturn(Optional.empty());

        CompressionStats stats = manager.stats();
        assertEquals(75.0, stats.compressionRatio(), 1e-9);
        assertEquals(4, stats.compressedRecords());
        assertNull(stats.lastRun());

        clock.advance(Duration.ofSeconds(10));
        manager.stats();
        verify(recordRepository, times(1)).totals();

        clock.advance(Duration.ofSeconds(25));
        manager.stats();
        verify(recordRepository, times(2)).totals();
    }

    @Test
    void updateConfig_shouldRejectInvalidLevel() {
        assertThrows(IllegalArgumentException.class,
                () -> manager.updateConfig(new CompressionConfig(true, true, 7, 30, CompressionAlgorithm.DEFLATE, 12)));
        assertThrows(IllegalArgumentException.class,
                () -> manager.updateConfig(new CompressionConfig(true, true, 0, 30, CompressionAlgorithm.DEFLATE, 3)));
    }

    @Test
    void start_shouldScheduleJob_onlyWhenAutoCompressEnabled() {
        manager.start();
        assertEquals(1, scheduler.pending("compression"));
        manager.stop();
        assertEquals(0, scheduler.pending("compression"));

        props.getCompression().setAutoCompress(false);
        CompressionManager manual = new CompressionManager(recordRepository, runRepository, mapper, clock, scheduler, props);
        manual.start();
        assertEquals(0, scheduler.pending("compression"));
    }
}
