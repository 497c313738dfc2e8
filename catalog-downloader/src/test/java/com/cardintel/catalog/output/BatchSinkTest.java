package com.cardintel.catalog.output;

import com.cardintel.catalog.config.CatalogDownloaderProperties;
import com.cardintel.catalog.model.CatalogItemRecord;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.IntStream;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.Mockito.doAnswer;
import static org.mockito.Mockito.doNothing;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;

@ExtendWith(MockitoExtension.class)
class BatchSinkTest {

    @Mock
    private OutputRouter outputRouter;

    private CatalogDownloaderProperties properties;
    private BatchSink sink;
    private final List<Integer> flushedSizes = new ArrayList<>();
    private int pushes;

    @BeforeEach
    void setUp() {
        properties = new CatalogDownloaderProperties();
        properties.getSink().setBatchSize(100);
        properties.getSink().setFlushBackoff(Duration.ofMillis(1));
        sink = new BatchSink(outputRouter, properties);
    }

    @Test
    void flushesFullBatchesAndDrainsTheRemainderOnShutdown() {
        recordFlushSizes();

        push(90);
        assertEquals(List.of(), flushedSizes);

        push(90);
        push(70);
        assertEquals(List.of(100, 100), flushedSizes);
        assertEquals(50, sink.buffered());

        sink.drainOnShutdown();

        assertEquals(List.of(100, 100, 50), flushedSizes);
        assertEquals(0, sink.buffered());
        assertEquals(250, sink.flushedRecords());
        assertEquals(3, sink.flushCount());
    }

    @Test
    void byteBoundCutsBatchesBeforeTheRecordCountDoes() {
        // records without text fields estimate at 128 bytes each
        properties.getSink().setMaxBatchBytes(400);
        recordFlushSizes();

        push(5);
        assertEquals(List.of(3), flushedSizes);

        sink.flush();
        assertEquals(List.of(3, 2), flushedSizes);
    }

    @Test
    void transientWarehouseFailureIsRetried() {
        doThrow(new IllegalStateException("connection reset"))
                .doNothing()
                .when(outputRouter).write(anyList());

        push(100);

        verify(outputRouter, times(2)).write(anyList());
        verify(outputRouter, never()).writeBackup(anyList());
        assertEquals(0, sink.buffered());
        assertEquals(100, sink.flushedRecords());
    }

    @Test
    void exhaustedRetriesSaveABackupAndFailTheRun() {
        doThrow(new IllegalStateException("ClickHouse down")).when(outputRouter).write(anyList());
        doNothing().when(outputRouter).writeBackup(anyList());

        assertThrows(SinkFlushException.class, () -> push(120));

        verify(outputRouter, times(3)).write(anyList());
        verify(outputRouter).writeBackup(anyList());
        assertEquals(20, sink.buffered());
        assertEquals(0, sink.flushedRecords());
    }

    @Test
    void recordsStayBufferedWhenTheBackupAlsoFails() {
        doThrow(new IllegalStateException("ClickHouse down")).when(outputRouter).write(anyList());
        doThrow(new IllegalStateException("disk full")).when(outputRouter).writeBackup(anyList());

        assertThrows(SinkFlushException.class, () -> push(100));

        assertEquals(100, sink.buffered());
    }

    @Test
    void ownerIsReportedDeliveredOnlyOnceItsLastRecordIsFlushed() {
        recordFlushSizes();
        List<String> delivered = new ArrayList<>();

        sink.push("3:604", records(60), () -> delivered.add("3:604"));
        sink.push("3:635", records(60), () -> delivered.add("3:635"));

        assertEquals(List.of(100), flushedSizes);
        assertEquals(List.of("3:604"), delivered);

        sink.drainOnShutdown();

        assertEquals(List.of("3:604", "3:635"), delivered);
    }

    @Test
    void emptyPushIsDeliveredStraightAway() {
        List<String> delivered = new ArrayList<>();

        sink.push("3:604", List.of(), () -> delivered.add("3:604"));

        assertEquals(List.of("3:604"), delivered);
        verifyNoInteractions(outputRouter);
    }

    @Test
    void backedUpRecordsCountAsDelivered() {
        doThrow(new IllegalStateException("ClickHouse down")).when(outputRouter).write(anyList());
        List<String> delivered = new ArrayList<>();

        sink.push("3:604", records(30), () -> delivered.add("3:604"));
        assertThrows(SinkFlushException.class, sink::drainOnShutdown);

        verify(outputRouter).writeBackup(anyList());
        assertEquals(List.of("3:604"), delivered);
    }

    @Test
    void undeliverableRecordsAreHandedBackByOwner() {
        properties.getSink().setBackupOnFailure(false);
        doThrow(new IllegalStateException("ClickHouse down")).when(outputRouter).write(anyList());
        List<String> delivered = new ArrayList<>();

        sink.push("3:604", records(30), () -> delivered.add("3:604"));
        sink.push("3:635", records(20), () -> delivered.add("3:635"));
        assertThrows(SinkFlushException.class, sink::drainOnShutdown);

        assertEquals(50, sink.buffered());
        assertEquals(List.of("3:604", "3:635"), sink.abandonUndelivered());
        assertEquals(0, sink.buffered());
        assertEquals(List.of(), delivered);
        verify(outputRouter, never()).writeBackup(anyList());
    }

    @Test
    void drainingAnEmptySinkDoesNothing() {
        sink.drainOnShutdown();

        verifyNoInteractions(outputRouter);
    }

    private void recordFlushSizes() {
        doAnswer(invocation -> {
            List<?> batch = invocation.getArgument(0);
            flushedSizes.add(batch.size());
            return null;
        }).when(outputRouter).write(anyList());
    }

    private void push(int count) {
        sink.push("3:" + (600 + pushes++), records(count), () -> { });
    }

    private static List<CatalogItemRecord> records(int count) {
        return IntStream.range(0, count)
                .mapToObj(i -> CatalogItemRecord.builder()
                        .categoryId(3)
                        .groupId(604)
                        .productId((long) i)
                        .build())
                .toList();
    }
}
