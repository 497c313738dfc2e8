package com.cardintel.catalog.output;

import com.cardintel.catalog.config.CatalogDownloaderProperties;
import com.cardintel.catalog.model.CatalogItemRecord;
import io.github.resilience4j.core.IntervalFunction;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryConfig;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Buffers fetched records and delivers them to the warehouse in bounded batches.
 *
 * A batch is at most {@code sink.batch-size} records and at most {@code sink.max-batch-bytes}.
 * Once the buffer reaches either bound, {@link #push} flushes full batches synchronously
 * before returning; pushes are serialised, so every producer waits while a flush is in
 * flight and the buffer never grows past one push over the bound.
 *
 * Delivery is at-least-once: a batch is dropped from the buffer only after the warehouse
 * accepted it, or after it was saved to a CSV backup once retries ran out. Records are
 * pushed on behalf of an owner (a group key); the owner's callback runs once its last
 * buffered record has left the buffer that way, and not before.
 */
@Component
@Slf4j
public class BatchSink {

    private final OutputRouter outputRouter;
    private final CatalogDownloaderProperties properties;

    // guarded by this
    private final List<Buffered> buffer = new ArrayList<>();
    private final Map<String, Integer> outstanding = new LinkedHashMap<>();
    private final Map<String, Runnable> onDelivered = new HashMap<>();
    private long bufferedBytes;
    private long flushedRecords;
    private int flushCount;

    public BatchSink(OutputRouter outputRouter, CatalogDownloaderProperties properties) {
        this.outputRouter = outputRouter;
        this.properties = properties;
    }

    /**
     * Buffer the owner's records, flushing full batches first if a bound is reached.
     *
     * @param delivered runs once every record of this push has been delivered or backed
     *                  up; straight away when there are no records
     */
    public synchronized void push(String owner, List<CatalogItemRecord> records, Runnable delivered) {
        if (records.isEmpty()) {
            delivered.run();
            return;
        }
        for (CatalogItemRecord record : records) {
            buffer.add(new Buffered(owner, record));
            bufferedBytes += record.estimatedBytes();
        }
        outstanding.merge(owner, records.size(), Integer::sum);
        onDelivered.put(owner, delivered);
        while (isFull()) {
            flushBatch();
        }
    }

    /** Deliver everything buffered, in bounded batches. */
    public synchronized void flush() {
        while (!buffer.isEmpty()) {
            flushBatch();
        }
    }

    /** Called at the end of every run, including interrupted and failed ones. */
    public synchronized void drainOnShutdown() {
        if (buffer.isEmpty()) {
            return;
        }
        log.info("Draining {} buffered records...", buffer.size());
        flush();
    }

    /**
     * Drop whatever could be neither delivered nor backed up and hand back its owners,
     * whose callbacks will never run. Their data has to be fetched again.
     */
    public synchronized List<String> abandonUndelivered() {
        List<String> owners = new ArrayList<>(outstanding.keySet());
        if (!owners.isEmpty()) {
            log.warn("Abandoning {} undelivered records of {} groups", buffer.size(), owners.size());
        }
        buffer.clear();
        bufferedBytes = 0;
        outstanding.clear();
        onDelivered.clear();
        return owners;
    }

    public synchronized int buffered() {
        return buffer.size();
    }

    public synchronized long flushedRecords() {
        return flushedRecords;
    }

    public synchronized int flushCount() {
        return flushCount;
    }

    // ── Internal ─────────────────────────────────────────────────────────────

    private boolean isFull() {
        return buffer.size() >= settings().getBatchSize() || bufferedBytes >= settings().getMaxBatchBytes();
    }

    private void flushBatch() {
        int size = 0;
        long bytes = 0;
        while (size < buffer.size() && size < settings().getBatchSize()) {
            long next = buffer.get(size).record().estimatedBytes();
            if (size > 0 && bytes + next > settings().getMaxBatchBytes()) {
                break;
            }
            bytes += next;
            size++;
        }

        List<CatalogItemRecord> batch = new ArrayList<>(size);
        for (Buffered entry : buffer.subList(0, size)) {
            batch.add(entry.record());
        }
        try {
            deliver(batch);
        } catch (SinkFlushException e) {
            if (settings().isBackupOnFailure() && saveBackup(batch)) {
                discard(size, bytes).forEach(Runnable::run);
            }
            throw e;
        }
        List<Runnable> completed = discard(size, bytes);
        flushedRecords += size;
        flushCount++;
        completed.forEach(Runnable::run);
    }

    private void deliver(List<CatalogItemRecord> batch) {
        RetryConfig config = RetryConfig.custom()
                .maxAttempts(Math.max(1, settings().getMaxFlushAttempts()))
                .intervalFunction(IntervalFunction.ofExponentialBackoff(
                        settings().getFlushBackoff(), settings().getFlushBackoffMultiplier()))
                .retryExceptions(RuntimeException.class)
                .build();
        Retry retry = Retry.of("sinkFlush", config);
        retry.getEventPublisher().onRetry(event -> log.warn("Flush of {} records failed (attempt {}), retrying in {} ms: {}",
                batch.size(), event.getNumberOfRetryAttempts(), event.getWaitInterval().toMillis(),
                event.getLastThrowable() != null ? event.getLastThrowable().getMessage() : "unknown"));

        try {
            Retry.decorateRunnable(retry, () -> outputRouter.write(batch)).run();
        } catch (RuntimeException e) {
            log.error("Flush of {} records failed after {} attempts: {}",
                    batch.size(), config.getMaxAttempts(), e.getMessage(), e);
            throw new SinkFlushException("Warehouse flush failed for " + batch.size() + " records", e);
        }
    }

    private boolean saveBackup(List<CatalogItemRecord> batch) {
        try {
            outputRouter.writeBackup(batch);
            return true;
        } catch (RuntimeException e) {
            log.error("Backup of {} undelivered records failed, keeping them buffered: {}",
                    batch.size(), e.getMessage(), e);
            return false;
        }
    }

    /** Remove the first records and return the callbacks of owners left with nothing buffered. */
    private List<Runnable> discard(int size, long bytes) {
        List<Buffered> removed = buffer.subList(0, size);
        List<Runnable> completed = new ArrayList<>();
        for (Buffered entry : removed) {
            int left = outstanding.merge(entry.owner(), -1, Integer::sum);
            if (left == 0) {
                outstanding.remove(entry.owner());
                completed.add(onDelivered.remove(entry.owner()));
            }
        }
        removed.clear();
        bufferedBytes = buffer.isEmpty() ? 0 : Math.max(0, bufferedBytes - bytes);
        return completed;
    }

    private CatalogDownloaderProperties.Sink settings() {
        return properties.getSink();
    }

    private record Buffered(String owner, CatalogItemRecord record) {
    }
}
