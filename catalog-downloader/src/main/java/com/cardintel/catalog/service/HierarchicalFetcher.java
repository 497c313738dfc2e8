package com.cardintel.catalog.service;

import com.cardintel.catalog.checkpoint.CheckpointPartition;
import com.cardintel.catalog.checkpoint.CheckpointStore;
import com.cardintel.catalog.config.CatalogDownloaderProperties;
import com.cardintel.catalog.model.CatalogItemRecord;
import com.cardintel.catalog.model.FetchOptions;
import com.cardintel.catalog.model.FetchSummary;
import com.cardintel.catalog.model.HierarchyNode;
import com.cardintel.catalog.model.NodeState;
import com.cardintel.catalog.model.RequestOutcome;
import com.cardintel.catalog.model.api.TcgCategory;
import com.cardintel.catalog.model.api.TcgGroup;
import com.cardintel.catalog.output.BatchSink;
import com.cardintel.catalog.proxy.ProxyPool;
import com.fasterxml.jackson.databind.JsonNode;
import jakarta.annotation.PreDestroy;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Walks category → group → items and drives every node through its checkpoint states.
 *
 * Each request waits for a rate permit, goes out through the route the proxy pool
 * selects, and its classified outcome is reported back to both. Completed nodes are
 * never requested again. A group is marked completed from the batch sink's delivery
 * callback, once its last record reached the warehouse (or a backup file); a category
 * whose groups are all fetched completes when the last of them is delivered.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class HierarchicalFetcher {

    private final CatalogApiClient apiClient;
    private final ItemRecordMapper itemMapper;
    private final RateGovernor rateGovernor;
    private final ProxyPool proxyPool;
    private final CheckpointStore checkpointStore;
    private final BatchSink batchSink;
    private final CatalogDownloaderProperties properties;

    private final AtomicBoolean stopRequested = new AtomicBoolean();
    private volatile CountDownLatch activeRun;

    /**
     * Fetch every pending node under the given categories, in order.
     *
     * The checkpoint must already be loaded. Fatal errors (checkpoint or sink) propagate
     * after the sink has been drained; node-level errors are recorded and counted.
     */
    public FetchSummary run(List<HierarchyNode> roots, FetchOptions options) {
        CountDownLatch done = new CountDownLatch(1);
        activeRun = done;

        RunCounters counters = new RunCounters();
        int concurrency = Math.max(1, options.getConcurrency());
        ExecutorService workers = concurrency > 1 ? newWorkerPool(concurrency) : null;

        log.info("Fetching {} categories (concurrency {}, retryFailed {}, onlyFailed {})",
                roots.size(), concurrency, options.isRetryFailed(), options.isOnlyFailed());

        boolean interrupted = false;
        boolean threadInterrupted = false;
        RuntimeException fatal = null;
        try {
            refreshProxyHealthIfNeeded();
            for (HierarchyNode category : roots) {
                if (stopRequested.get()) {
                    interrupted = true;
                    break;
                }
                processCategory(category, options, counters, workers);
            }
        } catch (InterruptedException e) {
            interrupted = true;
            threadInterrupted = !stopRequested.get();
            log.warn("Run interrupted: {}", e.getMessage());
        } catch (RuntimeException e) {
            fatal = e;
        } finally {
            if (workers != null) {
                workers.shutdownNow();
            }
            try {
                batchSink.drainOnShutdown();
            } catch (RuntimeException e) {
                if (fatal != null) {
                    fatal.addSuppressed(e);
                } else {
                    fatal = e;
                }
                try {
                    reopenUndelivered();
                } catch (RuntimeException reopenFailure) {
                    fatal.addSuppressed(reopenFailure);
                }
            }
            activeRun = null;
            stopRequested.set(false);
            done.countDown();
        }

        if (fatal != null) {
            log.error("Run aborted after {} requests: {}", counters.requests.get(), fatal.getMessage(), fatal);
            throw fatal;
        }

        FetchSummary summary = summarize(counters, interrupted);
        logSummary(summary);
        if (threadInterrupted) {
            Thread.currentThread().interrupt();
        }
        return summary;
    }

    /**
     * The root category listing, requested under the same pacing, routing and retry
     * rules as every node.
     *
     * @throws IllegalStateException if the listing could not be fetched
     */
    public List<HierarchyNode> listCategories() throws InterruptedException {
        refreshProxyHealthIfNeeded();
        NodeResult<List<TcgCategory>> result = fetchNode("category listing", apiClient::fetchCategories, new RunCounters());
        if (result.state() != NodeState.COMPLETED) {
            throw new IllegalStateException("Category listing unavailable: " + result.error());
        }
        List<HierarchyNode> categories = new ArrayList<>(result.value().size());
        for (TcgCategory category : result.value()) {
            categories.add(HierarchyNode.category(String.valueOf(category.getCategoryId()), category.getName()));
        }
        log.info("Catalog lists {} categories", categories.size());
        return categories;
    }

    /** Ask the running traversal to stop at its next pacing or request boundary. */
    public void requestStop() {
        if (!stopRequested.getAndSet(true)) {
            log.info("Stop requested, finishing in-flight node...");
        }
    }

    @PreDestroy
    public void shutdown() throws InterruptedException {
        CountDownLatch running = activeRun;
        if (running == null) {
            return;
        }
        requestStop();
        long graceMs = properties.getFetch().getShutdownGrace().toMillis();
        if (!running.await(graceMs, TimeUnit.MILLISECONDS)) {
            log.warn("Run did not stop within {} ms", graceMs);
        }
    }

    // ── Traversal ────────────────────────────────────────────────────────────

    private void processCategory(HierarchyNode category, FetchOptions options,
                                 RunCounters counters, ExecutorService workers) throws InterruptedException {
        String key = category.key();
        checkpointStore.register(category);

        NodeState state = checkpointStore.stateOf(key);
        if (state == NodeState.COMPLETED) {
            log.info("Skipping {}: already completed", category);
            counters.skipped.incrementAndGet();
            return;
        }
        if (state == NodeState.FAILED) {
            if (!options.isRetryFailed()) {
                log.info("Skipping {}: failed in a previous run", category);
                counters.skipped.incrementAndGet();
                return;
            }
            checkpointStore.mark(key, NodeState.PENDING);
        } else if (options.isOnlyFailed() && !checkpointStore.hasFailedChildren(key)) {
            log.debug("Skipping {}: nothing failed under it", category);
            counters.skipped.incrementAndGet();
            return;
        }
        if (!checkpointStore.claim(key)) {
            log.warn("Skipping {}: could not claim it (state {})", category, checkpointStore.stateOf(key));
            counters.skipped.incrementAndGet();
            return;
        }

        log.info("Processing {}", category);
        NodeResult<List<TcgGroup>> result;
        try {
            result = fetchNode(category, route -> apiClient.fetchGroups(route, category.externalId()), counters);
        } catch (InterruptedException e) {
            checkpointStore.mark(key, NodeState.PENDING);
            throw e;
        }
        if (result.state() != NodeState.COMPLETED) {
            settleUnfinished(category, result, counters);
            return;
        }

        List<HierarchyNode> groups = new ArrayList<>(result.value().size());
        for (TcgGroup group : result.value()) {
            groups.add(HierarchyNode.group(category, String.valueOf(group.getGroupId()), group.getName()));
        }
        checkpointStore.registerAll(groups);

        // a category that failed before listing its groups has only fresh groups to retry
        boolean onlyFailedGroups = options.isOnlyFailed() && state != NodeState.FAILED;
        Set<String> todo = new HashSet<>(onlyFailedGroups
                ? checkpointStore.failedNodes(key)
                : checkpointStore.pendingNodes(key, options.isRetryFailed()));
        List<HierarchyNode> work = groups.stream().filter(g -> todo.contains(g.key())).toList();
        int skippedGroups = groups.size() - work.size();
        counters.skipped.addAndGet(skippedGroups);
        log.info("{}: {} groups, {} to fetch, {} skipped", category, groups.size(), work.size(), skippedGroups);

        for (HierarchyNode group : work) {
            if (checkpointStore.isFailed(group.key())) {
                checkpointStore.mark(group.key(), NodeState.PENDING);
            }
        }

        try {
            if (workers == null) {
                for (HierarchyNode group : work) {
                    processGroup(category, group, counters);
                }
            } else {
                runConcurrently(category, work, counters, workers);
            }
        } catch (InterruptedException e) {
            checkpointStore.mark(key, NodeState.PENDING);
            throw e;
        }

        boolean allFetched = groups.stream()
                .allMatch(g -> checkpointStore.isCompleted(g.key()) || counters.isUndelivered(g.key()));
        if (!allFetched) {
            checkpointStore.mark(key, NodeState.PENDING);
            log.warn("{} left open: not every group completed", category);
            return;
        }
        List<String> groupKeys = groups.stream().map(HierarchyNode::key).toList();
        if (counters.awaitDelivery(key, groupKeys)) {
            checkpointStore.mark(key, NodeState.PENDING);
            log.info("{}: every group fetched, completing once their records are delivered", category);
        } else {
            completeCategory(category, counters);
        }
    }

    private void processGroup(HierarchyNode category, HierarchyNode group,
                              RunCounters counters) throws InterruptedException {
        String key = group.key();
        if (!checkpointStore.claim(key)) {
            log.debug("Skipping {}: already claimed or settled", group);
            counters.skipped.incrementAndGet();
            return;
        }

        String endpoint = apiClient.itemEndpointPath(category.externalId(), group.externalId());
        NodeResult<List<CatalogItemRecord>> result;
        try {
            result = fetchNode(group, route -> toRecords(category, group, endpoint,
                    apiClient.fetchItems(route, category.externalId(), group.externalId())), counters);
        } catch (InterruptedException e) {
            checkpointStore.mark(key, NodeState.PENDING);
            throw e;
        }
        if (result.state() != NodeState.COMPLETED) {
            settleUnfinished(group, result, counters);
            return;
        }

        List<CatalogItemRecord> records = result.value();
        counters.fetched(key);
        log.debug("Fetched {}: {} records handed to the sink", group, records.size());
        batchSink.push(key, records, () -> groupDelivered(category, group, records.size(), counters));
    }

    /** Maps inside the request loop so a schema mismatch fails the group like any client error. */
    private List<CatalogItemRecord> toRecords(HierarchyNode category, HierarchyNode group,
                                              String endpoint, List<JsonNode> items) {
        List<CatalogItemRecord> records = new ArrayList<>(items.size());
        for (JsonNode item : items) {
            records.add(itemMapper.map(group, category.name(), item, endpoint));
        }
        return records;
    }

    private void groupDelivered(HierarchyNode category, HierarchyNode group,
                                int recordCount, RunCounters counters) {
        checkpointStore.mark(group.key(), NodeState.COMPLETED);
        checkpointStore.addRecords(recordCount);
        counters.processed.incrementAndGet();
        counters.records.addAndGet(recordCount);
        log.info("Completed {}: {} records", group, recordCount);
        if (counters.delivered(category.key(), group.key())) {
            completeCategory(category, counters);
        }
    }

    private void completeCategory(HierarchyNode category, RunCounters counters) {
        checkpointStore.mark(category.key(), NodeState.COMPLETED);
        counters.processed.incrementAndGet();
        log.info("Completed {}", category);
    }

    /** Groups whose records were dropped undelivered go back to pending for the next run. */
    private void reopenUndelivered() {
        List<String> undelivered = batchSink.abandonUndelivered();
        for (String key : undelivered) {
            checkpointStore.recordError(key, "Records not delivered to the warehouse");
            checkpointStore.mark(key, NodeState.PENDING);
        }
        if (!undelivered.isEmpty()) {
            log.warn("{} groups returned to pending after a failed drain: {}", undelivered.size(), undelivered);
        }
    }

    private void runConcurrently(HierarchyNode category, List<HierarchyNode> groups,
                                 RunCounters counters, ExecutorService workers) throws InterruptedException {
        List<Future<Void>> futures = new ArrayList<>(groups.size());
        for (HierarchyNode group : groups) {
            futures.add(workers.submit(() -> {
                processGroup(category, group, counters);
                return null;
            }));
        }

        RuntimeException fatal = null;
        boolean stopped = false;
        for (Future<Void> future : futures) {
            try {
                future.get();
            } catch (ExecutionException e) {
                Throwable cause = e.getCause();
                if (cause instanceof InterruptedException) {
                    stopped = true;
                } else if (cause instanceof RuntimeException re) {
                    if (fatal == null) {
                        fatal = re;
                        stopRequested.set(true);
                    } else {
                        fatal.addSuppressed(re);
                    }
                } else if (cause instanceof Error err) {
                    throw err;
                }
            } catch (CancellationException e) {
                stopped = true;
            } catch (InterruptedException e) {
                stopRequested.set(true);
                futures.forEach(f -> f.cancel(true));
                throw e;
            }
        }
        if (fatal != null) {
            throw fatal;
        }
        if (stopped) {
            throw new InterruptedException("Group workers stopped");
        }
    }

    // ── Per-node request loop ────────────────────────────────────────────────

    /**
     * Request one node until it succeeds or its retry allowance is used up.
     * Rate-limited and server-side failures end as PENDING so a later run picks them up;
     * client errors and exhausted transport failures end as FAILED.
     */
    private <T> NodeResult<T> fetchNode(Object node, NodeRequest<T> request,
                                        RunCounters counters) throws InterruptedException {
        CatalogDownloaderProperties.Fetch fetch = properties.getFetch();
        int attempts = 0;
        int throttled = 0;

        while (true) {
            checkStop();
            rateGovernor.awaitPermit();
            checkStop();

            String route = proxyPool.selectRoute();
            counters.requests.incrementAndGet();
            try {
                T value = request.execute(route);
                proxyPool.report(route, RequestOutcome.OK);
                rateGovernor.recordOutcome(RequestOutcome.OK);
                return NodeResult.completed(value);
            } catch (UpstreamRequestException e) {
                RequestOutcome outcome = e.getOutcome();
                proxyPool.report(route, outcome);
                rateGovernor.recordOutcome(outcome);

                if (outcome == RequestOutcome.CLIENT_ERROR) {
                    log.error("{} failed: {}", node, e.getMessage());
                    return NodeResult.of(NodeState.FAILED, e.getMessage());
                }
                if (outcome == RequestOutcome.RATE_LIMITED) {
                    throttled++;
                    int failAfter = fetch.getThrottledAttemptsBeforeFailed();
                    if (failAfter > 0 && throttled >= failAfter) {
                        log.error("{} still rate limited after {} attempts, marking failed", node, throttled);
                        return NodeResult.of(NodeState.FAILED, e.getMessage());
                    }
                    if (throttled >= fetch.getMaxThrottledAttempts()) {
                        log.warn("{} still rate limited after {} attempts, leaving it for the next run", node, throttled);
                        return NodeResult.of(NodeState.PENDING, e.getMessage());
                    }
                } else {
                    attempts++;
                    if (attempts >= fetch.getMaxAttempts()) {
                        if (e.isTransport()) {
                            log.error("{} unreachable after {} attempts: {}", node, attempts, e.getMessage());
                            return NodeResult.of(NodeState.FAILED, e.getMessage());
                        }
                        log.warn("{} server error after {} attempts, leaving it for the next run", node, attempts);
                        return NodeResult.of(NodeState.PENDING, e.getMessage());
                    }
                }
                log.info("Retrying {} after {} (throttled {}, errors {})", node, outcome, throttled, attempts);
                if (node instanceof HierarchyNode tracked) {
                    checkpointStore.recordError(tracked.key(), "Retrying after " + e.getMessage());
                }
            }
        }
    }

    private void settleUnfinished(HierarchyNode node, NodeResult<?> result, RunCounters counters) {
        checkpointStore.recordError(node.key(), result.error());
        checkpointStore.mark(node.key(), result.state());
        if (result.state() == NodeState.FAILED) {
            counters.failed.incrementAndGet();
        } else {
            counters.pending.incrementAndGet();
        }
    }

    private void checkStop() throws InterruptedException {
        if (stopRequested.get()) {
            throw new InterruptedException("Stop requested");
        }
        if (Thread.currentThread().isInterrupted()) {
            throw new InterruptedException("Thread interrupted");
        }
    }

    private void refreshProxyHealthIfNeeded() {
        if (proxyPool.hasCandidates() && !proxyPool.hasEligibleRoute()) {
            log.info("No proxy route has a fresh passing health check, probing before the run");
            proxyPool.healthCheckAll();
        }
    }

    private ExecutorService newWorkerPool(int concurrency) {
        AtomicInteger threadIndex = new AtomicInteger();
        return Executors.newFixedThreadPool(concurrency, r -> {
            Thread thread = new Thread(r, "group-fetcher-" + threadIndex.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        });
    }

    // ── Summary ──────────────────────────────────────────────────────────────

    private FetchSummary summarize(RunCounters counters, boolean interrupted) {
        CheckpointPartition partition = checkpointStore.partition();
        return FetchSummary.builder()
                .processed(counters.processed.get())
                .skipped(counters.skipped.get())
                .failed(counters.failed.get())
                .pending(counters.pending.get())
                .totalRecords(counters.records.get())
                .requests(counters.requests.get())
                .interrupted(interrupted)
                .checkpointCompleted(partition.completed())
                .checkpointPending(partition.pending() + partition.inProgress())
                .checkpointFailed(partition.failed())
                .build();
    }

    private void logSummary(FetchSummary summary) {
        log.info("Run {}: {} processed, {} skipped, {} failed, {} pending, {} records, {} requests",
                summary.isInterrupted() ? "interrupted" : "finished",
                summary.getProcessed(), summary.getSkipped(), summary.getFailed(), summary.getPending(),
                summary.getTotalRecords(), summary.getRequests());
        log.info("Checkpoint: {} completed, {} pending, {} failed; {}",
                summary.getCheckpointCompleted(), summary.getCheckpointPending(), summary.getCheckpointFailed(),
                summary.isResumable() ? "resume to continue" : "nothing left to resume");
    }

    // ── Types ────────────────────────────────────────────────────────────────

    @FunctionalInterface
    private interface NodeRequest<T> {
        T execute(String route);
    }

    private record NodeResult<T>(NodeState state, T value, String error) {

        static <T> NodeResult<T> completed(T value) {
            return new NodeResult<>(NodeState.COMPLETED, value, null);
        }

        static <T> NodeResult<T> of(NodeState state, String error) {
            return new NodeResult<>(state, null, error);
        }
    }

    private static final class RunCounters {
        final AtomicInteger processed = new AtomicInteger();
        final AtomicInteger skipped = new AtomicInteger();
        final AtomicInteger failed = new AtomicInteger();
        final AtomicInteger pending = new AtomicInteger();
        final AtomicLong records = new AtomicLong();
        final AtomicLong requests = new AtomicLong();

        // groups fetched but not yet delivered, and the categories waiting on them; guarded by this
        private final Set<String> undelivered = new HashSet<>();
        private final Map<String, Set<String>> categoryWaits = new HashMap<>();

        synchronized void fetched(String groupKey) {
            undelivered.add(groupKey);
        }

        synchronized boolean isUndelivered(String groupKey) {
            return undelivered.contains(groupKey);
        }

        /**
         * Park a category until its undelivered groups are through.
         *
         * @return false when none of the groups is still waiting for delivery
         */
        synchronized boolean awaitDelivery(String categoryKey, List<String> groupKeys) {
            Set<String> waiting = new HashSet<>(groupKeys);
            waiting.retainAll(undelivered);
            if (waiting.isEmpty()) {
                return false;
            }
            categoryWaits.put(categoryKey, waiting);
            return true;
        }

        /** @return true when this was the last group the category was waiting for */
        synchronized boolean delivered(String categoryKey, String groupKey) {
            undelivered.remove(groupKey);
            Set<String> waiting = categoryWaits.get(categoryKey);
            if (waiting == null || !waiting.remove(groupKey) || !waiting.isEmpty()) {
                return false;
            }
            categoryWaits.remove(categoryKey);
            return true;
        }
    }
}
