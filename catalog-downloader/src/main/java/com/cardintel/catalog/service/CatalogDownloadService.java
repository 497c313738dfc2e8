package com.cardintel.catalog.service;

import com.cardintel.catalog.checkpoint.CheckpointPartition;
import com.cardintel.catalog.checkpoint.CheckpointStore;
import com.cardintel.catalog.config.CatalogDownloaderProperties;
import com.cardintel.catalog.model.DownloadRun;
import com.cardintel.catalog.model.FetchOptions;
import com.cardintel.catalog.model.FetchSummary;
import com.cardintel.catalog.model.HierarchyNode;
import com.cardintel.catalog.model.ProxyRecord;
import com.cardintel.catalog.model.RateState;
import com.cardintel.catalog.model.RunMode;
import com.cardintel.catalog.output.OutputRouter;
import com.cardintel.catalog.proxy.ProxyPool;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.LocalDateTime;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.UUID;
import java.util.stream.Collectors;

/**
 * Orchestrates one download run.
 *
 *   FRESH         discard the checkpoint (kept as .bak) and walk the whole catalog
 *   RESUME        continue from the checkpoint, skipping completed nodes
 *   RETRY_FAILED  only categories and groups that failed before
 *   CATEGORY      resume restricted to the given category ids, failed nodes included
 *
 * Every run ends with a row in the download run log, whatever its outcome.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class CatalogDownloadService {

    public static final String STATUS_RUNNING = "RUNNING";
    public static final String STATUS_SUCCESS = "SUCCESS";
    public static final String STATUS_PARTIAL = "PARTIAL";
    public static final String STATUS_FAILED = "FAILED";
    public static final String STATUS_INTERRUPTED = "INTERRUPTED";

    private final HierarchicalFetcher fetcher;
    private final CheckpointStore checkpointStore;
    private final OutputRouter outputRouter;
    private final ProxyPool proxyPool;
    private final RateGovernor rateGovernor;
    private final CatalogDownloaderProperties properties;

    public DownloadRun run(RunMode mode, List<String> categoryIds) {
        if (mode == RunMode.STATUS) {
            throw new IllegalArgumentException("STATUS does not download, use status()");
        }
        if (mode == RunMode.CATEGORY && categoryIds.isEmpty()) {
            throw new IllegalArgumentException("CATEGORY mode needs at least one category id");
        }

        DownloadRun run = DownloadRun.builder()
                .runId(UUID.randomUUID().toString())
                .mode(mode.name())
                .categories(categoryIds.isEmpty() ? null : String.join(",", categoryIds))
                .startedAt(LocalDateTime.now())
                .status(STATUS_RUNNING)
                .build();
        log.info("Starting {} download run {}", mode, run.getRunId());

        try {
            if (mode == RunMode.FRESH) {
                checkpointStore.reset();
            } else {
                checkpointStore.load();
            }
            outputRouter.prepare();

            List<HierarchyNode> roots = selectRoots(mode, fetcher.listCategories(), categoryIds);
            FetchSummary summary = fetcher.run(roots, optionsFor(mode));

            run.setNodesProcessed(summary.getProcessed());
            run.setNodesSkipped(summary.getSkipped());
            run.setNodesFailed(summary.getFailed());
            run.setNodesPending(summary.getPending());
            run.setRecordsWritten(summary.getTotalRecords());
            if (summary.isInterrupted()) {
                run.setStatus(STATUS_INTERRUPTED);
            } else if (summary.hasUnresolvedFailures()) {
                run.setStatus(STATUS_PARTIAL);
            } else {
                run.setStatus(STATUS_SUCCESS);
            }

        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Download run {} interrupted before traversal finished", run.getRunId());
            run.setStatus(STATUS_INTERRUPTED);
        } catch (RuntimeException e) {
            log.error("Download run {} failed: {}", run.getRunId(), e.getMessage(), e);
            run.setStatus(STATUS_FAILED);
            run.setErrorMessage(e.getMessage());
        } finally {
            run.setCompletedAt(LocalDateTime.now());
            outputRouter.writeDownloadRun(run);
        }

        log.info("Download run {} finished with status {}", run.getRunId(), run.getStatus());
        return run;
    }

    /**
     * Log where the checkpoint stands, plus rate and proxy state. Makes no requests.
     */
    public CheckpointPartition status() {
        checkpointStore.load();
        CheckpointPartition partition = checkpointStore.partition();
        log.info("Checkpoint: {} nodes, {} completed, {} pending, {} failed, {} records so far",
                partition.total(), partition.completed(), partition.pending() + partition.inProgress(),
                partition.failed(), checkpointStore.snapshot().getTotalRecords());

        RateState rate = rateGovernor.snapshot();
        log.info("Rate: {} consecutive failures, request delay {} ms",
                rate.consecutiveFailures(), rate.currentDelay().toMillis());

        if (proxyPool.hasCandidates()) {
            for (ProxyRecord record : proxyPool.statistics()) {
                log.info("Route {}: healthy={} attempts={} successes={} rateLimited={} serverErrors={} ratio={}",
                        record.getName(), record.getHealthy(), record.getAttempts(), record.getSuccesses(),
                        record.getRateLimited(), record.getServerErrors(),
                        String.format("%.2f", record.successRatio()));
            }
        } else {
            log.info("Proxy pool disabled, all traffic goes through {}", proxyPool.getDefaultRoute());
        }
        return partition;
    }

    // ── Internal ─────────────────────────────────────────────────────────────

    List<HierarchyNode> selectRoots(RunMode mode, List<HierarchyNode> categories, List<String> categoryIds) {
        return switch (mode) {
            case RETRY_FAILED -> {
                List<HierarchyNode> failed = categories.stream()
                        .filter(c -> checkpointStore.isFailed(c.key()) || checkpointStore.hasFailedChildren(c.key()))
                        .toList();
                log.info("{} categories have failed nodes to retry", failed.size());
                yield failed;
            }
            case CATEGORY -> {
                Set<String> wanted = new HashSet<>(categoryIds);
                List<HierarchyNode> selected = categories.stream()
                        .filter(c -> wanted.contains(c.externalId()))
                        .toList();
                Set<String> found = selected.stream().map(HierarchyNode::externalId).collect(Collectors.toSet());
                wanted.removeAll(found);
                if (!wanted.isEmpty()) {
                    log.warn("Unknown category ids ignored: {}", wanted);
                }
                if (selected.isEmpty()) {
                    throw new IllegalArgumentException("None of the requested categories exist: " + categoryIds);
                }
                yield selected;
            }
            default -> categories;
        };
    }

    private FetchOptions optionsFor(RunMode mode) {
        return FetchOptions.builder()
                .concurrency(properties.getFetch().getConcurrency())
                .retryFailed(mode == RunMode.RETRY_FAILED || mode == RunMode.CATEGORY)
                .onlyFailed(mode == RunMode.RETRY_FAILED)
                .build();
    }
}
