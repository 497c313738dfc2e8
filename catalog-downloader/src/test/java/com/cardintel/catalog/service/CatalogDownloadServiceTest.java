package com.cardintel.catalog.service;

import com.cardintel.catalog.checkpoint.CheckpointPartition;
import com.cardintel.catalog.checkpoint.CheckpointPersistenceException;
import com.cardintel.catalog.checkpoint.CheckpointStore;
import com.cardintel.catalog.config.CatalogDownloaderProperties;
import com.cardintel.catalog.model.Checkpoint;
import com.cardintel.catalog.model.DownloadRun;
import com.cardintel.catalog.model.FetchOptions;
import com.cardintel.catalog.model.FetchSummary;
import com.cardintel.catalog.model.HierarchyNode;
import com.cardintel.catalog.model.RateState;
import com.cardintel.catalog.model.RunMode;
import com.cardintel.catalog.output.OutputRouter;
import com.cardintel.catalog.proxy.ProxyPool;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
class CatalogDownloadServiceTest {

    @Mock
    private HierarchicalFetcher fetcher;
    @Mock
    private CheckpointStore checkpointStore;
    @Mock
    private OutputRouter outputRouter;
    @Mock
    private ProxyPool proxyPool;
    @Mock
    private RateGovernor rateGovernor;

    private CatalogDownloaderProperties properties;
    private CatalogDownloadService service;

    private final HierarchyNode magic = HierarchyNode.category("1", "Magic");
    private final HierarchyNode pokemon = HierarchyNode.category("3", "Pokemon");
    private final HierarchyNode yugioh = HierarchyNode.category("2", "YuGiOh");

    @BeforeEach
    void setUp() throws InterruptedException {
        properties = new CatalogDownloaderProperties();
        service = new CatalogDownloadService(fetcher, checkpointStore, outputRouter, proxyPool, rateGovernor, properties);
        when(fetcher.listCategories()).thenReturn(List.of(magic, yugioh, pokemon));
    }

    @Test
    void freshRunResetsTheCheckpointAndWalksEverything() {
        when(fetcher.run(anyList(), any())).thenReturn(summary(0, 0, false));

        DownloadRun run = service.run(RunMode.FRESH, List.of());

        verify(checkpointStore).reset();
        verify(checkpointStore, never()).load();
        verify(outputRouter).prepare();
        verify(fetcher).run(List.of(magic, yugioh, pokemon), FetchOptions.builder().build());
        assertEquals(CatalogDownloadService.STATUS_SUCCESS, run.getStatus());
        assertNotNull(run.getCompletedAt());
        verify(outputRouter).writeDownloadRun(run);
    }

    @Test
    void resumeLoadsTheCheckpointAndReportsPartialWhenWorkRemains() {
        properties.getFetch().setConcurrency(3);
        when(fetcher.run(anyList(), any())).thenReturn(summary(1, 2, false));

        DownloadRun run = service.run(RunMode.RESUME, List.of());

        verify(checkpointStore).load();
        ArgumentCaptor<FetchOptions> options = ArgumentCaptor.forClass(FetchOptions.class);
        verify(fetcher).run(anyList(), options.capture());
        assertEquals(3, options.getValue().getConcurrency());
        assertFalse(options.getValue().isRetryFailed());
        assertEquals(CatalogDownloadService.STATUS_PARTIAL, run.getStatus());
        assertEquals(1, run.getNodesFailed());
        assertEquals(2, run.getNodesPending());
    }

    @Test
    void retryFailedOnlyTouchesCategoriesWithFailures() {
        when(checkpointStore.isFailed("2")).thenReturn(true);
        when(checkpointStore.hasFailedChildren("3")).thenReturn(true);
        when(fetcher.run(anyList(), any())).thenReturn(summary(0, 0, false));

        service.run(RunMode.RETRY_FAILED, List.of());

        verify(fetcher).run(List.of(yugioh, pokemon),
                FetchOptions.builder().retryFailed(true).onlyFailed(true).build());
    }

    @Test
    void categoryModeRestrictsTheRunToTheRequestedIds() {
        when(fetcher.run(anyList(), any())).thenReturn(summary(0, 0, false));

        DownloadRun run = service.run(RunMode.CATEGORY, List.of("3", "99"));

        verify(fetcher).run(List.of(pokemon), FetchOptions.builder().retryFailed(true).build());
        assertEquals("3,99", run.getCategories());
    }

    @Test
    void categoryModeWithOnlyUnknownIdsFails() {
        DownloadRun run = service.run(RunMode.CATEGORY, List.of("99"));

        assertEquals(CatalogDownloadService.STATUS_FAILED, run.getStatus());
        verify(fetcher, never()).run(anyList(), any());
    }

    @Test
    void interruptedTraversalIsRecordedAsSuch() {
        when(fetcher.run(anyList(), any())).thenReturn(summary(0, 1, true));

        DownloadRun run = service.run(RunMode.RESUME, List.of());

        assertEquals(CatalogDownloadService.STATUS_INTERRUPTED, run.getStatus());
    }

    @Test
    void fatalErrorsAreRecordedAndTheRunLogIsStillWritten() {
        when(checkpointStore.load()).thenThrow(new CheckpointPersistenceException("disk full", null));

        DownloadRun run = service.run(RunMode.RESUME, List.of());

        assertEquals(CatalogDownloadService.STATUS_FAILED, run.getStatus());
        assertTrue(run.getErrorMessage().contains("disk full"));
        verify(outputRouter).writeDownloadRun(run);
    }

    @Test
    void categoryModeNeedsIds() {
        assertThrows(IllegalArgumentException.class, () -> service.run(RunMode.CATEGORY, List.of()));
    }

    @Test
    void statusOnlyReadsState() throws InterruptedException {
        when(checkpointStore.partition()).thenReturn(new CheckpointPartition(2, 0, 5, 1));
        when(checkpointStore.snapshot()).thenReturn(Checkpoint.fresh(Instant.now()));
        when(rateGovernor.snapshot()).thenReturn(new RateState(0, Duration.ofMillis(1200), Instant.EPOCH));
        when(proxyPool.getDefaultRoute()).thenReturn("DIRECT");

        CheckpointPartition partition = service.status();

        assertEquals(8, partition.total());
        verify(checkpointStore).load();
        verify(fetcher, never()).listCategories();
    }

    private static FetchSummary summary(int failed, int pending, boolean interrupted) {
        return FetchSummary.builder()
                .processed(4)
                .failed(failed)
                .pending(pending)
                .totalRecords(120)
                .interrupted(interrupted)
                .checkpointCompleted(4)
                .checkpointFailed(failed)
                .checkpointPending(pending)
                .build();
    }
}
