package com.cardintel.catalog.checkpoint;

import com.cardintel.catalog.config.CatalogDownloaderProperties;
import com.cardintel.catalog.model.Checkpoint;
import com.cardintel.catalog.model.HierarchyNode;
import com.cardintel.catalog.model.NodeState;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * JSON-file checkpoint.
 *
 * Each transition rewrites the whole file: serialise to {@code <file>.tmp}, force it to
 * disk, then atomically move it over the checkpoint, so a crash mid-write leaves the
 * previously committed file intact. All access is serialised on the store.
 */
@Component
@Slf4j
public class FileCheckpointStore implements CheckpointStore {

    private final Path file;
    private final ObjectMapper mapper;
    private final Clock clock;

    // guarded by this
    private Checkpoint checkpoint;

    @Autowired
    public FileCheckpointStore(CatalogDownloaderProperties properties, ObjectMapper objectMapper, Clock clock) {
        this(Paths.get(properties.getCheckpoint().getFile()), objectMapper, clock);
    }

    public FileCheckpointStore(Path file, ObjectMapper objectMapper, Clock clock) {
        this.file = file;
        this.mapper = objectMapper.copy()
                .enable(SerializationFeature.INDENT_OUTPUT)
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        this.clock = clock;
    }

    @Override
    public synchronized Checkpoint load() {
        if (Files.exists(file)) {
            try {
                checkpoint = mapper.readValue(file.toFile(), Checkpoint.class);
            } catch (IOException e) {
                throw new CheckpointPersistenceException("Cannot read checkpoint " + file, e);
            }
            int recovered = 0;
            for (Checkpoint.NodeEntry entry : checkpoint.getNodes().values()) {
                if (entry.getState() == NodeState.IN_PROGRESS) {
                    entry.setState(NodeState.PENDING);
                    recovered++;
                }
            }
            CheckpointPartition partition = partition();
            log.info("Loaded checkpoint {}: {} completed, {} pending, {} failed ({} interrupted nodes back to pending)",
                    file, partition.completed(), partition.pending(), partition.failed(), recovered);
            if (recovered > 0) {
                persist();
            }
        } else {
            log.info("No checkpoint at {}, starting fresh", file);
            checkpoint = Checkpoint.fresh(clock.instant());
            persist();
        }
        return checkpoint.copy();
    }

    @Override
    public synchronized Checkpoint reset() {
        if (Files.exists(file)) {
            Path backup = file.resolveSibling(file.getFileName() + ".bak");
            try {
                Files.move(file, backup, StandardCopyOption.REPLACE_EXISTING);
                log.info("Previous checkpoint kept as {}", backup);
            } catch (IOException e) {
                throw new CheckpointPersistenceException("Cannot back up checkpoint " + file, e);
            }
        }
        checkpoint = Checkpoint.fresh(clock.instant());
        persist();
        return checkpoint.copy();
    }

    @Override
    public synchronized void register(HierarchyNode node) {
        registerAll(List.of(node));
    }

    @Override
    public synchronized void registerAll(List<HierarchyNode> discovered) {
        Map<String, Checkpoint.NodeEntry> nodes = current().getNodes();
        boolean changed = false;
        for (HierarchyNode node : discovered) {
            if (nodes.containsKey(node.key())) {
                continue;
            }
            nodes.put(node.key(), Checkpoint.NodeEntry.builder()
                    .level(node.level())
                    .parentKey(node.parentKey())
                    .name(node.name())
                    .state(NodeState.PENDING)
                    .updatedAt(clock.instant())
                    .build());
            changed = true;
        }
        if (changed) {
            persist();
        }
    }

    @Override
    public synchronized boolean claim(String key) {
        Checkpoint.NodeEntry entry = current().getNodes().get(key);
        if (entry == null || entry.getState() != NodeState.PENDING) {
            return false;
        }
        entry.setState(NodeState.IN_PROGRESS);
        entry.setAttempts(entry.getAttempts() + 1);
        entry.setUpdatedAt(clock.instant());
        persist();
        return true;
    }

    @Override
    public synchronized void mark(String key, NodeState state) {
        Checkpoint.NodeEntry entry = requireEntry(key);
        NodeState from = entry.getState();
        if (from == state) {
            return;
        }
        if (!from.canTransitionTo(state)) {
            throw new IllegalStateException("Illegal transition " + from + " → " + state + " for node " + key);
        }
        entry.setState(state);
        if (state == NodeState.COMPLETED) {
            entry.setLastError(null);
        }
        entry.setUpdatedAt(clock.instant());
        persist();
    }

    @Override
    public synchronized void recordError(String key, String message) {
        Checkpoint.NodeEntry entry = requireEntry(key);
        entry.setLastError(message);
        entry.setUpdatedAt(clock.instant());
        persist();
    }

    @Override
    public synchronized void addRecords(long count) {
        if (count <= 0) return;
        current().setTotalRecords(current().getTotalRecords() + count);
        persist();
    }

    @Override
    public synchronized boolean isCompleted(String key) {
        return stateOf(key) == NodeState.COMPLETED;
    }

    @Override
    public synchronized boolean isFailed(String key) {
        return stateOf(key) == NodeState.FAILED;
    }

    @Override
    public synchronized NodeState stateOf(String key) {
        Checkpoint.NodeEntry entry = current().getNodes().get(key);
        return entry == null ? null : entry.getState();
    }

    @Override
    public synchronized List<String> pendingNodes(String parentKey, boolean includeFailed) {
        return current().getNodes().entrySet().stream()
                .filter(e -> isChildOf(e.getValue(), parentKey))
                .filter(e -> e.getValue().getState() == NodeState.PENDING
                        || (includeFailed && e.getValue().getState() == NodeState.FAILED))
                .map(Map.Entry::getKey)
                .toList();
    }

    @Override
    public synchronized List<String> failedNodes(String parentKey) {
        return current().getNodes().entrySet().stream()
                .filter(e -> isChildOf(e.getValue(), parentKey))
                .filter(e -> e.getValue().getState() == NodeState.FAILED)
                .map(Map.Entry::getKey)
                .toList();
    }

    @Override
    public synchronized boolean hasFailedChildren(String parentKey) {
        return !failedNodes(parentKey).isEmpty();
    }

    @Override
    public synchronized CheckpointPartition partition() {
        int pending = 0, inProgress = 0, completed = 0, failed = 0;
        for (Checkpoint.NodeEntry entry : current().getNodes().values()) {
            switch (entry.getState()) {
                case PENDING -> pending++;
                case IN_PROGRESS -> inProgress++;
                case COMPLETED -> completed++;
                case FAILED -> failed++;
            }
        }
        return new CheckpointPartition(pending, inProgress, completed, failed);
    }

    @Override
    public synchronized Checkpoint snapshot() {
        return current().copy();
    }

    // ── Internal ─────────────────────────────────────────────────────────────

    private Checkpoint current() {
        if (checkpoint == null) {
            throw new IllegalStateException("Checkpoint not loaded; call load() or reset() first");
        }
        return checkpoint;
    }

    private Checkpoint.NodeEntry requireEntry(String key) {
        Checkpoint.NodeEntry entry = current().getNodes().get(key);
        if (entry == null) {
            throw new IllegalArgumentException("Unknown checkpoint node: " + key);
        }
        return entry;
    }

    private static boolean isChildOf(Checkpoint.NodeEntry entry, String parentKey) {
        return parentKey == null ? entry.getParentKey() == null : parentKey.equals(entry.getParentKey());
    }

    private void persist() {
        Instant now = clock.instant();
        checkpoint.setLastUpdated(now);
        Path tmp = file.resolveSibling(file.getFileName() + ".tmp");
        try {
            Path parent = file.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            ByteBuffer buffer = ByteBuffer.wrap(mapper.writeValueAsBytes(checkpoint));
            try (FileChannel channel = FileChannel.open(tmp,
                    StandardOpenOption.CREATE, StandardOpenOption.WRITE, StandardOpenOption.TRUNCATE_EXISTING)) {
                while (buffer.hasRemaining()) {
                    channel.write(buffer);
                }
                channel.force(true);
            }
            try {
                Files.move(tmp, file, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            } catch (AtomicMoveNotSupportedException e) {
                Files.move(tmp, file, StandardCopyOption.REPLACE_EXISTING);
            }
            log.trace("Checkpoint saved");
        } catch (IOException e) {
            throw new CheckpointPersistenceException("Failed to save checkpoint " + file, e);
        }
    }
}
