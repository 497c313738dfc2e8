package com.cardintel.catalog.output;

import com.cardintel.catalog.config.CatalogDownloaderProperties;
import com.cardintel.catalog.model.CatalogItemRecord;
import com.cardintel.catalog.model.DownloadRun;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Routes output to the appropriate sink(s) based on configuration.
 * Supports CLICKHOUSE, CSV, or BOTH modes.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class OutputRouter {

    private final ClickHouseWriter clickHouseWriter;
    private final CsvWriter csvWriter;
    private final CatalogDownloaderProperties properties;

    public void write(List<CatalogItemRecord> records) {
        if (records.isEmpty()) return;

        switch (mode()) {
            case CLICKHOUSE -> clickHouseWriter.write(records);
            case CSV -> csvWriter.write(records);
            case BOTH -> {
                clickHouseWriter.write(records);
                csvWriter.write(records);
            }
        }
    }

    public void writeBackup(List<CatalogItemRecord> records) {
        csvWriter.writeBackup(records);
    }

    public void prepare() {
        if (usesClickHouse()) {
            clickHouseWriter.ensureSchema();
        }
    }

    /** Run metadata is best effort: a failure here never fails the run. */
    public void writeDownloadRun(DownloadRun run) {
        if (!usesClickHouse()) return;
        try {
            clickHouseWriter.writeDownloadRun(run);
        } catch (Exception e) {
            log.warn("Failed to write download run metadata: {}", e.getMessage());
        }
    }

    private boolean usesClickHouse() {
        return mode() != CatalogDownloaderProperties.Output.OutputMode.CSV;
    }

    private CatalogDownloaderProperties.Output.OutputMode mode() {
        return properties.getOutput().getMode();
    }
}
