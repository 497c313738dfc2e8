package com.cardintel.catalog.output;

import com.cardintel.catalog.config.CatalogDownloaderProperties;
import com.cardintel.catalog.model.CatalogItemRecord;
import com.opencsv.CSVWriter;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.FileWriter;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.List;

/**
 * Writes catalog records to CSV files.
 *
 * Regular output appends to one file per day: {outputDir}/catalog_items_{yyyyMMdd}.csv
 * Backups of batches the warehouse refused go to {backupDir}/backup_{yyyyMMdd_HHmmss_SSS}.csv
 *
 * These CSVs can be loaded into ClickHouse via:
 *   INSERT INTO card_intel.catalog_items FROM INFILE 'catalog_items_*.csv' FORMAT CSVWithNames
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class CsvWriter {

    private static final DateTimeFormatter DAY = DateTimeFormatter.ofPattern("yyyyMMdd");
    private static final DateTimeFormatter STAMP = DateTimeFormatter.ofPattern("yyyyMMdd_HHmmss_SSS");

    private final CatalogDownloaderProperties properties;

    static final String[] HEADERS = {
            "category_id", "category_name",
            "group_id", "group_name",
            "product_id", "product_name", "clean_name",
            "image_url", "product_url", "modified_on", "extended_data",
            "sub_type_name", "low_price", "mid_price", "high_price", "market_price", "direct_low_price",
            "update_date", "fetched_at", "source_endpoint"
    };

    public synchronized Path write(List<CatalogItemRecord> records) {
        Path outputDir = Paths.get(properties.getOutput().getCsv().getOutputDir());
        Path outputPath = outputDir.resolve("catalog_items_" + LocalDate.now().format(DAY) + ".csv");
        writeTo(outputPath, records, true);
        log.info("Appended {} records to CSV: {}", records.size(), outputPath);
        return outputPath;
    }

    /** Save a batch that could not be delivered, so it is never silently lost. */
    public synchronized Path writeBackup(List<CatalogItemRecord> records) {
        Path backupDir = Paths.get(properties.getOutput().getCsv().getBackupDir());
        Path backupPath = backupDir.resolve("backup_" + LocalDateTime.now().format(STAMP) + ".csv");
        writeTo(backupPath, records, false);
        log.warn("Backup of {} undelivered records saved: {}", records.size(), backupPath);
        return backupPath;
    }

    private void writeTo(Path path, List<CatalogItemRecord> records, boolean append) {
        ensureDirectory(path.toAbsolutePath().getParent());
        boolean newFile = !append || !Files.exists(path);

        try (CSVWriter writer = new CSVWriter(
                new FileWriter(path.toFile(), StandardCharsets.UTF_8, append),
                CSVWriter.DEFAULT_SEPARATOR,
                CSVWriter.DEFAULT_QUOTE_CHARACTER,
                CSVWriter.DEFAULT_ESCAPE_CHARACTER,
                CSVWriter.DEFAULT_LINE_END)) {

            if (newFile && properties.getOutput().getCsv().isIncludeHeader()) {
                writer.writeNext(HEADERS);
            }

            for (CatalogItemRecord r : records) {
                writer.writeNext(toRow(r));
            }

        } catch (IOException e) {
            log.error("Failed to write CSV file {}: {}", path, e.getMessage(), e);
            throw new UncheckedIOException("CSV write failed: " + path, e);
        }
    }

    private String[] toRow(CatalogItemRecord r) {
        return new String[]{
                str(r.getCategoryId()),
                str(r.getCategoryName()),
                str(r.getGroupId()),
                str(r.getGroupName()),
                str(r.getProductId()),
                str(r.getProductName()),
                str(r.getCleanName()),
                str(r.getImageUrl()),
                str(r.getProductUrl()),
                str(r.getModifiedOn()),
                str(r.getExtendedData()),
                str(r.getSubTypeName()),
                str(r.getLowPrice()),
                str(r.getMidPrice()),
                str(r.getHighPrice()),
                str(r.getMarketPrice()),
                str(r.getDirectLowPrice()),
                str(r.getUpdateDate()),
                str(r.getFetchedAt()),
                str(r.getSourceEndpoint())
        };
    }

    private String str(Object val) {
        return val == null ? "" : val.toString();
    }

    private void ensureDirectory(Path dir) {
        try {
            Files.createDirectories(dir);
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot create output directory: " + dir, e);
        }
    }
}
