package com.cardintel.catalog.output;

import com.cardintel.catalog.config.CatalogDownloaderProperties;
import com.cardintel.catalog.model.CatalogItemRecord;
import com.cardintel.catalog.model.DownloadRun;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.jdbc.core.JdbcTemplate;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.List;
import java.util.stream.IntStream;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;

@ExtendWith(MockitoExtension.class)
class ClickHouseWriterTest {

    @Mock
    private JdbcTemplate jdbcTemplate;

    private ClickHouseWriter writer;

    @BeforeEach
    void setUp() {
        writer = new ClickHouseWriter(jdbcTemplate, new CatalogDownloaderProperties());
    }

    @Test
    void rendersAValuesRowWithEscapingAndNulls() {
        CatalogItemRecord record = CatalogItemRecord.builder()
                .categoryId(3)
                .categoryName("Pokemon")
                .groupId(604)
                .groupName("Base Set")
                .productId(42382L)
                .productName("Farfetch'd")
                .marketPrice(new BigDecimal("1.50"))
                .updateDate(LocalDate.of(2024, 3, 1))
                .fetchedAt(LocalDateTime.of(2024, 3, 1, 12, 30, 15, 999))
                .build();

        String row = writer.toValueRow(record);

        assertTrue(row.startsWith("(3,'Pokemon',604,'Base Set',42382,'Farfetch\\'d',NULL,"), row);
        assertTrue(row.contains(",1.50,"), row);
        assertTrue(row.endsWith("'2024-03-01','2024-03-01 12:30:15',NULL)"), row);
    }

    @Test
    void splitsLargeBatchesIntoBoundedInserts() {
        List<CatalogItemRecord> records = IntStream.range(0, 2500)
                .mapToObj(i -> CatalogItemRecord.builder().categoryId(3).groupId(604).productId((long) i).build())
                .toList();

        writer.write(records);

        ArgumentCaptor<String> sql = ArgumentCaptor.forClass(String.class);
        verify(jdbcTemplate, times(3)).execute(sql.capture());
        assertTrue(sql.getAllValues().get(0).contains("INSERT INTO card_intel.catalog_items"));
    }

    @Test
    void writesTheRunLogRow() {
        DownloadRun run = DownloadRun.builder()
                .runId("run-1")
                .mode("RESUME")
                .startedAt(LocalDateTime.of(2024, 3, 1, 12, 0))
                .status("PARTIAL")
                .nodesProcessed(10)
                .nodesFailed(1)
                .recordsWritten(1234)
                .build();

        writer.writeDownloadRun(run);

        ArgumentCaptor<String> sql = ArgumentCaptor.forClass(String.class);
        verify(jdbcTemplate).execute(sql.capture());
        String statement = sql.getValue();
        assertTrue(statement.contains("INSERT INTO card_intel.download_runs"));
        assertTrue(statement.contains("'run-1','RESUME',NULL,'2024-03-01 12:00:00',NULL,'PARTIAL',10,0,1,0,1234,NULL"),
                statement);
    }

    @Test
    void createsDatabaseAndBothTables() {
        writer.ensureSchema();

        ArgumentCaptor<String> sql = ArgumentCaptor.forClass(String.class);
        verify(jdbcTemplate, times(3)).execute(sql.capture());
        assertEquals("CREATE DATABASE IF NOT EXISTS card_intel", sql.getAllValues().get(0));
        assertTrue(sql.getAllValues().get(1).contains("ReplacingMergeTree"));
        assertTrue(sql.getAllValues().get(2).contains("download_runs"));
    }

    @Test
    void priceSubTypesAreKeptApartInTheSortingKey() {
        writer.ensureSchema();

        ArgumentCaptor<String> sql = ArgumentCaptor.forClass(String.class);
        verify(jdbcTemplate, times(3)).execute(sql.capture());
        String ddl = sql.getAllValues().get(1);
        assertTrue(ddl.contains("sub_type_name       LowCardinality(String) DEFAULT ''"), ddl);
        assertTrue(ddl.contains("ORDER BY (category_id, group_id, product_id, sub_type_name, update_date)"), ddl);
    }

    @Test
    void missingSubTypeIsWrittenAsEmptyString() {
        CatalogItemRecord product = CatalogItemRecord.builder()
                .categoryId(3).groupId(604).productId(42382L).extendedData("[]").build();
        CatalogItemRecord holo = CatalogItemRecord.builder()
                .categoryId(3).groupId(604).productId(42382L).subTypeName("Holofoil").build();

        assertTrue(writer.toValueRow(product).contains(",'[]','',"), writer.toValueRow(product));
        assertTrue(writer.toValueRow(holo).contains(",NULL,'Holofoil',"), writer.toValueRow(holo));
    }
}
