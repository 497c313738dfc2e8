package com.cardintel.catalog.output;

import com.cardintel.catalog.config.CatalogDownloaderProperties;
import com.cardintel.catalog.model.CatalogItemRecord;
import com.cardintel.catalog.model.DownloadRun;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.List;
import java.util.stream.Collectors;

@Component
@Slf4j
@RequiredArgsConstructor
public class ClickHouseWriter {

    private static final int MAX_ROWS_PER_INSERT = 1000;
    private static final DateTimeFormatter DATE_TIME = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");

    private final JdbcTemplate jdbcTemplate;
    private final CatalogDownloaderProperties properties;

    public void ensureSchema() {
        String db = database();
        log.info("Ensuring ClickHouse schema exists in {}...", db);

        jdbcTemplate.execute("CREATE DATABASE IF NOT EXISTS " + db);

        jdbcTemplate.execute("""
            CREATE TABLE IF NOT EXISTS %s.catalog_items
            (
                category_id         Int32,
                category_name       LowCardinality(String),
                group_id            Int32,
                group_name          String,
                product_id          Int64,
                product_name        Nullable(String),
                clean_name          Nullable(String),
                image_url           Nullable(String),
                product_url         Nullable(String),
                modified_on         Nullable(String),
                extended_data       Nullable(String),
                sub_type_name       LowCardinality(String) DEFAULT '',
                low_price           Nullable(Decimal(18, 2)),
                mid_price           Nullable(Decimal(18, 2)),
                high_price          Nullable(Decimal(18, 2)),
                market_price        Nullable(Decimal(18, 2)),
                direct_low_price    Nullable(Decimal(18, 2)),
                update_date         Date,
                fetched_at          DateTime,
                source_endpoint     Nullable(String)
            )
            ENGINE = ReplacingMergeTree(fetched_at)
            PARTITION BY toYYYYMM(update_date)
            ORDER BY (category_id, group_id, product_id, sub_type_name, update_date)
            SETTINGS index_granularity = 8192
        """.formatted(db));

        jdbcTemplate.execute("""
            CREATE TABLE IF NOT EXISTS %s.download_runs
            (
                run_id              String,
                mode                LowCardinality(String),
                categories          Nullable(String),
                started_at          DateTime,
                completed_at        Nullable(DateTime),
                status              LowCardinality(String),
                nodes_processed     Int32,
                nodes_skipped       Int32,
                nodes_failed        Int32,
                nodes_pending       Int32,
                records_written     Int64,
                error_message       Nullable(String)
            )
            ENGINE = MergeTree()
            ORDER BY (started_at, run_id)
        """.formatted(db));

        log.info("ClickHouse schema ready.");
    }

    /**
     * Insert one sink batch. Larger batches are split so a single statement stays bounded.
     */
    public void write(List<CatalogItemRecord> records) {
        if (records.isEmpty()) return;

        int total = records.size();
        for (int i = 0; i < total; i += MAX_ROWS_PER_INSERT) {
            List<CatalogItemRecord> chunk = records.subList(i, Math.min(i + MAX_ROWS_PER_INSERT, total));
            writeChunkAsValues(chunk);
            log.debug("Wrote rows {}/{}", Math.min(i + MAX_ROWS_PER_INSERT, total), total);
        }

        log.info("Wrote {} records to ClickHouse", total);
    }

    /**
     * Build a single INSERT ... VALUES statement with all rows in the chunk.
     * More predictable with the ClickHouse JDBC driver than PreparedStatement batching.
     */
    private void writeChunkAsValues(List<CatalogItemRecord> chunk) {
        StringBuilder sql = new StringBuilder("""
            INSERT INTO %s.catalog_items
            (category_id, category_name, group_id, group_name, product_id, product_name, clean_name,
             image_url, product_url, modified_on, extended_data, sub_type_name, low_price, mid_price,
             high_price, market_price, direct_low_price, update_date, fetched_at, source_endpoint)
            VALUES
            """.formatted(database()));

        String rows = chunk.stream()
                .map(this::toValueRow)
                .collect(Collectors.joining(",\n"));

        sql.append(rows);
        jdbcTemplate.execute(sql.toString());
    }

    String toValueRow(CatalogItemRecord r) {
        return String.format("(%s,%s,%s,%s,%s,%s,%s,%s,%s,%s,%s,%s,%s,%s,%s,%s,%s,%s,%s,%s)",
                sqlNum(r.getCategoryId()),
                sqlStr(r.getCategoryName()),
                sqlNum(r.getGroupId()),
                sqlStr(r.getGroupName()),
                sqlNum(r.getProductId()),
                sqlStr(r.getProductName()),
                sqlStr(r.getCleanName()),
                sqlStr(r.getImageUrl()),
                sqlStr(r.getProductUrl()),
                sqlStr(r.getModifiedOn()),
                sqlStr(r.getExtendedData()),
                sqlStr(r.getSubTypeName() != null ? r.getSubTypeName() : ""),
                sqlDecimal(r.getLowPrice()),
                sqlDecimal(r.getMidPrice()),
                sqlDecimal(r.getHighPrice()),
                sqlDecimal(r.getMarketPrice()),
                sqlDecimal(r.getDirectLowPrice()),
                r.getUpdateDate() != null ? sqlStr(r.getUpdateDate().toString()) : "today()",
                r.getFetchedAt() != null ? sqlDateTime(r.getFetchedAt()) : "now()",
                sqlStr(r.getSourceEndpoint())
        );
    }

    public void writeDownloadRun(DownloadRun run) {
        String sql = String.format("""
            INSERT INTO %s.download_runs
            (run_id, mode, categories, started_at, completed_at, status,
             nodes_processed, nodes_skipped, nodes_failed, nodes_pending, records_written, error_message)
            VALUES (%s,%s,%s,%s,%s,%s,%d,%d,%d,%d,%d,%s)
            """,
                database(),
                sqlStr(run.getRunId()),
                sqlStr(run.getMode()),
                sqlStr(run.getCategories()),
                sqlDateTime(run.getStartedAt()),
                sqlDateTime(run.getCompletedAt()),
                sqlStr(run.getStatus()),
                run.getNodesProcessed(),
                run.getNodesSkipped(),
                run.getNodesFailed(),
                run.getNodesPending(),
                run.getRecordsWritten(),
                sqlStr(run.getErrorMessage())
        );
        jdbcTemplate.execute(sql);
    }

    private String database() {
        return properties.getOutput().getClickhouse().getDatabase();
    }

    private String sqlStr(Object val) {
        if (val == null) return "NULL";
        return "'" + val.toString().replace("\\", "\\\\").replace("'", "\\'") + "'";
    }

    private String sqlDateTime(LocalDateTime val) {
        return val == null ? "NULL" : sqlStr(val.format(DATE_TIME));
    }

    private String sqlNum(Number val) {
        return val == null ? "0" : val.toString();
    }

    private String sqlDecimal(BigDecimal val) {
        return val == null ? "NULL" : val.toPlainString();
    }
}
