package com.cardintel.catalog.output;

import com.cardintel.catalog.config.CatalogDownloaderProperties;
import com.cardintel.catalog.model.CatalogItemRecord;
import com.opencsv.CSVReader;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.FileReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class CsvWriterTest {

    @TempDir
    Path tempDir;

    private CsvWriter writer;

    @BeforeEach
    void setUp() {
        CatalogDownloaderProperties properties = new CatalogDownloaderProperties();
        properties.getOutput().getCsv().setOutputDir(tempDir.resolve("output").toString());
        properties.getOutput().getCsv().setBackupDir(tempDir.resolve("backup").toString());
        writer = new CsvWriter(properties);
    }

    @Test
    void appendsToTheDailyFileWithASingleHeader() throws Exception {
        Path first = writer.write(List.of(record(1, "Alakazam, Holo")));
        Path second = writer.write(List.of(record(2, "Blastoise")));

        assertEquals(first, second);
        List<String[]> rows = read(first);
        assertEquals(3, rows.size());
        assertArrayEquals(CsvWriter.HEADERS, rows.get(0));
        assertEquals("Alakazam, Holo", rows.get(1)[5]);
        assertEquals("2", rows.get(2)[4]);
    }

    @Test
    void backupsGoToTheirOwnFile() throws Exception {
        Path backup = writer.writeBackup(List.of(record(1, "Chansey"), record(2, "Clefairy")));

        assertTrue(backup.startsWith(tempDir.resolve("backup")));
        assertTrue(backup.getFileName().toString().startsWith("backup_"));
        assertEquals(3, read(backup).size());
        assertTrue(Files.notExists(tempDir.resolve("output")));
    }

    private static CatalogItemRecord record(long productId, String name) {
        return CatalogItemRecord.builder()
                .categoryId(3)
                .categoryName("Pokemon")
                .groupId(604)
                .groupName("Base Set")
                .productId(productId)
                .productName(name)
                .build();
    }

    private static List<String[]> read(Path path) throws Exception {
        try (CSVReader reader = new CSVReader(new FileReader(path.toFile(), StandardCharsets.UTF_8))) {
            return reader.readAll();
        }
    }
}
