package com.cardintel.catalog.command;

import com.cardintel.catalog.config.CatalogDownloaderProperties;
import com.cardintel.catalog.model.DownloadRun;
import com.cardintel.catalog.model.RunMode;
import com.cardintel.catalog.service.CatalogDownloadService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Operator entry point.
 *
 *   --mode=fresh|resume|retry-failed|category|status   (default: resume)
 *   --category=<id>      repeatable or comma-separated, required for --mode=category
 *   --concurrency=N      group workers per category
 *   --base-delay-ms=N    pacing floor
 *   --backoff-factor=X   growth per consecutive failure signal
 *   --max-delay-ms=N     pacing ceiling
 *
 * Exit status: 0 nothing left to do, 1 failed or pending nodes remain, 2 fatal error.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class DownloadCommand implements ApplicationRunner, ExitCodeGenerator {

    public static final int EXIT_OK = 0;
    public static final int EXIT_UNRESOLVED = 1;
    public static final int EXIT_FATAL = 2;

    private final CatalogDownloadService downloadService;
    private final CatalogDownloaderProperties properties;

    private int exitCode = EXIT_OK;

    @Override
    public void run(ApplicationArguments args) {
        RunMode mode;
        List<String> categories;
        try {
            mode = parseMode(args);
            categories = parseCategories(args);
            applyOverrides(args);
        } catch (IllegalArgumentException e) {
            log.error("Invalid arguments: {}", e.getMessage());
            exitCode = EXIT_FATAL;
            return;
        }

        if (mode == RunMode.STATUS) {
            try {
                downloadService.status();
                exitCode = EXIT_OK;
            } catch (RuntimeException e) {
                log.error("Status failed: {}", e.getMessage(), e);
                exitCode = EXIT_FATAL;
            }
            return;
        }

        if (mode == RunMode.CATEGORY && categories.isEmpty()) {
            log.error("--mode=category needs at least one --category=<id>");
            exitCode = EXIT_FATAL;
            return;
        }

        DownloadRun run = downloadService.run(mode, categories);
        exitCode = exitCodeFor(run);
    }

    @Override
    public int getExitCode() {
        return exitCode;
    }

    // ── Internal ─────────────────────────────────────────────────────────────

    static int exitCodeFor(DownloadRun run) {
        return switch (run.getStatus()) {
            case CatalogDownloadService.STATUS_SUCCESS -> EXIT_OK;
            case CatalogDownloadService.STATUS_PARTIAL, CatalogDownloadService.STATUS_INTERRUPTED -> EXIT_UNRESOLVED;
            default -> EXIT_FATAL;
        };
    }

    RunMode parseMode(ApplicationArguments args) {
        String value = single(args, "mode");
        if (value == null) {
            return RunMode.RESUME;
        }
        try {
            return RunMode.parse(value);
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown mode '" + value
                    + "', expected fresh|resume|retry-failed|category|status");
        }
    }

    List<String> parseCategories(ApplicationArguments args) {
        List<String> categories = new ArrayList<>();
        List<String> values = args.getOptionValues("category");
        if (values == null) {
            return categories;
        }
        for (String value : values) {
            for (String id : value.split(",")) {
                String trimmed = id.trim();
                if (trimmed.isEmpty()) continue;
                if (!trimmed.chars().allMatch(Character::isDigit)) {
                    throw new IllegalArgumentException("Category id must be numeric: " + trimmed);
                }
                categories.add(trimmed);
            }
        }
        return categories;
    }

    void applyOverrides(ApplicationArguments args) {
        String concurrency = single(args, "concurrency");
        if (concurrency != null) {
            int workers = parseInt("concurrency", concurrency);
            if (workers < 1) {
                throw new IllegalArgumentException("--concurrency must be at least 1");
            }
            properties.getFetch().setConcurrency(workers);
        }

        CatalogDownloaderProperties.Rate rate = properties.getRate();
        String baseDelay = single(args, "base-delay-ms");
        if (baseDelay != null) {
            rate.setBaseDelay(Duration.ofMillis(parseInt("base-delay-ms", baseDelay)));
        }
        String maxDelay = single(args, "max-delay-ms");
        if (maxDelay != null) {
            rate.setMaxDelay(Duration.ofMillis(parseInt("max-delay-ms", maxDelay)));
        }
        String factor = single(args, "backoff-factor");
        if (factor != null) {
            try {
                double value = Double.parseDouble(factor);
                if (value < 1.0) {
                    throw new IllegalArgumentException("--backoff-factor must be at least 1.0");
                }
                rate.setBackoffFactor(value);
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("--backoff-factor is not a number: " + factor);
            }
        }
        if (rate.getMaxDelay().compareTo(rate.getBaseDelay()) < 0) {
            throw new IllegalArgumentException("--max-delay-ms must not be below --base-delay-ms");
        }

        log.info("Pacing {} ms base, x{} backoff, {} ms ceiling; {} worker(s)",
                rate.getBaseDelay().toMillis(), rate.getBackoffFactor(), rate.getMaxDelay().toMillis(),
                properties.getFetch().getConcurrency());
    }

    private String single(ApplicationArguments args, String name) {
        List<String> values = args.getOptionValues(name);
        if (values == null || values.isEmpty()) {
            return null;
        }
        return values.get(values.size() - 1);
    }

    private int parseInt(String name, String value) {
        try {
            int parsed = Integer.parseInt(value.trim());
            if (parsed < 0) {
                throw new IllegalArgumentException("--" + name + " must not be negative");
            }
            return parsed;
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("--" + name + " is not a whole number: " + value);
        }
    }
}
