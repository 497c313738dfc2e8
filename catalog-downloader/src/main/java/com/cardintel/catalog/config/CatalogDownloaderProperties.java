package com.cardintel.catalog.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

@Component
@ConfigurationProperties(prefix = "catalog-downloader")
@Data
public class CatalogDownloaderProperties {

    private Api api = new Api();
    private Rate rate = new Rate();
    private Proxy proxy = new Proxy();
    private Checkpoint checkpoint = new Checkpoint();
    private Fetch fetch = new Fetch();
    private Sink sink = new Sink();
    private Output output = new Output();

    @Data
    public static class Api {
        private String baseUrl = "https://tcgcsv.com/tcgplayer";
        private Duration connectTimeout = Duration.ofSeconds(10);
        private Duration readTimeout = Duration.ofSeconds(30);
        private String userAgent = "card-intel-catalog-downloader/1.0";
        private List<Integer> rateLimitStatusCodes = new ArrayList<>(List.of(403, 429));
        private ItemEndpoint itemEndpoint = ItemEndpoint.PRODUCTS;

        public enum ItemEndpoint {
            PRODUCTS("products"), PRICES("prices");

            private final String path;

            ItemEndpoint(String path) {
                this.path = path;
            }

            public String path() {
                return path;
            }
        }
    }

    @Data
    public static class Rate {
        /** Pacing floor between requests when nothing is failing */
        private Duration baseDelay = Duration.ofMillis(1200);
        private double backoffFactor = 2.0;
        private Duration maxDelay = Duration.ofSeconds(60);
        /** Global pause after the first failure signal, grows with the same factor */
        private Duration cooldown = Duration.ofSeconds(5);
        private Duration maxCooldown = Duration.ofMinutes(5);
        /** Consecutive 5xx responses before they count as a throttle signal */
        private int serverErrorThreshold = 2;
    }

    @Data
    public static class Proxy {
        private boolean enabled = false;
        private String defaultRoute = "DIRECT";
        private List<Route> routes = new ArrayList<>();
        private String probeUrl = "https://httpbin.org/ip";
        private Duration probeTimeout = Duration.ofSeconds(10);
        /** A passing probe older than this no longer makes a route eligible */
        private Duration freshnessWindow = Duration.ofMinutes(15);
        private int unhealthyAfterProbeFailures = 2;
        private long healthCheckIntervalMs = 600_000;
        private ControlPlane controlPlane = new ControlPlane();

        @Data
        public static class Route {
            private String name;
            /** http://host:port */
            private String uri;
        }

        @Data
        public static class ControlPlane {
            private boolean enabled = false;
            private String url = "http://127.0.0.1:9090";
            private String secret = "";
            private String selectorGroup = "manual-select";
            /** Local mixed port every control-plane route is reached through */
            private String localProxyUri = "http://127.0.0.1:7890";
        }
    }

    @Data
    public static class Checkpoint {
        private String file = "data/download_checkpoint.json";
    }

    @Data
    public static class Fetch {
        private int concurrency = 1;
        /** Attempts per node for 5xx and transport errors */
        private int maxAttempts = 3;
        /** Local attempts per node while rate limited, after which the node stays pending */
        private int maxThrottledAttempts = 5;
        /** 0 keeps rate-limited nodes pending forever; otherwise they fail after this many throttled attempts */
        private int throttledAttemptsBeforeFailed = 0;
        private Duration shutdownGrace = Duration.ofSeconds(30);
    }

    @Data
    public static class Sink {
        private int batchSize = 500;
        private long maxBatchBytes = 8L * 1024 * 1024;
        private int maxFlushAttempts = 3;
        private Duration flushBackoff = Duration.ofSeconds(2);
        private double flushBackoffMultiplier = 2.0;
        private boolean backupOnFailure = true;
    }

    @Data
    public static class Output {
        private OutputMode mode = OutputMode.CLICKHOUSE;
        private Csv csv = new Csv();
        private ClickHouse clickhouse = new ClickHouse();

        @Data
        public static class Csv {
            private String outputDir = "data/output";
            private String backupDir = "data/backup";
            private boolean includeHeader = true;
        }

        @Data
        public static class ClickHouse {
            private String database = "card_intel";
        }

        public enum OutputMode {
            CLICKHOUSE, CSV, BOTH
        }
    }
}
