package im.arun.regingest.config;

import lombok.Data;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Map;

@Data
public class IngestConfig {
    private Http http = new Http();
    private Hansard hansard = new Hansard();
    private Questions questions = new Questions();
    private Fca fca = new Fca();
    private Store store = new Store();

    @Data
    public static class Http {
        /** Defaults to .cache/http, or the temp directory when running serverless. */
        private String cacheDir;
        private int cacheTtlHours = 24;
        private long rateLimitIntervalMs = 2000;
        private int rateLimitCapacity = 1;
        private int rateLimitMaxWaitSeconds = 300;
        private int timeoutSeconds = 30;
        private int maxRetries = 3;
        private long retryBackoffMs = 1000;

        public Path resolveCacheDir(Map<String, String> env) {
            if (cacheDir != null && !cacheDir.isBlank()) {
                return Paths.get(cacheDir);
            }
            String lambda = env.get("AWS_LAMBDA_FUNCTION_NAME");
            if (lambda != null && !lambda.isEmpty()) {
                return Paths.get(System.getProperty("java.io.tmpdir"), ".cache", "http");
            }
            return Paths.get(".cache", "http");
        }
    }

    @Data
    public static class Hansard {
        private String baseUrl = "https://hansard-api.parliament.uk";
        private int pageSize = 100;
        private int concurrency = 5;
        private int enrichmentConcurrency = 5;
        private List<String> contributionTypes = new ArrayList<>(
                Arrays.asList("Spoken", "Written", "Corrections", "Petitions"));
    }

    @Data
    public static class Questions {
        private String baseUrl = "https://questions-statements-api.parliament.uk/api";
        private int pageSize = 50;
        private int concurrency = 5;
        private int enrichmentConcurrency = 5;
    }

    @Data
    public static class Fca {
        private String baseUrl = "https://register.fca.org.uk/services/V0.1";
        private String email;
        private String apiKey;
        private int batchSize = 3;
        private int fanOut = 6;
        private int maxHitsPerTerm = 20;
        private int maxFirms = 500;
        private int maxProducts = 100;
        private List<String> firmSearchTerms = new ArrayList<>(
                Arrays.asList("ltd", "limited", "plc", "llp", "limited liability"));
        private List<String> knownFrns = new ArrayList<>(Arrays.asList("615820"));
        private List<String> productSearchTerms = new ArrayList<>(
                Arrays.asList("fund", "investment", "trust", "scheme", "portfolio"));
        /** Firms whose approved persons the individuals source loads. */
        private List<String> individualFirmFrns = new ArrayList<>(Arrays.asList("615820"));
    }

    @Data
    public static class Store {
        private String scheme = "http";
        private String host = "localhost";
        private int port = 9200;
        private String apiKey;
        private String indexPrefix = "regingest_";
        private int bulkMaxRetries = 3;
        private long bulkBackoffMs = 1000;

        public String baseUrl() {
            return scheme + "://" + host + ":" + port;
        }
    }
}
