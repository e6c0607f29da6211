package org.lite.ingestion.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

@Configuration
@ConfigurationProperties(prefix = "ingestion")
@Data
public class IngestionProperties {

    private Converter converter = new Converter();
    private Recognition recognition = new Recognition();
    private Completion completion = new Completion();
    private Pipeline pipeline = new Pipeline();

    @Data
    public static class Converter {
        private String executable = "soffice";
        private int maxConcurrent = 2;
        private int maxAttempts = 3;
        private Duration initialBackoff = Duration.ofSeconds(1);
        private Duration maxBackoff = Duration.ofSeconds(8);
        private Duration processTimeout = Duration.ofSeconds(60);
        private String workDir = System.getProperty("java.io.tmpdir") + "/ingestion-conversion";
        // Diagnostics printed when the converter runtime fails to initialise
        private List<String> transientMarkers = new ArrayList<>(List.of(
                "javaldx", "Java Runtime Environment", "UserInstallation"));
    }

    @Data
    public static class Recognition {
        private int maxWorkers = 4;
        private int pageAttempts = 3;
        private Duration pageRetryDelay = Duration.ofSeconds(1);
        private int dpi = 300;
        private String language = "eng";
        private String dataPath;
        private int pageSegMode = 6;
        private int engineMode = 1;
    }

    @Data
    public static class Completion {
        private String url = "https://openrouter.ai/api/v1/chat/completions";
        private String apiKey;
        private String model = "openai/gpt-4.1";
        private int maxTokens = 32000;
        // Longer documents are truncated before prompting
        private int maxInputTokens = 250000;
        private double temperature = 0.2;
        private Duration requestTimeout = Duration.ofSeconds(120);
        // Total attempts per call, the first one included
        private int maxAttempts = 3;
        private Duration initialBackoff = Duration.ofSeconds(2);
        private Duration maxBackoff = Duration.ofSeconds(30);
        private String referer = "https://contract-indexer.local";
        private String title = "Government Contract Attachment Analyzer";
        // Proposal sections in flight at once; 1 keeps generation serial
        private int sectionConcurrency = 1;
    }

    @Data
    public static class Pipeline {
        private int defaultLimit = 50;
        private int defaultConcurrency = 5;
        private int hardCap = 30;
        private int testModeThreshold = 5;
        private int testModeBatchSize = 1;
        private int testModeMaxContracts = 10;
        private int defaultMaxRetries = 3;
        private int minDirectWords = 100;
        private Duration documentTimeout = Duration.ofMinutes(3);
        private Duration downloadTimeout = Duration.ofSeconds(120);
        private Duration staleAfter = Duration.ofMinutes(10);
        private Duration sweepInterval = Duration.ofMinutes(5);
        private Duration sweepInitialDelay = Duration.ofMinutes(1);
        private String downloadDir = "downloaded_documents";
        private String userAgent = "Mozilla/5.0 (compatible; ContractIndexer/1.0)";
    }
}
