package com.di.dataqc.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Binding for all {@code dataqc.*} settings.
 *
 * <pre>
 * dataqc:
 *   results:
 *     max-size: 500
 *     expire-after-minutes: 120
 *   sessions:
 *     max-size: 100
 *     expire-after-minutes: 240
 *   upload:
 *     allowed-extensions: csv,txt,xlsx,xls
 *     max-file-size-mb: 100
 *   jdbc:
 *     maximum-pool-size: 4
 *     connection-timeout-ms: 30000
 *     query-timeout-seconds: 300
 *   preview:
 *     rows: 100
 *   request-logging:
 *     enabled: true
 * </pre>
 */
@Data
@Component
@ConfigurationProperties(prefix = "dataqc")
public class QcProperties {

    private Cache results = new Cache(500, 120);

    private Cache sessions = new Cache(100, 240);

    private Upload upload = new Upload();

    private Jdbc jdbc = new Jdbc();

    private Preview preview = new Preview();

    private RequestLogging requestLogging = new RequestLogging();

    // ------------------------------------------------------------------ //
    // Nested groups                                                      //
    // ------------------------------------------------------------------ //

    /** Bounds of an in-memory store. */
    @Data
    public static class Cache {
        private long maxSize;
        private long expireAfterMinutes;

        public Cache() {
        }

        public Cache(long maxSize, long expireAfterMinutes) {
            this.maxSize = maxSize;
            this.expireAfterMinutes = expireAfterMinutes;
        }
    }

    @Data
    public static class Upload {
        /** Lower-case extensions without the dot. */
        private List<String> allowedExtensions = new ArrayList<>(List.of("csv", "txt", "xlsx", "xls"));
        private long maxFileSizeMb = 100;
    }

    @Data
    public static class Jdbc {
        private int maximumPoolSize = 4;
        private long connectionTimeoutMs = 30_000;
        private int queryTimeoutSeconds = 300;
    }

    @Data
    public static class Preview {
        private int rows = 100;
    }

    @Data
    public static class RequestLogging {
        private boolean enabled = true;
        private int maxBodyLength = 2048;
    }
}
