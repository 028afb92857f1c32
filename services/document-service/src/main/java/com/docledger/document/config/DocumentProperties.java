package com.docledger.document.config;

import com.docledger.document.domain.DocumentType;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.EnumMap;
import java.util.Map;

/**
 * Tunables for the document service, bound from {@code documents.*}.
 */
@Data
@ConfigurationProperties(prefix = "documents")
public class DocumentProperties {

    private Locking locking = new Locking();
    private Retry retry = new Retry();
    private Drafts drafts = new Drafts();
    private Numbering numbering = new Numbering();
    private Events events = new Events();

    @Data
    public static class Locking {
        /**
         * Upper bound for a promotion or allocation transaction, lock wait included.
         */
        private int transactionTimeoutSeconds = 3;
        /**
         * Longest wait for a document or counter row lock. Applied per transaction on PostgreSQL;
         * other databases use their connection setting.
         */
        private Duration lockWait = Duration.ofMillis(2500);
    }

    @Data
    public static class Retry {
        /**
         * Attempts for operations that lost a row race and must re-run their conflict check.
         */
        private int maxAttempts = 3;
        private long backoffMillis = 25;
    }

    @Data
    public static class Drafts {
        private boolean cleanupEnabled = true;
        private Duration retention = Duration.ofDays(30);
        private String cleanupCron = "0 30 3 * * *";
    }

    @Data
    public static class Numbering {
        private Map<DocumentType, String> prefixes = new EnumMap<>(DocumentType.class);
        private int provisionAttempts = 10;

        public String prefixFor(DocumentType type) {
            String configured = prefixes.get(type);
            return configured != null && !configured.isBlank() ? configured.trim() : type.getDefaultPrefix();
        }
    }

    @Data
    public static class Events {
        private boolean enabled = true;
        private String topic = "document-events";
    }
}
