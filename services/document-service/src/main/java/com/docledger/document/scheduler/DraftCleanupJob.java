package com.docledger.document.scheduler;

import com.docledger.document.config.DocumentProperties;
import com.docledger.document.service.DocumentVersioningService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Nightly removal of drafts nobody has touched within the retention window.
 */
@Slf4j
@Component
@RequiredArgsConstructor
@ConditionalOnProperty(prefix = "documents.drafts", name = "cleanup-enabled", havingValue = "true", matchIfMissing = true)
public class DraftCleanupJob {

    private final DocumentVersioningService documentVersioningService;
    private final DocumentProperties properties;

    @Scheduled(cron = "${documents.drafts.cleanup-cron:0 30 3 * * *}")
    public void purgeAbandonedDrafts() {
        log.info("Starting abandoned draft cleanup, retention {}", properties.getDrafts().getRetention());
        int purged = documentVersioningService.purgeStaleDrafts(properties.getDrafts().getRetention());
        log.info("Abandoned draft cleanup finished, {} drafts removed", purged);
    }
}
