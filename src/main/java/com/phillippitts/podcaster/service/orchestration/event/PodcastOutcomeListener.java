package com.phillippitts.podcaster.service.orchestration.event;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Logs the outcome of every pipeline run. Failures sharing the same persisted message are
 * throttled so a broken provider does not flood the log.
 */
@Component
class PodcastOutcomeListener {
    private static final Logger LOG = LogManager.getLogger(PodcastOutcomeListener.class);

    private static final Duration THROTTLE = Duration.ofMinutes(1);

    private final Map<String, Instant> lastFailureLog = new ConcurrentHashMap<>();

    @EventListener
    void onPodcastFinished(PodcastFinishedEvent e) {
        if (e.succeeded()) {
            LOG.info("Podcast {} finished: pipeline={}, status={}", e.podcastId(), e.pipeline(), e.status());
            return;
        }
        String key = e.pipeline() + '-' + e.errorMessage();
        if (shouldLog(key, e.timestamp())) {
            LOG.warn("Podcast {} finished: pipeline={}, status={}, error={}",
                    e.podcastId(), e.pipeline(), e.status(), e.errorMessage());
        } else {
            LOG.debug("Podcast {} failed again with a recently logged error", e.podcastId());
        }
    }

    // Package-private for tests
    boolean shouldLog(String key, Instant now) {
        Instant prev = lastFailureLog.get(key);
        if (prev == null || Duration.between(prev, now).compareTo(THROTTLE) > 0) {
            lastFailureLog.put(key, now);
            return true;
        }
        return false;
    }
}
