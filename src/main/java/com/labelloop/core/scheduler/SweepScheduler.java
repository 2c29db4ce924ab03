package com.labelloop.core.scheduler;

import com.labelloop.core.engine.LabelingEngine;
import com.labelloop.core.model.SweepReport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Runs the engine's timeout sweep on a fixed delay. Deadlines are checked here rather than
 * by blocking waits, so a silent annotator or training collaborator never holds up other tasks.
 */
@Component
@ConditionalOnProperty(prefix = "labelloop.sweep", name = "enabled", havingValue = "true", matchIfMissing = true)
public class SweepScheduler {

    private static final Logger log = LoggerFactory.getLogger(SweepScheduler.class);

    private final LabelingEngine engine;

    public SweepScheduler(LabelingEngine engine) {
        this.engine = engine;
    }

    @Scheduled(fixedDelayString = "${labelloop.sweep.interval:30s}",
               initialDelayString = "${labelloop.sweep.interval:30s}")
    public void runSweep() {
        try {
            SweepReport report = engine.sweep();
            if (report.isEmpty()) {
                log.debug("Sweep found nothing to do");
            }
        } catch (RuntimeException e) {
            // next run retries
            log.error("Timeout sweep failed", e);
        }
    }
}
