package com.coordinator.recovery;

import com.coordinator.core.model.Stage;
import com.coordinator.engine.service.PipelineService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Sweeps the pipeline for work lost to crashed workers.
 *
 * Responsibilities:
 * - Finish handoffs interrupted between two stages
 * - Requeue inflight entries claimed longer ago than the stuck threshold
 *
 * A failure on one stage is logged and does not stop the sweep of the others.
 */
public class StuckTaskRecovery {

    private static final Logger log = LoggerFactory.getLogger(StuckTaskRecovery.class);

    private final PipelineService pipeline;
    private final Duration stuckMaxAge;
    private final Duration handoffGrace;

    public StuckTaskRecovery(PipelineService pipeline, Duration stuckMaxAge, Duration handoffGrace) {
        if (stuckMaxAge.isNegative() || stuckMaxAge.isZero()) {
            throw new IllegalArgumentException("stuckMaxAge must be positive");
        }
        this.pipeline = pipeline;
        this.stuckMaxAge = stuckMaxAge;
        this.handoffGrace = handoffGrace;
    }

    /**
     * Run one recovery pass.
     *
     * @return Ids that were requeued or whose handoff was finished
     */
    public List<String> sweep() {
        List<String> recovered = new ArrayList<>();

        try {
            recovered.addAll(pipeline.resumeHandoffs(handoffGrace));
        } catch (Exception e) {
            log.error("Failed to resume interrupted handoffs", e);
        }

        for (Stage stage : Stage.values()) {
            try {
                List<String> requeued = pipeline.recoverStuck(stage, stuckMaxAge);
                if (!requeued.isEmpty()) {
                    log.warn("Requeued {} stuck task(s) in {}: {}", requeued.size(), stage.wireName(), requeued);
                }
                recovered.addAll(requeued);
            } catch (Exception e) {
                log.error("Failed to recover stuck tasks in {}", stage.wireName(), e);
            }
        }

        if (recovered.isEmpty()) {
            log.debug("Recovery sweep found nothing to do");
        }
        return recovered;
    }

    public Duration stuckMaxAge() {
        return stuckMaxAge;
    }
}
