package com.coordinator.engine.pipeline;

import com.coordinator.core.model.Stage;
import com.coordinator.engine.test.PipelineFixture;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.RepeatedTest;

import java.time.Duration;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Random;
import java.util.Set;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

import static org.assertj.core.api.Assertions.*;

/**
 * Concurrent workers, recovery sweeps and an observer checking that no task id is ever
 * seen in two stage lists at once.
 */
class PipelineInvariantFuzzTest {

    private static final int TASKS = 40;
    private static final int WORKERS = 6;
    private static final int OPERATIONS_PER_WORKER = 400;

    @RepeatedTest(3)
    @DisplayName("A task id is never in more than one stage list")
    void taskIdInAtMostOneList() throws Exception {
        PipelineFixture fx = new PipelineFixture(new PipelineSettings(1000, Set.of()));
        for (int i = 0; i < TASKS; i++) {
            fx.pipeline.enqueue("T" + i, Stage.NEW);
        }

        ConcurrentLinkedQueue<String> violations = new ConcurrentLinkedQueue<>();
        AtomicBoolean running = new AtomicBoolean(true);
        CountDownLatch workersDone = new CountDownLatch(WORKERS + 1);
        ExecutorService executor = Executors.newFixedThreadPool(WORKERS + 2);

        for (int w = 0; w < WORKERS; w++) {
            long seed = 7L * w + 1;
            executor.submit(() -> {
                Random random = new Random(seed);
                Stage[] stages = Stage.values();
                try {
                    for (int op = 0; op < OPERATIONS_PER_WORKER; op++) {
                        Stage stage = stages[random.nextInt(stages.length)];
                        Optional<String> claimed = fx.pipeline.claim(stage, Duration.ZERO);
                        if (claimed.isEmpty()) {
                            continue;
                        }
                        if (random.nextInt(5) == 0) {
                            fx.pipeline.fail(claimed.get(), stage, "flaky");
                        } else if (random.nextInt(10) != 0) {
                            fx.pipeline.complete(claimed.get(), stage);
                        }
                        // else: abandon the claim for recovery to pick up
                    }
                } finally {
                    workersDone.countDown();
                }
            });
        }

        executor.submit(() -> {
            try {
                for (int sweep = 0; sweep < 200; sweep++) {
                    fx.time.advanceSeconds(5);
                    for (Stage stage : Stage.values()) {
                        fx.pipeline.recoverStuck(stage, Duration.ofSeconds(10));
                    }
                }
            } finally {
                workersDone.countDown();
            }
        });

        executor.submit(() -> {
            while (running.get()) {
                checkAtMostOneList(fx, violations);
            }
        });

        assertThat(workersDone.await(60, TimeUnit.SECONDS)).isTrue();
        running.set(false);
        executor.shutdown();
        assertThat(executor.awaitTermination(10, TimeUnit.SECONDS)).isTrue();

        checkAtMostOneList(fx, violations);
        assertThat(violations).isEmpty();

        Set<String> listed = new HashSet<>();
        for (Stage stage : Stage.values()) {
            listed.addAll(fx.pending(stage));
            listed.addAll(fx.inflight(stage));
        }
        assertThat(fx.store.smembers(fx.keys.members())).isEqualTo(listed);
    }

    private static void checkAtMostOneList(PipelineFixture fx, ConcurrentLinkedQueue<String> violations) {
        Map<String, List<String>> lists = fx.store.snapshotLists();
        Map<String, List<String>> seenIn = new HashMap<>();
        for (Stage stage : Stage.values()) {
            for (String key : List.of(fx.keys.queue(stage), fx.keys.inflight(stage))) {
                for (String taskId : lists.getOrDefault(key, List.of())) {
                    seenIn.computeIfAbsent(taskId, id -> new ArrayList<>()).add(key);
                }
            }
        }
        seenIn.forEach((taskId, keys) -> {
            if (keys.size() > 1) {
                violations.add(taskId + " in " + keys);
            }
        });
    }
}
