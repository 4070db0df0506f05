package com.di.skyflow.orchestration;

import com.di.skyflow.config.SkyFlowProperties;
import com.di.skyflow.group.ObservationGroup;
import com.di.skyflow.ingest.GroupFormer;
import com.di.skyflow.mosaic.MosaicService;
import com.di.skyflow.state.ProcessingStateMachine;
import com.di.skyflow.util.MdcPropagation;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Optional;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;

/**
 * Scheduled driver. Claims ready groups and runs them on a bounded pool; periodically
 * re-queues retryable failures, resumes groups abandoned by a crashed worker, and builds
 * pending mosaics. Several instances may run against the same database.
 */
@Component
@Slf4j
@ConditionalOnProperty(name = "skyflow.worker.enabled", havingValue = "true", matchIfMissing = true)
public class StreamingWorker {

    private static final int SWEEP_LIMIT = 50;

    private final GroupFormer groupFormer;
    private final StageOrchestrator orchestrator;
    private final ProcessingStateMachine stateMachine;
    private final MosaicService mosaicService;
    private final SkyFlowProperties props;
    private final ExecutorService pool;
    private final Semaphore slots;

    public StreamingWorker(GroupFormer groupFormer,
                           StageOrchestrator orchestrator,
                           ProcessingStateMachine stateMachine,
                           MosaicService mosaicService,
                           SkyFlowProperties props) {
        this.groupFormer = groupFormer;
        this.orchestrator = orchestrator;
        this.stateMachine = stateMachine;
        this.mosaicService = mosaicService;
        this.props = props;
        int threads = Math.max(1, props.getWorker().getThreads());
        this.pool = MdcPropagation.wrapExecutor(Executors.newFixedThreadPool(threads));
        this.slots = new Semaphore(threads);
        log.info("[WORKER] node={} threads={}", props.getWorker().getNodeName(), threads);
    }

    @Scheduled(fixedDelayString = "${skyflow.worker.poll-interval:10s}")
    public void pollReadyGroups() {
        while (slots.tryAcquire()) {
            Optional<ObservationGroup> ready;
            try {
                ready = groupFormer.nextReadyGroup();
            } catch (RuntimeException e) {
                slots.release();
                log.error("[WORKER] claiming next group failed: {}", e.getMessage(), e);
                return;
            }
            if (ready.isEmpty()) {
                slots.release();
                return;
            }
            submit(ready.get().getGroupId(), "ready");
        }
    }

    @Scheduled(fixedDelayString = "${skyflow.worker.retry-sweep-interval:5m}")
    public void sweepFailedAndStale() {
        for (ObservationGroup g : stateMachine.findRetryable(SWEEP_LIMIT)) {
            if (stateMachine.retry(g.getGroupId()).isPresent() && slots.tryAcquire()) {
                submit(g.getGroupId(), "retry");
            }
        }
        resumeStale();
    }

    /**
     * Resubmits in-flight groups with no recent update. A group whose stage lease is still
     * live has a worker on it, however long its tool runs, and is left alone.
     *
     * @return how many groups were resubmitted
     */
    int resumeStale() {
        int resumed = 0;
        List<ObservationGroup> stale = stateMachine.findStale(props.getState().getStaleAfter(), SWEEP_LIMIT);
        for (ObservationGroup g : stale) {
            if (orchestrator.isStageActive(g.getGroupId())) {
                log.debug("[WORKER] group {} in {} is quiet but its stage lease is live", g.getGroupId(), g.getState());
                continue;
            }
            if (!slots.tryAcquire()) {
                break;
            }
            log.warn("[WORKER] resuming stale group {} in {} (last update {})",
                    g.getGroupId(), g.getState(), g.getUpdatedAt());
            submit(g.getGroupId(), "stale");
            resumed++;
        }
        return resumed;
    }

    @Scheduled(fixedDelayString = "${skyflow.worker.poll-interval:10s}")
    public void buildMosaics() {
        try {
            mosaicService.planWindows();
            mosaicService.buildPending();
        } catch (RuntimeException e) {
            log.error("[WORKER] mosaic sweep failed: {}", e.getMessage(), e);
        }
    }

    /** Caller must hold a slot. */
    private void submit(String groupId, String reason) {
        try {
            pool.execute(() -> {
                try {
                    MdcPropagation.runForGroup(groupId, () -> {
                        log.info("[WORKER] processing {} ({})", groupId, reason);
                        orchestrator.runToCompletion(groupId);
                    });
                } catch (RuntimeException e) {
                    log.error("[WORKER] group {} aborted: {}", groupId, e.getMessage(), e);
                } finally {
                    slots.release();
                }
            });
        } catch (RejectedExecutionException e) {
            slots.release();
            log.warn("[WORKER] pool rejected group {}: {}", groupId, e.getMessage());
        }
    }

    @PreDestroy
    public void shutdown() throws InterruptedException {
        pool.shutdown();
        if (!pool.awaitTermination(30, TimeUnit.SECONDS)) {
            log.warn("[WORKER] in-flight groups still running at shutdown; they will be resumed as stale");
            pool.shutdownNow();
        }
    }
}
