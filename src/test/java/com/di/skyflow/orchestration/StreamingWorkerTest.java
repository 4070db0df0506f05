package com.di.skyflow.orchestration;

import com.di.skyflow.common.Result;
import com.di.skyflow.coordination.ScopedLock;
import com.di.skyflow.group.GroupState;
import com.di.skyflow.mosaic.MosaicStatus;
import com.di.skyflow.support.SkyFlowFixture;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("StreamingWorker Tests")
class StreamingWorkerTest {

    private static final DateTimeFormatter TIMESTAMP = DateTimeFormatter.ofPattern("yyyy-MM-dd'T'HH:mm:ss");

    private SkyFlowFixture f;
    private StreamingWorker worker;

    @BeforeEach
    void setUp() {
        f = SkyFlowFixture.create(props -> {
            props.getWorker().setThreads(2);
            props.getMosaic().setMsPerMosaic(3);
            props.getMosaic().setOverlap(1);
        });
        worker = new StreamingWorker(f.groupFormer, f.orchestrator, f.stateMachine, f.mosaicService, f.props);
    }

    @AfterEach
    void tearDown() throws InterruptedException {
        worker.shutdown();
        f.close();
    }

    private List<String> arriveObservations(int count) {
        List<String> ids = new ArrayList<>();
        LocalDateTime t = LocalDateTime.parse("2025-01-15T12:00:00");
        for (int i = 0; i < count; i++) {
            ids.add(f.arriveComplete(TIMESTAMP.format(t.plusMinutes(5L * i))));
        }
        return ids;
    }

    @Test
    @DisplayName("Should drive every ready group to COMPLETED")
    void testPollReadyGroups() throws InterruptedException {
        List<String> ids = arriveObservations(5);

        // two slots: poll until every group has been claimed
        for (int i = 0; i < 50 && f.groupFormer.countByState().get(GroupState.COLLECTING) > 0; i++) {
            worker.pollReadyGroups();
            Thread.sleep(20);
        }
        worker.shutdown();

        for (String id : ids) {
            assertEquals(GroupState.COMPLETED, f.groups.findById(id).orElseThrow().getState(), id);
        }
    }

    @Test
    @DisplayName("Should retry retryable failures and build planned mosaics")
    void testSweepAndBuild() throws InterruptedException {
        List<String> ids = arriveObservations(3);
        for (int i = 0; i < 3; i++) {
            f.groupFormer.nextReadyGroup();
        }
        f.stubs.failConvert(
                Result.transientFailure("CONVERT_TIMEOUT", "1"),
                Result.transientFailure("CONVERT_TIMEOUT", "2"),
                Result.transientFailure("CONVERT_TIMEOUT", "3"));
        f.orchestrator.runToCompletion(ids.get(0));
        f.orchestrator.runToCompletion(ids.get(1));
        f.orchestrator.runToCompletion(ids.get(2));
        assertEquals(GroupState.FAILED, f.groups.findById(ids.get(0)).orElseThrow().getState());

        worker.sweepFailedAndStale();
        worker.shutdown();
        assertEquals(GroupState.COMPLETED, f.groups.findById(ids.get(0)).orElseThrow().getState());

        worker.buildMosaics();
        String mosaicId = f.mosaics.findByStatus(MosaicStatus.COMPLETED).get(0).getMosaicId();
        assertEquals(3, f.mosaicService.findById(mosaicId).orElseThrow().getMembers().size());
    }

    @Test
    @DisplayName("Should resume in-flight groups that went stale")
    void testSweepStale() throws InterruptedException {
        String id = arriveObservations(1).get(0);
        f.groupFormer.nextReadyGroup();
        f.orchestrator.runStage(id, PipelineStage.CONVERT);
        f.clock.advance(f.props.getState().getStaleAfter().plus(Duration.ofMinutes(1)));

        worker.sweepFailedAndStale();
        worker.shutdown();

        assertEquals(GroupState.COMPLETED, f.groups.findById(id).orElseThrow().getState());
    }

    @Test
    @DisplayName("Should leave a quiet group alone while its stage lease is live")
    void testSweepStale_SkipsLiveStageLease() throws InterruptedException {
        String id = arriveObservations(1).get(0);
        f.groupFormer.nextReadyGroup();
        f.orchestrator.runStage(id, PipelineStage.CONVERT);
        f.clock.advance(f.props.getState().getStaleAfter().plus(Duration.ofMinutes(1)));

        try (ScopedLock running = f.coordinator.withLock("stage:" + id)) {
            assertEquals(0, worker.resumeStale());
        }
        assertEquals(GroupState.CALIBRATING, f.groups.findById(id).orElseThrow().getState());

        assertEquals(1, worker.resumeStale());
        worker.shutdown();
        assertEquals(GroupState.COMPLETED, f.groups.findById(id).orElseThrow().getState());
    }
}
