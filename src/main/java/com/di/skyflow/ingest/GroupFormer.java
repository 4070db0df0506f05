package com.di.skyflow.ingest;

import com.di.skyflow.config.SkyFlowProperties;
import com.di.skyflow.group.GroupMember;
import com.di.skyflow.group.GroupState;
import com.di.skyflow.group.ObservationGroup;
import com.di.skyflow.group.ObservationGroupRepository;
import com.di.skyflow.group.StaleGroupStateException;
import com.di.skyflow.state.ProcessingStateMachine;
import com.di.skyflow.state.TransitionContext;
import com.di.skyflow.util.MetricsCollector;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Buckets incoming subband files into observation groups and hands out groups once they
 * are complete. Membership is keyed by (bucket, subband index), so arrival order does not
 * change the resulting groups.
 */
@Service
@Slf4j
public class GroupFormer {

    private static final int READY_SCAN_LIMIT = 16;

    private final ObservationGroupRepository groups;
    private final ProcessingStateMachine stateMachine;
    private final MetricsCollector metrics;
    private final Clock clock;
    private final BucketResolver buckets;
    private final int expectedSubbands;

    public GroupFormer(ObservationGroupRepository groups,
                       ProcessingStateMachine stateMachine,
                       MetricsCollector metrics,
                       Clock clock,
                       SkyFlowProperties props) {
        SkyFlowProperties.Ingest ingest = props.getIngest();
        this.groups = groups;
        this.stateMachine = stateMachine;
        this.metrics = metrics;
        this.clock = clock;
        this.expectedSubbands = ingest.getExpectedSubbands();
        this.buckets = new BucketResolver(ingest.getChunkSeconds(),
                ingest.effectiveToleranceSeconds(), ingest.getGridOffsetSeconds());
    }

    /**
     * Routes one file to its group, creating the group on first sight.
     */
    public ArrivalResult onFileArrival(SubbandFile file) {
        BucketResolver.Bucket bucket = buckets.resolve(file.getObservedAt());
        String groupId = bucket.id();

        if (file.getSubbandIndex() < 0 || file.getSubbandIndex() >= expectedSubbands) {
            log.warn("[GROUP-FORMER] rejected {}: subband index {} outside 0..{}",
                    file.getPath(), file.getSubbandIndex(), expectedSubbands - 1);
            metrics.recordArrivalRejected();
            return new ArrivalResult(ArrivalOutcome.INVALID_INDEX, groupId, 0,
                    "subband index " + file.getSubbandIndex() + " outside 0.." + (expectedSubbands - 1));
        }
        if (!bucket.onGrid()) {
            log.info("[GROUP-FORMER] {} is off the chunk grid, own bucket {}", file.getPath(), groupId);
        }

        Instant now = clock.instant();
        if (groups.insertIfAbsent(newGroup(groupId, bucket.mjd(), now))) {
            log.info("[GROUP-FORMER] opened group {} (mjd={})", groupId, bucket.mjd());
        }

        Optional<String> owner = groups.findGroupIdByPath(file.getPath());
        if (owner.isPresent()) {
            metrics.recordArrivalDuplicate();
            log.debug("[GROUP-FORMER] re-ingest of {} ignored", file.getPath());
            return ArrivalResult.of(ArrivalOutcome.DUPLICATE_IGNORED, owner.get(), groups.countMembers(owner.get()));
        }

        GroupMember member = new GroupMember(file.getSubbandIndex(), file.getPath(), file.getChecksum(), now);
        if (groups.insertMember(groupId, member)) {
            metrics.recordArrivalAccepted();
            int count = groups.countMembers(groupId);
            if (count >= expectedSubbands) {
                log.info("[GROUP-FORMER] group {} complete ({} subbands)", groupId, count);
                return ArrivalResult.of(ArrivalOutcome.GROUP_COMPLETE, groupId, count);
            }
            return ArrivalResult.of(ArrivalOutcome.ACCEPTED, groupId, count);
        }

        return classifyRejectedMember(groupId, file);
    }

    /**
     * Claims the earliest complete collecting group by moving it to PENDING.
     * Concurrent callers never receive the same group.
     */
    public Optional<ObservationGroup> nextReadyGroup() {
        for (ObservationGroup candidate : groups.findCompleteCollecting(READY_SCAN_LIMIT)) {
            try {
                ObservationGroup claimed = stateMachine.transition(candidate, GroupState.PENDING,
                        TransitionContext.because("all " + candidate.getExpectedCount() + " subbands present"));
                return Optional.of(claimed);
            } catch (StaleGroupStateException e) {
                log.debug("[GROUP-FORMER] group {} claimed by another worker", candidate.getGroupId());
            }
        }
        return Optional.empty();
    }

    /**
     * Registers every matching file already present in {@code dir}. Safe to repeat.
     */
    public BootstrapSummary bootstrap(Path dir) {
        List<Path> files = new ArrayList<>();
        try (DirectoryStream<Path> stream = Files.newDirectoryStream(dir, SubbandFilenameParser.GLOB)) {
            for (Path p : stream) {
                if (Files.isRegularFile(p)) {
                    files.add(p);
                }
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot list incoming directory " + dir, e);
        }
        files.sort(null);

        int stored = 0;
        int duplicates = 0;
        int rejected = 0;
        int unparseable = 0;
        for (Path p : files) {
            Optional<SubbandFile> parsed = SubbandFilenameParser.parse(p);
            if (parsed.isEmpty()) {
                unparseable++;
                continue;
            }
            ArrivalOutcome outcome = onFileArrival(parsed.get()).outcome();
            if (outcome.isStored()) {
                stored++;
            } else if (outcome == ArrivalOutcome.DUPLICATE_IGNORED) {
                duplicates++;
            } else {
                rejected++;
            }
        }
        BootstrapSummary summary = new BootstrapSummary(files.size(), stored, duplicates, rejected, unparseable);
        if (summary.stored() > 0 || summary.rejected() > 0) {
            log.info("[GROUP-FORMER] bootstrap {}: {}", dir, summary);
        }
        return summary;
    }

    public Map<GroupState, Integer> countByState() {
        return groups.countByState();
    }

    public Optional<ObservationGroup> findGroup(String groupId) {
        return groups.findById(groupId);
    }

    // ------------------------------------------------------------------

    private ArrivalResult classifyRejectedMember(String groupId, SubbandFile file) {
        Optional<GroupMember> existing = groups.findMember(groupId, file.getSubbandIndex());
        int count = groups.countMembers(groupId);
        if (existing.isEmpty() || existing.get().sameContentAs(file.getPath(), file.getChecksum())) {
            // lost a race against an identical insert
            metrics.recordArrivalDuplicate();
            return ArrivalResult.of(ArrivalOutcome.DUPLICATE_IGNORED, groupId, count);
        }
        metrics.recordArrivalRejected();
        log.warn("[GROUP-FORMER] DuplicateMember group={} index={}: kept {}, rejected {}",
                groupId, file.getSubbandIndex(), existing.get().getPath(), file.getPath());
        return new ArrivalResult(ArrivalOutcome.DUPLICATE_MEMBER, groupId, count,
                "index " + file.getSubbandIndex() + " already held by " + existing.get().getPath());
    }

    private ObservationGroup newGroup(String groupId, double mjd, Instant now) {
        return ObservationGroup.builder()
                .groupId(groupId)
                .state(GroupState.COLLECTING)
                .expectedCount(expectedSubbands)
                .observedMjd(mjd)
                .createdAt(now)
                .updatedAt(now)
                .build();
    }
}
