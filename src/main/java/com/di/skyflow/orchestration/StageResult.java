package com.di.skyflow.orchestration;

import com.di.skyflow.common.Failure;
import com.di.skyflow.group.GroupState;
import lombok.Builder;
import lombok.Value;

/**
 * Outcome of one {@link StageOrchestrator#runStage} call.
 */
@Value
@Builder
public class StageResult {
    String groupId;
    PipelineStage stage;
    StageOutcome outcome;
    /** Group state after the call. */
    GroupState state;
    /** Output reference produced (or previously recorded) by the stage. */
    String output;
    Failure failure;
    int attempts;
    String message;
}
