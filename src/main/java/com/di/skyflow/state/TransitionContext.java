package com.di.skyflow.state;

import com.di.skyflow.group.CalibrationState;
import lombok.Builder;
import lombok.Value;

/**
 * Stage outputs and annotations written together with a transition. Null fields leave the
 * stored value untouched, so earlier outputs are never erased.
 */
@Value
@Builder
public class TransitionContext {

    private static final TransitionContext NONE = TransitionContext.builder().build();

    String outputPath;
    String imagePath;
    CalibrationState calibrationState;
    String calibrationSets;
    String calibratorName;
    Double transitMjd;
    /** Free text kept in the audit history. */
    String reason;

    public static TransitionContext none() {
        return NONE;
    }

    public static TransitionContext because(String reason) {
        return TransitionContext.builder().reason(reason).build();
    }
}
