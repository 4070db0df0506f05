package com.di.skyflow.coordination;

import com.di.skyflow.common.Result;

/**
 * Final result of a retried operation and how many attempts it took.
 */
public record RetryResult<T>(Result<T> result, int attempts) {

    public boolean isSuccess() {
        return result.isSuccess();
    }
}
