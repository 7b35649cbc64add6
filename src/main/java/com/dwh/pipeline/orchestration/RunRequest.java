package com.dwh.pipeline.orchestration;

import com.dwh.pipeline.rawstore.RawStoreLocation;

/**
 * "run pipeline" 입력
 */
public record RunRequest(
        String runId,
        RawStoreLocation rawStore
) {
}
