package com.legalreview.extraction.model;

import lombok.Value;

import java.util.concurrent.CompletableFuture;

/**
 * Returned by a submission. Callers either poll by job id or block on {@link #await()}.
 */
@Value
public class JobHandle {

    String jobId;
    CompletableFuture<Job> completion;

    public Job await() {
        return completion.join();
    }

    public boolean isDone() {
        return completion.isDone();
    }
}
