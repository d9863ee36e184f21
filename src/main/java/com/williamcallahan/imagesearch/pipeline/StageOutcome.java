package com.williamcallahan.imagesearch.pipeline;

import java.util.Objects;

/**
 * Tagged result of one stage task: either an output or the failure that replaced it.
 *
 * @param input the submitted input, kept so failures can be attributed
 * @param output task output, null on failure
 * @param failure task failure, null on success
 * @param <I> input type
 * @param <O> output type
 */
public record StageOutcome<I, O>(I input, O output, Exception failure) {

    public StageOutcome {
        Objects.requireNonNull(input, "input");
        if ((output == null) == (failure == null)) {
            throw new IllegalArgumentException("Exactly one of output or failure must be present");
        }
    }

    public static <I, O> StageOutcome<I, O> success(I input, O output) {
        return new StageOutcome<>(input, output, null);
    }

    public static <I, O> StageOutcome<I, O> failure(I input, Exception failure) {
        return new StageOutcome<>(input, null, failure);
    }

    public boolean isSuccess() {
        return failure == null;
    }
}
