package com.williamcallahan.imagesearch.pipeline;

/**
 * Work performed by a {@link WorkerPool} worker for one input.
 *
 * @param <I> input type
 * @param <O> output type
 */
@FunctionalInterface
public interface StageTask<I, O> {

    O apply(I input) throws Exception;
}
