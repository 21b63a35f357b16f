package com.example.progress.notifier.workflow;

import reactor.core.publisher.Mono;

/**
 * Performs the actual work of one stage. An error signal, or an exception thrown while building
 * the Mono, fails the whole workflow.
 */
@FunctionalInterface
public interface StageWorker {

    Mono<String> run(StageInput input);
}
