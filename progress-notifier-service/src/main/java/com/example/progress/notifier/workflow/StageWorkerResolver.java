package com.example.progress.notifier.workflow;

import com.example.progress.notifier.model.StageDescriptor;

@FunctionalInterface
public interface StageWorkerResolver {

    StageWorker resolve(StageDescriptor stage);
}
