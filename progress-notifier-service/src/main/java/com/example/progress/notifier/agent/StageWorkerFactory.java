package com.example.progress.notifier.agent;

import com.example.progress.notifier.workflow.StageWorker;
import com.example.progress.shared.util.Constants.AgentType;

/**
 * Builds the worker behind an agent type. Called at most once per type by the {@link AgentCatalog}.
 */
public interface StageWorkerFactory {

    StageWorker create(AgentType agentType);
}
