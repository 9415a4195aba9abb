package com.lidm.core.engine;

import com.lidm.core.backend.DispatcherFixture;
import com.lidm.core.backend.GenerationOptions;
import com.lidm.core.consistency.ConsistencySettings;
import com.lidm.core.consistency.SelfConsistencyVerifier;
import com.lidm.core.events.EventBus;
import com.lidm.core.graph.DelegationGraph;
import com.lidm.core.llm.StructuredOutputParser;
import com.lidm.core.nodes.AggregateResultsNode;
import com.lidm.core.nodes.ClassifyQueryNode;
import com.lidm.core.nodes.DecomposeQueryNode;
import com.lidm.core.nodes.ExecuteSubtasksNode;
import com.lidm.core.nodes.RouteDirectNode;
import com.lidm.core.nodes.VerifyAnswerNode;
import com.lidm.core.scheduler.CapabilityTierResolver;
import com.lidm.core.scheduler.SchedulerSettings;
import com.lidm.core.scheduler.SubtaskScheduler;
import org.bsc.langgraph4j.GraphStateException;

/**
 * The whole engine wired by hand over scripted backends.
 */
public class EngineFixture implements AutoCloseable {

    public final DispatcherFixture dispatch = new DispatcherFixture();
    public final EventBus eventBus = new EventBus();
    public final DelegationGraph graph;
    public final DelegationManager manager;

    public EngineFixture() throws GraphStateException {
        this(DelegationSettings.defaults());
    }

    public EngineFixture(DelegationSettings settings) throws GraphStateException {
        var parser = new StructuredOutputParser();
        var resolver = new CapabilityTierResolver();
        var verifier = new SelfConsistencyVerifier(dispatch.dispatcher(),
                new ConsistencySettings(0.6, 5, 3, 0.7, 512), dispatch.metrics);
        var scheduler = new SubtaskScheduler(dispatch.dispatcher(), resolver, dispatch.executor,
                new SchedulerSettings(4, 3, GenerationOptions.defaults()), eventBus, dispatch.metrics);
        this.graph = new DelegationGraph(
                new ClassifyQueryNode(dispatch.dispatcher(), parser, resolver, settings, eventBus),
                new DecomposeQueryNode(dispatch.dispatcher(), parser, settings, eventBus),
                new RouteDirectNode(),
                new ExecuteSubtasksNode(scheduler),
                new AggregateResultsNode(dispatch.dispatcher(), verifier, settings),
                new VerifyAnswerNode(dispatch.dispatcher(), verifier, settings),
                settings);
        this.manager = new DelegationManager(graph, eventBus, dispatch.metrics);
    }

    @Override
    public void close() {
        dispatch.close();
    }
}
