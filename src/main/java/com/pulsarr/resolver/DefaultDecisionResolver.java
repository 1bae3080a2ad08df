package com.pulsarr.resolver;

import com.pulsarr.core.ContentItem;
import com.pulsarr.core.RoutingContext;
import com.pulsarr.decision.RouterDecision;
import com.pulsarr.decision.RoutingDecision;
import com.pulsarr.evaluator.EvaluatorRegistry;
import com.pulsarr.evaluator.RoutingEvaluator;
import com.pulsarr.exception.RouterException;
import com.pulsarr.instance.Instance;
import com.pulsarr.instance.InstanceRepository;
import com.pulsarr.lookup.MetadataEnricher;
import com.pulsarr.plugin.RouterPlugin;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.function.BiFunction;
import java.util.function.BiPredicate;

/**
 * Default implementation of DecisionResolver.
 * <p>
 * All stage results are collected before any conflict is resolved. Decisions for the same
 * instance are reduced to the one with the highest priority, ties going to the lowest rule id.
 * When nothing matches, the content type's default instance and its synced instances receive
 * the item with their own settings.
 */
public class DefaultDecisionResolver implements DecisionResolver {

    private static final Logger log = LoggerFactory.getLogger(DefaultDecisionResolver.class);

    static final Comparator<RoutingDecision> PRECEDENCE = Comparator
            .comparingInt(RoutingDecision::priority).reversed()
            .thenComparing(RoutingDecision::ruleId, Comparator.nullsLast(Comparator.naturalOrder()))
            .thenComparingInt(RoutingDecision::instanceId);

    private final List<Stage> stages;
    private final InstanceRepository instances;
    private final ExecutorService executor;
    private final MetadataEnricher enricher;

    /**
     * @param executor Pool for running stages concurrently, or null to run them on the caller
     */
    public DefaultDecisionResolver(EvaluatorRegistry registry, List<? extends RouterPlugin> plugins,
                                   InstanceRepository instances, ExecutorService executor) {
        this(registry, plugins, instances, executor, null);
    }

    /**
     * @param executor Pool for running stages concurrently, or null to run them on the caller
     * @param enricher Looks up missing metadata once per resolution, or null to leave items as
     *                 given. When set, plugins that only perform a lookup are not run.
     */
    public DefaultDecisionResolver(EvaluatorRegistry registry, List<? extends RouterPlugin> plugins,
                                   InstanceRepository instances, ExecutorService executor,
                                   MetadataEnricher enricher) {
        List<Stage> all = new ArrayList<>();
        for (RoutingEvaluator evaluator : registry.evaluators()) {
            all.add(new Stage(evaluator.name(), evaluator.priority(), evaluator::canEvaluate, evaluator::evaluate));
        }
        for (RouterPlugin plugin : plugins) {
            if (enricher != null && plugin.performsLookup()) {
                log.debug("Skipping plugin {}: items are enriched before evaluation", plugin.name());
                continue;
            }
            all.add(new Stage(plugin.name(), plugin.priority(), (item, context) -> true, plugin::evaluateRouting));
        }
        all.sort(Comparator.comparingInt(Stage::priority).reversed());
        this.stages = List.copyOf(all);
        this.instances = instances;
        this.executor = executor;
        this.enricher = enricher;

        log.info("DecisionResolver initialized with stages {} ({}, {})", stages.stream().map(Stage::name).toList(),
                executor != null ? "parallel" : "sequential",
                enricher != null ? "metadata lookup" : "no metadata lookup");
    }

    @Override
    public ResolutionResult resolve(ContentItem given, RoutingContext context) {
        log.debug("Resolving routing for '{}' ({})", given.title(), context.contentType().value());
        ContentItem item = enricher != null ? enricher.enrich(given, context) : given;

        List<RoutingDecision> collected = new ArrayList<>();
        for (List<RoutingDecision> stageResult : runStages(item, context)) {
            collected.addAll(stageResult);
        }

        Map<Integer, Instance> enabled = enabledInstances(context);
        List<RoutingDecision> valid = new ArrayList<>();
        for (RoutingDecision decision : collected) {
            if (!enabled.containsKey(decision.instanceId())) {
                log.warn("Dropping decision from rule '{}': instance {} is not an enabled {} instance",
                        decision.ruleName(), decision.instanceId(), context.targetType().value());
            } else if (allowedBySyncTarget(decision, context)) {
                valid.add(decision);
            }
        }

        if (valid.isEmpty()) {
            return fallback(item, context, enabled);
        }

        List<RouterDecision> merged = merge(valid).stream().map(RouterDecision::route).toList();
        log.debug("Resolved '{}' to instances {}", item.title(),
                merged.stream().map(d -> d.routing().instanceId()).toList());
        return ResolutionResult.matched(merged);
    }

    /**
     * Keep the first decision per instance in precedence order.
     */
    static List<RoutingDecision> merge(List<RoutingDecision> decisions) {
        List<RoutingDecision> sorted = new ArrayList<>(decisions);
        sorted.sort(PRECEDENCE);
        Map<Integer, RoutingDecision> byInstance = new LinkedHashMap<>();
        for (RoutingDecision decision : sorted) {
            RoutingDecision kept = byInstance.putIfAbsent(decision.instanceId(), decision);
            if (kept != null) {
                log.debug("Instance {}: rule '{}' (priority {}) overrides rule '{}' (priority {})",
                        decision.instanceId(), kept.ruleName(), kept.priority(),
                        decision.ruleName(), decision.priority());
            }
        }
        return List.copyOf(byInstance.values());
    }

    private List<List<RoutingDecision>> runStages(ContentItem item, RoutingContext context) {
        if (executor == null) {
            return stages.stream().map(stage -> runStage(stage, item, context)).toList();
        }
        List<Callable<List<RoutingDecision>>> tasks = stages.stream()
                .<Callable<List<RoutingDecision>>>map(stage -> () -> runStage(stage, item, context))
                .toList();
        try {
            List<Future<List<RoutingDecision>>> futures = executor.invokeAll(tasks);
            List<List<RoutingDecision>> results = new ArrayList<>(futures.size());
            for (int i = 0; i < futures.size(); i++) {
                results.add(awaitStage(stages.get(i), futures.get(i)));
            }
            return results;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new RouterException("Interrupted while resolving routing for " + item.title(), e);
        }
    }

    private List<RoutingDecision> awaitStage(Stage stage, Future<List<RoutingDecision>> future)
            throws InterruptedException {
        try {
            return future.get();
        } catch (ExecutionException e) {
            log.error("Stage {} failed: {}", stage.name(), e.getCause().getMessage(), e.getCause());
            return List.of();
        }
    }

    private List<RoutingDecision> runStage(Stage stage, ContentItem item, RoutingContext context) {
        try {
            if (!stage.canEvaluate().test(item, context)) {
                return List.of();
            }
            List<RoutingDecision> result = stage.evaluate().apply(item, context);
            return result != null ? result : List.of();
        } catch (RuntimeException e) {
            log.error("Stage {} failed for '{}', continuing without it: {}", stage.name(), item.title(),
                    e.getMessage(), e);
            return List.of();
        }
    }

    private Map<Integer, Instance> enabledInstances(RoutingContext context) {
        Map<Integer, Instance> byId = new LinkedHashMap<>();
        for (Instance instance : instances.findEnabled(context.targetType())) {
            byId.put(instance.id(), instance);
        }
        return byId;
    }

    private static boolean allowedBySyncTarget(RoutingDecision decision, RoutingContext context) {
        return context.syncTargetInstanceId() == null || context.syncTargetInstanceId() == decision.instanceId();
    }

    private ResolutionResult fallback(ContentItem item, RoutingContext context, Map<Integer, Instance> enabled) {
        Optional<Instance> defaultInstance = instances.findDefault(context.targetType());
        if (defaultInstance.isEmpty()) {
            log.warn("No rule matched '{}' and no default {} instance is configured", item.title(),
                    context.targetType().value());
            return ResolutionResult.empty();
        }

        List<Instance> targets = new ArrayList<>();
        targets.add(defaultInstance.get());
        for (Integer syncedId : defaultInstance.get().syncedInstances()) {
            Instance synced = enabled.get(syncedId);
            if (synced != null && synced.id() != defaultInstance.get().id()) {
                targets.add(synced);
            }
        }

        List<RouterDecision> decisions = targets.stream()
                .map(instance -> instance.toDecision(RoutingDecision.DEFAULT_PRIORITY))
                .filter(decision -> allowedBySyncTarget(decision, context))
                .map(RouterDecision::route)
                .toList();
        log.info("No rule matched '{}', using default {} instance {} ({} target(s))", item.title(),
                context.targetType().value(), defaultInstance.get().id(), decisions.size());
        return ResolutionResult.fallback(decisions);
    }

    private record Stage(
            String name,
            int priority,
            BiPredicate<ContentItem, RoutingContext> canEvaluate,
            BiFunction<ContentItem, RoutingContext, List<RoutingDecision>> evaluate
    ) {
    }
}
