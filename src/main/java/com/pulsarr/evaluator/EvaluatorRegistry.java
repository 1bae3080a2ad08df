package com.pulsarr.evaluator;

import com.pulsarr.condition.ConditionInterpreter;
import com.pulsarr.condition.DefaultConditionInterpreter;
import com.pulsarr.exception.ConfigurationException;
import com.pulsarr.rule.RouterRuleRepository;
import com.pulsarr.rule.RuleFamily;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Fixed table of evaluators keyed by family and ordered by descending priority.
 */
public class EvaluatorRegistry {

    private static final Logger log = LoggerFactory.getLogger(EvaluatorRegistry.class);

    private final List<RoutingEvaluator> ordered;
    private final Map<RuleFamily, RoutingEvaluator> byFamily = new EnumMap<>(RuleFamily.class);

    public EvaluatorRegistry(List<? extends RoutingEvaluator> evaluators) {
        List<RoutingEvaluator> sorted = new ArrayList<>(evaluators);
        sorted.sort(Comparator.comparingInt(RoutingEvaluator::priority).reversed()
                .thenComparing(RoutingEvaluator::family));
        for (RoutingEvaluator evaluator : sorted) {
            if (byFamily.putIfAbsent(evaluator.family(), evaluator) != null) {
                throw new ConfigurationException("Duplicate evaluator for family: " + evaluator.family().value());
            }
        }
        this.ordered = List.copyOf(sorted);
        log.info("Evaluator registry initialized: {}", ordered.stream()
                .map(e -> e.name() + "(" + e.priority() + ")").toList());
    }

    /**
     * Standard evaluators over a rule repository, with the conditional evaluator interpreting
     * trees through the field evaluators.
     */
    public static EvaluatorRegistry create(RouterRuleRepository rules) {
        List<RoutingEvaluator> fieldEvaluators = List.of(
                new GenreEvaluator(rules),
                new UserEvaluator(rules),
                new YearEvaluator(rules),
                new SeasonEvaluator(rules),
                new LanguageEvaluator(rules),
                new CertificationEvaluator(rules)
        );
        ConditionInterpreter interpreter = new DefaultConditionInterpreter(fieldEvaluators);
        List<RoutingEvaluator> all = new ArrayList<>(fieldEvaluators);
        all.add(new ConditionalEvaluator(rules, interpreter));
        return new EvaluatorRegistry(all);
    }

    /**
     * Evaluators in descending priority.
     */
    public List<RoutingEvaluator> evaluators() {
        return ordered;
    }

    public Optional<RoutingEvaluator> find(RuleFamily family) {
        return Optional.ofNullable(byFamily.get(family));
    }

    /**
     * Highest-priority evaluator claiming a condition field.
     */
    public Optional<RoutingEvaluator> forField(String field) {
        return ordered.stream().filter(e -> e.canEvaluateConditionField(field)).findFirst();
    }

    public List<EvaluatorMetadata> metadata() {
        return ordered.stream().map(RoutingEvaluator::metadata).toList();
    }
}
