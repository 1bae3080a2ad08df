package com.pulsarr.evaluator;

import com.pulsarr.condition.Condition;
import com.pulsarr.condition.ConditionOperator;
import com.pulsarr.core.ContentItem;
import com.pulsarr.core.RoutingContext;
import com.pulsarr.exception.ConfigurationException;
import com.pulsarr.rule.RouterRule;
import com.pulsarr.rule.RouterRuleRepository;
import com.pulsarr.rule.RuleFamily;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Routes by requesting user. {@code userId} conditions match numeric ids, {@code userName}
 * conditions match names and {@code user} conditions match either; when an item is attributed
 * to several users, any of them can match.
 */
public class UserEvaluator extends AbstractRuleEvaluator {

    public static final int PRIORITY = 75;

    private static final List<FieldInfo> FIELDS = List.of(
            new FieldInfo("user", "Requesting user id or name", List.of("number", "string", "array")),
            new FieldInfo("userId", "Requesting user id", List.of("number", "number[]")),
            new FieldInfo("userName", "Requesting user name", List.of("string", "string[]"))
    );

    private static final List<OperatorInfo> OPERATORS = List.of(
            new OperatorInfo(ConditionOperator.EQUALS, "User is", "number | string"),
            new OperatorInfo(ConditionOperator.NOT_EQUALS, "User is not", "number | string"),
            new OperatorInfo(ConditionOperator.IN, "User is one of", "array"),
            new OperatorInfo(ConditionOperator.NOT_IN, "User is none of", "array"),
            new OperatorInfo(ConditionOperator.REGEX, "User name matches the pattern", "string")
    );

    private static final Map<String, List<OperatorInfo>> OPERATORS_BY_FIELD = sameOperators(FIELDS, OPERATORS);

    public UserEvaluator(RouterRuleRepository rules) {
        super(RuleFamily.USER, PRIORITY, rules);
    }

    @Override
    public String description() {
        return "Routes content based on who requested it";
    }

    @Override
    public boolean canEvaluate(ContentItem item, RoutingContext context) {
        return context.hasUser();
    }

    /**
     * Accepts {@code {users: {ids: [...], names: [...]}}}, {@code {users: [...]}} or
     * {@code {user: value, operator?}}. Listed ids only match user ids and listed names only
     * match user names.
     */
    @Override
    protected boolean matchesRule(RouterRule rule, ContentItem item, RoutingContext context) {
        for (Condition condition : criteriaConditions(rule.criteria())) {
            if (evaluateCondition(condition, item, context)) {
                return true;
            }
        }
        return false;
    }

    @Override
    public void validateCriteria(Map<String, Object> criteria) {
        for (Condition condition : criteriaConditions(criteria)) {
            validateCondition(condition);
        }
    }

    private List<Condition> criteriaConditions(Map<String, Object> criteria) {
        if (!(criteria.get("users") instanceof Map<?, ?> users)) {
            return List.of(criteriaCondition(criteria));
        }
        List<Condition> conditions = new ArrayList<>();
        List<String> ids = Values.toStrings(users.get("ids"));
        if (!ids.isEmpty()) {
            conditions.add(new Condition("userId", ConditionOperator.IN.value(), ids, false));
        }
        List<String> names = Values.toStrings(users.get("names"));
        if (!names.isEmpty()) {
            conditions.add(new Condition("userName", ConditionOperator.IN.value(), names, false));
        }
        if (conditions.isEmpty()) {
            throw new ConfigurationException("User rule criteria list no ids or names");
        }
        return conditions;
    }

    @Override
    protected Condition criteriaCondition(Map<String, Object> criteria) {
        Object users = criteria.get("users");
        if (users instanceof Map<?, ?>) {
            throw new ConfigurationException("User id and name lists are matched as separate conditions");
        }
        Object user = users != null ? users : criteria.get("user");
        if (user == null) {
            throw new ConfigurationException("User rule criteria require 'users' or 'user'");
        }
        String defaultOperator = user instanceof List<?>
                ? ConditionOperator.IN.value() : ConditionOperator.EQUALS.value();
        return new Condition("user", criteriaOperator(criteria, defaultOperator), user, false);
    }

    @Override
    protected boolean matches(ConditionOperator operator, Object value, ContentItem item, RoutingContext context) {
        return matches("user", operator, value, item, context);
    }

    /**
     * {@code userId} compares ids, {@code userName} compares names and {@code user} accepts either.
     */
    @Override
    protected boolean matches(String field, ConditionOperator operator, Object value, ContentItem item,
                              RoutingContext context) {
        if (!context.hasUser()) {
            return false;
        }
        List<String> candidates = candidates(field, context);
        return switch (operator) {
            case EQUALS, IN -> anyMatches(Values.toNormalizedSet(value), candidates);
            case NOT_EQUALS, NOT_IN -> !anyMatches(Values.toNormalizedSet(value), candidates);
            case REGEX -> {
                Pattern pattern = RegexSafety.compile(String.valueOf(value)).orElse(null);
                List<String> subjects = "userId".equals(field) ? candidates : context.userNames();
                yield pattern != null && subjects.stream().anyMatch(subject -> RegexSafety.find(pattern, subject));
            }
            default -> false;
        };
    }

    private static List<String> candidates(String field, RoutingContext context) {
        List<String> ids = context.userIds().stream().map(String::valueOf).toList();
        if ("userId".equals(field)) {
            return ids;
        }
        if ("userName".equals(field)) {
            return context.userNames();
        }
        List<String> all = new ArrayList<>(ids);
        all.addAll(context.userNames());
        return all;
    }

    private static boolean anyMatches(Set<String> expected, List<String> candidates) {
        for (String candidate : candidates) {
            if (expected.contains(Values.normalize(candidate))) {
                return true;
            }
        }
        return false;
    }

    @Override
    protected void validateValue(ConditionOperator operator, Object value) {
        if (operator != ConditionOperator.REGEX && Values.toNormalizedSet(value).isEmpty()) {
            throw new ConfigurationException("User condition requires at least one user");
        }
    }

    @Override
    public List<FieldInfo> supportedFields() {
        return FIELDS;
    }

    @Override
    public Map<String, List<OperatorInfo>> supportedOperators() {
        return OPERATORS_BY_FIELD;
    }
}
