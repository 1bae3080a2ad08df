package com.pulsarr.rule;

import com.pulsarr.core.TargetType;

import java.util.List;
import java.util.Optional;

/**
 * Storage of router rules. The routing engine only reads; writes come from administration.
 */
public interface RouterRuleRepository {

    /**
     * Rules of one family ordered by priority descending, then id ascending.
     */
    List<RouterRule> findByFamily(RuleFamily family, boolean enabledOnly);

    /**
     * Whether any enabled rule of the family targets the given download-manager type.
     */
    boolean hasEnabledRules(RuleFamily family, TargetType targetType);

    Optional<RouterRule> findById(long id);

    List<RouterRule> findAll();

    RouterRule save(RouterRule rule);

    boolean delete(long id);
}
