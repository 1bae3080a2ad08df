package com.pulsarr.rule;

import com.pulsarr.evaluator.RuleValidator;
import com.pulsarr.exception.ReferentialIntegrityException;
import com.pulsarr.instance.Instance;
import com.pulsarr.instance.InstanceRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Administrative writes to router rules. Rules are validated and their target instance checked
 * here, once, so the routing engine can read them without re-validating.
 */
public class RouterRuleService {

    private static final Logger log = LoggerFactory.getLogger(RouterRuleService.class);

    private final RouterRuleRepository repository;
    private final InstanceRepository instances;
    private final RuleValidator validator;

    public RouterRuleService(RouterRuleRepository repository, InstanceRepository instances, RuleValidator validator) {
        this.repository = repository;
        this.instances = instances;
        this.validator = validator;
    }

    public RouterRule save(RouterRule rule) {
        validator.validate(rule);
        Instance target = instances.findById(rule.targetInstanceId())
                .orElseThrow(() -> new ReferentialIntegrityException(
                        "Rule '" + rule.name() + "' targets unknown instance " + rule.targetInstanceId()));
        if (target.type() != rule.targetType()) {
            throw new ReferentialIntegrityException("Rule '" + rule.name() + "' targets " + rule.targetType().value()
                    + " but instance " + target.id() + " is " + target.type().value());
        }
        RouterRule saved = repository.save(rule);
        log.info("Saved {} rule '{}' (id {}) -> instance {}", saved.type().value(), saved.name(), saved.id(),
                saved.targetInstanceId());
        return saved;
    }

    public List<RouterRule> saveAll(List<RouterRule> rules) {
        return rules.stream().map(this::save).toList();
    }

    public boolean delete(long id) {
        boolean deleted = repository.delete(id);
        if (deleted) {
            log.info("Deleted rule {}", id);
        }
        return deleted;
    }
}
