package com.pulsarr.config;

import com.pulsarr.instance.Instance;
import com.pulsarr.instance.InstanceRepository;
import com.pulsarr.quota.QuotaTracker;
import com.pulsarr.quota.UserQuota;
import com.pulsarr.rule.RouterRule;
import com.pulsarr.rule.RouterRuleRepository;
import com.pulsarr.rule.RouterRuleService;
import com.pulsarr.user.RouterUser;
import com.pulsarr.user.UserRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.HashSet;
import java.util.Set;

/**
 * Writes seed data into storage. Users, instances and quotas are upserted; rules are added
 * unless a rule with the same family and name already exists, so re-importing on every
 * start is safe.
 */
public class RouterSeedImporter {

    private static final Logger log = LoggerFactory.getLogger(RouterSeedImporter.class);

    private final UserRepository users;
    private final InstanceRepository instances;
    private final QuotaTracker quotaTracker;
    private final RouterRuleRepository rules;
    private final RouterRuleService ruleService;

    public RouterSeedImporter(UserRepository users, InstanceRepository instances, QuotaTracker quotaTracker,
                              RouterRuleRepository rules, RouterRuleService ruleService) {
        this.users = users;
        this.instances = instances;
        this.quotaTracker = quotaTracker;
        this.rules = rules;
        this.ruleService = ruleService;
    }

    /**
     * @return number of rules added
     */
    public int importSeed(RouterSeedConfig seed) {
        for (RouterUser user : seed.users()) {
            users.save(user);
        }
        for (Instance instance : seed.instances()) {
            instances.save(instance);
        }
        for (UserQuota quota : seed.quotas()) {
            quotaTracker.setQuota(quota);
        }

        Set<String> existing = new HashSet<>();
        for (RouterRule rule : rules.findAll()) {
            existing.add(ruleKey(rule));
        }
        int added = 0;
        for (RouterRule rule : seed.rules()) {
            if (!existing.add(ruleKey(rule))) {
                log.debug("Rule '{}' already present, skipping", rule.name());
                continue;
            }
            ruleService.save(rule);
            added++;
        }
        log.info("Imported seed data: {} users, {} instances, {} quotas, {} new rules",
                seed.users().size(), seed.instances().size(), seed.quotas().size(), added);
        return added;
    }

    public int importSeed(String path) {
        return importSeed(ConfigLoader.load(path));
    }

    private static String ruleKey(RouterRule rule) {
        return rule.type().value() + ":" + rule.name();
    }
}
