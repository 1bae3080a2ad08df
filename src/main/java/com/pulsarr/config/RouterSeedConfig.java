package com.pulsarr.config;

import com.pulsarr.instance.Instance;
import com.pulsarr.quota.UserQuota;
import com.pulsarr.rule.RouterRule;
import com.pulsarr.user.RouterUser;

import java.util.List;

/**
 * Users, instances, quotas and rules read from a seed file.
 */
public record RouterSeedConfig(
        List<RouterUser> users,
        List<Instance> instances,
        List<UserQuota> quotas,
        List<RouterRule> rules
) {

    public RouterSeedConfig {
        users = users != null ? List.copyOf(users) : List.of();
        instances = instances != null ? List.copyOf(instances) : List.of();
        quotas = quotas != null ? List.copyOf(quotas) : List.of();
        rules = rules != null ? List.copyOf(rules) : List.of();
    }

    public static RouterSeedConfig empty() {
        return new RouterSeedConfig(List.of(), List.of(), List.of(), List.of());
    }
}
