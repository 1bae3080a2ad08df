package com.pulsarr.config;

import com.pulsarr.core.ContentType;
import com.pulsarr.core.TargetType;
import com.pulsarr.exception.ConfigurationException;
import com.pulsarr.instance.Instance;
import com.pulsarr.quota.QuotaType;
import com.pulsarr.quota.UserQuota;
import com.pulsarr.rule.RouterRule;
import com.pulsarr.rule.RuleFamily;
import com.pulsarr.user.RouterUser;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.io.ClassPathResource;
import org.springframework.core.io.FileSystemResource;
import org.springframework.core.io.Resource;
import org.yaml.snakeyaml.Yaml;

import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.function.Function;

/**
 * Loads router seed data from YAML files.
 * <p>
 * The document may be rooted at {@code pulsarr:} or hold the sections directly:
 * <pre>
 * pulsarr:
 *   users:     [{id, name, requires-approval}]
 *   instances: [{id, type, name, base-url, api-key, default, quality-profile, ...}]
 *   quotas:    [{user-id, content-type, quota-type, limit, bypass-approval}]
 *   rules:     [{name, type, target-type, target-instance-id, priority, criteria, ...}]
 * </pre>
 */
public class ConfigLoader {

    private static final Logger log = LoggerFactory.getLogger(ConfigLoader.class);

    /**
     * Load seed data from a path.
     * Supports classpath: prefix for classpath resources.
     *
     * @param path Path to the seed file
     * @return Parsed seed data
     */
    public static RouterSeedConfig load(String path) {
        log.info("Loading router seed data from: {}", path);

        try {
            Resource resource = getResource(path);
            try (InputStream inputStream = resource.getInputStream()) {
                return parseYaml(inputStream);
            }
        } catch (IOException e) {
            throw new ConfigurationException("Failed to load seed data from: " + path, e);
        }
    }

    private static Resource getResource(String path) {
        if (path.startsWith("classpath:")) {
            return new ClassPathResource(path.substring("classpath:".length()));
        }
        return new FileSystemResource(path);
    }

    @SuppressWarnings("unchecked")
    static RouterSeedConfig parseYaml(InputStream inputStream) {
        Map<String, Object> root = new Yaml().load(inputStream);
        if (root == null) {
            throw new ConfigurationException("Seed file is empty");
        }
        Map<String, Object> seed = root.containsKey("pulsarr")
                ? (Map<String, Object>) root.get("pulsarr")
                : root;

        List<RouterUser> users = parseList(seed, "users", ConfigLoader::parseUser);
        List<Instance> instances = parseList(seed, "instances", ConfigLoader::parseInstance);
        List<UserQuota> quotas = parseList(seed, "quotas", ConfigLoader::parseQuota);
        List<RouterRule> rules = parseList(seed, "rules", ConfigLoader::parseRule);

        for (TargetType type : TargetType.values()) {
            long defaults = instances.stream().filter(i -> i.type() == type && i.isDefault()).count();
            if (defaults > 1) {
                throw new ConfigurationException("At most one default " + type.value() + " instance is allowed");
            }
        }

        log.info("Loaded seed data: {} users, {} instances, {} quotas, {} rules",
                users.size(), instances.size(), quotas.size(), rules.size());
        return new RouterSeedConfig(users, instances, quotas, rules);
    }

    @SuppressWarnings("unchecked")
    private static <T> List<T> parseList(Map<String, Object> seed, String key,
                                         Function<Map<String, Object>, T> parser) {
        Object raw = seed.get(key);
        if (raw == null) {
            return List.of();
        }
        if (!(raw instanceof List<?> list)) {
            throw new ConfigurationException("Seed section '" + key + "' must be a list");
        }
        List<T> parsed = new ArrayList<>();
        for (Object entry : list) {
            if (!(entry instanceof Map<?, ?>)) {
                throw new ConfigurationException("Entries of '" + key + "' must be objects, got: " + entry);
            }
            parsed.add(parser.apply((Map<String, Object>) entry));
        }
        return parsed;
    }

    private static RouterUser parseUser(Map<String, Object> map) {
        int id = requireInt(map, "id", "user");
        return new RouterUser(id, getString(map, "name", "user-" + id),
                getBoolean(map, "requires-approval", false));
    }

    private static Instance parseInstance(Map<String, Object> map) {
        int id = requireInt(map, "id", "instance");
        TargetType type = parseEnum(map, "type", TargetType::fromValue, "instance " + id);
        return new Instance(
                id,
                type,
                getString(map, "name", type.value() + "-" + id),
                getString(map, "base-url", null),
                getString(map, "api-key", null),
                getBoolean(map, "enabled", true),
                getBoolean(map, "default", false),
                getString(map, "quality-profile", null),
                getString(map, "root-folder", null),
                getStrings(map, "tags"),
                getBoolean(map, "search-on-add", true),
                getString(map, "season-monitoring", null),
                getString(map, "series-type", null),
                getString(map, "minimum-availability", null),
                getInts(map, "synced-instances")
        );
    }

    private static UserQuota parseQuota(Map<String, Object> map) {
        int userId = requireInt(map, "user-id", "quota");
        return new UserQuota(
                userId,
                parseEnum(map, "content-type", ContentType::fromValue, "quota of user " + userId),
                parseEnum(map, "quota-type", QuotaType::fromValue, "quota of user " + userId),
                getInt(map, "limit", 10),
                getBoolean(map, "bypass-approval", false)
        );
    }

    @SuppressWarnings("unchecked")
    private static RouterRule parseRule(Map<String, Object> map) {
        String name = getString(map, "name", null);
        if (name == null || name.isBlank()) {
            throw new ConfigurationException("Every rule requires a name");
        }
        RuleFamily family = parseEnum(map, "type", RuleFamily::fromValue, "rule '" + name + "'");
        TargetType targetType = parseEnum(map, "target-type", TargetType::fromValue, "rule '" + name + "'");
        RouterRule.Builder builder = RouterRule.builder(name, family)
                .target(targetType, requireInt(map, "target-instance-id", "rule '" + name + "'"))
                .qualityProfile(getString(map, "quality-profile", null))
                .rootFolder(getString(map, "root-folder", null))
                .tags(getStrings(map, "tags"))
                .priority(getInt(map, "priority", 50))
                .enabled(getBoolean(map, "enabled", true))
                .seasonMonitoring(getString(map, "season-monitoring", null))
                .seriesType(getString(map, "series-type", null))
                .minimumAvailability(getString(map, "minimum-availability", null))
                .bypassUserQuotas(getBoolean(map, "bypass-user-quotas", false));
        if (map.containsKey("search-on-add")) {
            builder.searchOnAdd(getBoolean(map, "search-on-add", true));
        }
        if (getBoolean(map, "always-require-approval", false)) {
            builder.requireApproval(getString(map, "approval-reason", null));
        }

        Object criteria = map.get("criteria");
        if (criteria instanceof Map<?, ?> criteriaMap) {
            Map<String, Object> typed = (Map<String, Object>) criteriaMap;
            if (family == RuleFamily.CONDITIONAL) {
                if (!typed.containsKey("condition")) {
                    throw new ConfigurationException("Conditional rule '" + name + "' requires criteria.condition");
                }
                builder.condition(ConditionParser.parse(typed.get("condition")));
            } else {
                builder.criteria(typed);
            }
        } else if (criteria != null) {
            throw new ConfigurationException("Criteria of rule '" + name + "' must be an object");
        }
        return builder.build();
    }

    private static <E> E parseEnum(Map<String, Object> map, String key,
                                   Function<String, E> parser, String owner) {
        String value = getString(map, key, null);
        if (value == null) {
            throw new ConfigurationException("Missing '" + key + "' for " + owner);
        }
        try {
            return parser.apply(value);
        } catch (IllegalArgumentException e) {
            throw new ConfigurationException("Invalid '" + key + "' for " + owner + ": " + value, e);
        }
    }

    // Helper methods

    private static int requireInt(Map<String, Object> map, String key, String owner) {
        if (map.get(key) == null) {
            throw new ConfigurationException("Missing '" + key + "' for " + owner);
        }
        return getInt(map, key, 0);
    }

    private static String getString(Map<String, Object> map, String key, String defaultValue) {
        Object value = map.get(key);
        return value != null ? value.toString() : defaultValue;
    }

    private static int getInt(Map<String, Object> map, String key, int defaultValue) {
        Object value = map.get(key);
        if (value == null) return defaultValue;
        if (value instanceof Number) return ((Number) value).intValue();
        try {
            return Integer.parseInt(value.toString().trim());
        } catch (NumberFormatException e) {
            throw new ConfigurationException("'" + key + "' must be a number, got: " + value, e);
        }
    }

    private static boolean getBoolean(Map<String, Object> map, String key, boolean defaultValue) {
        Object value = map.get(key);
        if (value == null) return defaultValue;
        if (value instanceof Boolean) return (Boolean) value;
        return Boolean.parseBoolean(value.toString());
    }

    private static List<String> getStrings(Map<String, Object> map, String key) {
        Object value = map.get(key);
        if (value == null) return List.of();
        if (value instanceof List<?> list) {
            return list.stream().map(String::valueOf).toList();
        }
        return List.of(value.toString());
    }

    private static List<Integer> getInts(Map<String, Object> map, String key) {
        Object value = map.get(key);
        if (value == null) return List.of();
        if (!(value instanceof List<?> list)) {
            throw new ConfigurationException("'" + key + "' must be a list of ids");
        }
        List<Integer> ids = new ArrayList<>();
        for (Object id : list) {
            ids.add(id instanceof Number n ? n.intValue() : Integer.parseInt(id.toString().trim()));
        }
        return ids;
    }
}
