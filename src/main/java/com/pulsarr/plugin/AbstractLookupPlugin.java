package com.pulsarr.plugin;

import com.pulsarr.core.ContentItem;
import com.pulsarr.core.ContentMetadata;
import com.pulsarr.core.ContentType;
import com.pulsarr.core.RoutingContext;
import com.pulsarr.decision.RoutingDecision;
import com.pulsarr.evaluator.RoutingEvaluator;
import com.pulsarr.lookup.ContentLookupClient;
import com.pulsarr.rule.RouterRuleRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Optional;

/**
 * Looks up an item's metadata by GUID and matches its family's rules on the enriched copy.
 * <p>
 * Runs only for items whose own metadata lacks the field (the plain evaluator handles the
 * rest), and only after confirming that enabled rules of the family exist for the content
 * type, so no network call is made when nothing could match. A resolver that enriches items
 * itself skips these plugins.
 */
public abstract class AbstractLookupPlugin implements RouterPlugin {

    private static final Logger log = LoggerFactory.getLogger(AbstractLookupPlugin.class);

    private final RoutingEvaluator evaluator;
    private final RouterRuleRepository rules;
    private final ContentLookupClient lookupClient;

    protected AbstractLookupPlugin(RoutingEvaluator evaluator, RouterRuleRepository rules,
                                   ContentLookupClient lookupClient) {
        this.evaluator = evaluator;
        this.rules = rules;
        this.lookupClient = lookupClient;
    }

    @Override
    public String name() {
        return evaluator.name() + "-lookup";
    }

    @Override
    public int priority() {
        return evaluator.priority();
    }

    @Override
    public boolean performsLookup() {
        return true;
    }

    /**
     * Whether the item already carries the value this plugin would look up.
     */
    protected abstract boolean hasField(ContentItem item);

    @Override
    public List<RoutingDecision> evaluateRouting(ContentItem item, RoutingContext context) {
        if (hasField(item)) {
            return null;
        }
        try {
            if (!rules.hasEnabledRules(evaluator.family(), context.targetType())) {
                return null;
            }
        } catch (RuntimeException e) {
            log.error("{}: cannot check for {} rules: {}", name(), evaluator.family().value(), e.getMessage());
            return null;
        }

        Optional<ContentMetadata> metadata = lookup(item, context.contentType());
        if (metadata.isEmpty()) {
            log.warn("{}: no metadata for '{}', skipping", name(), item.title());
            return null;
        }

        ContentItem enriched = item.withMetadata(metadata.get());
        if (!hasField(enriched)) {
            log.debug("{}: lookup for '{}' did not provide the field", name(), item.title());
            return null;
        }
        return evaluator.evaluate(enriched, context);
    }

    private Optional<ContentMetadata> lookup(ContentItem item, ContentType contentType) {
        try {
            return lookupClient.lookup(item, contentType);
        } catch (RuntimeException e) {
            log.error("{}: lookup for '{}' failed: {}", name(), item.title(), e.getMessage());
            return Optional.empty();
        }
    }
}
