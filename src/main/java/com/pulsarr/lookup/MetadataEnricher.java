package com.pulsarr.lookup;

import com.pulsarr.core.ContentItem;
import com.pulsarr.core.ContentMetadata;
import com.pulsarr.core.ContentType;
import com.pulsarr.core.RoutingContext;
import com.pulsarr.core.TargetType;
import com.pulsarr.rule.RouterRuleRepository;
import com.pulsarr.rule.RuleFamily;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Optional;

/**
 * Fills an item's missing metadata with one lookup before routing, so every evaluator and
 * every condition tree sees the same enriched item.
 * <p>
 * The lookup is skipped when the item already carries all metadata, or when no enabled rule
 * of a metadata-reading family exists for the target type. Failures leave the item unchanged.
 */
public class MetadataEnricher {

    private static final Logger log = LoggerFactory.getLogger(MetadataEnricher.class);

    static final List<RuleFamily> METADATA_FAMILIES = List.of(
            RuleFamily.CONDITIONAL, RuleFamily.YEAR, RuleFamily.SEASON, RuleFamily.LANGUAGE,
            RuleFamily.CERTIFICATION);

    private final ContentLookupClient lookupClient;
    private final RouterRuleRepository rules;

    public MetadataEnricher(ContentLookupClient lookupClient, RouterRuleRepository rules) {
        this.lookupClient = lookupClient;
        this.rules = rules;
    }

    /**
     * @return the item with missing metadata filled in, or the item itself when nothing was looked up
     */
    public ContentItem enrich(ContentItem item, RoutingContext context) {
        if (isComplete(item, context.contentType())) {
            return item;
        }
        if (!metadataRulesExist(context.targetType())) {
            return item;
        }

        Optional<ContentMetadata> metadata;
        try {
            metadata = lookupClient.lookup(item, context.contentType());
        } catch (RuntimeException e) {
            log.error("Metadata lookup for '{}' failed: {}", item.title(), e.getMessage());
            return item;
        }
        if (metadata.isEmpty()) {
            log.debug("No metadata found for '{}', routing without it", item.title());
            return item;
        }
        log.debug("Enriched '{}' with {}", item.title(), metadata.get());
        return item.withMetadata(metadata.get());
    }

    private boolean metadataRulesExist(TargetType targetType) {
        try {
            for (RuleFamily family : METADATA_FAMILIES) {
                if (rules.hasEnabledRules(family, targetType)) {
                    return true;
                }
            }
            return false;
        } catch (RuntimeException e) {
            log.error("Cannot check for metadata rules, skipping lookup: {}", e.getMessage());
            return false;
        }
    }

    private static boolean isComplete(ContentItem item, ContentType contentType) {
        ContentMetadata metadata = item.metadata();
        if (metadata == null) {
            return false;
        }
        boolean seasonsKnown = contentType == ContentType.MOVIE || !metadata.seasons().isEmpty();
        return metadata.year() != null
                && metadata.originalLanguage() != null && !metadata.originalLanguage().isBlank()
                && metadata.certification() != null
                && seasonsKnown;
    }
}
