package com.pulsarr.plugin;

import com.pulsarr.core.ContentItem;
import com.pulsarr.evaluator.LanguageEvaluator;
import com.pulsarr.lookup.ContentLookupClient;
import com.pulsarr.rule.RouterRuleRepository;

/**
 * Language routing for items that arrive without an original language.
 */
public class LanguageRoutePlugin extends AbstractLookupPlugin {

    public LanguageRoutePlugin(LanguageEvaluator evaluator, RouterRuleRepository rules,
                               ContentLookupClient lookupClient) {
        super(evaluator, rules, lookupClient);
    }

    @Override
    protected boolean hasField(ContentItem item) {
        return item.metadata() != null
                && item.metadata().originalLanguage() != null
                && !item.metadata().originalLanguage().isBlank();
    }
}
