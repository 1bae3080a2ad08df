package com.pulsarr.plugin;

import com.pulsarr.core.ContentItem;
import com.pulsarr.evaluator.YearEvaluator;
import com.pulsarr.lookup.ContentLookupClient;
import com.pulsarr.rule.RouterRuleRepository;

/**
 * Year routing for items that arrive without a release year.
 */
public class YearRoutePlugin extends AbstractLookupPlugin {

    public YearRoutePlugin(YearEvaluator evaluator, RouterRuleRepository rules, ContentLookupClient lookupClient) {
        super(evaluator, rules, lookupClient);
    }

    @Override
    protected boolean hasField(ContentItem item) {
        return item.metadata() != null && item.metadata().year() != null;
    }
}
