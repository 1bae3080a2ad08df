package com.pulsarr.acquisition;

import com.pulsarr.core.ContentItem;
import com.pulsarr.core.ContentType;
import com.pulsarr.core.RoutingContext;
import com.pulsarr.core.TargetType;
import com.pulsarr.decision.RoutingDecision;

import java.util.List;

/**
 * One "add to instance" call handed to the acquisition workflow.
 *
 * @param title       Item title
 * @param guids       Item GUIDs, used by the target to identify the item
 * @param contentType Movie or show
 * @param routing     Instance and add options
 * @param userId      Requesting user, null for unattributed and sync requests
 */
public record AcquisitionRequest(
        String title,
        List<String> guids,
        ContentType contentType,
        RoutingDecision routing,
        Integer userId
) {

    public AcquisitionRequest {
        guids = guids != null ? List.copyOf(guids) : List.of();
    }

    public static AcquisitionRequest of(ContentItem item, RoutingContext context, RoutingDecision routing) {
        return new AcquisitionRequest(item.title(), item.guids(), context.contentType(), routing,
                context.primaryUserId().orElse(null));
    }

    public TargetType targetType() {
        return contentType.targetType();
    }
}
