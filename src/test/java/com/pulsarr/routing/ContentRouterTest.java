package com.pulsarr.routing;

import com.pulsarr.approval.ApprovalGate;
import com.pulsarr.approval.ApprovalLifecycleManager;
import com.pulsarr.core.ContentItem;
import com.pulsarr.core.ContentType;
import com.pulsarr.core.RoutingContext;
import com.pulsarr.core.TargetType;
import com.pulsarr.decision.DecisionAction;
import com.pulsarr.evaluator.EvaluatorRegistry;
import com.pulsarr.exception.RouterException;
import com.pulsarr.instance.Instance;
import com.pulsarr.quota.QuotaTracker;
import com.pulsarr.resolver.DefaultDecisionResolver;
import com.pulsarr.rule.RouterRule;
import com.pulsarr.rule.RuleFamily;
import com.pulsarr.support.MutableClock;
import com.pulsarr.support.RecordingAcquisitionWorkflow;
import com.pulsarr.support.RecordingApprovalNotifier;
import com.pulsarr.support.TestDatabase;
import com.pulsarr.user.RouterUser;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ContentRouterTest {

    private TestDatabase db;
    private RecordingAcquisitionWorkflow acquisition;
    private ApprovalLifecycleManager lifecycle;
    private ContentRouter router;

    private final ContentItem heat = ContentItem.builder().title("Heat").guid("tmdb:949").genre("Action").build();

    @BeforeEach
    void setUp() {
        MutableClock clock = MutableClock.at("2024-03-15T10:00:00Z");
        db = new TestDatabase(clock);
        db.user(1, "alice");
        db.users.save(new RouterUser(2, "bob", true));
        db.instance(Instance.of(1, TargetType.RADARR, "Main", true));
        db.instance(Instance.of(2, TargetType.RADARR, "Action", false));
        db.instance(Instance.of(3, TargetType.RADARR, "Mirror", false));

        acquisition = new RecordingAcquisitionWorkflow();
        RecordingApprovalNotifier notifier = new RecordingApprovalNotifier();
        QuotaTracker quotaTracker = new QuotaTracker(db.quotas, db.users, clock);
        DefaultDecisionResolver resolver = new DefaultDecisionResolver(EvaluatorRegistry.create(db.rules), List.of(),
                db.instances, null);
        ApprovalGate gate = new ApprovalGate(db.approvals, quotaTracker, db.users, db.rules, notifier,
                db.transactionTemplate, clock, Duration.ofHours(72));
        lifecycle = new ApprovalLifecycleManager(db.approvals, acquisition, quotaTracker, notifier, clock);
        router = new ContentRouter(resolver, gate, acquisition, quotaTracker);
    }

    @AfterEach
    void tearDown() {
        db.close();
    }

    private void actionRule(int instanceId) {
        db.rules.save(RouterRule.builder("Action " + instanceId, RuleFamily.GENRE).target(TargetType.RADARR, instanceId)
                .criterion("genre", "Action").build());
    }

    private static RoutingContext requestedBy(int userId, String name) {
        return RoutingContext.builder(ContentType.MOVIE).user(userId, name).build();
    }

    @Test
    @DisplayName("Should add the item to the matched instance and record one usage")
    void routesAndRecordsUsage() {
        actionRule(2);

        RoutingOutcome outcome = router.route(heat, requestedBy(1, "alice"));

        assertEquals(RoutingOutcome.Status.ROUTED, outcome.status());
        assertEquals(List.of(2), outcome.acquiredInstances());
        assertFalse(outcome.fallback());
        assertEquals(1, acquisition.requests().size());
        assertEquals(Integer.valueOf(1), acquisition.requests().get(0).userId());
        assertEquals(1, db.count("quota_usage"));
    }

    @Test
    @DisplayName("Should use the default instance when no rule matches")
    void fallback() {
        RoutingOutcome outcome = router.route(heat, requestedBy(1, "alice"));

        assertTrue(outcome.fallback());
        assertEquals(List.of(1), outcome.acquiredInstances());
    }

    @Test
    @DisplayName("Should not record usage for sync jobs")
    void syncRecordsNoUsage() {
        actionRule(2);
        RoutingContext sync = RoutingContext.builder(ContentType.MOVIE).user(1, "alice").syncing(true).build();

        assertEquals(RoutingOutcome.Status.ROUTED, router.route(heat, sync).status());
        assertEquals(0, db.count("quota_usage"));
    }

    @Test
    @DisplayName("Should report partial failures and still count the request once")
    void partialFailure() {
        actionRule(2);
        actionRule(3);
        acquisition.failFor(3);

        RoutingOutcome outcome = router.route(heat, requestedBy(1, "alice"));

        assertEquals(List.of(2), outcome.acquiredInstances());
        assertEquals(List.of(3), outcome.failedInstances());
        assertEquals(1, db.count("quota_usage"));
    }

    @Test
    @DisplayName("Should throw when every add call fails")
    void allFail() {
        actionRule(2);
        acquisition.failFor(2);

        assertThrows(RouterException.class, () -> router.route(heat, requestedBy(1, "alice")));
        assertEquals(0, db.count("quota_usage"));
    }

    @Test
    @DisplayName("Should hold, then replay once approved without counting twice")
    void holdApproveReplay() {
        actionRule(2);

        RoutingOutcome held = router.route(heat, requestedBy(2, "bob"));
        assertEquals(RoutingOutcome.Status.PENDING_APPROVAL, held.status());
        assertTrue(acquisition.requests().isEmpty());
        RoutingOutcome again = router.route(heat, requestedBy(2, "bob"));
        assertEquals(RoutingOutcome.Status.ALREADY_PENDING, again.status());
        assertEquals(DecisionAction.REQUIRE_APPROVAL, again.decisions().get(0).action());
        assertEquals(held.approvalRequest().id(), again.approvalRequest().id());

        assertTrue(lifecycle.approve(held.approvalRequest().id(), 1, null).transitioned());
        assertEquals(1, db.count("quota_usage"));

        RoutingOutcome replayed = router.route(heat, requestedBy(2, "bob"));
        assertEquals(RoutingOutcome.Status.ROUTED, replayed.status());
        assertEquals(List.of(2), replayed.acquiredInstances());
        assertEquals(2, acquisition.requests().size());
        assertEquals(1, db.count("quota_usage"));
    }

    @Test
    @DisplayName("Should report a rejected item")
    void rejected() {
        RoutingOutcome held = router.route(heat, requestedBy(2, "bob"));
        lifecycle.reject(held.approvalRequest().id(), 1, "no");

        assertEquals(RoutingOutcome.Status.REJECTED, router.route(heat, requestedBy(2, "bob")).status());
    }

    @Test
    @DisplayName("Should report no target when nothing matches and no default exists")
    void noTarget() {
        ContentItem show = ContentItem.builder().title("Lost").guid("tvdb:73739").build();

        RoutingOutcome outcome = router.route(show, RoutingContext.builder(ContentType.SHOW).build());

        assertEquals(RoutingOutcome.Status.NO_TARGET, outcome.status());
        assertTrue(acquisition.requests().isEmpty());
    }
}
