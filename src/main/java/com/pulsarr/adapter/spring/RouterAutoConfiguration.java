package com.pulsarr.adapter.spring;

import com.pulsarr.acquisition.AcquisitionWorkflow;
import com.pulsarr.acquisition.LoggingAcquisitionWorkflow;
import com.pulsarr.approval.ApprovalGate;
import com.pulsarr.approval.ApprovalLifecycleManager;
import com.pulsarr.approval.ApprovalNotifier;
import com.pulsarr.approval.ApprovalRepository;
import com.pulsarr.approval.JdbcApprovalRepository;
import com.pulsarr.approval.LoggingApprovalNotifier;
import com.pulsarr.config.RouterSeedImporter;
import com.pulsarr.decision.RouterDecisionCodec;
import com.pulsarr.evaluator.EvaluatorRegistry;
import com.pulsarr.evaluator.LanguageEvaluator;
import com.pulsarr.evaluator.RuleValidator;
import com.pulsarr.evaluator.YearEvaluator;
import com.pulsarr.instance.InstanceRepository;
import com.pulsarr.instance.JdbcInstanceRepository;
import com.pulsarr.lookup.ArrLookupClient;
import com.pulsarr.lookup.ContentLookupClient;
import com.pulsarr.lookup.MetadataEnricher;
import com.pulsarr.plugin.LanguageRoutePlugin;
import com.pulsarr.plugin.RouterPlugin;
import com.pulsarr.plugin.YearRoutePlugin;
import com.pulsarr.quota.JdbcQuotaRepository;
import com.pulsarr.quota.QuotaRepository;
import com.pulsarr.quota.QuotaTracker;
import com.pulsarr.resolver.DecisionResolver;
import com.pulsarr.resolver.DefaultDecisionResolver;
import com.pulsarr.routing.ContentRouter;
import com.pulsarr.rule.JdbcRouterRuleRepository;
import com.pulsarr.rule.RouterRuleRepository;
import com.pulsarr.rule.RouterRuleService;
import com.pulsarr.user.JdbcUserRepository;
import com.pulsarr.user.UserRepository;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Clock;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Spring Boot auto-configuration for the content router.
 */
@Configuration
@ConditionalOnProperty(prefix = "pulsarr", name = "enabled", havingValue = "true", matchIfMissing = true)
@EnableConfigurationProperties(RouterProperties.class)
public class RouterAutoConfiguration {

    private static final Logger log = LoggerFactory.getLogger(RouterAutoConfiguration.class);

    private ExecutorService evaluationExecutor;

    @Bean
    @ConditionalOnMissingBean
    public Clock routerClock() {
        return Clock.systemDefaultZone();
    }

    @Bean
    @ConditionalOnMissingBean
    public RouterRuleRepository routerRuleRepository(NamedParameterJdbcTemplate jdbcTemplate, Clock clock) {
        return new JdbcRouterRuleRepository(jdbcTemplate, clock);
    }

    @Bean
    @ConditionalOnMissingBean
    public InstanceRepository instanceRepository(NamedParameterJdbcTemplate jdbcTemplate) {
        return new JdbcInstanceRepository(jdbcTemplate);
    }

    @Bean
    @ConditionalOnMissingBean
    public UserRepository userRepository(NamedParameterJdbcTemplate jdbcTemplate) {
        return new JdbcUserRepository(jdbcTemplate);
    }

    @Bean
    @ConditionalOnMissingBean
    public QuotaRepository quotaRepository(NamedParameterJdbcTemplate jdbcTemplate, Clock clock) {
        return new JdbcQuotaRepository(jdbcTemplate, clock);
    }

    @Bean
    @ConditionalOnMissingBean
    public RouterDecisionCodec routerDecisionCodec() {
        return new RouterDecisionCodec();
    }

    @Bean
    @ConditionalOnMissingBean
    public ApprovalRepository approvalRepository(NamedParameterJdbcTemplate jdbcTemplate, RouterDecisionCodec codec) {
        return new JdbcApprovalRepository(jdbcTemplate, codec);
    }

    @Bean
    @ConditionalOnMissingBean
    public EvaluatorRegistry evaluatorRegistry(RouterRuleRepository rules) {
        return EvaluatorRegistry.create(rules);
    }

    @Bean
    @ConditionalOnMissingBean
    public RouterRuleService routerRuleService(RouterRuleRepository rules, InstanceRepository instances,
                                               EvaluatorRegistry registry) {
        return new RouterRuleService(rules, instances, new RuleValidator(registry));
    }

    @Bean
    @ConditionalOnMissingBean
    public ContentLookupClient contentLookupClient(InstanceRepository instances, RouterProperties properties) {
        RouterProperties.Lookup lookup = properties.getLookup();
        log.info("Creating lookup client (connect timeout {}, read timeout {})",
                lookup.getConnectTimeout(), lookup.getReadTimeout());
        return new ArrLookupClient(ArrLookupClient.restTemplate(lookup.getConnectTimeout(), lookup.getReadTimeout()),
                instances);
    }

    @Bean
    @ConditionalOnProperty(prefix = "pulsarr.router", name = "lookup-plugins-enabled", havingValue = "true",
            matchIfMissing = true)
    public YearRoutePlugin yearRoutePlugin(RouterRuleRepository rules, ContentLookupClient lookupClient) {
        return new YearRoutePlugin(new YearEvaluator(rules), rules, lookupClient);
    }

    @Bean
    @ConditionalOnProperty(prefix = "pulsarr.router", name = "lookup-plugins-enabled", havingValue = "true",
            matchIfMissing = true)
    public LanguageRoutePlugin languageRoutePlugin(RouterRuleRepository rules, ContentLookupClient lookupClient) {
        return new LanguageRoutePlugin(new LanguageEvaluator(rules), rules, lookupClient);
    }

    @Bean
    @ConditionalOnMissingBean
    @ConditionalOnProperty(prefix = "pulsarr.router", name = "metadata-lookup-enabled", havingValue = "true",
            matchIfMissing = true)
    public MetadataEnricher metadataEnricher(ContentLookupClient lookupClient, RouterRuleRepository rules) {
        return new MetadataEnricher(lookupClient, rules);
    }

    @Bean
    @ConditionalOnMissingBean
    public DecisionResolver decisionResolver(EvaluatorRegistry registry, ObjectProvider<RouterPlugin> plugins,
                                             ObjectProvider<MetadataEnricher> enricher,
                                             InstanceRepository instances, RouterProperties properties) {
        RouterProperties.Router router = properties.getRouter();
        if (router.isParallelEvaluation()) {
            log.info("Creating evaluation pool with {} threads", router.getEvaluationThreads());
            this.evaluationExecutor = Executors.newFixedThreadPool(router.getEvaluationThreads(),
                    evaluationThreadFactory());
        }
        List<RouterPlugin> registered = plugins.orderedStream().toList();
        return new DefaultDecisionResolver(registry, registered, instances, evaluationExecutor,
                enricher.getIfAvailable());
    }

    @Bean
    @ConditionalOnMissingBean
    public QuotaTracker quotaTracker(QuotaRepository quotas, UserRepository users, Clock clock) {
        return new QuotaTracker(quotas, users, clock);
    }

    @Bean
    @ConditionalOnMissingBean
    public ApprovalNotifier approvalNotifier() {
        return new LoggingApprovalNotifier();
    }

    @Bean
    @ConditionalOnMissingBean
    public AcquisitionWorkflow acquisitionWorkflow() {
        return new LoggingAcquisitionWorkflow();
    }

    @Bean
    @ConditionalOnMissingBean
    public ApprovalGate approvalGate(ApprovalRepository approvals, QuotaTracker quotaTracker, UserRepository users,
                                     RouterRuleRepository rules, ApprovalNotifier notifier,
                                     TransactionTemplate transactionTemplate, Clock clock,
                                     RouterProperties properties) {
        return new ApprovalGate(approvals, quotaTracker, users, rules, notifier, transactionTemplate, clock,
                properties.getApproval().getDefaultExpiration());
    }

    @Bean
    @ConditionalOnMissingBean
    public ApprovalLifecycleManager approvalLifecycleManager(ApprovalRepository approvals,
                                                             AcquisitionWorkflow acquisition,
                                                             QuotaTracker quotaTracker, ApprovalNotifier notifier,
                                                             Clock clock) {
        return new ApprovalLifecycleManager(approvals, acquisition, quotaTracker, notifier, clock);
    }

    @Bean
    @ConditionalOnMissingBean
    public ContentRouter contentRouter(DecisionResolver resolver, ApprovalGate approvalGate,
                                       AcquisitionWorkflow acquisition, QuotaTracker quotaTracker) {
        return new ContentRouter(resolver, approvalGate, acquisition, quotaTracker);
    }

    @Bean
    @ConditionalOnMissingBean
    public ApprovalMaintenanceScheduler approvalMaintenanceScheduler(ApprovalLifecycleManager lifecycleManager,
                                                                     QuotaTracker quotaTracker,
                                                                     RouterProperties properties) {
        return new ApprovalMaintenanceScheduler(lifecycleManager, quotaTracker, properties);
    }

    @Bean
    @ConditionalOnMissingBean
    public RouterSeedImporter routerSeedImporter(UserRepository users, InstanceRepository instances,
                                                 QuotaTracker quotaTracker, RouterRuleRepository rules,
                                                 RouterRuleService ruleService, RouterProperties properties) {
        RouterSeedImporter importer = new RouterSeedImporter(users, instances, quotaTracker, rules, ruleService);
        String seedPath = properties.getSeedPath();
        if (seedPath != null && !seedPath.isBlank()) {
            importer.importSeed(seedPath);
        }
        return importer;
    }

    @PreDestroy
    public void shutdown() {
        if (evaluationExecutor != null && !evaluationExecutor.isShutdown()) {
            log.info("Shutting down evaluation pool");
            evaluationExecutor.shutdown();
            try {
                if (!evaluationExecutor.awaitTermination(5, TimeUnit.SECONDS)) {
                    evaluationExecutor.shutdownNow();
                }
            } catch (InterruptedException e) {
                evaluationExecutor.shutdownNow();
                Thread.currentThread().interrupt();
            }
        }
    }

    private static ThreadFactory evaluationThreadFactory() {
        AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, "router-eval-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }
}
