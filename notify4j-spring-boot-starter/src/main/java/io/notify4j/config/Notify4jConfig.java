package io.notify4j.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.notify4j.ChannelSender;
import io.notify4j.JobScheduler;
import io.notify4j.MembershipResolver;
import io.notify4j.NotificationDispatcher;
import io.notify4j.RuleEngine;
import io.notify4j.core.NotificationChannel;
import io.notify4j.internal.DefaultJobScheduler;
import io.notify4j.internal.DefaultRuleEngine;
import io.notify4j.internal.LedgerDispatcher;
import io.notify4j.internal.RecipientResolver;
import io.notify4j.internal.channel.LoggingEmailSender;
import io.notify4j.internal.channel.UnconfiguredPushSender;
import io.notify4j.internal.mongo.MongoAlertStore;
import io.notify4j.internal.mongo.MongoJobStore;
import io.notify4j.internal.mongo.MongoNotificationLedger;
import io.notify4j.internal.mongo.MongoPreferenceStore;
import io.notify4j.internal.mongo.MongoRuleStore;
import io.notify4j.spi.AlertStore;
import io.notify4j.spi.JobStore;
import io.notify4j.spi.NotificationLedger;
import io.notify4j.spi.PreferenceStore;
import io.notify4j.spi.RuleStore;
import io.notify4j.utils.TemplateRenderer;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.SmartInitializingSingleton;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.data.mongodb.MongoTransactionManager;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Clock;
import java.util.List;

/**
 * Spring Boot auto-configuration entrypoint for notify4j components.
 *
 * <p>The host application must provide a {@link MembershipResolver}; without one the engine beans are not created.
 * Email and push transports are picked from {@link ChannelSender} beans by their channel.
 */
@AutoConfiguration
@ConditionalOnClass({JobScheduler.class, MongoTemplate.class})
@EnableConfigurationProperties(Notify4jProperties.class)
@ConditionalOnProperty(prefix = "notify4j", name = "enabled", havingValue = "true", matchIfMissing = true)
public class Notify4jConfig {

    @Bean
    @ConditionalOnMissingBean
    public Clock notify4jClock() {
        return Clock.systemUTC();
    }

    @Bean
    @ConditionalOnMissingBean
    public TemplateRenderer templateRenderer(ObjectProvider<ObjectMapper> objectMapper) {
        return new TemplateRenderer(objectMapper.getIfAvailable(Notify4jConfig::fallbackObjectMapper));
    }

    @Bean
    @ConditionalOnMissingBean
    protected JobStore mongoJobStore(MongoTemplate mongoTemplate,
                                     ObjectProvider<ObjectMapper> objectMapper,
                                     ObjectProvider<MongoTransactionManager> transactionManager) {
        MongoTransactionManager tm = transactionManager.getIfAvailable();
        TransactionTemplate tx = tm == null ? null : new TransactionTemplate(tm);
        return new MongoJobStore(mongoTemplate, objectMapper.getIfAvailable(Notify4jConfig::fallbackObjectMapper), tx);
    }

    @Bean
    @ConditionalOnMissingBean
    protected RuleStore mongoRuleStore(MongoTemplate mongoTemplate, ObjectProvider<ObjectMapper> objectMapper) {
        return new MongoRuleStore(mongoTemplate, objectMapper.getIfAvailable(Notify4jConfig::fallbackObjectMapper));
    }

    @Bean
    @ConditionalOnMissingBean
    protected NotificationLedger mongoNotificationLedger(MongoTemplate mongoTemplate,
                                                         ObjectProvider<ObjectMapper> objectMapper,
                                                         Clock clock) {
        return new MongoNotificationLedger(mongoTemplate, objectMapper.getIfAvailable(Notify4jConfig::fallbackObjectMapper), clock);
    }

    @Bean
    @ConditionalOnMissingBean
    protected AlertStore mongoAlertStore(MongoTemplate mongoTemplate) {
        return new MongoAlertStore(mongoTemplate);
    }

    @Bean
    @ConditionalOnMissingBean
    protected PreferenceStore mongoPreferenceStore(MongoTemplate mongoTemplate) {
        return new MongoPreferenceStore(mongoTemplate);
    }

    @Bean
    @ConditionalOnMissingBean
    protected Notify4jMongoIndexConfig notify4jMongoIndexConfig(MongoTemplate mongoTemplate) {
        return new Notify4jMongoIndexConfig(mongoTemplate);
    }

    @Bean
    @ConditionalOnMissingBean
    public NotificationDispatcher notificationDispatcher(NotificationLedger ledger,
                                                         PreferenceStore preferences,
                                                         ObjectProvider<List<ChannelSender>> sendersProvider,
                                                         Clock clock) {
        List<ChannelSender> senders = sendersProvider.getIfAvailable(List::of);
        ChannelSender email = pick(senders, NotificationChannel.EMAIL, new LoggingEmailSender());
        ChannelSender push = pick(senders, NotificationChannel.PUSH, new UnconfiguredPushSender());
        return new LedgerDispatcher(ledger, preferences, email, push, clock);
    }

    @Bean
    @ConditionalOnMissingBean
    @ConditionalOnBean(MembershipResolver.class)
    public RecipientResolver recipientResolver(MembershipResolver membershipResolver) {
        return new RecipientResolver(membershipResolver);
    }

    @Bean
    @ConditionalOnMissingBean
    @ConditionalOnBean(MembershipResolver.class)
    public RuleEngine ruleEngine(RuleStore rules,
                                 AlertStore alerts,
                                 NotificationDispatcher dispatcher,
                                 RecipientResolver recipientResolver,
                                 TemplateRenderer renderer,
                                 Clock clock) {
        return new DefaultRuleEngine(rules, alerts, dispatcher, recipientResolver, renderer, clock);
    }

    @Bean
    @ConditionalOnMissingBean
    @ConditionalOnBean(MembershipResolver.class)
    public JobScheduler jobScheduler(JobStore jobs,
                                     NotificationDispatcher dispatcher,
                                     RuleEngine ruleEngine,
                                     RecipientResolver recipientResolver,
                                     TemplateRenderer renderer,
                                     Notify4jProperties props,
                                     Clock clock) {
        return new DefaultJobScheduler(jobs, dispatcher, ruleEngine, recipientResolver, renderer,
                props.toSchedulerOptions(), clock);
    }

    @Bean
    @ConditionalOnMissingBean
    @ConditionalOnBean(JobScheduler.class)
    @ConditionalOnProperty(prefix = "notify4j", name = "scheduler-enabled", havingValue = "true", matchIfMissing = true)
    public SchedulerLifecycle schedulerLifecycle(JobScheduler jobScheduler, Notify4jProperties props) {
        return new SchedulerLifecycle(jobScheduler, props.getProcessEvery());
    }

    @Bean
    @ConditionalOnProperty(prefix = "notify4j", name = "ensure-indexes-on-startup", havingValue = "true")
    public SmartInitializingSingleton notify4jIndexesInitializer(Notify4jMongoIndexConfig indexConfig) {
        return indexConfig::ensureIndexes;
    }

    private static ObjectMapper fallbackObjectMapper() {
        return new ObjectMapper().findAndRegisterModules();
    }

    private static ChannelSender pick(List<ChannelSender> senders, NotificationChannel channel, ChannelSender fallback) {
        for (ChannelSender s : senders) {
            if (s.channel() == channel) {
                return s;
            }
        }
        return fallback;
    }
}
