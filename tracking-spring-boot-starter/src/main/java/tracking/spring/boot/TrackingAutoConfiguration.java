package tracking.spring.boot;

import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.jdbc.DataSourceAutoConfiguration;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import tracking.TrackingEngine;
import tracking.TrackingListener;
import tracking.automation.InMemoryRuleRepository;
import tracking.automation.RuleRepository;
import tracking.dispatch.ExponentialBackoffRetryPolicy;
import tracking.jdbc.store.JdbcTrackingStores;
import tracking.model.AutomationRule;
import tracking.registry.ClasspathOccurrenceCodeSource;
import tracking.registry.OccurrenceCodeSource;
import tracking.spi.MetricsExporter;
import tracking.spi.NotificationSender;
import tracking.spi.WebhookClient;
import tracking.timeline.TimelineBuilder;

import javax.sql.DataSource;
import java.io.IOException;
import java.sql.SQLException;
import java.time.Duration;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Auto-configuration for the tracking engine.
 *
 * <p>Wires a {@link TrackingEngine} from a {@link DataSource} and {@link TrackingProperties}.
 * The dialect is detected from the connection URL. {@link AutomationRule} beans are
 * registered with the default in-memory rule repository; {@link NotificationSender},
 * {@link WebhookClient}, {@link TrackingListener} and {@link MetricsExporter} beans are
 * picked up when present.
 *
 * @see TrackingProperties
 * @see TrackingMicrometerAutoConfiguration
 */
@AutoConfiguration(after = DataSourceAutoConfiguration.class)
@ConditionalOnClass(TrackingEngine.class)
@ConditionalOnBean(DataSource.class)
@EnableConfigurationProperties(TrackingProperties.class)
public class TrackingAutoConfiguration {
    private static final Logger logger = Logger.getLogger(TrackingAutoConfiguration.class.getName());

    @Bean
    @ConditionalOnMissingBean
    public JdbcTrackingStores trackingStores(DataSource dataSource, TrackingProperties props) {
        JdbcTrackingStores stores = JdbcTrackingStores.create(dataSource);
        if (props.getJdbc().isInitializeSchema()) {
            stores.createSchema();
        }
        if (props.getJdbc().isSeedOccurrenceCodes()) {
            try {
                int inserted = stores.occurrenceCodeSource().seed(new ClasspathOccurrenceCodeSource().load());
                logger.log(Level.INFO, "Seeded {0} occurrence codes", inserted);
            } catch (IOException | SQLException e) {
                throw new IllegalStateException("Failed to seed occurrence codes", e);
            }
        }
        return stores;
    }

    @Bean
    @ConditionalOnMissingBean(OccurrenceCodeSource.class)
    public OccurrenceCodeSource occurrenceCodeSource(JdbcTrackingStores stores, TrackingProperties props) {
        if (props.getJdbc().isOccurrenceCodesFromDatabase()) {
            return stores.occurrenceCodeSource();
        }
        return new ClasspathOccurrenceCodeSource();
    }

    @Bean
    @ConditionalOnMissingBean(RuleRepository.class)
    public InMemoryRuleRepository ruleRepository(ObjectProvider<AutomationRule> rules) {
        InMemoryRuleRepository repository = new InMemoryRuleRepository();
        rules.orderedStream().forEach(repository::register);
        return repository;
    }

    @Bean
    @ConditionalOnMissingBean
    public TimelineBuilder timelineBuilder(TrackingProperties props) {
        TrackingProperties.Timeline timeline = props.getTimeline();
        return TimelineBuilder.builder()
                .tieBreaker(timeline.getTieBreaker() == TrackingProperties.TieBreaker.DEDUP_KEY
                        ? TimelineBuilder.BY_DEDUP_KEY
                        : TimelineBuilder.BY_EVENT_ID)
                .gapThreshold(timeline.getGapThreshold())
                .build();
    }

    @Bean(destroyMethod = "close")
    @ConditionalOnMissingBean
    public TrackingEngine trackingEngine(TrackingProperties props,
                                         JdbcTrackingStores stores,
                                         OccurrenceCodeSource occurrenceCodeSource,
                                         RuleRepository ruleRepository,
                                         TimelineBuilder timelineBuilder,
                                         ObjectProvider<MetricsExporter> metricsProvider,
                                         ObjectProvider<NotificationSender> notificationSenderProvider,
                                         ObjectProvider<WebhookClient> webhookClientProvider,
                                         ObjectProvider<TrackingListener> listenerProvider) {
        TrackingProperties.Dispatcher dispatcher = props.getDispatcher();
        TrackingProperties.Poller poller = props.getPoller();
        TrackingProperties.Replay replay = props.getReplay();

        var builder = TrackingEngine.builder()
                .connectionProvider(stores.connectionProvider())
                .eventStore(stores.eventStore())
                .shipmentStore(stores.shipmentStore())
                .invocationStore(stores.invocationStore())
                .unresolvedStore(stores.unresolvedStore())
                .occurrenceCodeSource(occurrenceCodeSource)
                .ruleRepository(ruleRepository)
                .timelineBuilder(timelineBuilder)
                .actionTimeout(dispatcher.getActionTimeout())
                .workerCount(dispatcher.getWorkerCount())
                .hotQueueCapacity(dispatcher.getHotQueueCapacity())
                .coldQueueCapacity(dispatcher.getColdQueueCapacity())
                .maxAttempts(dispatcher.getMaxAttempts())
                .drainTimeoutMs(dispatcher.getDrainTimeoutMs())
                .retryPolicy(new ExponentialBackoffRetryPolicy(
                        props.getRetry().getBaseDelayMs(), props.getRetry().getMaxDelayMs()))
                .pollIntervalMs(poller.getIntervalMs())
                .pollBatchSize(poller.getBatchSize())
                .pollSkipRecent(Duration.ofMillis(poller.getSkipRecentMs()))
                .maxConflictRetries(props.getState().getMaxConflictRetries())
                .reconcileIntervalMs(props.getState().getReconcileIntervalMs())
                .replayWindow(replay.getWindow())
                .replayIntervalMs(replay.getIntervalMs())
                .replayRetryPolicy(new ExponentialBackoffRetryPolicy(
                        replay.getBaseDelayMs(), replay.getMaxDelayMs()))
                .autoStart(props.isAutoStart());
        if (props.getArchive().isEnabled()) {
            builder.archiveStore(stores.archiveStore())
                    .archiveCapacity(props.getArchive().getCapacity())
                    .archiveMaxRetries(props.getArchive().getMaxRetries());
        }
        MetricsExporter metrics = metricsProvider.getIfAvailable();
        if (metrics != null) {
            builder.metrics(metrics);
        }
        NotificationSender notificationSender = notificationSenderProvider.getIfAvailable();
        if (notificationSender != null) {
            builder.notificationSender(notificationSender);
        }
        WebhookClient webhookClient = webhookClientProvider.getIfAvailable();
        if (webhookClient != null) {
            builder.webhookClient(webhookClient);
        }
        TrackingListener listener = listenerProvider.getIfAvailable();
        if (listener != null) {
            builder.listener(listener);
        }
        return builder.build();
    }
}
