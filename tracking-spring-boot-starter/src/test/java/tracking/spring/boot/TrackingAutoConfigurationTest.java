package tracking.spring.boot;

import org.junit.jupiter.api.Test;
import org.springframework.boot.autoconfigure.AutoConfigurations;
import org.springframework.boot.autoconfigure.jdbc.DataSourceAutoConfiguration;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import tracking.IngestOutcome;
import tracking.TrackingEngine;
import tracking.automation.InMemoryRuleRepository;
import tracking.automation.RuleRepository;
import tracking.jdbc.store.JdbcOccurrenceCodeSource;
import tracking.jdbc.store.JdbcTrackingStores;
import tracking.model.AutomationAction;
import tracking.model.AutomationRule;
import tracking.model.CanonicalStatus;
import tracking.model.NewShipment;
import tracking.model.Shipment;
import tracking.registry.ClasspathOccurrenceCodeSource;
import tracking.registry.OccurrenceCodeSource;
import tracking.spi.NotificationSender;
import tracking.timeline.TimelineBuilder;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class TrackingAutoConfigurationTest {

  private static final Instant RECEIVED = Instant.parse("2024-03-02T12:00:00Z");

  private final ApplicationContextRunner runner = new ApplicationContextRunner()
      .withConfiguration(AutoConfigurations.of(
          DataSourceAutoConfiguration.class,
          TrackingAutoConfiguration.class))
      .withPropertyValues(
          "spring.datasource.url=jdbc:h2:mem:tracking_" + UUID.randomUUID().toString().replace("-", "")
              + ";DB_CLOSE_DELAY=-1",
          "spring.datasource.driver-class-name=org.h2.Driver",
          "tracking.auto-start=false",
          "tracking.jdbc.initialize-schema=true");

  private static String payload(String trackingCode, String code, String occurredAt) {
    return "{\"tracking_code\":\"" + trackingCode + "\",\"occurrence_code\":\"" + code
        + "\",\"occurred_at\":\"" + occurredAt + "\"}";
  }

  // ── Wiring ────────────────────────────────────────────────────

  @Test
  void createsAllBeans() {
    runner.run(ctx -> {
      assertNull(ctx.getStartupFailure());
      assertTrue(ctx.containsBean("trackingStores"));
      assertTrue(ctx.containsBean("occurrenceCodeSource"));
      assertTrue(ctx.containsBean("ruleRepository"));
      assertTrue(ctx.containsBean("timelineBuilder"));
      assertTrue(ctx.containsBean("trackingEngine"));

      assertEquals("h2", ctx.getBean(JdbcTrackingStores.class).dialect().name());
      assertInstanceOf(ClasspathOccurrenceCodeSource.class, ctx.getBean(OccurrenceCodeSource.class));
      assertInstanceOf(InMemoryRuleRepository.class, ctx.getBean(RuleRepository.class));
    });
  }

  @Test
  void wiredEngineTracksShipments() {
    runner.run(ctx -> {
      TrackingEngine engine = ctx.getBean(TrackingEngine.class);
      Shipment shipment = engine.registerShipment(new NewShipment(null, "TRK1", "acme", Map.of()));

      IngestOutcome outcome = engine.ingestRaw(payload("TRK1", "80", "2024-03-01T08:00:00Z"), "api", RECEIVED);

      assertTrue(outcome.accepted());
      assertEquals(CanonicalStatus.COLLECTED, engine.currentStatus(shipment.id()).orElseThrow().status());
    });
  }

  @Test
  void ruleBeansAreRegisteredAndNotificationsDelivered() {
    runner.withUserConfiguration(AutomationConfig.class).run(ctx -> {
      RuleRepository rules = ctx.getBean(RuleRepository.class);
      assertEquals(1, rules.all().size());

      TrackingEngine engine = ctx.getBean(TrackingEngine.class);
      Shipment shipment = engine.registerShipment(new NewShipment(null, "TRK2", "acme", Map.of()));
      engine.ingestRaw(payload("TRK2", "1", "2024-03-01T15:00:00Z"), "api", RECEIVED);

      BlockingQueue<String> sent = ctx.getBean(AutomationConfig.class).sent;
      assertEquals(shipment.id() + ":DELIVERED", sent.poll(5, TimeUnit.SECONDS));
    });
  }

  // ── Properties ────────────────────────────────────────────────

  @Test
  void bindsProperties() {
    runner
        .withPropertyValues(
            "tracking.dispatcher.worker-count=2",
            "tracking.dispatcher.action-timeout=3s",
            "tracking.replay.window=PT12H",
            "tracking.timeline.tie-breaker=DEDUP_KEY",
            "tracking.timeline.gap-threshold=PT48H",
            "tracking.state.max-conflict-retries=7",
            "tracking.state.reconcile-interval-ms=2500",
            "tracking.archive.enabled=false")
        .run(ctx -> {
          TrackingProperties props = ctx.getBean(TrackingProperties.class);
          assertEquals(2, props.getDispatcher().getWorkerCount());
          assertEquals(Duration.ofSeconds(3), props.getDispatcher().getActionTimeout());
          assertEquals(Duration.ofHours(12), props.getReplay().getWindow());
          assertEquals(TrackingProperties.TieBreaker.DEDUP_KEY, props.getTimeline().getTieBreaker());
          assertEquals(7, props.getState().getMaxConflictRetries());
          assertEquals(2500L, props.getState().getReconcileIntervalMs());
          assertFalse(props.getArchive().isEnabled());
          assertEquals(Duration.ofHours(48), ctx.getBean(TimelineBuilder.class).gapThreshold());
          assertNotNull(ctx.getBean(TrackingEngine.class));
        });
  }

  @Test
  void loadsOccurrenceCodesFromSeededDatabase() {
    runner
        .withPropertyValues(
            "tracking.jdbc.seed-occurrence-codes=true",
            "tracking.jdbc.occurrence-codes-from-database=true")
        .run(ctx -> {
          assertNull(ctx.getStartupFailure());
          assertInstanceOf(JdbcOccurrenceCodeSource.class, ctx.getBean(OccurrenceCodeSource.class));
          int bundled = new ClasspathOccurrenceCodeSource().load().size();
          assertEquals(bundled, ctx.getBean(TrackingEngine.class).occurrenceCodes().size());
        });
  }

  @Test
  void emptyOccurrenceCodeTableFailsStartup() {
    runner
        .withPropertyValues("tracking.jdbc.occurrence-codes-from-database=true")
        .run(ctx -> {
          assertNotNull(ctx.getStartupFailure());
          Throwable failure = findCause(ctx.getStartupFailure(), "Failed to load occurrence codes");
          assertInstanceOf(IllegalStateException.class, failure);
        });
  }

  // ── Conditions ────────────────────────────────────────────────

  @Test
  void notLoadedWithoutDataSource() {
    new ApplicationContextRunner()
        .withConfiguration(AutoConfigurations.of(TrackingAutoConfiguration.class))
        .run(ctx -> {
          assertFalse(ctx.containsBean("trackingEngine"));
        });
  }

  @Test
  void respectsConditionalOnMissingBean() {
    runner.withUserConfiguration(CustomRulesConfig.class).run(ctx -> {
      assertFalse(ctx.containsBean("ruleRepository"));
      assertEquals(1, ctx.getBeanNamesForType(RuleRepository.class).length);
      assertEquals("myRules", ctx.getBeanNamesForType(RuleRepository.class)[0]);
      assertNotNull(ctx.getBean(TrackingEngine.class));
    });
  }

  private static Throwable findCause(Throwable t, String message) {
    for (Throwable current = t; current != null; current = current.getCause()) {
      if (message.equals(current.getMessage())) {
        return current;
      }
    }
    return null;
  }

  // ── Test configurations ──────────────────────────────────────

  @Configuration
  static class AutomationConfig {
    final BlockingQueue<String> sent = new LinkedBlockingQueue<>();

    @Bean
    AutomationRule deliveredNotification() {
      return new AutomationRule("delivered-email", "Delivered e-mail", Set.of(CanonicalStatus.DELIVERED),
          null, List.of(new AutomationAction.Notify("email", "ops@example.com", "delivered")), true);
    }

    @Bean
    NotificationSender notificationSender() {
      return (action, shipmentId, newStatus, context) -> sent.add(shipmentId + ":" + newStatus);
    }
  }

  @Configuration
  static class CustomRulesConfig {
    @Bean
    RuleRepository myRules() {
      return new InMemoryRuleRepository();
    }
  }
}
