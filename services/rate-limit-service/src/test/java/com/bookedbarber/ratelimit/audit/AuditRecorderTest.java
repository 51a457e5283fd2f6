package com.bookedbarber.ratelimit.audit;

import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import com.bookedbarber.ratelimit.MutableClock;
import com.bookedbarber.ratelimit.identity.Identity;
import com.bookedbarber.ratelimit.metrics.RateLimitMetrics;
import com.bookedbarber.ratelimit.payment.Severity;
import com.bookedbarber.ratelimit.payment.Violation;
import com.bookedbarber.ratelimit.payment.ViolationType;
import com.bookedbarber.ratelimit.store.InMemoryCounterStore;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.slf4j.LoggerFactory;
import org.springframework.http.converter.json.Jackson2ObjectMapperBuilder;
import reactor.core.scheduler.Schedulers;

import java.math.BigDecimal;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.verify;

@ExtendWith(MockitoExtension.class)
@DisplayName("AuditRecorder Unit Tests")
class AuditRecorderTest {

    private static final Instant NOW = Instant.parse("2026-03-01T15:30:00Z");

    @Mock
    private AuditSink auditSink;

    private SimpleMeterRegistry meterRegistry;
    private InMemoryCounterStore store;
    private ObjectMapper objectMapper;
    private AuditRecorder recorder;

    @BeforeEach
    void setUp() {
        meterRegistry = new SimpleMeterRegistry();
        store = new InMemoryCounterStore(MutableClock.at("2026-03-01T15:30:00Z"));
        objectMapper = Jackson2ObjectMapperBuilder.json().build();
        recorder = new AuditRecorder(auditSink, store, Schedulers.immediate(), new RateLimitMetrics(meterRegistry),
                objectMapper, "rl", 3, Duration.ofDays(30));
    }

    @Test
    @DisplayName("Should keep recent usage per subject and count usage per endpoint and day")
    void shouldRecordUsage() {
        // Given
        UsageRecord first = new UsageRecord("api:k1", "/api/v2/public/shops/{id}", "GET", NOW, 200, 12);
        UsageRecord second = new UsageRecord("api:k1", "/api/v2/public/shops/{id}", "GET", NOW.plusSeconds(1), 429, 3);

        // When
        recorder.recordUsage(first);
        recorder.recordUsage(second);

        // Then
        verify(auditSink).recordUsage(first);
        List<UsageRecord> recent = recorder.recentUsage("api:k1", 10).block();
        assertThat(recent).containsExactly(second, first);
        assertThat(recorder.endpointUsage("GET", "/api/v2/public/shops/{id}", NOW).block()).isEqualTo(2L);
        assertThat(recorder.endpointUsage("GET", "/api/v2/public/shops/{id}", NOW.plus(Duration.ofDays(1))).block())
                .isZero();
    }

    @Test
    @DisplayName("Should cap recent usage at the configured length")
    void shouldCapRecentUsage() {
        for (int i = 0; i < 5; i++) {
            recorder.recordUsage(new UsageRecord("ip:1.1.1.1", "/x", "GET", NOW.plusSeconds(i), 200, 1));
        }

        assertThat(recorder.recentUsage("ip:1.1.1.1", 100).block()).hasSize(3);
    }

    @Test
    @DisplayName("Should count and swallow sink failures without reaching the caller")
    void shouldIsolateSinkFailures() {
        doThrow(new IllegalStateException("disk full")).when(auditSink).recordViolation(any());
        ViolationEvent event = ViolationEvent.from(violation(), new BigDecimal("15.00"), "/api/v2/payments/intents");

        assertThatCode(() -> recorder.recordViolation(event)).doesNotThrowAnyException();

        assertThat(meterRegistry.counter("rate_limit_audit_failures").count()).isEqualTo(1.0);
    }

    @Test
    @DisplayName("Should forward security alerts to the sink")
    void shouldRaiseAlert() {
        SecurityAlert alert = new SecurityAlert("payment_security_violation", Severity.HIGH, "user:u1",
                "Payment security violation", Map.of("rule", "burst"), NOW);

        recorder.raiseAlert(alert);

        verify(auditSink).raiseAlert(alert);
    }

    @Test
    @DisplayName("Should write audit events as JSON envelopes on the AUDIT logger")
    void shouldWriteJsonEnvelope() {
        Logger auditLogger = (Logger) LoggerFactory.getLogger("AUDIT");
        ListAppender<ILoggingEvent> appender = new ListAppender<>();
        appender.start();
        auditLogger.addAppender(appender);
        try {
            new LoggingAuditSink(objectMapper).recordViolation(
                    ViolationEvent.from(violation(), new BigDecimal("15.00"), "/api/v2/payments/intents"));

            assertThat(appender.list).singleElement().satisfies(logged -> {
                assertThat(logged.getFormattedMessage())
                        .contains("\"event_type\":\"rate_limit_violation\"")
                        .contains("\"violation_type\":\"velocity_anomaly\"")
                        .contains("\"ip_address\":\"10.1.1.1\"")
                        .contains("\"timestamp\":\"2026-03-01T15:30:00Z\"");
            });
        } finally {
            auditLogger.detachAppender(appender);
        }
    }

    private static Violation violation() {
        return Violation.of(ViolationType.VELOCITY_ANOMALY, Identity.ofUser("u1", "10.1.1.1"),
                "Suspicious rapid payment pattern detected", Map.of("rule", "burst"), NOW);
    }

    @AfterEach
    void tearDown() {
        meterRegistry.close();
    }
}
