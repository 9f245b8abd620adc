package com.myorg.eventbus.kafka;

import com.myorg.eventbus.kafka.health.CircuitBreakerHealthIndicator;
import org.junit.jupiter.api.Test;
import org.springframework.boot.actuate.health.Status;
import org.springframework.boot.autoconfigure.AutoConfigurations;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;
import org.springframework.kafka.core.KafkaAdmin;
import org.springframework.kafka.core.ProducerFactory;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;

class MessageBusAutoConfigurationTest {

    // Không cần broker: tắt startup check
    private final ApplicationContextRunner runner = new ApplicationContextRunner()
            .withConfiguration(AutoConfigurations.of(
                    EventBusKafkaAutoConfiguration.class,
                    EventBusProducerAutoConfiguration.class,
                    EventBusConsumerAutoConfiguration.class,
                    MessageBusAutoConfiguration.class))
            .withPropertyValues(
                    "eventbus.kafka.bootstrap-servers=broker-1:9092",
                    "eventbus.kafka.startup-check.enabled=false");

    @Test
    void registersClient_andBindsProperties() {
        runner.withPropertyValues(
                        "eventbus.kafka.service-name=tenant-service",
                        "eventbus.kafka.circuit-breaker.failure-threshold=3",
                        "eventbus.kafka.circuit-breaker.reset-timeout=10s",
                        "eventbus.kafka.dlq.suffix=.dead")
                .run(ctx -> {
                    assertThat(ctx).hasNotFailed();
                    MessageBusClient client = ctx.getBean(MessageBusClient.class);

                    assertThat(client.getServiceName()).isEqualTo("tenant-service");
                    assertThat(client.getCircuitBreaker().getFailureThreshold()).isEqualTo(3);
                    assertThat(client.getCircuitBreaker().getResetTimeout()).isEqualTo(Duration.ofSeconds(10));
                    assertThat(client.dlqTopicOf("tenant.events")).isEqualTo("tenant.events.dead");
                    assertThat(ctx.getBean(EventBusKafkaAutoConfiguration.EventBusKafkaMarker.class).bootstrapServers())
                            .isEqualTo("broker-1:9092");
                    assertThat(ctx.getBean(KafkaAdmin.class).getConfigurationProperties())
                            .containsKey("bootstrap.servers");
                });
    }

    @Test
    void serviceName_fallsBackToApplicationName() {
        runner.withPropertyValues("spring.application.name=billing-service")
                .run(ctx -> assertThat(ctx.getBean(MessageBusClient.class).getServiceName()).isEqualTo("billing-service"));
    }

    @Test
    void lifecycleStartsClientWithContext() {
        runner.run(ctx -> {
            assertThat(ctx).hasSingleBean(MessageBusLifecycle.class);
            assertThat(ctx.getBean(MessageBusClient.class).isRunning()).isTrue();
        });
    }

    @Test
    void lifecycleCanBeDisabled() {
        runner.withPropertyValues("eventbus.kafka.lifecycle.enabled=false")
                .run(ctx -> {
                    assertThat(ctx).doesNotHaveBean(MessageBusLifecycle.class);
                    assertThat(ctx.getBean(MessageBusClient.class).isRunning()).isFalse();
                });
    }

    @Test
    void producerConfig_mapsTransportRetrySettings() {
        runner.withPropertyValues(
                        "eventbus.kafka.retry.retries=0",
                        "eventbus.kafka.retry.initial-retry-time=250ms",
                        "eventbus.kafka.retry.max-retry-time=5s")
                .run(ctx -> {
                    ProducerFactory<?, ?> pf = ctx.getBean("eventBusProducerFactory", ProducerFactory.class);
                    assertThat(pf.getConfigurationProperties())
                            .containsEntry("retries", 0)
                            .containsEntry("retry.backoff.ms", 250L)
                            .containsEntry("reconnect.backoff.max.ms", 5000L)
                            // retries=0 không dùng được idempotence
                            .containsEntry("enable.idempotence", false);
                });
    }

    @Test
    void retryFactor_isBoundButLeavesProducerConfigUnchanged() {
        runner.withPropertyValues("eventbus.kafka.retry.factor=0.7")
                .run(ctx -> {
                    assertThat(ctx.getBean(EventBusKafkaProperties.class).getRetry().getFactor()).isEqualTo(0.7);
                    ProducerFactory<?, ?> tuned = ctx.getBean("eventBusProducerFactory", ProducerFactory.class);
                    runner.run(plain -> assertThat(tuned.getConfigurationProperties())
                            .isEqualTo(plain.getBean("eventBusProducerFactory", ProducerFactory.class)
                                    .getConfigurationProperties()));
                });
    }

    @Test
    void healthReflectsCircuitState() {
        runner.run(ctx -> {
            CircuitBreakerHealthIndicator health = ctx.getBean(CircuitBreakerHealthIndicator.class);
            assertThat(health.health().getStatus()).isEqualTo(Status.UP);
            assertThat(health.health().getDetails()).containsEntry("state", "CLOSED");
        });
    }

    @Test
    void userClientWins() {
        MessageBusClient custom = mock(MessageBusClient.class);
        runner.withPropertyValues("eventbus.kafka.lifecycle.enabled=false")
                .withBean(MessageBusClient.class, () -> custom)
                .run(ctx -> assertThat(ctx.getBean(MessageBusClient.class)).isSameAs(custom));
    }
}
