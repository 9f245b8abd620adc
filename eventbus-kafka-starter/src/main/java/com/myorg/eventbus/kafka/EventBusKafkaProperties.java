package com.myorg.eventbus.kafka;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Binds {@code eventbus.kafka.*}. Broker-level timeouts are handed to the Kafka clients as-is.
 */
@Data
@ConfigurationProperties(prefix = "eventbus.kafka")
public class EventBusKafkaProperties {
    private List<String> bootstrapServers = new ArrayList<>(List.of("localhost:9092"));
    private String clientId;
    // falls back to spring.application.name
    private String serviceName;
    // not interpreted, only forwarded to the clients
    private String schemaRegistryUrl;

    private final Retry retry = new Retry();
    private final CircuitBreaker circuitBreaker = new CircuitBreaker();
    private final Producer producer = new Producer();
    private final Consumer consumer = new Consumer();
    private final Dlq dlq = new Dlq();
    private final Admin admin = new Admin();
    private final StartupCheck startupCheck = new StartupCheck();
    private final Lifecycle lifecycle = new Lifecycle();

    /** Transport-level retry for the underlying producer connection. */
    @Data
    public static class Retry {
        private Duration initialRetryTime = Duration.ofMillis(300);
        private int retries = 5;
        private Duration maxRetryTime = Duration.ofSeconds(30);
        // bound but not applied: Kafka clients use a fixed 0.2 jitter and a doubling backoff that cannot be configured
        private double factor = 0.2;
    }

    @Data
    public static class CircuitBreaker {
        private int failureThreshold = 5;
        private Duration resetTimeout = Duration.ofSeconds(30);
    }

    @Data
    public static class Producer {
        private String acks = "all";
        private boolean idempotence = true;
        private String compression = "none";
        private int lingerMs = 5;
        private int batchSize = 16384;
        private Duration maxBlock = Duration.ofSeconds(10);
        private Duration requestTimeout = Duration.ofSeconds(30);
    }

    @Data
    public static class Consumer {
        private boolean autoCommit = false;
        private boolean fromBeginning = false;
        private Integer maxBytesPerPartition;
        private Duration sessionTimeout = Duration.ofSeconds(30);
        private int maxPollRecords = 500;
        private final HandlerRetry retry = new HandlerRetry();
    }

    /** In-place retry of a failing handler: delays 200ms, 400ms, 800ms with the defaults. */
    @Data
    public static class HandlerRetry {
        private int maxRetries = 3;
        private Duration initialBackoff = Duration.ofMillis(200);
        private double multiplier = 2.0;
        private Duration maxBackoff = Duration.ofSeconds(30);
    }

    @Data
    public static class Dlq {
        private boolean enabled = true;
        private String suffix = ".dlq";
        private Duration sendTimeout = Duration.ofSeconds(10);
    }

    @Data
    public static class Admin {
        private Duration operationTimeout = Duration.ofSeconds(30);
        private int defaultPartitions = 3;
        private short defaultReplicationFactor = 1;
    }

    @Data
    public static class StartupCheck {
        private boolean enabled = true;
        private Duration timeout = Duration.ofSeconds(10);
    }

    /** false leaves start()/stop() to the application. */
    @Data
    public static class Lifecycle {
        private boolean enabled = true;
    }
}
