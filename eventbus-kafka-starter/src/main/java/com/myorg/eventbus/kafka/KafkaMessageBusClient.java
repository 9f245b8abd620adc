package com.myorg.eventbus.kafka;

import com.myorg.eventbus.contracts.core.envelope.EventEnvelope;
import com.myorg.eventbus.kafka.circuit.CircuitBreaker;
import com.myorg.eventbus.kafka.circuit.CircuitState;
import com.myorg.eventbus.kafka.dlq.DeadLetterPublisher;
import com.myorg.eventbus.kafka.exception.CircuitOpenException;
import com.myorg.eventbus.kafka.exception.MessageBusAdminException;
import com.myorg.eventbus.kafka.exception.MessageBusConnectException;
import com.myorg.eventbus.kafka.exception.ProduceTransportException;
import lombok.extern.slf4j.Slf4j;
import org.apache.kafka.clients.admin.Admin;
import org.apache.kafka.clients.admin.AdminClient;
import org.apache.kafka.clients.admin.ConsumerGroupListing;
import org.apache.kafka.clients.admin.NewTopic;
import org.apache.kafka.clients.consumer.ConsumerConfig;
import org.apache.kafka.clients.consumer.OffsetAndMetadata;
import org.apache.kafka.clients.producer.ProducerRecord;
import org.apache.kafka.common.TopicPartition;
import org.apache.kafka.common.errors.TopicExistsException;
import org.springframework.kafka.core.ConsumerFactory;
import org.springframework.kafka.core.KafkaAdmin;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.kafka.listener.ConcurrentMessageListenerContainer;
import org.springframework.kafka.listener.ContainerProperties;
import org.springframework.kafka.support.ExponentialBackOffWithMaxRetries;
import org.springframework.util.StringUtils;
import org.springframework.util.backoff.BackOff;

import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Properties;
import java.util.TreeMap;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * {@link MessageBusClient} on top of spring-kafka.
 * <p>
 * Produce goes through a {@link CircuitBreaker}; dead letters do not. Each subscription runs
 * its own single-threaded listener container, so records of a partition are handled in order
 * and a retrying record holds back the ones behind it.
 */
@Slf4j
public class KafkaMessageBusClient implements MessageBusClient {

    private final EventBusKafkaProperties props;
    private final String serviceName;
    private final KafkaTemplate<String, String> template;
    private final ConsumerFactory<String, String> consumerFactory;
    private final KafkaAdmin kafkaAdmin;
    private final EnvelopeCodec codec;
    private final DeadLetterPublisher deadLetters;
    private final MessageBusMetrics metrics;
    private final CircuitBreaker circuitBreaker;
    private final Clock clock;

    private final Map<String, KafkaSubscription> subscriptions = new ConcurrentHashMap<>();
    private final AtomicBoolean running = new AtomicBoolean(false);

    private volatile Sleeper sleeper = Sleeper.threadSleep();

    public KafkaMessageBusClient(EventBusKafkaProperties props,
                                 String serviceName,
                                 KafkaTemplate<String, String> template,
                                 ConsumerFactory<String, String> consumerFactory,
                                 KafkaAdmin kafkaAdmin,
                                 EnvelopeCodec codec,
                                 MessageBusMetrics metrics,
                                 Clock clock) {
        this.props = props;
        this.serviceName = serviceName;
        this.template = template;
        this.consumerFactory = consumerFactory;
        this.kafkaAdmin = kafkaAdmin;
        this.codec = codec;
        this.metrics = metrics != null ? metrics : MessageBusMetrics.noop();
        this.clock = clock != null ? clock : Clock.systemUTC();

        EventBusKafkaProperties.CircuitBreaker cb = props.getCircuitBreaker();
        this.circuitBreaker = CircuitBreaker.builder()
                .failureThreshold(cb.getFailureThreshold())
                .resetTimeout(cb.getResetTimeout())
                .clock(this.clock)
                .onOpen(() -> this.metrics.circuitTransition(CircuitState.OPEN))
                .onHalfOpen(() -> this.metrics.circuitTransition(CircuitState.HALF_OPEN))
                .onClose(() -> this.metrics.circuitTransition(CircuitState.CLOSED))
                .build();

        EventBusKafkaProperties.Dlq dlq = props.getDlq();
        this.deadLetters = new DeadLetterPublisher(template, codec, serviceName, dlq.getSuffix(),
                dlq.getSendTimeout(), dlq.isEnabled(), this.metrics, this.clock);
    }

    // ---------------------------------------------------------------- lifecycle

    @Override
    public void start() {
        if (running.get()) return;
        if (props.getStartupCheck().isEnabled()) {
            Duration timeout = props.getStartupCheck().getTimeout();
            try (Admin admin = createAdmin()) {
                int nodes = admin.describeCluster().nodes().get(timeout.toMillis(), TimeUnit.MILLISECONDS).size();
                log.info("Connected to Kafka {} ({} broker(s)) as service {}", props.getBootstrapServers(), nodes, serviceName);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new MessageBusConnectException("Interrupted while connecting to Kafka", e);
            } catch (ExecutionException | TimeoutException | RuntimeException e) {
                throw new MessageBusConnectException("Failed to connect to Kafka " + props.getBootstrapServers(), e);
            }
        } else {
            log.info("Message bus started for service {} (startup check disabled)", serviceName);
        }
        running.set(true);
    }

    @Override
    public void stop() {
        if (!running.getAndSet(false) && subscriptions.isEmpty()) return;

        RuntimeException first = null;
        for (KafkaSubscription sub : new ArrayList<>(subscriptions.values())) {
            try {
                sub.unsubscribe();
            } catch (RuntimeException e) {
                log.error("Failed to stop subscription {} on {}", sub.groupId(), sub.topic(), e);
                if (first == null) first = e;
            }
        }
        try {
            template.getProducerFactory().reset();
        } catch (RuntimeException e) {
            log.error("Failed to close producer", e);
            if (first == null) first = e;
        }
        if (first != null) {
            throw new MessageBusConnectException("Failed to disconnect cleanly from Kafka", first);
        }
        log.info("Disconnected from Kafka");
    }

    @Override
    public boolean isRunning() {
        return running.get();
    }

    // ---------------------------------------------------------------- produce

    @Override
    public CompletableFuture<Long> produce(String topic, EventEnvelope event, ProduceOptions options) {
        // type không tự sinh được: chặn trước circuit breaker, không tính là lỗi transport
        if (event == null || !StringUtils.hasText(event.getType())) {
            return CompletableFuture.failedFuture(
                    new IllegalArgumentException("Event type is required to produce to " + topic));
        }
        EventEnvelope normalized = normalize(event);
        ProducerRecord<String, String> record;
        try {
            record = toRecord(topic, normalized, options != null ? options : ProduceOptions.none());
        } catch (RuntimeException e) {
            return CompletableFuture.failedFuture(e);
        }

        CompletableFuture<Long> result = new CompletableFuture<>();
        circuitBreaker.<Long>fire(() -> template.send(record).thenApply(r -> r.getRecordMetadata().offset()))
                .whenComplete((offset, ex) -> {
                    if (ex == null) {
                        metrics.produced(topic, "success");
                        log.debug("Produced event {} type={} to {} offset={}", normalized.getId(), normalized.getType(), topic, offset);
                        result.complete(offset);
                        return;
                    }
                    Throwable cause = unwrap(ex);
                    if (cause instanceof CircuitOpenException) {
                        metrics.produced(topic, "rejected");
                        log.warn("Circuit open, rejected event {} for {}", normalized.getId(), topic);
                        result.completeExceptionally(cause);
                    } else {
                        metrics.produced(topic, "failure");
                        log.error("Failed to produce event {} to {}: {}", normalized.getId(), topic, cause.toString());
                        result.completeExceptionally(new ProduceTransportException(topic, normalized.getId(), cause));
                    }
                });
        return result;
    }

    EventEnvelope normalize(EventEnvelope event) {
        if (event == null) throw new IllegalArgumentException("event must not be null");
        EventEnvelope.EventEnvelopeBuilder b = event.toBuilder();
        if (!StringUtils.hasText(event.getId())) b.id(UUID.randomUUID().toString());
        if (!StringUtils.hasText(event.getTime())) b.time(clock.instant().toString());
        if (!StringUtils.hasText(event.getSource())) b.source(serviceName);
        return b.build();
    }

    ProducerRecord<String, String> toRecord(String topic, EventEnvelope event, ProduceOptions options) {
        String key = StringUtils.hasText(options.getKey()) ? options.getKey() : event.getId();
        ProducerRecord<String, String> record =
                new ProducerRecord<>(topic, options.getPartition(), key, codec.encode(event));
        if (options.getHeaders() != null) {
            options.getHeaders().forEach((k, v) -> {
                if (v != null) record.headers().add(k, v.getBytes(StandardCharsets.UTF_8));
            });
        }
        return record;
    }

    // ---------------------------------------------------------------- consume

    @Override
    public Subscription subscribe(String topic, MessageHandler handler, SubscribeOptions options) {
        SubscribeOptions opts = options != null ? options : SubscribeOptions.defaults();
        return doSubscribe(topic, topic, handler, opts, true);
    }

    @Override
    public Subscription consumeDlq(String topic, MessageHandler handler, SubscribeOptions options) {
        SubscribeOptions opts = (options != null ? options.toBuilder() : SubscribeOptions.builder())
                .strictEnvelope(false)
                .build();
        return doSubscribe(dlqTopicOf(topic), dlqTopicOf(topic), handler, opts, false);
    }

    private Subscription doSubscribe(String topic, String groupTopic, MessageHandler handler,
                                     SubscribeOptions opts, boolean deadLetterOnFailure) {
        if (handler == null) throw new IllegalArgumentException("handler must not be null");
        String groupId = groupIdFor(groupTopic, opts);
        String key = groupId + ":" + topic;
        if (subscriptions.containsKey(key)) {
            throw new IllegalStateException("Already subscribed to " + topic + " with group " + groupId);
        }

        EventBusKafkaProperties.HandlerRetry retry = props.getConsumer().getRetry();
        RetryingRecordListener listener = new RetryingRecordListener(topic, handler, codec, deadLetters,
                backOff(retry), retry.getMaxRetries(), opts.isStrictEnvelope(), deadLetterOnFailure, sleeper, metrics);

        ConcurrentMessageListenerContainer<String, String> container =
                new ConcurrentMessageListenerContainer<>(consumerFactory, containerProperties(topic, groupId, opts, listener));
        container.setBeanName("eventbus-" + key);
        container.setConcurrency(1);

        KafkaSubscription sub = new KafkaSubscription(key, topic, groupId, container);
        if (subscriptions.putIfAbsent(key, sub) != null) {
            throw new IllegalStateException("Already subscribed to " + topic + " with group " + groupId);
        }
        try {
            container.start();
        } catch (RuntimeException e) {
            subscriptions.remove(key);
            throw e;
        }
        log.info("Subscribed to {} with group {}", topic, groupId);
        return sub;
    }

    String groupIdFor(String topic, SubscribeOptions opts) {
        if (StringUtils.hasText(opts.getGroupId())) return opts.getGroupId();
        return serviceName + "-" + topic + "-group";
    }

    ContainerProperties containerProperties(String topic, String groupId, SubscribeOptions opts, RetryingRecordListener listener) {
        EventBusKafkaProperties.Consumer defaults = props.getConsumer();
        boolean autoCommit = opts.getAutoCommit() != null ? opts.getAutoCommit() : defaults.isAutoCommit();
        boolean fromBeginning = opts.getFromBeginning() != null ? opts.getFromBeginning() : defaults.isFromBeginning();
        Integer maxBytes = opts.getMaxBytesPerPartition() != null ? opts.getMaxBytesPerPartition() : defaults.getMaxBytesPerPartition();
        Duration session = opts.getSessionTimeout() != null ? opts.getSessionTimeout() : defaults.getSessionTimeout();

        Properties overrides = new Properties();
        overrides.setProperty(ConsumerConfig.ENABLE_AUTO_COMMIT_CONFIG, String.valueOf(autoCommit));
        overrides.setProperty(ConsumerConfig.AUTO_OFFSET_RESET_CONFIG, fromBeginning ? "earliest" : "latest");
        if (maxBytes != null) {
            overrides.setProperty(ConsumerConfig.MAX_PARTITION_FETCH_BYTES_CONFIG, String.valueOf(maxBytes));
        }
        if (session != null) {
            overrides.setProperty(ConsumerConfig.SESSION_TIMEOUT_MS_CONFIG, String.valueOf(session.toMillis()));
        }

        ContainerProperties cp = new ContainerProperties(topic);
        cp.setGroupId(groupId);
        cp.setKafkaConsumerProperties(overrides);
        cp.setAckMode(ContainerProperties.AckMode.RECORD);
        // dừng sau record đang xử lý, không chạy hết batch
        cp.setStopImmediate(true);
        cp.setMessageListener(listener);
        return cp;
    }

    private static BackOff backOff(EventBusKafkaProperties.HandlerRetry retry) {
        ExponentialBackOffWithMaxRetries backOff = new ExponentialBackOffWithMaxRetries(retry.getMaxRetries());
        backOff.setInitialInterval(retry.getInitialBackoff().toMillis());
        backOff.setMultiplier(retry.getMultiplier());
        backOff.setMaxInterval(retry.getMaxBackoff().toMillis());
        return backOff;
    }

    /** Replaces the back-off sleep for subscriptions created afterwards. */
    public void setSleeper(Sleeper sleeper) {
        this.sleeper = sleeper != null ? sleeper : Sleeper.threadSleep();
    }

    public List<Subscription> getSubscriptions() {
        return List.copyOf(subscriptions.values());
    }

    // ---------------------------------------------------------------- DLQ

    @Override
    public void setDlqEnabled(boolean enabled) {
        deadLetters.setEnabled(enabled);
        log.info("DLQ {}", enabled ? "enabled" : "disabled");
    }

    @Override
    public boolean isDlqEnabled() {
        return deadLetters.isEnabled();
    }

    @Override
    public String dlqTopicOf(String topic) {
        return deadLetters.dlqTopicOf(topic);
    }

    public DeadLetterPublisher getDeadLetterPublisher() {
        return deadLetters;
    }

    // ---------------------------------------------------------------- admin

    @Override
    public void createTopic(String topic) {
        EventBusKafkaProperties.Admin admin = props.getAdmin();
        createTopic(topic, admin.getDefaultPartitions(), admin.getDefaultReplicationFactor());
    }

    @Override
    public void createTopic(String topic, int partitions, short replicationFactor) {
        Duration timeout = props.getAdmin().getOperationTimeout();
        try (Admin admin = createAdmin()) {
            admin.createTopics(List.of(new NewTopic(topic, partitions, replicationFactor)))
                    .all().get(timeout.toMillis(), TimeUnit.MILLISECONDS);
            log.info("Created topic {} partitions={} replication={}", topic, partitions, replicationFactor);
        } catch (ExecutionException e) {
            if (e.getCause() instanceof TopicExistsException) {
                log.debug("Topic {} already exists", topic);
                return;
            }
            throw new MessageBusAdminException("Failed to create topic " + topic, e.getCause());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new MessageBusAdminException("Interrupted while creating topic " + topic, e);
        } catch (TimeoutException | RuntimeException e) {
            throw new MessageBusAdminException("Failed to create topic " + topic, e);
        }
    }

    @Override
    public List<ConsumerGroupOffsets> getConsumerGroupsForTopic(String topic) {
        long timeoutMs = props.getAdmin().getOperationTimeout().toMillis();
        List<ConsumerGroupOffsets> result = new ArrayList<>();
        try (Admin admin = createAdmin()) {
            for (ConsumerGroupListing group : admin.listConsumerGroups().all().get(timeoutMs, TimeUnit.MILLISECONDS)) {
                String groupId = group.groupId();
                try {
                    Map<TopicPartition, OffsetAndMetadata> committed = admin.listConsumerGroupOffsets(groupId)
                            .partitionsToOffsetAndMetadata().get(timeoutMs, TimeUnit.MILLISECONDS);
                    Map<Integer, Long> offsets = new TreeMap<>();
                    committed.forEach((tp, om) -> {
                        if (om != null && topic.equals(tp.topic())) offsets.put(tp.partition(), om.offset());
                    });
                    if (!offsets.isEmpty()) {
                        result.add(new ConsumerGroupOffsets(groupId, topic, offsets));
                    }
                } catch (ExecutionException | TimeoutException e) {
                    // một group lỗi không làm hỏng cả danh sách
                    log.error("Failed to fetch offsets for group {}", groupId, e);
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new MessageBusAdminException("Interrupted while listing consumer groups", e);
        } catch (ExecutionException | TimeoutException | RuntimeException e) {
            throw new MessageBusAdminException("Failed to list consumer groups for topic " + topic, e);
        }
        result.sort(Comparator.comparing(ConsumerGroupOffsets::groupId));
        return result;
    }

    protected Admin createAdmin() {
        if (kafkaAdmin == null) {
            throw new IllegalStateException("No KafkaAdmin configured");
        }
        return AdminClient.create(kafkaAdmin.getConfigurationProperties());
    }

    // ---------------------------------------------------------------- misc

    @Override
    public CircuitBreaker getCircuitBreaker() {
        return circuitBreaker;
    }

    @Override
    public String getServiceName() {
        return serviceName;
    }

    private static Throwable unwrap(Throwable ex) {
        Throwable t = ex;
        while ((t instanceof CompletionException || t instanceof ExecutionException) && t.getCause() != null) {
            t = t.getCause();
        }
        return t;
    }

    private final class KafkaSubscription implements Subscription {

        private final String key;
        private final String topic;
        private final String groupId;
        private final ConcurrentMessageListenerContainer<String, String> container;
        private final AtomicBoolean active = new AtomicBoolean(true);

        private KafkaSubscription(String key, String topic, String groupId,
                                  ConcurrentMessageListenerContainer<String, String> container) {
            this.key = key;
            this.topic = topic;
            this.groupId = groupId;
            this.container = container;
        }

        @Override
        public String topic() {
            return topic;
        }

        @Override
        public String groupId() {
            return groupId;
        }

        @Override
        public boolean isActive() {
            return active.get();
        }

        @Override
        public void unsubscribe() {
            if (!active.compareAndSet(true, false)) return;
            try {
                container.stop();
                log.info("Unsubscribed from {} (group {})", topic, groupId);
            } finally {
                subscriptions.remove(key, this);
            }
        }
    }
}
