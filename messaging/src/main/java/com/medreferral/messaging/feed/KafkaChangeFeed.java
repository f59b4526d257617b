package com.medreferral.messaging.feed;

import com.medreferral.core.error.TransientException;
import com.medreferral.core.model.Message;
import com.medreferral.core.msg.Topics;
import com.medreferral.core.util.JitterBackoff;
import com.medreferral.core.util.JsonUtils;
import com.medreferral.messaging.config.MessagingConfig;
import org.apache.kafka.clients.consumer.ConsumerConfig;
import org.apache.kafka.clients.producer.ProducerConfig;
import org.apache.kafka.clients.producer.ProducerRecord;
import org.apache.kafka.common.serialization.StringDeserializer;
import org.apache.kafka.common.serialization.StringSerializer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.Disposable;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.kafka.receiver.KafkaReceiver;
import reactor.kafka.receiver.ReceiverOptions;
import reactor.kafka.receiver.ReceiverRecord;
import reactor.kafka.sender.KafkaSender;
import reactor.kafka.sender.SenderOptions;
import reactor.kafka.sender.SenderRecord;
import reactor.util.retry.Retry;

import java.util.Collections;
import java.util.HashMap;
import java.util.Map;

/**
 * Change feed carried by the {@code dm.messages.inserted} Kafka topic.
 * <p>
 * Records are keyed by the message's pair key, so one thread always maps to one partition and keeps its
 * order. Each node consumes with its own group ({@code dm-feed-{nodeId}}), which turns the topic into a
 * broadcast: every node sees every insert and fans it out to its local sessions.
 * </p>
 * <p>
 * A receiver failure disconnects local subscribers (they reconcile by fetch) and the receiver is restarted
 * with jittered exponential backoff. The group starts at {@code latest}: missed records are not replayed.
 * </p>
 */
public class KafkaChangeFeed extends AbstractChangeFeed {
    private static final Logger log = LoggerFactory.getLogger(KafkaChangeFeed.class);

    private final MessagingConfig config;
    private final KafkaSender<String, String> sender;
    private final JitterBackoff backoff;
    private Disposable receiving;

    public KafkaChangeFeed(MessagingConfig config) {
        this.config = config;
        this.backoff = new JitterBackoff(config.getReconnectBase(), config.getReconnectMax(), config.getReconnectJitter());

        Map<String, Object> producerProps = new HashMap<>();
        producerProps.put(ProducerConfig.BOOTSTRAP_SERVERS_CONFIG, config.getKafkaBootstrap());
        producerProps.put(ProducerConfig.KEY_SERIALIZER_CLASS_CONFIG, StringSerializer.class);
        producerProps.put(ProducerConfig.VALUE_SERIALIZER_CLASS_CONFIG, StringSerializer.class);
        producerProps.put(ProducerConfig.ACKS_CONFIG, "all");
        producerProps.put(ProducerConfig.MAX_IN_FLIGHT_REQUESTS_PER_CONNECTION, "5");
        // Idempotence keeps per-partition order across internal retries
        producerProps.put(ProducerConfig.ENABLE_IDEMPOTENCE_CONFIG, "true");

        this.sender = KafkaSender.create(SenderOptions.create(producerProps));
        log.info("Kafka feed producer initialized for {}", config.getKafkaBootstrap());
    }

    @Override
    public Mono<Void> start() {
        return Mono.fromRunnable(() -> {
            Map<String, Object> consumerProps = new HashMap<>();
            consumerProps.put(ConsumerConfig.BOOTSTRAP_SERVERS_CONFIG, config.getKafkaBootstrap());
            consumerProps.put(ConsumerConfig.GROUP_ID_CONFIG, Topics.feedGroupFor(config.getNodeId()));
            consumerProps.put(ConsumerConfig.KEY_DESERIALIZER_CLASS_CONFIG, StringDeserializer.class);
            consumerProps.put(ConsumerConfig.VALUE_DESERIALIZER_CLASS_CONFIG, StringDeserializer.class);
            consumerProps.put(ConsumerConfig.AUTO_OFFSET_RESET_CONFIG, "latest");
            consumerProps.put(ConsumerConfig.ENABLE_AUTO_COMMIT_CONFIG, "false");

            ReceiverOptions<String, String> options = ReceiverOptions.<String, String>create(consumerProps)
                .subscription(Collections.singleton(Topics.MESSAGES_INSERTED));

            receiving = Flux.defer(() -> KafkaReceiver.create(options).receive())
                .doOnNext(this::handleRecord)
                .doOnError(this::disconnect)
                .retryWhen(Retry.from(signals -> signals.concatMap(signal -> {
                    long attempt = signal.totalRetriesInARow();
                    log.warn("Restarting Kafka feed receiver (attempt {})", attempt + 1);
                    return Mono.delay(backoff.next((int) attempt));
                })))
                .subscribe();

            log.info("Kafka feed consuming {} as group {}", Topics.MESSAGES_INSERTED,
                Topics.feedGroupFor(config.getNodeId()));
        });
    }

    private void handleRecord(ReceiverRecord<String, String> record) {
        try {
            Message message = JsonUtils.readValue(record.value(), Message.class);
            log.debug("Feed record received: id={}, pair={}, partition={}",
                message.getId(), record.key(), record.partition());
            emit(message);
        } catch (RuntimeException e) {
            log.error("Skipping unreadable feed record at {}-{}@{}",
                record.topic(), record.partition(), record.offset(), e);
        } finally {
            record.receiverOffset().acknowledge();
        }
    }

    @Override
    public Mono<Void> publish(Message message) {
        ProducerRecord<String, String> record = new ProducerRecord<>(
            Topics.MESSAGES_INSERTED,
            message.pairKey(),
            JsonUtils.writeValueAsString(message)
        );

        return sender.send(Mono.just(SenderRecord.create(record, message.getId())))
            .next()
            .doOnNext(result -> log.debug("Published message {} to {}", result.correlationMetadata(),
                result.recordMetadata() != null ? result.recordMetadata().partition() : -1))
            .onErrorMap(err -> new TransientException("Failed to publish message " + message.getId(), err))
            .then();
    }

    @Override
    public Mono<Void> stop() {
        return Mono.fromRunnable(() -> {
            if (receiving != null) {
                receiving.dispose();
            }
            sender.close();
            completeSubscribers();
            log.info("Kafka feed stopped");
        });
    }

    @Override
    public String transport() {
        return "kafka";
    }
}
