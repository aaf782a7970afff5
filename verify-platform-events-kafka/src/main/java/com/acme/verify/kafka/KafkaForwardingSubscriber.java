package com.acme.verify.kafka;

import com.acme.verify.config.EventsConfig;
import com.acme.verify.core.Jsons;
import com.acme.verify.core.PublishException;
import com.acme.verify.events.EventPattern;
import com.acme.verify.events.EventSubscriber;
import com.acme.verify.events.EventTypeConstants;
import com.acme.verify.events.VerificationDetail;
import io.micronaut.context.annotation.Requires;
import jakarta.inject.Singleton;
import org.apache.kafka.clients.producer.Producer;
import org.apache.kafka.clients.producer.ProducerRecord;
import org.apache.kafka.clients.producer.RecordMetadata;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Event subscriber that forwards verification details to a Kafka topic, keyed by subject so all
 * events of one subject land on the same partition.
 */
@Singleton
@Requires(property = "events.kafka.enabled", value = "true")
public class KafkaForwardingSubscriber implements EventSubscriber {

    public static final String NAME = "kafka-forwarder";
    private static final Logger LOG = LoggerFactory.getLogger(KafkaForwardingSubscriber.class);

    private final Producer<String, String> producer;
    private final EventPattern pattern;
    private final String topic;
    private final Duration sendTimeout;

    public KafkaForwardingSubscriber(Producer<String, String> producer, EventsConfig config) {
        this.producer = producer;
        this.pattern = new EventPattern(config.getSource(), EventTypeConstants.VERIFICATION_SUCCEEDED);
        this.topic = config.getKafka().getTopic();
        this.sendTimeout = config.getKafka().getSendTimeout();
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public EventPattern pattern() {
        return pattern;
    }

    @Override
    public void deliver(String detailJson) {
        VerificationDetail detail = Jsons.fromJson(detailJson, VerificationDetail.class);
        ProducerRecord<String, String> record = new ProducerRecord<>(topic, detail.subject(), detailJson);
        record.headers().add("detail-type", pattern.detailType().getBytes(StandardCharsets.UTF_8));
        record.headers().add("source", pattern.source().getBytes(StandardCharsets.UTF_8));

        try {
            RecordMetadata metadata = producer.send(record).get(sendTimeout.toMillis(), TimeUnit.MILLISECONDS);
            LOG.debug("Forwarded verification detail to {}-{}@{}",
                    metadata.topic(), metadata.partition(), metadata.offset());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new PublishException("interrupted while forwarding to " + topic, e);
        } catch (ExecutionException e) {
            throw new PublishException("kafka rejected record for " + topic + ": " + e.getCause(), e.getCause());
        } catch (TimeoutException e) {
            throw new PublishException("kafka send to " + topic + " timed out after " + sendTimeout, e);
        }
    }
}
