package io.ledgerrelay.bus;

import io.ledgerrelay.model.MessageEnvelope;

import java.util.List;
import java.util.stream.Stream;

/**
 * Durable per-topic FIFO queue with at-least-once delivery.
 */
public interface Broker {

    void publish(String topic, MessageEnvelope message);

    Stream<Delivery> consume(String topic, String consumerId);

    int recover(String consumerId);

    void ack(Delivery delivery);

    void retryLater(Delivery delivery);

    void releaseParked(String msgId);

    void deadLetter(Delivery delivery);

    int depth(String topic);

    List<DeadLetter> deadLetters(int limit);
}
