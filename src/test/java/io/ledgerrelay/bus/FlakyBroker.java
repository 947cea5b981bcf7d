package io.ledgerrelay.bus;

import io.ledgerrelay.model.MessageEnvelope;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.Stream;

public final class FlakyBroker implements Broker {
    private final Broker delegate;
    private final AtomicBoolean available = new AtomicBoolean(true);
    private final AtomicInteger rejected = new AtomicInteger();
    private final List<MessageEnvelope> published = Collections.synchronizedList(new ArrayList<>());

    public FlakyBroker(Broker delegate) {
        this.delegate = delegate;
    }

    public void setAvailable(boolean value) {
        available.set(value);
    }

    public int rejectedPublishes() {
        return rejected.get();
    }

    public List<MessageEnvelope> published() {
        synchronized (published) {
            return List.copyOf(published);
        }
    }

    @Override
    public void publish(String topic, MessageEnvelope message) {
        if (!available.get()) {
            rejected.incrementAndGet();
            throw new BrokerUnavailableException("broker down");
        }
        delegate.publish(topic, message);
        published.add(message);
    }

    @Override
    public Stream<Delivery> consume(String topic, String consumerId) {
        return delegate.consume(topic, consumerId);
    }

    @Override
    public int recover(String consumerId) {
        return delegate.recover(consumerId);
    }

    @Override
    public void ack(Delivery delivery) {
        delegate.ack(delivery);
    }

    @Override
    public void retryLater(Delivery delivery) {
        delegate.retryLater(delivery);
    }

    @Override
    public void releaseParked(String msgId) {
        delegate.releaseParked(msgId);
    }

    @Override
    public void deadLetter(Delivery delivery) {
        delegate.deadLetter(delivery);
    }

    @Override
    public int depth(String topic) {
        return delegate.depth(topic);
    }

    @Override
    public List<DeadLetter> deadLetters(int limit) {
        return delegate.deadLetters(limit);
    }
}
