package io.ledgerrelay.bus;

import com.fasterxml.jackson.databind.JsonNode;
import io.ledgerrelay.config.LedgerRelayConfig;
import io.ledgerrelay.model.MessageEnvelope;
import io.ledgerrelay.util.Jsons;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.Spliterator;
import java.util.Spliterators;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Consumer;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;

public final class FileBroker implements Broker {
    private static final Logger log = LoggerFactory.getLogger(FileBroker.class);
    private static final String SUFFIX = ".msg.json";
    private static final AtomicLong LAST_SEQUENCE = new AtomicLong(0L);

    private final LedgerRelayConfig config;

    public FileBroker(LedgerRelayConfig config) {
        this.config = config;
    }

    @Override
    public void publish(String topic, MessageEnvelope message) {
        message.validate();
        if (!message.topic().equals(topic)) {
            throw new IllegalArgumentException("message " + message.msgId() + " belongs to topic "
                    + message.topic() + ", not " + topic);
        }
        String fileName = String.format("%020d_%s%s", nextSequence(), message.msgId(), SUFFIX);
        Path inbox = config.topicInbox(topic);
        Path tmp = inbox.resolve("." + fileName + ".tmp");
        try {
            Files.createDirectories(inbox);
            Files.writeString(tmp, Jsons.toCompactJson(message), StandardCharsets.UTF_8);
            move(tmp, inbox.resolve(fileName));
        } catch (IOException e) {
            throw new BrokerUnavailableException("Failed to publish " + message.msgId() + " to " + topic, e);
        }
        log.debug("Published {} to {} as {}", message.msgId(), topic, fileName);
    }

    @Override
    public Stream<Delivery> consume(String topic, String consumerId) {
        Spliterator<Delivery> claims = new Spliterators.AbstractSpliterator<>(Long.MAX_VALUE,
                Spliterator.ORDERED | Spliterator.NONNULL) {
            @Override
            public boolean tryAdvance(Consumer<? super Delivery> action) {
                Optional<Delivery> next = claimNext(topic, consumerId);
                next.ifPresent(action);
                return next.isPresent();
            }
        };
        return StreamSupport.stream(claims, false);
    }

    @Override
    public synchronized int recover(String consumerId) {
        Path workerDir = config.processingDir().resolve(consumerId);
        int recovered = 0;
        for (Path file : listMessageFiles(workerDir)) {
            Optional<MessageEnvelope> envelope = readEnvelope(file);
            try {
                if (envelope.isEmpty()) {
                    move(file, config.deadRoot().resolve(file.getFileName().toString()));
                    continue;
                }
                Path inbox = config.topicInbox(envelope.get().topic());
                Files.createDirectories(inbox);
                move(file, inbox.resolve(file.getFileName().toString()));
                recovered++;
            } catch (IOException e) {
                throw new BrokerUnavailableException("Failed to recover " + file + " for " + consumerId, e);
            }
        }
        if (recovered > 0) {
            log.info("Returned {} unacknowledged message(s) of consumer {} to their topics", recovered, consumerId);
        }
        return recovered;
    }

    @Override
    public void ack(Delivery delivery) {
        Path dailyDoneDir = config.doneRoot().resolve(LocalDate.now().toString());
        settle(delivery, dailyDoneDir, "done");
    }

    @Override
    public void retryLater(Delivery delivery) {
        settle(delivery, config.retryRoot(), "retry");
    }

    @Override
    public void releaseParked(String msgId) {
        if (msgId == null || msgId.isBlank()) {
            return;
        }
        for (Path file : listMessageFiles(config.retryRoot())) {
            if (file.getFileName().toString().endsWith("_" + msgId + SUFFIX)) {
                try {
                    Files.deleteIfExists(file);
                } catch (IOException e) {
                    throw new RuntimeException("Failed to release parked message: " + msgId, e);
                }
            }
        }
    }

    @Override
    public void deadLetter(Delivery delivery) {
        settle(delivery, config.deadRoot(), "dead");
    }

    @Override
    public int depth(String topic) {
        return listMessageFiles(config.topicInbox(topic)).size();
    }

    @Override
    public List<DeadLetter> deadLetters(int limit) {
        List<Path> files = listMessageFiles(config.deadRoot());
        List<DeadLetter> out = new ArrayList<>();
        for (int i = files.size() - 1; i >= 0 && out.size() < Math.max(1, limit); i--) {
            Path file = files.get(i);
            try {
                JsonNode message;
                String raw = Files.readString(file, StandardCharsets.UTF_8);
                try {
                    message = Jsons.readTree(raw);
                } catch (IllegalArgumentException e) {
                    message = Jsons.mapper().getNodeFactory().textNode(raw);
                }
                out.add(new DeadLetter(file.getFileName().toString(), Files.getLastModifiedTime(file).toMillis(), message));
            } catch (NoSuchFileException e) {
                log.debug("Dead letter {} disappeared while listing", file);
            } catch (IOException e) {
                throw new RuntimeException("Failed to read dead letter: " + file, e);
            }
        }
        return out;
    }

    private synchronized Optional<Delivery> claimNext(String topic, String consumerId) {
        Path workerDir = config.processingDir().resolve(consumerId);
        for (Path candidate : listMessageFiles(config.topicInbox(topic))) {
            Path claimed = workerDir.resolve(candidate.getFileName().toString());
            try {
                Files.createDirectories(workerDir);
                move(candidate, claimed);
            } catch (NoSuchFileException e) {
                continue;
            } catch (IOException e) {
                throw new BrokerUnavailableException("Failed to claim " + candidate, e);
            }
            Optional<MessageEnvelope> envelope = readEnvelope(claimed);
            if (envelope.isPresent() && topic.equals(envelope.get().topic())) {
                return Optional.of(new Delivery(envelope.get(), consumerId, claimed));
            }
            log.warn("Dead-lettering invalid message {} from topic {}", claimed.getFileName(), topic);
            try {
                move(claimed, config.deadRoot().resolve(claimed.getFileName().toString()));
            } catch (IOException e) {
                throw new BrokerUnavailableException("Failed to dead-letter " + claimed, e);
            }
        }
        return Optional.empty();
    }

    private Optional<MessageEnvelope> readEnvelope(Path file) {
        try {
            MessageEnvelope envelope = Jsons.mapper().readValue(file.toFile(), MessageEnvelope.class);
            envelope.validate();
            return Optional.of(envelope);
        } catch (IOException | IllegalArgumentException e) {
            log.warn("Unreadable message {}: {}", file.getFileName(), e.getMessage());
            return Optional.empty();
        }
    }

    private void settle(Delivery delivery, Path targetDir, String label) {
        try {
            Files.createDirectories(targetDir);
            move(delivery.processingFile(), targetDir.resolve(delivery.processingFile().getFileName().toString()));
        } catch (IOException e) {
            throw new RuntimeException("Failed to move message " + delivery.envelope().msgId() + " to " + label + " directory", e);
        }
    }

    private static void move(Path from, Path to) throws IOException {
        try {
            Files.move(from, to, StandardCopyOption.ATOMIC_MOVE);
        } catch (AtomicMoveNotSupportedException e) {
            Files.move(from, to, StandardCopyOption.REPLACE_EXISTING);
        }
    }

    private static List<Path> listMessageFiles(Path dir) {
        List<Path> files = new ArrayList<>();
        if (!Files.isDirectory(dir)) {
            return files;
        }
        try (DirectoryStream<Path> stream = Files.newDirectoryStream(dir, "*" + SUFFIX)) {
            for (Path path : stream) {
                if (!path.getFileName().toString().startsWith(".")) {
                    files.add(path);
                }
            }
        } catch (IOException e) {
            throw new BrokerUnavailableException("Failed to list broker directory: " + dir, e);
        }
        files.sort(Comparator.comparing(path -> path.getFileName().toString()));
        return files;
    }

    private static long nextSequence() {
        long nowMicros = System.currentTimeMillis() * 1000L;
        return LAST_SEQUENCE.updateAndGet(last -> Math.max(last + 1L, nowMicros));
    }
}
