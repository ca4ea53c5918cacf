package com.ryuqq.relay.adapter.inmemory.sink;

import com.ryuqq.relay.core.spi.DeadLetter;
import com.ryuqq.relay.core.spi.DeadLetterSink;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.stream.Collectors;

/**
 * Dead-letter sink that keeps entries in memory.
 *
 * @author Relay Team
 * @since 1.0.0
 */
public class InMemoryDeadLetterSink implements DeadLetterSink {

    private static final Logger log = LoggerFactory.getLogger(InMemoryDeadLetterSink.class);

    private final List<DeadLetter> entries = new CopyOnWriteArrayList<>();

    @Override
    public void deadLetter(DeadLetter deadLetter) {
        if (deadLetter == null) {
            throw new IllegalArgumentException("deadLetter cannot be null");
        }
        entries.add(deadLetter);
        log.info("Dead-lettered message {} from '{}' after {} failures",
            deadLetter.envelope().messageId(), deadLetter.destination(), deadLetter.failureCount());
    }

    public List<DeadLetter> deadLetters() {
        return List.copyOf(entries);
    }

    public List<DeadLetter> deadLetters(String destination) {
        return entries.stream()
            .filter(entry -> entry.destination().equals(destination))
            .collect(Collectors.toUnmodifiableList());
    }

    public int count() {
        return entries.size();
    }

    public void clear() {
        entries.clear();
    }
}
