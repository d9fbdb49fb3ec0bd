package com.phillippitts.enginecoordinator.service.recall;

import java.time.Clock;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.function.Consumer;

/**
 * Default backend: brute-force cosine scan over hashed bag-of-words embeddings.
 */
public class InMemoryVectorBackend implements MemoryBackend {

    private final HashingEmbedder embedder;
    private final Clock clock;
    private final Map<String, MemoryEntry> entries = new LinkedHashMap<>();
    private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();
    private final AtomicLong sequence = new AtomicLong();

    public InMemoryVectorBackend(HashingEmbedder embedder, Clock clock) {
        this.embedder = Objects.requireNonNull(embedder, "embedder");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    @Override
    public void search(RecallQuery query, Consumer<RecallHit> sink) throws InterruptedException {
        float[] probe = query.vector() != null && query.vector().length > 0
                ? query.vector()
                : embedder.embed(query.key());
        List<MemoryEntry> snapshot;
        lock.readLock().lock();
        try {
            snapshot = new ArrayList<>(entries.values());
        } finally {
            lock.readLock().unlock();
        }
        for (MemoryEntry e : snapshot) {
            if (Thread.interrupted()) {
                throw new InterruptedException("Recall scan interrupted");
            }
            double score = HashingEmbedder.cosine(probe, e.vector());
            if (score > 0) {
                sink.accept(new RecallHit(e.id(), score, e.content(), e.sequence()));
            }
        }
    }

    @Override
    public MemoryEntry insert(String id, String content, Map<String, String> metadata) {
        if (content == null || content.isBlank()) {
            throw new IllegalArgumentException("Memory content must not be blank");
        }
        MemoryEntry entry = new MemoryEntry(id, content.trim(), metadata, embedder.embed(content),
                sequence.incrementAndGet(), clock.instant());
        lock.writeLock().lock();
        try {
            entries.remove(id);
            entries.put(id, entry);
        } finally {
            lock.writeLock().unlock();
        }
        return entry;
    }

    @Override
    public int size() {
        lock.readLock().lock();
        try {
            return entries.size();
        } finally {
            lock.readLock().unlock();
        }
    }
}
