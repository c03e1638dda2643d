package com.agrisense.fact;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Predicate;
import java.util.stream.Stream;

/**
 * Single-session fact store. Not thread-safe: a session serializes its own
 * access to it.
 */
public class InMemoryFactStore implements FactStore {

    private final LinkedHashMap<Long, Fact> live = new LinkedHashMap<>();
    private final Map<String, LinkedHashMap<Long, Fact>> byKind = new HashMap<>();
    private final Map<FactKey, Long> identities = new HashMap<>();
    private final Map<String, Long> kindVersions = new HashMap<>();
    private long sequence = 0;

    @Override
    public long assertFact(String kind, Map<String, ?> attributes) {
        if (kind == null || kind.isBlank()) {
            throw new IllegalArgumentException("fact kind is required");
        }
        Map<String, Object> normalized = FactValues.normalize(attributes);
        FactKey key = new FactKey(kind, normalized);
        Long existing = identities.get(key);
        if (existing != null) {
            throw new DuplicateFactException(kind, normalized, existing);
        }

        Fact fact = new Fact(++sequence, kind, normalized);
        live.put(fact.id(), fact);
        byKind.computeIfAbsent(kind, k -> new LinkedHashMap<>()).put(fact.id(), fact);
        identities.put(key, fact.id());
        kindVersions.merge(kind, 1L, Long::sum);
        return fact.id();
    }

    @Override
    public Fact retract(long factId) {
        Fact fact = live.remove(factId);
        if (fact == null) {
            throw new UnknownFactException(factId);
        }
        byKind.get(fact.kind()).remove(factId);
        identities.remove(new FactKey(fact.kind(), fact.attributes()));
        kindVersions.merge(fact.kind(), 1L, Long::sum);
        return fact;
    }

    @Override
    public Stream<Fact> query(String kind, Predicate<Fact> predicate) {
        LinkedHashMap<Long, Fact> facts = byKind.get(kind);
        if (facts == null || facts.isEmpty()) {
            return Stream.empty();
        }
        List<Fact> snapshot = new ArrayList<>(facts.values());
        return snapshot.stream().filter(predicate);
    }

    @Override
    public Optional<Fact> get(long factId) {
        return Optional.ofNullable(live.get(factId));
    }

    @Override
    public List<Fact> facts() {
        return List.copyOf(live.values());
    }

    @Override
    public int size() {
        return live.size();
    }

    @Override
    public long kindVersion(String kind) {
        return kindVersions.getOrDefault(kind, 0L);
    }

    private record FactKey(String kind, Map<String, Object> attributes) {}
}
