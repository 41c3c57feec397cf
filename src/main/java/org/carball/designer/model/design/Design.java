package org.carball.designer.model.design;

import org.carball.designer.model.workload.Operation;
import org.carball.designer.stats.UnknownCollectionException;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;

/**
 * A candidate physical design: shard keys, denormalization parents and secondary indexes.
 * Instances are immutable; use {@link #builder()} or {@link #toBuilder()} to derive new ones.
 *
 * <p>A collection with a denormalization parent is embedded in the parent's documents and
 * has no shard key of its own. A collection without a declared shard key is sharded on
 * {@code _id}.
 */
public final class Design {

    public static final List<String> DEFAULT_SHARD_KEY = List.of(Operation.ID_FIELD);

    private final Map<String, List<String>> shardKeys;
    private final Map<String, String> denormParents;
    private final Map<String, Set<List<String>>> indexes;

    private Design(Builder builder) {
        Map<String, List<String>> keys = new LinkedHashMap<>();
        builder.shardKeys.forEach((collection, fields) -> keys.put(collection, List.copyOf(fields)));
        this.shardKeys = Collections.unmodifiableMap(keys);

        this.denormParents = Collections.unmodifiableMap(new LinkedHashMap<>(builder.denormParents));

        Map<String, Set<List<String>>> idx = new LinkedHashMap<>();
        builder.indexes.forEach((collection, declared) -> {
            Set<List<String>> copy = new LinkedHashSet<>();
            declared.forEach(fields -> copy.add(List.copyOf(fields)));
            idx.put(collection, Collections.unmodifiableSet(copy));
        });
        this.indexes = Collections.unmodifiableMap(idx);
    }

    public static Builder builder() {
        return new Builder();
    }

    public Builder toBuilder() {
        Builder builder = new Builder();
        shardKeys.forEach(builder::shardKey);
        denormParents.forEach(builder::denormalize);
        indexes.forEach((collection, declared) -> declared.forEach(fields -> builder.index(collection, fields)));
        return builder;
    }

    public Map<String, List<String>> getShardKeys() {
        return shardKeys;
    }

    public Map<String, String> getDenormParents() {
        return denormParents;
    }

    public Map<String, Set<List<String>>> getIndexes() {
        return indexes;
    }

    public Optional<List<String>> getShardKey(String collection) {
        return Optional.ofNullable(shardKeys.get(collection));
    }

    public Optional<String> getDenormalizationParent(String collection) {
        return Optional.ofNullable(denormParents.get(collection));
    }

    public boolean isDenormalized(String collection) {
        return denormParents.containsKey(collection);
    }

    public Set<List<String>> getIndexes(String collection) {
        return indexes.getOrDefault(collection, Set.of());
    }

    /**
     * Every collection the design mentions, in sorted order.
     */
    public Set<String> getCollections() {
        Set<String> collections = new TreeSet<>(shardKeys.keySet());
        collections.addAll(denormParents.keySet());
        collections.addAll(denormParents.values());
        collections.addAll(indexes.keySet());
        return collections;
    }

    /**
     * Follows denormalization parents to the collection that physically stores the documents.
     */
    public String resolveRoot(String collection) {
        String current = collection;
        Set<String> visited = new LinkedHashSet<>();
        while (denormParents.containsKey(current)) {
            if (!visited.add(current)) {
                throw new InvalidDesignException("Denormalization cycle through " + visited);
            }
            current = denormParents.get(current);
        }
        return current;
    }

    /**
     * The shard key that decides where documents of {@code collection} live, taken from its root.
     */
    public List<String> effectiveShardKey(String collection) {
        return shardKeys.getOrDefault(resolveRoot(collection), DEFAULT_SHARD_KEY);
    }

    /**
     * Checks structural invariants against the collections that have statistics.
     *
     * @throws UnknownCollectionException if the design names a collection outside {@code knownCollections}
     * @throws InvalidDesignException     if denormalization is cyclic, nested or conflicts with a shard key
     */
    public void validate(Set<String> knownCollections) {
        for (String collection : getCollections()) {
            if (!knownCollections.contains(collection)) {
                throw new UnknownCollectionException(collection);
            }
        }
        shardKeys.forEach((collection, fields) -> {
            if (fields.isEmpty()) {
                throw new InvalidDesignException("Empty shard key for collection '" + collection + "'");
            }
        });
        for (Map.Entry<String, String> link : denormParents.entrySet()) {
            String child = link.getKey();
            String parent = link.getValue();
            if (child.equals(parent)) {
                throw new InvalidDesignException("Collection '" + child + "' cannot be denormalized into itself");
            }
            if (denormParents.containsKey(parent)) {
                // Either a cycle or a chain deeper than one level
                resolveRoot(child);
                throw new InvalidDesignException(String.format(
                        "Collection '%s' is denormalized into '%s', which is itself embedded in '%s'",
                        child, parent, denormParents.get(parent)));
            }
            if (shardKeys.containsKey(child)) {
                throw new InvalidDesignException(String.format(
                        "Collection '%s' is embedded in '%s' and cannot have its own shard key", child, parent));
            }
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Design other)) return false;
        return shardKeys.equals(other.shardKeys)
                && denormParents.equals(other.denormParents)
                && indexes.equals(other.indexes);
    }

    @Override
    public int hashCode() {
        return Objects.hash(shardKeys, denormParents, indexes);
    }

    @Override
    public String toString() {
        return "Design{shardKeys=" + shardKeys + ", denormParents=" + denormParents + ", indexes=" + indexes + "}";
    }

    public static final class Builder {
        private final Map<String, List<String>> shardKeys = new LinkedHashMap<>();
        private final Map<String, String> denormParents = new LinkedHashMap<>();
        private final Map<String, List<List<String>>> indexes = new LinkedHashMap<>();

        private Builder() {
        }

        public Builder shardKey(String collection, List<String> fields) {
            shardKeys.put(collection, new ArrayList<>(fields));
            return this;
        }

        public Builder shardKey(String collection, String... fields) {
            return shardKey(collection, List.of(fields));
        }

        public Builder denormalize(String child, String parent) {
            denormParents.put(child, parent);
            return this;
        }

        public Builder index(String collection, List<String> fields) {
            indexes.computeIfAbsent(collection, c -> new ArrayList<>()).add(new ArrayList<>(fields));
            return this;
        }

        public Builder index(String collection, String... fields) {
            return index(collection, List.of(fields));
        }

        public Design build() {
            return new Design(this);
        }
    }
}
