package yaml.java17;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.stream.Collectors;

/// An ordered list of key/value entries whose keys are pairwise distinct.
///
/// Keys may be any `YamlValue`, including collections. Constructing a mapping with two
/// structurally equal keys fails; nothing is silently overwritten.
///
/// Entry order is kept for iteration and emission but does not take part in equality: two
/// mappings are equal when they hold the same key/value pairs.
public record YamlMapping(List<Entry> entries) implements YamlValue {

    public YamlMapping {
        Objects.requireNonNull(entries, "entries must not be null");
        entries = List.copyOf(entries);
        final Set<YamlValue> seen = new HashSet<>();
        for (Entry entry : entries) {
            if (!seen.add(entry.key())) {
                throw new IllegalArgumentException("duplicate mapping key " + entry.key());
            }
        }
    }

    public static YamlMapping of(List<Entry> entries) {
        return new YamlMapping(entries);
    }

    /// Builds a mapping with string keys, in the iteration order of the map.
    public static YamlMapping of(Map<String, ? extends YamlValue> members) {
        final var entries = new ArrayList<Entry>(members.size());
        members.forEach((k, v) -> entries.add(new Entry(YamlString.of(k), v)));
        return new YamlMapping(entries);
    }

    public static YamlMapping of() {
        return new YamlMapping(List.of());
    }

    @Override
    public String kind() {
        return "map";
    }

    public int size() {
        return entries.size();
    }

    /// {@return the entries as a map from string keys; non-string keys use their `toString`}
    public Map<String, YamlValue> members() {
        final var out = new LinkedHashMap<String, YamlValue>();
        for (Entry e : entries) {
            out.put(e.key() instanceof YamlString s ? s.value() : e.key().toString(), e.value());
        }
        return out;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof YamlMapping other) || other.entries.size() != entries.size()) {
            return false;
        }
        for (Entry entry : entries) {
            final var value = other.getOrAbsent(entry.key());
            if (value.isEmpty() || !value.get().equals(entry.value())) {
                return false;
            }
        }
        return true;
    }

    @Override
    public int hashCode() {
        int h = 0;
        for (Entry entry : entries) {
            h += entry.hashCode();
        }
        return h;
    }

    @Override
    public String toString() {
        return entries.stream().map(e -> e.key() + ": " + e.value())
                .collect(Collectors.joining(", ", "{", "}"));
    }

    /// One key/value pair of a mapping.
    public record Entry(YamlValue key, YamlValue value) {
        public Entry {
            Objects.requireNonNull(key, "key must not be null");
            Objects.requireNonNull(value, "value must not be null");
        }

        public static Entry of(String key, YamlValue value) {
            return new Entry(YamlString.of(key), value);
        }
    }
}
