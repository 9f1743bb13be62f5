package yaml.java17;

import java.math.BigInteger;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/// The interface that represents a YAML value composed under the Core Schema.
///
/// Instances of `YamlValue` are immutable and thread safe. Equality is structural: two values
/// are equal when they have the same kind and equal contents; mappings compare as sets of entries.
///
/// A `YamlValue` can be produced by {@link Yaml#parse(String)} or built directly from the
/// `of(...)` factories of each kind.
///
/// ```java
/// YamlValue doc = Yaml.parse("server:\n  port: 8080\n");
/// long port = doc.get("server").get("port").toLong();
/// ```
public sealed interface YamlValue
        permits YamlNull, YamlBool, YamlInt, YamlFloat, YamlString, YamlSequence, YamlMapping {

    /// {@return a short name of this value's kind, as used in error messages}
    String kind();

    /// {@return the `boolean` value represented by a `YamlBool`}
    default boolean bool() {
        throw YamlAssertionException.typeError(this, "YamlBool");
    }

    /// {@return this `YamlInt` as a `long`}
    /// @throws YamlAssertionException if this is not a `YamlInt` or does not fit in a `long`
    default long toLong() {
        throw YamlAssertionException.typeError(this, "YamlInt");
    }

    /// {@return this `YamlInt` as a `BigInteger`}
    default BigInteger toBigInteger() {
        throw YamlAssertionException.typeError(this, "YamlInt");
    }

    /// {@return this numeric value as a `double`; `YamlInt` values are widened}
    default double toDouble() {
        throw YamlAssertionException.typeError(this, "YamlFloat");
    }

    /// {@return the `String` value represented by a `YamlString`}
    default String string() {
        throw YamlAssertionException.typeError(this, "YamlString");
    }

    /// {@return the elements of a `YamlSequence`}
    default List<YamlValue> elements() {
        throw YamlAssertionException.typeError(this, "YamlSequence");
    }

    /// {@return the entries of a `YamlMapping`, in document order}
    default List<YamlMapping.Entry> entries() {
        throw YamlAssertionException.typeError(this, "YamlMapping");
    }

    /// {@return true if this is a `YamlNull`}
    default boolean isNull() {
        return false;
    }

    /// {@return the value associated with the given key of a `YamlMapping`}
    ///
    /// @throws YamlAssertionException if this is not a `YamlMapping` or the key is absent
    default YamlValue get(YamlValue key) {
        Objects.requireNonNull(key);
        return getOrAbsent(key).orElseThrow(() -> new YamlAssertionException(
                "YamlMapping key %s does not exist.".formatted(key)));
    }

    /// Shorthand for `get(YamlString.of(key))`.
    default YamlValue get(String key) {
        return get(YamlString.of(key));
    }

    /// {@return the value associated with the key, or an empty `Optional` if there is none}
    /// @throws YamlAssertionException if this is not a `YamlMapping`
    default Optional<YamlValue> getOrAbsent(YamlValue key) {
        Objects.requireNonNull(key);
        for (YamlMapping.Entry entry : entries()) {
            if (entry.key().equals(key)) {
                return Optional.of(entry.value());
            }
        }
        return Optional.empty();
    }

    /// Shorthand for `getOrAbsent(YamlString.of(key))`.
    default Optional<YamlValue> getOrAbsent(String key) {
        return getOrAbsent(YamlString.of(key));
    }

    /// {@return the element at the given index of a `YamlSequence`}
    /// @throws YamlAssertionException if this is not a sequence or the index is out of bounds
    default YamlValue element(int index) {
        final List<YamlValue> elements = elements();
        if (index < 0 || index >= elements.size()) {
            throw new YamlAssertionException(
                    "YamlSequence index %d out of bounds for length %d.".formatted(index, elements.size()));
        }
        return elements.get(index);
    }
}
