package yaml.java17;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/// Utilities over the value graph.
public final class YamlValues {

    /// Total, stable ordering of values, used for `sortKeys` emission.
    ///
    /// Kinds are ordered Null < Bool < Int < Float < Str < Sequence < Mapping. Within a kind:
    /// false < true, integers numerically, floats by `Double.compare` with `-0.0` folded into
    /// `0.0` (NaN sorts last), strings lexically, sequences element by element and then by
    /// size. Mappings compare like sequences of their entries sorted by key, so the order agrees
    /// with mapping equality.
    public static final Comparator<YamlValue> ORDER = YamlValues::compare;

    private static final Comparator<YamlMapping.Entry> ENTRY_ORDER =
            Comparator.comparing(YamlMapping.Entry::key, ORDER).thenComparing(YamlMapping.Entry::value, ORDER);

    private YamlValues() {}

    static int rank(YamlValue value) {
        if (value instanceof YamlNull) return 0;
        if (value instanceof YamlBool) return 1;
        if (value instanceof YamlInt) return 2;
        if (value instanceof YamlFloat) return 3;
        if (value instanceof YamlString) return 4;
        if (value instanceof YamlSequence) return 5;
        return 6;
    }

    private static int compare(YamlValue a, YamlValue b) {
        final int byKind = Integer.compare(rank(a), rank(b));
        if (byKind != 0) {
            return byKind;
        }
        if (a instanceof YamlBool x && b instanceof YamlBool y) {
            return Boolean.compare(x.value(), y.value());
        }
        if (a instanceof YamlInt x && b instanceof YamlInt y) {
            return x.value().compareTo(y.value());
        }
        if (a instanceof YamlFloat x && b instanceof YamlFloat y) {
            return Double.compare(x.normalized(), y.normalized());
        }
        if (a instanceof YamlString x && b instanceof YamlString y) {
            return x.value().compareTo(y.value());
        }
        if (a instanceof YamlSequence x && b instanceof YamlSequence y) {
            return compareLists(x.values(), y.values(), ORDER);
        }
        if (a instanceof YamlMapping x && b instanceof YamlMapping y) {
            return compareLists(sorted(x), sorted(y), ENTRY_ORDER);
        }
        return 0;
    }

    private static List<YamlMapping.Entry> sorted(YamlMapping mapping) {
        final List<YamlMapping.Entry> entries = new ArrayList<>(mapping.entries());
        entries.sort(ENTRY_ORDER);
        return entries;
    }

    private static <T> int compareLists(List<T> a, List<T> b, Comparator<T> cmp) {
        final int n = Math.min(a.size(), b.size());
        for (int i = 0; i < n; i++) {
            final int c = cmp.compare(a.get(i), b.get(i));
            if (c != 0) {
                return c;
            }
        }
        return Integer.compare(a.size(), b.size());
    }
}
