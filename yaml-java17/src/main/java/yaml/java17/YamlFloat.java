package yaml.java17;

/// A 64-bit floating point value, including the non-finite `.inf`, `-.inf` and `.nan`.
///
/// Equality differs from `Double.equals` in one respect: `-0.0` equals `0.0`, since the YAML
/// text form does not carry the sign of zero through every emitter. NaN equals NaN so that a
/// structural comparison of a reloaded document succeeds.
public record YamlFloat(double value) implements YamlValue {

    public static YamlFloat of(double value) {
        return new YamlFloat(value);
    }

    @Override
    public String kind() {
        return "float";
    }

    @Override
    public double toDouble() {
        return value;
    }

    public boolean isNaN() {
        return Double.isNaN(value);
    }

    public boolean isInfinite() {
        return Double.isInfinite(value);
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof YamlFloat other && Double.compare(normalized(), other.normalized()) == 0;
    }

    @Override
    public int hashCode() {
        return Double.hashCode(normalized());
    }

    double normalized() {
        return value == 0.0 ? 0.0 : value;
    }

    @Override
    public String toString() {
        if (Double.isNaN(value)) {
            return ".nan";
        }
        if (Double.isInfinite(value)) {
            return value > 0 ? ".inf" : "-.inf";
        }
        return Double.toString(value);
    }
}
