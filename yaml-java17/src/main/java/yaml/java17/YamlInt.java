package yaml.java17;

import java.math.BigInteger;
import java.util.Objects;

/// An integer of arbitrary size. Decimal, `0o` octal and `0x` hexadecimal forms all compose
/// to this kind.
public record YamlInt(BigInteger value) implements YamlValue {

    public YamlInt {
        Objects.requireNonNull(value, "value must not be null");
    }

    public static YamlInt of(long value) {
        return new YamlInt(BigInteger.valueOf(value));
    }

    public static YamlInt of(BigInteger value) {
        return new YamlInt(value);
    }

    @Override
    public String kind() {
        return "int";
    }

    @Override
    public long toLong() {
        try {
            return value.longValueExact();
        } catch (ArithmeticException ex) {
            throw new YamlAssertionException("YamlInt %s does not fit in a long.".formatted(value));
        }
    }

    @Override
    public BigInteger toBigInteger() {
        return value;
    }

    @Override
    public double toDouble() {
        return value.doubleValue();
    }

    @Override
    public String toString() {
        return value.toString();
    }
}
