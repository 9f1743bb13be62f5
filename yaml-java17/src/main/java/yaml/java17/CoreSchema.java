package yaml.java17;

import java.math.BigInteger;
import java.util.Optional;
import java.util.regex.Pattern;

/// YAML 1.2.2 Core Schema tag resolution for plain scalars.
///
/// Only the exact lowercase `null`, `true` and `false` spellings resolve to non-strings; the
/// capitalized and YAML 1.1 forms (`True`, `NULL`, `yes`, `on`) remain strings.
public final class CoreSchema {

    public static final String TAG_PREFIX = "tag:yaml.org,2002:";
    public static final String STR = TAG_PREFIX + "str";
    public static final String INT = TAG_PREFIX + "int";
    public static final String FLOAT = TAG_PREFIX + "float";
    public static final String BOOL = TAG_PREFIX + "bool";
    public static final String NULL = TAG_PREFIX + "null";
    public static final String SEQ = TAG_PREFIX + "seq";
    public static final String MAP = TAG_PREFIX + "map";

    private static final Pattern DECIMAL = Pattern.compile("[-+]?[0-9]+");
    private static final Pattern OCTAL = Pattern.compile("0o[0-7]+");
    private static final Pattern HEX = Pattern.compile("0x[0-9a-fA-F]+");
    private static final Pattern FLOAT_NUMBER =
            Pattern.compile("[-+]?(\\.[0-9]+|[0-9]+(\\.[0-9]*)?)([eE][-+]?[0-9]+)?");
    private static final Pattern INFINITY = Pattern.compile("[-+]?\\.(inf|Inf|INF)");
    private static final Pattern NAN = Pattern.compile("\\.nan", Pattern.CASE_INSENSITIVE);

    private CoreSchema() {}

    /// Resolves an untagged plain scalar.
    public static YamlValue resolvePlain(String text) {
        if (isNull(text)) {
            return YamlNull.of();
        }
        if ("true".equals(text)) {
            return YamlBool.of(true);
        }
        if ("false".equals(text)) {
            return YamlBool.of(false);
        }
        final Optional<BigInteger> integer = parseInt(text);
        if (integer.isPresent()) {
            return YamlInt.of(integer.get());
        }
        final Optional<Double> real = parseFloat(text);
        if (real.isPresent()) {
            return YamlFloat.of(real.get());
        }
        return YamlString.of(text);
    }

    /// {@return true if a plain scalar with this text would not resolve to a string}
    public static boolean resolvesToNonString(String text) {
        return !(resolvePlain(text) instanceof YamlString);
    }

    static boolean isNull(String text) {
        return text.isEmpty() || "~".equals(text) || "null".equals(text);
    }

    static Optional<BigInteger> parseInt(String text) {
        if (DECIMAL.matcher(text).matches()) {
            final String digits = text.charAt(0) == '+' ? text.substring(1) : text;
            return Optional.of(new BigInteger(digits));
        }
        if (OCTAL.matcher(text).matches()) {
            return Optional.of(new BigInteger(text.substring(2), 8));
        }
        if (HEX.matcher(text).matches()) {
            return Optional.of(new BigInteger(text.substring(2), 16));
        }
        return Optional.empty();
    }

    static Optional<Double> parseFloat(String text) {
        if (FLOAT_NUMBER.matcher(text).matches()) {
            return Optional.of(Double.parseDouble(text));
        }
        if (INFINITY.matcher(text).matches()) {
            return Optional.of(text.charAt(0) == '-' ? Double.NEGATIVE_INFINITY : Double.POSITIVE_INFINITY);
        }
        if (NAN.matcher(text).matches()) {
            return Optional.of(Double.NaN);
        }
        return Optional.empty();
    }

    /// {@return true for the YAML 1.1 boolean words that other loaders still read as booleans}
    static boolean isYaml11Boolean(String text) {
        return switch (text.toLowerCase(java.util.Locale.ROOT)) {
            case "y", "n", "yes", "no", "on", "off", "true", "false" -> true;
            default -> false;
        };
    }
}
