package yaml.java17.lint;

import yaml.java17.YamlEvent;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

/// Plain scalars like `0755`: an octal number in YAML 1.1, the decimal 755 under the 1.2 core schema.
final class OctalValuesRule implements LintRule {

    static final String ID = "octal-values";

    private static final Pattern IMPLICIT_OCTAL = Pattern.compile("([-+]?)0([0-7]+)");

    @Override
    public String id() {
        return ID;
    }

    @Override
    public Severity defaultSeverity() {
        return Severity.WARNING;
    }

    @Override
    public List<Diagnostic> check(LintContext context) {
        final List<Diagnostic> out = new ArrayList<>();
        for (LintContext.Node node : context.nodes()) {
            if (!(node.event() instanceof YamlEvent.Scalar scalar)
                    || scalar.style() != YamlEvent.ScalarStyle.PLAIN || scalar.tag() != null) {
                continue;
            }
            final var matcher = IMPLICIT_OCTAL.matcher(scalar.value());
            if (!matcher.matches()) {
                continue;
            }
            String digits = matcher.group(2).replaceFirst("^0+", "");
            if (digits.isEmpty()) {
                digits = "0";
            }
            out.add(context.diagnostic(this, "found implicit octal value \"" + scalar.value()
                            + "\", which is the decimal integer " + new BigInteger(scalar.value()),
                            scalar.span())
                    .withSuggestion("use the 0o prefix for an octal integer", scalar.span(),
                            matcher.group(1) + "0o" + digits));
        }
        return out;
    }
}
