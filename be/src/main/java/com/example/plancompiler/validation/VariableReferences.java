package com.example.plancompiler.validation;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Syntax of {@code {% ... %}} expression blocks and the variable references inside them.
 */
public final class VariableReferences {

    public static final String OPEN = "{%";
    public static final String CLOSE = "%}";

    private static final String NAME = "[a-zA-Z_]\\w*(?:\\.\\w+)*";

    /** {@code {% $name(.prop)* %}} and nothing else. */
    private static final Pattern SINGLE_REFERENCE = Pattern.compile("^\\{%\\s*\\$(" + NAME + ")\\s*%}$");

    /** A block holding at least one reference, concatenation allowed, no calls or indexers. */
    private static final Pattern TEMPLATE = Pattern.compile("^\\{%[^\\[\\]()]*\\$" + NAME + "[^\\[\\]()]*%}$", Pattern.DOTALL);

    private static final Pattern WHOLE_BLOCK = Pattern.compile("^\\{%.*%}$", Pattern.DOTALL);

    private static final Pattern VARIABLE = Pattern.compile("\\$(" + NAME + ")");

    private VariableReferences() {
    }

    public static boolean containsBlock(String text) {
        return text != null && text.contains(OPEN);
    }

    /** True when the whole (trimmed) text is one {@code {% ... %}} block. */
    public static boolean isWholeBlock(String text) {
        return text != null && WHOLE_BLOCK.matcher(text.trim()).matches();
    }

    public static boolean hasDisallowedSyntax(String text) {
        return text.indexOf('(') >= 0 || text.indexOf(')') >= 0 || text.indexOf('[') >= 0 || text.indexOf(']') >= 0;
    }

    public static boolean isTemplate(String text) {
        return TEMPLATE.matcher(text.trim()).matches();
    }

    /**
     * The dotted name referenced by a single-reference block, e.g. {@code order.id} for {@code {% $order.id %}}.
     */
    public static Optional<String> singleReference(String text) {
        if (text == null) {
            return Optional.empty();
        }
        Matcher matcher = SINGLE_REFERENCE.matcher(text.trim());
        return matcher.matches() ? Optional.of(matcher.group(1)) : Optional.empty();
    }

    /** Distinct dotted names referenced in {@code text}, in order of first appearance. */
    public static List<String> variables(String text) {
        Set<String> names = new LinkedHashSet<>();
        Matcher matcher = VARIABLE.matcher(text);
        while (matcher.find()) {
            names.add(matcher.group(1));
        }
        return new ArrayList<>(names);
    }

    /**
     * Replaces every {@code $a.b.c} in {@code text} with {@code $a_b_c}.
     */
    public static String flattenReferences(String text) {
        Matcher matcher = VARIABLE.matcher(text);
        StringBuilder out = new StringBuilder();
        while (matcher.find()) {
            matcher.appendReplacement(out, Matcher.quoteReplacement("$" + flatten(matcher.group(1))));
        }
        matcher.appendTail(out);
        return out.toString();
    }

    public static String flatten(String dottedName) {
        return dottedName.replace('.', '_');
    }
}
