package io.xsdbind.core.facet;

import io.xsdbind.core.spi.PatternCompiler;
import io.xsdbind.core.spi.PatternMatcher;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * Default {@link PatternCompiler} over {@code java.util.regex}. Patterns are matched against the
 * whole text. The schema name escapes {@code \i \I \c \C} are mapped to character classes,
 * character class subtraction ({@code [a-z-[aeiou]]}) becomes an intersection, and {@code ^}/
 * {@code $} outside classes are literal characters. No other dialect translation is done.
 */
public final class JdkPatternCompiler implements PatternCompiler {

    public static final JdkPatternCompiler INSTANCE = new JdkPatternCompiler();

    private static final String NAME_START = "_:\\p{L}";
    private static final String NAME_CHAR = "\\-._:\\p{L}\\p{N}\\u00B7";

    @Override
    public PatternMatcher compile(String pattern) {
        Pattern compiled;
        try {
            compiled = Pattern.compile(translate(pattern));
        } catch (PatternSyntaxException e) {
            throw new IllegalArgumentException("invalid pattern '" + pattern + "': " + e.getDescription(), e);
        }
        return text -> compiled.matcher(text).matches();
    }

    static String translate(String pattern) {
        StringBuilder out = new StringBuilder(pattern.length() + 16);
        int depth = 0;
        for (int i = 0; i < pattern.length(); i++) {
            char c = pattern.charAt(i);
            if (c == '\\' && i + 1 < pattern.length()) {
                char next = pattern.charAt(++i);
                switch (next) {
                    case 'i' -> out.append(depth > 0 ? NAME_START : "[" + NAME_START + "]");
                    case 'I' -> out.append(depth > 0 ? "&&[^" + NAME_START + "]" : "[^" + NAME_START + "]");
                    case 'c' -> out.append(depth > 0 ? NAME_CHAR : "[" + NAME_CHAR + "]");
                    case 'C' -> out.append(depth > 0 ? "&&[^" + NAME_CHAR + "]" : "[^" + NAME_CHAR + "]");
                    default -> out.append('\\').append(next);
                }
            } else if (c == '[') {
                depth++;
                out.append(c);
            } else if (c == ']' && depth > 0) {
                depth--;
                out.append(c);
            } else if (c == '-' && depth > 0 && i + 1 < pattern.length() && pattern.charAt(i + 1) == '[') {
                out.append("&&[^");
                depth++;
                i++;
            } else if ((c == '^' && !(depth > 0 && pattern.charAt(i - 1) == '[')) || (c == '$' && depth == 0)) {
                out.append('\\').append(c);
            } else {
                out.append(c);
            }
        }
        return out.toString();
    }
}
