package org.learningjava.scalarstore.domain.service.cache;

import java.util.regex.Pattern;

/**
 * Glob over cache keys: {@code *} matches any run of characters, {@code ?} exactly one, a backslash
 * makes the next character literal, everything else matches itself. This is the subset of Redis
 * {@code SCAN MATCH} syntax the cache keys use; brackets are literal here but not in Redis, so
 * text embedded in a pattern goes through {@link #escape(String)}.
 */
public final class GlobPattern {

    private static final String SPECIAL = "*?[]\\";

    private final String glob;
    private final Pattern regex;

    private GlobPattern(String glob, Pattern regex) {
        this.glob = glob;
        this.regex = regex;
    }

    public static GlobPattern compile(String glob) {
        StringBuilder sb = new StringBuilder();
        StringBuilder literal = new StringBuilder();
        for (int i = 0; i < glob.length(); i++) {
            char c = glob.charAt(i);
            if (c == '\\' && i + 1 < glob.length()) {
                literal.append(glob.charAt(++i));
            } else if (c == '*' || c == '?') {
                flush(sb, literal);
                sb.append(c == '*' ? ".*" : ".");
            } else {
                literal.append(c);
            }
        }
        flush(sb, literal);
        return new GlobPattern(glob, Pattern.compile(sb.toString(), Pattern.DOTALL));
    }

    /** Quotes {@code text} so it only matches itself, here and in Redis. */
    public static String escape(String text) {
        StringBuilder sb = new StringBuilder(text.length());
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (SPECIAL.indexOf(c) >= 0) {
                sb.append('\\');
            }
            sb.append(c);
        }
        return sb.toString();
    }

    public boolean matches(String key) {
        return regex.matcher(key).matches();
    }

    @Override
    public String toString() {
        return glob;
    }

    private static void flush(StringBuilder sb, StringBuilder literal) {
        if (literal.length() > 0) {
            sb.append(Pattern.quote(literal.toString()));
            literal.setLength(0);
        }
    }
}
