package com.reachscan.adapter.exclusion;

import java.nio.file.FileSystems;
import java.nio.file.PathMatcher;
import java.nio.file.Paths;
import java.util.regex.Pattern;

/**
 * One compiled exclusion rule.
 *
 * <pre>
 *   symbol:&lt;glob&gt;   matches function ids and call targets
 *   path:&lt;glob&gt;     matches source paths relative to the project root
 *   &lt;glob&gt;          matches either
 * </pre>
 *
 * In symbol globs {@code *} stops at {@code .}, {@code :} and {@code (}, {@code **} matches
 * anything, {@code ?} one character and {@code {a,b}} either alternative. A pattern without wildcards also matches everything
 * nested below it: {@code com.acme.Legacy} covers all its methods, {@code src/gen} every file under it.
 */
public final class ExclusionPattern {

    public enum Scope { SYMBOL, PATH, ANY }

    private static final String SYMBOL_PREFIX = "symbol:";
    private static final String PATH_PREFIX = "path:";
    private static final String ID_PREFIX = "java::";

    private final String source;
    private final Scope scope;
    private final String glob;
    private final boolean literal;
    private final Pattern symbolRegex;
    private final PathMatcher pathMatcher;

    private ExclusionPattern(String source, Scope scope, String glob) {
        this.source = source;
        this.scope = scope;
        this.glob = glob;
        this.literal = !hasWildcard(glob);
        this.symbolRegex = scope == Scope.PATH ? null : Pattern.compile(toSymbolRegex(glob));
        this.pathMatcher = scope == Scope.SYMBOL ? null : pathMatcher(glob);
    }

    /**
     * @throws InvalidExclusionPatternException for blank patterns, unknown prefixes or malformed globs
     */
    public static ExclusionPattern parse(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new InvalidExclusionPatternException(String.valueOf(raw), "pattern is blank");
        }
        String text = raw.trim();
        Scope scope = Scope.ANY;
        String glob = text;
        if (text.startsWith(SYMBOL_PREFIX)) {
            scope = Scope.SYMBOL;
            glob = text.substring(SYMBOL_PREFIX.length());
        } else if (text.startsWith(PATH_PREFIX)) {
            scope = Scope.PATH;
            glob = text.substring(PATH_PREFIX.length());
        } else if (text.matches("^[A-Za-z]{2,}:[^:].*") && !text.contains("::")) {
            throw new InvalidExclusionPatternException(raw,
                    "unknown prefix '" + text.substring(0, text.indexOf(':')) + ":'");
        }
        if (glob.isBlank()) {
            throw new InvalidExclusionPatternException(raw, "nothing after the prefix");
        }
        try {
            return new ExclusionPattern(text, scope, glob);
        } catch (IllegalArgumentException e) {
            throw new InvalidExclusionPatternException(raw, e.getMessage());
        }
    }

    public String source() { return source; }
    public Scope scope() { return scope; }

    public boolean matchesSymbol(String id) {
        if (scope == Scope.PATH || id == null) return false;
        String bare = id.startsWith(ID_PREFIX) ? id.substring(ID_PREFIX.length()) : id;
        for (String candidate : new String[] {id, bare}) {
            if (symbolRegex.matcher(candidate).matches()) return true;
            if (literal && (candidate.startsWith(glob + "::") || candidate.startsWith(glob + ".")
                    || candidate.startsWith(glob + "("))) {
                return true;
            }
        }
        return false;
    }

    public boolean matchesPath(String relativePath) {
        if (scope == Scope.SYMBOL || relativePath == null || relativePath.isEmpty()) return false;
        String path = relativePath.replace('\\', '/');
        if (literal) {
            String dir = glob.endsWith("/") ? glob.substring(0, glob.length() - 1) : glob;
            if (path.equals(dir) || path.startsWith(dir + "/")) return true;
        }
        return pathMatcher.matches(Paths.get(path));
    }

    static boolean hasWildcard(String glob) {
        for (char c : glob.toCharArray()) {
            if (c == '*' || c == '?' || c == '[' || c == '{') return true;
        }
        return false;
    }

    static String toSymbolRegex(String glob) {
        StringBuilder regex = new StringBuilder();
        int groupStart = -1;
        int i = 0;
        while (i < glob.length()) {
            char c = glob.charAt(i);
            if (c == '*') {
                if (i + 1 < glob.length() && glob.charAt(i + 1) == '*') {
                    regex.append(".*");
                    i += 2;
                    continue;
                }
                regex.append("[^.:(]*");
            } else if (c == '?') {
                regex.append('.');
            } else if (c == '[') {
                int close = glob.indexOf(']', i + 1);
                if (close < 0) {
                    throw new IllegalArgumentException("unclosed '[' at index " + i);
                }
                String cls = glob.substring(i + 1, close);
                if (cls.isEmpty()) {
                    throw new IllegalArgumentException("empty character class at index " + i);
                }
                if (cls.startsWith("!")) cls = "^" + cls.substring(1);
                regex.append('[').append(cls.replace("\\", "\\\\")).append(']');
                i = close + 1;
                continue;
            } else if (c == ']') {
                throw new IllegalArgumentException("unmatched ']' at index " + i);
            } else if (c == '{') {
                if (groupStart >= 0) {
                    throw new IllegalArgumentException("nested '{' at index " + i);
                }
                groupStart = i;
                regex.append("(?:");
            } else if (c == '}') {
                if (groupStart < 0) {
                    throw new IllegalArgumentException("unmatched '}' at index " + i);
                }
                groupStart = -1;
                regex.append(')');
            } else if (c == ',' && groupStart >= 0) {
                regex.append('|');
            } else {
                regex.append(Pattern.quote(String.valueOf(c)));
            }
            i++;
        }
        if (groupStart >= 0) {
            throw new IllegalArgumentException("unclosed '{' at index " + groupStart);
        }
        return regex.toString();
    }

    private static PathMatcher pathMatcher(String glob) {
        return FileSystems.getDefault().getPathMatcher("glob:" + glob);
    }

    @Override
    public String toString() {
        return source;
    }
}
