package FSA.Regex;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import FSA.Graph.Automata;
import net.automatalib.alphabet.Alphabet;
import net.automatalib.alphabet.impl.Alphabets;

/**
 * Resolves bracket classes, escape sequences and repetition bounds.
 */
public final class CharClasses {
    private CharClasses() { }

    /**
     * Digits, ASCII letters, punctuation, then space, tab, newline, carriage return, vertical tab and form feed.
     */
    public static final Alphabet<Character> PRINTABLE;

    static {
        final StringBuilder sb = new StringBuilder("0123456789");
        for (char c = 'a'; c <= 'z'; c++) {
            sb.append(c);
        }
        for (char c = 'A'; c <= 'Z'; c++) {
            sb.append(c);
        }
        sb.append("!\"#$%&'()*+,-./:;<=>?@[\\]^_`{|}~");
        sb.append(" \t\n\r\u000b\u000c");
        PRINTABLE = Alphabets.fromCollection(Automata.chars(sb));
    }

    private static final Map<Character, String> SHORTHANDS = Map.of(
        'd', "[0-9]",
        'D', "[^0-9]",
        's', "[ \t]",
        'S', "[^ \t]",
        'w', "[0-9A-Za-z]",
        'W', "[^0-9A-Za-z]");

    private static final Map<Character, Character> SPECIALS = Map.of(
        'a', '\u0007',
        'b', '\b',
        'f', '\f',
        'n', '\n',
        'r', '\r',
        't', '\t',
        'v', '\u000b');

    private static final String ESCAPED_META = "+*?.|[](){}";
    private static final String UNSUPPORTED = "ABZxuUN0";

    private static final Pattern EXACT = Pattern.compile("\\{\\s*(\\d+)\\s*\\}");
    private static final Pattern RANGE = Pattern.compile("\\{\\s*(\\d*)\\s*,\\s*(\\d*)\\s*\\}");

    /**
     * Bounds of a repetition. {@code max} is {@link #UNBOUNDED} for {@code {m,}}.
     */
    public record Repetition(int min, int max) {
        public static final int UNBOUNDED = -1;

        public boolean isBounded() {
            return max != UNBOUNDED;
        }
    }

    /**
     * Parses {@code {m}}, {@code {m,}}, {@code {,n}} or {@code {m,n}}.
     */
    public static Repetition parseRepetition(String s) {
        Matcher matcher = EXACT.matcher(s);
        if (matcher.matches()) {
            final int m = Integer.parseInt(matcher.group(1));
            return new Repetition(m, m);
        }
        matcher = RANGE.matcher(s);
        if (!matcher.matches() || matcher.group(1).isEmpty() && matcher.group(2).isEmpty()) {
            throw new RegexSyntaxException("Malformed repetition", s, 0);
        }
        final int m = matcher.group(1).isEmpty() ? 0 : Integer.parseInt(matcher.group(1));
        final int n = matcher.group(2).isEmpty() ? Repetition.UNBOUNDED : Integer.parseInt(matcher.group(2));
        if (n != Repetition.UNBOUNDED && n < m) {
            throw new RegexSyntaxException("Invalid upper bound " + n + " (lower bound is " + m + ")", s, 0);
        }
        return new Repetition(m, n);
    }

    /**
     * Resolves {@code [...]} or {@code [^...]}. Ranges {@code x-y} need {@code x <= y}; a {@code -} at either end is
     * a literal. Escape sequences are allowed. A negated class is complemented against {@code alphabet}.
     */
    public static Set<Character> parseBracket(String s, Collection<Character> alphabet) {
        if (s.length() < 2 || s.charAt(0) != '[' || s.charAt(s.length() - 1) != ']') {
            throw new RegexSyntaxException("Not a bracket class", s, 0);
        }
        if (s.length() < 3 || s.equals("[^]")) {
            throw new RegexSyntaxException("Empty bracket class", s, 0);
        }
        final boolean negated = s.charAt(1) == '^';
        final int end = s.length() - 1;
        final Set<Character> accepted = new LinkedHashSet<>();
        // last literal added, the only valid start of a range
        Character last = null;
        int i = negated ? 2 : 1;
        while (i < end) {
            final char a = s.charAt(i);
            if (a == '-' && last != null && i + 1 < end) {
                final char to = s.charAt(i + 1);
                if (last > to) {
                    throw new RegexSyntaxException("Invalid range " + last + "-" + to, s, i);
                }
                for (char c = last; c <= to; c++) {
                    accepted.add(c);
                }
                last = null;
                i += 2;
            } else if (a == '\\') {
                if (i + 1 >= end) {
                    throw new RegexSyntaxException("Trailing backslash in bracket class", s, i);
                }
                accepted.addAll(parseEscaped(s.substring(i, i + 2), alphabet));
                last = null;
                i += 2;
            } else {
                accepted.add(a);
                last = a;
                i++;
            }
        }
        if (!negated) {
            return accepted;
        }
        final Set<Character> complement = new LinkedHashSet<>(alphabet);
        complement.removeAll(accepted);
        return complement;
    }

    /**
     * Resolves a two-character escape sequence: an escaped metacharacter, a special character ({@code \n}...) or a
     * class shorthand ({@code \d}...).
     */
    public static Set<Character> parseEscaped(String s, Collection<Character> alphabet) {
        if (s.length() != 2 || s.charAt(0) != '\\') {
            throw new RegexSyntaxException("Invalid escape sequence " + s, s, 0);
        }
        final char a = s.charAt(1);
        if (ESCAPED_META.indexOf(a) >= 0) {
            return Set.of(a);
        }
        if (UNSUPPORTED.indexOf(a) >= 0) {
            throw new RegexSyntaxException("Escape sequence " + s + " not supported", s, 0);
        }
        final Character special = SPECIALS.get(a);
        if (special != null) {
            return Set.of(special);
        }
        final String shorthand = SHORTHANDS.get(a);
        if (shorthand != null) {
            return parseBracket(shorthand, alphabet);
        }
        throw new RegexSyntaxException("Invalid escape sequence " + s, s, 0);
    }

    /**
     * @return the characters of {@code chars}, in order, without duplicates
     */
    static List<Character> sorted(Set<Character> chars) {
        final List<Character> result = new ArrayList<>(chars);
        result.sort(null);
        return result;
    }
}
