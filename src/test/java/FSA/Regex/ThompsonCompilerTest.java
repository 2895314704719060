package FSA.Regex;

import java.util.List;
import java.util.Set;

import FSA.Graph.Nfa;
import it.unimi.dsi.fastutil.ints.IntSet;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import static FSA.Graph.Automata.chars;

public class ThompsonCompilerTest {
  static boolean accepts(Fragment f, String w) {
    return f.nfa().accepts(chars(w));
  }

  static void checkSingleInitialAndFinal(Fragment f) {
    Assertions.assertEquals(IntSet.of(f.initial()), f.nfa().initials());
    Assertions.assertEquals(List.of(f.finalState()), f.nfa().finals());
  }

  @Test
  void testLiteral() {
    Fragment f = ThompsonCompiler.literal('a');
    Assertions.assertEquals(IntSet.of(0), f.nfa().initials());
    Assertions.assertEquals(List.of(1), f.nfa().finals());
    Assertions.assertEquals(IntSet.of(1), f.nfa().delta(0, 'a'));
  }

  @Test
  void testConcatenation() {
    Fragment f = ThompsonCompiler.concatenation(ThompsonCompiler.literal('x'), ThompsonCompiler.compile("a+b"));
    checkSingleInitialAndFinal(f);
    Assertions.assertTrue(accepts(f, "xaab"));
    Assertions.assertFalse(accepts(f, "x"));
    Assertions.assertFalse(accepts(f, "aab"));
  }

  @Test
  void testAlternation() {
    Fragment f = ThompsonCompiler.alternation(ThompsonCompiler.literal('x'), ThompsonCompiler.compile("a+b"));
    checkSingleInitialAndFinal(f);
    Assertions.assertFalse(accepts(f, "xaab"));
    Assertions.assertTrue(accepts(f, "x"));
    Assertions.assertTrue(accepts(f, "aab"));
  }

  @Test
  void testUnaryOperators() {
    Fragment zeroOrOne = ThompsonCompiler.zeroOrOne(ThompsonCompiler.literal('x'));
    Assertions.assertTrue(accepts(zeroOrOne, ""));
    Assertions.assertTrue(accepts(zeroOrOne, "x"));
    Assertions.assertFalse(accepts(zeroOrOne, "xx"));
    Assertions.assertFalse(accepts(zeroOrOne, "a"));

    Fragment zeroOrMore = ThompsonCompiler.zeroOrMore(ThompsonCompiler.literal('x'));
    checkSingleInitialAndFinal(zeroOrMore);
    Assertions.assertTrue(accepts(zeroOrMore, ""));
    Assertions.assertTrue(accepts(zeroOrMore, "x"));
    Assertions.assertTrue(accepts(zeroOrMore, "xx"));
    Assertions.assertFalse(accepts(zeroOrMore, "a"));

    Fragment oneOrMore = ThompsonCompiler.oneOrMore(ThompsonCompiler.literal('x'));
    checkSingleInitialAndFinal(oneOrMore);
    Assertions.assertFalse(accepts(oneOrMore, ""));
    Assertions.assertTrue(accepts(oneOrMore, "x"));
    Assertions.assertTrue(accepts(oneOrMore, "xx"));
    Assertions.assertFalse(accepts(oneOrMore, "a"));
  }

  @Test
  void testRepetition() {
    int m = 4;
    Fragment f = ThompsonCompiler.repetition(ThompsonCompiler.literal('x'), m);
    checkSingleInitialAndFinal(f);
    for (int i = 0; i < 10; i++) {
      Assertions.assertEquals(i == m, accepts(f, "x".repeat(i)), "x * " + i);
    }
    Fragment none = ThompsonCompiler.repetition(ThompsonCompiler.literal('x'), 0);
    Assertions.assertTrue(accepts(none, ""));
    Assertions.assertFalse(accepts(none, "x"));
  }

  @Test
  void testRepetitionRange() {
    int unbounded = CharClasses.Repetition.UNBOUNDED;
    for (int[] bounds : new int[][] {{3, 5}, {0, 3}, {3, 3}, {3, unbounded}, {0, 1}, {0, unbounded}, {1, unbounded}}) {
      int m = bounds[0];
      int n = bounds[1];
      Fragment f = ThompsonCompiler.repetitionRange(ThompsonCompiler.literal('a'), m, n);
      for (int i = 0; i < 10; i++) {
        boolean expected = m <= i && (n == unbounded || i <= n);
        Assertions.assertEquals(expected, accepts(f, "a".repeat(i)), "{" + m + "," + n + "} i = " + i);
      }
    }
    Assertions.assertThrows(IllegalArgumentException.class,
        () -> ThompsonCompiler.repetitionRange(ThompsonCompiler.literal('a'), 3, 2));
  }

  @Test
  void testBracket() {
    Fragment f = ThompsonCompiler.bracket(CharClasses.parseBracket("[X-Z03a-e]", CharClasses.PRINTABLE));
    for (char a : "XYZ03abcde".toCharArray()) {
      Assertions.assertTrue(accepts(f, String.valueOf(a)));
    }
    for (char a : "ABC12456789fghi".toCharArray()) {
      Assertions.assertFalse(accepts(f, String.valueOf(a)));
    }
  }

  @Test
  void testEscapedOperators() {
    Fragment f = ThompsonCompiler.compile("a\\?b");
    Assertions.assertTrue(accepts(f, "a?b"));
    Assertions.assertFalse(accepts(f, "ab"));
    Assertions.assertFalse(accepts(f, "b"));

    f = ThompsonCompiler.compile("a?b");
    Assertions.assertFalse(accepts(f, "a?b"));
    Assertions.assertTrue(accepts(f, "ab"));
    Assertions.assertTrue(accepts(f, "b"));

    for (String regex : List.of("\\|", "\\.", "\\*", "\\+", "\\(", "\\)", "\\{", "\\}", "\\[", "\\]")) {
      Assertions.assertTrue(accepts(ThompsonCompiler.compile(regex), regex.replace("\\", "")), regex);
    }
    String all = "\\|\\.\\*\\+\\(\\)\\{\\}\\[\\]";
    Assertions.assertTrue(accepts(ThompsonCompiler.compile(all), all.replace("\\", "")));
  }

  @Test
  void testEscapedClasses() {
    for (String regex : List.of("\\d", "\\w", "\\s", "\\D", "\\W", "\\S")) {
      Set<Character> allowed = CharClasses.parseEscaped(regex, CharClasses.PRINTABLE);
      Fragment f = ThompsonCompiler.compile(regex);
      for (char a : CharClasses.PRINTABLE) {
        Assertions.assertEquals(allowed.contains(a), accepts(f, String.valueOf(a)), regex + " '" + a + "'");
      }
    }
    for (String regex : List.of("\\s+", "[\\s]+")) {
      Fragment f = ThompsonCompiler.compile(regex);
      for (String w : List.of(" ", "   ", "\t\t", " \t \t ")) {
        Assertions.assertTrue(accepts(f, w), regex);
      }
    }
  }

  @Test
  void testCompile() {
    Assertions.assertTrue(accepts(ThompsonCompiler.compile("(a?b)*?c+d"), "babbbababcccccd"));
    Assertions.assertFalse(accepts(ThompsonCompiler.compile("a*|b"), "bbbbb"));
    Assertions.assertTrue(accepts(ThompsonCompiler.compile("a*|b"), "aaa"));

    Fragment f = ThompsonCompiler.compile("(ab){2,3}c");
    Assertions.assertTrue(accepts(f, "ababc"));
    Assertions.assertTrue(accepts(f, "abababc"));
    Assertions.assertFalse(accepts(f, "abc"));
    Assertions.assertFalse(accepts(f, "ababababc"));

    f = ThompsonCompiler.compile("x{,2}");
    Assertions.assertTrue(accepts(f, ""));
    Assertions.assertTrue(accepts(f, "xx"));
    Assertions.assertFalse(accepts(f, "xxx"));
  }

  @Test
  void testOptionalLoop() {
    // the bypass of '?' must not be reachable from inside the loop
    Fragment f = ThompsonCompiler.compile("(a*b)?");
    for (String w : List.of("", "b", "ab", "aab")) {
      Assertions.assertTrue(accepts(f, w), w);
    }
    for (String w : List.of("a", "aa", "ba", "bb")) {
      Assertions.assertFalse(accepts(f, w), w);
    }

    f = ThompsonCompiler.compile("(a+b)?");
    Assertions.assertTrue(accepts(f, ""));
    Assertions.assertTrue(accepts(f, "aab"));
    Assertions.assertFalse(accepts(f, "a"));
    Assertions.assertFalse(accepts(f, "aa"));
    Assertions.assertFalse(accepts(f, "b"));

    f = ThompsonCompiler.compile("((a|b)*c)?d");
    Assertions.assertTrue(accepts(f, "d"));
    Assertions.assertTrue(accepts(f, "abcd"));
    Assertions.assertFalse(accepts(f, "abd"));
  }

  @Test
  void testStarOfRepetition() {
    Fragment f = ThompsonCompiler.compile("((ab){3})*");
    for (int i = 0; i <= 10; i++) {
      Assertions.assertEquals(i % 3 == 0, accepts(f, "ab".repeat(i)), "ab * " + i);
    }
    Assertions.assertFalse(accepts(f, "aba"));
  }

  @Test
  void testEmptyPattern() {
    Nfa<Character> nfa = ThompsonCompiler.compile("").nfa();
    Assertions.assertEquals(1, nfa.numStates());
    Assertions.assertTrue(nfa.accepts(chars("")));
    Assertions.assertFalse(nfa.accepts(chars("a")));
  }

  @Test
  void testSyntaxErrors() {
    for (String regex : List.of("a)", "(a", "a|", "*a", "a[b", "[z-a]", "a{3,1}", "\\x41")) {
      Assertions.assertThrows(RegexSyntaxException.class, () -> ThompsonCompiler.compile(regex), regex);
    }
  }
}
