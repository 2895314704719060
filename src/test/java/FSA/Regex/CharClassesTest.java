package FSA.Regex;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import static FSA.Graph.Automata.chars;

public class CharClassesTest {
  static Set<Character> charSet(String s) {
    return new HashSet<>(chars(s));
  }

  static Set<Character> bracket(String s) {
    return CharClasses.parseBracket(s, CharClasses.PRINTABLE);
  }

  @Test
  void testParseRepetition() {
    Assertions.assertEquals(new CharClasses.Repetition(0, 1), CharClasses.parseRepetition("{0,1}"));
    Assertions.assertEquals(new CharClasses.Repetition(0, CharClasses.Repetition.UNBOUNDED),
        CharClasses.parseRepetition("{0,}"));
    Assertions.assertEquals(new CharClasses.Repetition(2, 4), CharClasses.parseRepetition("{   2 , 4  }"));
    Assertions.assertEquals(new CharClasses.Repetition(3, 3), CharClasses.parseRepetition("{3}"));
    Assertions.assertEquals(new CharClasses.Repetition(0, 5), CharClasses.parseRepetition("{,5}"));
    Assertions.assertFalse(CharClasses.parseRepetition("{1,}").isBounded());
    Assertions.assertTrue(CharClasses.parseRepetition("{1,2}").isBounded());

    Assertions.assertThrows(RegexSyntaxException.class, () -> CharClasses.parseRepetition("{,}"));
    Assertions.assertThrows(RegexSyntaxException.class, () -> CharClasses.parseRepetition("{4,2}"));
    Assertions.assertThrows(RegexSyntaxException.class, () -> CharClasses.parseRepetition("{a}"));
  }

  @Test
  void testParseBracket() {
    Assertions.assertEquals(charSet("abcdefghijklmnopqrstuvwxyz"), bracket("[a-z]"));
    Assertions.assertEquals(charSet("0123456789PQRSTabcde"), bracket("[a-e0-9P-T]"));
    Assertions.assertEquals(charSet("XYZ03abcde"), bracket("[X-Z03a-e]"));
    // a '-' at either end is a literal
    Assertions.assertEquals(charSet("-ab"), bracket("[-ab]"));
    Assertions.assertEquals(charSet("ab-"), bracket("[ab-]"));
    Assertions.assertEquals(Set.of(' ', '\t'), bracket("[\\s]"));
    Assertions.assertEquals(charSet("a.b"), bracket("[a\\.b]"));
  }

  @Test
  void testNegatedBracket() {
    Set<Character> notLetters = bracket("[^a-zA-Z]");
    Assertions.assertEquals(CharClasses.PRINTABLE.size() - 52, notLetters.size());
    Assertions.assertFalse(notLetters.contains('q'));
    Assertions.assertTrue(notLetters.contains('7'));
    Assertions.assertTrue(notLetters.contains('\u000b'));

    Assertions.assertEquals(charSet("ab"), CharClasses.parseBracket("[^c]", List.of('a', 'b', 'c')));
  }

  @Test
  void testMalformedBracket() {
    Assertions.assertThrows(RegexSyntaxException.class, () -> bracket("[z-a]"));
    Assertions.assertThrows(RegexSyntaxException.class, () -> bracket("[]"));
    Assertions.assertThrows(RegexSyntaxException.class, () -> bracket("[^]"));
    Assertions.assertThrows(RegexSyntaxException.class, () -> bracket("abc"));
  }

  @Test
  void testParseEscaped() {
    for (char a : "+*?.|[](){}".toCharArray()) {
      Assertions.assertEquals(Set.of(a), CharClasses.parseEscaped("\\" + a, CharClasses.PRINTABLE));
    }
    Assertions.assertEquals(bracket("[a-zA-Z0-9]"), CharClasses.parseEscaped("\\w", CharClasses.PRINTABLE));
    Assertions.assertEquals(bracket("[^a-zA-Z0-9]"), CharClasses.parseEscaped("\\W", CharClasses.PRINTABLE));
    Assertions.assertEquals(bracket("[0-9]"), CharClasses.parseEscaped("\\d", CharClasses.PRINTABLE));
    Assertions.assertEquals(bracket("[^0-9]"), CharClasses.parseEscaped("\\D", CharClasses.PRINTABLE));
    Assertions.assertEquals(Set.of('\u0007'), CharClasses.parseEscaped("\\a", CharClasses.PRINTABLE));
    Assertions.assertEquals(Set.of('\b'), CharClasses.parseEscaped("\\b", CharClasses.PRINTABLE));
    Assertions.assertEquals(Set.of('\f'), CharClasses.parseEscaped("\\f", CharClasses.PRINTABLE));
    Assertions.assertEquals(Set.of('\n'), CharClasses.parseEscaped("\\n", CharClasses.PRINTABLE));
    Assertions.assertEquals(Set.of('\r'), CharClasses.parseEscaped("\\r", CharClasses.PRINTABLE));
    Assertions.assertEquals(Set.of('\t'), CharClasses.parseEscaped("\\t", CharClasses.PRINTABLE));
    Assertions.assertEquals(Set.of('\u000b'), CharClasses.parseEscaped("\\v", CharClasses.PRINTABLE));

    Assertions.assertThrows(RegexSyntaxException.class, () -> CharClasses.parseEscaped("\\x", CharClasses.PRINTABLE));
    Assertions.assertThrows(RegexSyntaxException.class, () -> CharClasses.parseEscaped("\\q", CharClasses.PRINTABLE));
    Assertions.assertThrows(RegexSyntaxException.class, () -> CharClasses.parseEscaped("ab", CharClasses.PRINTABLE));
  }

  @Test
  void testSorted() {
    List<Character> sorted = CharClasses.sorted(charSet("cab"));
    Assertions.assertEquals(new ArrayList<>(List.of('a', 'b', 'c')), sorted);
  }
}
