package FSA.Regex;

import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

public class RegexTokenizerTest {
  @Test
  void testWithoutCat() {
    Assertions.assertEquals(List.of("11", ".", "2", ".", "(", "3", "+", ".", "4", "*", ".", "5", "?", ")"),
        RegexTokenizer.tokenize("11.2.(3+.4*.5?)", null));
    Assertions.assertEquals(List.of("x", "{1,3}", ".", "y"), RegexTokenizer.tokenize("x{1,3}.y", null));
    Assertions.assertEquals(List.of("a", ".", "\\d", ".", "b"), RegexTokenizer.tokenize("a.\\d.b", null));
  }

  @Test
  void testRepetitions() {
    Assertions.assertEquals(List.of("x", "{1,3}", ".", "y"), RegexTokenizer.tokenize("x{1,3}y"));
    Assertions.assertEquals(List.of("x", "{3}", ".", "y"), RegexTokenizer.tokenize("x{3}y"));
    Assertions.assertEquals(List.of("x", "{3,}", ".", "y"), RegexTokenizer.tokenize("x{3,}y"));
    Assertions.assertEquals(List.of("x", "{,3}", ".", "y"), RegexTokenizer.tokenize("x{,3}y"));
  }

  @Test
  void testImplicitConcatenation() {
    Map<String, String> expected = Map.of(
        "123?(4|5)*67", "1.2.3?.(4|5)*.6.7",
        "(1?2)*?3+4", "(1?.2)*?.3+.4",
        "a\\dx", "a.\\d.x",
        "a\\d+x", "a.\\d+.x",
        "a[0-9]x", "a.[0-9].x",
        "a[0-9]+x", "a.[0-9]+.x",
        "a{1,2}+x", "a{1,2}+.x",
        "(abc)+", "(a.b.c)+",
        "a.b", "a.b");
    for (Map.Entry<String, String> entry : expected.entrySet()) {
      Assertions.assertEquals(entry.getValue(), String.join("", RegexTokenizer.tokenize(entry.getKey())),
          entry.getKey());
    }
  }

  @Test
  void testClasses() {
    Assertions.assertEquals(List.of("a", ".", "[^0-9]", ".", "b"), RegexTokenizer.tokenize("a[^0-9]b"));
    Assertions.assertEquals(List.of("a", ".", "[(]", ".", "b"), RegexTokenizer.tokenize("a[(]b"));
  }

  @Test
  void testMalformed() {
    Assertions.assertThrows(RegexSyntaxException.class, () -> RegexTokenizer.tokenize("a[b"));
    Assertions.assertThrows(RegexSyntaxException.class, () -> RegexTokenizer.tokenize("a]"));
    Assertions.assertThrows(RegexSyntaxException.class, () -> RegexTokenizer.tokenize("a{2"));
    Assertions.assertThrows(RegexSyntaxException.class, () -> RegexTokenizer.tokenize("a{x}"));
    Assertions.assertThrows(RegexSyntaxException.class, () -> RegexTokenizer.tokenize("a\\"));
    Assertions.assertThrows(RegexSyntaxException.class, () -> RegexTokenizer.tokenize("a\\q"));

    RegexSyntaxException e = Assertions.assertThrows(RegexSyntaxException.class,
        () -> RegexTokenizer.tokenize("ab\\x41"));
    Assertions.assertEquals(2, e.getIndex());
    Assertions.assertTrue(e.getDescription().contains("not supported"));
  }
}
