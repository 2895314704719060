package FSA.Graph;

import java.util.List;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import static FSA.Graph.Automata.chars;

public class TrieTest {
  static Trie<Character> trie(String... words) {
    Trie<Character> t = new Trie<>();
    for (String w : words) {
      t.insert(chars(w));
    }
    return t;
  }

  @Test
  void testInsertWords() {
    Trie<Character> t = trie("boxeur", "bougie", "ananas");
    // root + "bo" + "xeur" + "ugie" + "ananas"
    Assertions.assertEquals(17, t.numStates());
    Assertions.assertEquals(16, t.numTransitions());
    Assertions.assertTrue(t.accepts(chars("bougie")));
    Assertions.assertFalse(t.accepts(chars("bou")));
    Assertions.assertFalse(t.accepts(chars("")));

    t.insert(chars(""));
    Assertions.assertTrue(t.accepts(chars("")));
    Assertions.assertEquals(17, t.numStates());
  }

  @Test
  void testInsertAutomaton() {
    Trie<Character> t = trie("boxeur", "bougie");
    t.insert(trie("bouee", "ananas"));
    Assertions.assertEquals(19, t.numStates());
    for (String w : List.of("boxeur", "bougie", "bouee", "ananas")) {
      Assertions.assertTrue(t.accepts(chars(w)), w);
    }
    Assertions.assertFalse(t.accepts(chars("boue")));

    t.insert(DigitalSequence.of("boue"));
    Assertions.assertEquals(19, t.numStates());
    Assertions.assertTrue(t.accepts(chars("boue")));
  }

  @Test
  void testSuffixTrie() {
    Trie<Character> t = Trie.suffixTrie(chars("banana"));
    for (String factor : List.of("", "b", "ban", "banana", "nan", "ana", "a")) {
      Assertions.assertTrue(t.accepts(chars(factor)), factor);
    }
    Assertions.assertFalse(t.accepts(chars("nab")));
    Assertions.assertFalse(t.accepts(chars("bb")));

    Trie<Character> bounded = Trie.suffixTrie(chars("banana"), 2);
    Assertions.assertTrue(bounded.accepts(chars("an")));
    Assertions.assertFalse(bounded.accepts(chars("ana")));
  }
}
