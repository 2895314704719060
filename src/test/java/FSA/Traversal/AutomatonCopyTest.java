package FSA.Traversal;

import java.util.List;

import FSA.Graph.Automata;
import FSA.Graph.Automaton;
import FSA.Property.AssocAttributeMap;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import static FSA.Graph.Automata.chars;
import static FSA.Graph.Automata.edge;
import static FSA.Graph.DeterministicAutomaton.BOTTOM;

public class AutomatonCopyTest {
  static Automaton<Character> sample() {
    return Automata.make(
        List.of(edge(0, 1, 'a'), edge(1, 2, 'b'), edge(2, 1, 'a'), edge(0, 3, 'c'), edge(4, 0, 'a')), 0,
        q -> q == 2 || q == 3);
  }

  @Test
  void testCopyReachable() {
    Automaton<Character> dup = new Automaton<>();
    AssocAttributeMap<Integer, Integer> mapping = AutomatonCopy.copy(0, sample(), dup);
    Assertions.assertEquals(4, dup.numStates());
    Assertions.assertEquals(4, dup.numTransitions());
    Assertions.assertEquals(BOTTOM, mapping.get(4));
    Assertions.assertEquals(mapping.get(0), dup.initial());
    Assertions.assertTrue(dup.accepts(chars("abab")));
    Assertions.assertTrue(dup.accepts(chars("c")));
    Assertions.assertFalse(dup.accepts(chars("a")));
  }

  @Test
  void testCopyFiltered() {
    Automaton<Character> dup = new Automaton<>();
    AutomatonCopy.copy(1, sample(), dup, q -> q != 3, e -> e.symbol() != 'b');
    // from 1, 'b' is filtered out: only 1 is copied
    Assertions.assertEquals(1, dup.numStates());
    Assertions.assertEquals(0, dup.numTransitions());

    Automaton<Character> dup2 = new Automaton<>();
    AutomatonCopy.copy(0, sample(), dup2, q -> q != 3, e -> true);
    Assertions.assertFalse(dup2.accepts(chars("c")));
    Assertions.assertTrue(dup2.accepts(chars("ab")));
  }
}
