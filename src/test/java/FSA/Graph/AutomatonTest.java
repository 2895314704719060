package FSA.Graph;

import java.util.List;
import java.util.Set;

import FSA.Property.AttributeMap;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import static FSA.Graph.Automata.chars;
import static FSA.Graph.Automata.edge;
import static FSA.Graph.DeterministicAutomaton.BOTTOM;

public class AutomatonTest {
  static Automaton<Character> abc() {
    // 0 -a-> 1 -b-> 2 -c-> 3, 3 final
    return Automata.make(List.of(edge(0, 1, 'a'), edge(1, 2, 'b'), edge(2, 3, 'c')), 0, q -> q == 3);
  }

  @Test
  void testEmpty() {
    Automaton<Character> g = new Automaton<>();
    Assertions.assertEquals(0, g.numStates());
    Assertions.assertEquals(0, g.numTransitions());
    Assertions.assertEquals(BOTTOM, g.initial());
    Assertions.assertFalse(g.accepts(chars("")));
    Assertions.assertTrue(g.alphabet().isEmpty());
  }

  @Test
  void testDelta() {
    Automaton<Character> g = abc();
    Assertions.assertEquals(4, g.numStates());
    Assertions.assertEquals(3, g.numTransitions());
    Assertions.assertEquals(0, g.initial());
    Assertions.assertEquals(1, g.delta(0, 'a'));
    Assertions.assertEquals(BOTTOM, g.delta(0, 'b'));
    Assertions.assertEquals(BOTTOM, g.delta(BOTTOM, 'a'));
    Assertions.assertEquals(3, g.deltaWord(0, chars("abc")));
    Assertions.assertEquals(BOTTOM, g.deltaWord(0, chars("abca")));
    Assertions.assertEquals(Set.of('b'), g.sigma(1));
    Assertions.assertTrue(g.sigma(BOTTOM).isEmpty());

    Assertions.assertTrue(g.accepts(chars("abc")));
    Assertions.assertFalse(g.accepts(chars("ab")));
    Assertions.assertFalse(g.accepts(chars("abcc")));
    Assertions.assertEquals(List.of(3), g.finals());
  }

  @Test
  void testBestEffort() {
    Automaton<Character> g = abc();
    Assertions.assertEquals(new DeterministicAutomaton.Reach(2, 2), g.deltaBestEffort(chars("abxc")));
    Assertions.assertEquals(new DeterministicAutomaton.Reach(0, 0), g.deltaBestEffort(chars("x")));
    Assertions.assertEquals(new DeterministicAutomaton.Reach(3, 3), g.deltaBestEffort(chars("abc")));
  }

  @Test
  void testDeterminism() {
    Automaton<Character> g = abc();
    Assertions.assertFalse(g.addTransition(0, 2, 'a'));
    Assertions.assertEquals(1, g.delta(0, 'a'));
    Assertions.assertTrue(g.addTransition(0, 2, 'b'));
    Assertions.assertEquals(4, g.numTransitions());

    Assertions.assertTrue(g.removeTransition(0, 'a'));
    Assertions.assertFalse(g.removeTransition(0, 'a'));
    Assertions.assertEquals(BOTTOM, g.delta(0, 'a'));
    Assertions.assertEquals(3, g.numTransitions());
  }

  @Test
  void testInvalidState() {
    Automaton<Character> g = abc();
    Assertions.assertThrows(IllegalArgumentException.class, () -> g.addTransition(0, 7, 'z'));
    Assertions.assertThrows(IllegalArgumentException.class, () -> g.setFinal(BOTTOM));
  }

  @Test
  void testRemoveState() {
    Automaton<Character> g = abc();
    g.removeState(1);
    Assertions.assertEquals(3, g.numStates());
    Assertions.assertFalse(g.hasState(1));
    Assertions.assertEquals(1, g.numTransitions());
    Assertions.assertEquals(BOTTOM, g.delta(0, 'a'));
    Assertions.assertEquals(List.of(0, 2, 3), g.states());

    // ids are never reused
    Assertions.assertEquals(4, g.addState());

    g.removeState(0);
    Assertions.assertEquals(BOTTOM, g.initial());
  }

  @Test
  void testCompleteness() {
    Automaton<Character> g = new Automaton<>(2);
    g.addTransition(0, 1, 'a');
    g.addTransition(1, 0, 'a');
    Assertions.assertTrue(g.isComplete());
    g.addTransition(0, 0, 'b');
    Assertions.assertFalse(g.isComplete());
  }

  @Test
  void testInsertWord() {
    Automaton<Character> g = new Automaton<>();
    int q = g.insert(chars("ab"));
    Assertions.assertEquals(3, g.numStates());
    Assertions.assertTrue(g.isFinal(q));
    g.insert(chars("ac"));
    Assertions.assertEquals(4, g.numStates());
    Assertions.assertTrue(g.accepts(chars("ab")));
    Assertions.assertTrue(g.accepts(chars("ac")));
    Assertions.assertFalse(g.accepts(chars("a")));
  }

  @Test
  void testFunctionalFinals() {
    Automaton<Character> g = new Automaton<>(3, AttributeMap.func(q -> q % 2 == 0));
    Assertions.assertTrue(g.isFinal(0));
    Assertions.assertFalse(g.isFinal(1));
    Assertions.assertTrue(g.isFinal(2));
    Assertions.assertFalse(g.isFinal(BOTTOM));
    Assertions.assertThrows(UnsupportedOperationException.class, () -> g.setFinal(1));
  }
}
