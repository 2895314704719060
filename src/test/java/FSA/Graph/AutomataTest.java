package FSA.Graph;

import java.util.List;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import static FSA.Graph.Automata.chars;
import static FSA.Graph.Automata.edge;

public class AutomataTest {
  @Test
  void testDenseIds() {
    // labels are sorted, so "p" gets 0, "q" 1 and "r" 2
    Automaton<Character> g = Automata.make(
        List.of(edge("r", "p", 'b'), edge("p", "q", 'a')), "p", label -> label.equals("r"));
    Assertions.assertEquals(3, g.numStates());
    Assertions.assertEquals(0, g.initial());
    Assertions.assertEquals(1, g.delta(0, 'a'));
    Assertions.assertEquals(0, g.delta(2, 'b'));
    Assertions.assertEquals(List.of(2), g.finals());
  }

  @Test
  void testUnknownInitial() {
    Assertions.assertThrows(IllegalArgumentException.class,
        () -> Automata.make(List.of(edge(0, 1, 'a')), 5, q -> false));
  }

  @Test
  void testChars() {
    Assertions.assertEquals(List.of('a', 'b'), chars("ab"));
    Assertions.assertTrue(chars("").isEmpty());
  }

  @Test
  void testNfaInitials() {
    Nfa<Character> g = Automata.nfa(List.of(edge(0, 2, 'a'), edge(1, 2, 'b')), List.of(0, 1), q -> q == 2);
    Assertions.assertEquals(2, g.initials().size());
    Assertions.assertTrue(g.accepts(chars("a")));
    Assertions.assertTrue(g.accepts(chars("b")));
  }
}
