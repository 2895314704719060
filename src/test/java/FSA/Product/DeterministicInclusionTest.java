package FSA.Product;

import java.util.List;

import FSA.Graph.Automata;
import FSA.Graph.Automaton;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import static FSA.Graph.Automata.edge;

public class DeterministicInclusionTest {
  // "cats"
  static Automaton<Character> cats() {
    return Automata.make(List.of(edge(0, 1, 'c'), edge(1, 2, 'a'), edge(2, 3, 't'), edge(3, 4, 's')),
        0, q -> q == 4);
  }

  // "cats", "b+ats"
  static Automaton<Character> fda1() {
    return Automata.make(List.of(
        edge(0, 1, 'c'), edge(1, 2, 'a'), edge(2, 3, 't'), edge(3, 4, 's'), edge(0, 5, 'b'), edge(5, 5, 'b'),
        edge(5, 2, 'a')), 0, q -> q == 4);
  }

  // "xy*"
  static Automaton<Character> fda2() {
    return Automata.make(List.of(edge(0, 1, 'x'), edge(1, 1, 'y')), 0, q -> q == 1);
  }

  @Test
  void testDafsa() {
    Automaton<Character> g1 = DeterministicUnionTest.dafsa1();
    Automaton<Character> g2 = cats();
    Assertions.assertEquals(Inclusion.SUPERSET, DeterministicInclusion.compare(g1, g2));
    Assertions.assertEquals(Inclusion.SUBSET, DeterministicInclusion.compare(g2, g1));
    Assertions.assertEquals(Inclusion.EQUAL, DeterministicInclusion.compare(g1, g1));
    Assertions.assertEquals(Inclusion.EQUAL, DeterministicInclusion.compare(g2, g2));
  }

  @Test
  void testCyclic() {
    Automaton<Character> g1 = DeterministicUnionTest.dafsa1();
    Automaton<Character> g3 = fda1();
    Automaton<Character> g4 = fda2();
    Assertions.assertEquals(Inclusion.SUBSET, DeterministicInclusion.compare(g1, g3));
    Assertions.assertEquals(Inclusion.SUPERSET, DeterministicInclusion.compare(g3, g1));
    Assertions.assertEquals(Inclusion.EQUAL, DeterministicInclusion.compare(g3, g3));
    Assertions.assertEquals(Inclusion.INCOMPARABLE, DeterministicInclusion.compare(g1, g4));
    Assertions.assertEquals(Inclusion.INCOMPARABLE, DeterministicInclusion.compare(g4, g1));
    Assertions.assertEquals(Inclusion.INCOMPARABLE, DeterministicInclusion.compare(g3, g4));
    Assertions.assertEquals(Inclusion.INCOMPARABLE, DeterministicInclusion.compare(g4, g3));
  }

  @Test
  void testCodes() {
    Assertions.assertEquals(1, Inclusion.SUBSET.code());
    Assertions.assertEquals(0, Inclusion.EQUAL.code());
    Assertions.assertEquals(-1, Inclusion.SUPERSET.code());
    Assertions.assertNull(Inclusion.INCOMPARABLE.code());
  }
}
