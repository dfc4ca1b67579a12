package org.automatakit.automata.algorithms;

import org.automatakit.automata.SampleAutomata;
import org.automatakit.automata.analysis.PropertyAnalyzer;
import org.automatakit.automata.base.State;
import org.automatakit.automata.base.Symbol;
import org.automatakit.automata.base.Transition;
import org.automatakit.automata.base.Word;
import org.automatakit.automata.exceptions.Precondition;
import org.automatakit.automata.exceptions.PreconditionException;
import org.automatakit.automata.models.Automaton;
import org.automatakit.automata.simulation.Simulator;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class MinimizerTest {

    private static Minimizer minimizer;
    private static Completer completer;
    private static PropertyAnalyzer analyzer;
    private static Simulator simulator;

    @BeforeAll
    static void setUp() {
        minimizer = new Minimizer();
        analyzer = new PropertyAnalyzer();
        completer = new Completer(analyzer);
        simulator = new Simulator();
    }

    @Nested
    @DisplayName("划分求精 (Partition refinement)")
    class RefinementTests {

        @Test
        @DisplayName("可合并的终止状态被合并")
        void testMergesEquivalentStates() {
            Automaton minimized = minimizer.minimize(SampleAutomata.abStarRedundant());

            assertAll(
                    () -> assertEquals("abStarRedundant_min", minimized.getName()),
                    () -> assertEquals(3, minimized.stateCount()),
                    () -> assertTrue(analyzer.isMinimal(minimized)),
                    () -> assertEquals(State.of("q0", true, false), minimized.getState("q0").orElseThrow()),
                    () -> assertTrue(minimized.isAccepting("q1")),
                    () -> assertFalse(minimized.isAccepting("q2"))
            );
        }

        @Test
        @DisplayName("两个都拒绝一切的状态合并为一个非终止状态")
        void testRejectAll_CollapsesToSingleState() {
            Automaton minimized = minimizer.minimize(SampleAutomata.rejectAll());

            assertAll(
                    () -> assertEquals(1, minimized.stateCount()),
                    () -> assertEquals(State.of("q0", true, false), minimized.getInitialState()),
                    () -> assertEquals(Set.of(new Transition("q0", Symbol.of("a"), "q0")), minimized.getTransitions())
            );
        }

        @Test
        @DisplayName("带 epsilon 的 NFA 先被确定化和补全")
        void testEpsilonNfa() {
            Automaton minimized = minimizer.minimize(SampleAutomata.aStarBStar());

            assertEquals(3, minimized.stateCount());
            assertTrue(analyzer.isMinimal(minimized));
            for (Word w : SampleAutomata.allWords(minimized.getAlphabet(), 5)) {
                assertEquals(simulator.accepts(SampleAutomata.aStarBStar(), w), simulator.accepts(minimized, w),
                        "Disagreement on \"" + w + "\"");
            }
        }

        @Test
        @DisplayName("最小化是幂等的")
        void testIdempotent() {
            for (Automaton a : SampleAutomata.all()) {
                Automaton once = minimizer.minimize(a);
                Automaton twice = minimizer.minimize(once);
                assertEquals(Set.copyOf(once.getStates()), Set.copyOf(twice.getStates()), a.getName());
                assertEquals(once.getTransitions(), twice.getTransitions(), a.getName());
            }
        }

        @Test
        @DisplayName("接受相同语言的自动机得到相同的规范形式")
        void testCanonical() {
            Automaton left = minimizer.minimize(SampleAutomata.abStar());
            Automaton right = minimizer.minimize(SampleAutomata.abStarRedundant());

            assertEquals(Set.copyOf(left.getStates()), Set.copyOf(right.getStates()));
            assertEquals(left.getTransitions(), right.getTransitions());
        }

        @Test
        @DisplayName("先确定化再最小化与直接最小化结果一致")
        void testDeterminizeThenMinimize() {
            Automaton nfa = SampleAutomata.endsWithAb();
            Automaton viaDfa = minimizer.minimize(new Determinizer().determinize(nfa));
            Automaton direct = minimizer.minimize(nfa);

            assertEquals(3, direct.stateCount());
            assertEquals(direct.getTransitions(), viaDfa.getTransitions());
        }
    }

    @Nested
    @DisplayName("严格模式的前置条件 (Strict preconditions)")
    class StrictTests {

        @Test
        @DisplayName("非确定输入被拒绝")
        void testStrict_Nondeterministic() {
            PreconditionException e = assertThrows(PreconditionException.class,
                    () -> minimizer.minimizeStrict(SampleAutomata.endsWithAb()));
            assertEquals(Precondition.NOT_DETERMINISTIC, e.getPrecondition());
        }

        @Test
        @DisplayName("不完全的输入被拒绝")
        void testStrict_Incomplete() {
            PreconditionException e = assertThrows(PreconditionException.class,
                    () -> minimizer.minimizeStrict(SampleAutomata.abStar()));
            assertEquals(Precondition.NOT_COMPLETE, e.getPrecondition());
        }

        @Test
        @DisplayName("含不可达状态的输入被拒绝")
        void testStrict_Unreachable() {
            Automaton a = SampleAutomata.evenAs();
            a.addState("island");
            a.addTransition("island", "a", "island");
            a.addTransition("island", "b", "island");
            PreconditionException e = assertThrows(PreconditionException.class, () -> minimizer.minimizeStrict(a));
            assertEquals(Precondition.HAS_UNREACHABLE_STATES, e.getPrecondition());
        }

        @Test
        @DisplayName("满足条件的输入直接求精")
        void testStrict_Valid() {
            Automaton complete = completer.complete(SampleAutomata.abStarRedundant());
            assertEquals(3, minimizer.minimizeStrict(complete).stateCount());
        }
    }
}
