package org.automatakit.automata.algorithms;

import org.automatakit.automata.SampleAutomata;
import org.automatakit.automata.analysis.PropertyAnalyzer;
import org.automatakit.automata.base.Word;
import org.automatakit.automata.exceptions.LimitExceededException;
import org.automatakit.automata.exceptions.OperationCancelledException;
import org.automatakit.automata.models.Automaton;
import org.automatakit.automata.simulation.Simulator;
import org.automatakit.core.Cancellation;
import org.automatakit.core.EngineLimits;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class DeterminizerTest {

    private static Determinizer determinizer;
    private static PropertyAnalyzer analyzer;
    private static Simulator simulator;

    @BeforeAll
    static void setUp() {
        determinizer = new Determinizer();
        analyzer = new PropertyAnalyzer();
        simulator = new Simulator();
    }

    @Nested
    @DisplayName("子集构造 (Subset construction)")
    class ConstructionTests {

        @Test
        @DisplayName("输出总是确定的，且与输入接受相同的词")
        void testOutputDeterministicAndEquivalent() {
            for (Automaton a : SampleAutomata.all()) {
                Automaton dfa = determinizer.determinize(a);
                assertTrue(analyzer.isDeterministic(dfa), a.getName() + " should determinize to a DFA");
                for (Word w : SampleAutomata.allWords(a.getAlphabet(), 5)) {
                    assertEquals(simulator.accepts(a, w), simulator.accepts(dfa, w),
                            a.getName() + " disagrees on \"" + w + "\"");
                }
            }
        }

        @Test
        @DisplayName("宏状态以排序后的成员集合命名")
        void testMacroStateNames() {
            Automaton dfa = determinizer.determinize(SampleAutomata.endsWithAb());

            assertAll(
                    () -> assertEquals("endsWithAb_DFA", dfa.getName()),
                    () -> assertEquals(Set.of("{q0}", "{q0,q1}", "{q0,q2}"), dfa.getStateIds()),
                    () -> assertEquals("{q0}", dfa.getInitialState().getId()),
                    () -> assertTrue(dfa.isAccepting("{q0,q2}")),
                    () -> assertFalse(dfa.isAccepting("{q0,q1}")),
                    () -> assertEquals(6, dfa.transitionCount())
            );
        }

        @Test
        @DisplayName("epsilon 迁移到终止状态：确定化后接受空词")
        void testEpsilonToFinal_AcceptsEmptyWord() {
            Automaton dfa = determinizer.determinize(SampleAutomata.epsilonToFinal());

            assertAll(
                    () -> assertEquals(1, dfa.stateCount()),
                    () -> assertEquals("{q0,q1}", dfa.getInitialState().getId()),
                    () -> assertTrue(dfa.getInitialState().isAccepting()),
                    () -> assertTrue(simulator.accepts(dfa, Word.EMPTY))
            );
        }

        @Test
        @DisplayName("没有初始状态时得到接受空语言的单状态 DFA")
        void testNoInitialState() {
            Automaton dfa = determinizer.determinize(SampleAutomata.noInitial());

            assertAll(
                    () -> assertEquals(1, dfa.stateCount()),
                    () -> assertEquals("{}", dfa.getInitialState().getId()),
                    () -> assertFalse(dfa.getInitialState().isAccepting()),
                    () -> assertEquals(0, dfa.transitionCount()),
                    () -> assertTrue(analyzer.isDeterministic(dfa)),
                    () -> assertTrue(analyzer.isEmptyLanguage(dfa))
            );
        }

        @Test
        @DisplayName("不修改输入")
        void testInputUnchanged() {
            Automaton nfa = SampleAutomata.aStarBStar();
            String before = nfa.toSnapshot().toString();
            determinizer.determinize(nfa);
            assertEquals(before, nfa.toSnapshot().toString());
        }
    }

    @Nested
    @DisplayName("资源上限与取消 (Limits and cancellation)")
    class LimitTests {

        @Test
        @DisplayName("宏状态数超过上限时抛出 LimitExceededException")
        void testLimitExceeded() {
            Determinizer limited = new Determinizer(
                    EngineLimits.builder().maxDeterminizedStates(2).build(), Cancellation.NONE);
            LimitExceededException e = assertThrows(LimitExceededException.class,
                    () -> limited.determinize(SampleAutomata.endsWithAb()));
            assertEquals(EngineLimits.MAX_DETERMINIZED_STATES, e.getLimitName());
            assertEquals(2, e.getLimit());
        }

        @Test
        @DisplayName("取消后停止处理")
        void testCancelled() {
            Cancellation cancellation = new Cancellation();
            cancellation.cancel();
            Determinizer cancellable = new Determinizer(EngineLimits.defaults(), cancellation);
            assertThrows(OperationCancelledException.class,
                    () -> cancellable.determinize(SampleAutomata.endsWithAb()));
        }
    }
}
