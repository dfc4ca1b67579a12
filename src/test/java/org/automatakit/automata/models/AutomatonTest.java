package org.automatakit.automata.models;

import org.automatakit.automata.SampleAutomata;
import org.automatakit.automata.base.Alphabet;
import org.automatakit.automata.base.State;
import org.automatakit.automata.base.Symbol;
import org.automatakit.automata.base.Transition;
import org.automatakit.automata.exceptions.DuplicateStateException;
import org.automatakit.automata.exceptions.EmptyAutomatonException;
import org.automatakit.automata.exceptions.ErrorKind;
import org.automatakit.automata.exceptions.InvalidReferenceException;
import org.automatakit.automata.exceptions.PreconditionException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class AutomatonTest {

    @Nested
    @DisplayName("结构修改 (Mutation)")
    class MutationTests {

        @Test
        @DisplayName("引用不存在的状态时加入迁移应失败")
        void testAddTransition_UnknownState_ShouldThrow() {
            Automaton a = SampleAutomata.abStar();
            InvalidReferenceException e = assertThrows(InvalidReferenceException.class,
                    () -> a.addTransition("q0", "a", "missing"));
            assertEquals(ErrorKind.INVALID_REFERENCE, e.getKind());
            assertThrows(InvalidReferenceException.class, () -> a.addTransition("missing", "a", "q0"));
            assertEquals(2, a.transitionCount(), "Failed additions must not change the automaton");
        }

        @Test
        @DisplayName("符号不在字母表中且不是 epsilon 时加入迁移应失败")
        void testAddTransition_UnknownSymbol_ShouldThrow() {
            Automaton a = SampleAutomata.abStar();
            assertThrows(InvalidReferenceException.class, () -> a.addTransition("q0", "c", "q1"));
            assertTrue(a.addTransition("q0", Symbol.EPSILON, "q1"), "Epsilon is always allowed");
            assertTrue(a.hasEpsilonTransitions());
        }

        @Test
        @DisplayName("重复加入同一迁移返回 false")
        void testAddTransition_Duplicate_ReturnsFalse() {
            Automaton a = SampleAutomata.abStar();
            assertFalse(a.addTransition("q0", "a", "q1"));
            assertEquals(2, a.transitionCount());
        }

        @Test
        @DisplayName("重复的状态标识应被拒绝")
        void testAddState_Duplicate_ShouldThrow() {
            Automaton a = SampleAutomata.abStar();
            DuplicateStateException e = assertThrows(DuplicateStateException.class, () -> a.addState("q0"));
            assertEquals("q0", e.getStateId());
            assertEquals(ErrorKind.DUPLICATE_STATE, e.getKind());
        }

        @Test
        @DisplayName("删除状态应级联删除引用它的所有迁移")
        void testRemoveState_CascadesTransitions() {
            Automaton a = SampleAutomata.endsWithAb();
            a.removeState("q1");

            assertAll("No dangling transitions after removal",
                    () -> assertFalse(a.containsState("q1")),
                    () -> assertEquals(2, a.transitionCount()),
                    () -> assertTrue(a.getTransitions().stream().noneMatch(t -> t.touches("q1"))),
                    () -> assertEquals(Set.of("q0"), a.successors("q0", Symbol.of("a")))
            );
            assertThrows(InvalidReferenceException.class, () -> a.removeState("q1"));
        }

        @Test
        @DisplayName("修改初始/终止标记")
        void testSetFlags() {
            Automaton a = SampleAutomata.abStar();
            a.setAccepting("q0", true);
            a.setInitial("q1", true);

            assertAll(
                    () -> assertTrue(a.isAccepting("q0")),
                    () -> assertEquals(2, a.getInitialStates().size()),
                    () -> assertThrows(PreconditionException.class, a::getInitialState)
            );
            assertThrows(InvalidReferenceException.class, () -> a.setAccepting("zz", true));
        }

        @Test
        @DisplayName("从字母表移除符号应级联删除以它为标签的迁移")
        void testRemoveSymbol_CascadesTransitions() {
            Automaton a = SampleAutomata.abStar();
            a.removeSymbol(Symbol.of("b"));

            assertEquals(Alphabet.of("a"), a.getAlphabet());
            assertEquals(1, a.transitionCount());
            assertThrows(InvalidReferenceException.class, () -> a.removeSymbol(Symbol.of("b")));
        }

        @Test
        @DisplayName("删除迁移")
        void testRemoveTransition() {
            Automaton a = SampleAutomata.abStar();
            assertTrue(a.removeTransition("q1", Symbol.of("b"), "q1"));
            assertFalse(a.removeTransition(new Transition("q1", Symbol.of("b"), "q1")));
            assertTrue(a.successors("q1", Symbol.of("b")).isEmpty());
        }
    }

    @Nested
    @DisplayName("结构查询 (Queries)")
    class QueryTests {

        @Test
        @DisplayName("没有初始状态时获取唯一初始状态应失败")
        void testGetInitialState_NoInitial_ShouldThrow() {
            Automaton a = SampleAutomata.noInitial();
            EmptyAutomatonException e = assertThrows(EmptyAutomatonException.class, a::getInitialState);
            assertEquals(ErrorKind.EMPTY_AUTOMATON, e.getKind());
            assertTrue(a.initialClosure().isEmpty());
            assertTrue(a.reachableStates().isEmpty());
        }

        @Test
        @DisplayName("可达状态包括经 epsilon 边到达的状态")
        void testReachableStates_FollowEpsilon() {
            Automaton a = SampleAutomata.aStarBStar();
            a.addState("island");
            assertEquals(Set.of("s", "x", "y"), a.reachableStates());
        }

        @Test
        @DisplayName("余可达状态：存在到终止状态的路径")
        void testCoReachableStates() {
            Automaton a = SampleAutomata.endsWithAb();
            a.addState("dead");
            a.addTransition("q2", "a", "dead");
            assertEquals(Set.of("q0", "q1", "q2"), a.coReachableStates());
        }

        @Test
        @DisplayName("epsilon 闭包与步进")
        void testEpsilonClosureAndStep() {
            Automaton a = SampleAutomata.aStarBStar();
            assertAll(
                    () -> assertEquals(Set.of("s", "x", "y"), a.initialClosure()),
                    () -> assertEquals(Set.of("x", "y"), a.step(a.initialClosure(), Symbol.of("a"))),
                    () -> assertEquals(Set.of("y"), a.step(Set.of("x", "y"), Symbol.of("b"))),
                    () -> assertTrue(a.step(Set.of("y"), Symbol.of("a")).isEmpty())
            );
        }
    }

    @Nested
    @DisplayName("复制与快照 (Copy and snapshot)")
    class CopyTests {

        @Test
        @DisplayName("副本与原自动机互不影响")
        void testCopy_IsIndependent() {
            Automaton original = SampleAutomata.abStar();
            Automaton copy = original.copy("copy");
            copy.removeState("q1");
            copy.addState("extra");

            assertEquals(2, original.stateCount());
            assertEquals(2, original.transitionCount());
            assertEquals("copy", copy.getName());
        }

        @Test
        @DisplayName("删除不可达状态返回新自动机，原自动机不变")
        void testWithoutUnreachableStates() {
            Automaton a = SampleAutomata.abStar();
            a.addState("u", false, true);
            a.addTransition("u", "a", "q0");

            Automaton trimmed = a.withoutUnreachableStates();
            assertEquals(Set.of("q0", "q1"), trimmed.getStateIds());
            assertEquals(2, trimmed.transitionCount());
            assertEquals(3, a.stateCount());
        }

        @Test
        @DisplayName("快照重建得到相同结构")
        void testSnapshotRoundTrip() {
            Automaton a = SampleAutomata.aStarBStar();
            AutomatonSnapshot snapshot = a.toSnapshot();
            Automaton rebuilt = Automaton.fromSnapshot(snapshot);

            assertAll(
                    () -> assertEquals(a.getName(), rebuilt.getName()),
                    () -> assertEquals(a.getAlphabet(), rebuilt.getAlphabet()),
                    () -> assertEquals(Set.copyOf(a.getStates()), Set.copyOf(rebuilt.getStates())),
                    () -> assertEquals(a.getTransitions(), rebuilt.getTransitions()),
                    () -> assertTrue(snapshot.getTransitions().stream().anyMatch(t -> "ε".equals(t.getSymbol())))
            );
        }

        @Test
        @DisplayName("扩展字母表必须包含原字母表")
        void testWithAlphabet() {
            Automaton a = SampleAutomata.abStar();
            Automaton extended = a.withAlphabet(Alphabet.of("a", "b", "c"));
            assertEquals(3, extended.getAlphabet().size());
            assertEquals(State.of("q0", true, false), extended.getState("q0").orElseThrow());
            assertThrows(IllegalArgumentException.class, () -> a.withAlphabet(Alphabet.of("a")));
        }
    }
}
