package org.automatakit.automata.algorithms;

import org.automatakit.automata.base.Symbol;
import org.automatakit.automata.exceptions.LimitExceededException;
import org.automatakit.automata.models.Automaton;
import org.automatakit.core.Cancellation;
import org.automatakit.core.EngineLimits;
import org.automatakit.utils.SetArena;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Deque;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.SortedSet;

/**
 * 子集构造：把任意 NFA / ε-NFA 转换为等价的 DFA。
 * <p>
 * 起始宏状态是初始状态集合的 epsilon 闭包。对工作队列中的每个宏状态和字母表中的每个符号，
 * 取一步后继再做 epsilon 闭包；非空且未见过的集合成为新的宏状态。
 * 宏状态按集合值去重，与成员的插入顺序无关。
 * 宏状态包含原终止状态时为终止状态。
 * <p>
 * 输出是确定的，但不保证完全。输入不会被修改。
 */
public final class Determinizer {

    private static final Logger logger = LoggerFactory.getLogger(Determinizer.class);

    private final EngineLimits limits;
    private final Cancellation cancellation;

    public Determinizer() {
        this(EngineLimits.defaults(), Cancellation.NONE);
    }

    public Determinizer(EngineLimits limits, Cancellation cancellation) {
        this.limits = limits;
        this.cancellation = cancellation;
    }

    /**
     * @param nfa 任意自动机。
     * @return 等价的确定自动机，名称为 {@code <name>_DFA}。
     * @throws LimitExceededException 宏状态数超过 {@link EngineLimits#getMaxDeterminizedStates()}。
     */
    public Automaton determinize(Automaton nfa) {
        Automaton dfa = new Automaton(nfa.getName() + "_DFA", nfa.getAlphabet());
        SetArena<String> arena = new SetArena<>();
        List<String> names = new ArrayList<>();
        Set<String> usedNames = new HashSet<>();

        // 没有初始状态时，起始宏状态为空集，得到接受空语言的单状态 DFA
        SortedSet<String> start = nfa.initialClosure();
        int startIndex = arena.intern(start);
        names.add(register(dfa, usedNames, start, startIndex, true, nfa.containsAccepting(start)));

        Deque<Integer> worklist = new ArrayDeque<>();
        if (!start.isEmpty()) {
            worklist.add(startIndex);
        }
        while (!worklist.isEmpty()) {
            cancellation.checkpoint("determinize");
            int current = worklist.poll();
            SortedSet<String> macroState = arena.get(current);
            logger.debug("处理宏状态 {}", names.get(current));
            for (Symbol symbol : nfa.getAlphabet().getSymbols()) {
                SortedSet<String> next = nfa.step(macroState, symbol);
                if (next.isEmpty()) {
                    continue;
                }
                int nextIndex = arena.indexOf(next);
                if (nextIndex < 0) {
                    if (arena.size() >= limits.getMaxDeterminizedStates()) {
                        logger.error("{}: 子集构造的宏状态数超过上限 {}", nfa.getName(), limits.getMaxDeterminizedStates());
                        throw new LimitExceededException(EngineLimits.MAX_DETERMINIZED_STATES, limits.getMaxDeterminizedStates());
                    }
                    nextIndex = arena.intern(next);
                    names.add(register(dfa, usedNames, next, nextIndex, false, nfa.containsAccepting(next)));
                    worklist.add(nextIndex);
                }
                dfa.addTransition(names.get(current), symbol, names.get(nextIndex));
            }
        }
        logger.info("子集构造 {}: {} 个状态 -> {} 个宏状态", nfa.getName(), nfa.stateCount(), dfa.stateCount());
        return dfa;
    }

    private static String register(Automaton dfa, Set<String> usedNames, Collection<String> members,
                                   int index, boolean initial, boolean accepting) {
        String name = macroStateName(members);
        if (!usedNames.add(name)) {
            // 原状态标识中含有分隔符时可能重名
            name = name + "#" + index;
            usedNames.add(name);
        }
        dfa.addState(name, initial, accepting);
        return name;
    }

    /**
     * 宏状态的名称：成员标识排序后以逗号连接，例如 {@code {q0,q1}}。
     */
    static String macroStateName(Collection<String> members) {
        return "{" + String.join(",", members) + "}";
    }
}
