package org.automatakit.automata.analysis;

import org.automatakit.automata.algorithms.Minimizer;
import org.automatakit.automata.base.State;
import org.automatakit.automata.base.Symbol;
import org.automatakit.automata.models.Automaton;
import org.automatakit.core.Cancellation;
import org.automatakit.core.EngineLimits;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Set;

/**
 * 计算自动机的结构性质：确定性、完全性、最小性等。
 * 所有方法都是只读的，不修改传入的自动机。
 */
public final class PropertyAnalyzer {

    private static final Logger logger = LoggerFactory.getLogger(PropertyAnalyzer.class);

    private final EngineLimits limits;
    private final Cancellation cancellation;
    // 只在判断最小性时才需要，延迟创建
    private Minimizer minimizer;

    public PropertyAnalyzer() {
        this(EngineLimits.defaults(), Cancellation.NONE);
    }

    public PropertyAnalyzer(EngineLimits limits, Cancellation cancellation) {
        this.limits = limits;
        this.cancellation = cancellation;
    }

    /**
     * 确定性：恰有一个初始状态，没有 epsilon 迁移，且每个 (状态, 符号) 至多一条出边。
     */
    public boolean isDeterministic(Automaton automaton) {
        if (automaton.getInitialStates().size() != 1) {
            return false;
        }
        if (automaton.hasEpsilonTransitions()) {
            return false;
        }
        for (String id : automaton.getStateIds()) {
            for (Symbol symbol : automaton.outgoingSymbols(id)) {
                if (automaton.successors(id, symbol).size() > 1) {
                    logger.debug("{}: 状态 {} 在符号 {} 上有多个后继", automaton.getName(), id, symbol);
                    return false;
                }
            }
        }
        return true;
    }

    /**
     * 完全性：确定的，并且每个可达状态对字母表中每个符号恰有一条出边。
     */
    public boolean isComplete(Automaton automaton) {
        if (!isDeterministic(automaton)) {
            return false;
        }
        for (String id : automaton.reachableStates()) {
            for (Symbol symbol : automaton.getAlphabet().getSymbols()) {
                if (automaton.successors(id, symbol).size() != 1) {
                    return false;
                }
            }
        }
        return true;
    }

    /**
     * 每个状态（不论是否可达）对每个符号都有出边。
     */
    public boolean isTotal(Automaton automaton) {
        for (String id : automaton.getStateIds()) {
            for (Symbol symbol : automaton.getAlphabet().getSymbols()) {
                if (automaton.successors(id, symbol).isEmpty()) {
                    return false;
                }
            }
        }
        return true;
    }

    public boolean hasUnreachableStates(Automaton automaton) {
        return automaton.reachableStates().size() < automaton.stateCount();
    }

    /**
     * 最小性：确定、完全、没有不可达状态，并且最小化后状态数不变。
     */
    public boolean isMinimal(Automaton automaton) {
        if (!isComplete(automaton) || hasUnreachableStates(automaton)) {
            return false;
        }
        int minimizedSize = minimizer().minimizeStrict(automaton).stateCount();
        logger.debug("{}: 状态数 {}，最小化后 {}", automaton.getName(), automaton.stateCount(), minimizedSize);
        return minimizedSize == automaton.stateCount();
    }

    /**
     * 语言为空当且仅当没有终止状态从初始状态可达。没有初始状态的自动机接受空语言。
     */
    public boolean isEmptyLanguage(Automaton automaton) {
        Set<String> reachable = automaton.reachableStates();
        return reachable.stream().noneMatch(automaton::isAccepting);
    }

    public AutomatonType getType(Automaton automaton) {
        if (automaton.hasEpsilonTransitions()) {
            return AutomatonType.EPSILON_NFA;
        }
        return isDeterministic(automaton) ? AutomatonType.DFA : AutomatonType.NFA;
    }

    /**
     * 一次计算全部性质。
     */
    public AutomatonProperties analyze(Automaton automaton) {
        boolean deterministic = isDeterministic(automaton);
        boolean complete = deterministic && isComplete(automaton);
        boolean unreachable = hasUnreachableStates(automaton);
        AutomatonProperties properties = AutomatonProperties.builder()
                .automatonName(automaton.getName())
                .type(getType(automaton))
                .deterministic(deterministic)
                .complete(complete)
                .minimal(complete && !unreachable && isMinimal(automaton))
                .emptyLanguage(isEmptyLanguage(automaton))
                .epsilonTransitions(automaton.hasEpsilonTransitions())
                .unreachableStates(unreachable)
                .stateCount(automaton.stateCount())
                .transitionCount(automaton.transitionCount())
                .initialStateCount(automaton.getInitialStates().size())
                .acceptingStateCount((int) automaton.getStates().stream().filter(State::isAccepting).count())
                .reachableStateCount(automaton.reachableStates().size())
                .build();
        logger.info("分析结果: {}", properties);
        return properties;
    }

    private Minimizer minimizer() {
        if (minimizer == null) {
            minimizer = new Minimizer(limits, cancellation);
        }
        return minimizer;
    }
}
