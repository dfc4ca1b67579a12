package org.automatakit.automata.algorithms;

import org.apache.commons.lang3.tuple.Pair;
import org.automatakit.automata.analysis.PropertyAnalyzer;
import org.automatakit.automata.base.Symbol;
import org.automatakit.automata.exceptions.Precondition;
import org.automatakit.automata.exceptions.PreconditionException;
import org.automatakit.automata.models.Automaton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * 通过加入一个非终止的陷阱状态（sink）使 DFA 成为完全的。
 * <p>
 * 补全覆盖全部状态，包括不可达状态，结果满足 {@link PropertyAnalyzer#isTotal}。
 * 因此只在可达部分完全（{@link PropertyAnalyzer#isComplete}）而存在缺边的不可达状态的输入，
 * 仍会得到一个陷阱状态；语言不受影响。
 * 已经全函数的自动机原样复制返回，因此该操作是幂等的。
 */
public final class Completer {

    private static final Logger logger = LoggerFactory.getLogger(Completer.class);

    public static final String SINK_ID = "sink";

    private final PropertyAnalyzer analyzer;

    public Completer() {
        this(new PropertyAnalyzer());
    }

    public Completer(PropertyAnalyzer analyzer) {
        this.analyzer = analyzer;
    }

    /**
     * @param dfa 确定自动机。
     * @return 完全的等价自动机，名称为 {@code <name>_complete}。
     * @throws PreconditionException 如果输入不是确定的。
     */
    public Automaton complete(Automaton dfa) {
        if (!analyzer.isDeterministic(dfa)) {
            logger.error("{}: 只有确定自动机可以被补全", dfa.getName());
            throw new PreconditionException(Precondition.NOT_DETERMINISTIC, "complete");
        }
        Automaton result = dfa.copy(dfa.getName() + "_complete");

        List<Pair<String, Symbol>> missing = new ArrayList<>();
        for (String id : dfa.getStateIds()) {
            for (Symbol symbol : dfa.getAlphabet().getSymbols()) {
                if (dfa.successors(id, symbol).isEmpty()) {
                    missing.add(Pair.of(id, symbol));
                }
            }
        }
        if (missing.isEmpty()) {
            logger.debug("{} 已经是完全的，不需要陷阱状态", dfa.getName());
            return result;
        }

        String sink = freshSinkId(dfa);
        result.addState(sink, false, false);
        for (Symbol symbol : dfa.getAlphabet().getSymbols()) {
            result.addTransition(sink, symbol, sink);
        }
        for (Pair<String, Symbol> entry : missing) {
            result.addTransition(entry.getLeft(), entry.getRight(), sink);
        }
        logger.info("补全 {}: 加入陷阱状态 {} 和 {} 条缺失迁移", dfa.getName(), sink, missing.size());
        return result;
    }

    private static String freshSinkId(Automaton automaton) {
        if (!automaton.containsState(SINK_ID)) {
            return SINK_ID;
        }
        int suffix = 1;
        while (automaton.containsState(SINK_ID + "_" + suffix)) {
            suffix++;
        }
        return SINK_ID + "_" + suffix;
    }
}
