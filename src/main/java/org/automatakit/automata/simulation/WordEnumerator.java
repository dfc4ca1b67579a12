package org.automatakit.automata.simulation;

import org.apache.commons.lang3.tuple.Pair;
import org.automatakit.automata.base.Symbol;
import org.automatakit.automata.base.Word;
import org.automatakit.automata.exceptions.LimitExceededException;
import org.automatakit.automata.models.Automaton;
import org.automatakit.core.Cancellation;
import org.automatakit.core.EngineLimits;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.SortedSet;
import java.util.stream.Collectors;

/**
 * 有界长度的语言枚举。
 * <p>
 * 在 (前缀, 活动状态集合) 空间上做逐层广度优先遍历，步进函数与 {@link Simulator} 相同。
 * 每层内前缀按字母表顺序扩展，因此结果先按长度、再按字母表字典序排列。
 * 活动集合中没有能到达终止状态的状态时，该前缀被剪枝（包括活动集合为空以及只停留在陷阱状态的情况）。不假定自动机是确定的。
 */
public final class WordEnumerator {

    private static final Logger logger = LoggerFactory.getLogger(WordEnumerator.class);

    private final EngineLimits limits;
    private final Cancellation cancellation;

    public WordEnumerator() {
        this(EngineLimits.defaults(), Cancellation.NONE);
    }

    public WordEnumerator(EngineLimits limits, Cancellation cancellation) {
        this.limits = limits;
        this.cancellation = cancellation;
    }

    /**
     * 枚举所有长度不超过 maxLength 的被接受的词。
     * @param automaton 任意自动机，不会被修改。
     * @param maxLength 最大长度，必须非负。
     * @return 按长度、再按字典序排列的词。
     * @throws LimitExceededException 长度、结果数或单层前缀数超过配置上限。
     */
    public List<Word> enumerate(Automaton automaton, int maxLength) {
        if (maxLength < 0) {
            throw new IllegalArgumentException("最大长度不能为负数: " + maxLength);
        }
        if (maxLength > limits.getMaxEnumerationLength()) {
            logger.error("枚举长度 {} 超过上限 {}", maxLength, limits.getMaxEnumerationLength());
            throw new LimitExceededException(EngineLimits.MAX_ENUMERATION_LENGTH, limits.getMaxEnumerationLength());
        }

        List<Word> accepted = new ArrayList<>();
        List<Pair<Word, SortedSet<String>>> frontier = new ArrayList<>();
        // 不含任何余可达状态的前缀不可能再被扩展为被接受的词
        Set<String> live = automaton.coReachableStates();
        SortedSet<String> start = automaton.initialClosure();
        if (isLive(start, live)) {
            frontier.add(Pair.of(Word.EMPTY, start));
        }

        for (int length = 0; length <= maxLength && !frontier.isEmpty(); length++) {
            List<Pair<Word, SortedSet<String>>> next = new ArrayList<>();
            for (Pair<Word, SortedSet<String>> entry : frontier) {
                cancellation.checkpoint("enumerate");
                if (automaton.containsAccepting(entry.getRight())) {
                    accepted.add(entry.getLeft());
                    if (accepted.size() > limits.getMaxEnumeratedWords()) {
                        logger.error("{}: 被接受的词数超过上限 {}", automaton.getName(), limits.getMaxEnumeratedWords());
                        throw new LimitExceededException(EngineLimits.MAX_ENUMERATED_WORDS, limits.getMaxEnumeratedWords());
                    }
                }
                if (length == maxLength) {
                    continue;
                }
                for (Symbol symbol : automaton.getAlphabet().getSymbols()) {
                    SortedSet<String> successor = automaton.step(entry.getRight(), symbol);
                    if (isLive(successor, live)) {
                        next.add(Pair.of(entry.getLeft().append(symbol), successor));
                    }
                }
                if (next.size() > limits.getMaxEnumerationFrontier()) {
                    logger.error("{}: 长度 {} 的待扩展前缀数超过上限 {}", automaton.getName(), length + 1,
                            limits.getMaxEnumerationFrontier());
                    throw new LimitExceededException(EngineLimits.MAX_ENUMERATION_FRONTIER, limits.getMaxEnumerationFrontier());
                }
            }
            logger.debug("{}: 长度 {} 处理完毕，下一层 {} 个前缀", automaton.getName(), length, next.size());
            frontier = next;
        }
        logger.info("枚举 {} (长度 <= {}): {} 个词", automaton.getName(), maxLength, accepted.size());
        return accepted;
    }

    private static boolean isLive(Set<String> active, Set<String> live) {
        for (String id : active) {
            if (live.contains(id)) {
                return true;
            }
        }
        return false;
    }

    /**
     * 同 {@link #enumerate}，每个词以符号标签拼接的字符串表示。
     */
    public List<String> enumerateAsStrings(Automaton automaton, int maxLength) {
        return enumerate(automaton, maxLength).stream()
                .map(Word::toString)
                .collect(Collectors.toList());
    }
}
