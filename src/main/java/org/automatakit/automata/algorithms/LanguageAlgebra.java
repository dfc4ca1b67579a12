package org.automatakit.automata.algorithms;

import org.apache.commons.lang3.tuple.Pair;
import org.automatakit.automata.analysis.PropertyAnalyzer;
import org.automatakit.automata.base.Alphabet;
import org.automatakit.automata.base.Symbol;
import org.automatakit.automata.base.Word;
import org.automatakit.automata.models.Automaton;
import org.automatakit.core.Cancellation;
import org.automatakit.core.EngineLimits;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;
import java.util.function.BiPredicate;

/**
 * 语言代数：并、交、差、补以及等价判定。
 * <p>
 * 所有操作都自动规范化输入：两个输入先扩展到共同的字母表（字母表的并集），
 * 再确定化并补全。乘积构造只生成从初始状态对可达的状态对。
 * 结果不会自动最小化，调用方可以按需调用 {@link Minimizer}。
 */
public final class LanguageAlgebra {

    private static final Logger logger = LoggerFactory.getLogger(LanguageAlgebra.class);

    private final PropertyAnalyzer analyzer;
    private final Determinizer determinizer;
    private final Completer completer;
    private final Minimizer minimizer;

    public LanguageAlgebra() {
        this(EngineLimits.defaults(), Cancellation.NONE);
    }

    public LanguageAlgebra(EngineLimits limits, Cancellation cancellation) {
        this.analyzer = new PropertyAnalyzer(limits, cancellation);
        this.determinizer = new Determinizer(limits, cancellation);
        this.completer = new Completer(analyzer);
        this.minimizer = new Minimizer(limits, cancellation);
    }

    /**
     * L(A) ∪ L(B)。名称为 {@code A|B}。
     */
    public Automaton union(Automaton a, Automaton b) {
        return product(a, b, a.getName() + "|" + b.getName(), (p, q) -> p || q);
    }

    /**
     * L(A) ∩ L(B)。名称为 {@code A&B}。
     */
    public Automaton intersection(Automaton a, Automaton b) {
        return product(a, b, a.getName() + "&" + b.getName(), (p, q) -> p && q);
    }

    /**
     * L(A) \ L(B)。名称为 {@code A-B}。
     */
    public Automaton difference(Automaton a, Automaton b) {
        return product(a, b, a.getName() + "-" + b.getName(), (p, q) -> p && !q);
    }

    /**
     * 补语言（相对于自动机自己的字母表）。
     * 输入不是完全 DFA 时先自动确定化并补全，然后翻转每个状态的终止标记。
     * @return 名称为 {@code <name>_complement} 的完全 DFA。
     */
    public Automaton complement(Automaton automaton) {
        Automaton complete = normalize(automaton);
        Automaton result = new Automaton(automaton.getName() + "_complement", complete.getAlphabet());
        complete.getStates().forEach(s -> result.addState(s.getId(), s.isInitial(), !s.isAccepting()));
        complete.getTransitions().forEach(t -> result.addTransition(t.getSource(), t.getSymbol(), t.getTarget()));
        logger.info("求补 {}: {} 个状态", automaton.getName(), result.stateCount());
        return result;
    }

    /**
     * 两个自动机是否接受相同的语言。
     * 两边在共同字母表上最小化后，比较规范形式是否同构。
     */
    public boolean areEquivalent(Automaton a, Automaton b) {
        Alphabet common = a.getAlphabet().union(b.getAlphabet());
        Automaton minA = minimizer.minimize(a.withAlphabet(common));
        Automaton minB = minimizer.minimize(b.withAlphabet(common));
        boolean equivalent = isomorphic(minA, minB);
        logger.info("等价判定 {} 与 {}: {}", a.getName(), b.getName(), equivalent);
        return equivalent;
    }

    /**
     * 求一个恰好被其中一个自动机接受的最短词（长度优先，其次按字母表顺序）。
     * @return 两者等价时返回 {@link Optional#empty()}。
     */
    public Optional<Word> distinguishingWord(Automaton a, Automaton b) {
        Automaton symmetric = product(a, b, a.getName() + "^" + b.getName(), (p, q) -> p ^ q);
        return shortestAcceptedWord(symmetric);
    }

    public boolean isEmpty(Automaton automaton) {
        return analyzer.isEmptyLanguage(automaton);
    }

    /**
     * L(A) ⊆ L(B)，即 L(A) \ L(B) 为空。
     */
    public boolean isSubsetOf(Automaton a, Automaton b) {
        return analyzer.isEmptyLanguage(difference(a, b));
    }

    /**
     * 判断两个最小完全 DFA 是否同构：从初始状态同步广度优先遍历，建立双射，
     * 要求对应状态的终止标记一致、各符号上的目标也相互对应。
     */
    boolean isomorphic(Automaton x, Automaton y) {
        if (x.stateCount() != y.stateCount() || !x.getAlphabet().equals(y.getAlphabet())) {
            return false;
        }
        Map<String, String> forward = new HashMap<>();
        Map<String, String> backward = new HashMap<>();
        String startX = x.getInitialState().getId();
        String startY = y.getInitialState().getId();
        forward.put(startX, startY);
        backward.put(startY, startX);
        Deque<String> worklist = new ArrayDeque<>();
        worklist.add(startX);
        while (!worklist.isEmpty()) {
            String p = worklist.poll();
            String q = forward.get(p);
            if (x.isAccepting(p) != y.isAccepting(q)) {
                return false;
            }
            for (Symbol symbol : x.getAlphabet().getSymbols()) {
                String pNext = single(x, p, symbol);
                String qNext = single(y, q, symbol);
                if (pNext == null || qNext == null) {
                    if (pNext != null || qNext != null) {
                        return false;
                    }
                    continue;
                }
                String mapped = forward.get(pNext);
                String reverse = backward.get(qNext);
                if (mapped == null && reverse == null) {
                    forward.put(pNext, qNext);
                    backward.put(qNext, pNext);
                    worklist.add(pNext);
                } else if (!qNext.equals(mapped) || !pNext.equals(reverse)) {
                    return false;
                }
            }
        }
        return forward.size() == x.stateCount();
    }

    private Automaton product(Automaton a, Automaton b, String name, BiPredicate<Boolean, Boolean> acceptance) {
        Alphabet common = a.getAlphabet().union(b.getAlphabet());
        Automaton left = normalize(a.withAlphabet(common));
        Automaton right = normalize(b.withAlphabet(common));

        Automaton result = new Automaton(name, common);
        Map<Pair<String, String>, String> names = new HashMap<>();
        Deque<Pair<String, String>> worklist = new ArrayDeque<>();
        Pair<String, String> start = Pair.of(left.getInitialState().getId(), right.getInitialState().getId());
        addPair(result, names, start, true, left, right, acceptance);
        worklist.add(start);
        while (!worklist.isEmpty()) {
            Pair<String, String> current = worklist.poll();
            for (Symbol symbol : common.getSymbols()) {
                Pair<String, String> next = Pair.of(single(left, current.getLeft(), symbol),
                        single(right, current.getRight(), symbol));
                if (!names.containsKey(next)) {
                    addPair(result, names, next, false, left, right, acceptance);
                    worklist.add(next);
                }
                result.addTransition(names.get(current), symbol, names.get(next));
            }
        }
        logger.info("乘积构造 {}: {} x {} -> {} 个可达状态对", name, left.stateCount(), right.stateCount(), result.stateCount());
        return result;
    }

    private static void addPair(Automaton result, Map<Pair<String, String>, String> names, Pair<String, String> pair,
                                boolean initial, Automaton left, Automaton right,
                                BiPredicate<Boolean, Boolean> acceptance) {
        String id = "(" + pair.getLeft() + "," + pair.getRight() + ")";
        if (result.containsState(id)) {
            // 分量标识中含有逗号或括号时可能重名
            id = id + "#" + names.size();
        }
        boolean accepting = acceptance.test(left.isAccepting(pair.getLeft()), right.isAccepting(pair.getRight()));
        result.addState(id, initial, accepting);
        names.put(pair, id);
    }

    /**
     * 确定化（必要时）并补全。
     */
    private Automaton normalize(Automaton automaton) {
        if (analyzer.isComplete(automaton) && !analyzer.hasUnreachableStates(automaton)) {
            return automaton;
        }
        if (!analyzer.isDeterministic(automaton)) {
            logger.warn("{} 不是确定的，先进行子集构造", automaton.getName());
            automaton = determinizer.determinize(automaton);
        }
        if (!analyzer.isComplete(automaton)) {
            logger.warn("{} 不是完全的，先进行补全", automaton.getName());
        }
        return completer.complete(automaton).withoutUnreachableStates();
    }

    private static String single(Automaton dfa, String state, Symbol symbol) {
        Set<String> targets = dfa.successors(state, symbol);
        return targets.isEmpty() ? null : targets.iterator().next();
    }

    private static Optional<Word> shortestAcceptedWord(Automaton dfa) {
        String start = dfa.getInitialState().getId();
        Map<String, Word> paths = new HashMap<>();
        paths.put(start, Word.EMPTY);
        Deque<String> worklist = new ArrayDeque<>();
        worklist.add(start);
        while (!worklist.isEmpty()) {
            String current = worklist.poll();
            if (dfa.isAccepting(current)) {
                return Optional.of(paths.get(current));
            }
            for (Symbol symbol : dfa.getAlphabet().getSymbols()) {
                String next = single(dfa, current, symbol);
                if (next != null && !paths.containsKey(next)) {
                    paths.put(next, paths.get(current).append(symbol));
                    worklist.add(next);
                }
            }
        }
        return Optional.empty();
    }
}
