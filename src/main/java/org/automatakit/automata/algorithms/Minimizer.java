package org.automatakit.automata.algorithms;

import org.automatakit.automata.analysis.PropertyAnalyzer;
import org.automatakit.automata.base.Alphabet;
import org.automatakit.automata.base.Symbol;
import org.automatakit.automata.exceptions.Precondition;
import org.automatakit.automata.exceptions.PreconditionException;
import org.automatakit.automata.models.Automaton;
import org.automatakit.core.Cancellation;
import org.automatakit.core.EngineLimits;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;

/**
 * 划分求精最小化。
 * <p>
 * 初始划分为 {终止状态, 非终止状态}（空块省略）。每一轮按成员在各符号上的目标块对每个块进行分裂，
 * 直到一整轮没有任何分裂为止。每个块成为输出中的一个状态，迁移取自块内的代表元。
 * <p>
 * 输出状态按从初始状态出发、依字母表顺序的广度优先次序重新命名为 {@code q0, q1, ...}，
 * 因此同一字母表上接受相同语言的自动机得到结构完全相同的输出。
 */
public final class Minimizer {

    private static final Logger logger = LoggerFactory.getLogger(Minimizer.class);

    private final Cancellation cancellation;
    private final PropertyAnalyzer analyzer;
    private final Determinizer determinizer;
    private final Completer completer;

    public Minimizer() {
        this(EngineLimits.defaults(), Cancellation.NONE);
    }

    public Minimizer(EngineLimits limits, Cancellation cancellation) {
        this.cancellation = cancellation;
        this.analyzer = new PropertyAnalyzer(limits, cancellation);
        this.determinizer = new Determinizer(limits, cancellation);
        this.completer = new Completer(analyzer);
    }

    /**
     * 对任意自动机求最小完全 DFA：必要时先确定化，然后补全并删除不可达状态，最后求精。
     * @param automaton 任意自动机，不会被修改。
     * @return 规范的最小完全 DFA，名称为 {@code <name>_min}。
     */
    public Automaton minimize(Automaton automaton) {
        Automaton dfa = analyzer.isDeterministic(automaton) ? automaton : determinizer.determinize(automaton);
        Automaton normalized = completer.complete(dfa).withoutUnreachableStates();
        return refine(normalized, automaton.getName());
    }

    /**
     * 只接受确定、完全且没有不可达状态的输入。
     * @throws PreconditionException 输入不满足上述任一条件。
     */
    public Automaton minimizeStrict(Automaton dfa) {
        if (!analyzer.isDeterministic(dfa)) {
            logger.error("{}: 最小化要求确定自动机", dfa.getName());
            throw new PreconditionException(Precondition.NOT_DETERMINISTIC, "minimize");
        }
        if (!analyzer.isComplete(dfa)) {
            logger.error("{}: 最小化要求完全自动机", dfa.getName());
            throw new PreconditionException(Precondition.NOT_COMPLETE, "minimize");
        }
        if (analyzer.hasUnreachableStates(dfa)) {
            logger.error("{}: 最小化要求没有不可达状态", dfa.getName());
            throw new PreconditionException(Precondition.HAS_UNREACHABLE_STATES, "minimize");
        }
        return refine(dfa, dfa.getName());
    }

    private Automaton refine(Automaton dfa, String baseName) {
        Alphabet alphabet = dfa.getAlphabet();
        List<String> ids = new ArrayList<>(dfa.getStateIds());
        Map<String, Integer> index = new HashMap<>();
        for (int i = 0; i < ids.size(); i++) {
            index.put(ids.get(i), i);
        }
        int n = ids.size();
        int k = alphabet.size();

        int[][] delta = new int[n][k];
        for (int i = 0; i < n; i++) {
            for (int s = 0; s < k; s++) {
                String target = dfa.successors(ids.get(i), alphabet.get(s)).iterator().next();
                delta[i][s] = index.get(target);
            }
        }

        int[] block = new int[n];
        int blockCount = initialPartition(dfa, ids, block);
        int pass = 0;
        while (true) {
            cancellation.checkpoint("minimize");
            pass++;
            Map<List<Integer>, Integer> signatures = new HashMap<>();
            int[] next = new int[n];
            for (int i = 0; i < n; i++) {
                List<Integer> signature = new ArrayList<>(k + 1);
                signature.add(block[i]);
                for (int s = 0; s < k; s++) {
                    signature.add(block[delta[i][s]]);
                }
                Integer id = signatures.get(signature);
                if (id == null) {
                    id = signatures.size();
                    signatures.put(signature, id);
                }
                next[i] = id;
            }
            block = next;
            logger.debug("第 {} 轮求精: {} -> {} 个块", pass, blockCount, signatures.size());
            if (signatures.size() == blockCount) {
                break;
            }
            blockCount = signatures.size();
        }

        Automaton minimized = build(dfa, ids, delta, block, blockCount, baseName + "_min");
        logger.info("最小化 {}: {} 个状态 -> {} 个状态", baseName, n, minimized.stateCount());
        return minimized;
    }

    /**
     * 终止状态与非终止状态各成一块，块号按首次出现的顺序分配。
     * @return 块数。
     */
    private static int initialPartition(Automaton dfa, List<String> ids, int[] block) {
        int acceptingBlock = -1;
        int rejectingBlock = -1;
        int count = 0;
        for (int i = 0; i < ids.size(); i++) {
            if (dfa.isAccepting(ids.get(i))) {
                if (acceptingBlock < 0) {
                    acceptingBlock = count++;
                }
                block[i] = acceptingBlock;
            } else {
                if (rejectingBlock < 0) {
                    rejectingBlock = count++;
                }
                block[i] = rejectingBlock;
            }
        }
        return count;
    }

    private static Automaton build(Automaton dfa, List<String> ids, int[][] delta, int[] block,
                                   int blockCount, String name) {
        Alphabet alphabet = dfa.getAlphabet();
        int[] representative = new int[blockCount];
        Arrays.fill(representative, -1);
        for (int i = 0; i < ids.size(); i++) {
            if (representative[block[i]] < 0) {
                representative[block[i]] = i;
            }
        }

        int initialBlock = block[ids.indexOf(dfa.getInitialState().getId())];
        // 广度优先给块编号，得到规范的状态名
        int[] canonical = new int[blockCount];
        Arrays.fill(canonical, -1);
        List<Integer> order = new ArrayList<>();
        Deque<Integer> worklist = new ArrayDeque<>();
        canonical[initialBlock] = 0;
        order.add(initialBlock);
        worklist.add(initialBlock);
        while (!worklist.isEmpty()) {
            int current = worklist.poll();
            for (int s = 0; s < alphabet.size(); s++) {
                int target = block[delta[representative[current]][s]];
                if (canonical[target] < 0) {
                    canonical[target] = order.size();
                    order.add(target);
                    worklist.add(target);
                }
            }
        }

        Automaton minimized = new Automaton(name, alphabet);
        for (int b : order) {
            minimized.addState(stateName(canonical[b]), b == initialBlock, dfa.isAccepting(ids.get(representative[b])));
        }
        for (int b : order) {
            for (int s = 0; s < alphabet.size(); s++) {
                int target = block[delta[representative[b]][s]];
                Symbol symbol = alphabet.get(s);
                minimized.addTransition(stateName(canonical[b]), symbol, stateName(canonical[target]));
            }
        }
        return minimized;
    }

    private static String stateName(int index) {
        return "q" + index;
    }
}
