package org.automatakit;

import lombok.Getter;
import org.automatakit.automata.algorithms.Completer;
import org.automatakit.automata.algorithms.Determinizer;
import org.automatakit.automata.algorithms.LanguageAlgebra;
import org.automatakit.automata.algorithms.Minimizer;
import org.automatakit.automata.analysis.AutomatonProperties;
import org.automatakit.automata.analysis.PropertyAnalyzer;
import org.automatakit.automata.base.Word;
import org.automatakit.automata.models.Automaton;
import org.automatakit.automata.simulation.SimulationTrace;
import org.automatakit.automata.simulation.Simulator;
import org.automatakit.automata.simulation.WordEnumerator;
import org.automatakit.core.Cancellation;
import org.automatakit.core.EngineLimits;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Optional;

/**
 * 引擎门面：用同一份资源上限与取消标记装配全部算法组件。
 * 外部的界面与持久化协作方只需要依赖这个类。
 */
@Getter
public final class AutomatonEngine {

    private static final Logger logger = LoggerFactory.getLogger(AutomatonEngine.class);

    private final EngineLimits limits;
    private final Cancellation cancellation;
    private final PropertyAnalyzer analyzer;
    private final Determinizer determinizer;
    private final Completer completer;
    private final Minimizer minimizer;
    private final LanguageAlgebra algebra;
    private final Simulator simulator;
    private final WordEnumerator enumerator;

    public AutomatonEngine() {
        this(EngineLimits.load(), new Cancellation());
    }

    public AutomatonEngine(EngineLimits limits, Cancellation cancellation) {
        this.limits = limits;
        this.cancellation = cancellation;
        this.analyzer = new PropertyAnalyzer(limits, cancellation);
        this.determinizer = new Determinizer(limits, cancellation);
        this.completer = new Completer(analyzer);
        this.minimizer = new Minimizer(limits, cancellation);
        this.algebra = new LanguageAlgebra(limits, cancellation);
        this.simulator = new Simulator();
        this.enumerator = new WordEnumerator(limits, cancellation);
        logger.info("创建 AutomatonEngine: {}", limits);
    }

    public AutomatonProperties analyze(Automaton automaton) {
        return analyzer.analyze(automaton);
    }

    public Automaton determinize(Automaton automaton) {
        return determinizer.determinize(automaton);
    }

    public Automaton complete(Automaton automaton) {
        return completer.complete(automaton);
    }

    /**
     * 确定化（必要时）、补全、删除不可达状态并最小化，得到规范形式。
     */
    public Automaton minimize(Automaton automaton) {
        return minimizer.minimize(automaton);
    }

    public Automaton union(Automaton a, Automaton b) {
        return algebra.union(a, b);
    }

    public Automaton intersection(Automaton a, Automaton b) {
        return algebra.intersection(a, b);
    }

    public Automaton difference(Automaton a, Automaton b) {
        return algebra.difference(a, b);
    }

    public Automaton complement(Automaton automaton) {
        return algebra.complement(automaton);
    }

    public boolean areEquivalent(Automaton a, Automaton b) {
        return algebra.areEquivalent(a, b);
    }

    public Optional<Word> distinguishingWord(Automaton a, Automaton b) {
        return algebra.distinguishingWord(a, b);
    }

    public SimulationTrace simulate(Automaton automaton, Word word) {
        return simulator.simulate(automaton, word);
    }

    public boolean accepts(Automaton automaton, String word) {
        return simulator.accepts(automaton, word);
    }

    public List<Word> enumerate(Automaton automaton, int maxLength) {
        return enumerator.enumerate(automaton, maxLength);
    }
}
