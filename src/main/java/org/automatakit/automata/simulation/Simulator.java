package org.automatakit.automata.simulation;

import org.automatakit.automata.base.Symbol;
import org.automatakit.automata.base.Word;
import org.automatakit.automata.models.Automaton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.SortedSet;

/**
 * 在（可能非确定的）自动机上模拟输入词。
 * <p>
 * 维护活动状态集合：初始为初始状态的 epsilon 闭包；每读入一个符号，
 * 下一集合为所有活动状态一步后继之并的 epsilon 闭包。读完后活动集合含终止状态则接受。
 * 活动集合变空时提前拒绝，剩余符号不再处理。不在字母表中的符号使活动集合变空。
 * 没有初始状态的自动机接受空语言。
 */
public final class Simulator {

    private static final Logger logger = LoggerFactory.getLogger(Simulator.class);

    /**
     * 模拟并生成逐步轨迹。
     * @param automaton 任意自动机，不会被修改。
     * @param word 输入词。
     * @return 包含每个前缀（含空前缀）对应活动集合的轨迹。
     */
    public SimulationTrace simulate(Automaton automaton, Word word) {
        List<SimulationStep> steps = new ArrayList<>(word.length() + 1);
        SortedSet<String> active = automaton.initialClosure();
        steps.add(new SimulationStep(0, null, active, automaton.containsAccepting(active)));

        boolean rejectedEarly = false;
        for (int i = 0; i < word.length(); i++) {
            if (active.isEmpty()) {
                rejectedEarly = true;
                break;
            }
            Symbol symbol = word.get(i);
            active = automaton.step(active, symbol);
            steps.add(new SimulationStep(i + 1, symbol, active, automaton.containsAccepting(active)));
        }
        boolean accepted = automaton.containsAccepting(active);
        logger.debug("模拟 {} 于 \"{}\": {}", automaton.getName(), word.toDisplayString(), accepted ? "接受" : "拒绝");
        return new SimulationTrace(automaton.getName(), word, steps, accepted, rejectedEarly);
    }

    /**
     * 把字符串的每个字符当作一个符号进行模拟。
     */
    public SimulationTrace simulate(Automaton automaton, String word) {
        return simulate(automaton, Word.ofCharacters(word));
    }

    public boolean accepts(Automaton automaton, Word word) {
        SortedSet<String> active = automaton.initialClosure();
        for (Symbol symbol : word) {
            if (active.isEmpty()) {
                return false;
            }
            active = automaton.step(active, symbol);
        }
        return automaton.containsAccepting(active);
    }

    public boolean accepts(Automaton automaton, String word) {
        return accepts(automaton, Word.ofCharacters(word));
    }
}
