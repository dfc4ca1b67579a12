package org.automatakit.automata.simulation;

import lombok.Getter;
import org.automatakit.automata.base.Word;

import java.util.List;
import java.util.stream.Collectors;

/**
 * 一次词模拟的完整结果：是否接受，以及逐步的活动状态集合，供外部逐步动画展示。
 * 此类是不可变的。
 */
@Getter
public final class SimulationTrace {

    private final String automatonName;
    private final Word word;
    private final List<SimulationStep> steps;
    private final boolean accepted;
    // 活动集合变空后提前停止
    private final boolean rejectedEarly;

    SimulationTrace(String automatonName, Word word, List<SimulationStep> steps, boolean accepted, boolean rejectedEarly) {
        this.automatonName = automatonName;
        this.word = word;
        this.steps = List.copyOf(steps);
        this.accepted = accepted;
        this.rejectedEarly = rejectedEarly;
    }

    /**
     * @return 实际读入的符号个数。
     */
    public int getConsumedLength() {
        return steps.size() - 1;
    }

    /**
     * @return 提前拒绝时尚未读入的后缀。
     */
    public Word getUnconsumedSuffix() {
        return Word.of(word.getSymbols().subList(getConsumedLength(), word.length()));
    }

    public SimulationStep getFinalStep() {
        return steps.get(steps.size() - 1);
    }

    @Override
    public String toString() {
        return "SimulationTrace(" + automatonName + ", \"" + word.toDisplayString() + "\", accepted=" + accepted + ")\n"
                + steps.stream().map(s -> "  " + s).collect(Collectors.joining("\n"));
    }
}
