package org.automatakit.automata.simulation;

import lombok.AccessLevel;
import lombok.Getter;
import org.automatakit.automata.base.Symbol;

import java.util.Collections;
import java.util.Objects;
import java.util.Optional;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * 模拟轨迹中的一步：读入第 {@code index} 个前缀之后的活动状态集合。
 * 第 0 步对应空前缀，此时没有读入符号。此类是不可变的。
 */
@Getter
public final class SimulationStep {

    private final int index;
    @Getter(AccessLevel.NONE)
    private final Symbol consumed;
    private final SortedSet<String> activeStates;
    private final boolean accepting;

    SimulationStep(int index, Symbol consumed, SortedSet<String> activeStates, boolean accepting) {
        this.index = index;
        this.consumed = consumed;
        this.activeStates = Collections.unmodifiableSortedSet(new TreeSet<>(Objects.requireNonNull(activeStates)));
        this.accepting = accepting;
    }

    /**
     * @return 本步读入的符号，第 0 步为空。
     */
    public Optional<Symbol> getConsumedSymbol() {
        return Optional.ofNullable(consumed);
    }

    public boolean isDead() {
        return activeStates.isEmpty();
    }

    @Override
    public String toString() {
        return index + ": " + (consumed == null ? "-" : consumed.toString()) + " -> " + activeStates
                + (accepting ? " (accepting)" : "");
    }
}
