package org.automatakit.automata.base;

import lombok.Getter;

import java.util.Comparator;
import java.util.Objects;

/**
 * 代表一条带标签的迁移 (source, symbol, target)。
 * 端点以状态标识引用，符号可以是 {@link Symbol#EPSILON}。
 * 此类是不可变的。
 */
@Getter
public final class Transition implements Comparable<Transition> {

    private static final Comparator<Transition> ORDER = Comparator
            .comparing(Transition::getSource)
            .thenComparing(Transition::getSymbol)
            .thenComparing(Transition::getTarget);

    private final String source;
    private final Symbol symbol;
    private final String target;

    private final int hashCode;

    /**
     * @param source 源状态标识 (q)
     * @param symbol 触发迁移的符号 (a)
     * @param target 目标状态标识 (q')
     */
    public Transition(String source, Symbol symbol, String target) {
        this.source = Objects.requireNonNull(source, "Source state cannot be null.");
        this.symbol = Objects.requireNonNull(symbol, "Symbol cannot be null.");
        this.target = Objects.requireNonNull(target, "Target state cannot be null.");
        this.hashCode = Objects.hash(source, symbol, target);
    }

    public boolean isEpsilon() {
        return symbol.isEpsilon();
    }

    /**
     * 检查此迁移是否引用了指定状态（作为源或目标）。
     */
    public boolean touches(String stateId) {
        return source.equals(stateId) || target.equals(stateId);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        Transition that = (Transition) o;
        return source.equals(that.source) &&
                symbol.equals(that.symbol) &&
                target.equals(that.target);
    }

    @Override
    public int hashCode() {
        return hashCode;
    }

    @Override
    public int compareTo(Transition other) {
        return ORDER.compare(this, other);
    }

    @Override
    public String toString() {
        return String.format("%s --[%s]--> %s", source, symbol, target);
    }
}
