package org.automatakit.automata.analysis;

import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

/**
 * 一次性质分析的结果，供显示使用。此类是不可变的。
 */
@Getter
@Builder
@ToString
public final class AutomatonProperties {

    private final String automatonName;
    private final AutomatonType type;
    private final boolean deterministic;
    private final boolean complete;
    private final boolean minimal;
    private final boolean emptyLanguage;
    private final boolean epsilonTransitions;
    private final boolean unreachableStates;
    private final int stateCount;
    private final int transitionCount;
    private final int initialStateCount;
    private final int acceptingStateCount;
    private final int reachableStateCount;
}
