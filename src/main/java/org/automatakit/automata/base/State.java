package org.automatakit.automata.base;

import lombok.Getter;

import java.util.Objects;

/**
 * 代表有限自动机中的一个状态。
 * State 是不可变对象：标识在其所属自动机内唯一，初始/终止标记的修改会产生新的实例。
 */
@Getter
public final class State implements Comparable<State> {

    private final String id;
    private final boolean initial;
    private final boolean accepting;

    private final int hashCode;

    private State(String id, boolean initial, boolean accepting) {
        this.id = Objects.requireNonNull(id, "State id cannot be null");
        this.initial = initial;
        this.accepting = accepting;
        this.hashCode = Objects.hash(id, initial, accepting);
    }

    /**
     * 创建一个既非初始也非终止的状态。
     * @param id 状态标识。
     * @return 新的 State 实例。
     */
    public static State of(String id) {
        return new State(id, false, false);
    }

    /**
     * 创建一个状态，并指定初始与终止标记。
     * @param id 状态标识。
     * @param initial 是否为初始状态。
     * @param accepting 是否为终止（接受）状态。
     * @return 新的 State 实例。
     */
    public static State of(String id, boolean initial, boolean accepting) {
        return new State(id, initial, accepting);
    }

    public State withInitial(boolean initial) {
        return new State(id, initial, accepting);
    }

    public State withAccepting(boolean accepting) {
        return new State(id, initial, accepting);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        State state = (State) o;
        return id.equals(state.id) && initial == state.initial && accepting == state.accepting;
    }

    @Override
    public int hashCode() {
        return hashCode;
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        if (initial) {
            sb.append("->");
        }
        sb.append(id);
        if (accepting) {
            sb.append("*");
        }
        return sb.toString();
    }

    @Override
    public int compareTo(State other) {
        return this.id.compareTo(other.id);
    }
}
