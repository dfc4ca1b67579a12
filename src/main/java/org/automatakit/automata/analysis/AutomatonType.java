package org.automatakit.automata.analysis;

/**
 * 自动机的类别。三者共用同一数据结构，类别由结构性质决定。
 */
public enum AutomatonType {
    DFA("确定有限自动机"),
    NFA("非确定有限自动机"),
    EPSILON_NFA("带 ε 迁移的非确定有限自动机");

    private final String description;

    AutomatonType(String description) {
        this.description = description;
    }

    public String getDescription() {
        return description;
    }
}
