package org.automatakit.automata.exceptions;

/**
 * 算法可能要求的自动机前置条件。
 */
public enum Precondition {
    NOT_DETERMINISTIC("自动机不是确定的"),
    NOT_COMPLETE("自动机不是完全的"),
    HAS_UNREACHABLE_STATES("自动机包含不可达状态");

    private final String description;

    Precondition(String description) {
        this.description = description;
    }

    public String getDescription() {
        return description;
    }
}
