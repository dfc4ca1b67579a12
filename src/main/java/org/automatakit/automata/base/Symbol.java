package org.automatakit.automata.base;

import lombok.Getter;

import java.util.Objects;

/**
 * 代表自动机的一个输入符号（原子记号，通常是单个字符）。
 * Symbol 是不可变对象。空标签保留给 epsilon 迁移。
 */
@Getter
public final class Symbol implements Comparable<Symbol> {

    /**
     * 序列化与显示时使用的 epsilon 记号。
     */
    public static final String EPSILON_LABEL = "ε";

    // 空字符串表示 epsilon 符号
    public static final Symbol EPSILON = new Symbol("");

    private final String label;
    private final boolean isEpsilon;

    private final int hashCode;

    private Symbol(String label) {
        this.label = Objects.requireNonNull(label, "Symbol label cannot be null");
        this.isEpsilon = label.isEmpty();
        this.hashCode = Objects.hash(label);
    }

    /**
     * 工厂方法：创建一个符号。
     * null、空字符串以及 "ε" 均返回 {@link #EPSILON}。
     * @param label 符号标签。
     * @return 对应的 Symbol 实例。
     */
    public static Symbol of(String label) {
        if (label == null || label.isEmpty() || EPSILON_LABEL.equals(label)) {
            return EPSILON;
        }
        return new Symbol(label);
    }

    /**
     * 将输入文本中的单个字符原样作为符号，不做 epsilon 别名转换。
     * 字符 "ε" 因此成为一个普通符号，它不可能属于任何字母表。
     */
    static Symbol ofCharacter(String character) {
        if (character.isEmpty()) {
            throw new IllegalArgumentException("Character cannot be empty");
        }
        return new Symbol(character);
    }

    /**
     * 检查此符号是否为 epsilon。
     * @return 如果是 epsilon 则返回 true。
     */
    public boolean isEpsilon() {
        return isEpsilon;
    }

    @Override
    public String toString() {
        return isEpsilon ? EPSILON_LABEL : label;
    }

    @Override
    public int compareTo(Symbol other) {
        // epsilon 排在最前面
        if (this.isEpsilon() && !other.isEpsilon()) {
            return -1;
        }
        if (!this.isEpsilon() && other.isEpsilon()) {
            return 1;
        }
        return this.label.compareTo(other.label);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        Symbol symbol = (Symbol) o;
        return label.equals(symbol.label);
    }

    @Override
    public int hashCode() {
        return hashCode;
    }
}
