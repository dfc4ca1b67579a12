package org.automatakit.automata.base;

import lombok.Getter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.SortedSet;
import java.util.TreeSet;
import java.util.stream.Collectors;

/**
 * 代表一个有限自动机的字母表。
 * Alphabet 是不可变对象，一旦创建，其包含的符号集合就不会改变。
 * 字母表从不包含 epsilon；epsilon 是保留记号，由 {@link Symbol#EPSILON} 表示。
 * 符号按 {@link Symbol#compareTo} 排序，该顺序只用于确定性的遍历、显示和枚举。
 */
public final class Alphabet {

    private static final Logger logger = LoggerFactory.getLogger(Alphabet.class);

    public static final Alphabet EMPTY = new Alphabet(Collections.emptySet());

    @Getter
    private final SortedSet<Symbol> symbols;
    // 与 symbols 相同顺序的列表视图，用于按下标访问
    private final List<Symbol> ordered;
    private final int hashCode;

    private Alphabet(Collection<Symbol> symbols) {
        Objects.requireNonNull(symbols, "Symbols cannot be null");
        SortedSet<Symbol> temp = new TreeSet<>();
        for (Symbol symbol : symbols) {
            Objects.requireNonNull(symbol, "Symbol cannot be null");
            if (symbol.isEpsilon()) {
                logger.warn("Alphabet 构造时忽略了 epsilon 符号，epsilon 不属于字母表。");
                continue;
            }
            temp.add(symbol);
        }
        this.symbols = Collections.unmodifiableSortedSet(temp);
        this.ordered = List.copyOf(temp);
        this.hashCode = Objects.hash(this.symbols);
        logger.debug("创建 Alphabet，包含 {} 个符号。详情：{}", this.symbols.size(), this.symbols);
    }

    /**
     * 工厂方法：从一个符号集合创建 Alphabet 实例。重复的符号会被合并。
     * @param symbols 构成字母表的符号集合。
     * @return Alphabet 实例。
     */
    public static Alphabet of(Collection<Symbol> symbols) {
        return new Alphabet(symbols);
    }

    /**
     * 工厂方法：从一系列符号标签创建 Alphabet 实例。
     * @param labels 符号标签。
     * @return Alphabet 实例。
     */
    public static Alphabet of(String... labels) {
        List<Symbol> list = new ArrayList<>();
        for (String label : labels) {
            list.add(Symbol.of(label));
        }
        return new Alphabet(list);
    }

    public boolean contains(Symbol symbol) {
        return symbols.contains(symbol);
    }

    /**
     * 根据标签获取符号。
     * @param label 符号标签。
     * @return 对应的 Symbol，如果字母表中不存在则返回 null。
     */
    public Symbol getSymbolByLabel(String label) {
        Symbol candidate = Symbol.of(label);
        return symbols.contains(candidate) ? candidate : null;
    }

    /**
     * 返回符号在字母表顺序中的下标，不存在时返回 -1。
     */
    public int indexOf(Symbol symbol) {
        int index = Collections.binarySearch(ordered, symbol);
        return index >= 0 ? index : -1;
    }

    /**
     * 按字母表顺序返回第 index 个符号。
     */
    public Symbol get(int index) {
        return ordered.get(index);
    }

    public List<Symbol> asList() {
        return ordered;
    }

    public int size() {
        return symbols.size();
    }

    public boolean isEmpty() {
        return symbols.isEmpty();
    }

    /**
     * 返回加入了指定符号的新字母表。
     */
    public Alphabet with(Symbol symbol) {
        List<Symbol> list = new ArrayList<>(symbols);
        list.add(symbol);
        return new Alphabet(list);
    }

    /**
     * 返回移除了指定符号的新字母表。
     */
    public Alphabet without(Symbol symbol) {
        List<Symbol> list = new ArrayList<>(symbols);
        list.remove(symbol);
        return new Alphabet(list);
    }

    /**
     * 两个字母表的并集。
     */
    public Alphabet union(Alphabet other) {
        if (this.equals(other)) {
            return this;
        }
        List<Symbol> list = new ArrayList<>(symbols);
        list.addAll(other.symbols);
        return new Alphabet(list);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        Alphabet alphabet = (Alphabet) o;
        return symbols.equals(alphabet.symbols);
    }

    @Override
    public int hashCode() {
        return hashCode;
    }

    @Override
    public String toString() {
        return "Alphabet{" +
                symbols.stream()
                        .map(Symbol::toString)
                        .collect(Collectors.joining(", ")) +
                '}';
    }
}
