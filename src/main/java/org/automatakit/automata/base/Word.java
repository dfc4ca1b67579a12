package org.automatakit.automata.base;

import lombok.Getter;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * 代表一个输入词，即非 epsilon 符号的有限序列。
 * 此类是不可变的。
 */
public final class Word implements Iterable<Symbol> {

    public static final Word EMPTY = new Word(Collections.emptyList());

    @Getter
    private final List<Symbol> symbols;
    private final int hashCode;

    private Word(List<Symbol> symbols) {
        for (Symbol symbol : symbols) {
            Objects.requireNonNull(symbol, "Word symbol cannot be null");
            if (symbol.isEpsilon()) {
                throw new IllegalArgumentException("词中不能包含 epsilon 符号");
            }
        }
        this.symbols = List.copyOf(symbols);
        this.hashCode = Objects.hash(this.symbols);
    }

    public static Word of(List<Symbol> symbols) {
        return symbols.isEmpty() ? EMPTY : new Word(symbols);
    }

    /**
     * 由一系列符号标签构造词，每个参数是一个符号。
     */
    public static Word of(String... labels) {
        List<Symbol> list = new ArrayList<>(labels.length);
        for (String label : labels) {
            list.add(Symbol.of(label));
        }
        return of(list);
    }

    /**
     * 将字符串的每个字符视为一个符号来构造词。
     * 字符 "ε" 不表示空串，而是一个不在任何字母表中的符号。
     */
    public static Word ofCharacters(String text) {
        Objects.requireNonNull(text, "Text cannot be null");
        List<Symbol> list = new ArrayList<>(text.length());
        text.codePoints().forEach(cp -> list.add(Symbol.ofCharacter(new String(Character.toChars(cp)))));
        return of(list);
    }

    public Word append(Symbol symbol) {
        List<Symbol> list = new ArrayList<>(symbols.size() + 1);
        list.addAll(symbols);
        list.add(symbol);
        return new Word(list);
    }

    public int length() {
        return symbols.size();
    }

    public boolean isEmpty() {
        return symbols.isEmpty();
    }

    public Symbol get(int index) {
        return symbols.get(index);
    }

    @Override
    public Iterator<Symbol> iterator() {
        return symbols.iterator();
    }

    /**
     * 用于显示的形式，空词显示为 "ε"。
     */
    public String toDisplayString() {
        return isEmpty() ? Symbol.EPSILON_LABEL : toString();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        return symbols.equals(((Word) o).symbols);
    }

    @Override
    public int hashCode() {
        return hashCode;
    }

    /**
     * 符号标签直接拼接，空词返回空字符串。
     */
    @Override
    public String toString() {
        return symbols.stream().map(Symbol::getLabel).collect(Collectors.joining());
    }
}
