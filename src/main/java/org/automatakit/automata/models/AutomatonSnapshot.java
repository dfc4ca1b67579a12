package org.automatakit.automata.models;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.automatakit.automata.base.Alphabet;
import org.automatakit.automata.base.State;
import org.automatakit.automata.base.Symbol;
import org.automatakit.automata.base.Transition;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * 自动机的结构化快照，供外部的持久化与可视化协作方序列化使用。
 * JSON 形式：
 * <pre>
 * { "name": ..., "alphabet": [...],
 *   "states": [{"id", "initial", "final"}...],
 *   "transitions": [{"from", "symbol", "to"}...] }
 * </pre>
 * epsilon 迁移的符号写作 "ε"。
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonPropertyOrder({"name", "alphabet", "states", "transitions"})
public final class AutomatonSnapshot {

    private String name;
    private List<String> alphabet = new ArrayList<>();
    private List<StateEntry> states = new ArrayList<>();
    private List<TransitionEntry> transitions = new ArrayList<>();

    /** 单个状态的快照。 */
    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    @JsonPropertyOrder({"id", "initial", "final"})
    public static final class StateEntry {
        private String id;
        private boolean initial;
        @JsonProperty("final")
        private boolean accepting;
    }

    /** 单条迁移的快照。 */
    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    @JsonPropertyOrder({"from", "symbol", "to"})
    public static final class TransitionEntry {
        private String from;
        private String symbol;
        private String to;
    }

    static AutomatonSnapshot of(Automaton automaton) {
        AutomatonSnapshot snapshot = new AutomatonSnapshot();
        snapshot.setName(automaton.getName());
        for (Symbol symbol : automaton.getAlphabet().getSymbols()) {
            snapshot.alphabet.add(symbol.getLabel());
        }
        for (State state : automaton.getStates()) {
            snapshot.states.add(new StateEntry(state.getId(), state.isInitial(), state.isAccepting()));
        }
        for (Transition t : automaton.getTransitions()) {
            snapshot.transitions.add(new TransitionEntry(t.getSource(), t.getSymbol().toString(), t.getTarget()));
        }
        return snapshot;
    }

    Automaton toAutomaton() {
        List<Symbol> symbols = new ArrayList<>();
        if (alphabet != null) {
            for (String label : alphabet) {
                symbols.add(Symbol.of(label));
            }
        }
        Automaton automaton = new Automaton(Objects.requireNonNullElse(name, "unnamed"), Alphabet.of(symbols));
        if (states != null) {
            for (StateEntry entry : states) {
                automaton.addState(entry.getId(), entry.isInitial(), entry.isAccepting());
            }
        }
        if (transitions != null) {
            for (TransitionEntry entry : transitions) {
                automaton.addTransition(entry.getFrom(), Symbol.of(entry.getSymbol()), entry.getTo());
            }
        }
        return automaton;
    }
}
