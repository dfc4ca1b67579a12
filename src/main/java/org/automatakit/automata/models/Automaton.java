package org.automatakit.automata.models;

import lombok.Getter;
import org.automatakit.automata.base.Alphabet;
import org.automatakit.automata.base.State;
import org.automatakit.automata.base.Symbol;
import org.automatakit.automata.base.Transition;
import org.automatakit.automata.exceptions.DuplicateStateException;
import org.automatakit.automata.exceptions.EmptyAutomatonException;
import org.automatakit.automata.exceptions.InvalidReferenceException;
import org.automatakit.automata.exceptions.Precondition;
import org.automatakit.automata.exceptions.PreconditionException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;
import java.util.stream.Collectors;

/**
 * 代表一个有限自动机（DFA、NFA 或 ε-NFA 统一用同一种结构表示）。
 * Automaton 独占其包含的状态和迁移，只能通过显式的增删操作修改。
 * 每次结构修改都会同步维护出边索引，因此任何时刻都不存在悬空的迁移。
 * 确定性、完全性等派生性质不在此存储，由
 * {@link org.automatakit.automata.analysis.PropertyAnalyzer} 按需计算。
 * 此类不是线程安全的。
 */
public final class Automaton {

    private static final Logger logger = LoggerFactory.getLogger(Automaton.class);

    @Getter
    private String name;
    @Getter
    private Alphabet alphabet;
    private final Map<String, State> states = new LinkedHashMap<>();
    private final Set<Transition> transitions = new LinkedHashSet<>();
    // 出边索引：源状态 -> 符号 -> 目标状态集合
    private final Map<String, Map<Symbol, Set<String>>> outgoing = new HashMap<>();

    /**
     * 构造一个空自动机。
     * @param name 自动机的名称。
     * @param alphabet 字母表。
     */
    public Automaton(String name, Alphabet alphabet) {
        this.name = Objects.requireNonNull(name, "Automaton name cannot be null.");
        this.alphabet = Objects.requireNonNull(alphabet, "Alphabet cannot be null.");
    }

    public Automaton(String name) {
        this(name, Alphabet.EMPTY);
    }

    public void setName(String name) {
        this.name = Objects.requireNonNull(name, "Automaton name cannot be null.");
    }

    // ------------------------------------------------------------------
    // 结构修改
    // ------------------------------------------------------------------

    public State addState(String id) {
        return addState(State.of(id));
    }

    public State addState(String id, boolean initial, boolean accepting) {
        return addState(State.of(id, initial, accepting));
    }

    /**
     * 加入一个状态。
     * @param state 要加入的状态。
     * @return 加入的状态。
     * @throws DuplicateStateException 如果已存在同一标识的状态。
     */
    public State addState(State state) {
        Objects.requireNonNull(state, "State cannot be null.");
        if (states.containsKey(state.getId())) {
            logger.error("{}: 状态 {} 已存在", name, state.getId());
            throw new DuplicateStateException(state.getId());
        }
        states.put(state.getId(), state);
        logger.debug("{}: 加入状态 {}", name, state);
        return state;
    }

    /**
     * 删除一个状态，并级联删除所有引用它的迁移。
     * @param id 状态标识。
     * @throws InvalidReferenceException 如果状态不存在。
     */
    public void removeState(String id) {
        requireState(id);
        states.remove(id);
        List<Transition> dangling = transitions.stream()
                .filter(t -> t.touches(id))
                .collect(Collectors.toList());
        dangling.forEach(this::unindex);
        transitions.removeAll(dangling);
        outgoing.remove(id);
        logger.debug("{}: 删除状态 {}，级联删除了 {} 条迁移", name, id, dangling.size());
    }

    public void setInitial(String id, boolean initial) {
        State state = requireState(id);
        states.put(id, state.withInitial(initial));
    }

    public void setAccepting(String id, boolean accepting) {
        State state = requireState(id);
        states.put(id, state.withAccepting(accepting));
    }

    /**
     * 加入一条迁移。
     * @param from 源状态标识。
     * @param symbol 符号，可以是 epsilon。
     * @param to 目标状态标识。
     * @return 如果迁移是新加入的返回 true，已存在则返回 false。
     * @throws InvalidReferenceException 如果端点不存在，或符号既不在字母表中也不是 epsilon。
     */
    public boolean addTransition(String from, Symbol symbol, String to) {
        Objects.requireNonNull(symbol, "Symbol cannot be null.");
        requireState(from);
        requireState(to);
        if (!symbol.isEpsilon() && !alphabet.contains(symbol)) {
            logger.error("{}: 符号 {} 不在字母表 {} 中", name, symbol, alphabet);
            throw new InvalidReferenceException("符号 '" + symbol + "' 不在自动机 '" + name + "' 的字母表中");
        }
        Transition transition = new Transition(from, symbol, to);
        if (!transitions.add(transition)) {
            return false;
        }
        outgoing.computeIfAbsent(from, k -> new TreeMap<>())
                .computeIfAbsent(symbol, k -> new LinkedHashSet<>())
                .add(to);
        logger.debug("{}: 加入迁移 {}", name, transition);
        return true;
    }

    public boolean addTransition(String from, String symbol, String to) {
        return addTransition(from, Symbol.of(symbol), to);
    }

    public boolean removeTransition(String from, Symbol symbol, String to) {
        return removeTransition(new Transition(from, symbol, to));
    }

    /**
     * @return 如果迁移存在并已删除返回 true。
     */
    public boolean removeTransition(Transition transition) {
        if (!transitions.remove(transition)) {
            return false;
        }
        unindex(transition);
        logger.debug("{}: 删除迁移 {}", name, transition);
        return true;
    }

    public void addSymbol(Symbol symbol) {
        if (symbol.isEpsilon()) {
            throw new IllegalArgumentException("epsilon 不能加入字母表");
        }
        alphabet = alphabet.with(symbol);
    }

    /**
     * 从字母表中移除一个符号，并级联删除所有以它为标签的迁移。
     */
    public void removeSymbol(Symbol symbol) {
        if (!alphabet.contains(symbol)) {
            throw new InvalidReferenceException("符号 '" + symbol + "' 不在自动机 '" + name + "' 的字母表中");
        }
        List<Transition> labelled = transitions.stream()
                .filter(t -> t.getSymbol().equals(symbol))
                .collect(Collectors.toList());
        labelled.forEach(this::removeTransition);
        alphabet = alphabet.without(symbol);
    }

    private void unindex(Transition transition) {
        Map<Symbol, Set<String>> bySymbol = outgoing.get(transition.getSource());
        if (bySymbol == null) {
            return;
        }
        Set<String> targets = bySymbol.get(transition.getSymbol());
        if (targets != null) {
            targets.remove(transition.getTarget());
            if (targets.isEmpty()) {
                bySymbol.remove(transition.getSymbol());
            }
        }
        if (bySymbol.isEmpty()) {
            outgoing.remove(transition.getSource());
        }
    }

    private State requireState(String id) {
        State state = states.get(Objects.requireNonNull(id, "State id cannot be null."));
        if (state == null) {
            logger.error("{}: 引用了不存在的状态 {}", name, id);
            throw new InvalidReferenceException("状态 '" + id + "' 不存在于自动机 '" + name + "' 中");
        }
        return state;
    }

    // ------------------------------------------------------------------
    // 结构查询
    // ------------------------------------------------------------------

    public Optional<State> getState(String id) {
        return Optional.ofNullable(states.get(id));
    }

    public boolean containsState(String id) {
        return states.containsKey(id);
    }

    /**
     * @return 按加入顺序排列的状态的不可修改视图。
     */
    public Collection<State> getStates() {
        return Collections.unmodifiableCollection(states.values());
    }

    public Set<String> getStateIds() {
        return Collections.unmodifiableSet(states.keySet());
    }

    public List<State> getInitialStates() {
        return states.values().stream().filter(State::isInitial).collect(Collectors.toList());
    }

    public Set<String> getInitialStateIds() {
        return states.values().stream()
                .filter(State::isInitial)
                .map(State::getId)
                .collect(Collectors.toCollection(TreeSet::new));
    }

    /**
     * 获取唯一的初始状态。
     * @throws EmptyAutomatonException 如果没有初始状态。
     * @throws PreconditionException 如果有多于一个初始状态。
     */
    public State getInitialState() {
        List<State> initials = getInitialStates();
        if (initials.isEmpty()) {
            throw new EmptyAutomatonException(name);
        }
        if (initials.size() > 1) {
            throw new PreconditionException(Precondition.NOT_DETERMINISTIC, "getInitialState");
        }
        return initials.get(0);
    }

    public List<State> getAcceptingStates() {
        return states.values().stream().filter(State::isAccepting).collect(Collectors.toList());
    }

    public boolean isAccepting(String id) {
        State state = states.get(id);
        return state != null && state.isAccepting();
    }

    public Set<Transition> getTransitions() {
        return Collections.unmodifiableSet(transitions);
    }

    public List<Transition> getTransitionsFrom(String id) {
        return transitions.stream()
                .filter(t -> t.getSource().equals(id))
                .collect(Collectors.toList());
    }

    public List<Transition> getTransitionsFrom(String id, Symbol symbol) {
        return successors(id, symbol).stream()
                .map(target -> new Transition(id, symbol, target))
                .collect(Collectors.toList());
    }

    /**
     * 一步后继：从状态 id 经符号 symbol 可以直接到达的状态，不做 epsilon 闭包。
     */
    public Set<String> successors(String id, Symbol symbol) {
        Map<Symbol, Set<String>> bySymbol = outgoing.get(id);
        if (bySymbol == null) {
            return Collections.emptySet();
        }
        Set<String> targets = bySymbol.get(symbol);
        return targets == null ? Collections.emptySet() : Collections.unmodifiableSet(targets);
    }

    /**
     * @return 状态 id 有出边的符号（包括 epsilon）。
     */
    public Set<Symbol> outgoingSymbols(String id) {
        Map<Symbol, Set<String>> bySymbol = outgoing.get(id);
        return bySymbol == null ? Collections.emptySet() : Collections.unmodifiableSet(bySymbol.keySet());
    }

    public boolean hasEpsilonTransitions() {
        return transitions.stream().anyMatch(Transition::isEpsilon);
    }

    public int stateCount() {
        return states.size();
    }

    public int transitionCount() {
        return transitions.size();
    }

    // ------------------------------------------------------------------
    // 状态集合上的步进
    // ------------------------------------------------------------------

    /**
     * 计算一组状态的 epsilon 闭包。
     * @param ids 起始状态集合。
     * @return 从这些状态只经 epsilon 迁移可以到达的全部状态（含自身），有序。
     */
    public SortedSet<String> epsilonClosure(Collection<String> ids) {
        SortedSet<String> closure = new TreeSet<>(ids);
        Deque<String> worklist = new ArrayDeque<>(ids);
        while (!worklist.isEmpty()) {
            String current = worklist.poll();
            for (String next : successors(current, Symbol.EPSILON)) {
                if (closure.add(next)) {
                    worklist.add(next);
                }
            }
        }
        return closure;
    }

    /**
     * 初始状态集合的 epsilon 闭包；没有初始状态时为空集。
     */
    public SortedSet<String> initialClosure() {
        return epsilonClosure(getInitialStateIds());
    }

    /**
     * 读入一个符号：对活动集合中每个状态取一步后继，再做 epsilon 闭包。
     * @param active 当前活动状态集合。
     * @param symbol 非 epsilon 符号。
     * @return 下一活动状态集合，可能为空。
     */
    public SortedSet<String> step(Collection<String> active, Symbol symbol) {
        Set<String> next = new HashSet<>();
        for (String id : active) {
            next.addAll(successors(id, symbol));
        }
        return epsilonClosure(next);
    }

    public boolean containsAccepting(Collection<String> ids) {
        return ids.stream().anyMatch(this::isAccepting);
    }

    // ------------------------------------------------------------------
    // 图遍历
    // ------------------------------------------------------------------

    /**
     * 从初始状态出发（含 epsilon 边）可达的状态集合。
     */
    public Set<String> reachableStates() {
        Set<String> visited = new LinkedHashSet<>();
        Deque<String> worklist = new ArrayDeque<>();
        for (State state : states.values()) {
            if (state.isInitial() && visited.add(state.getId())) {
                worklist.add(state.getId());
            }
        }
        while (!worklist.isEmpty()) {
            String current = worklist.poll();
            Map<Symbol, Set<String>> bySymbol = outgoing.getOrDefault(current, Collections.emptyMap());
            for (Set<String> targets : bySymbol.values()) {
                for (String target : targets) {
                    if (visited.add(target)) {
                        worklist.add(target);
                    }
                }
            }
        }
        return visited;
    }

    /**
     * 存在到某个终止状态的路径的状态集合（终止状态本身包含在内）。
     */
    public Set<String> coReachableStates() {
        Map<String, List<String>> incoming = new HashMap<>();
        for (Transition t : transitions) {
            incoming.computeIfAbsent(t.getTarget(), k -> new ArrayList<>()).add(t.getSource());
        }
        Set<String> visited = new LinkedHashSet<>();
        Deque<String> worklist = new ArrayDeque<>();
        for (State state : states.values()) {
            if (state.isAccepting() && visited.add(state.getId())) {
                worklist.add(state.getId());
            }
        }
        while (!worklist.isEmpty()) {
            String current = worklist.poll();
            for (String source : incoming.getOrDefault(current, Collections.emptyList())) {
                if (visited.add(source)) {
                    worklist.add(source);
                }
            }
        }
        return visited;
    }

    // ------------------------------------------------------------------
    // 复制与快照
    // ------------------------------------------------------------------

    public Automaton copy() {
        return copy(name);
    }

    /**
     * 深拷贝，新自动机拥有自己的状态与迁移，不与本自动机共享任何可变结构。
     */
    public Automaton copy(String newName) {
        Automaton copy = new Automaton(newName, alphabet);
        for (State state : states.values()) {
            copy.addState(State.of(state.getId(), state.isInitial(), state.isAccepting()));
        }
        for (Transition t : transitions) {
            copy.addTransition(t.getSource(), t.getSymbol(), t.getTarget());
        }
        return copy;
    }

    /**
     * 返回删除了不可达状态（及其迁移）的新自动机，本自动机不变。
     */
    public Automaton withoutUnreachableStates() {
        Set<String> reachable = reachableStates();
        Automaton trimmed = new Automaton(name, alphabet);
        for (State state : states.values()) {
            if (reachable.contains(state.getId())) {
                trimmed.addState(State.of(state.getId(), state.isInitial(), state.isAccepting()));
            }
        }
        for (Transition t : transitions) {
            if (reachable.contains(t.getSource())) {
                trimmed.addTransition(t.getSource(), t.getSymbol(), t.getTarget());
            }
        }
        logger.debug("{}: 删除了 {} 个不可达状态", name, states.size() - trimmed.stateCount());
        return trimmed;
    }

    /**
     * 返回使用指定字母表（必须包含当前字母表）的副本。
     */
    public Automaton withAlphabet(Alphabet extended) {
        for (Symbol symbol : alphabet.getSymbols()) {
            if (!extended.contains(symbol)) {
                throw new IllegalArgumentException("新字母表 " + extended + " 缺少符号 " + symbol);
            }
        }
        Automaton copy = copy();
        copy.alphabet = extended;
        return copy;
    }

    public AutomatonSnapshot toSnapshot() {
        return AutomatonSnapshot.of(this);
    }

    /**
     * 由结构化快照重建自动机。
     * @throws InvalidReferenceException 快照中的迁移引用了不存在的状态或符号。
     * @throws DuplicateStateException 快照中的状态标识重复。
     */
    public static Automaton fromSnapshot(AutomatonSnapshot snapshot) {
        return snapshot.toAutomaton();
    }

    @Override
    public String toString() {
        return "Automaton(name='" + name + "', states=" + states.size() +
                ", transitions=" + transitions.size() + ", " + alphabet + ")";
    }
}
