package org.automatakit.automata.exceptions;

/**
 * 操作需要至少一个初始状态，但自动机中不存在初始状态。
 */
public class EmptyAutomatonException extends AutomatonException {

    public EmptyAutomatonException(String automatonName) {
        super(ErrorKind.EMPTY_AUTOMATON, "自动机 '" + automatonName + "' 没有初始状态");
    }
}
