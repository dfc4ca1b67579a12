package org.automatakit.automata.exceptions;

import lombok.Getter;

/**
 * 操作要求输入满足确定性、完全性或无不可达状态，而输入不满足。
 */
@Getter
public class PreconditionException extends AutomatonException {

    private final Precondition precondition;

    public PreconditionException(Precondition precondition, String operation) {
        super(ErrorKind.PRECONDITION, operation + ": " + precondition.getDescription());
        this.precondition = precondition;
    }
}
