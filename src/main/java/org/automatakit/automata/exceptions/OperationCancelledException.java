package org.automatakit.automata.exceptions;

public class OperationCancelledException extends AutomatonException {

    public OperationCancelledException(String operation) {
        super(ErrorKind.CANCELLED, operation + " 已被取消");
    }
}
