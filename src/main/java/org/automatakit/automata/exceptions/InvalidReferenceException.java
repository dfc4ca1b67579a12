package org.automatakit.automata.exceptions;

/**
 * 迁移或操作引用了自动机中不存在的状态标识或符号。
 */
public class InvalidReferenceException extends AutomatonException {

    public InvalidReferenceException(String message) {
        super(ErrorKind.INVALID_REFERENCE, message);
    }
}
