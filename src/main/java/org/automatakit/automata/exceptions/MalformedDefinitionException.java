package org.automatakit.automata.exceptions;

/**
 * 自动机的结构化定义无法解析，或者引用了不存在的状态/符号。
 */
public class MalformedDefinitionException extends AutomatonException {

    public MalformedDefinitionException(String message) {
        super(ErrorKind.MALFORMED_DEFINITION, message);
    }

    public MalformedDefinitionException(String message, Throwable cause) {
        super(ErrorKind.MALFORMED_DEFINITION, message, cause);
    }
}
