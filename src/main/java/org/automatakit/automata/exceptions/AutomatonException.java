package org.automatakit.automata.exceptions;

import lombok.Getter;

/**
 * 所有引擎错误的基类。
 * 引擎只抛出非受检异常，调用方捕获此类型即可按 {@link #getKind()} 分类处理。
 */
@Getter
public abstract class AutomatonException extends RuntimeException {

    private final ErrorKind kind;

    protected AutomatonException(ErrorKind kind, String message) {
        super(message);
        this.kind = kind;
    }

    protected AutomatonException(ErrorKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }
}
