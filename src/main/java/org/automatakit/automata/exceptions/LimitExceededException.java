package org.automatakit.automata.exceptions;

import lombok.Getter;

/**
 * 操作超出了 {@link org.automatakit.core.EngineLimits} 中配置的资源上限。
 */
@Getter
public class LimitExceededException extends AutomatonException {

    private final String limitName;
    private final long limit;

    public LimitExceededException(String limitName, long limit) {
        super(ErrorKind.LIMIT_EXCEEDED, "超出资源上限 " + limitName + " = " + limit);
        this.limitName = limitName;
        this.limit = limit;
    }
}
