package org.automatakit.automata.exceptions;

import lombok.Getter;

@Getter
public class DuplicateStateException extends AutomatonException {

    private final String stateId;

    public DuplicateStateException(String stateId) {
        super(ErrorKind.DUPLICATE_STATE, "状态 '" + stateId + "' 已存在");
        this.stateId = stateId;
    }
}
