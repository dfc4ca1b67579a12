package org.automatakit.core;

import org.automatakit.automata.exceptions.OperationCancelledException;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * 协作式取消标记。
 * 算法在处理完工作队列中的每一项之后检查它，调用方可以从其他线程调用 {@link #cancel()}。
 */
public class Cancellation {

    /**
     * 永远不会被取消的共享实例。
     */
    public static final Cancellation NONE = new Cancellation() {
        @Override
        public void cancel() {
            throw new UnsupportedOperationException("Cancellation.NONE 不能被取消");
        }
    };

    private final AtomicBoolean cancelled = new AtomicBoolean(false);

    public void cancel() {
        cancelled.set(true);
    }

    public boolean isCancelled() {
        return cancelled.get();
    }

    /**
     * 如果已取消，抛出 {@link OperationCancelledException}。
     * @param operation 当前操作的名称，用于错误信息。
     */
    public void checkpoint(String operation) {
        if (cancelled.get()) {
            throw new OperationCancelledException(operation);
        }
    }
}
