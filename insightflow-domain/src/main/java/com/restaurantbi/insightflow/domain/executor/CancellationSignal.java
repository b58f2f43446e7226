package com.restaurantbi.insightflow.domain.executor;

import java.util.concurrent.CancellationException;

/**
 * CancellationSignal - 协作式取消信号
 * <p>
 * 长耗时执行器应在循环或远程调用之间检查该信号。
 * </p>
 */
public class CancellationSignal {

    private volatile String reason;

    public void cancel(String reason) {
        this.reason = reason == null ? "cancelled" : reason;
    }

    public boolean isCancelled() {
        return reason != null;
    }

    public String getReason() {
        return reason;
    }

    public void throwIfCancelled() {
        String current = reason;
        if (current != null) {
            throw new CancellationException(current);
        }
    }
}
