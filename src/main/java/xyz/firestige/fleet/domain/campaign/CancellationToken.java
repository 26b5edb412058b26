package xyz.firestige.fleet.domain.campaign;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * 协作式取消令牌
 * <p>
 * 在每个挂起点（每次模拟网络等待前后）检查；正在进行的调用不会被打断，只在下一个检查点生效。
 */
public final class CancellationToken {

    private final AtomicBoolean cancelled = new AtomicBoolean(false);

    /**
     * @return 是否是首次取消
     */
    public boolean cancel() {
        return cancelled.compareAndSet(false, true);
    }

    public boolean isCancellationRequested() {
        return cancelled.get();
    }
}
