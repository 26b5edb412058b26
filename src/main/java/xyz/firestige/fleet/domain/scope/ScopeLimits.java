package xyz.firestige.fleet.domain.scope;

/**
 * 设备数量上限
 */
public final class ScopeLimits {

    /**
     * 硬上限，不受操作员输入影响
     */
    public static final int HARD_MAX_DEVICES = 200;

    public static final int DEFAULT_MAX_DEVICES = 50;

    private ScopeLimits() {
    }

    /**
     * 将操作员设置的上限钳制到 [1, HARD_MAX_DEVICES]
     */
    public static int clamp(int requestedMax) {
        return Math.max(1, Math.min(HARD_MAX_DEVICES, requestedMax));
    }
}
