package xyz.firestige.fleet.domain.device;

/**
 * 设备状态枚举
 * <p>
 * 状态转换说明：
 * - PENDING → WAKING_UP → CONNECTING: 唤醒并建立连接
 * - CONNECTING/RETRYING → RETRYING: 连接失败，等待重试
 * - CONNECTING/RETRYING → OFFLINE: 重试耗尽（终态）
 * - SCANNING_INFO → SCANNING_FIRMWARE → SCANNING_AGENT → SCANNING_OS: 固定顺序扫描
 * - SCANNING_OS → SCAN_COMPLETE: 存在待更新组件
 * - SCANNING_OS → SUCCESS: 全部合规，无需更新
 * - SCANNING_OS → READY_FOR_EXECUTION: 全部合规，活动带有待执行脚本
 * - READY_FOR_EXECUTION / SCAN_COMPLETE → RUNNING_SCRIPT → 原停靠态 / SUCCESS / FAILED: 逐个执行脚本队列
 * - SCAN_COMPLETE → UPDATING_*: 按 固件 → 代理 → 系统 顺序更新
 * - UPDATING_* → PENDING_REBOOT / SUCCESS / FAILED
 * - PENDING_REBOOT → REBOOTING → SUCCESS
 * - 任意非终态 → CANCELLED
 * - OFFLINE → WAKING_UP → PENDING: 网络唤醒后重新排队
 * - PENDING → CONNECTING: 复查（单次连接，不发送唤醒包）
 */
public enum DeviceStatus {

    PENDING("待处理"),

    WAKING_UP("唤醒中"),

    CONNECTING("连接中"),

    /**
     * 连接失败，等待下一次尝试
     */
    RETRYING("重试中"),

    SCANNING_INFO("扫描设备信息"),

    SCANNING_FIRMWARE("扫描固件"),

    SCANNING_AGENT("扫描代理"),

    SCANNING_OS("扫描系统"),

    /**
     * 扫描完成，存在待更新组件（可执行更新）
     */
    SCAN_COMPLETE("扫描完成"),

    /**
     * 合规，等待执行脚本队列（停靠态）
     */
    READY_FOR_EXECUTION("待执行脚本"),

    RUNNING_SCRIPT("执行脚本中"),

    UPDATING_FIRMWARE("更新固件"),

    UPDATING_AGENT("更新代理"),

    UPDATING_OS("更新系统"),

    /**
     * 更新完成，等待重启（可执行重启）
     */
    PENDING_REBOOT("等待重启"),

    REBOOTING("重启中"),

    /**
     * 合规（终态）
     */
    SUCCESS("成功"),

    /**
     * 组件更新失败（终态）
     */
    FAILED("失败"),

    /**
     * 重试耗尽，设备无响应（终态）
     */
    OFFLINE("离线"),

    /**
     * 已取消（终态）
     */
    CANCELLED("已取消");

    private final String description;

    DeviceStatus(String description) {
        this.description = description;
    }

    public String getDescription() {
        return description;
    }

    /**
     * 是否为终态
     */
    public boolean isTerminal() {
        return this == SUCCESS
            || this == FAILED
            || this == OFFLINE
            || this == CANCELLED;
    }

    /**
     * 是否为停靠态：非终态，但当前没有进行中的工作，等待操作员下一步动作
     */
    public boolean isResting() {
        return this == SCAN_COMPLETE || this == PENDING_REBOOT || this == READY_FOR_EXECUTION;
    }

    /**
     * 是否处于进行中（取消时会被置为 CANCELLED）
     */
    public boolean isInFlight() {
        return !isTerminal() && !isResting();
    }

    public boolean isFailure() {
        return this == FAILED || this == OFFLINE;
    }

    public boolean canUpdate() {
        return this == SCAN_COMPLETE;
    }

    public boolean canReboot() {
        return this == PENDING_REBOOT;
    }

    /**
     * 可以进入脚本执行
     */
    public boolean canRunScript() {
        return this == READY_FOR_EXECUTION || this == SCAN_COMPLETE;
    }

    public boolean canWake() {
        return this == OFFLINE;
    }
}
