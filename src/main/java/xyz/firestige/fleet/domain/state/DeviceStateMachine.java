package xyz.firestige.fleet.domain.state;

import xyz.firestige.fleet.domain.device.DeviceStatus;
import xyz.firestige.fleet.exception.StateTransitionException;

import java.util.Collections;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.Map;
import java.util.Set;

import static xyz.firestige.fleet.domain.device.DeviceStatus.*;

/**
 * 设备状态图
 * <p>
 * 终态（SUCCESS / FAILED / CANCELLED）没有出边；OFFLINE 只能经网络唤醒重新排队。
 * 扫描中途失联视为 OFFLINE。
 * 脚本执行结束后回到进入前的停靠态；合规设备执行完最后一个脚本后进入 SUCCESS。
 * 新活动开始时的 reset 不经过状态图。
 */
public final class DeviceStateMachine {

    private static final Map<DeviceStatus, Set<DeviceStatus>> RULES = new EnumMap<>(DeviceStatus.class);

    static {
        RULES.put(PENDING, EnumSet.of(WAKING_UP, CONNECTING, CANCELLED));
        RULES.put(WAKING_UP, EnumSet.of(CONNECTING, PENDING, CANCELLED));
        RULES.put(CONNECTING, EnumSet.of(RETRYING, SCANNING_INFO, OFFLINE, CANCELLED));
        RULES.put(RETRYING, EnumSet.of(RETRYING, SCANNING_INFO, OFFLINE, CANCELLED));
        RULES.put(SCANNING_INFO, EnumSet.of(SCANNING_FIRMWARE, OFFLINE, CANCELLED));
        RULES.put(SCANNING_FIRMWARE, EnumSet.of(SCANNING_AGENT, OFFLINE, CANCELLED));
        RULES.put(SCANNING_AGENT, EnumSet.of(SCANNING_OS, OFFLINE, CANCELLED));
        RULES.put(SCANNING_OS, EnumSet.of(SCAN_COMPLETE, READY_FOR_EXECUTION, SUCCESS, OFFLINE, CANCELLED));
        RULES.put(SCAN_COMPLETE, EnumSet.of(UPDATING_FIRMWARE, UPDATING_AGENT, UPDATING_OS, RUNNING_SCRIPT, CANCELLED));
        RULES.put(READY_FOR_EXECUTION, EnumSet.of(RUNNING_SCRIPT, CANCELLED));
        RULES.put(RUNNING_SCRIPT, EnumSet.of(READY_FOR_EXECUTION, SCAN_COMPLETE, SUCCESS, FAILED, CANCELLED));
        RULES.put(UPDATING_FIRMWARE, EnumSet.of(UPDATING_AGENT, UPDATING_OS, PENDING_REBOOT, SUCCESS, FAILED, CANCELLED));
        RULES.put(UPDATING_AGENT, EnumSet.of(UPDATING_OS, PENDING_REBOOT, SUCCESS, FAILED, CANCELLED));
        RULES.put(UPDATING_OS, EnumSet.of(PENDING_REBOOT, SUCCESS, FAILED, CANCELLED));
        RULES.put(PENDING_REBOOT, EnumSet.of(REBOOTING, CANCELLED));
        RULES.put(REBOOTING, EnumSet.of(SUCCESS, FAILED, CANCELLED));
        RULES.put(OFFLINE, EnumSet.of(WAKING_UP));
        RULES.put(SUCCESS, EnumSet.noneOf(DeviceStatus.class));
        RULES.put(FAILED, EnumSet.noneOf(DeviceStatus.class));
        RULES.put(CANCELLED, EnumSet.noneOf(DeviceStatus.class));
    }

    private DeviceStateMachine() {
    }

    public static boolean canTransition(DeviceStatus from, DeviceStatus to) {
        return RULES.getOrDefault(from, Collections.emptySet()).contains(to);
    }

    public static Set<DeviceStatus> allowedTargets(DeviceStatus from) {
        return Collections.unmodifiableSet(RULES.getOrDefault(from, EnumSet.noneOf(DeviceStatus.class)));
    }

    public static void assertTransition(String hostname, DeviceStatus from, DeviceStatus to) {
        if (!canTransition(from, to)) {
            throw new StateTransitionException(
                    String.format("非法状态转换: %s → %s, host: %s", from, to, hostname),
                    from.name(), to.name());
        }
    }
}
