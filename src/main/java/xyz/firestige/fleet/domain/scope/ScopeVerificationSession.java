package xyz.firestige.fleet.domain.scope;

import xyz.firestige.fleet.domain.device.Device;
import xyz.firestige.fleet.exception.ScopeGateException;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * 范围校验流程
 * <p>
 * 两段式确认：
 * 1. 每台目标设备都必须逐台勾选确认（不提供"全选"）
 * 2. 操作员必须手工输入已确认的设备数量
 * <p>
 * 只有全部确认、输入数量一致且不超过上限时才能签发 {@link ScopePolicy}。
 * 非线程安全，一个校验界面对应一个实例。
 */
public class ScopeVerificationSession {

    private final Map<String, Device> selected = new LinkedHashMap<>();
    private final Set<String> acknowledged = new LinkedHashSet<>();
    private final int effectiveMax;
    private final ScopeToggles toggles;
    private final Clock clock;

    private String typedCount = "";
    private boolean issued;

    public ScopeVerificationSession(List<Device> selectedDevices, int requestedMax, ScopeToggles toggles, Clock clock) {
        for (Device device : selectedDevices) {
            selected.put(device.getId(), device);
        }
        this.effectiveMax = ScopeLimits.clamp(requestedMax);
        this.toggles = toggles != null ? toggles : ScopeToggles.defaults();
        this.clock = clock;
    }

    public void acknowledge(String deviceId) {
        if (!selected.containsKey(deviceId)) {
            throw new ScopeGateException("设备不在本次选择范围内: " + deviceId, deviceId);
        }
        acknowledged.add(deviceId);
    }

    public void revoke(String deviceId) {
        acknowledged.remove(deviceId);
    }

    /**
     * 记录操作员输入的确认数量（原始文本，校验在 isReady 时进行）
     */
    public void typeConfirmationCount(String typed) {
        this.typedCount = typed == null ? "" : typed.trim();
    }

    public boolean isReady() {
        return readinessProblems().isEmpty();
    }

    /**
     * 当前未满足的条件，空列表表示可以签发
     */
    public List<String> readinessProblems() {
        List<String> problems = new ArrayList<>();
        int total = selected.size();
        if (total == 0) {
            problems.add("未选择任何设备");
        }
        if (total > effectiveMax) {
            problems.add(String.format("选择 %d 台设备，超过上限 %d", total, effectiveMax));
        }
        if (acknowledged.size() != total) {
            problems.add(String.format("仅确认 %d/%d 台设备", acknowledged.size(), total));
        }
        Integer typed = parseTyped();
        if (typed == null || typed != acknowledged.size()) {
            problems.add(String.format("输入数量 '%s' 与已确认数量 %d 不一致", typedCount, acknowledged.size()));
        }
        return problems;
    }

    /**
     * 签发策略与已验证的设备快照
     *
     * @throws ScopeGateException 条件未全部满足
     */
    public VerifiedScope issue() {
        List<String> problems = readinessProblems();
        if (!problems.isEmpty()) {
            throw new ScopeGateException("范围校验未完成: " + String.join("; ", problems));
        }
        LocalDateTime now = LocalDateTime.now(clock);
        ScopePolicy.Builder builder = ScopePolicy.builder()
                .maxDeviceCount(effectiveMax)
                .toggles(toggles)
                .issuedAt(now);
        List<Device> verified = new ArrayList<>();
        for (Device device : selected.values()) {
            builder.allowHostname(device.getHostname()).allowMac(device.getMac());
            Device copy = device.copy();
            copy.markScopeVerified(now);
            verified.add(copy);
        }
        issued = true;
        return new VerifiedScope(builder.build(), verified);
    }

    public int getSelectedCount() {
        return selected.size();
    }

    public Set<String> getAcknowledged() {
        return Collections.unmodifiableSet(acknowledged);
    }

    public int getEffectiveMax() {
        return effectiveMax;
    }

    public boolean isIssued() {
        return issued;
    }

    private Integer parseTyped() {
        if (typedCount.isEmpty()) {
            return null;
        }
        try {
            return Integer.valueOf(typedCount);
        } catch (NumberFormatException e) {
            return null;
        }
    }
}
