package xyz.firestige.fleet.domain.scope;

import xyz.firestige.fleet.domain.device.DeviceIdentifiers;

import java.time.LocalDateTime;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.stream.Collectors;

/**
 * 范围策略：限定一次活动可以触达的设备与操作类别
 * <p>
 * 由 {@link ScopeVerificationSession#issue()} 签发，签发后不可变，仅对一次活动有效：
 * 活动启动时通过 {@link #markUsed()} 占用，再次启动需要重新校验。
 */
public final class ScopePolicy {

    private final String policyId;
    private final List<String> allowedHostnames;
    private final List<String> allowedMacs;
    private final Set<String> hostnameKeys;
    private final Set<String> macKeys;
    private final int maxDeviceCount;
    private final boolean requireExplicitSelection;
    private final boolean blockBroadcastCommands;
    private final boolean blockSubnetWideOperations;
    private final boolean blockRegistryWrites;
    private final boolean blockServiceStops;
    private final boolean enforceHostnameWhitelist;
    private final LocalDateTime issuedAt;
    private final AtomicBoolean used = new AtomicBoolean(false);

    private ScopePolicy(Builder builder) {
        this.policyId = builder.policyId != null ? builder.policyId : UUID.randomUUID().toString();
        this.allowedHostnames = List.copyOf(builder.allowedHostnames);
        this.allowedMacs = List.copyOf(builder.allowedMacs);
        this.hostnameKeys = allowedHostnames.stream()
                .map(DeviceIdentifiers::hostnameKey)
                .collect(Collectors.toUnmodifiableSet());
        this.macKeys = allowedMacs.stream()
                .map(DeviceIdentifiers::normalizeMac)
                .collect(Collectors.toUnmodifiableSet());
        this.maxDeviceCount = ScopeLimits.clamp(builder.maxDeviceCount);
        this.requireExplicitSelection = builder.requireExplicitSelection;
        this.blockBroadcastCommands = builder.blockBroadcastCommands;
        this.blockSubnetWideOperations = builder.blockSubnetWideOperations;
        this.blockRegistryWrites = builder.blockRegistryWrites;
        this.blockServiceStops = builder.blockServiceStops;
        this.enforceHostnameWhitelist = builder.enforceHostnameWhitelist;
        this.issuedAt = builder.issuedAt != null ? builder.issuedAt : LocalDateTime.now();
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * 主机名是否在白名单内（忽略大小写）
     */
    public boolean allowsHostname(String hostname) {
        return hostnameKeys.contains(DeviceIdentifiers.hostnameKey(hostname));
    }

    public boolean allowsMac(String mac) {
        return macKeys.contains(DeviceIdentifiers.normalizeMac(mac));
    }

    /**
     * 占用策略，只有第一次调用返回 true
     */
    public boolean markUsed() {
        return used.compareAndSet(false, true);
    }

    public boolean isUsed() {
        return used.get();
    }

    public String getPolicyId() {
        return policyId;
    }

    public List<String> getAllowedHostnames() {
        return allowedHostnames;
    }

    public List<String> getAllowedMacs() {
        return allowedMacs;
    }

    public int getMaxDeviceCount() {
        return maxDeviceCount;
    }

    public boolean isRequireExplicitSelection() {
        return requireExplicitSelection;
    }

    public boolean isBlockBroadcastCommands() {
        return blockBroadcastCommands;
    }

    public boolean isBlockSubnetWideOperations() {
        return blockSubnetWideOperations;
    }

    public boolean isBlockRegistryWrites() {
        return blockRegistryWrites;
    }

    public boolean isBlockServiceStops() {
        return blockServiceStops;
    }

    public boolean isEnforceHostnameWhitelist() {
        return enforceHostnameWhitelist;
    }

    public LocalDateTime getIssuedAt() {
        return issuedAt;
    }

    @Override
    public String toString() {
        return "ScopePolicy{" +
                "policyId='" + policyId + '\'' +
                ", devices=" + allowedHostnames.size() +
                ", maxDeviceCount=" + maxDeviceCount +
                ", enforceHostnameWhitelist=" + enforceHostnameWhitelist +
                '}';
    }

    /**
     * 所有开关默认开启
     */
    public static final class Builder {
        private String policyId;
        private final Set<String> allowedHostnames = new LinkedHashSet<>();
        private final Set<String> allowedMacs = new LinkedHashSet<>();
        private int maxDeviceCount = ScopeLimits.DEFAULT_MAX_DEVICES;
        private boolean requireExplicitSelection = true;
        private boolean blockBroadcastCommands = true;
        private boolean blockSubnetWideOperations = true;
        private boolean blockRegistryWrites = true;
        private boolean blockServiceStops = true;
        private boolean enforceHostnameWhitelist = true;
        private LocalDateTime issuedAt;

        private Builder() {
        }

        public Builder policyId(String policyId) {
            this.policyId = policyId;
            return this;
        }

        public Builder allowHostname(String hostname) {
            this.allowedHostnames.add(Objects.requireNonNull(hostname));
            return this;
        }

        public Builder allowMac(String mac) {
            this.allowedMacs.add(Objects.requireNonNull(mac));
            return this;
        }

        public Builder maxDeviceCount(int maxDeviceCount) {
            this.maxDeviceCount = maxDeviceCount;
            return this;
        }

        public Builder toggles(ScopeToggles toggles) {
            this.requireExplicitSelection = toggles.isRequireExplicitSelection();
            this.blockBroadcastCommands = toggles.isBlockBroadcastCommands();
            this.blockSubnetWideOperations = toggles.isBlockSubnetWideOperations();
            this.blockRegistryWrites = toggles.isBlockRegistryWrites();
            this.blockServiceStops = toggles.isBlockServiceStops();
            this.enforceHostnameWhitelist = toggles.isEnforceHostnameWhitelist();
            return this;
        }

        public Builder issuedAt(LocalDateTime issuedAt) {
            this.issuedAt = issuedAt;
            return this;
        }

        public ScopePolicy build() {
            return new ScopePolicy(this);
        }
    }
}
