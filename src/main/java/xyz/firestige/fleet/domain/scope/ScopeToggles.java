package xyz.firestige.fleet.domain.scope;

/**
 * 操作员在范围校验界面上可调整的策略开关，默认全部开启
 */
public class ScopeToggles {

    private boolean requireExplicitSelection = true;
    private boolean blockBroadcastCommands = true;
    private boolean blockSubnetWideOperations = true;
    private boolean blockRegistryWrites = true;
    private boolean blockServiceStops = true;
    private boolean enforceHostnameWhitelist = true;

    public static ScopeToggles defaults() {
        return new ScopeToggles();
    }

    public boolean isRequireExplicitSelection() { return requireExplicitSelection; }
    public void setRequireExplicitSelection(boolean v) { this.requireExplicitSelection = v; }

    public boolean isBlockBroadcastCommands() { return blockBroadcastCommands; }
    public void setBlockBroadcastCommands(boolean v) { this.blockBroadcastCommands = v; }

    public boolean isBlockSubnetWideOperations() { return blockSubnetWideOperations; }
    public void setBlockSubnetWideOperations(boolean v) { this.blockSubnetWideOperations = v; }

    public boolean isBlockRegistryWrites() { return blockRegistryWrites; }
    public void setBlockRegistryWrites(boolean v) { this.blockRegistryWrites = v; }

    public boolean isBlockServiceStops() { return blockServiceStops; }
    public void setBlockServiceStops(boolean v) { this.blockServiceStops = v; }

    public boolean isEnforceHostnameWhitelist() { return enforceHostnameWhitelist; }
    public void setEnforceHostnameWhitelist(boolean v) { this.enforceHostnameWhitelist = v; }
}
