package xyz.firestige.fleet.domain.device;

import java.util.List;

/**
 * 固定的失败原因目录
 */
public final class FailureCatalog {

    public static final FailureDetail DEVICE_UNREACHABLE = new FailureDetail(
            "ERR_DEVICE_UNREACHABLE",
            "Device did not respond after all connection attempts.",
            List.of(
                    "Verify the device is powered on and connected to the network.",
                    "Confirm the MAC address in the device list matches the physical device.",
                    "Ensure Wake-on-LAN is enabled in BIOS and the network switch supports WoL magic packets.",
                    "Ping the device IP manually to confirm network-layer connectivity.",
                    "Check firewall or VLAN rules that may block WMI or WoL traffic.",
                    "Increase max retries in the deployment settings and re-run."));

    public static final FailureDetail UPDATE_FAILED = new FailureDetail(
            "ERR_UPDATE_FAILED",
            "One or more component updates failed during execution.",
            List.of(
                    "Review the update result to identify which component failed.",
                    "Ensure the device has at least 10 GB of free disk space.",
                    "Verify the device has a stable network connection to the update source.",
                    "Reboot the device manually to clear any partial update state, then re-scan.",
                    "Check the campaign log for the specific error returned by the update tool.",
                    "Run the update manually on the device and verify it completes without errors."));

    public static final FailureDetail SCRIPT_EXEC_FAILED = new FailureDetail(
            "ERR_SCRIPT_EXEC_FAILED",
            "The deployment script failed to execute successfully.",
            List.of(
                    "Verify the selected script file is not corrupted or zero-length.",
                    "Confirm the script requires no interactive prompts.",
                    "Check if the script requires elevated privileges on the target device.",
                    "Review script syntax for the target shell version.",
                    "Ensure all packages referenced by the script are present on the device.",
                    "Run the script manually on the device and capture the output for diagnosis."));

    private FailureCatalog() {
    }
}
