package xyz.firestige.fleet.domain.script;

import java.util.List;

import static xyz.firestige.fleet.domain.script.Severity.BLOCKED;
import static xyz.firestige.fleet.domain.script.Severity.DANGER;
import static xyz.firestige.fleet.domain.script.Severity.WARNING;

/**
 * 固定的危险模式目录（批处理 / CMD / PowerShell）
 * <p>
 * 宁可误报也不漏报：模式刻意写得宽泛。
 */
public final class ScriptRuleCatalog {

    private static final String DRIVE_ROOT = "[A-Za-z]:\\\\";
    private static final String WINDOWS_DIR = "[A-Za-z]:\\\\Windows";
    private static final String PROGRAM_FILES = "[A-Za-z]:\\\\Program\\s*Files";
    private static final String UNC_WILDCARD = "\\\\\\\\\\*";

    public static final List<PatternRule> BLOCKED_RULES = List.of(
            // 关机
            new PatternRule("shutdown\\s+/[sr](?!.*/t\\s+\\d)", BLOCKED,
                    "Shutdown/restart command without explicit /t timeout. Could immediately power off hospital systems.",
                    "Add an explicit /t timeout value (e.g. shutdown /r /t 60) and target a specific hostname."),
            new PatternRule("shutdown\\s+.*" + UNC_WILDCARD, BLOCKED,
                    "Shutdown command targeting wildcard machines. This would affect every reachable host.",
                    "Target specific hostnames only. Never use wildcard targets for shutdown."),
            // 关键服务
            new PatternRule("net\\s+stop\\s+(W32Time|WinRM|DNS|Dnscache|DHCP|DHCPServer|Spooler|wuauserv|LanmanServer"
                    + "|LanmanWorkstation|EventLog|TermService|RemoteRegistry|MSSQLSERVER|MSSQL\\$|SQLAgent|W3SVC"
                    + "|IISAdmin|CertSvc|NTDS|Netlogon|Kdc)", BLOCKED,
                    "Stopping a critical Windows/infrastructure service. This can cripple hospital networking, printing, updates, or domain services.",
                    "Do not stop critical infrastructure services via deployment scripts. Use proper change-management procedures."),
            // 递归删除
            new PatternRule("\\bdel\\s+(/s\\s+/q|/q\\s+/s)\\s+" + DRIVE_ROOT, BLOCKED,
                    "Recursive silent deletion on a system drive root. This will destroy the operating system and all data.",
                    "Never perform recursive deletes on drive roots. Target specific subdirectories only."),
            new PatternRule("\\b(rd|rmdir)\\s+/s\\s+/q\\s+" + DRIVE_ROOT, BLOCKED,
                    "Recursive silent directory removal on a system drive root.",
                    "Never remove drive root directories. Target specific subdirectories only."),
            new PatternRule("Remove-Item\\s+.*-Recurse.*" + DRIVE_ROOT, BLOCKED,
                    "PowerShell recursive removal on a drive root.",
                    "Never recursively remove drive roots. Scope removal to specific subdirectories."),
            new PatternRule("\\bformat\\s+[A-Za-z]:", BLOCKED,
                    "Disk format command detected. This will destroy all data on the target volume.",
                    "Format commands must never appear in deployment scripts."),
            // 注册表根键
            new PatternRule("reg\\s+delete\\s+HKLM\\\\SYSTEM(?:\\s|$|\\\\)", BLOCKED,
                    "Registry delete on HKLM\\SYSTEM root. This can render Windows unbootable.",
                    "Never delete the HKLM\\SYSTEM root key. Target specific subkeys if absolutely necessary."),
            new PatternRule("reg\\s+delete\\s+HKLM\\\\SOFTWARE(?:\\s|$|\\\\$)", BLOCKED,
                    "Registry delete on HKLM\\SOFTWARE root. This will destroy all installed software configuration.",
                    "Never delete the HKLM\\SOFTWARE root key. Target specific subkeys if absolutely necessary."),
            // 防火墙
            new PatternRule("netsh\\s+advfirewall\\s+set\\s+(allprofiles|domainprofile|privateprofile|publicprofile)\\s+state\\s+off", BLOCKED,
                    "Disabling Windows Firewall. This exposes the host to network attacks.",
                    "Never disable the firewall. Add specific rules for required traffic instead."),
            new PatternRule("Set-NetFirewallProfile\\s+.*-Enabled\\s+False", BLOCKED,
                    "PowerShell command disabling Windows Firewall profile.",
                    "Never disable the firewall. Use New-NetFirewallRule for specific exceptions."),
            // 启动与磁盘
            new PatternRule("\\bbcdedit\\b", BLOCKED,
                    "Boot Configuration Data edit detected. Incorrect changes can prevent Windows from booting.",
                    "BCD modifications must not be performed via deployment scripts. Use proper imaging workflows."),
            new PatternRule("\\bdiskpart\\b", BLOCKED,
                    "DiskPart utility detected. DiskPart can destroy disk partitions and all data.",
                    "DiskPart must never be invoked from deployment scripts. Use proper imaging workflows."),
            // 广播与扫描
            new PatternRule("ping\\s+.*\\.255", BLOCKED,
                    "Pinging a broadcast address (x.x.x.255). This is a subnet-wide broadcast operation.",
                    "Do not send broadcast pings. Target specific hosts only."),
            new PatternRule("ping\\s+.*255\\.255\\.255\\.255", BLOCKED,
                    "Pinging the global broadcast address. This reaches every host on the local network.",
                    "Never ping the broadcast address from deployment scripts."),
            new PatternRule("for\\s+/L\\s+.*\\bping\\b", BLOCKED,
                    "Loop-based ping sweep detected (for /L ... ping). This scans an entire subnet range.",
                    "Do not perform ping sweeps. Target only the specific devices in your deployment list."),
            new PatternRule("1\\.\\.254.*ping|ping.*1\\.\\.254", BLOCKED,
                    "PowerShell range-based ping sweep (1..254). This scans an entire subnet.",
                    "Do not scan subnets. Target specific hostnames from the approved device list."),
            new PatternRule("for\\s+.*%.*in\\s*\\(\\s*\\d+\\s*,\\s*1\\s*,\\s*254\\s*\\).*ping", BLOCKED,
                    "Batch subnet sweep using a for loop with ping.",
                    "Do not perform subnet sweeps in deployment scripts."),
            // 通配目标
            new PatternRule("psexec\\s+.*" + UNC_WILDCARD, BLOCKED,
                    "PsExec targeting wildcard machines. This will execute on every discoverable host.",
                    "Never use wildcard targets with PsExec. Specify exact hostnames."),
            new PatternRule("wmic\\s+.*/node:\\s*\"?\\*", BLOCKED,
                    "WMIC targeting wildcard node. This will affect every reachable machine.",
                    "Specify explicit hostnames with /node. Never use wildcards."),
            new PatternRule("Invoke-Command\\s+.*-ComputerName\\s+\\*", BLOCKED,
                    "Invoke-Command targeting wildcard ComputerName. This will execute on all domain machines.",
                    "Specify explicit hostnames with -ComputerName. Never use wildcards."),
            new PatternRule("Stop-Service\\s+[\"']?\\*", BLOCKED,
                    "Stop-Service with wildcard. This will stop ALL services on the machine.",
                    "Specify the exact service name. Never use wildcards with Stop-Service."),
            new PatternRule(UNC_WILDCARD + "\\s", BLOCKED,
                    "UNC path with wildcard target (\\\\*). This targets all network hosts.",
                    "Use explicit hostnames in UNC paths. Never use wildcard targets."),
            new PatternRule("-ComputerName\\s+[\"']?\\*", BLOCKED,
                    "PowerShell -ComputerName parameter with wildcard. This targets all discoverable computers.",
                    "Specify explicit hostnames. Never use wildcard computer names."),
            // 执行策略
            new PatternRule("Set-ExecutionPolicy\\s+Unrestricted\\s+.*-Force", BLOCKED,
                    "Forcing Unrestricted execution policy. This disables all PowerShell script security.",
                    "Use RemoteSigned or AllSigned execution policies. Never force Unrestricted."),
            new PatternRule("Set-ExecutionPolicy\\s+Bypass\\s+.*-Force", BLOCKED,
                    "Forcing Bypass execution policy. This completely disables PowerShell script security checks.",
                    "Use RemoteSigned or AllSigned execution policies. Never force Bypass."),
            new PatternRule("ff[:\\-]ff[:\\-]ff[:\\-]ff[:\\-]ff[:\\-]ff.*255\\.255\\.255\\.255", BLOCKED,
                    "Broadcast Wake-on-LAN magic packet to entire subnet.",
                    "Send WoL packets to specific MAC addresses via directed broadcast or unicast only."));

    public static final List<PatternRule> DANGER_RULES = List.of(
            new PatternRule("reg\\s+add\\s+HKLM", DANGER,
                    "Adding a registry key under HKLM. This modifies machine-wide configuration.",
                    "Verify the exact key path is necessary. Prefer HKCU modifications when possible."),
            new PatternRule("reg\\s+delete\\s+HKLM", DANGER,
                    "Deleting a registry key under HKLM. This modifies machine-wide configuration.",
                    "Verify the exact key path is necessary. Ensure you are not deleting critical subkeys."),
            new PatternRule("net\\s+stop\\s+\\S+", DANGER,
                    "Stopping a Windows service. Service disruption can affect hospital workflows.",
                    "Verify the service is non-critical and scoped to the target device only."),
            new PatternRule("\\bsc\\s+config\\s+", DANGER,
                    "Modifying service configuration (startup type, binary path, etc.).",
                    "Review the exact service and configuration change carefully. Test on a non-production device."),
            new PatternRule("\\bsc\\s+delete\\s+", DANGER,
                    "Deleting a Windows service registration.",
                    "Ensure the service is not required by any hospital application."),
            new PatternRule("schtasks\\s+/create", DANGER,
                    "Creating a scheduled task. Persistent scheduled tasks can execute arbitrary commands later.",
                    "Review the scheduled task action, trigger, and run-as identity carefully."),
            new PatternRule("Register-ScheduledTask", DANGER,
                    "PowerShell scheduled task registration. Persistent tasks execute arbitrary commands later.",
                    "Review the task action, trigger, and principal carefully."),
            new PatternRule("\\bwmic\\b", DANGER,
                    "WMIC command detected. WMI can query and modify system configuration remotely.",
                    "Verify WMIC is scoped to the target device. Prefer modern PowerShell cmdlets."),
            new PatternRule("Invoke-WmiMethod", DANGER,
                    "PowerShell WMI method invocation. Can execute commands and modify system state remotely.",
                    "Ensure the target is explicitly scoped. Review the method and arguments."),
            new PatternRule("Invoke-CimMethod", DANGER,
                    "PowerShell CIM method invocation. Can execute commands and modify system state remotely.",
                    "Ensure the target is explicitly scoped. Review the method and arguments."),
            new PatternRule("Enter-PSSession", DANGER,
                    "Interactive PowerShell remote session. Provides full remote shell access to the target.",
                    "Ensure the target hostname is in the allowed device list."),
            new PatternRule("Invoke-Command\\b", DANGER,
                    "PowerShell remote command execution. Runs arbitrary commands on remote machines.",
                    "Verify -ComputerName targets only approved devices. Review the script block."),
            new PatternRule("New-PSSession", DANGER,
                    "Creating a persistent PowerShell remote session.",
                    "Ensure the session target is in the approved device list and sessions are properly closed."),
            new PatternRule("\\bnetsh\\b", DANGER,
                    "Network shell (netsh) command. Can modify firewall rules, IP configuration, and network settings.",
                    "Review the specific netsh context and command carefully."),
            new PatternRule("\\broute\\s+add\\b", DANGER,
                    "Adding a network route. This changes network traffic flow on the host.",
                    "Verify the route is necessary and does not redirect hospital traffic."),
            new PatternRule("\\broute\\s+delete\\b", DANGER,
                    "Deleting a network route. This can break network connectivity.",
                    "Verify the route removal will not disrupt hospital network traffic."),
            new PatternRule("gpupdate\\s+/force", DANGER,
                    "Forcing Group Policy update. This can change security settings, mapped drives, and software installations.",
                    "Ensure Group Policy changes have been reviewed and approved by the domain admin team."),
            new PatternRule("cipher\\s+/w", DANGER,
                    "Secure wiping free disk space. This is a long-running I/O-intensive operation.",
                    "Do not run cipher /w during hospital operating hours. It will degrade disk performance."),
            new PatternRule("setx\\s+.*/M", DANGER,
                    "Setting a system-level environment variable (setx /M).",
                    "Verify the variable does not conflict with hospital applications."),
            new PatternRule("\\[Environment\\]::SetEnvironmentVariable\\s*\\(.*Machine", DANGER,
                    "PowerShell system-level environment variable modification.",
                    "Verify the variable does not conflict with hospital applications."),
            new PatternRule("takeown\\s+.*" + WINDOWS_DIR, DANGER,
                    "Taking ownership of Windows system directory files.",
                    "Do not take ownership of OS files unless absolutely necessary and approved."),
            new PatternRule("takeown\\s+.*" + PROGRAM_FILES, DANGER,
                    "Taking ownership of Program Files directory.",
                    "Do not modify ownership of Program Files. Use proper installers."),
            new PatternRule("icacls\\s+.*" + WINDOWS_DIR, DANGER,
                    "Modifying ACLs on Windows system directory.",
                    "Do not modify system directory ACLs unless absolutely necessary and approved."),
            new PatternRule("icacls\\s+.*" + PROGRAM_FILES, DANGER,
                    "Modifying ACLs on Program Files directory.",
                    "Do not modify Program Files ACLs. Use proper installers."),
            new PatternRule("\\btakeown\\b", DANGER,
                    "File ownership change command detected.",
                    "Verify the target path is scoped narrowly and does not affect system files."),
            new PatternRule("\\bicacls\\b", DANGER,
                    "ACL modification command detected.",
                    "Verify the target path and permissions are correct and narrowly scoped."));

    public static final List<PatternRule> WARNING_RULES = List.of(
            new PatternRule("\\b(copy|xcopy|robocopy)\\b.*" + WINDOWS_DIR, WARNING,
                    "Copying files to the Windows directory.",
                    "Verify the destination path. Prefer application-specific directories."),
            new PatternRule("\\b(copy|xcopy|robocopy)\\b.*" + PROGRAM_FILES, WARNING,
                    "Copying files to Program Files.",
                    "Use proper installers (MSI/MSIX) instead of manual file copies."),
            new PatternRule("Copy-Item\\s+.*" + WINDOWS_DIR, WARNING,
                    "PowerShell Copy-Item to the Windows directory.",
                    "Verify the destination path. Prefer application-specific directories."),
            new PatternRule("Copy-Item\\s+.*" + PROGRAM_FILES, WARNING,
                    "PowerShell Copy-Item to Program Files.",
                    "Use proper installers instead of manual file copies."),
            new PatternRule("msiexec\\s+.*/(i|x)\\s+.*/q", WARNING,
                    "Silent MSI installation/uninstallation.",
                    "Verify the MSI package source is trusted and the product is approved."),
            new PatternRule("msiexec", WARNING,
                    "MSI installer invocation detected.",
                    "Verify the MSI package is from a trusted source."),
            new PatternRule("\\bcertutil\\b", WARNING,
                    "CertUtil usage detected. CertUtil can download files, decode payloads, and manage certificates.",
                    "Review the specific certutil arguments. Certutil -urlcache is often used for file download."),
            new PatternRule("\\bping\\b", WARNING,
                    "Ping command detected. Could be used for network reconnaissance.",
                    "Verify the ping target is in the approved device list."),
            new PatternRule("\\btaskkill\\b|Stop-Process", WARNING,
                    "Process termination command detected.",
                    "Verify the target process. Avoid killing system-critical processes."),
            new PatternRule("\\bnet\\s+use\\b", WARNING,
                    "Network drive mapping or disconnection.",
                    "Verify the share path and credentials are appropriate."),
            new PatternRule("Invoke-WebRequest|Invoke-RestMethod", WARNING,
                    "PowerShell web request detected.",
                    "Verify the endpoint URL is a trusted internal source."),
            new PatternRule("\\bwget\\b|\\bcurl\\b", WARNING,
                    "Command-line download tool detected.",
                    "Verify the download URL is a trusted internal source."),
            new PatternRule("Start-BitsTransfer", WARNING,
                    "BITS file transfer detected.",
                    "Verify the source URL is a trusted internal location."),
            new PatternRule("DownloadString|DownloadFile|WebClient", WARNING,
                    ".NET web download method detected.",
                    "Verify the download URL is a trusted internal source."));

    /**
     * 子网 / 地址段定位（命中同时记入范围违规）
     */
    public static final List<PatternRule> SUBNET_RULES = List.of(
            new PatternRule("\\d{1,3}\\.\\d{1,3}\\.\\d{1,3}\\.\\d{1,3}/\\d{1,2}", DANGER,
                    "CIDR subnet notation detected. This may target an entire network range.",
                    "Use explicit hostnames instead of subnet ranges."),
            new PatternRule("\\d{1,3}\\.\\d{1,3}\\.\\d{1,3}\\.\\d{1,3}\\s*-\\s*\\d{1,3}\\.\\d{1,3}\\.\\d{1,3}\\.\\d{1,3}", DANGER,
                    "IP address range detected. This targets multiple hosts.",
                    "Use explicit hostnames from the approved device list."),
            new PatternRule("\\d{1,3}\\.\\d{1,3}\\.\\d{1,3}\\.\\*", BLOCKED,
                    "Wildcard IP address detected (x.x.x.*). This targets an entire subnet.",
                    "Use explicit hostnames from the approved device list."),
            new PatternRule("\\d{1,3}\\.\\d{1,3}\\.\\d{1,3}\\.255", BLOCKED,
                    "Broadcast address detected (x.x.x.255). This reaches every host on the subnet.",
                    "Target specific hosts only. Never use broadcast addresses."),
            new PatternRule("\\d+\\.\\.\\d+.*\\d{1,3}\\.\\d{1,3}\\.\\d{1,3}|\\d{1,3}\\.\\d{1,3}\\.\\d{1,3}.*\\d+\\.\\.\\d+", BLOCKED,
                    "PowerShell range operator combined with IP address. Likely a subnet sweep.",
                    "Do not perform subnet sweeps. Use the approved device list."));

    /**
     * AD 通配查询（命中同时记入范围违规，但不会阻断）
     */
    public static final List<PatternRule> WILDCARD_RULES = List.of(
            new PatternRule("Get-ADComputer\\s+.*-Filter\\s+['\"]*\\*", DANGER,
                    "Active Directory wildcard computer query. This retrieves ALL domain computers.",
                    "Filter AD queries to specific OUs or hostname patterns."),
            new PatternRule("Get-ADComputer.*(ForEach|\\|)", WARNING,
                    "Active Directory computer query piped to another command.",
                    "Ensure the AD query is filtered to only approved devices."));

    private ScriptRuleCatalog() {
    }
}
