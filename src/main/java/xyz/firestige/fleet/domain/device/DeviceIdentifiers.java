package xyz.firestige.fleet.domain.device;

import java.util.Locale;
import java.util.regex.Pattern;

/**
 * MAC 与主机名的规范化工具
 */
public final class DeviceIdentifiers {

    private static final Pattern MAC_SEPARATORS = Pattern.compile("[:\\-.\\s]");
    private static final Pattern CANONICAL_MAC = Pattern.compile("^[0-9A-F]{12}$");
    private static final Pattern HOSTNAME_ILLEGAL = Pattern.compile("[^a-zA-Z0-9\\-_]");

    private DeviceIdentifiers() {
    }

    /**
     * 去掉分隔符并转大写；不做合法性校验
     */
    public static String normalizeMac(String mac) {
        if (mac == null) {
            return "";
        }
        return MAC_SEPARATORS.matcher(mac).replaceAll("").toUpperCase(Locale.ROOT);
    }

    public static boolean isValidMac(String normalizedMac) {
        return normalizedMac != null && CANONICAL_MAC.matcher(normalizedMac).matches();
    }

    public static String sanitizeHostname(String hostname) {
        if (hostname == null) {
            return "";
        }
        return HOSTNAME_ILLEGAL.matcher(hostname.trim()).replaceAll("");
    }

    public static String hostnameKey(String hostname) {
        return hostname == null ? "" : hostname.trim().toUpperCase(Locale.ROOT);
    }
}
