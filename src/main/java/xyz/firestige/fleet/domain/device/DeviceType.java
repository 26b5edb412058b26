package xyz.firestige.fleet.domain.device;

import java.util.List;
import java.util.Locale;

/**
 * 设备外形，根据主机名片段推断
 */
public enum DeviceType {

    LAPTOP_14("Latitude 5440", "l14", "lap14"),
    LAPTOP_16("Precision 5690", "l16", "lap16"),
    LAPTOP("Latitude 7450", "lap", "lt"),
    SFF("OptiPlex 7010 SFF", "sff"),
    MICRO("OptiPlex 7010 Micro", "micro"),
    TOWER("OptiPlex 7010 Tower", "twr", "tower"),
    WYSE("Wyse 5070", "wyse"),
    VDI("Wyse 5470 VDI", "vdi"),
    DETACHABLE("Latitude 7350 Detachable", "detach"),
    DESKTOP("OptiPlex 7010");

    private final String model;
    private final List<String> fragments;

    DeviceType(String model, String... fragments) {
        this.model = model;
        this.fragments = List.of(fragments);
    }

    public String getModel() {
        return model;
    }

    /**
     * 按声明顺序匹配，l14 必须先于 lap 判断
     */
    public static DeviceType detect(String hostname) {
        if (hostname == null) {
            return DESKTOP;
        }
        String lower = hostname.toLowerCase(Locale.ROOT);
        for (DeviceType type : values()) {
            for (String fragment : type.fragments) {
                if (lower.contains(fragment)) {
                    return type;
                }
            }
        }
        return DESKTOP;
    }
}
