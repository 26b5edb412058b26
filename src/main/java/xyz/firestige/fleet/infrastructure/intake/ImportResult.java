package xyz.firestige.fleet.infrastructure.intake;

import xyz.firestige.fleet.domain.device.Device;

import java.util.List;

/**
 * 部分成功的导入结果：合法行全部载入，非法行逐行记录原因
 */
public record ImportResult(List<Device> devices, List<RowRejection> rejections, List<String> warnings) {

    public ImportResult {
        devices = List.copyOf(devices);
        rejections = List.copyOf(rejections);
        warnings = List.copyOf(warnings);
    }

    public boolean hasRejections() {
        return !rejections.isEmpty();
    }
}
