package xyz.firestige.fleet.domain.device;

import java.util.List;

/**
 * 设备失败诊断信息，取自 {@link FailureCatalog}
 */
public record FailureDetail(String errorCode, String reason, List<String> troubleshootingSteps) {

    public FailureDetail {
        troubleshootingSteps = List.copyOf(troubleshootingSteps);
    }
}
