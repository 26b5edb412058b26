package xyz.firestige.fleet.domain.device;

import java.util.List;

/**
 * 单次更新的结果：已成功与已失败的组件（失败时后续组件不会尝试）
 */
public record UpdateResult(List<UpdateComponent> succeeded, List<UpdateComponent> failed) {

    public UpdateResult {
        succeeded = List.copyOf(succeeded);
        failed = List.copyOf(failed);
    }

    public boolean hasFailure() {
        return !failed.isEmpty();
    }
}
