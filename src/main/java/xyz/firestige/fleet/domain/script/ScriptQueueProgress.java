package xyz.firestige.fleet.domain.script;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 脚本队列进度：每个脚本的整体状态，以及它在每台设备上的状态
 * <p>
 * 按队列下标记录，同名脚本可以重复入队。
 */
public class ScriptQueueProgress {

    public enum Status {
        PENDING,
        RUNNING,
        COMPLETED,
        FAILED,
        /** 设备在之前的脚本中已失败或被取消 */
        SKIPPED
    }

    private final List<String> names;
    private final List<Status> jobStatus = new ArrayList<>();
    private final List<Map<String, Status>> deviceStatus = new ArrayList<>();

    public ScriptQueueProgress(List<ScriptJob> queue) {
        this.names = queue.stream().map(ScriptJob::getName).toList();
        for (int i = 0; i < names.size(); i++) {
            jobStatus.add(Status.PENDING);
            deviceStatus.add(new LinkedHashMap<>());
        }
    }

    /**
     * 扫描结束后登记参与执行的设备，全部置为 PENDING
     */
    public synchronized void enroll(Collection<String> deviceIds) {
        for (Map<String, Status> perDevice : deviceStatus) {
            perDevice.clear();
            deviceIds.forEach(id -> perDevice.put(id, Status.PENDING));
        }
    }

    public synchronized void markJob(int index, Status status) {
        jobStatus.set(index, status);
    }

    public synchronized void markDevice(int index, String deviceId, Status status) {
        deviceStatus.get(index).put(deviceId, status);
    }

    public int size() {
        return names.size();
    }

    public String name(int index) {
        return names.get(index);
    }

    public synchronized Status jobStatus(int index) {
        return jobStatus.get(index);
    }

    public synchronized Map<String, Status> deviceProgress(int index) {
        return Map.copyOf(deviceStatus.get(index));
    }
}
