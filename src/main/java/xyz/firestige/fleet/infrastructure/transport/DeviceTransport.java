package xyz.firestige.fleet.infrastructure.transport;

import xyz.firestige.fleet.domain.device.Device;
import xyz.firestige.fleet.domain.device.DeviceMetadata;
import xyz.firestige.fleet.domain.device.UpdateComponent;

/**
 * 与终端设备通信的最小契约
 * <p>
 * 每个方法都可能阻塞（网络等待），编排层只在调用前后检查取消，不会打断进行中的调用。
 * 通信失败抛出 {@link TransportException}。
 */
public interface DeviceTransport {

    /**
     * 发送 Wake-on-LAN 魔术包（单播到设备 MAC）
     */
    void wake(Device device);

    /**
     * 尝试建立一次连接
     *
     * @param attempt 从 1 开始的尝试序号
     * @return 设备是否响应
     */
    boolean connect(Device device, int attempt);

    DeviceMetadata queryMetadata(Device device);

    String queryVersion(Device device, UpdateComponent component);

    /**
     * 应用单个组件更新
     *
     * @return 是否成功
     */
    boolean applyUpdate(Device device, UpdateComponent component, String targetVersion);

    /**
     * 重启并等待设备恢复
     */
    void reboot(Device device);

    /**
     * 在设备上执行一个已审查的脚本
     *
     * @return 脚本是否成功退出
     */
    boolean executeScript(Device device, String scriptName, String content);
}
