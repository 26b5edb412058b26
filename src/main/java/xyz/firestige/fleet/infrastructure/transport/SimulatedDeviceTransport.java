package xyz.firestige.fleet.infrastructure.transport;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import xyz.firestige.fleet.config.FleetProperties;
import xyz.firestige.fleet.domain.device.Device;
import xyz.firestige.fleet.domain.device.DeviceMetadata;
import xyz.firestige.fleet.domain.device.TargetVersions;
import xyz.firestige.fleet.domain.device.UpdateComponent;

import java.util.List;
import java.util.Locale;
import java.util.Random;
import java.util.concurrent.TimeUnit;

/**
 * 模拟传输：随机延迟与随机结果
 * <p>
 * 真实的网络 / 代理实现替换此类即可，编排逻辑不受影响。
 */
public class SimulatedDeviceTransport implements DeviceTransport {

    private static final Logger log = LoggerFactory.getLogger(SimulatedDeviceTransport.class);

    private static final List<Integer> RAM_OPTIONS = List.of(8, 16, 32, 64);
    private static final List<Integer> DISK_OPTIONS = List.of(256, 512, 1024);
    private static final List<String> STALE_OS = List.of("22H2", "21H2");

    private final FleetProperties.Simulation simulation;
    private final TargetVersions targets;
    private final Random random;

    public SimulatedDeviceTransport(FleetProperties.Simulation simulation, TargetVersions targets, Random random) {
        this.simulation = simulation;
        this.targets = targets;
        this.random = random;
    }

    @Override
    public void wake(Device device) {
        log.debug("[SimulatedTransport] WoL 魔术包 → {}", device.getMac());
        pause(simulation.getWakeDelayMillis());
    }

    @Override
    public boolean connect(Device device, int attempt) {
        pause(simulation.getConnectDelayMillis());
        return random.nextDouble() < simulation.getConnectSuccessRate();
    }

    @Override
    public DeviceMetadata queryMetadata(Device device) {
        pause(simulation.getScanDelayMillis());
        return new DeviceMetadata(
                String.format("10.%d.%d.%d", 10 + random.nextInt(20), random.nextInt(256), 1 + random.nextInt(254)),
                "SN" + Long.toString(Math.abs(random.nextLong()), 36).toUpperCase(Locale.ROOT),
                device.getDeviceType().getModel(),
                RAM_OPTIONS.get(random.nextInt(RAM_OPTIONS.size())),
                DISK_OPTIONS.get(random.nextInt(DISK_OPTIONS.size())),
                random.nextDouble() < simulation.getEncryptionRate());
    }

    @Override
    public String queryVersion(Device device, UpdateComponent component) {
        pause(simulation.getScanDelayMillis());
        String target = targets.get(component);
        if (random.nextDouble() < simulation.getUpToDateRate()) {
            return target;
        }
        return staleVersion(component, target);
    }

    @Override
    public boolean applyUpdate(Device device, UpdateComponent component, String targetVersion) {
        pause(simulation.getUpdateDelayMillis());
        return random.nextDouble() < simulation.getUpdateSuccessRate();
    }

    @Override
    public void reboot(Device device) {
        pause(simulation.getRebootDelayMillis());
    }

    @Override
    public boolean executeScript(Device device, String scriptName, String content) {
        log.debug("[SimulatedTransport] {} 执行脚本 {}", device.getHostname(), scriptName);
        pause(simulation.getScriptDelayMillis());
        return random.nextDouble() < simulation.getScriptSuccessRate();
    }

    private String staleVersion(UpdateComponent component, String target) {
        switch (component) {
            case FIRMWARE:
                return "A" + (18 + random.nextInt(6));
            case AGENT: {
                String[] parts = target.split("\\.");
                if (parts.length == 3) {
                    int minor = Integer.parseInt(parts[1]);
                    return parts[0] + "." + random.nextInt(Math.max(1, minor)) + "." + random.nextInt(9);
                }
                return "0.0.0";
            }
            default:
                return STALE_OS.get(random.nextInt(STALE_OS.size()));
        }
    }

    /**
     * 基础延迟上浮 0~50% 抖动
     */
    private void pause(long baseMillis) {
        if (baseMillis <= 0) {
            return;
        }
        long jitter = (long) (baseMillis * 0.5 * random.nextDouble());
        try {
            TimeUnit.MILLISECONDS.sleep(baseMillis + jitter);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new TransportException("设备通信被中断", e);
        }
    }
}
