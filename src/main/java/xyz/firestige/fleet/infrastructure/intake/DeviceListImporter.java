package xyz.firestige.fleet.infrastructure.intake;

import com.fasterxml.jackson.databind.MappingIterator;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvParser;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import xyz.firestige.fleet.domain.campaign.CampaignState;
import xyz.firestige.fleet.domain.campaign.LogLevel;
import xyz.firestige.fleet.domain.device.Device;
import xyz.firestige.fleet.domain.device.DeviceIdentifiers;
import xyz.firestige.fleet.exception.DeviceIntakeException;

import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * 设备清单 CSV 导入
 * <p>
 * 表头按子串启发式匹配（忽略大小写）；逐行校验，非法行记录原因后跳过，合法行照常载入。
 * 缺少主机名列或 MAC 列时整个文件拒绝导入。
 */
public class DeviceListImporter {

    private static final Logger log = LoggerFactory.getLogger(DeviceListImporter.class);

    private static final List<String> HOSTNAME_HINTS =
            List.of("hostname", "computername", "devicename", "computer", "name", "device");

    private final CsvMapper csvMapper;
    private final CampaignState state;

    public DeviceListImporter(CampaignState state) {
        this.state = state;
        this.csvMapper = new CsvMapper();
        this.csvMapper.enable(CsvParser.Feature.WRAP_AS_ARRAY);
        this.csvMapper.enable(CsvParser.Feature.SKIP_EMPTY_LINES);
    }

    public ImportResult importFrom(Path file) {
        try (Reader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
            return importFrom(reader, file.getFileName().toString());
        } catch (IOException e) {
            throw new DeviceIntakeException("读取设备清单失败: " + file, e);
        }
    }

    /**
     * @throws DeviceIntakeException 缺少必要列、无法解析，或没有任何合法设备
     */
    public ImportResult importFrom(Reader reader, String sourceName) {
        List<String[]> rows = readRows(reader, sourceName);
        if (rows.isEmpty()) {
            state.log(LogLevel.ERROR, "Could not detect header row in CSV.");
            throw new DeviceIntakeException("CSV 没有表头: " + sourceName);
        }

        String[] header = rows.get(0);
        int hostnameCol = findHostnameColumn(header);
        int macCol = findMacColumn(header);
        if (hostnameCol < 0 || macCol < 0) {
            state.log(LogLevel.ERROR, "CSV must contain columns for 'Hostname' and 'MAC Address'.");
            throw new DeviceIntakeException("CSV 缺少主机名列或 MAC 列: " + sourceName);
        }

        List<Device> devices = new ArrayList<>();
        List<RowRejection> rejections = new ArrayList<>();
        List<String> warnings = new ArrayList<>();
        Set<String> seenHostnames = new HashSet<>();
        Set<String> seenMacs = new HashSet<>();

        for (int i = 1; i < rows.size(); i++) {
            int rowNumber = i + 1;
            String[] row = rows.get(i);
            String rawHostname = cell(row, hostnameCol).trim();
            String rawMac = cell(row, macCol);
            if (rawHostname.isEmpty() && rawMac.isBlank()) {
                continue;
            }

            String hostname = DeviceIdentifiers.sanitizeHostname(rawHostname);
            String mac = DeviceIdentifiers.normalizeMac(rawMac);
            if (hostname.isEmpty()) {
                reject(rejections, rowNumber, rawHostname, String.format("Skipping row %d: Hostname is empty.", rowNumber));
                continue;
            }
            if (!rawHostname.equals(hostname)) {
                String warning = String.format("Sanitized hostname in row %d: \"%s\" → \"%s\".", rowNumber, rawHostname, hostname);
                warnings.add(warning);
                state.log(LogLevel.WARNING, warning);
            }
            if (!DeviceIdentifiers.isValidMac(mac)) {
                reject(rejections, rowNumber, hostname, String.format(
                        "[Validation Skip] Skipping device \"%s\" from row %d. Reason: Invalid MAC address format.",
                        hostname, rowNumber));
                continue;
            }
            if (!seenHostnames.add(DeviceIdentifiers.hostnameKey(hostname))) {
                reject(rejections, rowNumber, hostname, String.format(
                        "[Validation Skip] Duplicate hostname \"%s\" detected in row %d.", hostname, rowNumber));
                continue;
            }
            if (!seenMacs.add(mac)) {
                reject(rejections, rowNumber, hostname, String.format(
                        "[Validation Skip] Duplicate MAC address \"%s\" detected in row %d.", mac, rowNumber));
                continue;
            }
            devices.add(new Device("device-" + (devices.size() + 1), hostname, mac));
        }

        if (!rejections.isEmpty()) {
            state.log(LogLevel.INFO, String.format("Skipped %d invalid or incomplete entr%s from CSV. See logs for details.",
                    rejections.size(), rejections.size() > 1 ? "ies" : "y"));
        }
        if (devices.isEmpty()) {
            state.log(LogLevel.ERROR, "No valid devices found in the CSV file to process.");
            throw new DeviceIntakeException("CSV 中没有合法设备: " + sourceName);
        }
        state.log(LogLevel.INFO, String.format("Validated and loaded %d devices from %s.", devices.size(), sourceName));
        log.info("[DeviceListImporter] 导入完成: {}, loaded: {}, rejected: {}", sourceName, devices.size(), rejections.size());
        return new ImportResult(devices, rejections, warnings);
    }

    private List<String[]> readRows(Reader reader, String sourceName) {
        List<String[]> rows = new ArrayList<>();
        try (MappingIterator<String[]> it = csvMapper.readerFor(String[].class).readValues(reader)) {
            while (it.hasNextValue()) {
                rows.add(it.nextValue());
            }
        } catch (IOException | RuntimeException e) {
            throw new DeviceIntakeException("CSV 解析失败: " + sourceName, e);
        }
        return rows;
    }

    private void reject(List<RowRejection> rejections, int rowNumber, String hostname, String reason) {
        rejections.add(new RowRejection(rowNumber, hostname, reason));
        state.log(LogLevel.WARNING, reason);
    }

    /**
     * 按提示词优先级匹配：先找 hostname 列，再依次退到 name / device；MAC 列不参与匹配
     */
    static int findHostnameColumn(String[] header) {
        for (String hint : HOSTNAME_HINTS) {
            for (int i = 0; i < header.length; i++) {
                String h = header[i].toLowerCase(Locale.ROOT);
                if (h.contains(hint) && !isMacHeader(h)) {
                    return i;
                }
            }
        }
        return -1;
    }

    static int findMacColumn(String[] header) {
        for (int i = 0; i < header.length; i++) {
            if (isMacHeader(header[i].toLowerCase(Locale.ROOT))) {
                return i;
            }
        }
        return -1;
    }

    private static boolean isMacHeader(String lowerCaseHeader) {
        return lowerCaseHeader.replaceAll("[\\s_-]", "").contains("macaddress") || lowerCaseHeader.trim().equals("mac");
    }

    private static String cell(String[] row, int index) {
        return index < row.length && row[index] != null ? row[index] : "";
    }
}
