package xyz.firestige.fleet.domain.campaign;

import java.time.LocalDateTime;

/**
 * 活动日志条目，message 在写入前已脱敏
 */
public record LogEntry(LocalDateTime timestamp, LogLevel level, String message) {
}
