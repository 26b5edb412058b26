package xyz.firestige.fleet.support.redaction;

import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * 日志脱敏：所有写入活动日志或抛给操作员的文本都先经过这里
 * <ul>
 *   <li>{@code password: xxx} / {@code token=xxx} 一类键值对，值替换为 [REDACTED]</li>
 *   <li>Bearer 凭据</li>
 *   <li>32 位以上的不透明串（疑似密钥）</li>
 * </ul>
 */
public final class LogRedactor {

    static final String MASK = "[REDACTED]";

    private static final Pattern KEY_VALUE = Pattern.compile(
            "\\b(password|passwd|pwd|token|secret|api[_-]?key|credential)\\s*[:=]\\s*\\S+",
            Pattern.CASE_INSENSITIVE);
    private static final Pattern BEARER = Pattern.compile("\\b(Bearer)\\s+\\S+", Pattern.CASE_INSENSITIVE);
    private static final Pattern OPAQUE = Pattern.compile("(?<![A-Za-z0-9+/=_])[A-Za-z0-9+/=_]{32,}(?![A-Za-z0-9+/=_])");

    private LogRedactor() {
    }

    public static String redact(String text) {
        if (text == null || text.isEmpty()) {
            return text;
        }
        Matcher kv = KEY_VALUE.matcher(text);
        StringBuilder sb = new StringBuilder();
        while (kv.find()) {
            kv.appendReplacement(sb, Matcher.quoteReplacement(kv.group(1).toLowerCase(Locale.ROOT) + ": " + MASK));
        }
        kv.appendTail(sb);
        String out = BEARER.matcher(sb.toString()).replaceAll("$1 " + Matcher.quoteReplacement(MASK));
        return OPAQUE.matcher(out).replaceAll(Matcher.quoteReplacement(MASK));
    }
}
