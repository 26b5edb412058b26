package xyz.firestige.fleet.exception;

import java.util.List;

/**
 * 脚本包含 BLOCKED 级别的模式，或尚未经过安全审查
 */
public class ScriptRejectedException extends FleetException {

    private final List<String> blockedPatterns;

    public ScriptRejectedException(String message, List<String> blockedPatterns) {
        super("ERR_SCRIPT_REJECTED", message, ErrorType.SCRIPT_REJECTED);
        this.blockedPatterns = List.copyOf(blockedPatterns);
        addContext("blockedPatterns", this.blockedPatterns.size());
    }

    public List<String> getBlockedPatterns() {
        return blockedPatterns;
    }
}
