package xyz.firestige.fleet.exception;

/**
 * 模板文件读写失败
 */
public class TemplateStoreException extends FleetException {

    public TemplateStoreException(String message, Throwable cause) {
        super("ERR_TEMPLATE_STORE", message, ErrorType.SYSTEM_ERROR, cause);
        setRetryable(true);
    }
}
