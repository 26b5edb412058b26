package xyz.firestige.fleet.exception;

/**
 * 特权操作缺少管理员校验或本次确认
 */
public class AuthorizationRequiredException extends FleetException {

    public AuthorizationRequiredException(String message) {
        super("ERR_NOT_AUTHORIZED", message, ErrorType.AUTHORIZATION_ERROR);
    }
}
