package xyz.firestige.fleet.infrastructure.transport;

import xyz.firestige.fleet.exception.ErrorType;
import xyz.firestige.fleet.exception.FleetException;

/**
 * 与设备通信失败
 */
public class TransportException extends FleetException {

    public TransportException(String message) {
        super("ERR_TRANSPORT", message, ErrorType.NETWORK_ERROR);
        setRetryable(true);
    }

    public TransportException(String message, Throwable cause) {
        super("ERR_TRANSPORT", message, ErrorType.NETWORK_ERROR, cause);
        setRetryable(true);
    }
}
