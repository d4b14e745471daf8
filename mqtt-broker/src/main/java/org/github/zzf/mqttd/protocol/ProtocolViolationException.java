package org.github.zzf.mqttd.protocol;

import org.github.zzf.mqttd.protocol.model.ReasonCode;

/**
 * A well-formed packet received in the wrong state. Fatal to the connection.
 *
 * @author zhanfeng.zhang@icloud.com
 * @date 2026-10-19
 */
public class ProtocolViolationException extends RuntimeException {

    private final int reasonCode;

    public ProtocolViolationException(String message) {
        this(ReasonCode.PROTOCOL_ERROR, message);
    }

    public ProtocolViolationException(int reasonCode, String message) {
        super(message);
        this.reasonCode = reasonCode;
    }

    /**
     * the reason code of the DISCONNECT sent to a 5.0 Client before the Network Connection is closed
     */
    public int reasonCode() {
        return reasonCode;
    }

}
