package org.github.zzf.mqttd.protocol;

/**
 * A packet that can not be decoded. Fatal to the connection.
 *
 * @author zhanfeng.zhang@icloud.com
 * @date 2026-10-19
 */
public class MalformedPacketException extends RuntimeException {

    public MalformedPacketException(String message) {
        super(message);
    }

    public MalformedPacketException(String message, Throwable cause) {
        super(message, cause);
    }

}
