package org.github.zzf.mqttd.protocol;

/**
 * CONNECT carried a protocol name / level the Server does not speak.
 * <p>The Server MUST respond to the CONNECT Packet with a CONNACK return code 0x01 (unacceptable protocol
 * level) and then disconnect the Client</p>
 */
public class UnsupportedProtocolVersionException extends MalformedPacketException {

    private final int protocolLevel;

    public UnsupportedProtocolVersionException(int protocolLevel) {
        super("unsupported protocol level: " + protocolLevel);
        this.protocolLevel = protocolLevel;
    }

    public int protocolLevel() {
        return protocolLevel;
    }

}
