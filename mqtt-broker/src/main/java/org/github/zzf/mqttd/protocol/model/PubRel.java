package org.github.zzf.mqttd.protocol.model;

import io.netty.buffer.ByteBuf;

/**
 * response to a PUBREC. It is the third packet of the QoS 2 protocol exchange
 * <p>Bits 3,2,1 and 0 of the fixed header in the PUBREL Control Packet are reserved and MUST be set to
 * 0,0,1 and 0 respectively</p>
 */
public class PubRel extends AbstractPublishAck {

    public static final byte _0_BYTE = 0x62;

    PubRel(byte byte0, ByteBuf buf, MqttVersion version) {
        super(byte0, buf, version);
    }

    public PubRel(MqttVersion version, int packetIdentifier, int reasonCode, Properties properties) {
        super(_0_BYTE, version, packetIdentifier, reasonCode, properties);
    }

    public static PubRel from(MqttVersion version, int packetIdentifier) {
        return from(version, packetIdentifier, ReasonCode.SUCCESS);
    }

    public static PubRel from(MqttVersion version, int packetIdentifier, int reasonCode) {
        return new PubRel(version, packetIdentifier, reasonCode, emptyProperties(version));
    }

}
