package org.github.zzf.mqttd.protocol.model;

import io.netty.buffer.ByteBuf;

/**
 * response to a QoS 2 PUBLISH. It is the second packet of the QoS 2 protocol exchange
 */
public class PubRec extends AbstractPublishAck {

    PubRec(byte byte0, ByteBuf buf, MqttVersion version) {
        super(byte0, buf, version);
    }

    public PubRec(MqttVersion version, int packetIdentifier, int reasonCode, Properties properties) {
        super(PUBREC, version, packetIdentifier, reasonCode, properties);
    }

    public static PubRec from(MqttVersion version, int packetIdentifier) {
        return from(version, packetIdentifier, ReasonCode.SUCCESS);
    }

    public static PubRec from(MqttVersion version, int packetIdentifier, int reasonCode) {
        return new PubRec(version, packetIdentifier, reasonCode, emptyProperties(version));
    }

}
