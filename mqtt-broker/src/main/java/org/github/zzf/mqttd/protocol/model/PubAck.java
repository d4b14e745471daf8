package org.github.zzf.mqttd.protocol.model;

import io.netty.buffer.ByteBuf;

/**
 * response to a QoS 1 PUBLISH
 */
public class PubAck extends AbstractPublishAck {

    PubAck(byte byte0, ByteBuf buf, MqttVersion version) {
        super(byte0, buf, version);
    }

    public PubAck(MqttVersion version, int packetIdentifier, int reasonCode, Properties properties) {
        super(PUBACK, version, packetIdentifier, reasonCode, properties);
    }

    public static PubAck from(MqttVersion version, int packetIdentifier) {
        return from(version, packetIdentifier, ReasonCode.SUCCESS);
    }

    public static PubAck from(MqttVersion version, int packetIdentifier, int reasonCode) {
        return new PubAck(version, packetIdentifier, reasonCode, emptyProperties(version));
    }

}
