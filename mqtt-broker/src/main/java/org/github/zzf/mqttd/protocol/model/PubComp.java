package org.github.zzf.mqttd.protocol.model;

import io.netty.buffer.ByteBuf;

/**
 * response to a PUBREL. It is the fourth and final packet of the QoS 2 protocol exchange
 */
public class PubComp extends AbstractPublishAck {

    PubComp(byte byte0, ByteBuf buf, MqttVersion version) {
        super(byte0, buf, version);
    }

    public PubComp(MqttVersion version, int packetIdentifier, int reasonCode, Properties properties) {
        super(PUBCOMP, version, packetIdentifier, reasonCode, properties);
    }

    public static PubComp from(MqttVersion version, int packetIdentifier) {
        return from(version, packetIdentifier, ReasonCode.SUCCESS);
    }

    public static PubComp from(MqttVersion version, int packetIdentifier, int reasonCode) {
        return new PubComp(version, packetIdentifier, reasonCode, emptyProperties(version));
    }

}
