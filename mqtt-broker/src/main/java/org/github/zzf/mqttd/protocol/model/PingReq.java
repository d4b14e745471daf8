package org.github.zzf.mqttd.protocol.model;

import io.netty.buffer.ByteBuf;

public class PingReq extends ControlPacket {

    PingReq(byte byte0, ByteBuf buf, MqttVersion version) {
        super(byte0, version);
    }

    public PingReq(MqttVersion version) {
        super(PINGREQ, version);
    }

    @Override
    protected void writeVariableHeaderAndPayload(ByteBuf buf) {
        // no variable header and no payload
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof PingReq that && version == that.version;
    }

    @Override
    public int hashCode() {
        return PINGREQ;
    }

}
