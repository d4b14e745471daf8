package org.github.zzf.mqttd.protocol.model;

import io.netty.buffer.ByteBuf;

public class PingResp extends ControlPacket {

    PingResp(byte byte0, ByteBuf buf, MqttVersion version) {
        super(byte0, version);
    }

    public PingResp(MqttVersion version) {
        super(PINGRESP, version);
    }

    @Override
    protected void writeVariableHeaderAndPayload(ByteBuf buf) {
        // no variable header and no payload
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof PingResp that && version == that.version;
    }

    @Override
    public int hashCode() {
        return PINGRESP;
    }

}
