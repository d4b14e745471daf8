package org.github.zzf.mqttd.protocol.model;

import static com.google.common.base.Preconditions.checkArgument;

import io.netty.buffer.ByteBuf;
import java.util.Objects;

/**
 * 3.1.1: Client to Server only, no variable header. 5.0: sent by either side with an optional Reason Code and
 * optional Properties
 */
public class Disconnect extends ControlPacket {

    private final int reasonCode;
    private final Properties properties;

    Disconnect(byte byte0, ByteBuf buf, MqttVersion version) {
        super(byte0, version);
        if (version.isV5()) {
            // If the Remaining Length is less than 1 the value of 0x00 (Normal disconnection) is used
            this.reasonCode = buf.isReadable() ? buf.readUnsignedByte() : ReasonCode.NORMAL_DISCONNECTION;
            this.properties = buf.isReadable() ? Properties.decode(buf, DISCONNECT) : Properties.empty();
        }
        else {
            this.reasonCode = ReasonCode.NORMAL_DISCONNECTION;
            this.properties = null;
        }
    }

    public Disconnect(MqttVersion version, int reasonCode, Properties properties) {
        super(DISCONNECT, version);
        checkArgument(version.isV5() || reasonCode == ReasonCode.NORMAL_DISCONNECTION, "%s has no Reason Code", version);
        checkArgument(reasonCode >= 0 && reasonCode <= 0xFF, "reasonCode");
        this.reasonCode = reasonCode;
        this.properties = propertiesValidate(version, properties);
    }

    public static Disconnect from(MqttVersion version) {
        return from(version, ReasonCode.NORMAL_DISCONNECTION);
    }

    public static Disconnect from(MqttVersion version, int reasonCode) {
        return new Disconnect(version, reasonCode, version.isV5() ? Properties.empty() : null);
    }

    @Override
    protected void writeVariableHeaderAndPayload(ByteBuf buf) {
        if (!version.isV5()) {
            return;
        }
        if (reasonCode == ReasonCode.NORMAL_DISCONNECTION && properties.isEmpty()) {
            return;
        }
        buf.writeByte(reasonCode);
        if (!properties.isEmpty()) {
            properties.encode(buf);
        }
    }

    public int reasonCode() {
        return reasonCode;
    }

    public Properties properties() {
        return properties;
    }

    /**
     * @return null if absent
     */
    public Long sessionExpiryInterval() {
        return properties == null ? null : properties.longValue(PropertyId.SESSION_EXPIRY_INTERVAL);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        Disconnect that = (Disconnect) o;
        return version == that.version
            && reasonCode == that.reasonCode
            && Objects.equals(properties, that.properties);
    }

    @Override
    public int hashCode() {
        return Objects.hash(version, reasonCode);
    }

    @Override
    public String toString() {
        final StringBuilder sb = new StringBuilder("{");
        sb.append("\"packet\":\"DISCONNECT\",");
        sb.append("\"version\":\"").append(version).append("\",");
        if (version.isV5()) {
            sb.append("\"reasonCode\":\"").append(ReasonCode.hex(reasonCode)).append("\",");
            sb.append("\"properties\":").append(properties).append(',');
        }
        return sb.replace(sb.length() - 1, sb.length(), "}").toString();
    }

}
