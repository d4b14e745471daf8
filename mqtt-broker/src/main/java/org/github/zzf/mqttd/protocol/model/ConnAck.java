package org.github.zzf.mqttd.protocol.model;

import static com.google.common.base.Preconditions.checkArgument;
import static org.github.zzf.mqttd.protocol.model.MqttVersion.MQTT_3_1_1;

import io.netty.buffer.ByteBuf;
import java.util.Objects;
import org.github.zzf.mqttd.protocol.MalformedPacketException;

/**
 * @author zhanfeng.zhang@icloud.com
 * @date 2026-10-19
 */
public class ConnAck extends ControlPacket {

    private final boolean sessionPresent;
    private final int reasonCode;
    private final Properties properties;

    ConnAck(byte byte0, ByteBuf buf, MqttVersion version) {
        super(byte0, version);
        int flags = buf.readUnsignedByte();
        // Bits 7-1 are reserved and MUST be set to 0
        if ((flags & 0xFE) != 0) {
            throw new MalformedPacketException("CONNACK reserved flags are not zero");
        }
        this.sessionPresent = (flags & 0x01) != 0;
        this.reasonCode = buf.readUnsignedByte();
        this.properties = version.isV5() ? Properties.decode(buf, CONNACK) : null;
    }

    public ConnAck(MqttVersion version, boolean sessionPresent, int reasonCode, Properties properties) {
        super(CONNACK, version);
        // If a Server sends a CONNACK packet containing a non-zero return code it MUST set Session Present to 0
        checkArgument(!(sessionPresent && reasonCode != ReasonCode.SUCCESS), "Session Present with a failure code");
        checkArgument(reasonCode >= 0 && reasonCode <= 0xFF, "reasonCode");
        this.sessionPresent = sessionPresent;
        this.reasonCode = reasonCode;
        this.properties = propertiesValidate(version, properties);
    }

    public static ConnAck accepted(MqttVersion version, boolean sessionPresent, Properties properties) {
        return new ConnAck(version, sessionPresent, ReasonCode.SUCCESS, properties);
    }

    public static ConnAck rejected(MqttVersion version, int reasonCode) {
        return new ConnAck(version, false, reasonCode, version.isV5() ? Properties.empty() : null);
    }

    /**
     * The Server does not know which version the Client speaks, answer in 3.1.1
     */
    public static ConnAck unsupportedProtocolVersion() {
        return new ConnAck(MQTT_3_1_1, false, ReasonCode.UNACCEPTABLE_PROTOCOL_VERSION, null);
    }

    @Override
    protected void writeVariableHeaderAndPayload(ByteBuf buf) {
        buf.writeByte(sessionPresent ? 0x01 : 0x00);
        buf.writeByte(reasonCode);
        if (version.isV5()) {
            properties.encode(buf);
        }
    }

    public boolean sessionPresent() {
        return sessionPresent;
    }

    public int reasonCode() {
        return reasonCode;
    }

    public Properties properties() {
        return properties;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        ConnAck that = (ConnAck) o;
        return version == that.version
            && sessionPresent == that.sessionPresent
            && reasonCode == that.reasonCode
            && Objects.equals(properties, that.properties);
    }

    @Override
    public int hashCode() {
        return Objects.hash(version, sessionPresent, reasonCode);
    }

    @Override
    public String toString() {
        final StringBuilder sb = new StringBuilder("{");
        sb.append("\"packet\":\"CONNACK\",");
        sb.append("\"version\":\"").append(version).append("\",");
        sb.append("\"sessionPresent\":").append(sessionPresent).append(',');
        sb.append("\"reasonCode\":\"").append(ReasonCode.hex(reasonCode)).append("\",");
        if (properties != null) {
            sb.append("\"properties\":").append(properties).append(',');
        }
        return sb.replace(sb.length() - 1, sb.length(), "}").toString();
    }

}
