package org.github.zzf.mqttd.protocol.model;

import static com.google.common.base.Preconditions.checkArgument;

import io.netty.buffer.ByteBuf;
import java.util.Objects;

/**
 * PUBACK / PUBREC / PUBREL / PUBCOMP share the same layout: Packet Identifier, then (5.0 only) an optional
 * Reason Code and optional Properties.
 */
public abstract class AbstractPublishAck extends ControlPacket {

    private final int packetIdentifier;
    private final int reasonCode;
    private final Properties properties;

    protected AbstractPublishAck(byte byte0, ByteBuf buf, MqttVersion version) {
        super(byte0, version);
        this.packetIdentifier = buf.readUnsignedShort();
        packetIdentifierValidate(packetIdentifier);
        if (version.isV5()) {
            // The Reason Code and Property Length can be omitted if the Reason Code is 0x00 (Success)
            // and there are no Properties
            this.reasonCode = buf.isReadable() ? buf.readUnsignedByte() : ReasonCode.SUCCESS;
            this.properties = buf.isReadable() ? Properties.decode(buf, type(byte0)) : Properties.empty();
        }
        else {
            this.reasonCode = ReasonCode.SUCCESS;
            this.properties = null;
        }
    }

    protected AbstractPublishAck(byte byte0, MqttVersion version, int packetIdentifier, int reasonCode,
            Properties properties) {
        super(byte0, version);
        packetIdentifierValidate(packetIdentifier);
        checkArgument(version.isV5() || reasonCode == ReasonCode.SUCCESS, "%s has no Reason Code", version);
        checkArgument(reasonCode >= 0 && reasonCode <= 0xFF, "reasonCode");
        this.packetIdentifier = packetIdentifier;
        this.reasonCode = reasonCode;
        this.properties = propertiesValidate(version, properties);
    }

    protected static Properties emptyProperties(MqttVersion version) {
        return version.isV5() ? Properties.empty() : null;
    }

    @Override
    protected void writeVariableHeaderAndPayload(ByteBuf buf) {
        buf.writeShort(packetIdentifier);
        if (!version.isV5()) {
            return;
        }
        if (reasonCode == ReasonCode.SUCCESS && properties.isEmpty()) {
            return;
        }
        buf.writeByte(reasonCode);
        if (!properties.isEmpty()) {
            properties.encode(buf);
        }
    }

    public int packetIdentifier() {
        return packetIdentifier;
    }

    public int reasonCode() {
        return reasonCode;
    }

    public Properties properties() {
        return properties;
    }

    public String pId() {
        return hexPId(packetIdentifier);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        AbstractPublishAck that = (AbstractPublishAck) o;
        return version == that.version
            && packetIdentifier == that.packetIdentifier
            && reasonCode == that.reasonCode
            && Objects.equals(properties, that.properties);
    }

    @Override
    public int hashCode() {
        return Objects.hash(getClass(), version, packetIdentifier, reasonCode);
    }

    @Override
    public String toString() {
        final StringBuilder sb = new StringBuilder("{");
        sb.append("\"packet\":\"").append(this.getClass().getSimpleName().toUpperCase()).append('\"').append(',');
        sb.append("\"version\":\"").append(version).append("\",");
        sb.append("\"packetIdentifier\":\"").append(pId()).append("\",");
        if (version.isV5()) {
            sb.append("\"reasonCode\":\"").append(ReasonCode.hex(reasonCode)).append("\",");
            sb.append("\"properties\":").append(properties).append(',');
        }
        return sb.replace(sb.length() - 1, sb.length(), "}").toString();
    }

}
