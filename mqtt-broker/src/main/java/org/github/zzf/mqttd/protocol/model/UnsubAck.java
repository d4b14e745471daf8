package org.github.zzf.mqttd.protocol.model;

import static com.google.common.base.Preconditions.checkArgument;

import io.netty.buffer.ByteBuf;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import org.github.zzf.mqttd.protocol.MalformedPacketException;

/**
 * 3.1.1 UNSUBACK carries nothing but the Packet Identifier; 5.0 adds Properties and one Reason Code per
 * Topic Filter
 */
public class UnsubAck extends ControlPacket {

    private final int packetIdentifier;
    private final Properties properties;
    private final List<Integer> reasonCodes;

    UnsubAck(byte byte0, ByteBuf buf, MqttVersion version) {
        super(byte0, version);
        this.packetIdentifier = buf.readUnsignedShort();
        if (version.isV5()) {
            this.properties = Properties.decode(buf, UNSUBACK);
            this.reasonCodes = new ArrayList<>(buf.readableBytes());
            while (buf.isReadable()) {
                reasonCodes.add((int) buf.readUnsignedByte());
            }
            if (reasonCodes.isEmpty()) {
                throw new MalformedPacketException("UNSUBACK without Reason Code");
            }
        }
        else {
            this.properties = null;
            this.reasonCodes = List.of();
        }
    }

    public UnsubAck(MqttVersion version, int packetIdentifier, Properties properties, List<Integer> reasonCodes) {
        super(UNSUBACK, version);
        packetIdentifierValidate(packetIdentifier);
        if (version.isV5()) {
            checkArgument(!reasonCodes.isEmpty(), "UNSUBACK without Reason Code");
        }
        else {
            checkArgument(reasonCodes.isEmpty(), "%s UNSUBACK has no Reason Code", version);
        }
        this.packetIdentifier = packetIdentifier;
        this.properties = propertiesValidate(version, properties);
        this.reasonCodes = List.copyOf(reasonCodes);
    }

    public static UnsubAck from(MqttVersion version, int packetIdentifier, List<Integer> reasonCodes) {
        if (version.isV5()) {
            return new UnsubAck(version, packetIdentifier, Properties.empty(), reasonCodes);
        }
        return new UnsubAck(version, packetIdentifier, null, List.of());
    }

    @Override
    protected void writeVariableHeaderAndPayload(ByteBuf buf) {
        buf.writeShort(packetIdentifier);
        if (version.isV5()) {
            properties.encode(buf);
            for (Integer rc : reasonCodes) {
                buf.writeByte(rc);
            }
        }
    }

    public int packetIdentifier() {
        return packetIdentifier;
    }

    public Properties properties() {
        return properties;
    }

    public List<Integer> reasonCodes() {
        return reasonCodes;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        UnsubAck that = (UnsubAck) o;
        return version == that.version
            && packetIdentifier == that.packetIdentifier
            && Objects.equals(properties, that.properties)
            && reasonCodes.equals(that.reasonCodes);
    }

    @Override
    public int hashCode() {
        return Objects.hash(version, packetIdentifier, reasonCodes);
    }

    @Override
    public String toString() {
        final StringBuilder sb = new StringBuilder("{");
        sb.append("\"packet\":\"UNSUBACK\",");
        sb.append("\"version\":\"").append(version).append("\",");
        sb.append("\"packetIdentifier\":\"").append(hexPId(packetIdentifier)).append("\",");
        if (version.isV5()) {
            sb.append("\"reasonCodes\":").append(reasonCodes.stream().map(ReasonCode::hex).toList()).append(',');
        }
        return sb.replace(sb.length() - 1, sb.length(), "}").toString();
    }

}
