package org.github.zzf.mqttd.protocol.model;

import static com.google.common.base.Preconditions.checkArgument;

import io.netty.buffer.ByteBuf;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import org.github.zzf.mqttd.protocol.MalformedPacketException;

public class SubAck extends ControlPacket {

    private final int packetIdentifier;
    private final Properties properties;
    private final List<Integer> reasonCodes;

    SubAck(byte byte0, ByteBuf buf, MqttVersion version) {
        super(byte0, version);
        this.packetIdentifier = buf.readUnsignedShort();
        this.properties = version.isV5() ? Properties.decode(buf, SUBACK) : null;
        this.reasonCodes = new ArrayList<>(buf.readableBytes());
        while (buf.isReadable()) {
            reasonCodes.add((int) buf.readUnsignedByte());
        }
        if (reasonCodes.isEmpty()) {
            throw new MalformedPacketException("SUBACK without Reason Code");
        }
    }

    public SubAck(MqttVersion version, int packetIdentifier, Properties properties, List<Integer> reasonCodes) {
        super(SUBACK, version);
        packetIdentifierValidate(packetIdentifier);
        checkArgument(!reasonCodes.isEmpty(), "SUBACK without Reason Code");
        this.packetIdentifier = packetIdentifier;
        this.properties = propertiesValidate(version, properties);
        this.reasonCodes = List.copyOf(reasonCodes);
    }

    public static SubAck from(MqttVersion version, int packetIdentifier, List<Integer> reasonCodes) {
        return new SubAck(version, packetIdentifier, version.isV5() ? Properties.empty() : null, reasonCodes);
    }

    @Override
    protected void writeVariableHeaderAndPayload(ByteBuf buf) {
        buf.writeShort(packetIdentifier);
        if (version.isV5()) {
            properties.encode(buf);
        }
        for (Integer rc : reasonCodes) {
            buf.writeByte(rc);
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
        SubAck that = (SubAck) o;
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
        sb.append("\"packet\":\"SUBACK\",");
        sb.append("\"version\":\"").append(version).append("\",");
        sb.append("\"packetIdentifier\":\"").append(hexPId(packetIdentifier)).append("\",");
        sb.append("\"reasonCodes\":").append(reasonCodes.stream().map(ReasonCode::hex).toList()).append(',');
        return sb.replace(sb.length() - 1, sb.length(), "}").toString();
    }

}
