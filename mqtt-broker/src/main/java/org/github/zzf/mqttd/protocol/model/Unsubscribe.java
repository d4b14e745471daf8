package org.github.zzf.mqttd.protocol.model;

import static com.google.common.base.Preconditions.checkArgument;

import io.netty.buffer.ByteBuf;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import org.github.zzf.mqttd.protocol.MalformedPacketException;

public class Unsubscribe extends ControlPacket {

    public static final byte _0_BYTE = (byte) 0xA2;

    private final int packetIdentifier;
    private final Properties properties;
    private final List<String> topicFilters;

    Unsubscribe(byte byte0, ByteBuf buf, MqttVersion version) {
        super(byte0, version);
        this.packetIdentifier = buf.readUnsignedShort();
        packetIdentifierValidate(packetIdentifier);
        this.properties = version.isV5() ? Properties.decode(buf, UNSUBSCRIBE) : null;
        this.topicFilters = new ArrayList<>();
        while (buf.isReadable()) {
            topicFilters.add(readUtf8String(buf));
        }
        // The Payload of an UNSUBSCRIBE packet MUST contain at least one Topic Filter
        if (topicFilters.isEmpty()) {
            throw new MalformedPacketException("UNSUBSCRIBE without Topic Filter");
        }
    }

    public Unsubscribe(MqttVersion version, int packetIdentifier, Properties properties, List<String> topicFilters) {
        super(_0_BYTE, version);
        packetIdentifierValidate(packetIdentifier);
        checkArgument(!topicFilters.isEmpty(), "UNSUBSCRIBE without Topic Filter");
        this.packetIdentifier = packetIdentifier;
        this.properties = propertiesValidate(version, properties);
        this.topicFilters = List.copyOf(topicFilters);
    }

    public static Unsubscribe from(MqttVersion version, int packetIdentifier, List<String> topicFilters) {
        return new Unsubscribe(version, packetIdentifier, version.isV5() ? Properties.empty() : null, topicFilters);
    }

    @Override
    protected void writeVariableHeaderAndPayload(ByteBuf buf) {
        buf.writeShort(packetIdentifier);
        if (version.isV5()) {
            properties.encode(buf);
        }
        for (String tf : topicFilters) {
            writeUtf8String(buf, tf);
        }
    }

    public int packetIdentifier() {
        return packetIdentifier;
    }

    public Properties properties() {
        return properties;
    }

    public List<String> topicFilters() {
        return topicFilters;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        Unsubscribe that = (Unsubscribe) o;
        return version == that.version
            && packetIdentifier == that.packetIdentifier
            && Objects.equals(properties, that.properties)
            && topicFilters.equals(that.topicFilters);
    }

    @Override
    public int hashCode() {
        return Objects.hash(version, packetIdentifier, topicFilters);
    }

    @Override
    public String toString() {
        final StringBuilder sb = new StringBuilder("{");
        sb.append("\"packet\":\"UNSUBSCRIBE\",");
        sb.append("\"version\":\"").append(version).append("\",");
        sb.append("\"packetIdentifier\":\"").append(hexPId(packetIdentifier)).append("\",");
        sb.append("\"topicFilters\":").append(topicFilters).append(',');
        return sb.replace(sb.length() - 1, sb.length(), "}").toString();
    }

}
