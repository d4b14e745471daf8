package org.github.zzf.mqttd.protocol.model;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

import io.netty.buffer.ByteBuf;
import io.netty.buffer.ByteBufUtil;
import io.netty.buffer.Unpooled;
import java.util.Objects;
import lombok.Builder;
import org.github.zzf.mqttd.protocol.MalformedPacketException;

/**
 * @author zhanfeng.zhang@icloud.com
 * @date 2026-10-19
 */
public class Publish extends ControlPacket {

    public static final int AT_MOST_ONCE = 0;
    public static final int AT_LEAST_ONCE = 1;
    public static final int EXACTLY_ONCE = 2;
    public static final int NO_PACKET_IDENTIFIER = 0;

    private final String topicName;
    private final int packetIdentifier;
    private final Properties properties;
    private final ByteBuf payload;

    Publish(byte byte0, ByteBuf buf, MqttVersion version) {
        super(byte0, version);
        // A PUBLISH Packet MUST NOT have both QoS bits set to 1
        if (qos() == 3) {
            throw new MalformedPacketException("PUBLISH QoS is 3");
        }
        // The DUP flag MUST be set to 0 for all QoS 0 messages
        if (qos() == AT_MOST_ONCE && dup()) {
            throw new MalformedPacketException("DUP flag set on a QoS 0 PUBLISH");
        }
        this.topicName = readUtf8String(buf);
        if (needAck()) {
            this.packetIdentifier = buf.readUnsignedShort();
            packetIdentifierValidate(packetIdentifier);
        }
        else {
            this.packetIdentifier = NO_PACKET_IDENTIFIER;
        }
        this.properties = version.isV5() ? Properties.decode(buf, PUBLISH) : null;
        // the payload outlives the inbound buffer
        byte[] bytes = new byte[buf.readableBytes()];
        buf.readBytes(bytes);
        this.payload = Unpooled.wrappedBuffer(bytes);
        if (!topicNameValidate()) {
            throw new MalformedPacketException("invalid Topic Name: " + topicName);
        }
    }

    /**
     * outgoing packet
     */
    @Builder
    private Publish(MqttVersion version,
            boolean dup,
            int qos,
            boolean retain,
            String topicName,
            int packetIdentifier,
            Properties properties,
            ByteBuf payload) {
        super(build_0Byte(retain, qos, dup), version);
        checkArgument(qos >= AT_MOST_ONCE && qos <= EXACTLY_ONCE, "qos: %s", qos);
        checkArgument(!(qos == AT_MOST_ONCE && dup), "DUP flag set on a QoS 0 PUBLISH");
        if (needAck(qos)) {
            packetIdentifierValidate(packetIdentifier);
        }
        else {
            checkArgument(packetIdentifier == NO_PACKET_IDENTIFIER, "QoS 0 PUBLISH with a Packet Identifier");
        }
        this.topicName = checkNotNull(topicName, "topicName");
        this.packetIdentifier = packetIdentifier;
        this.properties = propertiesValidate(version, properties);
        this.payload = payload == null ? Unpooled.EMPTY_BUFFER : payload;
        checkArgument(topicNameValidate(), "invalid Topic Name: %s", topicName);
    }

    public static Publish outgoing(MqttVersion version, int qos, String topicName, int packetIdentifier,
            ByteBuf payload, Properties properties) {
        return Publish.builder()
            .version(version)
            .qos(qos)
            .topicName(topicName)
            .packetIdentifier(packetIdentifier)
            .payload(payload)
            .properties(properties)
            .build();
    }

    /**
     * the same message under another Topic Name / Properties, used when a Topic Alias is applied or resolved
     */
    public Publish copy(String topicName, Properties properties) {
        return Publish.builder()
            .version(version)
            .dup(dup())
            .qos(qos())
            .retain(retain())
            .topicName(topicName)
            .packetIdentifier(packetIdentifier)
            .properties(properties)
            .payload(payload)
            .build();
    }

    @Override
    public ByteBuf toByteBuf() {
        ByteBuf varHeader = Unpooled.buffer();
        writeVariableHeader(varHeader);
        ByteBuf fixedHeader = Unpooled.buffer(_0_BYTE_LENGTH + 4);
        fixedHeader.writeByte(byte0);
        writeVariableByteInteger(fixedHeader, varHeader.readableBytes() + payload.readableBytes());
        // core: zero-copy. the payload may be shared by many outgoing Publish
        return Unpooled.wrappedBuffer(fixedHeader, varHeader, payload.retainedDuplicate());
    }

    @Override
    protected void writeVariableHeaderAndPayload(ByteBuf buf) {
        writeVariableHeader(buf);
        buf.writeBytes(payload, payload.readerIndex(), payload.readableBytes());
    }

    private void writeVariableHeader(ByteBuf buf) {
        writeUtf8String(buf, topicName);
        if (needAck()) {
            buf.writeShort(packetIdentifier);
        }
        if (version.isV5()) {
            properties.encode(buf);
        }
    }

    /**
     * whether the qos need receiver ack
     *
     * @return true / false;
     */
    public static boolean needAck(int qos) {
        return qos == AT_LEAST_ONCE || qos == EXACTLY_ONCE;
    }

    public boolean needAck() {
        return needAck(qos());
    }

    static byte build_0Byte(boolean retain, int qos, boolean dup) {
        byte _0Byte = PUBLISH;
        if (retain) {
            _0Byte |= 0x01;
        }
        _0Byte |= (byte) (qos << 1);
        if (dup) {
            _0Byte |= 0x08;
        }
        return _0Byte;
    }

    /**
     * The Topic Name in the PUBLISH Packet MUST NOT contain wildcard characters. A 5.0 PUBLISH may carry a
     * zero length Topic Name together with a Topic Alias
     */
    private boolean topicNameValidate() {
        if (topicName.isEmpty()) {
            return version.isV5() && properties.contains(PropertyId.TOPIC_ALIAS);
        }
        return topicNameValidate(topicName);
    }

    public static boolean topicNameValidate(String topicName) {
        if (topicName == null || topicName.isEmpty()) {
            return false;
        }
        return topicName.indexOf('#') == -1 && topicName.indexOf('+') == -1;
    }

    public boolean dup() {
        return (byte0 & 0x08) != 0;
    }

    public int qos() {
        return (this.byte0 & 0x06) >> 1;
    }

    public boolean retain() {
        return (byte0 & 0x01) != 0;
    }

    public boolean atMostOnce() {
        return qos() == AT_MOST_ONCE;
    }

    public boolean atLeastOnce() {
        return qos() == AT_LEAST_ONCE;
    }

    public boolean exactlyOnce() {
        return qos() == EXACTLY_ONCE;
    }

    public String topicName() {
        return this.topicName;
    }

    public int packetIdentifier() {
        return this.packetIdentifier;
    }

    public Properties properties() {
        return properties;
    }

    public ByteBuf payload() {
        return this.payload;
    }

    /**
     * @return null if absent
     */
    public Integer topicAlias() {
        return properties == null ? null : properties.intValue(PropertyId.TOPIC_ALIAS);
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
        Publish that = (Publish) o;
        return version == that.version
            && byte0 == that.byte0
            && packetIdentifier == that.packetIdentifier
            && topicName.equals(that.topicName)
            && Objects.equals(properties, that.properties)
            && ByteBufUtil.equals(payload, that.payload);
    }

    @Override
    public int hashCode() {
        return Objects.hash(version, byte0, topicName, packetIdentifier);
    }

    @Override
    public String toString() {
        final StringBuilder sb = new StringBuilder("{");
        sb.append("\"packet\":\"PUBLISH\",");
        sb.append("\"version\":\"").append(version).append("\",");
        sb.append("\"packetIdentifier\":\"").append(pId()).append("\",");
        sb.append("\"topicName\":\"").append(topicName).append('\"').append(',');
        sb.append("\"qos\":").append(qos()).append(",");
        sb.append("\"dup\":").append(dup()).append(",");
        sb.append("\"retain\":").append(retain()).append(",");
        if (properties != null) {
            sb.append("\"properties\":").append(properties).append(',');
        }
        sb.append("\"payload\":").append(payload.readableBytes()).append(',');
        return sb.replace(sb.length() - 1, sb.length(), "}").toString();
    }

}
