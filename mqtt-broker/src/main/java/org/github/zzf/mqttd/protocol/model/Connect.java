package org.github.zzf.mqttd.protocol.model;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;
import static org.github.zzf.mqttd.protocol.model.MqttVersion.MQTT_3_1_1;

import io.netty.buffer.ByteBuf;
import java.util.Arrays;
import java.util.Objects;
import lombok.Builder;
import org.github.zzf.mqttd.protocol.MalformedPacketException;

/**
 * @author zhanfeng.zhang@icloud.com
 * @date 2026-10-19
 */
public class Connect extends ControlPacket {

    public static final long SESSION_EXPIRY_NEVER = 0xFFFFFFFFL;
    public static final int DEFAULT_RECEIVE_MAXIMUM = 65535;

    private final boolean cleanStart;
    private final int keepAlive;
    private final Properties properties;
    private final String clientIdentifier;
    private final int willQos;
    private final boolean willRetain;
    private final String willTopic;
    private final byte[] willPayload;
    private final Properties willProperties;
    private final String username;
    private final byte[] password;

    /**
     * incoming packet: the version is read from the Protocol Name and the Protocol Level
     */
    Connect(byte byte0, ByteBuf buf) {
        super(byte0, MqttVersion.of(readUtf8String(buf), buf.readUnsignedByte()));
        int flags = buf.readUnsignedByte();
        // The Server MUST validate that the reserved flag in the CONNECT Control Packet is set to zero and
        // disconnect the Client if it is not zero
        if ((flags & 0x01) != 0) {
            throw new MalformedPacketException("CONNECT reserved flag is not zero");
        }
        this.cleanStart = (flags & 0x02) != 0;
        boolean willFlag = (flags & 0x04) != 0;
        this.willQos = (flags & 0x18) >> 3;
        this.willRetain = (flags & 0x20) != 0;
        boolean passwordFlag = (flags & 0x40) != 0;
        boolean usernameFlag = (flags & 0x80) != 0;
        // If the Will Flag is set to 0, then the Will QoS MUST be set to 0 (0x00) and Will Retain MUST be 0
        if (!willFlag && (willQos != 0 || willRetain)) {
            throw new MalformedPacketException("Will QoS / Will Retain set without Will Flag");
        }
        if (willQos == 3) {
            throw new MalformedPacketException("Will QoS is 3");
        }
        // If the User Name Flag is set to 0, the Password Flag MUST be set to 0 (3.1.1 only)
        if (!version.isV5() && passwordFlag && !usernameFlag) {
            throw new MalformedPacketException("Password Flag set without User Name Flag");
        }
        this.keepAlive = buf.readUnsignedShort();
        this.properties = version.isV5() ? Properties.decode(buf, CONNECT) : null;
        this.clientIdentifier = readUtf8String(buf);
        if (willFlag) {
            this.willProperties = version.isV5() ? Properties.decode(buf, WILL_PROPERTIES) : null;
            this.willTopic = readUtf8String(buf);
            this.willPayload = readBinaryData(buf);
        }
        else {
            this.willProperties = null;
            this.willTopic = null;
            this.willPayload = null;
        }
        this.username = usernameFlag ? readUtf8String(buf) : null;
        this.password = passwordFlag ? readBinaryData(buf) : null;
    }

    /**
     * outgoing packet. Will Message is present if {@code willTopic} is not null
     */
    @Builder
    private Connect(MqttVersion version,
            boolean cleanStart,
            int keepAlive,
            Properties properties,
            String clientIdentifier,
            int willQos,
            boolean willRetain,
            String willTopic,
            byte[] willPayload,
            Properties willProperties,
            String username,
            byte[] password) {
        super(CONNECT, version);
        this.cleanStart = cleanStart;
        this.keepAlive = keepAlive;
        this.properties = propertiesValidate(version, properties);
        this.clientIdentifier = checkNotNull(clientIdentifier, "clientIdentifier");
        this.willQos = willQos;
        this.willRetain = willRetain;
        this.willTopic = willTopic;
        this.willPayload = willPayload;
        this.willProperties = willProperties;
        this.username = username;
        this.password = password;
        checkArgument(keepAlive >= 0 && keepAlive <= 0xFFFF, "keepAlive");
        if (willTopic == null) {
            checkArgument(willQos == 0 && !willRetain && willPayload == null && willProperties == null,
                "Will fields without Will Topic");
        }
        else {
            checkArgument(willQos >= 0 && willQos <= 2, "willQos");
            checkArgument(willPayload != null, "willPayload");
            propertiesValidate(version, willProperties);
        }
        if (!version.isV5()) {
            checkArgument(password == null || username != null, "password without username");
        }
    }

    public static Connect from(String clientIdentifier, int keepAlive) {
        return from(MQTT_3_1_1, clientIdentifier, true, keepAlive);
    }

    public static Connect from(MqttVersion version, String clientIdentifier, boolean cleanStart, int keepAlive) {
        return Connect.builder()
            .version(version)
            .clientIdentifier(clientIdentifier)
            .cleanStart(cleanStart)
            .keepAlive(keepAlive)
            .properties(version.isV5() ? Properties.empty() : null)
            .build();
    }

    @Override
    protected void writeVariableHeaderAndPayload(ByteBuf buf) {
        writeUtf8String(buf, version.protocolName());
        buf.writeByte(version.protocolLevel());
        buf.writeByte(flags());
        buf.writeShort(keepAlive);
        if (version.isV5()) {
            properties.encode(buf);
        }
        writeUtf8String(buf, clientIdentifier);
        if (willFlag()) {
            if (version.isV5()) {
                willProperties.encode(buf);
            }
            writeUtf8String(buf, willTopic);
            writeBinaryData(buf, willPayload);
        }
        if (username != null) {
            writeUtf8String(buf, username);
        }
        if (password != null) {
            writeBinaryData(buf, password);
        }
    }

    private int flags() {
        int flags = 0;
        if (cleanStart) {
            flags |= 0x02;
        }
        if (willFlag()) {
            flags |= 0x04;
            flags |= willQos << 3;
            if (willRetain) {
                flags |= 0x20;
            }
        }
        if (password != null) {
            flags |= 0x40;
        }
        if (username != null) {
            flags |= 0x80;
        }
        return flags;
    }

    public boolean cleanStart() {
        return cleanStart;
    }

    public int keepAlive() {
        return keepAlive;
    }

    public Properties properties() {
        return properties;
    }

    public String clientIdentifier() {
        return clientIdentifier;
    }

    public boolean willFlag() {
        return willTopic != null;
    }

    public int willQos() {
        return willQos;
    }

    public boolean willRetain() {
        return willRetain;
    }

    public String willTopic() {
        return willTopic;
    }

    public byte[] willPayload() {
        return willPayload;
    }

    public Properties willProperties() {
        return willProperties;
    }

    public String username() {
        return username;
    }

    public byte[] password() {
        return password;
    }

    /**
     * If the Session Expiry Interval is absent the value 0 is used
     */
    public long sessionExpiryInterval() {
        Long v = properties == null ? null : properties.longValue(PropertyId.SESSION_EXPIRY_INTERVAL);
        return v == null ? 0 : v;
    }

    /**
     * If the Receive Maximum value is absent then its value defaults to 65,535
     */
    public int receiveMaximum() {
        Integer v = properties == null ? null : properties.intValue(PropertyId.RECEIVE_MAXIMUM);
        return v == null ? DEFAULT_RECEIVE_MAXIMUM : v;
    }

    /**
     * the highest Topic Alias the Client accepts from the Server. 0 if absent
     */
    public int topicAliasMaximum() {
        Integer v = properties == null ? null : properties.intValue(PropertyId.TOPIC_ALIAS_MAXIMUM);
        return v == null ? 0 : v;
    }

    /**
     * @return 0 if the Client imposes no limit
     */
    public long maximumPacketSize() {
        Long v = properties == null ? null : properties.longValue(PropertyId.MAXIMUM_PACKET_SIZE);
        return v == null ? 0 : v;
    }

    public String authenticationMethod() {
        return properties == null ? null : properties.stringValue(PropertyId.AUTHENTICATION_METHOD);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        Connect that = (Connect) o;
        return version == that.version
            && cleanStart == that.cleanStart
            && keepAlive == that.keepAlive
            && willQos == that.willQos
            && willRetain == that.willRetain
            && Objects.equals(properties, that.properties)
            && clientIdentifier.equals(that.clientIdentifier)
            && Objects.equals(willTopic, that.willTopic)
            && Arrays.equals(willPayload, that.willPayload)
            && Objects.equals(willProperties, that.willProperties)
            && Objects.equals(username, that.username)
            && Arrays.equals(password, that.password);
    }

    @Override
    public int hashCode() {
        return Objects.hash(version, clientIdentifier, cleanStart, keepAlive);
    }

    @Override
    public String toString() {
        final StringBuilder sb = new StringBuilder("{");
        sb.append("\"packet\":\"CONNECT\",");
        sb.append("\"version\":\"").append(version).append("\",");
        sb.append("\"clientIdentifier\":\"").append(clientIdentifier).append("\",");
        sb.append("\"cleanStart\":").append(cleanStart).append(',');
        sb.append("\"keepAlive\":").append(keepAlive).append(',');
        if (properties != null) {
            sb.append("\"properties\":").append(properties).append(',');
        }
        if (willTopic != null) {
            sb.append("\"willTopic\":\"").append(willTopic).append("\",");
            sb.append("\"willQos\":").append(willQos).append(',');
            sb.append("\"willRetain\":").append(willRetain).append(',');
        }
        if (username != null) {
            sb.append("\"username\":\"").append(username).append("\",");
        }
        return sb.replace(sb.length() - 1, sb.length(), "}").toString();
    }

}
