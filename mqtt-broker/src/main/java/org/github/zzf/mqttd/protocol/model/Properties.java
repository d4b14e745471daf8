package org.github.zzf.mqttd.protocol.model;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

import io.netty.buffer.ByteBuf;
import io.netty.buffer.Unpooled;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.EnumSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import org.github.zzf.mqttd.protocol.MalformedPacketException;

/**
 * MQTT 5.0 Properties: an ordered list of (identifier, value) pairs.
 * <p>Values are typed by {@link PropertyId.Type}: Byte / Two Byte Integer / Variable Byte Integer as
 * {@link Integer}, Four Byte Integer as {@link Long}, UTF-8 String as {@link String}, Binary Data as
 * {@code byte[]} and UTF-8 String Pair as {@link UserProperty}.</p>
 *
 * @author zhanfeng.zhang@icloud.com
 * @date 2026-10-19
 */
public class Properties {

    private final List<Property> properties;

    public Properties() {
        this.properties = new ArrayList<>(2);
    }

    private Properties(List<Property> properties) {
        this.properties = properties;
    }

    public static Properties empty() {
        return new Properties();
    }

    public Properties add(PropertyId id, Object value) {
        checkNotNull(id, "id");
        checkNotNull(value, "value");
        checkArgument(id.type().valueType().isInstance(value),
            "property %s expects %s, but got %s", id, id.type().valueType().getSimpleName(), value.getClass());
        properties.add(new Property(id, value));
        return this;
    }

    public Properties add(String name, String value) {
        return add(PropertyId.USER_PROPERTY, new UserProperty(name, value));
    }

    /**
     * a copy of this Properties without the given identifiers
     */
    public Properties without(PropertyId... ids) {
        Set<PropertyId> excluded = EnumSet.noneOf(PropertyId.class);
        excluded.addAll(Arrays.asList(ids));
        List<Property> list = new ArrayList<>(properties.size());
        for (Property p : properties) {
            if (!excluded.contains(p.id())) {
                list.add(p);
            }
        }
        return new Properties(list);
    }

    public List<Property> list() {
        return Collections.unmodifiableList(properties);
    }

    public boolean isEmpty() {
        return properties.isEmpty();
    }

    public boolean contains(PropertyId id) {
        return value(id) != null;
    }

    /**
     * @return the value of the first property with the id, null if absent
     */
    public Object value(PropertyId id) {
        for (Property p : properties) {
            if (p.id() == id) {
                return p.value();
            }
        }
        return null;
    }

    public List<Object> values(PropertyId id) {
        List<Object> ret = new ArrayList<>(1);
        for (Property p : properties) {
            if (p.id() == id) {
                ret.add(p.value());
            }
        }
        return ret;
    }

    public Integer intValue(PropertyId id) {
        return (Integer) value(id);
    }

    public Long longValue(PropertyId id) {
        return (Long) value(id);
    }

    public String stringValue(PropertyId id) {
        return (String) value(id);
    }

    public byte[] binaryValue(PropertyId id) {
        return (byte[]) value(id);
    }

    public List<Integer> subscriptionIdentifiers() {
        return values(PropertyId.SUBSCRIPTION_IDENTIFIER).stream().map(Integer.class::cast).toList();
    }

    public List<UserProperty> userProperties() {
        return values(PropertyId.USER_PROPERTY).stream().map(UserProperty.class::cast).toList();
    }

    /**
     * read the Properties of a packet (Property Length included)
     *
     * @param buf the packet
     * @param packetType the packet type, or {@link ControlPacket#WILL_PROPERTIES}
     */
    public static Properties decode(ByteBuf buf, byte packetType) {
        int length = ControlPacket.readVariableByteInteger(buf);
        if (length > buf.readableBytes()) {
            throw new MalformedPacketException("Property Length exceeds the packet: " + length);
        }
        Properties ret = new Properties();
        int end = buf.readerIndex() + length;
        while (buf.readerIndex() < end) {
            int identifier = ControlPacket.readVariableByteInteger(buf);
            PropertyId id = PropertyId.of(identifier);
            if (id == null) {
                throw new MalformedPacketException("unknown property identifier: 0x" + Integer.toHexString(identifier));
            }
            if (!id.allowedIn(packetType)) {
                throw new MalformedPacketException("property " + id + " is not allowed in packet " + packetType);
            }
            if (!id.repeatableIn(packetType) && ret.contains(id)) {
                throw new MalformedPacketException("property " + id + " included more than once");
            }
            Object value = readValue(buf, id);
            if (buf.readerIndex() > end) {
                throw new MalformedPacketException("property " + id + " crosses the Property Length boundary");
            }
            ret.properties.add(new Property(id, value));
        }
        return ret;
    }

    private static Object readValue(ByteBuf buf, PropertyId id) {
        return switch (id.type()) {
            case BYTE -> (int) buf.readUnsignedByte();
            case TWO_BYTE_INTEGER -> buf.readUnsignedShort();
            case FOUR_BYTE_INTEGER -> buf.readUnsignedInt();
            case VARIABLE_BYTE_INTEGER -> ControlPacket.readVariableByteInteger(buf);
            case UTF8_STRING -> ControlPacket.readUtf8String(buf);
            case BINARY_DATA -> ControlPacket.readBinaryData(buf);
            case UTF8_STRING_PAIR -> new UserProperty(ControlPacket.readUtf8String(buf), ControlPacket.readUtf8String(buf));
        };
    }

    /**
     * write the Properties (Property Length included)
     */
    public void encode(ByteBuf out) {
        ByteBuf body = Unpooled.buffer();
        for (Property p : properties) {
            ControlPacket.writeVariableByteInteger(body, p.id().id());
            writeValue(body, p);
        }
        ControlPacket.writeVariableByteInteger(out, body.readableBytes());
        out.writeBytes(body);
    }

    private static void writeValue(ByteBuf buf, Property p) {
        Object v = p.value();
        switch (p.id().type()) {
            case BYTE -> buf.writeByte((Integer) v);
            case TWO_BYTE_INTEGER -> buf.writeShort((Integer) v);
            case FOUR_BYTE_INTEGER -> buf.writeInt(((Long) v).intValue());
            case VARIABLE_BYTE_INTEGER -> ControlPacket.writeVariableByteInteger(buf, (Integer) v);
            case UTF8_STRING -> ControlPacket.writeUtf8String(buf, (String) v);
            case BINARY_DATA -> ControlPacket.writeBinaryData(buf, (byte[]) v);
            case UTF8_STRING_PAIR -> {
                UserProperty up = (UserProperty) v;
                ControlPacket.writeUtf8String(buf, up.name());
                ControlPacket.writeUtf8String(buf, up.value());
            }
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        Properties that = (Properties) o;
        return properties.equals(that.properties);
    }

    @Override
    public int hashCode() {
        return Objects.hash(properties);
    }

    @Override
    public String toString() {
        final StringBuilder sb = new StringBuilder("[");
        for (Property p : properties) {
            sb.append(p).append(',');
        }
        if (sb.length() > 1) {
            sb.setLength(sb.length() - 1);
        }
        return sb.append(']').toString();
    }

    public record Property(PropertyId id, Object value) {

        @Override
        public boolean equals(Object o) {
            if (this == o) {
                return true;
            }
            if (!(o instanceof Property that)) {
                return false;
            }
            return id == that.id && Objects.deepEquals(value, that.value);
        }

        @Override
        public int hashCode() {
            int h = id.hashCode();
            return 31 * h + (value instanceof byte[] bytes ? Arrays.hashCode(bytes) : Objects.hashCode(value));
        }

        @Override
        public String toString() {
            final StringBuilder sb = new StringBuilder("{");
            sb.append("\"").append(id).append("\":");
            if (value instanceof byte[] bytes) {
                sb.append("\"").append(bytes.length).append(" bytes\"");
            }
            else if (value instanceof UserProperty up) {
                sb.append("{\"").append(up.name()).append("\":\"").append(up.value()).append("\"}");
            }
            else if (value instanceof String) {
                sb.append("\"").append(value).append("\"");
            }
            else {
                sb.append(value);
            }
            return sb.append("}").toString();
        }
    }

}
