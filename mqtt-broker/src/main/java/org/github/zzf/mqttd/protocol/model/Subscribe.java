package org.github.zzf.mqttd.protocol.model;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

import io.netty.buffer.ByteBuf;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import org.github.zzf.mqttd.protocol.MalformedPacketException;

/**
 * @author zhanfeng.zhang@icloud.com
 * @date 2026-10-19
 */
public class Subscribe extends ControlPacket {

    public static final byte _0_BYTE = (byte) 0x82;
    public static final String SHARED_SUBSCRIPTION_PREFIX = "$share/";

    private final int packetIdentifier;
    private final Properties properties;
    private final List<Subscription> subscriptions;

    Subscribe(byte byte0, ByteBuf buf, MqttVersion version) {
        super(byte0, version);
        this.packetIdentifier = buf.readUnsignedShort();
        packetIdentifierValidate(packetIdentifier);
        this.properties = version.isV5() ? Properties.decode(buf, SUBSCRIBE) : null;
        this.subscriptions = new ArrayList<>();
        while (buf.isReadable()) {
            String topicFilter = readUtf8String(buf);
            int options = buf.readUnsignedByte();
            // The Server MUST treat a SUBSCRIBE packet as malformed if any of Reserved bits in the payload
            // are non-zero, or QoS is not 0,1 or 2
            int reserved = version.isV5() ? 0xC0 : 0xFC;
            if ((options & reserved) != 0) {
                throw new MalformedPacketException("SUBSCRIBE options reserved bits are not zero");
            }
            Subscription s = Subscription.fromOptions(topicFilter, options);
            if (s.qos() == 3 || s.retainHandling() == 3) {
                throw new MalformedPacketException("invalid SUBSCRIBE options: 0x" + Integer.toHexString(options));
            }
            this.subscriptions.add(s);
        }
        //  The payload of a SUBSCRIBE packet MUST contain at least one Topic Filter / QoS pair.
        if (subscriptions.isEmpty()) {
            throw new MalformedPacketException("SUBSCRIBE without Topic Filter");
        }
    }

    public Subscribe(MqttVersion version, int packetIdentifier, Properties properties,
            List<Subscription> subscriptions) {
        super(_0_BYTE, version);
        packetIdentifierValidate(packetIdentifier);
        checkArgument(!subscriptions.isEmpty(), "SUBSCRIBE without Topic Filter");
        this.packetIdentifier = packetIdentifier;
        this.properties = propertiesValidate(version, properties);
        this.subscriptions = List.copyOf(subscriptions);
    }

    public static Subscribe from(MqttVersion version, int packetIdentifier, List<Subscription> subscriptions) {
        return new Subscribe(version, packetIdentifier, version.isV5() ? Properties.empty() : null, subscriptions);
    }

    @Override
    protected void writeVariableHeaderAndPayload(ByteBuf buf) {
        buf.writeShort(packetIdentifier);
        if (version.isV5()) {
            properties.encode(buf);
        }
        for (Subscription s : subscriptions) {
            writeUtf8String(buf, s.topicFilter());
            buf.writeByte(version.isV5() ? s.options() : s.qos());
        }
    }

    public int packetIdentifier() {
        return this.packetIdentifier;
    }

    public Properties properties() {
        return properties;
    }

    public List<Subscription> subscriptions() {
        return this.subscriptions;
    }

    /**
     * @return null if absent
     */
    public Integer subscriptionIdentifier() {
        return properties == null ? null : properties.intValue(PropertyId.SUBSCRIPTION_IDENTIFIER);
    }

    /**
     * every level containing a wildcard must be the wildcard alone; '#' only as the last level
     */
    public static boolean topicFilterValidate(String topicFilter) {
        if (topicFilter == null || topicFilter.isEmpty()) {
            return false;
        }
        String[] levels = topicFilter.split("/", -1);
        for (int i = 0; i < levels.length; i++) {
            String level = levels[i];
            if (level.contains("#")) {
                // sport/tennis/#/ranking is not valid
                // “sport/tennis#” is not valid
                if (!level.equals("#") || i != levels.length - 1) {
                    return false;
                }
            }
            // "sport+" is not valid
            if (level.contains("+") && !level.equals("+")) {
                return false;
            }
        }
        return true;
    }

    public static boolean sharedSubscription(String topicFilter) {
        return topicFilter.startsWith(SHARED_SUBSCRIPTION_PREFIX);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        Subscribe that = (Subscribe) o;
        return version == that.version
            && packetIdentifier == that.packetIdentifier
            && Objects.equals(properties, that.properties)
            && subscriptions.equals(that.subscriptions);
    }

    @Override
    public int hashCode() {
        return Objects.hash(version, packetIdentifier, subscriptions);
    }

    @Override
    public String toString() {
        final StringBuilder sb = new StringBuilder("{");
        sb.append("\"packet\":\"SUBSCRIBE\",");
        sb.append("\"version\":\"").append(version).append("\",");
        sb.append("\"packetIdentifier\":\"").append(hexPId(packetIdentifier)).append("\",");
        if (properties != null) {
            sb.append("\"properties\":").append(properties).append(',');
        }
        sb.append("\"subscriptions\":").append(subscriptions).append(',');
        return sb.replace(sb.length() - 1, sb.length(), "}").toString();
    }

    /**
     * a Topic Filter and its Subscription Options. 3.1.1 only knows about the QoS
     */
    public static class Subscription {

        private final String topicFilter;
        private final int qos;
        private final boolean noLocal;
        private final boolean retainAsPublished;
        private final int retainHandling;

        public Subscription(String topicFilter, int qos) {
            this(topicFilter, qos, false, false, 0);
        }

        public Subscription(String topicFilter, int qos, boolean noLocal, boolean retainAsPublished,
                int retainHandling) {
            this.topicFilter = checkNotNull(topicFilter, "topicFilter");
            this.qos = qos;
            this.noLocal = noLocal;
            this.retainAsPublished = retainAsPublished;
            this.retainHandling = retainHandling;
        }

        static Subscription fromOptions(String topicFilter, int options) {
            return new Subscription(topicFilter,
                options & 0x03,
                (options & 0x04) != 0,
                (options & 0x08) != 0,
                (options & 0x30) >> 4);
        }

        int options() {
            int options = qos;
            if (noLocal) {
                options |= 0x04;
            }
            if (retainAsPublished) {
                options |= 0x08;
            }
            return options | (retainHandling << 4);
        }

        public String topicFilter() {
            return this.topicFilter;
        }

        public int qos() {
            return this.qos;
        }

        public boolean noLocal() {
            return noLocal;
        }

        public boolean retainAsPublished() {
            return retainAsPublished;
        }

        public int retainHandling() {
            return retainHandling;
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) {
                return true;
            }
            if (o == null || getClass() != o.getClass()) {
                return false;
            }
            Subscription that = (Subscription) o;
            return qos == that.qos
                && noLocal == that.noLocal
                && retainAsPublished == that.retainAsPublished
                && retainHandling == that.retainHandling
                && topicFilter.equals(that.topicFilter);
        }

        @Override
        public int hashCode() {
            return Objects.hash(topicFilter, qos);
        }

        @Override
        public String toString() {
            final StringBuilder sb = new StringBuilder("{");
            sb.append("\"topicFilter\":\"").append(topicFilter).append('\"').append(',');
            sb.append("\"qos\":").append(qos).append(',');
            if (noLocal) {
                sb.append("\"noLocal\":true,");
            }
            return sb.replace(sb.length() - 1, sb.length(), "}").toString();
        }
    }

}
