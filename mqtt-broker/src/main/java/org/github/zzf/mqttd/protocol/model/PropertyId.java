package org.github.zzf.mqttd.protocol.model;

import static org.github.zzf.mqttd.protocol.model.ControlPacket.AUTH;
import static org.github.zzf.mqttd.protocol.model.ControlPacket.CONNACK;
import static org.github.zzf.mqttd.protocol.model.ControlPacket.CONNECT;
import static org.github.zzf.mqttd.protocol.model.ControlPacket.DISCONNECT;
import static org.github.zzf.mqttd.protocol.model.ControlPacket.PUBACK;
import static org.github.zzf.mqttd.protocol.model.ControlPacket.PUBCOMP;
import static org.github.zzf.mqttd.protocol.model.ControlPacket.PUBLISH;
import static org.github.zzf.mqttd.protocol.model.ControlPacket.PUBREC;
import static org.github.zzf.mqttd.protocol.model.ControlPacket.PUBREL;
import static org.github.zzf.mqttd.protocol.model.ControlPacket.SUBACK;
import static org.github.zzf.mqttd.protocol.model.ControlPacket.SUBSCRIBE;
import static org.github.zzf.mqttd.protocol.model.ControlPacket.UNSUBACK;
import static org.github.zzf.mqttd.protocol.model.ControlPacket.UNSUBSCRIBE;
import static org.github.zzf.mqttd.protocol.model.ControlPacket.WILL_PROPERTIES;
import static org.github.zzf.mqttd.protocol.model.PropertyId.Type.BINARY_DATA;
import static org.github.zzf.mqttd.protocol.model.PropertyId.Type.BYTE;
import static org.github.zzf.mqttd.protocol.model.PropertyId.Type.FOUR_BYTE_INTEGER;
import static org.github.zzf.mqttd.protocol.model.PropertyId.Type.TWO_BYTE_INTEGER;
import static org.github.zzf.mqttd.protocol.model.PropertyId.Type.UTF8_STRING;
import static org.github.zzf.mqttd.protocol.model.PropertyId.Type.UTF8_STRING_PAIR;
import static org.github.zzf.mqttd.protocol.model.PropertyId.Type.VARIABLE_BYTE_INTEGER;

/**
 * MQTT 5.0 property identifiers with their value type and the packets they may appear in.
 *
 * @author zhanfeng.zhang@icloud.com
 * @date 2026-10-19
 */
public enum PropertyId {

    PAYLOAD_FORMAT_INDICATOR(0x01, BYTE, PUBLISH, WILL_PROPERTIES),
    MESSAGE_EXPIRY_INTERVAL(0x02, FOUR_BYTE_INTEGER, PUBLISH, WILL_PROPERTIES),
    CONTENT_TYPE(0x03, UTF8_STRING, PUBLISH, WILL_PROPERTIES),
    RESPONSE_TOPIC(0x08, UTF8_STRING, PUBLISH, WILL_PROPERTIES),
    CORRELATION_DATA(0x09, BINARY_DATA, PUBLISH, WILL_PROPERTIES),
    SUBSCRIPTION_IDENTIFIER(0x0B, VARIABLE_BYTE_INTEGER, PUBLISH, SUBSCRIBE),
    SESSION_EXPIRY_INTERVAL(0x11, FOUR_BYTE_INTEGER, CONNECT, CONNACK, DISCONNECT),
    ASSIGNED_CLIENT_IDENTIFIER(0x12, UTF8_STRING, CONNACK),
    SERVER_KEEP_ALIVE(0x13, TWO_BYTE_INTEGER, CONNACK),
    AUTHENTICATION_METHOD(0x15, UTF8_STRING, CONNECT, CONNACK, AUTH),
    AUTHENTICATION_DATA(0x16, BINARY_DATA, CONNECT, CONNACK, AUTH),
    REQUEST_PROBLEM_INFORMATION(0x17, BYTE, CONNECT),
    WILL_DELAY_INTERVAL(0x18, FOUR_BYTE_INTEGER, WILL_PROPERTIES),
    REQUEST_RESPONSE_INFORMATION(0x19, BYTE, CONNECT),
    RESPONSE_INFORMATION(0x1A, UTF8_STRING, CONNACK),
    SERVER_REFERENCE(0x1C, UTF8_STRING, CONNACK, DISCONNECT),
    REASON_STRING(0x1F, UTF8_STRING, CONNACK, PUBACK, PUBREC, PUBREL, PUBCOMP, SUBACK, UNSUBACK, DISCONNECT, AUTH),
    RECEIVE_MAXIMUM(0x21, TWO_BYTE_INTEGER, CONNECT, CONNACK),
    TOPIC_ALIAS_MAXIMUM(0x22, TWO_BYTE_INTEGER, CONNECT, CONNACK),
    TOPIC_ALIAS(0x23, TWO_BYTE_INTEGER, PUBLISH),
    MAXIMUM_QOS(0x24, BYTE, CONNACK),
    RETAIN_AVAILABLE(0x25, BYTE, CONNACK),
    USER_PROPERTY(0x26, UTF8_STRING_PAIR, CONNECT, CONNACK, PUBLISH, WILL_PROPERTIES, PUBACK, PUBREC, PUBREL,
        PUBCOMP, SUBSCRIBE, SUBACK, UNSUBSCRIBE, UNSUBACK, DISCONNECT, AUTH),
    MAXIMUM_PACKET_SIZE(0x27, FOUR_BYTE_INTEGER, CONNECT, CONNACK),
    WILDCARD_SUBSCRIPTION_AVAILABLE(0x28, BYTE, CONNACK),
    SUBSCRIPTION_IDENTIFIER_AVAILABLE(0x29, BYTE, CONNACK),
    SHARED_SUBSCRIPTION_AVAILABLE(0x2A, BYTE, CONNACK),
    ;

    private static final PropertyId[] BY_ID = new PropertyId[0x80];

    static {
        for (PropertyId p : values()) {
            BY_ID[p.id] = p;
        }
    }

    private final int id;
    private final Type type;
    // bit n set: allowed in the packet whose type nibble is n. bit 0 stands for Will Properties
    private final int allowedIn;

    PropertyId(int id, Type type, byte... packetTypes) {
        this.id = id;
        this.type = type;
        int mask = 0;
        for (byte t : packetTypes) {
            mask |= 1 << ((t & 0xF0) >> 4);
        }
        this.allowedIn = mask;
    }

    public int id() {
        return id;
    }

    public Type type() {
        return type;
    }

    public boolean allowedIn(byte packetType) {
        return (allowedIn & (1 << ((packetType & 0xF0) >> 4))) != 0;
    }

    /**
     * It is a Protocol Error to include a property more than once, except the User Property and the
     * Subscription Identifier of a PUBLISH (one for each matching subscription)
     */
    public boolean repeatableIn(byte packetType) {
        return this == USER_PROPERTY || (this == SUBSCRIPTION_IDENTIFIER && packetType == PUBLISH);
    }

    /**
     * @return null if the id is unknown
     */
    public static PropertyId of(int id) {
        if (id < 0 || id >= BY_ID.length) {
            return null;
        }
        return BY_ID[id];
    }

    public enum Type {
        BYTE(Integer.class),
        TWO_BYTE_INTEGER(Integer.class),
        FOUR_BYTE_INTEGER(Long.class),
        VARIABLE_BYTE_INTEGER(Integer.class),
        UTF8_STRING(String.class),
        BINARY_DATA(byte[].class),
        UTF8_STRING_PAIR(UserProperty.class),
        ;

        private final Class<?> valueType;

        Type(Class<?> valueType) {
            this.valueType = valueType;
        }

        public Class<?> valueType() {
            return valueType;
        }
    }

}
