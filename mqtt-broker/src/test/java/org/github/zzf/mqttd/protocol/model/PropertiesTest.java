package org.github.zzf.mqttd.protocol.model;

import static org.assertj.core.api.Assertions.catchThrowable;
import static org.assertj.core.api.BDDAssertions.then;

import io.netty.buffer.ByteBuf;
import io.netty.buffer.Unpooled;
import org.github.zzf.mqttd.protocol.MalformedPacketException;
import org.junit.jupiter.api.Test;

class PropertiesTest {

    @Test
    void givenProperties_whenEncodeAndDecode_thenSame() {
        Properties out = Properties.empty()
            .add(PropertyId.SESSION_EXPIRY_INTERVAL, 3600L)
            .add(PropertyId.RECEIVE_MAXIMUM, 20)
            .add("region", "sh");
        ByteBuf buf = Unpooled.buffer();
        out.encode(buf);
        Properties in = Properties.decode(buf, ControlPacket.CONNECT);
        then(in).isEqualTo(out);
        then(in.longValue(PropertyId.SESSION_EXPIRY_INTERVAL)).isEqualTo(3600L);
        then(in.intValue(PropertyId.RECEIVE_MAXIMUM)).isEqualTo(20);
        then(in.userProperties()).containsExactly(new UserProperty("region", "sh"));
        then(buf.isReadable()).isFalse();
    }

    @Test
    void givenEmptyProperties_whenEncode_thenOneZeroByte() {
        ByteBuf buf = Unpooled.buffer();
        Properties.empty().encode(buf);
        then(buf.readableBytes()).isEqualTo(1);
        then(buf.getByte(0)).isEqualTo((byte) 0);
    }

    @Test
    void givenWrongValueType_whenAdd_thenException() {
        Throwable t = catchThrowable(() -> Properties.empty().add(PropertyId.SESSION_EXPIRY_INTERVAL, 1));
        then(t).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void givenUnknownIdentifier_whenDecode_thenMalformed() {
        ByteBuf buf = Unpooled.buffer();
        // length 2, identifier 0x7F, one byte value
        buf.writeByte(2).writeByte(0x7F).writeByte(0);
        then(catchThrowable(() -> Properties.decode(buf, ControlPacket.CONNECT)))
            .isInstanceOf(MalformedPacketException.class);
    }

    @Test
    void givenPropertyNotAllowedInPacket_whenDecode_thenMalformed() {
        ByteBuf buf = Unpooled.buffer();
        Properties.empty().add(PropertyId.TOPIC_ALIAS, 1).encode(buf);
        then(catchThrowable(() -> Properties.decode(buf, ControlPacket.CONNECT)))
            .isInstanceOf(MalformedPacketException.class);
    }

    /**
     * It is a Protocol Error to include the Receive Maximum value more than once
     */
    @Test
    void givenDuplicateProperty_whenDecode_thenMalformed() {
        ByteBuf buf = Unpooled.buffer();
        Properties.empty()
            .add(PropertyId.RECEIVE_MAXIMUM, 1)
            .add(PropertyId.RECEIVE_MAXIMUM, 2)
            .encode(buf);
        then(catchThrowable(() -> Properties.decode(buf, ControlPacket.CONNECT)))
            .isInstanceOf(MalformedPacketException.class);
    }

    @Test
    void givenMultipleSubscriptionIdentifiers_whenDecodeInPublish_thenAllKept() {
        ByteBuf buf = Unpooled.buffer();
        Properties.empty()
            .add(PropertyId.SUBSCRIPTION_IDENTIFIER, 1)
            .add(PropertyId.SUBSCRIPTION_IDENTIFIER, 2)
            .encode(buf);
        then(Properties.decode(buf, ControlPacket.PUBLISH).subscriptionIdentifiers()).containsExactly(1, 2);
    }

    @Test
    void givenPropertyLengthLargerThanPacket_whenDecode_thenMalformed() {
        ByteBuf buf = Unpooled.buffer();
        buf.writeByte(10).writeByte(0x21).writeShort(1);
        then(catchThrowable(() -> Properties.decode(buf, ControlPacket.CONNECT)))
            .isInstanceOf(MalformedPacketException.class);
    }

    @Test
    void givenPropertyCrossingTheBoundary_whenDecode_thenMalformed() {
        ByteBuf buf = Unpooled.buffer();
        // Property Length 2, but Receive Maximum takes 3 bytes; a trailing byte keeps the buffer readable
        buf.writeByte(2).writeByte(0x21).writeShort(1).writeByte(0);
        then(catchThrowable(() -> Properties.decode(buf, ControlPacket.CONNECT)))
            .isInstanceOf(MalformedPacketException.class);
    }

    @Test
    void givenProperties_whenWithout_thenCopyWithoutThem() {
        Properties origin = Properties.empty()
            .add(PropertyId.TOPIC_ALIAS, 1)
            .add(PropertyId.SUBSCRIPTION_IDENTIFIER, 2)
            .add(PropertyId.CONTENT_TYPE, "json");
        Properties copy = origin.without(PropertyId.TOPIC_ALIAS, PropertyId.SUBSCRIPTION_IDENTIFIER);
        then(copy.list()).hasSize(1);
        then(copy.stringValue(PropertyId.CONTENT_TYPE)).isEqualTo("json");
        then(origin.list()).hasSize(3);
    }

}
