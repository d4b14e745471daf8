package org.github.zzf.mqttd.protocol.model;

import static java.nio.charset.StandardCharsets.UTF_8;
import static org.assertj.core.api.Assertions.catchThrowable;
import static org.assertj.core.api.BDDAssertions.then;
import static org.github.zzf.mqttd.protocol.model.MqttVersion.MQTT_3_1_1;
import static org.github.zzf.mqttd.protocol.model.MqttVersion.MQTT_5;

import io.netty.buffer.ByteBuf;
import io.netty.buffer.Unpooled;
import org.github.zzf.mqttd.protocol.MalformedPacketException;
import org.junit.jupiter.api.Test;

/**
 * @author zhanfeng.zhang@icloud.com
 * @date 2022/07/01
 */
class PublishTest {

    /**
     * normal flow
     */
    @Test
    void givenRightPacket_whenOutAndIn_thenSuccess() {
        ByteBuf payload = Unpooled.copyLong(1L, 2L, 3L);
        String topicName = "topicName";
        Publish out = Publish.outgoing(MQTT_3_1_1, Publish.AT_LEAST_ONCE, topicName, 0x7FFF, payload, null);
        ByteBuf buf = out.toByteBuf();
        // inBound
        Publish in = (Publish) ControlPacket.from(buf, MQTT_3_1_1);
        then(in.atLeastOnce()).isTrue();
        then(in.retain()).isFalse();
        then(in.dup()).isFalse();
        then(in.topicName()).isEqualTo(topicName);
        then(in.packetIdentifier()).isEqualTo(0x7FFF);
        then(in.payload().readableBytes()).isEqualTo(3 * 8);
        // the payload of the outgoing packet is shared, not consumed
        then(payload.readableBytes()).isEqualTo(3 * 8);
    }

    @Test
    void given_whenBuild_0Byte_then() {
        then(Publish.build_0Byte(true, 1, true)).isEqualTo((byte) 0x3B);
        then(Publish.build_0Byte(true, 2, true)).isEqualTo((byte) 0x3D);
        then(Publish.build_0Byte(false, 2, true)).isEqualTo((byte) 0x3C);
        then(Publish.build_0Byte(false, 2, false)).isEqualTo((byte) 0x34);
    }

    /**
     * A PUBLISH Packet MUST NOT have both QoS bits set to 1
     */
    @Test
    void givenQos3_whenDecode_thenMalformed() {
        ByteBuf buf = Publish.outgoing(MQTT_3_1_1, 1, "a", 1, Unpooled.EMPTY_BUFFER, null).toByteBuf();
        buf.setByte(0, 0x36);
        then(catchThrowable(() -> ControlPacket.from(buf, MQTT_3_1_1))).isInstanceOf(MalformedPacketException.class);
    }

    /**
     * The DUP flag MUST be set to 0 for all QoS 0 messages
     */
    @Test
    void givenDupOnQos0_whenDecode_thenMalformed() {
        ByteBuf buf = Publish.outgoing(MQTT_3_1_1, 0, "a", 0, Unpooled.EMPTY_BUFFER, null).toByteBuf();
        buf.setByte(0, 0x38);
        then(catchThrowable(() -> ControlPacket.from(buf, MQTT_3_1_1))).isInstanceOf(MalformedPacketException.class);
    }

    /**
     * The Topic Name in the PUBLISH Packet MUST NOT contain wildcard characters
     */
    @Test
    void givenWildcardTopicName_whenDecode_thenMalformed() {
        ByteBuf buf = Unpooled.buffer();
        buf.writeByte(0x30).writeByte(3 + 2);
        ControlPacket.writeUtf8String(buf, "a/+");
        then(catchThrowable(() -> ControlPacket.from(buf, MQTT_3_1_1))).isInstanceOf(MalformedPacketException.class);
    }

    @Test
    void givenEmptyTopicWithoutAlias_whenDecode_thenMalformed() {
        ByteBuf buf = Unpooled.buffer();
        // topic "", properties length 0
        buf.writeByte(0x30).writeByte(3).writeShort(0).writeByte(0);
        then(catchThrowable(() -> ControlPacket.from(buf, MQTT_5))).isInstanceOf(MalformedPacketException.class);
    }

    @Test
    void givenZeroPacketIdentifier_whenDecode_thenMalformed() {
        ByteBuf buf = Unpooled.buffer();
        buf.writeByte(0x32).writeByte(3 + 2);
        ControlPacket.writeUtf8String(buf, "a");
        buf.writeShort(0);
        then(catchThrowable(() -> ControlPacket.from(buf, MQTT_3_1_1))).isInstanceOf(MalformedPacketException.class);
    }

    @Test
    void givenPublish_whenCopy_thenSamePayloadAnotherTopic() {
        Publish origin = Publish.outgoing(MQTT_5, 1, "", 3, Unpooled.copiedBuffer("p", UTF_8),
            Properties.empty().add(PropertyId.TOPIC_ALIAS, 2));
        Publish copy = origin.copy("a/b", origin.properties());
        then(copy.topicName()).isEqualTo("a/b");
        then(copy.packetIdentifier()).isEqualTo(3);
        then(copy.topicAlias()).isEqualTo(2);
        then(copy.payload().toString(UTF_8)).isEqualTo("p");
    }

    @Test
    void given_whenToString_then() {
        Publish publish = Publish.outgoing(MQTT_3_1_1, 0, "t", 0, Unpooled.buffer(), null);
        then(publish.toString()).isNotNull();
    }

}
