package org.github.zzf.mqttd.protocol.model;

import static java.nio.charset.StandardCharsets.UTF_8;
import static org.assertj.core.api.BDDAssertions.then;
import static org.github.zzf.mqttd.protocol.model.MqttVersion.MQTT_3_1_1;
import static org.github.zzf.mqttd.protocol.model.MqttVersion.MQTT_5;

import io.netty.buffer.ByteBuf;
import io.netty.buffer.Unpooled;
import java.util.List;
import java.util.stream.Stream;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.Arguments;
import org.junit.jupiter.params.provider.MethodSource;

/**
 * every packet type decodes to what was encoded, in both protocol versions
 */
class PacketRoundTripTest {

    @ParameterizedTest(name = "[{index}] {0}")
    @MethodSource("packets")
    void givenPacket_whenToByteBufAndFrom_thenEqual(ControlPacket out) {
        ByteBuf buf = out.toByteBuf();
        ControlPacket in = ControlPacket.from(buf, out.version());
        then(in).isEqualTo(out);
        then(in.version()).isEqualTo(out.version());
        then(buf.isReadable()).isFalse();
    }

    static Stream<Arguments> packets() {
        Properties publishProperties = Properties.empty()
            .add(PropertyId.PAYLOAD_FORMAT_INDICATOR, 1)
            .add(PropertyId.MESSAGE_EXPIRY_INTERVAL, 60L)
            .add(PropertyId.CONTENT_TYPE, "text/plain")
            .add(PropertyId.RESPONSE_TOPIC, "reply/to")
            .add(PropertyId.CORRELATION_DATA, new byte[]{1, 2, 3})
            .add(PropertyId.SUBSCRIPTION_IDENTIFIER, 1)
            .add(PropertyId.SUBSCRIPTION_IDENTIFIER, 268_435_455)
            .add(PropertyId.TOPIC_ALIAS, 3)
            .add("k", "v1")
            .add("k", "v2");
        return Stream.of(
            // CONNECT
            Connect.from("client-1", 60),
            Connect.from(MQTT_3_1_1, "client-1", false, 0),
            Connect.builder().version(MQTT_3_1_1).clientIdentifier("c").cleanStart(true).keepAlive(30)
                .willTopic("will/topic").willPayload("bye".getBytes(UTF_8)).willQos(1).willRetain(true)
                .username("user").password("secret".getBytes(UTF_8))
                .build(),
            Connect.builder().version(MQTT_5).clientIdentifier("c5").keepAlive(0xFFFF)
                .properties(Properties.empty()
                    .add(PropertyId.SESSION_EXPIRY_INTERVAL, Connect.SESSION_EXPIRY_NEVER)
                    .add(PropertyId.RECEIVE_MAXIMUM, 10)
                    .add(PropertyId.TOPIC_ALIAS_MAXIMUM, 5)
                    .add(PropertyId.MAXIMUM_PACKET_SIZE, 1024L)
                    .add("app", "mqttd"))
                .willTopic("will/topic").willPayload(new byte[0]).willQos(2)
                .willProperties(Properties.empty().add(PropertyId.WILL_DELAY_INTERVAL, 5L))
                .password("only-password".getBytes(UTF_8))
                .build(),
            // CONNACK
            ConnAck.accepted(MQTT_3_1_1, true, null),
            ConnAck.rejected(MQTT_3_1_1, ReasonCode.NOT_AUTHORIZED),
            ConnAck.accepted(MQTT_5, false, Properties.empty()
                .add(PropertyId.ASSIGNED_CLIENT_IDENTIFIER, "auto-1")
                .add(PropertyId.TOPIC_ALIAS_MAXIMUM, 16)
                .add(PropertyId.RETAIN_AVAILABLE, 0)
                .add(PropertyId.MAXIMUM_QOS, 1)),
            ConnAck.rejected(MQTT_5, ReasonCode.CLIENT_IDENTIFIER_NOT_VALID),
            // PUBLISH
            Publish.outgoing(MQTT_3_1_1, 0, "sensors/a", 0, Unpooled.copiedBuffer("23.5", UTF_8), null),
            Publish.outgoing(MQTT_3_1_1, 1, "sensors/a", 1, Unpooled.EMPTY_BUFFER, null),
            Publish.builder().version(MQTT_3_1_1).qos(2).dup(true).retain(true).topicName("a/b")
                .packetIdentifier(0xFFFF).payload(Unpooled.wrappedBuffer(new byte[300])).build(),
            Publish.outgoing(MQTT_5, 1, "sensors/a", 7, Unpooled.copiedBuffer("x", UTF_8), publishProperties),
            Publish.outgoing(MQTT_5, 0, "", 0, Unpooled.EMPTY_BUFFER,
                Properties.empty().add(PropertyId.TOPIC_ALIAS, 1)),
            // PUBACK / PUBREC / PUBREL / PUBCOMP
            PubAck.from(MQTT_3_1_1, 1),
            PubAck.from(MQTT_5, 2),
            PubAck.from(MQTT_5, 3, ReasonCode.NO_MATCHING_SUBSCRIBERS),
            new PubAck(MQTT_5, 4, ReasonCode.QUOTA_EXCEEDED, Properties.empty().add(PropertyId.REASON_STRING, "slow down")),
            PubRec.from(MQTT_3_1_1, 5),
            PubRec.from(MQTT_5, 6, ReasonCode.NO_MATCHING_SUBSCRIBERS),
            PubRel.from(MQTT_3_1_1, 7),
            PubRel.from(MQTT_5, 8, ReasonCode.PACKET_IDENTIFIER_NOT_FOUND),
            PubComp.from(MQTT_3_1_1, 9),
            PubComp.from(MQTT_5, 10),
            // SUBSCRIBE / SUBACK
            Subscribe.from(MQTT_3_1_1, 11, List.of(
                new Subscribe.Subscription("sport/+/player1", 0),
                new Subscribe.Subscription("sport/#", 2))),
            new Subscribe(MQTT_5, 12, Properties.empty().add(PropertyId.SUBSCRIPTION_IDENTIFIER, 42), List.of(
                new Subscribe.Subscription("sensors/+", 1, true, true, 2),
                new Subscribe.Subscription("#", 0, false, false, 1))),
            SubAck.from(MQTT_3_1_1, 11, List.of(0, 2, ReasonCode.SUBSCRIPTION_FAILURE)),
            SubAck.from(MQTT_5, 12, List.of(1, ReasonCode.TOPIC_FILTER_INVALID, ReasonCode.SHARED_SUBSCRIPTIONS_NOT_SUPPORTED)),
            // UNSUBSCRIBE / UNSUBACK
            Unsubscribe.from(MQTT_3_1_1, 13, List.of("sport/#", "a/b")),
            Unsubscribe.from(MQTT_5, 14, List.of("sensors/+")),
            UnsubAck.from(MQTT_3_1_1, 13, List.of()),
            UnsubAck.from(MQTT_5, 14, List.of(ReasonCode.SUCCESS, ReasonCode.NO_SUBSCRIPTION_EXISTED)),
            // PINGREQ / PINGRESP
            new PingReq(MQTT_3_1_1),
            new PingReq(MQTT_5),
            new PingResp(MQTT_3_1_1),
            new PingResp(MQTT_5),
            // DISCONNECT
            Disconnect.from(MQTT_3_1_1),
            Disconnect.from(MQTT_5),
            Disconnect.from(MQTT_5, ReasonCode.SESSION_TAKEN_OVER),
            new Disconnect(MQTT_5, ReasonCode.NORMAL_DISCONNECTION,
                Properties.empty().add(PropertyId.SESSION_EXPIRY_INTERVAL, 30L)),
            // AUTH
            new Auth(MQTT_5, ReasonCode.SUCCESS, Properties.empty()),
            new Auth(MQTT_5, ReasonCode.CONTINUE_AUTHENTICATION, Properties.empty()
                .add(PropertyId.AUTHENTICATION_METHOD, "SCRAM-SHA-1")
                .add(PropertyId.AUTHENTICATION_DATA, new byte[]{9, 8, 7}))
        ).map(Arguments::of);
    }

}
