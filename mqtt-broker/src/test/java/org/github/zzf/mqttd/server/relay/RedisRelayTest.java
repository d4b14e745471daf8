package org.github.zzf.mqttd.server.relay;

import static java.nio.charset.StandardCharsets.UTF_8;
import static org.assertj.core.api.BDDAssertions.then;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.BDDMockito.given;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;

import org.github.zzf.mqttd.protocol.server.RelayListener;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.redisson.api.RFuture;
import org.redisson.api.RTopic;
import org.redisson.api.RedissonClient;
import org.redisson.api.listener.MessageListener;
import org.redisson.client.codec.StringCodec;

class RedisRelayTest {

    final RedissonClient redisson = mock(RedissonClient.class);
    final RTopic topic = mock(RTopic.class);

    RedisRelay relay(String nodeId) {
        given(redisson.getTopic(RedisRelay.DEFAULT_CHANNEL, StringCodec.INSTANCE)).willReturn(topic);
        return new RedisRelay(redisson, nodeId);
    }

    @Test
    @SuppressWarnings("unchecked")
    void givenMessage_whenPublishOut_thenJsonPublished() {
        RFuture<Long> future = mock(RFuture.class);
        given(topic.publishAsync(anyString())).willReturn(future);
        relay("node-1").publishOut("a/b", "p".getBytes(UTF_8), 1);
        ArgumentCaptor<Object> captor = ArgumentCaptor.forClass(Object.class);
        verify(topic).publishAsync(captor.capture());
        RelayMessage m = RelayMessage.fromJson((String) captor.getValue());
        then(m.getNodeId()).isEqualTo("node-1");
        then(m.getTopic()).isEqualTo("a/b");
        then(m.getQos()).isEqualTo(1);
    }

    @Test
    @SuppressWarnings("unchecked")
    void givenListener_whenMessagesArrive_thenOwnAndBrokenMessagesSkipped() {
        RelayListener listener = mock(RelayListener.class);
        relay("node-1").subscribe(listener);
        ArgumentCaptor<MessageListener<String>> captor = ArgumentCaptor.forClass(MessageListener.class);
        verify(topic).addListener(eq(String.class), captor.capture());
        MessageListener<String> redisListener = captor.getValue();

        String own = new RelayMessage().setNodeId("node-1").setTopic("a").setPayload(new byte[0]).toJson();
        redisListener.onMessage(RedisRelay.DEFAULT_CHANNEL, own);
        redisListener.onMessage(RedisRelay.DEFAULT_CHANNEL, "not json");
        verify(listener, never()).onRelayMessage(anyString(), any(), anyInt());

        String remote = new RelayMessage().setNodeId("node-2").setTopic("a").setPayload("r".getBytes(UTF_8))
            .setQos(2).toJson();
        redisListener.onMessage(RedisRelay.DEFAULT_CHANNEL, remote);
        verify(listener).onRelayMessage("a", "r".getBytes(UTF_8), 2);
    }

    @Test
    void givenSharedClient_whenClose_thenClientKeptRunning() {
        relay("node-1").close();
        verify(topic).removeAllListeners();
        verify(redisson, never()).shutdown();
    }

}
