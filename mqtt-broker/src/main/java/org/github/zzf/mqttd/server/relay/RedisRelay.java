package org.github.zzf.mqttd.server.relay;

import static com.google.common.base.Preconditions.checkNotNull;

import lombok.extern.slf4j.Slf4j;
import org.github.zzf.mqttd.protocol.server.Relay;
import org.github.zzf.mqttd.protocol.server.RelayListener;
import org.redisson.api.RTopic;
import org.redisson.api.RedissonClient;
import org.redisson.client.codec.StringCodec;

/**
 * Relay on a Redis pub/sub channel. Every node publishes to and listens on the same channel, messages tagged
 * with the local node id are skipped.
 *
 * @author zhanfeng.zhang@icloud.com
 * @date 2026-10-19
 */
@Slf4j
public class RedisRelay implements Relay {

    public static final String DEFAULT_CHANNEL = "mqttd:relay";

    private final RedissonClient redisson;
    private final String nodeId;
    private final RTopic topic;
    private final boolean ownClient;

    public RedisRelay(RedissonClient redisson, String nodeId) {
        this(redisson, nodeId, DEFAULT_CHANNEL, false);
    }

    /**
     * @param ownClient the RedissonClient is shutdown by {@link #close()}
     */
    public RedisRelay(RedissonClient redisson, String nodeId, String channel, boolean ownClient) {
        this.redisson = checkNotNull(redisson, "redisson");
        this.nodeId = checkNotNull(nodeId, "nodeId");
        this.topic = redisson.getTopic(channel, StringCodec.INSTANCE);
        this.ownClient = ownClient;
    }

    public static RedisRelay connect(String addresses, String nodeId) {
        return new RedisRelay(RedisConfiguration.newRedisson(addresses), nodeId, DEFAULT_CHANNEL, true);
    }

    @Override
    public void publishOut(String topicName, byte[] payload, int qos) {
        RelayMessage m = new RelayMessage()
            .setNodeId(nodeId)
            .setTopic(topicName)
            .setPayload(payload)
            .setQos(qos);
        // async, the local delivery does not wait for redis
        topic.publishAsync(m.toJson()).whenComplete((receivers, e) -> {
            if (e != null) {
                log.error("Relay publishOut failed -> {}", m, e);
            }
            else {
                log.debug("Relay publishOut -> {}, receivers: {}", m, receivers);
            }
        });
    }

    @Override
    public void subscribe(RelayListener listener) {
        topic.addListener(String.class, (channel, json) -> {
            RelayMessage m;
            try {
                m = RelayMessage.fromJson(json);
            } catch (RuntimeException e) {
                log.error("Relay received an unknown message: {}", json, e);
                return;
            }
            if (nodeId.equals(m.getNodeId())) {
                return;
            }
            log.debug("Relay received -> {}", m);
            listener.onRelayMessage(m.getTopic(), m.getPayload(), m.getQos());
        });
        log.info("Relay listening on {}, nodeId: {}", topic.getChannelNames(), nodeId);
    }

    @Override
    public void close() {
        topic.removeAllListeners();
        if (ownClient) {
            redisson.shutdown();
        }
        log.info("Relay closed, nodeId: {}", nodeId);
    }

    @Override
    public String toString() {
        return "RedisRelay{" + "nodeId='" + nodeId + '\'' + ", channel=" + topic.getChannelNames() + '}';
    }

}
