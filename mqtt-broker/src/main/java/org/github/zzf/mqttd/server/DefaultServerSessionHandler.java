package org.github.zzf.mqttd.server;

import static java.nio.charset.StandardCharsets.UTF_8;
import static org.github.zzf.mqttd.protocol.model.Connect.DEFAULT_RECEIVE_MAXIMUM;

import com.google.common.util.concurrent.RateLimiter;
import io.netty.channel.Channel;
import io.netty.channel.ChannelFuture;
import io.netty.channel.ChannelFutureListener;
import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.ChannelInboundHandlerAdapter;
import io.netty.channel.ChannelPromise;
import io.netty.handler.codec.DecoderException;
import io.netty.handler.timeout.ReadTimeoutException;
import io.netty.handler.timeout.ReadTimeoutHandler;
import java.nio.channels.ClosedChannelException;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.List;
import java.util.Queue;
import java.util.UUID;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import lombok.extern.slf4j.Slf4j;
import org.github.zzf.mqttd.protocol.MalformedPacketException;
import org.github.zzf.mqttd.protocol.ProtocolViolationException;
import org.github.zzf.mqttd.protocol.UnsupportedProtocolVersionException;
import org.github.zzf.mqttd.protocol.model.ConnAck;
import org.github.zzf.mqttd.protocol.model.Connect;
import org.github.zzf.mqttd.protocol.model.ControlPacket;
import org.github.zzf.mqttd.protocol.model.Disconnect;
import org.github.zzf.mqttd.protocol.model.MqttVersion;
import org.github.zzf.mqttd.protocol.model.PingReq;
import org.github.zzf.mqttd.protocol.model.PingResp;
import org.github.zzf.mqttd.protocol.model.Properties;
import org.github.zzf.mqttd.protocol.model.PropertyId;
import org.github.zzf.mqttd.protocol.model.PubAck;
import org.github.zzf.mqttd.protocol.model.PubComp;
import org.github.zzf.mqttd.protocol.model.PubRec;
import org.github.zzf.mqttd.protocol.model.PubRel;
import org.github.zzf.mqttd.protocol.model.Publish;
import org.github.zzf.mqttd.protocol.model.ReasonCode;
import org.github.zzf.mqttd.protocol.model.Subscribe;
import org.github.zzf.mqttd.protocol.model.Subscribe.Subscription;
import org.github.zzf.mqttd.protocol.model.SubAck;
import org.github.zzf.mqttd.protocol.model.UnsubAck;
import org.github.zzf.mqttd.protocol.model.Unsubscribe;
import org.github.zzf.mqttd.protocol.server.Authenticator;
import org.github.zzf.mqttd.protocol.server.Broker;
import org.github.zzf.mqttd.protocol.server.Connection;
import org.github.zzf.mqttd.protocol.server.ControlPacketContext;
import org.github.zzf.mqttd.protocol.server.DeliveryReceipt;
import org.github.zzf.mqttd.protocol.server.ServerSession;
import org.github.zzf.mqttd.protocol.server.ServerSession.OutboundTopicAlias;
import org.github.zzf.mqttd.protocol.server.SessionManager.AdmitResult;
import org.github.zzf.mqttd.protocol.server.TopicSubscription;

/**
 * One instance per Network Connection. Every method except {@link #send}, {@link #takeover} and
 * {@link #disconnect} runs on the event loop of the channel.
 *
 * @author zhanfeng.zhang@icloud.com
 * @date 2022/06/28
 */
@Slf4j
public class DefaultServerSessionHandler extends ChannelInboundHandlerAdapter implements Connection {

    public static final ChannelFutureListener LOG_ON_FAILURE = future -> {
        if (!future.isSuccess()) {
            log.error("Channel(" + future.channel() + ").writeAndFlush failed.", future.cause());
        }
    };

    public static final String HANDLER_NAME = DefaultServerSessionHandler.class.getSimpleName();
    public static final String ACTIVE_IDLE_TIMEOUT_HANDLER = "activeIdleTimeoutHandler";
    public static final String CLIENT_KEEP_ALIVE_HANDLER = "clientKeepAliveHandler";

    private final Broker broker;
    private final BrokerConfig config;
    private final RateLimiter rateLimiter;
    private final RateLimiter subscribeRateLimiter;

    private volatile State state = State.AWAITING_CONNECT;
    private boolean initialized;
    private Channel channel;
    private ReadTimeoutHandler activeIdleTimeoutHandler;
    // packets held back until the CONNACK is written
    private final Queue<ControlPacket> pendingInbound = new ArrayDeque<>();
    private final Queue<PendingWrite> pendingOutbound = new ArrayDeque<>();

    private volatile MqttVersion version;
    private volatile String clientIdentifier;
    private volatile ServerSession session;
    private long generation;
    private long sessionExpiryInterval;
    // limits the Client imposes on the Server
    private volatile int clientReceiveMaximum = DEFAULT_RECEIVE_MAXIMUM;
    private volatile int clientTopicAliasMaximum;
    private volatile long lastActivity = System.currentTimeMillis();

    public DefaultServerSessionHandler(Broker broker, BrokerConfig config) {
        this.broker = broker;
        this.config = config;
        int permits = config.getMaxMessagesPerSecond();
        this.rateLimiter = permits > 0 ? RateLimiter.create(permits) : null;
        int subscriptionsPerMinute = config.getMaxSubscriptionsPerMinute();
        this.subscribeRateLimiter = subscriptionsPerMinute > 0 ? RateLimiter.create(subscriptionsPerMinute / 60.0) : null;
    }

    @Override
    public void handlerAdded(ChannelHandlerContext ctx) {
        // the handler may be added to a channel that is already active
        if (ctx.channel().isActive()) {
            initialize(ctx);
        }
    }

    @Override
    public void channelActive(ChannelHandlerContext ctx) throws Exception {
        initialize(ctx);
        super.channelActive(ctx);
    }

    private void initialize(ChannelHandlerContext ctx) {
        if (initialized) {
            return;
        }
        initialized = true;
        this.channel = ctx.channel();
        if (!broker.accept(channel)) {
            state = State.CLOSED;
            ctx.channel().close();
            return;
        }
        // If the Server does not receive a CONNECT Packet
        // within a reasonable amount of time after the Network Connection is established,
        // the Server SHOULD close the connection
        addActiveIdleTimeoutHandler(ctx);
    }

    @Override
    public void channelRead(ChannelHandlerContext ctx, Object msg) {
        lastActivity = System.currentTimeMillis();
        // receive a packet, remove the activeIdleTimeoutHandler
        removeActiveIdleTimeoutHandler(ctx);
        if (!(msg instanceof ControlPacket cp)) {
            log.error("channelRead msg is not ControlPacket, now close the channel: {}", msg);
            ctx.channel().close();
            return;
        }
        if (state == State.DISCONNECTING || state == State.CLOSED) {
            log.debug("Client({}) packet ignored in state {}: {}", clientIdentifier, state, cp);
            return;
        }
        if (state == State.CONNECTING) {
            log.debug("Client({}) packet queued until ConnAck is sent: {}", clientIdentifier, cp);
            pendingInbound.add(cp);
            return;
        }
        handle(ctx, cp);
    }

    private void handle(ChannelHandlerContext ctx, ControlPacket cp) {
        try {
            channelRead0(ctx, cp);
        } catch (ProtocolViolationException e) {
            protocolViolation(ctx, e.reasonCode(), e.getMessage());
        }
    }

    private void channelRead0(ChannelHandlerContext ctx, ControlPacket cp) {
        if (state == State.AWAITING_CONNECT) {
            // After a Network Connection is established by a Client to a Server,
            // the first Packet sent from the Client to the Server MUST be a CONNECT Packet
            if (!(cp instanceof Connect connect)) {
                log.error("channelRead the first Packet is not Connect, now close channel: {}", cp);
                state = State.CLOSED;
                ctx.channel().close();
                return;
            }
            onConnect(ctx, connect);
            return;
        }
        if (log.isDebugEnabled()) {
            log.debug("sender({}) -> {}", clientIdentifier, cp);
        }
        if (cp instanceof Publish packet) {
            onPublish(ctx, packet);
        }
        else if (cp instanceof PubAck packet) {
            acknowledged(packet.packetIdentifier(), "PubAck");
        }
        else if (cp instanceof PubRec packet) {
            onPubRec(ctx, packet);
        }
        else if (cp instanceof PubRel packet) {
            onPubRel(ctx, packet);
        }
        else if (cp instanceof PubComp packet) {
            acknowledged(packet.packetIdentifier(), "PubComp");
        }
        else if (cp instanceof Subscribe packet) {
            onSubscribe(ctx, packet);
        }
        else if (cp instanceof Unsubscribe packet) {
            onUnsubscribe(ctx, packet);
        }
        else if (cp instanceof PingReq) {
            ctx.writeAndFlush(new PingResp(version)).addListener(LOG_ON_FAILURE);
        }
        else if (cp instanceof Disconnect packet) {
            onDisconnect(ctx, packet);
        }
        else if (cp instanceof Connect) {
            // The Server MUST process a second CONNECT Packet sent from a Client as a protocol violation
            throw new ProtocolViolationException("Client sent CONNECT more than once");
        }
        else {
            // AUTH, or a packet only the Server may send
            throw new ProtocolViolationException("unexpected packet from Client: " + cp.getClass().getSimpleName());
        }
    }

    private void onConnect(ChannelHandlerContext ctx, Connect connect) {
        log.debug("Server receive Connect from client({}) -> {}", connect.clientIdentifier(), connect);
        this.version = connect.version();
        // enhanced authentication is not supported
        if (version.isV5() && connect.authenticationMethod() != null) {
            refuse(ctx, connect, ReasonCode.BAD_AUTHENTICATION_METHOD);
            return;
        }
        String clientId = connect.clientIdentifier();
        boolean assigned = false;
        if (clientId.isEmpty()) {
            // A Server MAY allow a Client to supply a ClientId that has a length of zero bytes. 3.1.1 requires
            // CleanSession set to 1 in that case
            if (!version.isV5() && !connect.cleanStart()) {
                refuse(ctx, connect, ReasonCode.IDENTIFIER_REJECTED);
                return;
            }
            clientId = "auto-" + UUID.randomUUID();
            assigned = true;
        }
        else if (clientId.getBytes(UTF_8).length > config.getMaxClientIdLength()) {
            refuse(ctx, connect, version.isV5() ? ReasonCode.CLIENT_IDENTIFIER_NOT_VALID : ReasonCode.IDENTIFIER_REJECTED);
            return;
        }
        int authenticate = broker.authenticator().authenticate(connect);
        if (authenticate != Authenticator.AUTHENTICATE_SUCCESS) {
            log.info("Server authenticate Connect from client({}) failed -> {}", clientId, ReasonCode.hex(authenticate));
            refuse(ctx, connect, version.isV5() ? authenticateReasonCode(authenticate) : authenticate);
            return;
        }
        this.clientIdentifier = clientId;
        if (version.isV5()) {
            this.sessionExpiryInterval = connect.sessionExpiryInterval();
            this.clientReceiveMaximum = connect.receiveMaximum();
            this.clientTopicAliasMaximum = connect.topicAliasMaximum();
        }
        else {
            this.sessionExpiryInterval = connect.cleanStart() ? 0 : config.getV3SessionExpiryInterval();
        }
        // nothing but the CONNACK may reach the Client until it is written
        state = State.CONNECTING;
        AdmitResult admitted = broker.connect(connect, clientId, sessionExpiryInterval, this);
        this.session = admitted.session();
        this.generation = admitted.generation();
        ConnAck connAck = ConnAck.accepted(version, admitted.sessionPresent(), connAckProperties(assigned));
        Connection evicted = admitted.evicted();
        if (evicted == null) {
            sendConnAck(ctx, connect, connAck);
            return;
        }
        // the CONNACK goes out once the Connection taken over is closed
        ctx.channel().config().setAutoRead(false);
        evicted.channel().closeFuture().addListener(f -> ctx.executor().execute(() -> sendConnAck(ctx, connect, connAck)));
    }

    private void sendConnAck(ChannelHandlerContext ctx, Connect connect, ConnAck connAck) {
        if (state != State.CONNECTING) {
            return;
        }
        state = State.ESTABLISHED;
        ctx.writeAndFlush(connAck)
            .addListener(LOG_ON_FAILURE)
            .addListener(f -> log.debug("Client({}) Connect accepted: {}", clientIdentifier, connAck));
        // keep alive
        if (connect.keepAlive() > 0) {
            addClientKeepAliveHandler(ctx, connect.keepAlive());
        }
        PendingWrite write;
        while ((write = pendingOutbound.poll()) != null) {
            write0(write.packet(), write.promise());
        }
        ControlPacket cp;
        while (state == State.ESTABLISHED && (cp = pendingInbound.poll()) != null) {
            handle(ctx, cp);
        }
        ctx.channel().config().setAutoRead(true);
    }

    private Properties connAckProperties(boolean assignedClientIdentifier) {
        if (!version.isV5()) {
            return null;
        }
        Properties properties = Properties.empty();
        if (assignedClientIdentifier) {
            properties.add(PropertyId.ASSIGNED_CLIENT_IDENTIFIER, clientIdentifier);
        }
        if (config.getTopicAliasMaximum() > 0) {
            properties.add(PropertyId.TOPIC_ALIAS_MAXIMUM, config.getTopicAliasMaximum());
        }
        if (config.getReceiveMaximum() < DEFAULT_RECEIVE_MAXIMUM) {
            properties.add(PropertyId.RECEIVE_MAXIMUM, config.getReceiveMaximum());
        }
        if (config.getMaxQos() < Publish.EXACTLY_ONCE) {
            properties.add(PropertyId.MAXIMUM_QOS, config.getMaxQos());
        }
        if (config.getMaxPacketSize() < ControlPacket.MAX_PACKET_SIZE) {
            properties.add(PropertyId.MAXIMUM_PACKET_SIZE, (long) config.getMaxPacketSize());
        }
        properties.add(PropertyId.RETAIN_AVAILABLE, 0)
            .add(PropertyId.SHARED_SUBSCRIPTION_AVAILABLE, 0)
            .add(PropertyId.WILDCARD_SUBSCRIPTION_AVAILABLE, 1)
            .add(PropertyId.SUBSCRIPTION_IDENTIFIER_AVAILABLE, 1);
        return properties;
    }

    private static int authenticateReasonCode(int authenticate) {
        return switch (authenticate) {
            case ReasonCode.IDENTIFIER_REJECTED -> ReasonCode.CLIENT_IDENTIFIER_NOT_VALID;
            case ReasonCode.SERVER_UNAVAILABLE -> ReasonCode.SERVER_UNAVAILABLE_5;
            case ReasonCode.BAD_USER_NAME_OR_PASSWORD -> ReasonCode.BAD_USERNAME_OR_PASSWORD;
            default -> ReasonCode.NOT_AUTHORIZED_5;
        };
    }

    private void refuse(ChannelHandlerContext ctx, Connect connect, int reasonCode) {
        log.info("Client({}) Connect refused -> {}", connect.clientIdentifier(), ReasonCode.hex(reasonCode));
        state = State.DISCONNECTING;
        ctx.writeAndFlush(ConnAck.rejected(version, reasonCode))
            .addListener(LOG_ON_FAILURE)
            .addListener(ChannelFutureListener.CLOSE);
    }

    private void onPublish(ChannelHandlerContext ctx, Publish packet) {
        if (packet.qos() > config.getMaxQos()) {
            throw new ProtocolViolationException(ReasonCode.QOS_NOT_SUPPORTED, "QoS " + packet.qos() + " not supported");
        }
        if (rateLimiter != null && !rateLimiter.tryAcquire()) {
            log.warn("sender({}/{}) Publish dropped, rate limit exceeded", clientIdentifier, packet.pId());
            if (packet.needAck()) {
                int code = version.isV5() ? ReasonCode.QUOTA_EXCEEDED : ReasonCode.SUCCESS;
                ControlPacket ack = packet.atLeastOnce()
                    ? PubAck.from(version, packet.packetIdentifier(), code)
                    : PubRec.from(version, packet.packetIdentifier(), code);
                ctx.writeAndFlush(ack).addListener(LOG_ON_FAILURE);
            }
            return;
        }
        Publish publish = resolveTopicAlias(packet);
        switch (publish.qos()) {
            case Publish.AT_MOST_ONCE -> broker.forward(clientIdentifier, publish);
            case Publish.AT_LEAST_ONCE -> {
                DeliveryReceipt receipt = broker.forward(clientIdentifier, publish);
                int code = noMatchingSubscribers(receipt);
                ctx.writeAndFlush(PubAck.from(version, publish.packetIdentifier(), code)).addListener(LOG_ON_FAILURE);
            }
            case Publish.EXACTLY_ONCE -> {
                int code = ReasonCode.SUCCESS;
                // a retransmitted PUBLISH must not be delivered twice
                if (session.receiveExactlyOnce(publish.packetIdentifier())) {
                    code = noMatchingSubscribers(broker.forward(clientIdentifier, publish));
                }
                else {
                    log.debug("sender({}/{}) Publish retransmitted, resend PubRec", clientIdentifier, publish.pId());
                }
                ctx.writeAndFlush(PubRec.from(version, publish.packetIdentifier(), code)).addListener(LOG_ON_FAILURE);
            }
            default -> throw new IllegalStateException();
        }
    }

    private int noMatchingSubscribers(DeliveryReceipt receipt) {
        return version.isV5() && receipt.routeMiss() ? ReasonCode.NO_MATCHING_SUBSCRIBERS : ReasonCode.SUCCESS;
    }

    private Publish resolveTopicAlias(Publish packet) {
        Integer alias = packet.topicAlias();
        if (alias == null) {
            return packet;
        }
        // A Topic Alias value of 0 or greater than the Topic Alias Maximum is a protocol error
        if (alias == 0 || alias > config.getTopicAliasMaximum()) {
            throw new ProtocolViolationException(ReasonCode.TOPIC_ALIAS_INVALID, "Topic Alias " + alias + " invalid");
        }
        String topicName = session.resolveTopicAlias(alias, packet.topicName());
        if (topicName == null) {
            throw new ProtocolViolationException("Topic Alias " + alias + " was never bound");
        }
        if (topicName.equals(packet.topicName())) {
            return packet;
        }
        return packet.copy(topicName, packet.properties());
    }

    private void acknowledged(int packetIdentifier, String ack) {
        ControlPacketContext ctx = session.acknowledge(packetIdentifier);
        if (ctx == null) {
            log.warn("receiver({}/{}) {} for no in flight Publish", clientIdentifier, ControlPacket.hexPId(packetIdentifier), ack);
            return;
        }
        log.debug("receiver({}/{}) {} received, Publish done", clientIdentifier, ctx.pId(), ack);
    }

    private void onPubRec(ChannelHandlerContext ctx, PubRec packet) {
        int pid = packet.packetIdentifier();
        ControlPacketContext inFlight = session.received(pid);
        int code = ReasonCode.SUCCESS;
        if (inFlight == null) {
            log.warn("receiver({}/{}) PubRec for no in flight Publish", clientIdentifier, packet.pId());
            code = version.isV5() ? ReasonCode.PACKET_IDENTIFIER_NOT_FOUND : ReasonCode.SUCCESS;
        }
        ctx.writeAndFlush(PubRel.from(version, pid, code)).addListener(LOG_ON_FAILURE);
    }

    private void onPubRel(ChannelHandlerContext ctx, PubRel packet) {
        int pid = packet.packetIdentifier();
        int code = ReasonCode.SUCCESS;
        if (!session.releaseExactlyOnce(pid)) {
            log.warn("sender({}/{}) PubRel for unknown Packet Identifier", clientIdentifier, packet.pId());
            code = version.isV5() ? ReasonCode.PACKET_IDENTIFIER_NOT_FOUND : ReasonCode.SUCCESS;
        }
        ctx.writeAndFlush(PubComp.from(version, pid, code)).addListener(LOG_ON_FAILURE);
    }

    private void onSubscribe(ChannelHandlerContext ctx, Subscribe packet) {
        Integer subscriptionIdentifier = packet.subscriptionIdentifier();
        List<Integer> reasonCodes = new ArrayList<>(packet.subscriptions().size());
        List<TopicSubscription> permitted = new ArrayList<>(packet.subscriptions().size());
        for (Subscription sub : packet.subscriptions()) {
            String tf = sub.topicFilter();
            if (Subscribe.sharedSubscription(tf)) {
                reasonCodes.add(version.isV5() ? ReasonCode.SHARED_SUBSCRIPTIONS_NOT_SUPPORTED : ReasonCode.SUBSCRIPTION_FAILURE);
                continue;
            }
            if (!Subscribe.topicFilterValidate(tf)) {
                log.warn("Client({}) Subscribe invalid Topic Filter: {}", clientIdentifier, tf);
                reasonCodes.add(version.isV5() ? ReasonCode.TOPIC_FILTER_INVALID : ReasonCode.SUBSCRIPTION_FAILURE);
                continue;
            }
            if (subscribeRateLimiter != null && !subscribeRateLimiter.tryAcquire()) {
                log.warn("Client({}) Subscribe {} refused, rate limit exceeded", clientIdentifier, tf);
                reasonCodes.add(version.isV5() ? ReasonCode.QUOTA_EXCEEDED : ReasonCode.SUBSCRIPTION_FAILURE);
                continue;
            }
            int qos = Math.min(sub.qos(), config.getMaxQos());
            permitted.add(new TopicSubscription(tf, qos, subscriptionIdentifier, sub.noLocal()));
            reasonCodes.add(qos);
        }
        if (!permitted.isEmpty() && !broker.subscribe(session, generation, permitted)) {
            log.debug("Client({}) Subscribe ignored, the Session was taken over", clientIdentifier);
            return;
        }
        SubAck subAck = SubAck.from(version, packet.packetIdentifier(), reasonCodes);
        log.debug("Client({}) Subscribe -> {}", clientIdentifier, subAck);
        ctx.writeAndFlush(subAck).addListener(LOG_ON_FAILURE);
    }

    private void onUnsubscribe(ChannelHandlerContext ctx, Unsubscribe packet) {
        List<Boolean> existed = broker.unsubscribe(session, generation, packet.topicFilters());
        List<Integer> reasonCodes = new ArrayList<>(existed.size());
        for (Boolean e : existed) {
            reasonCodes.add(e ? ReasonCode.SUCCESS : ReasonCode.NO_SUBSCRIPTION_EXISTED);
        }
        ctx.writeAndFlush(UnsubAck.from(version, packet.packetIdentifier(), reasonCodes)).addListener(LOG_ON_FAILURE);
    }

    private void onDisconnect(ChannelHandlerContext ctx, Disconnect packet) {
        log.debug("Client({}) Disconnect -> {}", clientIdentifier, packet);
        Long expiry = packet.sessionExpiryInterval();
        if (expiry != null && expiry != sessionExpiryInterval) {
            // If the Session Expiry Interval in the CONNECT packet was zero, then it is a Protocol Error to set a
            // non-zero Session Expiry Interval in the DISCONNECT packet
            if (sessionExpiryInterval == 0) {
                throw new ProtocolViolationException("Session Expiry Interval was 0 in CONNECT");
            }
            sessionExpiryInterval = expiry;
            broker.updateSessionExpiry(session, generation, expiry);
        }
        state = State.DISCONNECTING;
        ctx.channel().close();
    }

    private void protocolViolation(ChannelHandlerContext ctx, int reasonCode, String reason) {
        log.error("Client({}) protocol violation, now close the channel -> {}: {}", clientIdentifier, ReasonCode.hex(reasonCode), reason);
        closeWith(ctx.channel(), reasonCode);
    }

    /**
     * 5.0 Clients get a DISCONNECT with the Reason Code before the Network Connection is closed
     */
    private ChannelFuture closeWith(Channel ch, int reasonCode) {
        State current = state;
        state = State.DISCONNECTING;
        if (current == State.ESTABLISHED && version != null && version.isV5()) {
            ch.writeAndFlush(Disconnect.from(version, reasonCode)).addListener(LOG_ON_FAILURE);
        }
        ch.close();
        return ch.closeFuture();
    }

    private void addClientKeepAliveHandler(ChannelHandlerContext ctx, int keepAlive) {
        if (ctx.pipeline().get(CLIENT_KEEP_ALIVE_HANDLER) != null) {
            return;
        }
        // If the Keep Alive value is non-zero and the Server does not receive a Control Packet from the Client
        // within one and a half times the Keep Alive time period, it MUST disconnect the Network Connection to the
        // Client as if the network had failed
        ReadTimeoutHandler handler = new ReadTimeoutHandler(keepAlive * 1500L, TimeUnit.MILLISECONDS);
        ctx.pipeline().addBefore(HANDLER_NAME, CLIENT_KEEP_ALIVE_HANDLER, handler);
        log.debug("addClientKeepAliveHandler done");
    }

    private void addActiveIdleTimeoutHandler(ChannelHandlerContext ctx) {
        ReadTimeoutHandler handler = new ReadTimeoutHandler(config.getActiveIdleTimeoutSecond());
        ctx.pipeline().addBefore(HANDLER_NAME, ACTIVE_IDLE_TIMEOUT_HANDLER, handler);
        this.activeIdleTimeoutHandler = handler;
        log.debug("addActiveIdleTimeoutHandler done");
    }

    private void removeActiveIdleTimeoutHandler(ChannelHandlerContext ctx) {
        if (this.activeIdleTimeoutHandler == null) {
            return;
        }
        ctx.pipeline().remove(ACTIVE_IDLE_TIMEOUT_HANDLER);
        this.activeIdleTimeoutHandler = null;
        log.debug("removeActiveIdleTimeoutHandler done");
    }

    @Override
    public void exceptionCaught(ChannelHandlerContext ctx, Throwable cause) {
        Throwable e = cause instanceof DecoderException && cause.getCause() != null ? cause.getCause() : cause;
        if (e instanceof UnsupportedProtocolVersionException upv) {
            // The Server MUST respond to the CONNECT Packet with a CONNACK return code 0x01 (unacceptable protocol
            // level) and then disconnect the Client if the Protocol Level is not supported by the Server
            log.info("Server not support protocol level {}, now send ConnAck and close channel", upv.protocolLevel());
            state = State.DISCONNECTING;
            ctx.writeAndFlush(ConnAck.unsupportedProtocolVersion())
                .addListener(LOG_ON_FAILURE)
                .addListener(ChannelFutureListener.CLOSE);
        }
        else if (e instanceof MalformedPacketException) {
            log.error("Client({}) sent a malformed packet, now close the channel -> {}", clientIdentifier, e.getMessage());
            closeWith(ctx.channel(), ReasonCode.MALFORMED_PACKET);
        }
        else if (e instanceof ProtocolViolationException pv) {
            protocolViolation(ctx, pv.reasonCode(), pv.getMessage());
        }
        else if (e instanceof ReadTimeoutException) {
            if (state == State.AWAITING_CONNECT) {
                log.info("Channel({}) no CONNECT received in {}s, now close the channel", ctx.channel(), config.getActiveIdleTimeoutSecond());
                ctx.channel().close();
            }
            else {
                log.info("Client({}) keep alive timeout, now close the channel", clientIdentifier);
                closeWith(ctx.channel(), ReasonCode.KEEP_ALIVE_TIMEOUT);
            }
        }
        else {
            log.error("Client({}) exceptionCaught. now close the Channel -> channel: {}", clientIdentifier, ctx.channel(), e);
            closeWith(ctx.channel(), ReasonCode.UNSPECIFIED_ERROR);
        }
    }

    @Override
    public void channelInactive(ChannelHandlerContext ctx) throws Exception {
        log.debug("Client({}) channelInactive", clientIdentifier);
        state = State.CLOSED;
        pendingInbound.clear();
        PendingWrite write;
        while ((write = pendingOutbound.poll()) != null) {
            write.promise().tryFailure(new ClosedChannelException());
        }
        if (session != null) {
            broker.disconnect(session, this, generation);
        }
        broker.release(ctx.channel());
        super.channelInactive(ctx);
    }

    @Override
    public String clientIdentifier() {
        return clientIdentifier;
    }

    @Override
    public MqttVersion version() {
        return version;
    }

    @Override
    public Channel channel() {
        return channel;
    }

    @Override
    public ChannelFuture send(ControlPacket packet) {
        ChannelPromise promise = channel.newPromise();
        promise.addListener(LOG_ON_FAILURE);
        if (channel.eventLoop().inEventLoop()) {
            write0(packet, promise);
            return promise;
        }
        try {
            channel.eventLoop().execute(() -> write0(packet, promise));
        } catch (RejectedExecutionException e) {
            promise.tryFailure(e);
        }
        return promise;
    }

    /**
     * runs on the event loop of the channel
     */
    private void write0(ControlPacket packet, ChannelPromise promise) {
        if (state == State.CONNECTING) {
            pendingOutbound.add(new PendingWrite(packet, promise));
            return;
        }
        ControlPacket outgoing = packet;
        if (packet instanceof Publish publish && version.isV5() && clientTopicAliasMaximum > 0 && session != null) {
            outgoing = applyTopicAlias(publish);
        }
        if (log.isDebugEnabled()) {
            log.debug("receiver({}) <- {}", clientIdentifier, outgoing);
        }
        channel.writeAndFlush(outgoing, promise);
    }

    private Publish applyTopicAlias(Publish publish) {
        OutboundTopicAlias alias = session.outboundTopicAlias(publish.topicName(), clientTopicAliasMaximum);
        if (alias == null) {
            return publish;
        }
        Properties properties = publish.properties().without(PropertyId.TOPIC_ALIAS)
            .add(PropertyId.TOPIC_ALIAS, alias.alias());
        // once established the alias replaces the Topic Name
        return publish.copy(alias.established() ? "" : publish.topicName(), properties);
    }

    @Override
    public int receiveMaximum() {
        return clientReceiveMaximum;
    }

    @Override
    public ChannelFuture takeover() {
        log.info("Client({}) Session taken over, now close the channel: {}", clientIdentifier, channel);
        return closeWith(channel, ReasonCode.SESSION_TAKEN_OVER);
    }

    @Override
    public ChannelFuture disconnect(int reasonCode) {
        log.info("Client({}) disconnected by Server -> {}", clientIdentifier, ReasonCode.hex(reasonCode));
        return closeWith(channel, reasonCode);
    }

    @Override
    public long lastActivity() {
        return lastActivity;
    }

    State state() {
        return state;
    }

    private record PendingWrite(ControlPacket packet, ChannelPromise promise) {

    }

    public enum State {
        AWAITING_CONNECT,
        /**
         * the Session is bound, the CONNACK waits for the Connection taken over to close
         */
        CONNECTING,
        ESTABLISHED,
        DISCONNECTING,
        CLOSED,
        ;
    }

}
