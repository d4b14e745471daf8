package org.github.zzf.mqttd.protocol.codec;

import io.netty.buffer.ByteBuf;
import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.ChannelPromise;
import io.netty.handler.codec.ByteToMessageCodec;
import java.util.List;
import lombok.extern.slf4j.Slf4j;
import org.github.zzf.mqttd.protocol.MalformedPacketException;
import org.github.zzf.mqttd.protocol.model.Connect;
import org.github.zzf.mqttd.protocol.model.ControlPacket;
import org.github.zzf.mqttd.protocol.model.MqttVersion;

/**
 * One instance per channel: the protocol version is fixed by the first CONNECT and used for every later packet.
 *
 * @author zhanfeng.zhang@icloud.com
 * @date 2026-10-19
 */
@Slf4j
public class MqttCodec extends ByteToMessageCodec<ControlPacket> {

    private final int maximumPacketSize;
    private MqttVersion version;
    private boolean failed;

    public MqttCodec() {
        this(ControlPacket.MAX_PACKET_SIZE);
    }

    public MqttCodec(int maximumPacketSize) {
        this.maximumPacketSize = maximumPacketSize;
    }

    @Override
    public void write(ChannelHandlerContext ctx,
            Object msg,
            ChannelPromise promise) {
        if (msg instanceof ControlPacket cp) {
            // the owner of the buf will transfer to the netty
            // netty will release the buf after flush it to the wire
            ctx.write(cp.toByteBuf(), promise);
        }
        else {
            ctx.write(msg, promise);
        }
    }

    @Override
    protected void encode(ChannelHandlerContext ctx,
            ControlPacket msg,
            ByteBuf out) {
        // code should not go here.
        throw new UnsupportedOperationException();
    }

    @Override
    protected void decode(ChannelHandlerContext ctx,
            ByteBuf in,
            List<Object> out) {
        if (failed) {
            // no further packet is processed after a malformed one
            in.skipBytes(in.readableBytes());
            return;
        }
        try {
            int packetLength = ControlPacket.tryPickupPacket(in, maximumPacketSize);
            if (packetLength == -1) {// can not decode a packet
                return;
            }
            ByteBuf incoming = in.readSlice(packetLength);
            // packets before CONNECT are decoded as 3.1.1, the session handler will reject them anyway
            ControlPacket cp = ControlPacket.from(incoming, version == null ? MqttVersion.MQTT_3_1_1 : version);
            if (version == null && cp instanceof Connect connect) {
                version = connect.version();
            }
            out.add(cp);
        } catch (MalformedPacketException e) {
            failed = true;
            in.skipBytes(in.readableBytes());
            throw e;
        }
    }

    /**
     * @return null before CONNECT is decoded
     */
    public MqttVersion version() {
        return version;
    }

}
