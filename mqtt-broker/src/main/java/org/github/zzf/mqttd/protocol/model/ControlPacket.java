package org.github.zzf.mqttd.protocol.model;

import static com.google.common.base.Preconditions.checkArgument;
import static java.nio.charset.StandardCharsets.UTF_8;

import io.netty.buffer.ByteBuf;
import io.netty.buffer.ByteBufUtil;
import io.netty.buffer.Unpooled;
import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CodingErrorAction;
import lombok.extern.slf4j.Slf4j;
import org.github.zzf.mqttd.protocol.MalformedPacketException;

/**
 * @author zhanfeng.zhang@icloud.com
 * @date 2026-10-19
 */
@Slf4j
public abstract class ControlPacket {

    public static final int _0_BYTE_LENGTH = 1;
    public static final int MIN_PACKET_LENGTH = 2;
    public static final int MAX_REMAINING_LENGTH = 268_435_455;
    /**
     * fixed header (1 byte) + Remaining Length (4 bytes max) + Remaining Length
     */
    public static final int MAX_PACKET_SIZE = 1 + 4 + MAX_REMAINING_LENGTH;

    public static final byte CONNECT = 0x10;
    public static final byte CONNACK = 0x20;
    public static final byte PUBLISH = 0x30;
    public static final byte PUBACK = 0x40;
    public static final byte PUBREC = 0x50;
    public static final byte PUBREL = 0x60;
    public static final byte PUBCOMP = 0x70;
    public static final byte SUBSCRIBE = (byte) 0x80;
    public static final byte SUBACK = (byte) 0x90;
    public static final byte UNSUBSCRIBE = (byte) 0xA0;
    public static final byte UNSUBACK = (byte) 0xB0;
    public static final byte PINGREQ = (byte) 0xC0;
    public static final byte PINGRESP = (byte) 0xD0;
    public static final byte DISCONNECT = (byte) 0xE0;
    public static final byte AUTH = (byte) 0xF0;
    /**
     * not a packet type: the Will Properties in the payload of CONNECT
     */
    public static final byte WILL_PROPERTIES = 0x00;

    protected final byte byte0;
    protected final MqttVersion version;

    protected ControlPacket(byte byte0, MqttVersion version) {
        this.byte0 = byte0;
        this.version = version;
    }

    /**
     * ByteBuf to model
     *
     * @param incoming exactly one packet (fixed header included)
     * @param version the protocol version of the connection. ignored by CONNECT, which carries its own
     * @return model
     * @throws MalformedPacketException if the packet can not be decoded
     */
    public static ControlPacket from(ByteBuf incoming, MqttVersion version) {
        try {
            byte byte0 = incoming.readByte();
            int remainingLength = readVariableByteInteger(incoming);
            if (remainingLength != incoming.readableBytes()) {
                throw new MalformedPacketException("Remaining Length(" + remainingLength
                    + ") does not match the packet(" + incoming.readableBytes() + ")");
            }
            fixedHeaderFlagsValidate(byte0);
            ControlPacket cp = buildControlPacketFrom(byte0, incoming, version);
            // should read all the bytes out of the packet.
            if (incoming.isReadable()) {
                throw new MalformedPacketException(incoming.readableBytes() + " bytes left after decoding " + cp);
            }
            return cp;
        } catch (IndexOutOfBoundsException e) {
            throw new MalformedPacketException("packet truncated", e);
        } catch (IllegalArgumentException e) {
            throw new MalformedPacketException(e.getMessage(), e);
        }
    }

    private static ControlPacket buildControlPacketFrom(byte byte0, ByteBuf buf, MqttVersion version) {
        return switch (type(byte0)) {
            case CONNECT -> new Connect(byte0, buf);
            case CONNACK -> new ConnAck(byte0, buf, version);
            // core
            case PUBLISH -> new Publish(byte0, buf, version);
            case PUBACK -> new PubAck(byte0, buf, version);
            case PUBREC -> new PubRec(byte0, buf, version);
            case PUBREL -> new PubRel(byte0, buf, version);
            case PUBCOMP -> new PubComp(byte0, buf, version);
            case SUBSCRIBE -> new Subscribe(byte0, buf, version);
            case SUBACK -> new SubAck(byte0, buf, version);
            case UNSUBSCRIBE -> new Unsubscribe(byte0, buf, version);
            case UNSUBACK -> new UnsubAck(byte0, buf, version);
            case PINGREQ -> new PingReq(byte0, buf, version);
            case PINGRESP -> new PingResp(byte0, buf, version);
            case DISCONNECT -> new Disconnect(byte0, buf, version);
            case AUTH -> {
                if (!version.isV5()) {
                    throw new MalformedPacketException("AUTH is reserved in " + version);
                }
                yield new Auth(byte0, buf, version);
            }
            default -> throw new MalformedPacketException("reserved packet type: " + (byte0 & 0xF0));
        };
    }

    /**
     * Where a flag bit is marked as "Reserved", it is reserved for future use and MUST be set to the value listed.
     * If invalid flags are received, the receiver MUST close the Network Connection
     */
    private static void fixedHeaderFlagsValidate(byte byte0) {
        byte type = type(byte0);
        int flags = byte0 & 0x0F;
        if (type == PUBLISH) {
            return;
        }
        int expected = (type == PUBREL || type == SUBSCRIBE || type == UNSUBSCRIBE) ? 0x02 : 0x00;
        if (flags != expected) {
            throw new MalformedPacketException("invalid fixed header flags: 0x" + Integer.toHexString(byte0 & 0xFF));
        }
    }

    /**
     * @param in the cumulation
     * @return the length of the next complete packet, -1 if more data is needed
     */
    public static int tryPickupPacket(ByteBuf in) {
        return tryPickupPacket(in, MAX_PACKET_SIZE);
    }

    /**
     * @param in the cumulation
     * @param maximumPacketSize the maximum packet size the receiver accepts
     * @return the length of the next complete packet, -1 if more data is needed
     * @throws MalformedPacketException Remaining Length takes more than 4 bytes or the packet is too large
     */
    public static int tryPickupPacket(ByteBuf in, int maximumPacketSize) {
        if (in.readableBytes() < MIN_PACKET_LENGTH) {
            return -1;
        }
        int idx = in.readerIndex() + _0_BYTE_LENGTH;
        int remainingLength = 0;
        int rlBytes = 0;
        while (true) {
            if (idx >= in.writerIndex()) {
                // remainLength is 4 bytes, but now just received 2 bytes
                return -1;
            }
            byte encodedByte = in.getByte(idx++);
            remainingLength += (encodedByte & 0x7F) << (7 * rlBytes);
            rlBytes += 1;
            if ((encodedByte & 0x80) == 0) {
                break;
            }
            if (rlBytes == 4) {
                log.error("tryPickupPacket failed: {}", ByteBufUtil.hexDump(in, in.readerIndex(), rlBytes + 1));
                throw new MalformedPacketException("Remaining Length exceeds 4 bytes");
            }
        }
        // fixed header length + remainingLength
        int packetLength = _0_BYTE_LENGTH + rlBytes + remainingLength;
        if (packetLength > maximumPacketSize) {
            throw new MalformedPacketException("packet(" + packetLength + ") exceeds Maximum Packet Size(" + maximumPacketSize + ")");
        }
        if (in.readableBytes() < packetLength) {
            return -1;
        }
        return packetLength;
    }

    /**
     * model to ByteBuf
     *
     * @return ByteBuf
     */
    public ByteBuf toByteBuf() {
        ByteBuf body = Unpooled.buffer();
        writeVariableHeaderAndPayload(body);
        ByteBuf buf = Unpooled.buffer(_0_BYTE_LENGTH + 4 + body.readableBytes());
        buf.writeByte(byte0);
        writeVariableByteInteger(buf, body.readableBytes());
        buf.writeBytes(body);
        return buf;
    }

    /**
     * write everything after the Remaining Length
     */
    protected abstract void writeVariableHeaderAndPayload(ByteBuf buf);

    public static byte type(byte _0byte) {
        return (byte) (_0byte & 0xF0);
    }

    public byte type() {
        return type(this.byte0);
    }

    public byte byte0() {
        return byte0;
    }

    public MqttVersion version() {
        return version;
    }

    /**
     * Properties exist in 5.0 packets and only there
     */
    protected static Properties propertiesValidate(MqttVersion version, Properties properties) {
        checkArgument(version != null, "version");
        if (version.isV5()) {
            checkArgument(properties != null, "a %s packet must carry Properties", version);
        }
        else {
            checkArgument(properties == null, "a %s packet can not carry Properties", version);
        }
        return properties;
    }

    protected static void packetIdentifierValidate(int packetIdentifier) {
        // SUBSCRIBE, UNSUBSCRIBE, and PUBLISH (in cases where QoS > 0) Control Packets MUST contain a non-zero
        // 16-bit Packet Identifier
        if (packetIdentifier <= 0 || packetIdentifier > 0xFFFF) {
            throw new IllegalArgumentException("invalid Packet Identifier: " + packetIdentifier);
        }
    }

    public static int readVariableByteInteger(ByteBuf buf) {
        int value = 0;
        for (int i = 0; i < 4; i++) {
            byte encodedByte = buf.readByte();
            value += (encodedByte & 0x7F) << (7 * i);
            if ((encodedByte & 0x80) == 0) {
                return value;
            }
        }
        throw new MalformedPacketException("Variable Byte Integer exceeds 4 bytes");
    }

    public static void writeVariableByteInteger(ByteBuf buf, int value) {
        checkArgument(value >= 0 && value <= MAX_REMAINING_LENGTH, "Variable Byte Integer out of range: %s", value);
        int v = value;
        do {
            int encodedByte = v % 128;
            v /= 128;
            if (v > 0) {
                encodedByte = (encodedByte | 128);
            }
            buf.writeByte(encodedByte);
        } while (v > 0);
    }

    /**
     * The character data in a UTF-8 Encoded String MUST be well-formed UTF-8 as defined by the Unicode
     * specification and MUST NOT include an encoding of the null character U+0000
     */
    public static String readUtf8String(ByteBuf buf) {
        byte[] bytes = readBinaryData(buf);
        String str;
        try {
            str = UTF_8.newDecoder()
                .onMalformedInput(CodingErrorAction.REPORT)
                .onUnmappableCharacter(CodingErrorAction.REPORT)
                .decode(ByteBuffer.wrap(bytes))
                .toString();
        } catch (CharacterCodingException e) {
            throw new MalformedPacketException("ill-formed UTF-8 string", e);
        }
        if (str.indexOf('\u0000') != -1) {
            throw new MalformedPacketException("UTF-8 string contains U+0000");
        }
        return str;
    }

    public static void writeUtf8String(ByteBuf buf, String str) {
        writeBinaryData(buf, str.getBytes(UTF_8));
    }

    public static byte[] readBinaryData(ByteBuf buf) {
        int length = buf.readUnsignedShort();
        byte[] bytes = new byte[length];
        buf.readBytes(bytes);
        return bytes;
    }

    public static void writeBinaryData(ByteBuf buf, byte[] bytes) {
        checkArgument(bytes.length <= 0xFFFF, "data too long: %s", bytes.length);
        buf.writeShort(bytes.length);
        buf.writeBytes(bytes);
    }

    public static String hexPId(int packetIdentifier) {
        return "0x" + Integer.toHexString(packetIdentifier & 0xffff);
    }

    @Override
    public String toString() {
        final StringBuilder sb = new StringBuilder("{");
        sb.append("\"packet\":\"").append(this.getClass().getSimpleName().toUpperCase()).append('\"').append(',');
        sb.append("\"version\":\"").append(version).append("\",");
        return sb.replace(sb.length() - 1, sb.length(), "}").toString();
    }

}
