package org.github.zzf.mqttd.protocol.model;

import static com.google.common.base.Preconditions.checkArgument;

import io.netty.buffer.ByteBuf;
import java.util.Objects;

/**
 * 5.0 extended authentication exchange
 */
public class Auth extends ControlPacket {

    private final int reasonCode;
    private final Properties properties;

    Auth(byte byte0, ByteBuf buf, MqttVersion version) {
        super(byte0, version);
        // The Reason Code and Property Length can be omitted if the Reason Code is 0x00 (Success) and there
        // are no Properties
        this.reasonCode = buf.isReadable() ? buf.readUnsignedByte() : ReasonCode.SUCCESS;
        this.properties = buf.isReadable() ? Properties.decode(buf, AUTH) : Properties.empty();
    }

    public Auth(MqttVersion version, int reasonCode, Properties properties) {
        super(AUTH, version);
        checkArgument(version.isV5(), "AUTH is reserved in %s", version);
        checkArgument(reasonCode == ReasonCode.SUCCESS
            || reasonCode == ReasonCode.CONTINUE_AUTHENTICATION
            || reasonCode == ReasonCode.RE_AUTHENTICATE, "reasonCode");
        this.reasonCode = reasonCode;
        this.properties = propertiesValidate(version, properties);
    }

    @Override
    protected void writeVariableHeaderAndPayload(ByteBuf buf) {
        if (reasonCode == ReasonCode.SUCCESS && properties.isEmpty()) {
            return;
        }
        buf.writeByte(reasonCode);
        properties.encode(buf);
    }

    public int reasonCode() {
        return reasonCode;
    }

    public Properties properties() {
        return properties;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        Auth that = (Auth) o;
        return reasonCode == that.reasonCode && properties.equals(that.properties);
    }

    @Override
    public int hashCode() {
        return Objects.hash(reasonCode);
    }

    @Override
    public String toString() {
        final StringBuilder sb = new StringBuilder("{");
        sb.append("\"packet\":\"AUTH\",");
        sb.append("\"reasonCode\":\"").append(ReasonCode.hex(reasonCode)).append("\",");
        sb.append("\"properties\":").append(properties).append(',');
        return sb.replace(sb.length() - 1, sb.length(), "}").toString();
    }

}
