package org.github.zzf.mqttd.protocol.server;

import static org.github.zzf.mqttd.protocol.model.ControlPacket.hexPId;

/**
 * an outgoing QoS 1/2 PUBLISH in flight
 *
 * @author zhanfeng.zhang@icloud.com
 * @date 2026-10-19
 */
public class ControlPacketContext {

    private final int packetIdentifier;
    private final int qos;
    private volatile Status status = Status.INIT;

    public ControlPacketContext(int packetIdentifier, int qos) {
        this.packetIdentifier = packetIdentifier;
        this.qos = qos;
    }

    public int packetIdentifier() {
        return packetIdentifier;
    }

    public int qos() {
        return qos;
    }

    public Status status() {
        return status;
    }

    public ControlPacketContext markStatus(Status expect, Status update) {
        if (status != expect) {
            throw new IllegalStateException("status is " + status + ", expect " + expect);
        }
        this.status = update;
        return this;
    }

    public String pId() {
        return hexPId(packetIdentifier);
    }

    @Override
    public String toString() {
        final StringBuilder sb = new StringBuilder("{");
        sb.append("\"packetIdentifier\":\"").append(pId()).append("\",");
        sb.append("\"qos\":").append(qos).append(',');
        sb.append("\"status\":\"").append(status).append("\",");
        return sb.replace(sb.length() - 1, sb.length(), "}").toString();
    }

    public enum Status {
        INIT,
        PUB_REC,
        ;
    }

}
