package org.github.zzf.mqttd.server;

import io.netty.bootstrap.ServerBootstrap;
import io.netty.channel.Channel;
import io.netty.channel.ChannelFuture;
import io.netty.channel.ChannelInitializer;
import io.netty.channel.nio.NioEventLoopGroup;
import io.netty.channel.socket.SocketChannel;
import io.netty.channel.socket.nio.NioServerSocketChannel;
import io.netty.handler.logging.LogLevel;
import io.netty.handler.logging.LoggingHandler;
import io.netty.handler.ssl.SslContext;
import io.netty.handler.ssl.SslContextBuilder;
import io.netty.util.concurrent.DefaultThreadFactory;
import java.io.IOException;
import java.io.InputStream;
import java.net.InetSocketAddress;
import java.net.URI;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.SneakyThrows;
import lombok.extern.slf4j.Slf4j;
import org.github.zzf.mqttd.protocol.codec.MqttCodec;
import org.github.zzf.mqttd.protocol.server.Broker;

@Slf4j
@Builder
public class BrokerBootstrap {

    private final Map<String, ListenPort> LISTENED_SERVERS = new LinkedHashMap<>(4);

    final Broker broker;
    final BrokerConfig config;

    @SneakyThrows
    public BrokerBootstrap start() {
        // mqtt / mqtts use the same Broker
        /* ["mqtt://host:port", "mqtts://host:port"] */
        String[] addressList = config.getListenedAddress().split(",");
        for (String address : addressList) {
            URI uri = new URI(address.trim());
            InetSocketAddress bindAddress = new InetSocketAddress(uri.getHost(), uri.getPort());
            Channel channel;
            switch (uri.getScheme()) {
                case "mqtt":
                    channel = mqttServer(bindAddress, null);
                    LISTENED_SERVERS.put("mqtt", new ListenPort(address, channel));
                    break;
                case "mqtts":
                    channel = mqttServer(bindAddress, sslContext());
                    LISTENED_SERVERS.put("mqtts", new ListenPort(address, channel));
                    break;
                default:
                    throw new UnsupportedOperationException("Unsupported Schema: " + uri.getScheme());
            }
        }
        return this;
    }

    /**
     * close the listened ports then the Broker
     */
    public void shutdown() {
        closeListenedPort();
        broker.close();
    }

    @SneakyThrows
    public void closeListenedPort() {
        // first shutdown the listened servers
        for (Map.Entry<String, ListenPort> e : LISTENED_SERVERS.entrySet()) {
            log.info("Shutdown Server... -> {}", e.getValue());
            e.getValue().getChannel().close().sync().addListener(f -> {
                if (f.isSuccess()) {
                    log.info("Server Shutdown Success: -> {}", e.getValue());
                }
                else {
                    log.error("Server Shutdown Failed: -> {}", e.getValue(), f.cause());
                }
            });
        }
        LISTENED_SERVERS.clear();
    }

    public Map<String, ListenPort> listenedServers() {
        return LISTENED_SERVERS;
    }

    private SslContext sslContext() throws IOException {
        try (InputStream cert = open(config.getSslCert());
             InputStream key = open(config.getSslKey())) {
            return SslContextBuilder.forServer(cert, key).build();
        }
    }

    /**
     * a file path first, then the classpath
     */
    private static InputStream open(String path) throws IOException {
        Path file = Path.of(path);
        if (Files.isRegularFile(file)) {
            return Files.newInputStream(file);
        }
        InputStream in = ClassLoader.getSystemResourceAsStream(path);
        if (in == null) {
            throw new IOException("no such file or classpath resource: " + path);
        }
        return in;
    }

    private Channel mqttServer(InetSocketAddress address, SslContext sslCtx) {
        String scheme = sslCtx == null ? "mqtt" : "mqtts";
        NioEventLoopGroup bossGroup = new NioEventLoopGroup(1, new DefaultThreadFactory(scheme + "-boss", false, Thread.MAX_PRIORITY));
        NioEventLoopGroup workerGroup = new NioEventLoopGroup(config.getWorkerThreadNum(), new DefaultThreadFactory(scheme + "-worker"));
        try {
            ChannelFuture future = new ServerBootstrap()
                    .group(bossGroup, workerGroup)
                    // the Channel is created by reflection
                    .channel(NioServerSocketChannel.class)
                    .handler(new LoggingHandler(LogLevel.DEBUG))
                    .childHandler(new ChannelInitializer<SocketChannel>() {
                        @Override
                        protected void initChannel(SocketChannel ch) {
                            if (sslCtx != null) {
                                ch.pipeline().addLast(sslCtx.newHandler(ch.alloc()));
                            }
                            ch.pipeline()
                                    .addLast(new MqttCodec(config.getMaxPacketSize()))
                                    .addLast(DefaultServerSessionHandler.HANDLER_NAME, new DefaultServerSessionHandler(broker, config))
                            ;
                        }
                    })
                    .bind(address).sync().addListener(f -> log.info("MQTT server listened at {}://{}", scheme, address))
                    .channel().closeFuture().addListener(f -> {
                        bossGroup.shutdownGracefully();
                        workerGroup.shutdownGracefully();
                        log.info("MQTT server {}://{} was shutdown.", scheme, address);
                    });
            return future.channel();
        } catch (Exception e) {
            log.info("MQTT server {}://{} was shutdown.", scheme, address, e);
            bossGroup.shutdownGracefully();
            workerGroup.shutdownGracefully();
            throw new RuntimeException(e);
        }
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class ListenPort {

        // mqtt://host:port
        private String url;
        private Channel channel;

    }

}
