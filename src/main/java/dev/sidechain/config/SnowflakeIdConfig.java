package dev.sidechain.config;

import dev.sidechain.util.SnowflakeId;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.net.InetAddress;
import java.net.NetworkInterface;
import java.net.SocketException;
import java.net.UnknownHostException;

/**
 * Node id comes from {@code app.snowflake.node-id} (env SNOWFLAKE_NODE_ID),
 * otherwise from the MAC address, otherwise from the hostname.
 */
@Configuration(proxyBeanMethods = false)
@Slf4j
public class SnowflakeIdConfig {

    private static final long NODE_MASK = 0x3FF;

    @Value("${app.snowflake.node-id:#{null}}")
    private Long configuredNodeId;

    @Bean
    public SnowflakeId snowflakeId() {
        long nodeId = resolveNodeId();
        log.info("Initialized Snowflake ID generator with node ID: {}", nodeId);
        return new SnowflakeId(nodeId);
    }

    private long resolveNodeId() {
        if (configuredNodeId != null) {
            log.debug("Using configured Snowflake node ID: {}", configuredNodeId);
            return configuredNodeId;
        }

        try {
            InetAddress localHost = InetAddress.getLocalHost();
            NetworkInterface networkInterface = NetworkInterface.getByInetAddress(localHost);
            if (networkInterface != null) {
                byte[] mac = networkInterface.getHardwareAddress();
                if (mac != null && mac.length >= 2) {
                    int hash = ((mac[mac.length - 2] & 0xFF) << 8) | (mac[mac.length - 1] & 0xFF);
                    return hash & NODE_MASK;
                }
            }
            String hostname = localHost.getHostName();
            long nodeId = Math.abs(hostname.hashCode()) & NODE_MASK;
            log.debug("Derived Snowflake node ID from hostname '{}': {}", hostname, nodeId);
            return nodeId;
        } catch (UnknownHostException | SocketException e) {
            log.warn("Failed to derive node ID from host, using 0: {}", e.getMessage());
            return 0;
        }
    }
}
