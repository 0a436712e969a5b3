package org.arpha.dispatch.configuration;

import lombok.Builder;
import lombok.Data;
import org.arpha.dispatch.exception.ConfigurationException;

@Data
@Builder
public class ServerProperties {

    private String host;
    private int port;
    private int workerThreads;
    private int maxContentLength;

    public static ServerProperties initialize() {
        return initialize(ConfigurationManager.getINSTANCE());
    }

    public static ServerProperties initialize(ConfigurationManager config) {
        ServerProperties properties = ServerProperties.builder()
                .host(config.getProperty("server.host", "0.0.0.0"))
                .port(config.getIntProperty("server.port", 4444))
                .workerThreads(config.getIntProperty("server.worker.threads", 16))
                .maxContentLength(config.getIntProperty("server.max.content.length", 512 * 1024))
                .build();

        if (properties.port < 0 || properties.port > 65535) {
            throw new ConfigurationException("server.port out of range: " + properties.port);
        }
        if (properties.workerThreads <= 0) {
            throw new ConfigurationException("server.worker.threads must be positive");
        }
        if (properties.maxContentLength <= 0) {
            throw new ConfigurationException("server.max.content.length must be positive");
        }
        return properties;
    }

}
