package com.example.cronkeeper.config;

import com.example.cronkeeper.service.DaemonRuntime;
import com.example.cronkeeper.util.ListenAddress;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.web.server.ConfigurableWebServerFactory;
import org.springframework.boot.web.server.WebServerFactoryCustomizer;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Profile;

import java.net.InetAddress;
import java.net.UnknownHostException;

/**
 * Binds the control plane to the address persisted in the daemon config.
 * A bad address fails startup.
 */
@Slf4j
@Configuration
@Profile("daemon")
public class DaemonServerConfig {

    @Bean
    public WebServerFactoryCustomizer<ConfigurableWebServerFactory> daemonAddressCustomizer(DaemonRuntime daemonRuntime) {
        return factory -> {
            var address = ListenAddress.parse(daemonRuntime.address());
            try {
                factory.setAddress(InetAddress.getByName(address.host()));
            } catch (UnknownHostException e) {
                throw new IllegalStateException("Cannot bind daemon to " + daemonRuntime.address(), e);
            }
            factory.setPort(address.port());
            log.info("Control plane will listen on {}:{}", address.host(), address.port());
        };
    }
}
