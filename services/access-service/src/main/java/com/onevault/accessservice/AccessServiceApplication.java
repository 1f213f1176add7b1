package com.onevault.accessservice;

import com.onevault.accessservice.config.AccessProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * OneVault access service: hosts the identity, versioning and zero trust core as Spring beans.
 *
 * <p>Request routing lives elsewhere and calls {@link com.onevault.security.ZeroTrustGateway}
 * in-process. The only HTTP surface is actuator (health probes, metrics, Prometheus). This
 * application contributes configuration, audit redelivery and graceful shutdown.
 */
@SpringBootApplication
@EnableConfigurationProperties(AccessProperties.class)
@EnableScheduling
public class AccessServiceApplication {

    private static final Logger log = LoggerFactory.getLogger(AccessServiceApplication.class);

    public static void main(String[] args) {
        SpringApplication.run(AccessServiceApplication.class, args);
        log.info("OneVault access service started");
    }
}
