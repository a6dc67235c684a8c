package com.ascentful.accessservice;

import com.ascentful.accessservice.config.AccessServiceProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

/**
 * Access service: exposes guard evaluation, impersonation and feature flag administration
 * over HTTP.
 *
 * <p>The caller's identity is taken from trusted headers set by the identity gateway in front
 * of this service (see {@code IdentityHeaders}). Impersonation overlays live in memory, so
 * they do not survive a restart and are not shared between instances.
 */
@SpringBootApplication
@EnableConfigurationProperties(AccessServiceProperties.class)
public class AccessServiceApplication {

    private static final Logger log = LoggerFactory.getLogger(AccessServiceApplication.class);

    public static void main(String[] args) {
        SpringApplication.run(AccessServiceApplication.class, args);
        log.info("Access service started successfully");
    }
}
