package com.touristtax.reservation.config;

import com.touristtax.reservation.client.ImojeClient;
import org.springframework.cloud.openfeign.EnableFeignClients;
import org.springframework.context.annotation.Configuration;

/**
 * Feign registration lives here rather than on the application class so MVC slice tests
 * do not try to build gateway clients.
 */
@Configuration
@EnableFeignClients(clients = ImojeClient.class)
public class GatewayClientConfig {
}
