package com.example.eventrelay;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableAsync;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableAsync
@EnableScheduling
public class EventRelayApplication {

    public static void main(String[] args) {
        // Webhook 目标地址的 DNS 解析缓存 60 秒，与 SSRF 校验保持一致
        java.security.Security.setProperty("networkaddress.cache.ttl", "60");
        SpringApplication.run(EventRelayApplication.class, args);
    }

}
