package com.example.eventrelay.utils;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.net.InetAddress;
import java.net.URI;
import java.util.Arrays;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Webhook 目标地址 SSRF 校验
 * 注册订阅与测试投递前调用，拒绝指向回环、内网、链路本地地址或黑名单的 URL。
 */
@Component
@Slf4j
public class WebhookUrlValidator {

    private final boolean enabled;
    private final List<String> blockedIps;

    public WebhookUrlValidator(
            @Value("${app.security.ssrf.enabled:true}") boolean enabled,
            @Value("${app.security.ssrf.blocked-ips:127.0.0.1,localhost,10.0.0.0/8,172.16.0.0/12,192.168.0.0/16,169.254.169.254}") String blockedIpsConfig) {
        this.enabled = enabled;
        this.blockedIps = Arrays.stream(blockedIpsConfig.split(","))
                .map(String::trim)
                .filter(s -> !s.isEmpty())
                .collect(Collectors.toList());
    }

    /**
     * 校验目标 URL。
     *
     * @throws IllegalArgumentException URL 不合法或不安全
     */
    public void validate(String url) {
        if (url == null || url.isBlank()) {
            throw new IllegalArgumentException("Webhook URL is required");
        }
        URI uri;
        try {
            uri = URI.create(url.trim()).normalize();
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Invalid webhook URL: " + url);
        }

        String scheme = uri.getScheme();
        if (scheme == null || (!scheme.equalsIgnoreCase("http") && !scheme.equalsIgnoreCase("https"))) {
            throw new IllegalArgumentException("Blocked protocol: " + scheme);
        }

        String host = uri.getHost();
        if (host == null || host.isEmpty()) {
            throw new IllegalArgumentException("Host cannot be empty");
        }

        if (!enabled) {
            return;
        }

        if (host.equals("0.0.0.0") || host.equals("::") || host.equals("[::]")) {
            throw new IllegalArgumentException("Blocked wildcard address: " + host);
        }
        if (blockedIps.contains(host.toLowerCase())) {
            throw new IllegalArgumentException("Blocked host: " + host);
        }

        try {
            // 任意一个解析结果命中黑名单即拒绝整个域名（避免 DNS 轮询绕过）
            for (InetAddress addr : InetAddress.getAllByName(host)) {
                if (isBlockedAddress(addr)) {
                    log.warn("[SSRF] Found blocked IP: {} for host: {}", addr.getHostAddress(), host);
                    throw new IllegalArgumentException("Blocked IP detected: " + addr.getHostAddress());
                }
            }
        } catch (IllegalArgumentException e) {
            throw e;
        } catch (Exception e) {
            log.warn("[SSRF] Could not resolve {}: {}", host, e.getMessage());
            throw new IllegalArgumentException("Could not resolve host: " + host);
        }
    }

    /**
     * @param url 目标 URL
     * @return true 表示安全
     */
    public boolean isSafeUrl(String url) {
        try {
            validate(url);
            return true;
        } catch (IllegalArgumentException e) {
            return false;
        }
    }

    private boolean isBlockedAddress(InetAddress addr) {
        if (addr.isLoopbackAddress() || addr.isSiteLocalAddress() || addr.isLinkLocalAddress()
                || addr.isMulticastAddress() || addr.isAnyLocalAddress()) {
            return true;
        }

        byte[] bytes = addr.getAddress();

        // IPv6 ULA：fc00::/7
        if (bytes.length == 16 && (bytes[0] & 0xFE) == (byte) 0xFC) {
            return true;
        }

        String ip = addr.getHostAddress();
        for (String blocked : blockedIps) {
            if (blocked.contains("/")) {
                if (isInSubnet(bytes, blocked)) {
                    return true;
                }
            } else if (ip.equals(blocked)) {
                return true;
            }
        }
        return false;
    }

    private boolean isInSubnet(byte[] ipBytes, String cidr) {
        try {
            String[] parts = cidr.split("/");
            int bits = Integer.parseInt(parts[1]);
            byte[] subnetBytes = InetAddress.getByName(parts[0]).getAddress();
            if (subnetBytes.length != ipBytes.length) {
                return false;
            }

            int fullBytes = bits / 8;
            for (int i = 0; i < fullBytes; i++) {
                if (ipBytes[i] != subnetBytes[i]) {
                    return false;
                }
            }

            int remainingBits = bits % 8;
            if (remainingBits > 0) {
                int mask = (0xFF << (8 - remainingBits)) & 0xFF;
                return (ipBytes[fullBytes] & mask) == (subnetBytes[fullBytes] & mask);
            }
            return true;
        } catch (Exception e) {
            log.debug("[SSRF] Ignoring malformed CIDR {}: {}", cidr, e.getMessage());
            return false;
        }
    }
}
