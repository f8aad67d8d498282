package com.example.eventrelay.service.webhook;

import java.io.IOException;
import java.time.Duration;
import java.util.Map;

/**
 * 出站 HTTP 投递。
 */
public interface WebhookSender {

    /**
     * 以 JSON 正文 POST 到目标地址。
     *
     * @throws IOException          网络错误或超时
     * @throws InterruptedException 等待响应时被中断
     */
    WebhookResponse post(String url, String body, Map<String, String> headers, Duration timeout)
            throws IOException, InterruptedException;

    record WebhookResponse(int statusCode, String body) {

        public boolean isSuccess() {
            return statusCode >= 200 && statusCode < 300;
        }
    }
}
