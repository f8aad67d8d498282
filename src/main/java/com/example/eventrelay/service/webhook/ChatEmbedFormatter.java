package com.example.eventrelay.service.webhook;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.net.URI;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.time.format.FormatStyle;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * 聊天平台（Discord）Webhook 的 embed 格式转换
 * 目标为 discord.com / discordapp.com 且路径以 /api/webhooks 开头时使用，
 * 此类请求不附加签名等自定义请求头。
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class ChatEmbedFormatter {

    static final int COLOR_DEFAULT = 5814783;
    static final int COLOR_CREATED = 3066993;
    static final int COLOR_UPDATED = 15844367;
    static final int COLOR_DELETED = 15158332;
    static final int COLOR_PUBLISHED = 10181046;

    private static final int MAX_FIELDS = 10;
    private static final int MAX_VALUE_LENGTH = 100;
    private static final int MAX_CONTENT_LENGTH = 2000;
    private static final DateTimeFormatter DATE_FORMAT = DateTimeFormatter
            .ofLocalizedDateTime(FormatStyle.MEDIUM)
            .withLocale(Locale.getDefault())
            .withZone(ZoneId.systemDefault());

    private final ObjectMapper objectMapper;

    public boolean supports(String url) {
        try {
            URI uri = URI.create(url);
            String host = uri.getHost() == null ? "" : uri.getHost().toLowerCase();
            String path = uri.getPath() == null ? "" : uri.getPath();
            return (host.equals("discord.com") || host.equals("discordapp.com")) && path.startsWith("/api/webhooks");
        } catch (IllegalArgumentException e) {
            return false;
        }
    }

    /**
     * 将 {event, timestamp, data} 信封转换为 embed；解析失败时退化为纯文本消息。
     */
    public String format(String envelope) {
        try {
            JsonNode root = objectMapper.readTree(envelope);
            String event = root.get("event").asText();

            ObjectNode embed = objectMapper.createObjectNode();
            embed.put("title", titleOf(event));
            embed.put("description", "Event: `" + event + "`");
            embed.put("color", colorOf(event));

            ArrayNode fields = embed.putArray("fields");
            List<ObjectNode> collected = new ArrayList<>();
            JsonNode data = root.get("data");
            if (data != null && data.isObject()) {
                collectFields(data, "", collected);
            }
            collected.forEach(fields::add);

            if (root.hasNonNull("timestamp")) {
                embed.put("timestamp", root.get("timestamp").asText());
            }
            embed.putObject("footer").put("text", "Webhook Event");

            ObjectNode payload = objectMapper.createObjectNode();
            payload.putArray("embeds").add(embed);
            return objectMapper.writeValueAsString(payload);
        } catch (Exception e) {
            log.warn("[Webhook] Failed to transform payload to chat embed format: {}", e.getMessage());
            return fallback(envelope);
        }
    }

    private String fallback(String envelope) {
        String truncated = envelope.length() > 100 ? envelope.substring(0, 100) : envelope;
        String content = "Webhook event received: " + truncated + "...";
        if (content.length() > MAX_CONTENT_LENGTH) {
            content = content.substring(0, MAX_CONTENT_LENGTH);
        }
        try {
            return objectMapper.writeValueAsString(Map.of("content", content));
        } catch (Exception e) {
            throw new IllegalStateException("Cannot serialize fallback content", e);
        }
    }

    static String titleOf(String event) {
        StringBuilder title = new StringBuilder();
        for (String word : event.split("\\.")) {
            if (word.isEmpty()) {
                continue;
            }
            if (title.length() > 0) {
                title.append(' ');
            }
            title.append(Character.toUpperCase(word.charAt(0))).append(word.substring(1));
        }
        return title.toString();
    }

    static int colorOf(String event) {
        if (event.contains("created")) {
            return COLOR_CREATED;
        } else if (event.contains("updated")) {
            return COLOR_UPDATED;
        } else if (event.contains("deleted")) {
            return COLOR_DELETED;
        } else if (event.contains("published")) {
            return COLOR_PUBLISHED;
        }
        return COLOR_DEFAULT;
    }

    // 只展开一层嵌套对象，数组与更深层对象跳过
    private void collectFields(JsonNode node, String prefix, List<ObjectNode> out) {
        Iterator<Map.Entry<String, JsonNode>> it = node.fields();
        while (it.hasNext() && out.size() < MAX_FIELDS) {
            Map.Entry<String, JsonNode> entry = it.next();
            String key = entry.getKey();
            JsonNode value = entry.getValue();
            if (value == null || value.isNull() || value.isMissingNode()) {
                continue;
            }
            if (value.isObject()) {
                if (prefix.isEmpty()) {
                    collectFields(value, key, out);
                }
                continue;
            }

            String name = prefix.isEmpty() ? key : prefix + "." + key;
            String text = value.isValueNode() ? value.asText() : value.toString();
            if (text.length() > MAX_VALUE_LENGTH) {
                text = text.substring(0, 97) + "...";
            }
            if ((key.contains("At") || key.equals("timestamp")) && value.isValueNode()) {
                text = formatDate(value, text);
            }

            ObjectNode field = objectMapper.createObjectNode();
            field.put("name", Character.toUpperCase(name.charAt(0)) + name.substring(1));
            field.put("value", text);
            field.put("inline", true);
            out.add(field);
        }
    }

    private String formatDate(JsonNode value, String fallback) {
        try {
            Instant instant = value.isNumber()
                    ? Instant.ofEpochMilli(value.asLong())
                    : OffsetDateTime.parse(value.asText()).toInstant();
            return DATE_FORMAT.format(instant);
        } catch (Exception e) {
            try {
                return DATE_FORMAT.format(Instant.parse(value.asText()));
            } catch (Exception ignored) {
                return fallback;
            }
        }
    }
}
