package com.example.eventrelay.service.webhook;

/**
 * 单次 deliver 调用的结果。
 */
public enum DeliveryOutcome {
    DELIVERED,
    RETRY_SCHEDULED,
    FAILED,
    // 事件非 PENDING、未到期或正在投递中
    SKIPPED,
    // 事件或订阅不存在，或订阅已停用
    ABORTED
}
