package com.example.eventrelay.model;

import java.time.Duration;

/**
 * 投递失败后的重试退避策略。
 */
public enum RetryBackoff {

    /**
     * 线性：第 n 次失败后等待 n+1 分钟。
     */
    LINEAR {
        @Override
        public Duration delayAfter(int attempts) {
            return Duration.ofMinutes(Math.max(attempts, 0) + 1L);
        }
    },

    /**
     * 指数：按固定表取值，最长 24 小时。
     */
    EXPONENTIAL {
        @Override
        public Duration delayAfter(int attempts) {
            int index = Math.min(Math.max(attempts, 0), EXPONENTIAL_MINUTES.length - 1);
            return Duration.ofMinutes(EXPONENTIAL_MINUTES[index]);
        }
    };

    private static final long[] EXPONENTIAL_MINUTES = {1, 5, 15, 60, 360, 1440};

    /**
     * @param attempts 已尝试次数
     * @return 距下次重试的等待时长
     */
    public abstract Duration delayAfter(int attempts);
}
