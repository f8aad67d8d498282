package com.example.eventrelay.repository;

import com.example.eventrelay.model.DeliveryStatus;
import com.example.eventrelay.model.WebhookEvent;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.JpaSpecificationExecutor;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.LocalDateTime;
import java.util.List;

/**
 * Webhook 投递记录仓储。
 * 按 nextRetry 排序的 PENDING 记录即为延迟重试队列。
 */
@Repository
public interface WebhookEventRepository
                extends JpaRepository<WebhookEvent, Long>, JpaSpecificationExecutor<WebhookEvent> {

        /**
         * 查询已到期的待投递事件，按 nextRetry 升序。
         * 只返回所属订阅仍处于启用状态的事件，停用订阅下的积压不会占满批次；重新启用后自动恢复。
         *
         * @param now      当前时间
         * @param pageable 批量上限
         * @return 到期事件 ID
         */
        @Query("SELECT e.id FROM WebhookEvent e WHERE e.status = com.example.eventrelay.model.DeliveryStatus.PENDING "
                        + "AND e.nextRetry <= :now "
                        + "AND EXISTS (SELECT s.id FROM WebhookSubscription s WHERE s.id = e.subscriptionId AND s.active = true) "
                        + "ORDER BY e.nextRetry ASC")
        List<Long> findDueIds(@Param("now") LocalDateTime now, Pageable pageable);

        /**
         * 按状态统计事件数
         *
         * @param status 目标状态
         * @return 指定状态的事件数量
         */
        long countByStatus(DeliveryStatus status);

        long countBySubscriptionId(Long subscriptionId);

        void deleteBySubscriptionId(Long subscriptionId);
}
