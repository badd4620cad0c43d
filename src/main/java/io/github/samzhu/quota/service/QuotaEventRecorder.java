package io.github.samzhu.quota.service;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;

import org.bson.types.ObjectId;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.SmartLifecycle;
import org.springframework.data.domain.Sort;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Criteria;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import io.github.samzhu.quota.config.QuotaProperties;
import io.github.samzhu.quota.document.QuotaEvent;

/**
 * 配額稽核事件記錄服務。
 *
 * <p>{@link #record(QuotaEvent)} 只把事件放進有界佇列，不碰資料庫，
 * 配額檢查的回應時間因此不受稽核寫入影響。事件在以下時機批次寫入：
 * <ul>
 *   <li>定時觸發（由 {@code quota.events.flush-interval} 配置，預設每秒）</li>
 *   <li>應用程式關閉時（graceful shutdown）</li>
 * </ul>
 *
 * <p>失敗處理：
 * <ul>
 *   <li>佇列已滿 - 丟棄事件並記錄警告</li>
 *   <li>寫入失敗 - 記錄錯誤，事件放回佇列（放不下的部分丟棄）等待下次 flush</li>
 *   <li>任何例外都不會傳回呼叫端</li>
 * </ul>
 *
 * @see <a href="https://docs.spring.io/spring-framework/reference/core/beans/factory-nature.html#beans-factory-lifecycle-processor">SmartLifecycle</a>
 */
@Service
public class QuotaEventRecorder implements SmartLifecycle {

    private static final Logger log = LoggerFactory.getLogger(QuotaEventRecorder.class);

    static final int DEFAULT_QUERY_LIMIT = 50;
    static final int MAX_QUERY_LIMIT = 1000;

    private final MongoTemplate mongoTemplate;
    private final BlockingQueue<QuotaEvent> queue;
    private final int batchSize;
    private final AtomicBoolean running = new AtomicBoolean(false);
    private final AtomicLong droppedCount = new AtomicLong();

    public QuotaEventRecorder(MongoTemplate mongoTemplate, QuotaProperties properties) {
        this.mongoTemplate = mongoTemplate;
        this.queue = new ArrayBlockingQueue<>(properties.events().bufferCapacity());
        this.batchSize = properties.events().batchSize();
    }

    /**
     * 非阻塞記錄事件。
     *
     * @param event 稽核事件
     */
    public void record(QuotaEvent event) {
        try {
            if (!queue.offer(event)) {
                long dropped = droppedCount.incrementAndGet();
                log.warn("Quota event queue full, dropping event: userId={}, type={}, totalDropped={}",
                    event.userId(), event.eventType(), dropped);
                return;
            }
            log.debug("Quota event queued: userId={}, type={}, queueSize={}",
                event.userId(), event.eventType(), queue.size());
        } catch (RuntimeException e) {
            log.error("Failed to queue quota event: {}", e.getMessage(), e);
        }
    }

    /**
     * 將佇列中的事件分批寫入資料庫。
     *
     * <p>此方法為 synchronized，確保同時只有一個執行緒執行 flush。
     */
    public synchronized void flush() {
        while (!queue.isEmpty()) {
            List<QuotaEvent> batch = new ArrayList<>(batchSize);
            queue.drainTo(batch, batchSize);
            if (batch.isEmpty()) {
                return;
            }
            try {
                mongoTemplate.insert(batch, QuotaEvent.class);
                log.debug("Flushed {} quota events", batch.size());
            } catch (RuntimeException e) {
                int requeued = requeue(batch);
                log.error("Failed to flush {} quota events, requeued={}, dropped={}: {}",
                    batch.size(), requeued, batch.size() - requeued, e.getMessage(), e);
                return;
            }
        }
    }

    /**
     * 定時觸發 flush。
     *
     * <p>只在服務 running 狀態時執行，避免啟動或關閉過程中執行。
     */
    @Scheduled(fixedDelayString = "${quota.events.flush-interval:PT1S}")
    public void scheduledFlush() {
        if (running.get()) {
            flush();
        }
    }

    /**
     * 查詢稽核事件，依時間降序（同時間依事件 ID 降序）。
     *
     * @param filter 查詢條件
     * @param limit 筆數，限制在 1 到 1000，null 時為 50
     * @return 事件清單
     */
    public List<QuotaEvent> query(QuotaEventFilter filter, Integer limit) {
        int effectiveLimit = clampLimit(limit);
        List<Criteria> criteria = new ArrayList<>();

        if (filter.userId() != null) {
            criteria.add(Criteria.where("userId").is(filter.userId()));
        }
        if (filter.tierId() != null) {
            criteria.add(Criteria.where("tierId").is(filter.tierId()));
        }
        if (filter.eventType() != null) {
            criteria.add(Criteria.where("eventType").is(filter.eventType()));
        }
        if (filter.before() != null && ObjectId.isValid(filter.before())) {
            criteria.add(cursorCriteria(filter.before()));
        }

        Query query = new Query();
        if (!criteria.isEmpty()) {
            query.addCriteria(new Criteria().andOperator(criteria));
        }
        query.with(Sort.by(Sort.Order.desc("timestamp"), Sort.Order.desc("_id")));
        query.limit(effectiveLimit);

        return mongoTemplate.find(query, QuotaEvent.class);
    }

    static int clampLimit(Integer limit) {
        if (limit == null) {
            return DEFAULT_QUERY_LIMIT;
        }
        return Math.max(1, Math.min(MAX_QUERY_LIMIT, limit));
    }

    /**
     * 游標條件：比游標事件舊，或時間相同但 ID 較小。
     * 游標事件已過期被刪除時，只比較 ID。
     */
    private Criteria cursorCriteria(String before) {
        QuotaEvent cursor = mongoTemplate.findById(before, QuotaEvent.class);
        if (cursor == null) {
            return Criteria.where("_id").lt(new ObjectId(before));
        }
        return new Criteria().orOperator(
            Criteria.where("timestamp").lt(cursor.timestamp()),
            new Criteria().andOperator(
                Criteria.where("timestamp").is(cursor.timestamp()),
                Criteria.where("_id").lt(new ObjectId(before))));
    }

    private int requeue(List<QuotaEvent> batch) {
        int requeued = 0;
        for (QuotaEvent event : batch) {
            if (!queue.offer(event)) {
                break;
            }
            requeued++;
        }
        droppedCount.addAndGet(batch.size() - requeued);
        return requeued;
    }

    // ===== SmartLifecycle Implementation =====

    @Override
    public void start() {
        running.set(true);
        log.info("QuotaEventRecorder started: capacity={}, batchSize={}",
            queue.remainingCapacity() + queue.size(), batchSize);
    }

    @Override
    public void stop() {
        log.info("QuotaEventRecorder stopping, flushing remaining {} events...", queue.size());
        running.set(false);
        flush();
        log.info("QuotaEventRecorder stopped: totalDropped={}", droppedCount.get());
    }

    @Override
    public boolean isRunning() {
        return running.get();
    }

    @Override
    public int getPhase() {
        // 在 web server 與 Spring Cloud Stream bindings 之後關閉
        return Integer.MAX_VALUE - 100;
    }

    @Override
    public void stop(Runnable callback) {
        stop();
        callback.run();
    }

    /**
     * 取得目前佇列大小，用於監控。
     */
    public int getQueueSize() {
        return queue.size();
    }

    public long getDroppedCount() {
        return droppedCount.get();
    }
}
