package io.github.samzhu.quota.controller;

import java.io.IOException;
import java.io.OutputStreamWriter;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import io.github.samzhu.quota.document.QuotaEvent;
import io.github.samzhu.quota.dto.api.InspectionResponse;
import io.github.samzhu.quota.model.QuotaEventType;
import io.github.samzhu.quota.model.QuotaUser;
import io.github.samzhu.quota.service.QuotaEventCsvWriter;
import io.github.samzhu.quota.service.QuotaEventFilter;
import io.github.samzhu.quota.service.QuotaEventRecorder;
import io.github.samzhu.quota.service.QuotaInspectorService;
import io.github.samzhu.quota.service.ReconciliationReport;
import io.github.samzhu.quota.service.UsageReconciliationService;

import jakarta.servlet.http.HttpServletResponse;

/**
 * 配額維運 API 控制器。
 *
 * <p>提供稽核事件查詢與匯出、用戶配額診斷、手動觸發對帳。
 */
@RestController
@RequestMapping("/api/v1/admin/quota")
public class QuotaOperationsController {

    private static final Logger log = LoggerFactory.getLogger(QuotaOperationsController.class);

    private final QuotaEventRecorder eventRecorder;
    private final QuotaEventCsvWriter csvWriter;
    private final QuotaInspectorService inspectorService;
    private final UsageReconciliationService reconciliationService;
    private final Clock clock;

    public QuotaOperationsController(
            QuotaEventRecorder eventRecorder,
            QuotaEventCsvWriter csvWriter,
            QuotaInspectorService inspectorService,
            UsageReconciliationService reconciliationService,
            Clock clock) {
        this.eventRecorder = eventRecorder;
        this.csvWriter = csvWriter;
        this.inspectorService = inspectorService;
        this.reconciliationService = reconciliationService;
        this.clock = clock;
    }

    // ========== 稽核事件 ==========

    /**
     * 查詢稽核事件，依時間降序。
     *
     * @param before 分頁游標，傳入上一頁最後一筆的 eventId
     * @param limit 筆數 (1-1000)，預設 50
     */
    @GetMapping("/events")
    public ResponseEntity<List<QuotaEvent>> listEvents(
            @RequestParam(required = false) String userId,
            @RequestParam(required = false) String tierId,
            @RequestParam(required = false) QuotaEventType eventType,
            @RequestParam(required = false) String before,
            @RequestParam(required = false) Integer limit) {
        return ResponseEntity.ok(eventRecorder.query(
            new QuotaEventFilter(userId, tierId, eventType, before), limit));
    }

    /**
     * 匯出稽核事件為 CSV。
     */
    @GetMapping("/events/export")
    public void exportEvents(
            @RequestParam(required = false) String userId,
            @RequestParam(required = false) String tierId,
            @RequestParam(required = false) QuotaEventType eventType,
            @RequestParam(required = false) String before,
            @RequestParam(required = false) Integer limit,
            HttpServletResponse response) throws IOException {

        List<QuotaEvent> events = eventRecorder.query(
            new QuotaEventFilter(userId, tierId, eventType, before), limit == null ? 1000 : limit);
        log.info("Exporting quota events: count={}, userId={}, tierId={}, eventType={}",
            events.size(), userId, tierId, eventType);

        response.setContentType("text/csv;charset=UTF-8");
        response.setHeader(HttpHeaders.CONTENT_DISPOSITION, "attachment; filename=\"quota-events.csv\"");
        Writer writer = new OutputStreamWriter(response.getOutputStream(), StandardCharsets.UTF_8);
        csvWriter.write(events, writer);
    }

    // ========== 診斷 ==========

    /**
     * 診斷用戶目前的配額狀態，不記錄事件。
     */
    @GetMapping("/inspector/users/{userId}")
    public ResponseEntity<InspectionResponse> inspect(
            @PathVariable String userId,
            @RequestParam(required = false) String email,
            @RequestParam(required = false) List<String> roles) {
        QuotaUser user = QuotaUser.of(userId, email, roles);
        return ResponseEntity.ok(InspectionResponse.from(inspectorService.inspect(user, clock.instant())));
    }

    // ========== 對帳 ==========

    @PostMapping("/reconciliation/run")
    public ResponseEntity<ReconciliationReport> runReconciliation() {
        log.info("Manual reconciliation triggered");
        return ResponseEntity.ok(reconciliationService.run(clock.instant()));
    }
}
