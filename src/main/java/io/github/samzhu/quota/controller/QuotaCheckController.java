package io.github.samzhu.quota.controller;

import java.time.Clock;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import io.github.samzhu.quota.dto.api.QuotaCheckRequest;
import io.github.samzhu.quota.dto.api.QuotaCheckResponse;
import io.github.samzhu.quota.service.QuotaCheckResult;
import io.github.samzhu.quota.service.QuotaChecker;

/**
 * 配額檢查 API 控制器，供聊天管線在呼叫模型前使用。
 */
@RestController
@RequestMapping("/api/v1/quota")
public class QuotaCheckController {

    private static final Logger log = LoggerFactory.getLogger(QuotaCheckController.class);

    private final QuotaChecker quotaChecker;
    private final Clock clock;

    public QuotaCheckController(QuotaChecker quotaChecker, Clock clock) {
        this.quotaChecker = quotaChecker;
        this.clock = clock;
    }

    /**
     * 檢查配額。
     *
     * @param request 用戶身分與請求資訊
     * @return 放行時 200，超過配額時 429，儲存層故障且 fail-closed 時 503
     */
    @PostMapping("/check")
    public ResponseEntity<QuotaCheckResponse> check(@RequestBody @Validated QuotaCheckRequest request) {
        QuotaCheckResult result = quotaChecker.checkQuota(
            request.toUser(), request.sessionId(), request.requestedModelId(), clock.instant());

        QuotaCheckResponse response = QuotaCheckResponse.from(result);
        if (!result.allowed() && result.degraded()) {
            log.warn("Quota check failed closed: userId={}", request.userId());
            return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE).body(response);
        }
        if (!result.allowed()) {
            log.info("Quota check blocked: userId={}, tierId={}, percentageUsed={}",
                request.userId(), result.tierId(), result.percentageUsed());
            return ResponseEntity.status(HttpStatus.TOO_MANY_REQUESTS).body(response);
        }
        return ResponseEntity.ok(response);
    }
}
