package io.github.samzhu.quota.service;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Function;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import io.github.samzhu.quota.document.QuotaAssignment;
import io.github.samzhu.quota.document.QuotaTier;
import io.github.samzhu.quota.exception.QuotaNotFoundException;
import io.github.samzhu.quota.model.AssignmentType;
import io.github.samzhu.quota.model.QuotaUser;
import io.github.samzhu.quota.repository.QuotaAssignmentRepository;
import io.github.samzhu.quota.repository.QuotaTierRepository;

/**
 * 用戶方案解析器。
 *
 * <p>依 {@link AssignmentType#PRECEDENCE} 逐層比對：
 * <ol>
 *   <li>{@code DIRECT_USER} - 指派給 userId</li>
 *   <li>{@code JWT_ROLE} - 指派給用戶持有的任一角色</li>
 *   <li>{@code EMAIL_DOMAIN} - 網域樣式符合，見 {@link EmailDomainMatcher}</li>
 *   <li>{@code DEFAULT_TIER} - 系統預設</li>
 * </ol>
 *
 * <p>同一層級內只考慮已啟用、且指向存在並已啟用方案的指派；
 * priority 高者勝出，相同時取 tierId 字典序最小者。
 * 層級沒有可用指派就往下一層，連預設方案都沒有時拋出 {@link QuotaNotFoundException}。
 *
 * <p>此類別只讀取資料，不產生任何副作用，可供檢查器與診斷工具共用。
 */
@Service
public class AssignmentResolver {

    private static final Logger log = LoggerFactory.getLogger(AssignmentResolver.class);

    private final QuotaAssignmentRepository assignmentRepository;
    private final QuotaTierRepository tierRepository;

    public AssignmentResolver(
            QuotaAssignmentRepository assignmentRepository,
            QuotaTierRepository tierRepository) {
        this.assignmentRepository = assignmentRepository;
        this.tierRepository = tierRepository;
    }

    /**
     * 解析用戶適用的方案。
     *
     * @param user 用戶身分
     * @return 方案與勝出層級
     * @throws QuotaNotFoundException 沒有任何可用的預設方案
     */
    public ResolvedTier resolve(QuotaUser user) {
        for (AssignmentType level : AssignmentType.PRECEDENCE) {
            Optional<ResolvedTier> resolved = resolveLevel(level, user);
            if (resolved.isPresent()) {
                log.debug("Tier resolved: userId={}, tierId={}, matchedBy={}",
                    user.userId(), resolved.get().tier().tierId(), resolved.get().matchedBy());
                return resolved.get();
            }
        }
        log.error("No default tier configured, cannot resolve quota: userId={}", user.userId());
        throw QuotaNotFoundException.noDefaultTier();
    }

    /**
     * 只解析預設方案，不存在時回傳 empty。
     */
    public Optional<ResolvedTier> resolveDefault() {
        return pickHighestPriority(AssignmentType.DEFAULT_TIER,
            assignmentRepository.findByAssignmentTypeAndEnabledTrue(AssignmentType.DEFAULT_TIER));
    }

    /**
     * 假設某筆指派被取代（或刪除）後的預設方案，不寫入資料庫。
     *
     * @param assignmentId 被取代的指派
     * @param replacement 取代後的內容，null 表示刪除
     * @return 變更後仍可用的預設方案
     */
    public Optional<ResolvedTier> resolveDefaultReplacing(String assignmentId, QuotaAssignment replacement) {
        List<QuotaAssignment> candidates = new ArrayList<>();
        for (QuotaAssignment assignment : assignmentRepository
                .findByAssignmentTypeAndEnabledTrue(AssignmentType.DEFAULT_TIER)) {
            if (!Objects.equals(assignment.assignmentId(), assignmentId)) {
                candidates.add(assignment);
            }
        }
        if (replacement != null && replacement.assignmentType() == AssignmentType.DEFAULT_TIER) {
            candidates.add(replacement);
        }
        return pickHighestPriority(AssignmentType.DEFAULT_TIER, candidates, tierRepository::findById);
    }

    /**
     * 假設某個方案改為 {@code replacement} 後的預設方案，不寫入資料庫。
     */
    public Optional<ResolvedTier> resolveDefaultWithTier(QuotaTier replacement) {
        return pickHighestPriority(AssignmentType.DEFAULT_TIER,
            assignmentRepository.findByAssignmentTypeAndEnabledTrue(AssignmentType.DEFAULT_TIER),
            tierId -> tierId.equals(replacement.tierId())
                ? Optional.of(replacement)
                : tierRepository.findById(tierId));
    }

    private Optional<ResolvedTier> resolveLevel(AssignmentType level, QuotaUser user) {
        List<QuotaAssignment> candidates = switch (level) {
            case DIRECT_USER -> assignmentRepository
                .findByAssignmentTypeAndUserIdAndEnabledTrue(level, user.userId());
            case JWT_ROLE -> user.roles().isEmpty()
                ? List.of()
                : assignmentRepository.findByAssignmentTypeAndJwtRoleInAndEnabledTrue(level, user.roles());
            case EMAIL_DOMAIN -> user.emailDomain() == null
                ? List.of()
                : matchingDomainAssignments(user.emailDomain());
            case DEFAULT_TIER -> assignmentRepository.findByAssignmentTypeAndEnabledTrue(level);
        };
        return pickHighestPriority(level, candidates);
    }

    private List<QuotaAssignment> matchingDomainAssignments(String emailDomain) {
        List<QuotaAssignment> matched = new ArrayList<>();
        for (QuotaAssignment assignment : assignmentRepository
                .findByAssignmentTypeAndEnabledTrue(AssignmentType.EMAIL_DOMAIN)) {
            if (EmailDomainMatcher.matches(assignment.emailDomain(), emailDomain)) {
                matched.add(assignment);
            }
        }
        return matched;
    }

    private Optional<ResolvedTier> pickHighestPriority(AssignmentType level, List<QuotaAssignment> candidates) {
        return pickHighestPriority(level, candidates, tierRepository::findById);
    }

    private Optional<ResolvedTier> pickHighestPriority(
            AssignmentType level,
            List<QuotaAssignment> candidates,
            Function<String, Optional<QuotaTier>> tierLookup) {
        List<QuotaAssignment> ordered = new ArrayList<>();
        for (QuotaAssignment candidate : candidates) {
            if (candidate.enabled() && candidate.tierId() != null) {
                ordered.add(candidate);
            }
        }
        ordered.sort(Comparator.comparingInt(QuotaAssignment::priority).reversed()
            .thenComparing(QuotaAssignment::tierId));

        for (QuotaAssignment assignment : ordered) {
            Optional<QuotaTier> tier = tierLookup.apply(assignment.tierId());
            if (tier.isEmpty()) {
                log.warn("Assignment references missing tier: assignmentId={}, tierId={}",
                    assignment.assignmentId(), assignment.tierId());
                continue;
            }
            if (!tier.get().enabled()) {
                log.debug("Skipping disabled tier: assignmentId={}, tierId={}",
                    assignment.assignmentId(), assignment.tierId());
                continue;
            }
            return Optional.of(new ResolvedTier(tier.get(), level.matchedBy(), assignment));
        }
        return Optional.empty();
    }
}
