package io.github.samzhu.quota.service;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Email 網域比對規則。
 *
 * <p>支援的樣式：
 * <ul>
 *   <li>完全相符：{@code university.edu}</li>
 *   <li>子網域萬用字元：{@code *.university.edu}，同時符合 {@code university.edu} 本身</li>
 *   <li>正規表示式：{@code regex:^(cs|eng)\.university\.edu$}，從網域開頭比對，整個樣式視為一個 regex</li>
 *   <li>逗號清單：{@code a.edu, *.b.edu}，任一項符合即可</li>
 * </ul>
 *
 * <p>非 regex 樣式不分大小寫。不合法的 regex 永遠不符合並記錄警告，
 * 寫入時則由 {@link #validate(String)} 拒絕。
 */
public final class EmailDomainMatcher {

    private static final Logger log = LoggerFactory.getLogger(EmailDomainMatcher.class);

    static final String REGEX_PREFIX = "regex:";

    private EmailDomainMatcher() {
    }

    /**
     * 判斷網域是否符合樣式。
     *
     * @param pattern 指派上設定的樣式
     * @param domain 用戶 Email 網域，null 一律不符合
     * @return 是否符合
     */
    public static boolean matches(String pattern, String domain) {
        if (pattern == null || pattern.isBlank() || domain == null || domain.isBlank()) {
            return false;
        }
        String normalizedDomain = domain.trim().toLowerCase(Locale.ROOT);

        for (String part : splitPatterns(pattern)) {
            if (matchesSingle(part, normalizedDomain)) {
                return true;
            }
        }
        return false;
    }

    /**
     * 驗證樣式，回傳所有錯誤。
     *
     * @param pattern 樣式
     * @return 錯誤清單，合法時為空
     */
    public static List<String> validate(String pattern) {
        List<String> errors = new ArrayList<>();
        if (pattern == null || pattern.isBlank()) {
            errors.add("emailDomain is required for EMAIL_DOMAIN assignments");
            return errors;
        }
        for (String part : splitPatterns(pattern)) {
            if (part.startsWith(REGEX_PREFIX)) {
                try {
                    Pattern.compile(part.substring(REGEX_PREFIX.length()));
                } catch (PatternSyntaxException e) {
                    errors.add("Invalid regex pattern '" + part + "': " + e.getDescription());
                }
            } else if (part.equals("*.") || part.contains("@")) {
                errors.add("Invalid domain pattern: " + part);
            }
        }
        return errors;
    }

    private static List<String> splitPatterns(String pattern) {
        String trimmedPattern = pattern.trim();
        if (trimmedPattern.startsWith(REGEX_PREFIX)) {
            // regex 內可能有逗號，例如 {2,3}
            return List.of(trimmedPattern);
        }
        List<String> parts = new ArrayList<>();
        for (String raw : pattern.split(",")) {
            String trimmed = raw.trim();
            if (!trimmed.isEmpty()) {
                parts.add(trimmed);
            }
        }
        return parts;
    }

    private static boolean matchesSingle(String pattern, String domain) {
        if (pattern.startsWith(REGEX_PREFIX)) {
            String regex = pattern.substring(REGEX_PREFIX.length());
            try {
                return Pattern.compile(regex).matcher(domain).lookingAt();
            } catch (PatternSyntaxException e) {
                log.warn("Invalid email domain regex ignored: pattern={}, error={}", regex, e.getDescription());
                return false;
            }
        }

        String normalized = pattern.toLowerCase(Locale.ROOT);
        if (normalized.startsWith("*.")) {
            String base = normalized.substring(2);
            return domain.equals(base) || domain.endsWith("." + base);
        }
        return domain.equals(normalized);
    }
}
