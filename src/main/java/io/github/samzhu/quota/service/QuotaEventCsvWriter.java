package io.github.samzhu.quota.service;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.io.Writer;
import java.math.BigDecimal;
import java.util.List;
import java.util.Locale;

import org.springframework.stereotype.Component;

import io.github.samzhu.quota.document.QuotaEvent;

/**
 * 將稽核事件輸出為 CSV，供管理介面匯出。
 *
 * <p>欄位：{@code Event ID,User ID,Tier ID,Event Type,Current Usage,Quota Limit,Percentage Used,Timestamp}。
 * 含逗號、雙引號或換行的欄位以雙引號包住，內部雙引號重複一次（RFC 4180）。
 */
@Component
public class QuotaEventCsvWriter {

    static final String HEADER =
        "Event ID,User ID,Tier ID,Event Type,Current Usage,Quota Limit,Percentage Used,Timestamp";

    public void write(List<QuotaEvent> events, Writer writer) {
        try {
            writer.write(HEADER);
            writer.write("\r\n");
            for (QuotaEvent event : events) {
                writer.write(String.join(",",
                    escape(event.eventId()),
                    escape(event.userId()),
                    escape(event.tierId()),
                    escape(event.eventType() == null ? null : event.eventType().name()),
                    amount(event.currentUsage()),
                    amount(event.quotaLimit()),
                    String.format(Locale.ROOT, "%.2f", event.percentageUsed()),
                    escape(event.timestamp() == null ? null : event.timestamp().toString())));
                writer.write("\r\n");
            }
            writer.flush();
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to write quota events CSV", e);
        }
    }

    private static String amount(BigDecimal value) {
        return value == null ? "" : value.stripTrailingZeros().toPlainString();
    }

    static String escape(String value) {
        if (value == null) {
            return "";
        }
        if (value.contains(",") || value.contains("\"") || value.contains("\n") || value.contains("\r")) {
            return "\"" + value.replace("\"", "\"\"") + "\"";
        }
        return value;
    }
}
