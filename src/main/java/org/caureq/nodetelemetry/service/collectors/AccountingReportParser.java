package org.caureq.nodetelemetry.service.collectors;

import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;

/**
 * Parses the whitespace-tabulated accounting report (Account, CPU_Hours, GPU_Hours).
 * First line is the header. Short lines are skipped silently, lines with non-numeric hours
 * (separators, banners) are skipped with a debug trace.
 */
@Slf4j
public final class AccountingReportParser {
    static final int MIN_FIELDS = 3;

    private AccountingReportParser() {}

    public record AccountReading(String account, double cpuHours, double gpuHours) {}

    public static List<AccountReading> parse(List<String> lines) {
        List<AccountReading> out = new ArrayList<>();
        for (int i = 1; i < lines.size(); i++) {
            String line = lines.get(i).trim();
            String[] parts = line.split("\\s+");
            if (line.isEmpty() || parts.length < MIN_FIELDS) continue;
            try {
                out.add(new AccountReading(parts[0], Double.parseDouble(parts[1]), Double.parseDouble(parts[2])));
            } catch (NumberFormatException e) {
                log.debug("[Accounting] skipping line '{}'", line);
            }
        }
        return out;
    }
}
