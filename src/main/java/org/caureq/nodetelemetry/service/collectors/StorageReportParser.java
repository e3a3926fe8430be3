package org.caureq.nodetelemetry.service.collectors;

import org.caureq.nodetelemetry.service.tools.ToolOutputParseException;

import java.util.ArrayList;
import java.util.List;

/**
 * Parses {@code df -h <mount>}: Filesystem Size Used Avail Use% Mounted-on.
 * df wraps the row when the filesystem name is long, so all lines after the header are joined.
 */
public final class StorageReportParser {
    static final int USED_COLUMN = 2;
    static final int PERCENT_COLUMN = 4;

    private StorageReportParser() {}

    public record StorageReading(double usageGb, double usagePercent) {}

    public static StorageReading parse(List<String> lines) {
        if (lines.size() < 2) {
            throw new ToolOutputParseException("expected a header and a data line, got " + lines.size() + " line(s)");
        }
        List<String> fields = new ArrayList<>();
        for (int i = 1; i < lines.size(); i++) {
            String line = lines.get(i).trim();
            if (!line.isEmpty()) fields.addAll(List.of(line.split("\\s+")));
        }
        if (fields.size() <= PERCENT_COLUMN) {
            throw new ToolOutputParseException("expected at least 5 fields, got " + fields);
        }
        String used = fields.get(USED_COLUMN);
        String pct = fields.get(PERCENT_COLUMN);
        try {
            return new StorageReading(toGigabytes(used), Double.parseDouble(pct.replace("%", "")));
        } catch (NumberFormatException e) {
            throw new ToolOutputParseException("unparseable used/percent fields: " + used + " " + pct, e);
        }
    }

    /** 179T -> 183296, 512G -> 512, 2P -> 2097152; any other suffix -> 0. */
    public static double toGigabytes(String size) {
        if (size == null || size.isBlank()) return 0;
        String s = size.trim();
        char unit = s.charAt(s.length() - 1);
        double factor = switch (unit) {
            case 'G' -> 1;
            case 'T' -> 1024;
            case 'P' -> 1024.0 * 1024;
            default -> 0;
        };
        if (factor == 0) return 0;
        return Double.parseDouble(s.substring(0, s.length() - 1)) * factor;
    }
}
