package org.caureq.nodetelemetry.service.collectors;

import org.caureq.nodetelemetry.service.tools.ToolOutputParseException;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class StorageReportParserTest {

    private static final String HEADER = "Filesystem      Size  Used Avail Use% Mounted on";

    @Test
    void parsesUsedAndPercentFromDfRow() {
        var reading = StorageReportParser.parse(List.of(
                HEADER,
                "nfs01:/rs01     250T  179T   71T  72% /rs01"));

        assertEquals(183296.0, reading.usageGb());
        assertEquals(72.0, reading.usagePercent());
    }

    @Test
    void joinsWrappedRowWhenFilesystemNameIsLong() {
        var reading = StorageReportParser.parse(List.of(
                HEADER,
                "storage-head-01.cluster.local:/export/rs01",
                "                 1.0P  512G  500T   1% /rs01"));

        assertEquals(512.0, reading.usageGb());
        assertEquals(1.0, reading.usagePercent());
    }

    @Test
    void convertsSizeSuffixesToGigabytes() {
        assertEquals(183296.0, StorageReportParser.toGigabytes("179T"));
        assertEquals(512.0, StorageReportParser.toGigabytes("512G"));
        assertEquals(2097152.0, StorageReportParser.toGigabytes("2P"));
        assertEquals(1.5, StorageReportParser.toGigabytes("1.5G"));
    }

    @Test
    void treatsOtherSuffixesAsZero() {
        assertEquals(0.0, StorageReportParser.toGigabytes("800M"));
        assertEquals(0.0, StorageReportParser.toGigabytes("12K"));
        assertEquals(0.0, StorageReportParser.toGigabytes("0"));
        assertEquals(0.0, StorageReportParser.toGigabytes("3t"));
        assertEquals(0.0, StorageReportParser.toGigabytes(""));
    }

    @Test
    void rejectsHeaderOnlyOutput() {
        assertThrows(ToolOutputParseException.class, () -> StorageReportParser.parse(List.of(HEADER)));
        assertThrows(ToolOutputParseException.class, () -> StorageReportParser.parse(List.of()));
    }

    @Test
    void rejectsRowWithTooFewFields() {
        assertThrows(ToolOutputParseException.class,
                () -> StorageReportParser.parse(List.of(HEADER, "nfs01:/rs01 250T 179T")));
    }

    @Test
    void rejectsNonNumericPercent() {
        var ex = assertThrows(ToolOutputParseException.class,
                () -> StorageReportParser.parse(List.of(HEADER, "nfs01:/rs01 250T 179T 71T -- /rs01")));
        assertTrue(ex.getMessage().contains("--"));
    }
}
