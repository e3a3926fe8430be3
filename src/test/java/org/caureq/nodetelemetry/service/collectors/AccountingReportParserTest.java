package org.caureq.nodetelemetry.service.collectors;

import org.caureq.nodetelemetry.service.collectors.AccountingReportParser.AccountReading;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class AccountingReportParserTest {

    @Test
    void skipsHeaderAndParsesAccountRows() {
        var readings = AccountingReportParser.parse(List.of(
                "Account CPU_Hours GPU_Hours",
                "alice 12.5 3.0",
                "bob    100   0"));

        assertEquals(List.of(
                new AccountReading("alice", 12.5, 3.0),
                new AccountReading("bob", 100.0, 0.0)), readings);
    }

    @Test
    void skipsBlankAndShortLines() {
        var readings = AccountingReportParser.parse(List.of(
                "Account CPU_Hours GPU_Hours",
                "",
                "carol 4",
                "   ",
                "dave 1 2"));

        assertEquals(1, readings.size());
        assertEquals("dave", readings.get(0).account());
    }

    @Test
    void skipsSeparatorAndNonNumericLines() {
        var readings = AccountingReportParser.parse(List.of(
                "Account CPU_Hours GPU_Hours",
                "------- --------- ---------",
                "eve n/a 1.0",
                "frank 2.0 1.0"));

        assertEquals(List.of(new AccountReading("frank", 2.0, 1.0)), readings);
    }

    @Test
    void headerOnlyGivesNoRows() {
        assertTrue(AccountingReportParser.parse(List.of("Account CPU_Hours GPU_Hours")).isEmpty());
        assertTrue(AccountingReportParser.parse(List.of()).isEmpty());
    }

    @Test
    void ignoresExtraColumns() {
        var readings = AccountingReportParser.parse(List.of(
                "Account CPU_Hours GPU_Hours Login",
                "grace 7.25 0.5 grace01"));

        assertEquals(new AccountReading("grace", 7.25, 0.5), readings.get(0));
    }
}
