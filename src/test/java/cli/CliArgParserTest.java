package cli;

import cli.CliArgParser.ReportFormat;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class CliArgParserTest {

    @Test
    void parses_equals_and_space_separated_values() {
        Map<String, String> m = CliArgParser.parseArgs(new String[]{
                "--data=applicants.xlsx", "--template", "card.hwpx", "--noExternal", "--sheet", "명단", "stray"
        });

        assertEquals("applicants.xlsx", m.get("data"));
        assertEquals("card.hwpx", m.get("template"));
        assertEquals("", m.get("noExternal"));
        assertEquals("명단", m.get("sheet"));
        assertEquals(4, m.size());
    }

    @Test
    void flag_presence_and_explicit_values() {
        Map<String, String> m = CliArgParser.parseArgs(new String[]{"--noExternal", "--noReport=false"});

        assertTrue(CliArgParser.flag(m, "noExternal"));
        assertFalse(CliArgParser.flag(m, "noReport"));
        assertFalse(CliArgParser.flag(m, "help"));
    }

    @Test
    void numbers_fall_back_to_default() {
        assertEquals(5000L, CliArgParser.parseLong("5000", 1L));
        assertEquals(1L, CliArgParser.parseLong("5s", 1L));
        assertEquals(7, CliArgParser.parseInt(" ", 7));
    }

    @Test
    void report_format_from_option_or_out_extension() {
        assertEquals(ReportFormat.JSON, CliArgParser.parseReportFormat("JSON", null));
        assertEquals(ReportFormat.XLSX, CliArgParser.parseReportFormat("excel", "x.json"));
        assertEquals(ReportFormat.JSON, CliArgParser.parseReportFormat(null, "out/report.JSON"));
        assertEquals(ReportFormat.XLSX, CliArgParser.parseReportFormat("", "out/report.xlsx"));
        assertEquals(ReportFormat.XLSX, CliArgParser.parseReportFormat(null, null));
        assertThrows(IllegalArgumentException.class, () -> CliArgParser.parseReportFormat("pdf", null));
    }
}
