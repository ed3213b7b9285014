package cli;

import java.util.HashMap;
import java.util.Locale;
import java.util.Map;

/**
 * CLI argument parsing helpers.
 */
public final class CliArgParser {

    /** 리포트 형식. 기본 xlsx. */
    public enum ReportFormat {
        XLSX, JSON
    }

    private CliArgParser() {
    }

    public static int parseInt(String s, int def) {
        if (s == null || s.isBlank()) return def;
        try {
            return Integer.parseInt(s.trim());
        } catch (Exception e) {
            return def;
        }
    }

    public static long parseLong(String s, long def) {
        if (s == null || s.isBlank()) return def;
        try {
            return Long.parseLong(s.trim());
        } catch (Exception e) {
            return def;
        }
    }

    public static boolean parseBoolean(String s, boolean def) {
        if (s == null || s.isBlank()) return def;
        String v = s.trim()
                .toLowerCase(Locale.ROOT);
        return v.equals("true") || v.equals("1") || v.equals("y") || v.equals("yes");
    }

    /**
     * Presence-style flag.
     * <ul>
     *   <li>--noExternal       => true</li>
     *   <li>--noExternal=true  => true</li>
     *   <li>--noExternal=false => false</li>
     * </ul>
     */
    public static boolean flag(Map<String, String> argv, String key) {
        if (argv == null || key == null) return false;
        if (!argv.containsKey(key)) return false;
        String raw = argv.get(key);
        if (raw == null || raw.isBlank()) return true;
        return parseBoolean(raw, true);
    }

    /**
     * --format 파싱.
     * <ul>
     *   <li>xlsx / excel -> XLSX</li>
     *   <li>json -> JSON</li>
     * </ul>
     * 비어 있으면 out 경로 확장자로 추정, 그것도 없으면 XLSX.
     */
    public static ReportFormat parseReportFormat(String raw, String outPath) {
        String v = raw == null ? "" : raw.trim()
                .toLowerCase(Locale.ROOT);
        if (v.isEmpty() && outPath != null) {
            String o = outPath.trim()
                    .toLowerCase(Locale.ROOT);
            if (o.endsWith(".json")) return ReportFormat.JSON;
            return ReportFormat.XLSX;
        }
        return switch (v) {
            case "", "xlsx", "excel", "xls" -> ReportFormat.XLSX;
            case "json" -> ReportFormat.JSON;
            default -> throw new IllegalArgumentException("Unknown --format: " + raw + " (xlsx|json)");
        };
    }

    public static Map<String, String> parseArgs(String[] args) {
        Map<String, String> m = new HashMap<>();
        if (args == null) return m;

        for (int i = 0; i < args.length; i++) {
            String a = args[i];
            if (a == null) continue;
            a = a.trim();
            if (!a.startsWith("--")) continue;

            String k;
            String v;

            int eq = a.indexOf('=');
            if (eq > 2) {
                k = a.substring(2, eq)
                        .trim();
                v = a.substring(eq + 1)
                        .trim();
            } else {
                k = a.substring(2)
                        .trim();
                v = "";
                if (i + 1 < args.length && args[i + 1] != null && !args[i + 1].startsWith("--")) {
                    v = args[i + 1].trim();
                    i++;
                }
            }

            if (!k.isEmpty()) m.put(k, v);
        }

        return m;
    }
}
