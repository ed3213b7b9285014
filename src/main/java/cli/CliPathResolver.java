package cli;

import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Map;

/** CLI path resolver (baseDir 기준 상대경로 해석). */
public final class CliPathResolver {

    private CliPathResolver() {}

    public static final String PROP_BASE_DIR = "baseDir";

    public static void applyBaseDirPropertyIfPresent(Map<String, String> argv) {
        String bd = (argv == null) ? null : argv.get("baseDir");
        if (bd == null || bd.isBlank()) return;
        System.setProperty(PROP_BASE_DIR, bd.trim());
    }
    public static Path resolveBaseDir() {
        String bd = System.getProperty(PROP_BASE_DIR);
        if (bd != null && !bd.isBlank()) {
            return resolveAgainstUserDir(bd).toAbsolutePath().normalize();
        }
        return Paths.get(".").toAbsolutePath().normalize();
    }
    public static Path resolvePath(Path baseDir, String input) {
        if (input == null || input.isBlank()) return null;
        Path p = Paths.get(input.trim());
        if (!p.isAbsolute()) {
            if (baseDir != null) p = baseDir.resolve(p);
            else p = resolveAgainstUserDir(input.trim());
        }
        return p.toAbsolutePath().normalize();
    }
    public static Path resolveAgainstUserDir(String raw) {
        if (raw == null || raw.isBlank()) return null;
        Path p = Paths.get(raw.trim());
        if (p.isAbsolute()) return p;
        return Paths.get(System.getProperty("user.dir")).resolve(p);
    }
    public static void validateFileExists(Path p, String label) {
        if (p == null) throw new IllegalArgumentException(label + " is required");
        if (!Files.exists(p)) throw new IllegalArgumentException(label + " not found: " + p);
        if (!Files.isRegularFile(p)) throw new IllegalArgumentException(label + " is not a file: " + p);
    }

    /** 기본 리포트 경로: data 파일 옆에 {@code <이름>.mapping.<ext>}. */
    public static Path defaultReportPath(Path dataFile, String extension) {
        String name = dataFile.getFileName().toString();
        int dot = name.lastIndexOf('.');
        String stem = dot > 0 ? name.substring(0, dot) : name;
        Path dir = dataFile.toAbsolutePath().normalize().getParent();
        Path out = Paths.get(stem + ".mapping." + extension);
        return dir == null ? out.toAbsolutePath().normalize() : dir.resolve(out).normalize();
    }
    public static String trimToNull(String s) {
        if (s == null) return null;
        String t = s.trim();
        return t.isEmpty() ? null : t;
    }
    public static boolean isBlank(String s) {
        return s == null || s.trim().isEmpty();
    }
}
