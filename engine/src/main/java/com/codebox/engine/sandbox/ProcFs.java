package com.codebox.engine.sandbox;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.OptionalLong;
import java.util.stream.Stream;

/**
 * Linux /proc readers used for best-effort memory accounting and liveness.
 * On other systems (or when a process vanished) they report "unknown".
 */
final class ProcFs {

    private static final Path PROC = Path.of("/proc");

    private ProcFs() {}

    static boolean available() {
        return Files.isDirectory(PROC.resolve("self"));
    }

    /** VmRSS of one process in bytes, empty when it cannot be read. */
    static OptionalLong residentBytes(long pid) {
        try {
            for (String line : Files.readAllLines(PROC.resolve(pid + "/status"), StandardCharsets.UTF_8)) {
                if (line.startsWith("VmRSS:")) {
                    String[] parts = line.substring(6).trim().split("\\s+");
                    return OptionalLong.of(Long.parseLong(parts[0]) * 1024L);   // reported in kB
                }
            }
        } catch (IOException | NumberFormatException e) {
            return OptionalLong.empty();
        }
        return OptionalLong.empty();   // kernel threads and zombies have no VmRSS line
    }

    /**
     * True while the process exists and is not a zombie. Falls back to
     * {@link ProcessHandle#isAlive()} when /proc is not available.
     */
    static boolean running(ProcessHandle handle) {
        if (!handle.isAlive()) return false;
        if (!available()) return true;
        try {
            String stat = Files.readString(PROC.resolve(handle.pid() + "/stat"), StandardCharsets.UTF_8);
            // Format: pid (comm) state ...   (comm may contain spaces and parens)
            int close = stat.lastIndexOf(')');
            return close < 0 || close + 2 >= stat.length() || stat.charAt(close + 2) != 'Z';
        } catch (IOException e) {
            return false;
        }
    }

    /**
     * Pids of the processes whose environment contains exactly {@code entry}
     * ("NAME=value"). Processes that cannot be read are skipped.
     */
    static List<Long> pidsWithEnvironment(String entry) {
        List<Long> pids = new ArrayList<>();
        if (!available()) return pids;
        byte[] needle = entry.getBytes(StandardCharsets.UTF_8);
        try (Stream<Path> entries = Files.list(PROC)) {
            entries.map(p -> p.getFileName().toString())
                    .filter(name -> !name.isEmpty() && name.chars().allMatch(Character::isDigit))
                    .forEach(name -> {
                        if (environContains(PROC.resolve(name + "/environ"), needle)) {
                            pids.add(Long.parseLong(name));
                        }
                    });
        } catch (IOException e) {
            return pids;
        }
        return pids;
    }

    private static boolean environContains(Path environ, byte[] needle) {
        byte[] env;
        try {
            env = Files.readAllBytes(environ);
        } catch (IOException e) {
            return false;   // gone, or owned by another user
        }
        // NUL-separated NAME=value entries
        int start = 0;
        for (int i = 0; i <= env.length; i++) {
            if (i == env.length || env[i] == 0) {
                if (i - start == needle.length && regionEquals(env, start, needle)) return true;
                start = i + 1;
            }
        }
        return false;
    }

    private static boolean regionEquals(byte[] haystack, int offset, byte[] needle) {
        for (int j = 0; j < needle.length; j++) {
            if (haystack[offset + j] != needle[j]) return false;
        }
        return true;
    }
}
