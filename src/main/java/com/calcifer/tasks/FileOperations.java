package com.calcifer.tasks;

import com.calcifer.backend.CommandResult;
import com.calcifer.backend.HostShell;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

import static com.calcifer.backend.AbstractHostShell.quote;

/**
 * Idempotent file writes on a host: compare, stage, back up, install.
 */
public final class FileOperations {

    static final String BACKUP_DIR = "/var/backups/calcifer";

    private FileOperations() {}

    /**
     * Makes {@code path} hold exactly {@code content}.
     *
     * @return true when the file was written, false when it already matched
     * @throws IllegalStateException when a write step fails
     */
    public static boolean ensureFile(HostShell shell, String path, String content, String owner, String mode) {
        String current = shell.readFile(path).orElse(null);
        if (content.equals(current)) {
            return false;
        }
        String staged = shell.stage(content);
        if (current != null) {
            String backup = BACKUP_DIR + "/" + path.replace('/', '_') + ".$(date +%Y%m%d_%H%M%S).bak";
            require(shell.sudo("mkdir -p " + BACKUP_DIR + " && cp " + quote(path) + " " + backup),
                    "backup of " + path);
        }
        String[] ownership = owner.split(":", 2);
        String group = ownership.length > 1 ? ownership[1] : ownership[0];
        require(shell.sudo("install -m " + mode + " -o " + ownership[0] + " -g " + group + " "
                + quote(staged) + " " + quote(path)), "install of " + path);
        return true;
    }

    /**
     * Makes sure {@code line} is present in the file. Lines matching {@code replacePattern}
     * are replaced by {@code line}; when none match it is appended.
     *
     * @return true when the file changed
     */
    public static boolean ensureLine(HostShell shell, String path, String line, Pattern replacePattern) {
        String current = shell.readFile(path).orElse("");
        String updated = withLine(current, line, replacePattern);
        if (updated.equals(current)) {
            return false;
        }
        return ensureFile(shell, path, updated, "root:root", "644");
    }

    static String withLine(String content, String line, Pattern replacePattern) {
        List<String> lines = new ArrayList<>(content.isEmpty() ? List.of() : List.of(content.split("\n", -1)));
        if (!lines.isEmpty() && lines.get(lines.size() - 1).isEmpty()) {
            lines.remove(lines.size() - 1);
        }
        boolean found = false;
        List<String> out = new ArrayList<>();
        for (String existing : lines) {
            if (replacePattern.matcher(existing).find()) {
                if (!found) {
                    out.add(line);
                    found = true;
                }
                continue;
            }
            out.add(existing);
        }
        if (!found) {
            out.add(line);
        }
        return String.join("\n", out) + "\n";
    }

    private static void require(CommandResult result, String what) {
        if (!result.succeeded()) {
            throw new IllegalStateException(what + " failed: " + result.errorSummary());
        }
    }
}
