package com.engram.core.history;

import com.engram.core.config.EngramProperties;
import com.engram.core.engine.Deadline;
import com.engram.core.model.CommitInfo;
import com.engram.core.model.Contributor;
import com.engram.core.model.HistorySummary;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Reads history by shelling out to the {@code git} CLI via {@link ProcessBuilder}.
 * <p>
 * Four read-only queries are issued: recent commits, commit count, first commit date and
 * contributors. Each one runs under its own timeout and a failure only empties the fields
 * that query feeds.
 */
@Component
public class GitCliHistoryProvider implements HistoryProvider {

    private static final Logger log = LoggerFactory.getLogger(GitCliHistoryProvider.class);

    /** ASCII unit separator, emitted by {@code %x1f}; never appears in names or subjects. */
    static final String FIELD_SEPARATOR = "\u001f";
    static final int HASH_LENGTH = 8;

    private static final Pattern SHORTLOG_LINE = Pattern.compile("\\s*(\\d+)\\s+(.*)");

    private final EngramProperties properties;

    public GitCliHistoryProvider(EngramProperties properties) {
        this.properties = properties;
    }

    @Override
    public HistorySummary extractHistory(Path root, int limit, Deadline deadline) {
        if (!Files.exists(root.resolve(".git"))) {
            log.debug("No .git in {}, skipping history", root);
            return HistorySummary.empty();
        }

        var warnings = new ArrayList<String>();
        List<CommitInfo> commits = List.of();
        List<Contributor> contributors = List.of();
        int commitCount = 0;
        String firstCommitDate = "";

        try {
            String out = query(root, deadline, "log", "-" + Math.max(limit, 0),
                    "--format=%H%x1f%an%x1f%ad%x1f%s", "--date=short");
            commits = parseCommits(out, properties.getMessageMaxLength());
        } catch (GitQueryException e) {
            warnings.add(degraded("recent commits", e));
        }

        try {
            commitCount = parseCount(query(root, deadline, "rev-list", "--count", "HEAD"));
        } catch (GitQueryException e) {
            warnings.add(degraded("commit count", e));
        }

        try {
            firstCommitDate = lastLine(query(root, deadline,
                    "log", "--max-parents=0", "--format=%ad", "--date=short", "HEAD"));
        } catch (GitQueryException e) {
            warnings.add(degraded("first commit date", e));
        }

        try {
            contributors = parseShortlog(query(root, deadline, "shortlog", "-sn", "--no-merges", "HEAD"),
                    properties.getContributorLimit());
        } catch (GitQueryException e) {
            warnings.add(degraded("contributors", e));
        }

        String lastCommitDate = commits.isEmpty() ? "" : commits.get(0).date();
        return new HistorySummary(commits, contributors, commitCount, firstCommitDate, lastCommitDate, warnings);
    }

    private String query(Path root, Deadline deadline, String... args) throws GitQueryException {
        if (deadline.isExpired()) {
            throw new GitQueryException("deadline reached");
        }
        Duration timeout = deadline.clamp(Duration.ofSeconds(properties.getQueryTimeoutSeconds()));
        return runGit(root, timeout, args);
    }

    private static String degraded(String field, GitQueryException e) {
        log.warn("git query for {} failed: {}", field, e.getMessage());
        return "history: " + field + " unavailable (" + e.getMessage() + ")";
    }

    /**
     * Runs a git command and captures stdout. Stderr is discarded and stdin is closed so
     * the process can never wait for input.
     *
     * @param workDir working directory for the git command
     * @param timeout how long to wait before the process is killed
     * @param args    git arguments
     * @return captured stdout
     * @throws GitQueryException if git cannot be started, times out or exits non-zero
     */
    String runGit(Path workDir, Duration timeout, String... args) throws GitQueryException {
        List<String> command = gitCommand(args);
        log.debug("Running (capture): {}", command);

        Process process;
        try {
            process = new ProcessBuilder(command)
                    .directory(workDir.toFile())
                    .redirectError(ProcessBuilder.Redirect.DISCARD)
                    .start();
        } catch (IOException e) {
            throw new GitQueryException("git not available", e);
        }

        try {
            process.getOutputStream().close();
            CompletableFuture<String> stdout = CompletableFuture.supplyAsync(() -> readAll(process.getInputStream()));
            if (!process.waitFor(timeout.toMillis(), TimeUnit.MILLISECONDS)) {
                process.destroyForcibly();
                throw new GitQueryException("timed out after " + timeout.toMillis() + "ms");
            }
            int exitCode = process.exitValue();
            if (exitCode != 0) {
                throw new GitQueryException("git " + args[0] + " exited with code " + exitCode);
            }
            return stdout.get(timeout.toMillis() + 1_000, TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            process.destroyForcibly();
            throw new GitQueryException("interrupted", e);
        } catch (IOException | ExecutionException | TimeoutException e) {
            process.destroyForcibly();
            throw new GitQueryException("could not read git output", e);
        }
    }

    /** Full command line for a git invocation. */
    List<String> gitCommand(String... args) {
        var command = new ArrayList<String>();
        command.add("git");
        command.addAll(List.of(args));
        return command;
    }

    private static String readAll(InputStream in) {
        try (in) {
            return new String(in.readAllBytes(), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    static List<CommitInfo> parseCommits(String output, int messageMaxLength) {
        var commits = new ArrayList<CommitInfo>();
        for (String line : output.split("\n")) {
            if (line.isBlank()) {
                continue;
            }
            String[] parts = line.split(FIELD_SEPARATOR, 4);
            if (parts.length < 4) {
                continue;
            }
            commits.add(new CommitInfo(
                    truncate(parts[0], HASH_LENGTH),
                    parts[1],
                    parts[2],
                    truncate(parts[3], messageMaxLength)));
        }
        return commits;
    }

    static int parseCount(String output) throws GitQueryException {
        try {
            return Integer.parseInt(output.strip());
        } catch (NumberFormatException e) {
            throw new GitQueryException("unexpected rev-list output", e);
        }
    }

    /** {@code --max-parents=0} lists root commits newest first; the oldest is last. */
    static String lastLine(String output) {
        String result = "";
        for (String line : output.split("\n")) {
            if (!line.isBlank()) {
                result = line.strip();
            }
        }
        return result;
    }

    static List<Contributor> parseShortlog(String output, int limit) {
        var contributors = new ArrayList<Contributor>();
        for (String line : output.split("\n")) {
            if (contributors.size() >= limit) {
                break;
            }
            Matcher m = SHORTLOG_LINE.matcher(line);
            if (m.matches()) {
                contributors.add(new Contributor(m.group(2).strip(), Integer.parseInt(m.group(1))));
            }
        }
        return contributors;
    }

    private static String truncate(String value, int max) {
        return value.length() <= max ? value : value.substring(0, max);
    }
}
