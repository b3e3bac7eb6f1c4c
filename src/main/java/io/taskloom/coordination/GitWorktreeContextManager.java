package io.taskloom.coordination;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.stream.Stream;

/**
 * Isolated contexts as git worktrees. Each item works on branch {@code taskloom/item-<n>} in
 * {@code <worktreeRoot>/item-<n>}; reconciliation is a {@code --no-ff} merge into the trunk
 * branch of the main checkout. Shells out to the {@code git} CLI.
 */
public final class GitWorktreeContextManager implements IsolatedContextManager {
    private static final Logger log = LoggerFactory.getLogger(GitWorktreeContextManager.class);
    private static final String BRANCH_PREFIX = "taskloom/item-";
    private static final String DIR_PREFIX = "item-";

    private final Path repoRoot;
    private final Path worktreeRoot;
    private final String trunkBranch;

    public GitWorktreeContextManager(Path repoRoot, Path worktreeRoot, String trunkBranch) {
        this.repoRoot = repoRoot;
        this.worktreeRoot = worktreeRoot;
        this.trunkBranch = trunkBranch;
    }

    @Override
    public Path acquire(int itemNumber) throws IOException {
        Files.createDirectories(worktreeRoot);
        Path worktree = worktreeRoot.resolve(DIR_PREFIX + itemNumber).toAbsolutePath().normalize();
        String branch = branchName(itemNumber);
        if (Files.isDirectory(worktree.resolve(".git")) || Files.isRegularFile(worktree.resolve(".git"))) {
            log.info("Reusing existing worktree for item {} at {}", itemNumber, worktree);
            return worktree;
        }
        log.info("Adding worktree for item {} at {} (branch: {})", itemNumber, worktree, branch);
        int exitCode = runGit(repoRoot, "worktree", "add", worktree.toString(), "-b", branch, trunkBranch);
        if (exitCode != 0) {
            // branch left over from an earlier attempt
            log.info("Branch {} may already exist, checking it out instead", branch);
            exitCode = runGit(repoRoot, "worktree", "add", worktree.toString(), branch);
            if (exitCode != 0) {
                throw new IOException("Failed to create worktree for item " + itemNumber + " (exit code " + exitCode + ")");
            }
        }
        return worktree;
    }

    /**
     * Commits anything the worker left uncommitted, then lists files changed since the branch
     * left the trunk.
     */
    @Override
    public List<String> changedPaths(Path context) throws IOException {
        String status = runGitOutput(context, "status", "--porcelain");
        if (!status.isBlank()) {
            runGitChecked(context, "add", "-A");
            runGitChecked(context, "commit", "-m", "taskloom: uncommitted work in " + context.getFileName());
        }
        String diff = runGitOutput(context, "diff", "--name-only", trunkBranch + "...HEAD");
        List<String> out = new ArrayList<>();
        for (String line : diff.split("\n")) {
            if (!line.isBlank()) {
                out.add(line.trim());
            }
        }
        return out;
    }

    @Override
    public MergeAttempt merge(Path context, int itemNumber) throws IOException {
        String branch = branchName(itemNumber);
        int checkoutExit = runGit(repoRoot, "checkout", trunkBranch);
        if (checkoutExit != 0) {
            return MergeAttempt.conflict("Failed to checkout " + trunkBranch + " (exit code " + checkoutExit + ")");
        }
        int mergeExit = runGit(repoRoot, "merge", branch, "--no-ff", "-m", "Merge item " + itemNumber);
        if (mergeExit != 0) {
            int abortExit = runGit(repoRoot, "merge", "--abort");
            if (abortExit != 0) {
                log.warn("git merge --abort exited with {} for item {}", abortExit, itemNumber);
            }
            return MergeAttempt.conflict("Failed to merge branch " + branch + " (exit code " + mergeExit + ")");
        }
        log.info("Merged {} into {}", branch, trunkBranch);
        return MergeAttempt.ok();
    }

    /**
     * Removes the worktree. The branch is kept, so unmerged work can still be resolved by hand.
     */
    @Override
    public void release(Path context) throws IOException {
        if (context == null || !Files.exists(context)) {
            return;
        }
        int exitCode = runGit(repoRoot, "worktree", "remove", "--force", context.toString());
        if (exitCode != 0) {
            log.warn("git worktree remove failed for {}, deleting it manually", context);
            deleteDirectory(context);
            runGit(repoRoot, "worktree", "prune");
        }
    }

    static String branchName(int itemNumber) {
        return BRANCH_PREFIX + itemNumber;
    }

    int runGit(Path workDir, String... args) throws IOException {
        List<String> command = command(args);
        log.debug("Running: {}", command);
        Process process = new ProcessBuilder(command)
                .directory(workDir.toFile())
                .redirectErrorStream(true)
                .start();
        try (BufferedReader reader = new BufferedReader(new InputStreamReader(process.getInputStream(), StandardCharsets.UTF_8))) {
            String line;
            while ((line = reader.readLine()) != null) {
                log.debug("git: {}", line);
            }
        }
        try {
            return process.waitFor();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            process.destroyForcibly();
            throw new IOException("Interrupted while running " + command, e);
        }
    }

    private void runGitChecked(Path workDir, String... args) throws IOException {
        int exitCode = runGit(workDir, args);
        if (exitCode != 0) {
            throw new IOException("git " + String.join(" ", args) + " failed (exit code " + exitCode + ")");
        }
    }

    String runGitOutput(Path workDir, String... args) throws IOException {
        List<String> command = command(args);
        log.debug("Running (capture): {}", command);
        Process process = new ProcessBuilder(command)
                .directory(workDir.toFile())
                .redirectErrorStream(false)
                .redirectError(ProcessBuilder.Redirect.DISCARD)
                .start();
        String output;
        try (BufferedReader reader = new BufferedReader(new InputStreamReader(process.getInputStream(), StandardCharsets.UTF_8))) {
            output = String.join("\n", reader.lines().toList());
        }
        try {
            int exitCode = process.waitFor();
            if (exitCode != 0) {
                throw new IOException("git " + String.join(" ", args) + " failed (exit code " + exitCode + ")");
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            process.destroyForcibly();
            throw new IOException("Interrupted while running " + command, e);
        }
        return output;
    }

    private static List<String> command(String... args) {
        List<String> command = new ArrayList<>();
        command.add("git");
        command.addAll(List.of(args));
        return command;
    }

    private static void deleteDirectory(Path dir) throws IOException {
        try (Stream<Path> walk = Files.walk(dir)) {
            for (Path p : walk.sorted(Comparator.reverseOrder()).toList()) {
                Files.deleteIfExists(p);
            }
        }
    }
}
