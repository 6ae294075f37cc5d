package com.my.inbox.adapter.out.git;

import com.my.inbox.config.AppConfig;
import com.my.inbox.domain.port.out.VersionControlPort;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.TimeUnit;

/**
 * 왜: 서버에 설정된 git 자격 증명을 그대로 쓰기 위해 git CLI 를 하위 프로세스로 실행하기 위함.
 */
@ApplicationScoped
public class GitCliAdapter implements VersionControlPort {

    private static final Logger log = Logger.getLogger(GitCliAdapter.class);

    private final String binary;
    private final Path workingDirectory;
    private final Duration timeout;

    @Inject
    public GitCliAdapter(AppConfig appConfig) {
        this(appConfig.git().binary(), Path.of(appConfig.vault().path()),
                Duration.ofSeconds(appConfig.git().commandTimeoutSeconds()));
    }

    GitCliAdapter(String binary, Path workingDirectory, Duration timeout) {
        this.binary = binary;
        this.workingDirectory = workingDirectory.toAbsolutePath().normalize();
        this.timeout = timeout;
    }

    @Override
    public boolean hasUncommittedChanges() {
        return !run("status", "--porcelain").isBlank();
    }

    @Override
    public void stashPush(String marker) {
        run("stash", "push", "-u", "-m", marker);
    }

    @Override
    public boolean hasStash(String markerPrefix) {
        return run("stash", "list").contains(markerPrefix);
    }

    @Override
    public void stashPop() {
        run("stash", "pop");
    }

    @Override
    public boolean pull() {
        String before = run("rev-parse", "HEAD").trim();
        run("pull", "--no-rebase");
        String after = run("rev-parse", "HEAD").trim();
        return !before.equals(after);
    }

    @Override
    public void add(List<String> relativePaths) {
        List<String> args = new ArrayList<>(List.of("add", "--"));
        args.addAll(relativePaths);
        run(args.toArray(String[]::new));
    }

    @Override
    public boolean hasStagedChanges() {
        return !run("diff", "--cached", "--name-only").isBlank();
    }

    @Override
    public String commit(String message) {
        run("commit", "-m", message);
        return run("rev-parse", "--short", "HEAD").trim();
    }

    @Override
    public boolean hasUnpushedCommits() {
        return Integer.parseInt(run("rev-list", "--count", "@{u}..HEAD").trim()) > 0;
    }

    @Override
    public void push() {
        run("push");
    }

    String run(String... args) {
        List<String> command = new ArrayList<>();
        command.add(binary);
        command.addAll(List.of(args));
        String name = args[0];
        log.debugf("[Git] 실행: %s", command);
        Path outputFile = null;
        try {
            outputFile = Files.createTempFile("vault-inbox-git-", ".log");
            ProcessBuilder builder = new ProcessBuilder(command)
                    .directory(workingDirectory.toFile())
                    .redirectErrorStream(true)
                    .redirectOutput(outputFile.toFile());
            builder.environment().put("GIT_TERMINAL_PROMPT", "0");
            Process process = builder.start();
            process.getOutputStream().close();
            boolean finished = process.waitFor(timeout.toMillis(), TimeUnit.MILLISECONDS);
            if (!finished) {
                process.destroyForcibly();
                throw new GitCommandException(name, -1, "timed out after " + timeout.toSeconds() + "s");
            }
            String output = Files.readString(outputFile, StandardCharsets.UTF_8);
            if (process.exitValue() != 0) {
                throw new GitCommandException(name, process.exitValue(), output);
            }
            return output;
        } catch (IOException e) {
            throw new GitCommandException(name, e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new GitCommandException(name, e);
        } finally {
            deleteQuietly(outputFile);
        }
    }

    private static void deleteQuietly(Path file) {
        if (file == null) {
            return;
        }
        try {
            Files.deleteIfExists(file);
        } catch (IOException e) {
            log.debugf("임시 파일 삭제 실패: %s", file);
        }
    }
}
