package com.my.inbox.adapter.out.git;

import com.my.inbox.domain.exception.GitSyncException;

/**
 * 왜: 실패한 git 명령의 종료 코드와 출력을 로그에 남길 수 있도록 함께 전달하기 위함.
 */
public class GitCommandException extends GitSyncException {

    private final int exitCode;
    private final String output;

    public GitCommandException(String command, int exitCode, String output) {
        super("git " + command + " failed (exit " + exitCode + "): " + output.trim());
        this.exitCode = exitCode;
        this.output = output;
    }

    public GitCommandException(String command, Throwable cause) {
        super("git " + command + " failed: " + cause.getMessage(), cause);
        this.exitCode = -1;
        this.output = "";
    }

    public int exitCode() {
        return exitCode;
    }

    public String output() {
        return output;
    }
}
