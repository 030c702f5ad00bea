package com.flow.sandbox;

/**
 * Output streams of a finished container.
 */
public record CapturedOutput(String stdout, String stderr) {

    public static final CapturedOutput EMPTY = new CapturedOutput("", "");

    public CapturedOutput {
        stdout = stdout != null ? stdout : "";
        stderr = stderr != null ? stderr : "";
    }
}
