package etlflow.engine.execution;

/**
 * Outcome of one attempt to run a job body.
 */
public record ProcessResult(String output, String errorOutput, int exitCode, boolean timedOut) {

    public static ProcessResult failure(String errorOutput) {
        return new ProcessResult("", errorOutput, 1, false);
    }

    public boolean succeeded() {
        return exitCode == 0;
    }
}
