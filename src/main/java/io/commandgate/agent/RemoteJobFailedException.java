package io.commandgate.agent;

public final class RemoteJobFailedException extends Exception {
    public RemoteJobFailedException(String jobId, String error) {
        super("remote job " + jobId + " failed: " + error);
    }
}
