package com.graphgate.config.transcode;

/**
 * Thrown when a {@link Transcoder} cannot build a {@link Blueprint} from a configuration.
 * Checked so that callers decide how to recover (e.g. fall back to a previous configuration).
 */
public final class TranscodeException extends Exception {

    public TranscodeException(String message) {
        super(message);
    }

    public TranscodeException(String message, Throwable cause) {
        super(message, cause);
    }
}
