package com.graphgate.config.transcode;

/**
 * Executable form of a gateway configuration. Built by a {@link Transcoder} and run by the
 * gateway runtime; this module only passes it along.
 */
public interface Blueprint {
}
