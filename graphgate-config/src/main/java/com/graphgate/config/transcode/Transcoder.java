package com.graphgate.config.transcode;

import com.graphgate.config.GatewayConfiguration;

/**
 * Translates an effective configuration into a {@link Blueprint}. Implementations are provided
 * by the runtime; see {@link GatewayConfiguration#toBlueprint(Transcoder, boolean)} for the entry point.
 */
@FunctionalInterface
public interface Transcoder {

    /**
     * @param configuration effective (merged, optionally compressed) configuration
     * @param encodeSteps   whether step pipelines are embedded in encoded form
     * @return the blueprint, never null
     * @throws TranscodeException when no blueprint can be built from the configuration
     */
    Blueprint toBlueprint(GatewayConfiguration configuration, boolean encodeSteps) throws TranscodeException;
}
