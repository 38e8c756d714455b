package com.graphgate.config.load;

import java.io.IOException;

/**
 * Destination for a serialized configuration, e.g. the effective configuration after merging
 * and compression so other gateway instances or operators can inspect it.
 */
public interface ConfigSink {

    /** Human-readable name used in logs. */
    String describe();

    /**
     * Writes configuration JSON, replacing any previous content.
     *
     * @param json configuration JSON
     */
    void write(String json) throws IOException;
}
