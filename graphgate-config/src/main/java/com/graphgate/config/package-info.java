/**
 * Gateway configuration: model, layering, compression and JSON serialization.
 *
 * <ul>
 *   <li>{@link com.graphgate.config.GatewayConfiguration} – root value;
 *       {@link com.graphgate.config.GatewayConfiguration#mergeRight mergeRight} (right-biased overlay, whole-type replace)
 *       and {@link com.graphgate.config.GatewayConfiguration#compress compress} (minimal equivalent form)</li>
 *   <li>{@link com.graphgate.config.schema} – fields and arguments of GraphQL types</li>
 *   <li>{@link com.graphgate.config.step} – resolution steps (HTTP call, constant, object path)</li>
 *   <li>{@link com.graphgate.config.codec} – {@code fromJson}/{@code toJson} with path-aware decode errors</li>
 *   <li>{@link com.graphgate.config.load} – {@link com.graphgate.config.load.ConfigurationLoader}
 *       (sources merged in order, missing or invalid sources skipped, then retry)</li>
 *   <li>{@link com.graphgate.config.transcode} – boundary to the blueprint transcoder</li>
 * </ul>
 */
package com.graphgate.config;
