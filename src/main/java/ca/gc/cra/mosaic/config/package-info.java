/**
 * Configuration loading, merging and composition for MOSAIC.
 * <p><strong>Precedence:</strong> CLI {@code key=value} &gt; YAML ({@code config=PATH}) &gt; {@link ca.gc.cra.mosaic.config.DefaultsForMode}.</p>
 * <p><strong>Concurrency:</strong> Records and loaders are immutable or stateless.</p>
 * <p><strong>Security:</strong> Passphrases are accepted from the CLI or an environment variable, never from YAML.</p>
 */
package ca.gc.cra.mosaic.config;
