/**
 * Command-line driving adapter: {@code mosaic encode} and {@code mosaic decode}.
 * <p><strong>Conventions:</strong> arguments are {@code key=value} pairs plus {@code --flags}; results go to
 * stdout, logs to stderr.</p>
 * <p><strong>Exit codes:</strong> see {@link ca.gc.cra.mosaic.api.ExitCode}.</p>
 * <p><strong>Security:</strong> passphrases are never logged; prefer {@code passphraseEnv=VAR} over
 * {@code passphrase=P}, which is visible in the process list.</p>
 */
package ca.gc.cra.mosaic.api;
