/**
 * The MOSAIC wire protocol: checksum envelope, passphrase encryption, chunking, frame codec and reassembly.
 * <p><strong>Role:</strong> Application core between raw text and per-symbol strings; knows nothing about images.</p>
 * <p><strong>Concurrency:</strong> Every class is stateless or call-scoped; no locking required.</p>
 * <p><strong>Security:</strong> Passphrases are reduced to derived keys and never logged.</p>
 */
package ca.gc.cra.mosaic.application.codec;
