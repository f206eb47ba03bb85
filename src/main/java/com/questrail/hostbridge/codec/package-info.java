/**
 * Codec ports
 * =============================================================================
 *
 * Framework-neutral boundary between raw wire bytes and the bridge's value
 * types. Transport adapters hand complete messages (one datagram, or one framed
 * TCP object) to a {@link com.questrail.hostbridge.codec.CommandDecoder} and
 * write whatever a {@link com.questrail.hostbridge.codec.ResponseEncoder}
 * produces.
 *
 * <p>Decoders never classify. A syntactically valid message naming an unknown
 * command decodes successfully; rejecting it is the classifier's job.</p>
 */
package com.questrail.hostbridge.codec;
