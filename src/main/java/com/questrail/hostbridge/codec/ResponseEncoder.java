package com.questrail.hostbridge.codec;

import com.questrail.hostbridge.model.CommandResponse;

/**
 * Encodes a {@link CommandResponse} into its wire form.
 *
 * <p>Encoding never fails: a result that cannot be represented is replaced by
 * an error envelope describing why.</p>
 */
public interface ResponseEncoder
{
    byte[] encode(CommandResponse response);
}
