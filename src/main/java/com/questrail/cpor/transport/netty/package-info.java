/**
 * Netty adapter for carrying CPOR messages over a byte stream.
 *
 * <h2>Netty containment rule</h2>
 * Netty types ({@code ByteBuf}, {@code ChannelPipeline}, ...) appear only in
 * this package. The protocol core works on {@code byte[]} and
 * {@link com.questrail.cpor.protocol.model.CporMessage}.
 *
 * <p>Session state, sequencing and connection lifecycle are not handled
 * here.</p>
 */
package com.questrail.cpor.transport.netty;
