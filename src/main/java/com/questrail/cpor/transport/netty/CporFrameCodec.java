package com.questrail.cpor.transport.netty;

import com.questrail.cpor.observability.CporObservabilitySink;
import com.questrail.cpor.observability.FrameRejectedEvent;
import com.questrail.cpor.protocol.CporProtocolException;
import com.questrail.cpor.protocol.codec.CporMessageDecoder;
import com.questrail.cpor.protocol.codec.CporMessageEncoder;
import com.questrail.cpor.protocol.model.CporMessage;

import io.netty.buffer.ByteBuf;
import io.netty.buffer.Unpooled;
import io.netty.channel.ChannelHandlerContext;
import io.netty.handler.codec.MessageToMessageCodec;
import io.netty.handler.codec.TooLongFrameException;

import java.time.Clock;
import java.util.List;
import java.util.Objects;

/**
 * CporFrameCodec
 * =============================================================================
 * Converts between complete frames and {@link CporMessage}s.
 *
 * <p>This handler expects length framing to have been removed already (see
 * {@link CporPipeline}); each inbound {@link ByteBuf} is exactly one payload.</p>
 *
 * <h2>Poisoned frames</h2>
 * A frame that fails to decode, or decodes to an invalid message, is dropped
 * and reported through {@link CporObservabilitySink#onFrameRejected}. The
 * channel stays open and later frames are processed normally. Oversized frames
 * rejected by the upstream length decoder are reported the same way.
 *
 * <p>Netty types do not escape this package; the codec ports see only
 * {@code byte[]}.</p>
 */
public final class CporFrameCodec extends MessageToMessageCodec<ByteBuf, CporMessage>
{
    private final CporMessageEncoder encoder;
    private final CporMessageDecoder decoder;
    private final CporObservabilitySink sink;
    private final Clock clock;

    public CporFrameCodec(CporMessageEncoder encoder, CporMessageDecoder decoder, CporObservabilitySink sink) {
        this(encoder, decoder, sink, Clock.systemUTC());
    }

    public CporFrameCodec(CporMessageEncoder encoder,
                          CporMessageDecoder decoder,
                          CporObservabilitySink sink,
                          Clock clock) {
        this.encoder = Objects.requireNonNull(encoder, "encoder");
        this.decoder = Objects.requireNonNull(decoder, "decoder");
        this.sink = Objects.requireNonNull(sink, "sink");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    @Override
    protected void encode(ChannelHandlerContext ctx, CporMessage message, List<Object> out) {
        out.add(Unpooled.wrappedBuffer(encoder.encode(message)));
    }

    @Override
    protected void decode(ChannelHandlerContext ctx, ByteBuf frame, List<Object> out) {
        // Copy out of the (reference-counted) frame before handing to the decoder.
        byte[] bytes = new byte[frame.readableBytes()];
        frame.readBytes(bytes);

        try {
            out.add(decoder.parse(bytes));
        } catch (CporProtocolException e) {
            sink.onFrameRejected(new FrameRejectedEvent(clock.instant(), bytes.length, e.getMessage(), e));
        }
    }

    @Override
    public void exceptionCaught(ChannelHandlerContext ctx, Throwable cause) throws Exception {
        if (cause instanceof TooLongFrameException) {
            sink.onFrameRejected(new FrameRejectedEvent(clock.instant(), -1, cause.getMessage(), cause));
            return;
        }
        super.exceptionCaught(ctx, cause);
    }
}
