package com.questrail.cpor.transport.netty;

import com.questrail.cpor.config.CodecConfig;
import com.questrail.cpor.observability.CporObservabilitySink;
import com.questrail.cpor.protocol.codec.CporMessageDecoder;
import com.questrail.cpor.protocol.codec.CporMessageEncoder;

import io.netty.channel.ChannelPipeline;
import io.netty.handler.codec.LengthFieldBasedFrameDecoder;
import io.netty.handler.codec.LengthFieldPrepender;

import java.util.Objects;

/**
 * Installs CPOR framing on a stream channel.
 *
 * <p>Each message travels as a 4-byte big-endian length followed by that many
 * payload bytes. Handlers added, in order:</p>
 * <ol>
 *   <li>{@value #FRAME_DECODER}: strips the length prefix, rejecting frames
 *       larger than {@link CodecConfig#maxMessageSize()}</li>
 *   <li>{@value #FRAME_ENCODER}: adds the length prefix</li>
 *   <li>{@value #MESSAGE_CODEC}: {@link CporFrameCodec}</li>
 * </ol>
 */
public final class CporPipeline
{
    public static final String FRAME_DECODER = "cporFrameDecoder";
    public static final String FRAME_ENCODER = "cporFrameEncoder";
    public static final String MESSAGE_CODEC = "cporMessageCodec";

    static final int LENGTH_FIELD_LENGTH = 4;

    private CporPipeline() {}

    public static void install(ChannelPipeline pipeline,
                               CporMessageEncoder encoder,
                               CporMessageDecoder decoder,
                               CodecConfig config,
                               CporObservabilitySink sink) {
        Objects.requireNonNull(pipeline, "pipeline");
        Objects.requireNonNull(config, "config");

        // The length decoder's limit counts the length field itself.
        int maxFrameLength = (int) Math.min((long) config.maxMessageSize() + LENGTH_FIELD_LENGTH, Integer.MAX_VALUE);

        pipeline.addLast(FRAME_DECODER, new LengthFieldBasedFrameDecoder(
                maxFrameLength, 0, LENGTH_FIELD_LENGTH, 0, LENGTH_FIELD_LENGTH));
        pipeline.addLast(FRAME_ENCODER, new LengthFieldPrepender(LENGTH_FIELD_LENGTH));
        pipeline.addLast(MESSAGE_CODEC, new CporFrameCodec(encoder, decoder, sink));
    }
}
