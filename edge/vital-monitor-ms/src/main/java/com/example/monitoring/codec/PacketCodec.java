package com.example.monitoring.codec;

import com.example.monitoring.model.SensorPacket;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import java.io.ByteArrayOutputStream;
import java.nio.BufferUnderflowException;
import java.nio.ByteBuffer;
import java.security.GeneralSecurityException;
import java.time.Instant;
import java.util.zip.DataFormatException;
import java.util.zip.Deflater;
import java.util.zip.Inflater;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;

/**
 * Transport frame codec: AES-GCM sealed, zlib compressed, fixed header followed by five
 * length-prefixed float arrays (ecg, ppg, accel, spo2, glucose). Big-endian throughout.
 */
@ApplicationScoped
public class PacketCodec {

    public static final int MAGIC = 0x56504B31; // "VPK1"
    public static final byte VERSION = 1;
    private static final int HEADER_LENGTH = 4 + 1 + 8 + 4 + 4;
    private static final Logger LOG = Logger.getLogger(PacketCodec.class);

    private final AeadCipher cipher;
    private final int maxFrameBytes;

    @Inject
    public PacketCodec(
        @ConfigProperty(name = "monitoring.codec.session-key") String sessionKey,
        @ConfigProperty(
            name = "monitoring.codec.max-frame-bytes",
            defaultValue = "1048576"
        ) int maxFrameBytes
    ) {
        this(AeadCipher.fromBase64(sessionKey), maxFrameBytes);
    }

    public PacketCodec(AeadCipher cipher, int maxFrameBytes) {
        this.cipher = cipher;
        this.maxFrameBytes = maxFrameBytes;
    }

    public SensorPacket decode(byte[] raw) throws DecodeException {
        byte[] compressed;
        try {
            compressed = cipher.open(raw, null);
        } catch (GeneralSecurityException e) {
            LOG.warnf("Dropping frame of %d bytes: authentication failed", raw == null ? 0 : raw.length);
            throw new DecodeException(DecodeException.Reason.AUTHENTICATION_FAILED, "frame failed authentication", e);
        }

        byte[] body = inflate(compressed);
        return parse(body);
    }

    public byte[] encode(SensorPacket packet) {
        float[][] arrays = {packet.ecg(), packet.ppg(), packet.accel(), packet.spo2(), packet.glucose()};
        int size = HEADER_LENGTH;
        for (float[] a : arrays) {
            size += 4 + 4 * a.length;
        }
        ByteBuffer buf = ByteBuffer.allocate(size);
        buf.putInt(MAGIC).put(VERSION).putLong(packet.capturedAt().toEpochMilli());
        buf.putFloat(packet.temperature()).putFloat(packet.batteryPct());
        for (float[] a : arrays) {
            buf.putInt(a.length);
            for (float v : a) {
                buf.putFloat(v);
            }
        }
        return cipher.seal(deflate(buf.array()), null);
    }

    private byte[] inflate(byte[] compressed) throws DecodeException {
        Inflater inflater = new Inflater();
        try {
            inflater.setInput(compressed);
            ByteArrayOutputStream out = new ByteArrayOutputStream(compressed.length * 4);
            byte[] chunk = new byte[8192];
            while (!inflater.finished()) {
                int n = inflater.inflate(chunk);
                if (n == 0 && (inflater.needsInput() || inflater.needsDictionary())) {
                    LOG.warn("Dropping frame: zlib stream ends before its final block");
                    throw new DecodeException(DecodeException.Reason.CORRUPT_FRAME, "truncated zlib stream");
                }
                out.write(chunk, 0, n);
                if (out.size() > maxFrameBytes) {
                    throw new DecodeException(
                        DecodeException.Reason.MALFORMED_PACKET,
                        "inflated frame exceeds %d bytes".formatted(maxFrameBytes)
                    );
                }
            }
            return out.toByteArray();
        } catch (DataFormatException e) {
            LOG.warnf("Dropping frame: zlib stream is corrupt (%s)", e.getMessage());
            throw new DecodeException(DecodeException.Reason.CORRUPT_FRAME, "corrupt zlib stream", e);
        } finally {
            inflater.end();
        }
    }

    private static byte[] deflate(byte[] body) {
        Deflater deflater = new Deflater(Deflater.BEST_SPEED);
        try {
            deflater.setInput(body);
            deflater.finish();
            ByteArrayOutputStream out = new ByteArrayOutputStream(body.length / 2 + 64);
            byte[] chunk = new byte[8192];
            while (!deflater.finished()) {
                int n = deflater.deflate(chunk);
                out.write(chunk, 0, n);
            }
            return out.toByteArray();
        } finally {
            deflater.end();
        }
    }

    private SensorPacket parse(byte[] body) throws DecodeException {
        ByteBuffer buf = ByteBuffer.wrap(body);
        try {
            int magic = buf.getInt();
            if (magic != MAGIC) {
                throw malformed("bad magic 0x%08X".formatted(magic));
            }
            byte version = buf.get();
            if (version != VERSION) {
                throw malformed("unsupported version " + version);
            }
            Instant capturedAt = Instant.ofEpochMilli(buf.getLong());
            float temperature = buf.getFloat();
            float battery = buf.getFloat();
            float[] ecg = readArray(buf, "ecg");
            float[] ppg = readArray(buf, "ppg");
            float[] accel = readArray(buf, "accel");
            float[] spo2 = readArray(buf, "spo2");
            float[] glucose = readArray(buf, "glucose");
            if (buf.hasRemaining()) {
                throw malformed("%d trailing bytes".formatted(buf.remaining()));
            }
            if (accel.length % 3 != 0) {
                throw malformed("accelerometer samples are not xyz triples");
            }
            return new SensorPacket(capturedAt, ecg, ppg, accel, spo2, glucose, temperature, battery);
        } catch (BufferUnderflowException e) {
            LOG.warnf("Dropping frame: packet truncated at byte %d", buf.position());
            throw new DecodeException(DecodeException.Reason.MALFORMED_PACKET, "truncated packet", e);
        }
    }

    private static float[] readArray(ByteBuffer buf, String name) throws DecodeException {
        int count = buf.getInt();
        if (count < 0 || (long) count * 4 > buf.remaining()) {
            throw malformed("%s count %d does not fit in %d remaining bytes".formatted(name, count, buf.remaining()));
        }
        float[] out = new float[count];
        for (int i = 0; i < count; i++) {
            out[i] = buf.getFloat();
        }
        return out;
    }

    private static DecodeException malformed(String message) {
        LOG.warnf("Dropping frame: %s", message);
        return new DecodeException(DecodeException.Reason.MALFORMED_PACKET, message);
    }
}
