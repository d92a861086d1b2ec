package com.chicu.streamcore.compression;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.util.zip.Deflater;
import java.util.zip.DeflaterOutputStream;
import java.util.zip.GZIPInputStream;
import java.util.zip.GZIPOutputStream;
import java.util.zip.InflaterInputStream;

/**
 * Кодеки для архивных записей. Уровень 1..9, как у Deflater.
 */
public enum CompressionAlgorithm {

    DEFLATE {
        @Override
        OutputStream wrap(OutputStream out, int level) {
            return new DeflaterOutputStream(out, new Deflater(level)) {
                // свой Deflater поток сам не освобождает
                @Override
                public void close() throws IOException {
                    try {
                        super.close();
                    } finally {
                        def.end();
                    }
                }
            };
        }

        @Override
        InputStream unwrap(InputStream in) {
            return new InflaterInputStream(in);
        }
    },

    GZIP {
        @Override
        OutputStream wrap(OutputStream out, int level) throws IOException {
            return new GZIPOutputStream(out) {
                {
                    def.setLevel(level);
                }
            };
        }

        @Override
        InputStream unwrap(InputStream in) throws IOException {
            return new GZIPInputStream(in);
        }
    };

    abstract OutputStream wrap(OutputStream out, int level) throws IOException;

    abstract InputStream unwrap(InputStream in) throws IOException;

    public byte[] compress(byte[] data, int level) throws IOException {
        int lvl = Math.max(Deflater.BEST_SPEED, Math.min(Deflater.BEST_COMPRESSION, level));
        ByteArrayOutputStream bos = new ByteArrayOutputStream(Math.max(64, data.length / 2));
        try (OutputStream out = wrap(bos, lvl)) {
            out.write(data);
        }
        return bos.toByteArray();
    }

    public byte[] decompress(byte[] data) throws IOException {
        try (InputStream in = unwrap(new ByteArrayInputStream(data))) {
            return in.readAllBytes();
        }
    }
}
