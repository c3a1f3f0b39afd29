package io.trackimport.io;

import java.io.Closeable;
import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.util.Iterator;
import java.util.NoSuchElementException;

import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

/**
 * Reads a blob from a byte offset to its end as a sequence of fixed-size chunks.
 * Every chunk except the last one is exactly {@code chunkSize} bytes long.
 */
@Slf4j
public class RangeByteSource implements Iterator<byte[]>, Closeable {

    public static final int DEFAULT_CHUNK_SIZE = 1024 * 1024;

    private final InputStream stream;
    private final int chunkSize;
    @Getter
    private final long startOffset;
    @Getter
    private long bytesRead;
    private byte[] nextChunk;
    private boolean exhausted;

    RangeByteSource(InputStream stream, long startOffset, int chunkSize) {
        if (chunkSize <= 0) {
            throw new IllegalArgumentException("chunkSize must be > 0, got " + chunkSize);
        }
        this.stream = stream;
        this.startOffset = startOffset;
        this.chunkSize = chunkSize;
    }

    public static RangeByteSource open(BlobSource blobSource, String path, long startOffset, int chunkSize)
        throws IOException {
        if (startOffset < 0) {
            throw new IllegalArgumentException("startOffset must be >= 0, got " + startOffset);
        }
        log.atDebug().setMessage("Opening range read of {} from byte {} in chunks of {} bytes")
            .addArgument(path).addArgument(startOffset).addArgument(chunkSize).log();
        return new RangeByteSource(blobSource.getBlobRange(path, startOffset), startOffset, chunkSize);
    }

    public static RangeByteSource open(BlobSource blobSource, String path, long startOffset) throws IOException {
        return open(blobSource, path, startOffset, DEFAULT_CHUNK_SIZE);
    }

    @Override
    public boolean hasNext() {
        if (nextChunk == null && !exhausted) {
            nextChunk = readChunk();
        }
        return nextChunk != null;
    }

    @Override
    public byte[] next() {
        if (!hasNext()) {
            throw new NoSuchElementException("Range read is exhausted");
        }
        var chunk = nextChunk;
        nextChunk = null;
        bytesRead += chunk.length;
        return chunk;
    }

    private byte[] readChunk() {
        try {
            byte[] chunk = stream.readNBytes(chunkSize);
            if (chunk.length < chunkSize) {
                exhausted = true;
            }
            return chunk.length == 0 ? null : chunk;
        } catch (IOException e) {
            throw new UncheckedIOException("Failed reading chunk at byte " + (startOffset + bytesRead), e);
        }
    }

    @Override
    public void close() throws IOException {
        exhausted = true;
        nextChunk = null;
        stream.close();
    }
}
