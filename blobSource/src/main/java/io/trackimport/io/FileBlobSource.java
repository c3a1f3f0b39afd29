package io.trackimport.io;

import java.io.IOException;
import java.io.InputStream;
import java.nio.channels.Channels;
import java.nio.channels.SeekableByteChannel;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardOpenOption;

import lombok.Getter;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * BlobSource implementation for local filesystem access
 */
@RequiredArgsConstructor
@Slf4j
public class FileBlobSource implements BlobSource {

    @Getter
    private final Path rootPath;

    public FileBlobSource(String rootPath) {
        this(Paths.get(rootPath));
    }

    @Override
    public InputStream getBlobRange(String path, long startOffset) throws IOException {
        Path fullPath = resolveExistingFile(path);
        log.debug("Reading blob from: {} starting at byte {}", fullPath, startOffset);

        SeekableByteChannel channel = Files.newByteChannel(fullPath, StandardOpenOption.READ);
        try {
            channel.position(startOffset);
        } catch (IOException | IllegalArgumentException e) {
            channel.close();
            throw new IOException("Unable to seek to byte " + startOffset + " of " + fullPath, e);
        }
        return Channels.newInputStream(channel);
    }

    @Override
    public boolean exists(String path) {
        Path fullPath = rootPath.resolve(path);
        return Files.exists(fullPath) && Files.isRegularFile(fullPath);
    }

    @Override
    public long getBlobSize(String path) throws IOException {
        return Files.size(resolveExistingFile(path));
    }

    private Path resolveExistingFile(String path) throws IOException {
        Path fullPath = rootPath.resolve(path);

        if (!Files.exists(fullPath)) {
            throw new IOException("File does not exist: " + fullPath);
        }

        if (!Files.isRegularFile(fullPath)) {
            throw new IOException("Path is not a regular file: " + fullPath);
        }
        return fullPath;
    }
}
