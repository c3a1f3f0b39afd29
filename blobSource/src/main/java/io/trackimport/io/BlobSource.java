package io.trackimport.io;

import java.io.IOException;
import java.io.InputStream;

/**
 * Abstraction for reading a single large blob from object storage or the local filesystem.
 * Reads are range based so that an import can resume at any byte offset of the blob.
 */
public interface BlobSource {

    /**
     * Open a stream over the blob starting at the given byte offset and running to its end.
     * @param path the path/key of the blob
     * @param startOffset the first byte to return, 0 for the whole blob
     * @return InputStream positioned at {@code startOffset}
     * @throws IOException if the blob cannot be accessed or doesn't exist
     */
    InputStream getBlobRange(String path, long startOffset) throws IOException;

    /**
     * Check if a blob exists at the given path
     * @param path the path/key to check
     * @return true if the blob exists, false otherwise
     */
    boolean exists(String path);

    /**
     * Get the size of a blob in bytes
     * @param path the path/key of the blob
     * @return the size in bytes
     * @throws IOException if the blob cannot be accessed or doesn't exist
     */
    long getBlobSize(String path) throws IOException;
}
