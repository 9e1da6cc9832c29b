package win.ixuni.cloudreve.core.util;

import java.util.Arrays;

/**
 * 上传分块计算
 * <p>
 * Content is cut into {@code ceil(size / chunkSize)} consecutive chunks. A non-positive chunk
 * size or empty content yields exactly one chunk holding everything.
 */
public final class UploadChunks {

    private UploadChunks() {
    }

    public static int count(long size, long chunkSize) {
        if (chunkSize <= 0 || size == 0) {
            return 1;
        }
        long chunks = (size + chunkSize - 1) / chunkSize;
        if (chunks > Integer.MAX_VALUE) {
            throw new IllegalArgumentException("Too many chunks: " + chunks);
        }
        return (int) chunks;
    }

    /**
     * Bytes of chunk {@code index} (0-based)
     */
    public static byte[] slice(byte[] content, long chunkSize, int index) {
        if (chunkSize <= 0 || content.length == 0) {
            return content;
        }
        long from = index * chunkSize;
        long to = Math.min(from + chunkSize, content.length);
        if (from >= content.length) {
            throw new IndexOutOfBoundsException("Chunk " + index + " is past the end of the content");
        }
        return Arrays.copyOfRange(content, (int) from, (int) to);
    }
}
