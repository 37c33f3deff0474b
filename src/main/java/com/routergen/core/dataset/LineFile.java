package com.routergen.core.dataset;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;

/**
 * Append-only line file that can be cut back to an earlier size, so a sink
 * can undo a half-written example.
 */
interface LineFile extends AutoCloseable {

    long size() throws IOException;

    /** Appends {@code line} plus a newline; may leave a partial line on failure. */
    void append(String line) throws IOException;

    void truncate(long size) throws IOException;

    @Override
    void close() throws IOException;

    /** Opens {@code path} for writing, creating parent directories and truncating old content. */
    static LineFile open(Path path) throws IOException {
        Path parent = path.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        FileChannel channel = FileChannel.open(path,
                StandardOpenOption.CREATE, StandardOpenOption.WRITE, StandardOpenOption.TRUNCATE_EXISTING);
        return new ChannelLineFile(channel);
    }

    final class ChannelLineFile implements LineFile {

        private final FileChannel channel;

        ChannelLineFile(FileChannel channel) {
            this.channel = channel;
        }

        @Override
        public long size() throws IOException {
            return channel.size();
        }

        @Override
        public void append(String line) throws IOException {
            ByteBuffer buffer = ByteBuffer.wrap((line + "\n").getBytes(StandardCharsets.UTF_8));
            channel.position(channel.size());
            while (buffer.hasRemaining()) {
                channel.write(buffer);
            }
        }

        @Override
        public void truncate(long size) throws IOException {
            channel.truncate(size);
            channel.position(size);
        }

        @Override
        public void close() throws IOException {
            channel.close();
        }
    }
}
