package io.surfworks.hybridforge.remote;

import java.io.IOException;
import java.nio.file.Path;

/**
 * A file transfer channel on a {@link RemoteConnection}.
 *
 * <p>Copies are byte-faithful and overwrite the destination.
 */
public interface TransferChannel extends AutoCloseable {

    void put(Path localFile, String remotePath) throws IOException;

    void get(String remotePath, Path localFile) throws IOException;

    void remove(String remotePath) throws IOException;

    @Override
    void close();
}
