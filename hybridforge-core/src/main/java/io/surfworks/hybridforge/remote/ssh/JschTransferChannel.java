package io.surfworks.hybridforge.remote.ssh;

import com.jcraft.jsch.ChannelSftp;
import com.jcraft.jsch.SftpException;
import io.surfworks.hybridforge.remote.TransferChannel;

import java.io.FileNotFoundException;
import java.io.IOException;
import java.nio.file.Path;

/**
 * SFTP channel on a JSch session.
 */
final class JschTransferChannel implements TransferChannel {

    private final ChannelSftp sftp;

    JschTransferChannel(ChannelSftp sftp) {
        this.sftp = sftp;
    }

    @Override
    public void put(Path localFile, String remotePath) throws IOException {
        try {
            sftp.put(localFile.toString(), remotePath, ChannelSftp.OVERWRITE);
        } catch (SftpException e) {
            throw translate(remotePath, e);
        }
    }

    @Override
    public void get(String remotePath, Path localFile) throws IOException {
        try {
            sftp.get(remotePath, localFile.toString());
        } catch (SftpException e) {
            throw translate(remotePath, e);
        }
    }

    @Override
    public void remove(String remotePath) throws IOException {
        try {
            sftp.rm(remotePath);
        } catch (SftpException e) {
            throw translate(remotePath, e);
        }
    }

    @Override
    public void close() {
        sftp.disconnect();
    }

    private static IOException translate(String remotePath, SftpException e) {
        if (e.id == ChannelSftp.SSH_FX_NO_SUCH_FILE) {
            FileNotFoundException missing = new FileNotFoundException("No such remote file: " + remotePath);
            missing.initCause(e);
            return missing;
        }
        return new IOException("sftp error on " + remotePath + ": " + e.getMessage(), e);
    }
}
