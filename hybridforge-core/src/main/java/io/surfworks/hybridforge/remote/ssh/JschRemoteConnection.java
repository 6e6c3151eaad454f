package io.surfworks.hybridforge.remote.ssh;

import com.jcraft.jsch.ChannelExec;
import com.jcraft.jsch.ChannelSftp;
import com.jcraft.jsch.JSchException;
import com.jcraft.jsch.Session;
import io.surfworks.hybridforge.remote.CommandResult;
import io.surfworks.hybridforge.remote.RemoteConnection;
import io.surfworks.hybridforge.remote.TransferChannel;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InterruptedIOException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;

/**
 * A connected JSch session.
 */
final class JschRemoteConnection implements RemoteConnection {

    private static final long POLL_INTERVAL_MS = 100;

    private final Session session;
    private final int channelTimeoutMillis;

    JschRemoteConnection(Session session, int channelTimeoutMillis) {
        this.session = session;
        this.channelTimeoutMillis = channelTimeoutMillis;
    }

    @Override
    public CommandResult exec(String command, Duration timeout) throws IOException {
        ChannelExec channel = null;
        try {
            channel = (ChannelExec) session.openChannel("exec");
            channel.setCommand(command);
            channel.setInputStream(null);

            ByteArrayOutputStream stdout = new ByteArrayOutputStream();
            ByteArrayOutputStream stderr = new ByteArrayOutputStream();
            channel.setOutputStream(stdout);
            channel.setErrStream(stderr);
            channel.connect(channelTimeoutMillis);

            long deadline = timeout.isZero() ? Long.MAX_VALUE : System.nanoTime() + timeout.toNanos();
            while (!channel.isClosed()) {
                if (System.nanoTime() > deadline) {
                    channel.disconnect();
                    return CommandResult.timeout(decode(stdout), decode(stderr));
                }
                Thread.sleep(POLL_INTERVAL_MS);
            }

            return new CommandResult(channel.getExitStatus(), decode(stdout), decode(stderr));

        } catch (JSchException e) {
            throw new IOException("exec channel failed: " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new InterruptedIOException("Interrupted while waiting for remote command");
        } finally {
            if (channel != null) {
                channel.disconnect();
            }
        }
    }

    @Override
    public TransferChannel openTransferChannel() throws IOException {
        try {
            ChannelSftp sftp = (ChannelSftp) session.openChannel("sftp");
            sftp.connect(channelTimeoutMillis);
            return new JschTransferChannel(sftp);
        } catch (JSchException e) {
            throw new IOException("sftp channel failed: " + e.getMessage(), e);
        }
    }

    @Override
    public void close() {
        session.disconnect();
    }

    private static String decode(ByteArrayOutputStream out) {
        return out.toString(StandardCharsets.UTF_8);
    }
}
