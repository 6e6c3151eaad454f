package io.surfworks.hybridforge.remote.ssh;

import com.jcraft.jsch.JSch;
import com.jcraft.jsch.JSchException;
import com.jcraft.jsch.Session;
import io.surfworks.hybridforge.config.SshConfig;
import io.surfworks.hybridforge.remote.RemoteConnection;
import io.surfworks.hybridforge.remote.RemoteTransport;

import java.io.IOException;
import java.nio.file.Files;
import java.util.logging.Logger;

/**
 * SSH transport backed by JSch.
 *
 * <p>Authenticates with the configured private key and/or password. Unknown
 * host keys are accepted unless {@link SshConfig#strictHostKeyChecking()} is set,
 * in which case the configured known_hosts file is consulted.
 */
public final class JschRemoteTransport implements RemoteTransport {

    private static final Logger LOG = Logger.getLogger(JschRemoteTransport.class.getName());

    @Override
    public String name() {
        return "jsch";
    }

    @Override
    public RemoteConnection connect(SshConfig config) throws IOException {
        JSch jsch = new JSch();
        try {
            if (config.privateKeyPath() != null) {
                if (Files.isReadable(config.privateKeyPath())) {
                    jsch.addIdentity(config.privateKeyPath().toString());
                } else {
                    LOG.warning("Private key not readable, skipping: " + config.privateKeyPath());
                }
            }
            if (config.strictHostKeyChecking() && config.knownHosts() != null) {
                jsch.setKnownHosts(config.knownHosts().toString());
            }

            Session session = jsch.getSession(config.username(), config.host(), config.port());
            if (config.password() != null) {
                session.setPassword(config.password());
            }
            session.setConfig("StrictHostKeyChecking", config.strictHostKeyChecking() ? "yes" : "no");
            session.connect(timeoutMillis(config));

            return new JschRemoteConnection(session, timeoutMillis(config));

        } catch (JSchException e) {
            throw new IOException("SSH connection to " + config.target() + " failed: " + e.getMessage(), e);
        }
    }

    private static int timeoutMillis(SshConfig config) {
        return (int) Math.min(Integer.MAX_VALUE, config.connectTimeout().toMillis());
    }
}
