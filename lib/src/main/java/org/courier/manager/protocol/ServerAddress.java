package org.courier.manager.protocol;

import org.apache.commons.codec.binary.Base32;
import org.courier.manager.api.InvalidServerAddressException;
import org.courier.manager.config.ServiceConfig;

import java.net.URI;
import java.net.URISyntaxException;
import java.util.regex.Pattern;

/**
 * A home server address of the form {@code pondserver://BASE32ID@host}.
 *
 * @param serverId 32 byte server identity decoded from the user part
 * @param hostPort host to connect to, with the default port appended outside of testing
 */
public record ServerAddress(String url, byte[] serverId, String hostPort) {

    private static final Pattern SERVER_ID_PATTERN = Pattern.compile("[A-Z2-7]+=*");

    public static ServerAddress parse(String url, boolean testing) throws InvalidServerAddressException {
        final URI uri;
        try {
            uri = new URI(url);
        } catch (URISyntaxException e) {
            throw new InvalidServerAddressException("Invalid server address: " + e.getMessage());
        }
        if (!ServiceConfig.SERVER_SCHEME.equals(uri.getScheme())) {
            throw new InvalidServerAddressException("Bad URL scheme, should be " + ServiceConfig.SERVER_SCHEME);
        }
        final var encodedId = uri.getRawUserInfo();
        if (encodedId == null || encodedId.isEmpty()) {
            throw new InvalidServerAddressException("No server ID in server address");
        }
        if (!SERVER_ID_PATTERN.matcher(encodedId).matches()) {
            throw new InvalidServerAddressException("Invalid server ID");
        }
        final var serverId = new Base32().decode(encodedId);
        if (serverId.length != ServiceConfig.SERVER_ID_LENGTH) {
            throw new InvalidServerAddressException("Server ID has incorrect length");
        }

        final var host = uri.getHost();
        if (host == null || host.isEmpty()) {
            throw new InvalidServerAddressException("No host in server address");
        }
        final String hostPort;
        if (testing) {
            hostPort = uri.getPort() == -1 ? host : host + ":" + uri.getPort();
        } else {
            if (uri.getPort() != -1) {
                throw new InvalidServerAddressException("Server address contains a port number");
            }
            if (!host.endsWith(".onion")) {
                throw new InvalidServerAddressException("Server address is not a Tor hidden service");
            }
            hostPort = host + ":" + ServiceConfig.DEFAULT_SERVER_PORT;
        }
        return new ServerAddress(url, serverId, hostPort);
    }
}
