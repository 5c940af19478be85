package org.courier.manager.internal;

import org.courier.manager.Settings;
import org.courier.manager.groups.GroupSignatureScheme;
import org.courier.manager.network.NetworkGateway;

import java.security.SecureRandom;
import java.time.Clock;

public class SessionDependencies {

    private final Settings settings;
    private final GroupSignatureScheme groupSignatureScheme;
    private final NetworkGateway networkGateway;
    private final SecureRandom secureRandom;
    private final Clock clock;

    public SessionDependencies(
            final Settings settings,
            final GroupSignatureScheme groupSignatureScheme,
            final NetworkGateway networkGateway,
            final SecureRandom secureRandom,
            final Clock clock
    ) {
        this.settings = settings;
        this.groupSignatureScheme = groupSignatureScheme;
        this.networkGateway = networkGateway;
        this.secureRandom = secureRandom;
        this.clock = clock;
    }

    public SessionDependencies(
            final Settings settings,
            final GroupSignatureScheme groupSignatureScheme,
            final NetworkGateway networkGateway
    ) {
        this(settings, groupSignatureScheme, networkGateway, new SecureRandom(), Clock.systemUTC());
    }

    public Settings getSettings() {
        return settings;
    }

    public GroupSignatureScheme getGroupSignatureScheme() {
        return groupSignatureScheme;
    }

    public NetworkGateway getNetworkGateway() {
        return networkGateway;
    }

    public SecureRandom getSecureRandom() {
        return secureRandom;
    }

    public Clock getClock() {
        return clock;
    }
}
