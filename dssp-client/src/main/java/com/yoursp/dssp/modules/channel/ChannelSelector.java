package com.yoursp.dssp.modules.channel;

import com.yoursp.dssp.modules.channel.dto.ApplicationCredentials;
import com.yoursp.dssp.modules.session.dto.AsyncSession;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Objects;

/**
 * Picks the authentication mode for a call and opens a port for it.
 * <p>
 * For application credentials the precedence is: anonymous when there is
 * neither a password nor any certificate, then an inline certificate, then a
 * certificate lookup, then username and password. Session downloads always
 * use the session's secure conversation. Every call gets its own port.
 * </p>
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ChannelSelector {

    private final DsspPortFactory portFactory;

    public static ChannelBinding select(ApplicationCredentials credentials) {
        Objects.requireNonNull(credentials, "credentials");

        if (!credentials.hasPassword() && !credentials.hasCertificate() && !credentials.hasCertificateLookup()) {
            return ChannelBinding.anonymous();
        }
        if (credentials.hasCertificate()) {
            return ChannelBinding.application(AuthenticationMode.CLIENT_CERT, credentials);
        }
        if (credentials.hasCertificateLookup()) {
            return ChannelBinding.application(AuthenticationMode.CLIENT_CERT_BY_LOOKUP, credentials);
        }
        return ChannelBinding.application(AuthenticationMode.USERNAME_PASSWORD, credentials);
    }

    public static ChannelBinding select(AsyncSession session) {
        return ChannelBinding.secureConversation(session);
    }

    public DsspPort open(ApplicationCredentials credentials) {
        ChannelBinding binding = select(credentials);
        log.debug("DSS-P channel: mode={}", binding.getMode());
        return portFactory.create(binding);
    }

    public DsspPort open(AsyncSession session) {
        ChannelBinding binding = select(session);
        log.debug("DSS-P channel: mode={}, keyId={}", binding.getMode(), session.getKeyId());
        return portFactory.create(binding);
    }
}
