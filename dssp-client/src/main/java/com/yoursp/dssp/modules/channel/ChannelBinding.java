package com.yoursp.dssp.modules.channel;

import com.yoursp.dssp.modules.channel.dto.ApplicationCredentials;
import com.yoursp.dssp.modules.session.dto.AsyncSession;
import lombok.Getter;

import java.util.Objects;

/**
 * An authentication mode with the material it needs. Exactly one of
 * {@link #getCredentials()} and {@link #getSession()} is set, except for
 * {@link AuthenticationMode#ANONYMOUS}.
 */
@Getter
public final class ChannelBinding {

    private final AuthenticationMode mode;
    private final ApplicationCredentials credentials;
    private final AsyncSession session;

    private ChannelBinding(AuthenticationMode mode, ApplicationCredentials credentials, AsyncSession session) {
        this.mode = mode;
        this.credentials = credentials;
        this.session = session;
    }

    public static ChannelBinding anonymous() {
        return new ChannelBinding(AuthenticationMode.ANONYMOUS, null, null);
    }

    public static ChannelBinding application(AuthenticationMode mode, ApplicationCredentials credentials) {
        if (mode == AuthenticationMode.SECURE_CONVERSATION || mode == AuthenticationMode.ANONYMOUS) {
            throw new IllegalArgumentException("Mode " + mode + " is not bound to application credentials");
        }
        return new ChannelBinding(mode, Objects.requireNonNull(credentials, "credentials"), null);
    }

    public static ChannelBinding secureConversation(AsyncSession session) {
        return new ChannelBinding(AuthenticationMode.SECURE_CONVERSATION, null,
                Objects.requireNonNull(session, "session"));
    }

    @Override
    public String toString() {
        return "ChannelBinding[mode=" + mode + "]";
    }
}
