package io.sharedkey.platform.http.filters;

import io.sharedkey.platform.domain.auth.Identity;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletRequestWrapper;
import java.security.Principal;

/** Exposes an authenticated {@link Identity} through the servlet principal API. */
final class IdentityRequestWrapper extends HttpServletRequestWrapper {

    private final Identity identity;

    IdentityRequestWrapper(HttpServletRequest request, Identity identity) {
        super(request);
        this.identity = identity;
    }

    @Override
    public Principal getUserPrincipal() {
        return identity::account;
    }

    @Override
    public String getRemoteUser() {
        return identity.account();
    }

    @Override
    public String getAuthType() {
        return identity.authenticationType();
    }
}
