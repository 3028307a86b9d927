package com.openforge.identity.oauth;

import com.openforge.identity.common.IdentityException;
import org.springframework.http.HttpStatus;

public class OAuthNotConfiguredException extends IdentityException {

    public OAuthNotConfiguredException(String provider) {
        super("OAUTH_NOT_CONFIGURED", "%s OAuth is not configured".formatted(provider));
    }

    @Override
    public HttpStatus status() {
        return HttpStatus.NOT_IMPLEMENTED;
    }
}
