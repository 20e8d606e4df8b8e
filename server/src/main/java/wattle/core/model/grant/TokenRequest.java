package wattle.core.model.grant;

import java.net.URI;
import java.util.List;

/**
 * Parameters of a token endpoint request after client authentication.
 *
 * <p>Only {@code grantType} is always present; which other fields are required
 * depends on the grant type.
 */
public record TokenRequest(
        String grantType,
        String code,
        String codeVerifier,
        URI redirectUri,
        String refreshToken,
        String authenticationRequestId,
        String deviceCode,
        String assertion,
        String username,
        String password,
        List<String> scope,
        List<URI> resources) {

    public TokenRequest {
        scope = scope != null ? List.copyOf(scope) : List.of();
        resources = resources != null ? List.copyOf(resources) : List.of();
    }

    public static Builder builder(String grantType) {
        return new Builder(grantType);
    }

    public static final class Builder {
        private final String grantType;
        private String code;
        private String codeVerifier;
        private URI redirectUri;
        private String refreshToken;
        private String authenticationRequestId;
        private String deviceCode;
        private String assertion;
        private String username;
        private String password;
        private List<String> scope = List.of();
        private List<URI> resources = List.of();

        private Builder(String grantType) {
            this.grantType = grantType;
        }

        public Builder code(String code) {
            this.code = code;
            return this;
        }

        public Builder codeVerifier(String codeVerifier) {
            this.codeVerifier = codeVerifier;
            return this;
        }

        public Builder redirectUri(URI redirectUri) {
            this.redirectUri = redirectUri;
            return this;
        }

        public Builder refreshToken(String refreshToken) {
            this.refreshToken = refreshToken;
            return this;
        }

        public Builder authenticationRequestId(String authenticationRequestId) {
            this.authenticationRequestId = authenticationRequestId;
            return this;
        }

        public Builder deviceCode(String deviceCode) {
            this.deviceCode = deviceCode;
            return this;
        }

        public Builder assertion(String assertion) {
            this.assertion = assertion;
            return this;
        }

        public Builder username(String username) {
            this.username = username;
            return this;
        }

        public Builder password(String password) {
            this.password = password;
            return this;
        }

        public Builder scope(List<String> scope) {
            this.scope = scope;
            return this;
        }

        public Builder resources(List<URI> resources) {
            this.resources = resources;
            return this;
        }

        public TokenRequest build() {
            return new TokenRequest(
                    grantType,
                    code,
                    codeVerifier,
                    redirectUri,
                    refreshToken,
                    authenticationRequestId,
                    deviceCode,
                    assertion,
                    username,
                    password,
                    scope,
                    resources);
        }
    }
}
