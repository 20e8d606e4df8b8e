package wattle.core.model.common;

/**
 * Grant type identifiers accepted in the {@code grant_type} token request parameter.
 */
public final class GrantTypes {

    public static final String AUTHORIZATION_CODE = "authorization_code";
    public static final String CLIENT_CREDENTIALS = "client_credentials";
    public static final String REFRESH_TOKEN = "refresh_token";
    public static final String PASSWORD = "password";
    public static final String CIBA = "urn:openid:params:grant-type:ciba";
    public static final String JWT_BEARER = "urn:ietf:params:oauth:grant-type:jwt-bearer";
    public static final String DEVICE_CODE = "urn:ietf:params:oauth:grant-type:device_code";

    private GrantTypes() {}
}
