package wattle.core.model.jwt;

/**
 * Values of the JWT {@code typ} header issued or accepted by the server.
 */
public final class JwtTypes {

    public static final String REFRESH_TOKEN = "rt+jwt";
    public static final String ACCESS_TOKEN = "at+jwt";

    private JwtTypes() {}
}
