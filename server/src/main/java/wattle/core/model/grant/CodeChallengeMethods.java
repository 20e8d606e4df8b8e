package wattle.core.model.grant;

/**
 * PKCE code challenge methods (RFC 7636).
 */
public final class CodeChallengeMethods {

    public static final String PLAIN = "plain";
    public static final String S256 = "S256";
    public static final String S512 = "S512";

    private CodeChallengeMethods() {}
}
