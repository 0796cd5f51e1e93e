package warden.core.model.storage;

/**
 * PKCE challenge bound to an authorization or device flow.
 */
public record Pkce(String codeChallenge, String codeChallengeMethod) {

    public static final Pkce NONE = new Pkce("", "");

    public Pkce {
        codeChallenge = codeChallenge != null ? codeChallenge : "";
        codeChallengeMethod = codeChallengeMethod != null ? codeChallengeMethod : "";
    }
}
