package io.privx.sdk.oauth;

import java.util.Objects;

/**
 * API client credential accumulated by {@link CredentialResolver}.
 *
 * <p>Fields start empty and are overwritten by each {@link CredentialOption} in turn.
 * Nothing here checks that a field is set; {@link io.privx.sdk.client.auth.AccessTokenManager}
 * rejects an incomplete credential when it requests a token.
 */
public class ClientCredential {

    private String access = "";
    private String secret = "";
    private String digest = "";

    /**
     * Client identifier sent as the token request username.
     */
    public String getAccess() {
        return access;
    }

    void setAccess(String access) {
        this.access = access;
    }

    /**
     * Client secret sent as the token request password.
     */
    public String getSecret() {
        return secret;
    }

    void setSecret(String secret) {
        this.secret = secret;
    }

    /**
     * Base64 of {@code oauthClientId:oauthClientSecret}, used as HTTP basic auth on the
     * token endpoint. Empty when no OAuth client pair was configured.
     */
    public String getDigest() {
        return digest;
    }

    void setDigest(String digest) {
        this.digest = digest;
    }

    public boolean hasDigest() {
        return !digest.isEmpty();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ClientCredential)) return false;
        ClientCredential that = (ClientCredential) o;
        return access.equals(that.access) && secret.equals(that.secret) && digest.equals(that.digest);
    }

    @Override
    public int hashCode() {
        return Objects.hash(access, secret, digest);
    }

    @Override
    public String toString() {
        return "ClientCredential{access='" + access + "', secret=" + (secret.isEmpty() ? "''" : "***")
            + ", digest=" + (digest.isEmpty() ? "''" : "***") + "}";
    }
}
