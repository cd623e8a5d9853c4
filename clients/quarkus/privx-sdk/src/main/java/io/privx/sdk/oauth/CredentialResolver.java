package io.privx.sdk.oauth;

import java.util.List;

/**
 * Builds a {@link ClientCredential} by folding credential options over an empty credential.
 *
 * <p>Precedence is controlled purely by ordering:
 * <pre>{@code
 * ClientCredential credential = CredentialResolver.resolve(
 *     CredentialOptions.fromConfigFile(path),
 *     CredentialOptions.fromEnvironment(),
 *     CredentialOptions.access(cliAccess));
 * }</pre>
 */
public final class CredentialResolver {

    private CredentialResolver() {
    }

    public static ClientCredential resolve(CredentialOption... options) {
        return resolve(List.of(options));
    }

    public static ClientCredential resolve(List<CredentialOption> options) {
        ClientCredential credential = new ClientCredential();
        for (CredentialOption option : options) {
            credential = option.apply(credential);
        }
        return credential;
    }
}
