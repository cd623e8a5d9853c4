package io.privx.sdk.oauth;

/**
 * A single step of credential resolution.
 *
 * <p>Options are applied in order by {@link CredentialResolver}; a later option
 * overwrites any field an earlier one set.
 */
@FunctionalInterface
public interface CredentialOption {

    ClientCredential apply(ClientCredential credential);
}
