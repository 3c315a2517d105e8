package org.rostilos.prwizard.vcsclient;

import okhttp3.OkHttpClient;

import java.io.IOException;

/**
 * Supplies an HTTP client authorized to act on behalf of one GitHub App installation.
 * <p>
 * Callers that outlive a single webhook delivery (the expiry sweeper in particular) ask for a
 * client every time they need one instead of holding on to a token.
 */
@FunctionalInterface
public interface InstallationClientProvider {

    /**
     * @param installationId GitHub App installation id the record was created under
     * @return client carrying a valid installation token
     * @throws IOException when the token exchange fails
     */
    OkHttpClient forInstallation(long installationId) throws IOException;
}
