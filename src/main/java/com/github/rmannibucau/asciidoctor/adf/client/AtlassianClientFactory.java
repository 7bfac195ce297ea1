package com.github.rmannibucau.asciidoctor.adf.client;

import com.github.rmannibucau.asciidoctor.adf.extension.JiraCredentials;

/**
 * Creates a client per macro invocation from the credentials resolved for the current document.
 */
@FunctionalInterface
public interface AtlassianClientFactory {

    AtlassianClient create(JiraCredentials credentials);

    static AtlassianClientFactory http() {
        return HttpAtlassianClient::new;
    }
}
