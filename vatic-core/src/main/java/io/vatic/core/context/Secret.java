package io.vatic.core.context;

import java.util.Objects;

/// A named credential routed through the outbound proxy.
///
/// Templates only ever see {@link #matchUrl()} through `{% proxy:<name> %}`; the key
/// itself is never rendered and is masked in {@link #toString()}.
///
/// @param key credential value, not null
/// @param header how the credential is sent, e.g. `bearer`, not null
/// @param matchUrl URL prefix the proxy matches requests against, not null
public record Secret(String key, String header, String matchUrl) {

    /// Header scheme used when none is configured.
    public static final String DEFAULT_HEADER = "bearer";

    public Secret {
        Objects.requireNonNull(key, "key must not be null");
        Objects.requireNonNull(header, "header must not be null");
        Objects.requireNonNull(matchUrl, "matchUrl must not be null");
    }

    @Override
    public String toString() {
        return "Secret[key=***, header=" + header + ", matchUrl=" + matchUrl + "]";
    }
}
