package warden.core.config;

import java.util.Map;
import java.util.Optional;

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;
import io.smallrye.config.WithParentName;

/**
 * Statically configured connectors, written to storage at startup.
 *
 * <pre>{@code
 * warden.connectors.gitlab.type=gitlab
 * warden.connectors.gitlab.name=GitLab
 * warden.connectors.gitlab.config={"clientID":"...","clientSecret":"...","redirectURI":"..."}
 * }</pre>
 */
@ConfigMapping(prefix = "warden.connectors")
public interface ConnectorsConfig {

    /**
     * Connector definitions keyed by connector id.
     */
    @WithParentName
    Map<String, Definition> definitions();

    interface Definition {

        String type();

        Optional<String> name();

        /**
         * Connector-specific configuration as a JSON object.
         */
        @WithDefault("{}")
        String config();
    }
}
