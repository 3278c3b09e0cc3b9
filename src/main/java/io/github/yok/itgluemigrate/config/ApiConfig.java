package io.github.yok.itgluemigrate.config;

import java.util.LinkedHashMap;
import java.util.Map;
import lombok.Data;
import org.apache.commons.lang3.StringUtils;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Connection settings of the destination API, bound from the {@code api} prefix.
 *
 * <pre>
 * api:
 *   url: https://docs.example.com
 *   token: ${BIFROST_API_TOKEN:}
 *   timeout-seconds: 30
 *   upload-timeout-seconds: 300
 *   host-rewrites:
 *     "[minio:9000]": localhost:9000
 * </pre>
 *
 * @author Yasuharu.Okawauchi
 */
@Component
@ConfigurationProperties(prefix = "api")
@Data
public class ApiConfig {

    // Base URL; command-line --api-url and the plan's api_url take precedence.
    private String url;

    // Bearer token; command-line --token takes precedence.
    private String token;

    private int timeoutSeconds = 30;

    // Timeout of presigned-URL uploads.
    private int uploadTimeoutSeconds = 300;

    /**
     * Host rewrites applied to presigned upload URLs: {@code host[:port] → host[:port]}.
     *
     * <p>
     * A destination running in containers signs URLs with container-internal host names that
     * the migration host cannot resolve.
     * </p>
     */
    private Map<String, String> hostRewrites = new LinkedHashMap<>();

    /**
     * Returns the first non-blank of the given value and the configured URL.
     *
     * @param override value from the command line or plan, may be {@code null}
     * @return effective URL, or {@code null} if neither is set
     */
    public String resolveUrl(String override) {
        return StringUtils.isNotBlank(override) ? override : StringUtils.trimToNull(url);
    }

    /**
     * Returns the first non-blank of the given value and the configured token.
     *
     * @param override value from the command line, may be {@code null}
     * @return effective token, or {@code null} if neither is set
     */
    public String resolveToken(String override) {
        return StringUtils.isNotBlank(override) ? override : StringUtils.trimToNull(token);
    }
}
