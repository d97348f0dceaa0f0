package io.github.hotbrkm.spfengine.evaluator.spf.properties;

import io.github.hotbrkm.spfengine.evaluator.spf.QueryRrTypes;
import io.github.hotbrkm.spfengine.evaluator.spf.SpfServerOptions;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.NestedConfigurationProperty;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Configuration properties for the SPF server.
 * <p>
 * These properties are loaded from the {@code spf.server} prefix in application.yml.
 * </p>
 *
 * <h2>Example Configuration</h2>
 * <pre>
 * spf:
 *   server:
 *     hostname: mx.example.org
 *     query-rr-types: all
 *     limits:
 *       max-dns-interactive-terms: 10
 *       max-void-dns-lookups: 2
 *     dns:
 *       servers: 192.0.2.53, 198.51.100.53
 *       timeout: 5s
 * </pre>
 */
@Getter
@Setter
@ConfigurationProperties(prefix = "spf.server")
public class SpfServerProperties {

    /**
     * Host name of the receiving server, used by the {@code %{r}} macro and in Received-SPF headers.
     * Detected from the local host when empty.
     */
    private String hostname;

    /**
     * Record types queried for policies.
     */
    private QueryRrTypes queryRrTypes = QueryRrTypes.TXT;

    /**
     * Whether a time-out of the type 99 query is ignored instead of being reported as a DNS error.
     */
    private boolean ignoreSpfTypeTimeouts = false;

    /**
     * Explanation given for {@code fail} verdicts when the sender's domain publishes none.
     */
    private String defaultAuthorityExplanation = SpfServerOptions.DEFAULT_AUTHORITY_EXPLANATION;

    /**
     * Processing limits.
     */
    @NestedConfigurationProperty
    private Limits limits = new Limits();

    /**
     * DNS resolver settings.
     */
    @NestedConfigurationProperty
    private Dns dns = new Dns();

    /**
     * Processing limits; a value of zero or less disables the corresponding check.
     */
    @Getter
    @Setter
    public static class Limits {

        private int maxDnsInteractiveTerms = SpfServerOptions.DEFAULT_MAX_DNS_INTERACTIVE_TERMS;

        private int maxNameLookupsPerTerm = SpfServerOptions.DEFAULT_MAX_NAME_LOOKUPS_PER_TERM;

        /**
         * Defaults to {@link #maxNameLookupsPerTerm}.
         */
        private Integer maxNameLookupsPerMxMech;

        /**
         * Defaults to {@link #maxNameLookupsPerTerm}.
         */
        private Integer maxNameLookupsPerPtrMech;

        private int maxVoidDnsLookups = SpfServerOptions.DEFAULT_MAX_VOID_DNS_LOOKUPS;
    }

    @Getter
    @Setter
    public static class Dns {

        /**
         * Name servers to query. The system configuration is used when empty.
         */
        private List<String> servers = new ArrayList<>();

        /**
         * Per-query timeout.
         */
        private Duration timeout = Duration.ofSeconds(5);
    }
}
