package io.github.hotbrkm.spfengine.evaluator.config;

import io.github.hotbrkm.spfengine.evaluator.spf.SpfServer;
import io.github.hotbrkm.spfengine.evaluator.spf.SpfServerOptions;
import io.github.hotbrkm.spfengine.evaluator.spf.dns.DnsResolver;
import io.github.hotbrkm.spfengine.evaluator.spf.metrics.SpfMetricsRecorder;
import io.github.hotbrkm.spfengine.evaluator.spf.properties.SpfServerProperties;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.util.StringUtils;

@Slf4j
@Configuration
@EnableConfigurationProperties(SpfServerProperties.class)
public class SpfServerConfig {

    @Bean
    @ConditionalOnMissingBean(DnsResolver.class)
    public DnsResolver dnsResolver(SpfServerProperties properties) {
        SpfServerProperties.Dns dns = properties.getDns();
        return DnsResolver.forServers(dns.getServers(), dns.getTimeout());
    }

    @Bean
    public SpfServer spfServer(SpfServerProperties properties,
                               DnsResolver dnsResolver,
                               SpfMetricsRecorder metricsRecorder) {
        SpfServerProperties.Limits limits = properties.getLimits();
        SpfServerOptions.SpfServerOptionsBuilder builder = SpfServerOptions.builder()
                .dnsResolver(dnsResolver)
                .queryRrTypes(properties.getQueryRrTypes())
                .ignoreSpfTypeTimeouts(properties.isIgnoreSpfTypeTimeouts())
                .maxDnsInteractiveTerms(limits.getMaxDnsInteractiveTerms())
                .maxNameLookupsPerTerm(limits.getMaxNameLookupsPerTerm())
                .maxNameLookupsPerMxMech(limits.getMaxNameLookupsPerMxMech())
                .maxNameLookupsPerPtrMech(limits.getMaxNameLookupsPerPtrMech())
                .maxVoidDnsLookups(limits.getMaxVoidDnsLookups());

        if (StringUtils.hasText(properties.getHostname())) {
            builder.hostname(properties.getHostname());
        }

        if (StringUtils.hasText(properties.getDefaultAuthorityExplanation())) {
            builder.defaultAuthorityExplanation(properties.getDefaultAuthorityExplanation());
        }

        SpfServer spfServer = new SpfServer(builder.build(), metricsRecorder);
        log.info("SPF server is configured: hostname={}, queryRrTypes={}, maxDnsInteractiveTerms={}, maxVoidDnsLookups={}",
                spfServer.getHostname(), spfServer.getQueryRrTypes(),
                spfServer.getMaxDnsInteractiveTerms(), spfServer.getMaxVoidDnsLookups());
        return spfServer;
    }

    @Bean
    @ConditionalOnMissingBean(MeterRegistry.class)
    public MeterRegistry meterRegistry() {
        return new SimpleMeterRegistry();
    }

    @Bean
    public SpfMetricsRecorder spfMetricsRecorder(MeterRegistry meterRegistry) {
        return new SpfMetricsRecorder(meterRegistry);
    }
}
