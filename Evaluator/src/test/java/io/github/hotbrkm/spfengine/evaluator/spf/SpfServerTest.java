package io.github.hotbrkm.spfengine.evaluator.spf;

import io.github.hotbrkm.spfengine.evaluator.spf.dns.DnsResolver.QueryStatus;
import io.github.hotbrkm.spfengine.evaluator.spf.dns.TestDnsResolver;
import io.github.hotbrkm.spfengine.evaluator.spf.exception.DnsException;
import io.github.hotbrkm.spfengine.evaluator.spf.exception.DnsTimeoutException;
import io.github.hotbrkm.spfengine.evaluator.spf.exception.NoAcceptableRecordException;
import io.github.hotbrkm.spfengine.evaluator.spf.exception.RecordSyntaxException;
import io.github.hotbrkm.spfengine.evaluator.spf.exception.RedundantAcceptableRecordsException;
import io.github.hotbrkm.spfengine.evaluator.spf.macro.MacroString;
import io.github.hotbrkm.spfengine.evaluator.spf.metrics.SpfMetricsRecorder;
import io.github.hotbrkm.spfengine.evaluator.spf.record.RecordVersion;
import io.github.hotbrkm.spfengine.evaluator.spf.record.SpfRecord;
import io.github.hotbrkm.spfengine.evaluator.spf.result.SpfResult;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.xbill.DNS.Type;

import java.net.InetAddress;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("SpfServer test")
class SpfServerTest {

    private TestDnsResolver resolver;

    @BeforeEach
    void setUp() {
        resolver = new TestDnsResolver();
    }

    @Nested
    @DisplayName("Construction")
    class Construction {

        @DisplayName("Unset options fall back to the defaults")
        @Test
        void testDefaults() {
            SpfServer server = new SpfServer(SpfServerOptions.builder().dnsResolver(resolver).build());

            assertThat(server.getHostname()).isNotBlank();
            assertThat(server.getQueryRrTypes()).isEqualTo(QueryRrTypes.TXT);
            assertThat(server.getMaxDnsInteractiveTerms()).isEqualTo(10);
            assertThat(server.getMaxNameLookupsPerTerm()).isEqualTo(10);
            assertThat(server.getMaxNameLookupsPerMxMech()).isEqualTo(10);
            assertThat(server.getMaxNameLookupsPerPtrMech()).isEqualTo(10);
            assertThat(server.getMaxVoidDnsLookups()).isEqualTo(2);
            assertThat(server.getDefaultAuthorityExplanation().getText())
                    .isEqualTo(SpfServerOptions.DEFAULT_AUTHORITY_EXPLANATION);
        }

        @DisplayName("Per-mechanism limits follow the per-term limit unless set")
        @Test
        void testPerMechanismLimits() {
            SpfServer server = new SpfServer(SpfServerOptions.builder()
                    .hostname("mx.example.org")
                    .dnsResolver(resolver)
                    .maxNameLookupsPerTerm(7)
                    .maxNameLookupsPerPtrMech(3)
                    .build());

            assertThat(server.getMaxNameLookupsPerMxMech()).isEqualTo(7);
            assertThat(server.getMaxNameLookupsPerPtrMech()).isEqualTo(3);
        }

        @DisplayName("A prebuilt explanation template is used as is")
        @Test
        void testExplanationTemplate() {
            MacroString template = MacroString.explanation("Rejected by %{d}");
            SpfServer server = new SpfServer(SpfServerOptions.builder()
                    .hostname("mx.example.org")
                    .dnsResolver(resolver)
                    .defaultAuthorityExplanationTemplate(template)
                    .build());

            assertThat(server.getDefaultAuthorityExplanation()).isSameAs(template);
        }

        @DisplayName("An invalid default explanation is rejected")
        @Test
        void testInvalidExplanation() {
            SpfServerOptions options = SpfServerOptions.builder()
                    .hostname("mx.example.org")
                    .dnsResolver(resolver)
                    .defaultAuthorityExplanation("broken %{z}")
                    .build();

            assertThatThrownBy(() -> new SpfServer(options))
                    .isInstanceOf(IllegalArgumentException.class);
        }

        @DisplayName("Result codes resolve by name")
        @Test
        void testResultCode() {
            SpfServer server = server(QueryRrTypes.TXT);

            assertThat(server.resultCode("softfail")).isEqualTo(SpfResult.Code.SOFTFAIL);
            assertThatThrownBy(() -> server.resultCode("maybe")).isInstanceOf(IllegalArgumentException.class);
        }
    }

    @Nested
    @DisplayName("Record selection")
    class Selection {

        @DisplayName("An SPF-type v=spf1 -all record selects V1 and fails")
        @Test
        void testSpfTypeRecordEndToEnd() throws Exception {
            resolver.addSpf("example.com", "v=spf1 -all");
            SpfServer server = server(QueryRrTypes.SPF);
            SpfRequest request = request("user@example.com");

            SpfRecord record = server.selectRecord(request);
            SpfResult result = server.process(request("user@example.com"));

            assertThat(record.getVersion()).isEqualTo(RecordVersion.V1);
            assertThat(result.code()).isEqualTo(SpfResult.Code.FAIL);
            assertThat(resolver.getQueries()).doesNotContain("example.com/TXT");
        }

        @DisplayName("The default TXT-only configuration never asks for SPF-type records")
        @Test
        void testDefaultConfigurationSkipsSpfType() throws Exception {
            resolver.addSpf("example.com", "v=spf1 -all");
            SpfServer server = new SpfServer(SpfServerOptions.builder()
                    .hostname("mx.example.org")
                    .dnsResolver(resolver)
                    .build());

            SpfResult result = server.process(request("user@example.com"));

            assertThat(result.code()).isEqualTo(SpfResult.Code.NONE);
            assertThat(resolver.getQueries()).containsExactly("example.com/TXT");
        }

        @DisplayName("TXT records are only queried when no SPF-type record applies")
        @Test
        void testTxtFallbackGating() throws Exception {
            resolver.addSpf("example.com", "v=spf1 -all")
                    .addTxt("example.com", "v=spf1 +all");
            SpfServer server = server(QueryRrTypes.ALL);

            SpfRecord record = server.selectRecord(request("user@example.com"));

            assertThat(record.getText()).isEqualTo("v=spf1 -all");
            assertThat(resolver.getQueries()).containsExactly("example.com/SPF");
        }

        @DisplayName("TXT is tried when SPF-type records exist but none covers the scope")
        @Test
        void testTxtFallbackOnInapplicableSpfRecords() throws Exception {
            resolver.addSpf("example.com", "spf2.0/pra -all")
                    .addTxt("example.com", "v=spf1 +all");
            SpfServer server = server(QueryRrTypes.ALL);

            SpfRecord record = server.selectRecord(request("user@example.com"));

            assertThat(record.getText()).isEqualTo("v=spf1 +all");
            assertThat(resolver.getQueries()).containsExactly("example.com/SPF", "example.com/TXT");
        }

        @DisplayName("Multi-segment TXT strings are joined without separator")
        @Test
        void testSegmentsJoined() throws Exception {
            resolver.addTxt("example.com", "v=spf1 ip4:192.0.2.0/24", " -all");

            SpfRecord record = server(QueryRrTypes.TXT).selectRecord(request("user@example.com"));

            assertThat(record.getText()).isEqualTo("v=spf1 ip4:192.0.2.0/24 -all");
            assertThat(record.getMechanisms()).hasSize(2);
        }

        @DisplayName("Two applicable records of the same version are redundant")
        @Test
        void testRedundantRecords() throws Exception {
            resolver.addTxt("example.com", "v=spf1 -all")
                    .addTxt("example.com", "v=spf1 ~all");

            assertThatThrownBy(() -> server(QueryRrTypes.TXT).selectRecord(request("user@example.com")))
                    .isInstanceOf(RedundantAcceptableRecordsException.class)
                    .hasMessage("Redundant applicable 'v=spf1' sender policies found");
        }

        @DisplayName("Only the highest version present is kept")
        @Test
        void testHighestVersionWins() throws Exception {
            resolver.addTxt("example.com", "v=spf1 -all")
                    .addTxt("example.com", "spf2.0/mfrom,pra ~all");

            SpfRecord record = server(QueryRrTypes.TXT).selectRecord(request("user@example.com"));

            assertThat(record.getVersion()).isEqualTo(RecordVersion.V2);
            assertThat(record.getVersionTag()).isEqualTo("spf2.0/mfrom,pra");
        }

        @DisplayName("Texts of versions not requested are ignored")
        @Test
        void testUnrequestedVersionIgnored() throws Exception {
            resolver.addTxt("example.com", "v=spf1 -all")
                    .addTxt("example.com", "spf2.0/mfrom ~all");
            SpfRequest request = SpfRequest.builder()
                    .identity("user@example.com")
                    .ipAddress(InetAddress.getByName("192.0.2.3"))
                    .versions(List.of(1))
                    .build();

            SpfRecord record = server(QueryRrTypes.TXT).selectRecord(request);

            assertThat(record.getText()).isEqualTo("v=spf1 -all");
        }

        @DisplayName("Non-policy texts are skipped and none left means no record")
        @Test
        void testNoAcceptableRecord() throws Exception {
            resolver.addTxt("example.com", "google-site-verification=abc")
                    .addTxt("example.com", "v=spf10 -all");

            assertThatThrownBy(() -> server(QueryRrTypes.TXT).selectRecord(request("user@example.com")))
                    .isInstanceOf(NoAcceptableRecordException.class)
                    .hasMessage("No applicable sender policy available");
        }

        @DisplayName("A malformed record of a requested version propagates")
        @Test
        void testSyntaxErrorPropagates() throws Exception {
            resolver.addTxt("example.com", "v=spf1 foo:bar -all");

            assertThatThrownBy(() -> server(QueryRrTypes.TXT).selectRecord(request("user@example.com")))
                    .isInstanceOf(RecordSyntaxException.class);
        }

        @DisplayName("The first DNS error is rethrown when every query failed")
        @Test
        void testAllQueriesFailed() throws Exception {
            resolver.fail("example.com", Type.SPF, QueryStatus.TIMEOUT)
                    .fail("example.com", Type.TXT, QueryStatus.SERVER_ERROR);

            assertThatThrownBy(() -> server(QueryRrTypes.ALL).selectRecord(request("user@example.com")))
                    .isInstanceOf(DnsTimeoutException.class)
                    .hasMessage("Time-out on DNS 'SPF' lookup of 'example.com'");
        }

        @DisplayName("One successful query is enough")
        @Test
        void testOneQuerySucceeded() throws Exception {
            resolver.fail("example.com", Type.SPF, QueryStatus.TIMEOUT)
                    .addTxt("example.com", "v=spf1 -all");

            SpfRecord record = server(QueryRrTypes.ALL).selectRecord(request("user@example.com"));

            assertThat(record.getText()).isEqualTo("v=spf1 -all");
        }

        @DisplayName("Ignored SPF-type time-outs leave the TXT error to be reported")
        @Test
        void testIgnoreSpfTypeTimeouts() throws Exception {
            resolver.fail("example.com", Type.SPF, QueryStatus.TIMEOUT)
                    .fail("example.com", Type.TXT, QueryStatus.SERVER_ERROR);
            SpfServer server = new SpfServer(SpfServerOptions.builder()
                    .hostname("mx.example.org")
                    .dnsResolver(resolver)
                    .queryRrTypes(QueryRrTypes.ALL)
                    .ignoreSpfTypeTimeouts(true)
                    .build());

            assertThatThrownBy(() -> server.selectRecord(request("user@example.com")))
                    .isInstanceOf(DnsException.class)
                    .isNotInstanceOf(DnsTimeoutException.class)
                    .hasMessage("'SERVFAIL' error on DNS 'TXT' lookup of 'example.com'");
        }

        @DisplayName("With no query type enabled there is no record")
        @Test
        void testNoQueryTypes() throws Exception {
            resolver.addTxt("example.com", "v=spf1 -all");

            assertThatThrownBy(() -> server(QueryRrTypes.NONE).selectRecord(request("user@example.com")))
                    .isInstanceOf(NoAcceptableRecordException.class);
            assertThat(resolver.getQueries()).isEmpty();
        }
    }

    @Nested
    @DisplayName("DNS lookup")
    class Lookup {

        @DisplayName("Domains are canonicalized before querying")
        @Test
        void testCanonicalized() {
            server(QueryRrTypes.TXT).dnsLookup("Example.COM.", Type.TXT);

            assertThat(resolver.getQueries()).containsExactly("example.com/TXT");
        }

        @DisplayName("NXDOMAIN is an empty answer")
        @Test
        void testNxDomain() {
            assertThat(server(QueryRrTypes.TXT).dnsLookup("missing.example.com", Type.TXT).answers()).isEmpty();
        }

        @DisplayName("Failures map onto DNS exceptions")
        @Test
        void testFailures() {
            resolver.fail("timeout.example.com", Type.TXT, QueryStatus.TIMEOUT)
                    .fail("silent.example.com", Type.TXT, QueryStatus.NO_RESPONSE)
                    .fail("broken.example.com", Type.TXT, QueryStatus.SERVER_ERROR);
            SpfServer server = server(QueryRrTypes.TXT);

            assertThatThrownBy(() -> server.dnsLookup("timeout.example.com", Type.TXT))
                    .isInstanceOf(DnsTimeoutException.class)
                    .hasMessage("Time-out on DNS 'TXT' lookup of 'timeout.example.com'");
            assertThatThrownBy(() -> server.dnsLookup("silent.example.com", Type.TXT))
                    .isExactlyInstanceOf(DnsException.class)
                    .hasMessage("Unknown error on DNS 'TXT' lookup of 'silent.example.com'");
            assertThatThrownBy(() -> server.dnsLookup("broken.example.com", Type.TXT))
                    .isExactlyInstanceOf(DnsException.class)
                    .hasMessage("'SERVFAIL' error on DNS 'TXT' lookup of 'broken.example.com'");
        }

        @DisplayName("Macro domains are expanded first")
        @Test
        void testMacroDomain() throws Exception {
            server(QueryRrTypes.TXT).dnsLookup(MacroString.domainSpec("%{ir}._spf.%{D}"), request("user@example.com"), Type.A);

            assertThat(resolver.getQueries()).containsExactly("3.2.0.192._spf.example.com/A");
        }
    }

    @Nested
    @DisplayName("Processing")
    class Processing {

        @DisplayName("DNS errors become temperror")
        @Test
        void testTempError() throws Exception {
            resolver.fail("example.com", Type.TXT, QueryStatus.SERVER_ERROR);

            SpfResult result = server(QueryRrTypes.TXT).process(request("user@example.com"));

            assertThat(result.code()).isEqualTo(SpfResult.Code.TEMPERROR);
            assertThat(result.text()).isEqualTo("'SERVFAIL' error on DNS 'TXT' lookup of 'example.com'");
        }

        @DisplayName("A missing policy becomes none")
        @Test
        void testNone() throws Exception {
            SpfResult result = server(QueryRrTypes.TXT).process(request("user@example.com"));

            assertThat(result.code()).isEqualTo(SpfResult.Code.NONE);
            assertThat(result.text()).isEqualTo("No applicable sender policy available");
        }

        @DisplayName("Redundant and malformed policies become permerror")
        @Test
        void testPermError() throws Exception {
            resolver.addTxt("example.com", "v=spf1 -all")
                    .addTxt("example.com", "v=spf1 +all")
                    .addTxt("example.net", "v=spf1 ip4:192.0.2.0/40 -all");
            SpfServer server = server(QueryRrTypes.TXT);

            assertThat(server.process(request("user@example.com")).code()).isEqualTo(SpfResult.Code.PERMERROR);
            assertThat(server.process(request("user@example.net")).code()).isEqualTo(SpfResult.Code.PERMERROR);
        }

        @DisplayName("The selected record is stored in the request")
        @Test
        void testRecordStored() throws Exception {
            resolver.addTxt("example.com", "v=spf1 ip4:192.0.2.3 -all");
            SpfRequest request = request("user@example.com");

            SpfResult result = server(QueryRrTypes.TXT).process(request);

            assertThat(result.code()).isEqualTo(SpfResult.Code.PASS);
            assertThat(request.getRecord().getText()).isEqualTo("v=spf1 ip4:192.0.2.3 -all");
        }

        @DisplayName("Verdicts and DNS queries are counted")
        @Test
        void testMetrics() throws Exception {
            resolver.addTxt("example.com", "v=spf1 -all");
            SimpleMeterRegistry registry = new SimpleMeterRegistry();
            SpfServer server = new SpfServer(SpfServerOptions.builder()
                    .hostname("mx.example.org")
                    .dnsResolver(resolver)
                    .build(), new SpfMetricsRecorder(registry));

            server.process(request("user@example.com"));

            assertThat(registry.counter("spf.server.result.total", "scope", "mfrom", "result", "fail").count())
                    .isEqualTo(1.0);
            assertThat(registry.counter("spf.server.dns.query.total", "type", "TXT", "status", "SUCCESS").count())
                    .isEqualTo(1.0);
        }
    }

    private SpfServer server(QueryRrTypes queryRrTypes) {
        return new SpfServer(SpfServerOptions.builder()
                .hostname("mx.example.org")
                .dnsResolver(resolver)
                .queryRrTypes(queryRrTypes)
                .build());
    }

    private static SpfRequest request(String identity) throws Exception {
        return SpfRequest.builder()
                .identity(identity)
                .ipAddress(InetAddress.getByName("192.0.2.3"))
                .build();
    }
}
