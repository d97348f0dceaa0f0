package io.github.hotbrkm.spfengine.evaluator.spf;

import io.github.hotbrkm.spfengine.evaluator.spf.dns.DnsResolver;
import io.github.hotbrkm.spfengine.evaluator.spf.exception.DnsException;
import io.github.hotbrkm.spfengine.evaluator.spf.exception.DnsTimeoutException;
import io.github.hotbrkm.spfengine.evaluator.spf.exception.InvalidRecordVersionException;
import io.github.hotbrkm.spfengine.evaluator.spf.exception.NoAcceptableRecordException;
import io.github.hotbrkm.spfengine.evaluator.spf.exception.ProcessingLimitExceededException;
import io.github.hotbrkm.spfengine.evaluator.spf.exception.RecordSyntaxException;
import io.github.hotbrkm.spfengine.evaluator.spf.exception.RedundantAcceptableRecordsException;
import io.github.hotbrkm.spfengine.evaluator.spf.macro.MacroString;
import io.github.hotbrkm.spfengine.evaluator.spf.metrics.SpfMetricsRecorder;
import io.github.hotbrkm.spfengine.evaluator.spf.record.RecordVersion;
import io.github.hotbrkm.spfengine.evaluator.spf.record.SpfRecord;
import io.github.hotbrkm.spfengine.evaluator.spf.result.SpfResult;
import io.github.hotbrkm.spfengine.evaluator.spf.util.DomainNames;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import org.xbill.DNS.Type;

import java.net.InetAddress;
import java.net.UnknownHostException;
import java.util.ArrayList;
import java.util.List;

/**
 * Evaluates SPF requests.
 * <p>
 * The server owns the configuration, the DNS resolver and the processing limits; it is immutable and can be
 * shared between threads. Every call to {@link #process(SpfRequest)} is synchronous and confined to the
 * calling thread, as is the request tree it walks.
 */
@Slf4j
@Getter
public class SpfServer {

    private static final String FALLBACK_HOSTNAME = "localhost";

    private final MacroString defaultAuthorityExplanation;
    private final String hostname;
    private final DnsResolver dnsResolver;
    private final QueryRrTypes queryRrTypes;
    private final boolean ignoreSpfTypeTimeouts;
    private final int maxDnsInteractiveTerms;
    private final int maxNameLookupsPerTerm;
    private final int maxNameLookupsPerMxMech;
    private final int maxNameLookupsPerPtrMech;
    private final int maxVoidDnsLookups;
    private final SpfMetricsRecorder metricsRecorder;

    public SpfServer() {
        this(SpfServerOptions.defaults());
    }

    public SpfServer(SpfServerOptions options) {
        this(options, new SpfMetricsRecorder(null));
    }

    /**
     * @throws IllegalArgumentException if the default explanation is not a valid explanation string
     */
    public SpfServer(SpfServerOptions options, SpfMetricsRecorder metricsRecorder) {
        this.defaultAuthorityExplanation = options.getDefaultAuthorityExplanationTemplate() != null
                ? options.getDefaultAuthorityExplanationTemplate()
                : parseExplanation(options.getDefaultAuthorityExplanation());
        this.hostname = options.getHostname() == null || options.getHostname().isBlank()
                ? detectHostname()
                : options.getHostname();
        this.dnsResolver = options.getDnsResolver() == null ? new DnsResolver() : options.getDnsResolver();
        this.queryRrTypes = options.getQueryRrTypes() == null ? QueryRrTypes.TXT : options.getQueryRrTypes();
        this.ignoreSpfTypeTimeouts = options.isIgnoreSpfTypeTimeouts();
        this.maxDnsInteractiveTerms = options.getMaxDnsInteractiveTerms();
        this.maxNameLookupsPerTerm = options.getMaxNameLookupsPerTerm();
        this.maxNameLookupsPerMxMech = options.getMaxNameLookupsPerMxMech() == null
                ? maxNameLookupsPerTerm
                : options.getMaxNameLookupsPerMxMech();
        this.maxNameLookupsPerPtrMech = options.getMaxNameLookupsPerPtrMech() == null
                ? maxNameLookupsPerTerm
                : options.getMaxNameLookupsPerPtrMech();
        this.maxVoidDnsLookups = options.getMaxVoidDnsLookups();
        this.metricsRecorder = metricsRecorder == null ? new SpfMetricsRecorder(null) : metricsRecorder;
    }

    /**
     * Evaluates a request and returns exactly one verdict.
     * <p>
     * Protocol failures become verdicts here: DNS errors {@code temperror}, a missing policy {@code none},
     * conflicting policies, syntax errors and exceeded limits {@code permerror}. Any other exception propagates.
     */
    public SpfResult process(SpfRequest request) {
        request.resetTransientState();

        SpfResult result;
        try {
            SpfRecord record = selectRecord(request);
            request.setRecord(record);
            result = record.eval(this, request);
        } catch (DnsException e) {
            result = newResult(SpfResult.Code.TEMPERROR, request, e.getMessage());
        } catch (NoAcceptableRecordException e) {
            result = newResult(SpfResult.Code.NONE, request, e.getMessage());
        } catch (RedundantAcceptableRecordsException | RecordSyntaxException | ProcessingLimitExceededException e) {
            result = newResult(SpfResult.Code.PERMERROR, request, e.getMessage());
        }

        log.debug("SPF evaluated: request={}, result={}", request, result);
        if (request.isRootRequest()) {
            metricsRecorder.recordResult(request.getScope().scopeName(), result.code().getName());
        }
        return result;
    }

    /**
     * Looks up the policy records of the request's authority domain and selects the one that applies.
     *
     * @throws DnsException                         if every attempted query failed
     * @throws NoAcceptableRecordException          if no record applies
     * @throws RedundantAcceptableRecordsException  if more than one record of the highest version applies
     * @throws RecordSyntaxException                if an applicable record is malformed
     */
    public SpfRecord selectRecord(SpfRequest request) {
        String domain = request.getAuthorityDomain();
        List<RecordVersion> versions = request.getVersions();
        Scope scope = request.getScope();

        List<SpfRecord> records = new ArrayList<>();
        List<DnsException> dnsErrors = new ArrayList<>();
        int queryCount = 0;

        if (queryRrTypes.includesSpf()) {
            try {
                queryCount++;
                records.addAll(getAcceptableRecords(dnsLookup(domain, Type.SPF), Type.SPF, versions, scope));
            } catch (DnsTimeoutException e) {
                if (ignoreSpfTypeTimeouts) {
                    log.debug("Ignoring time-out of SPF-type query: domain={}", domain);
                    queryCount--;
                } else {
                    dnsErrors.add(e);
                }
            } catch (DnsException e) {
                dnsErrors.add(e);
            }
        }

        // Still try TXT when type 99 records exist but none of them applies (RFC 4408, 4.5)
        if (records.isEmpty() && queryRrTypes.includesTxt()) {
            try {
                queryCount++;
                records.addAll(getAcceptableRecords(dnsLookup(domain, Type.TXT), Type.TXT, versions, scope));
            } catch (DnsException e) {
                dnsErrors.add(e);
            }
        }

        if (queryCount > 0 && dnsErrors.size() == queryCount) {
            throw dnsErrors.get(0);
        }

        if (records.isEmpty()) {
            // RFC 4408, 4.5/7
            throw new NoAcceptableRecordException("No applicable sender policy available");
        }

        RecordVersion preferred = records.stream()
                .map(SpfRecord::getVersion)
                .max((left, right) -> Integer.compare(left.version(), right.version()))
                .orElseThrow();
        List<SpfRecord> preferredRecords = records.stream()
                .filter(record -> record.getVersion() == preferred)
                .toList();

        if (preferredRecords.size() != 1) {
            // RFC 4408, 4.5/6
            throw new RedundantAcceptableRecordsException(
                    "Redundant applicable '" + preferred.versionTag() + "' sender policies found");
        }

        SpfRecord selected = preferredRecords.get(0);
        log.debug("SPF record selected: domain={}, record={}", domain, selected);
        return selected;
    }

    /**
     * Parses the TXT or SPF answers of a lookup into the records applicable to {@code scope}.
     * <p>
     * Each answer is tried against the versions highest first. Texts that are no policy record of any
     * requested version are skipped; a malformed record of a requested version is an error.
     *
     * @throws RecordSyntaxException if an answer carries a requested version tag but is malformed
     */
    public List<SpfRecord> getAcceptableRecords(DnsResolver.QueryResult queryResult, int type,
                                                List<RecordVersion> versions, Scope scope) {
        List<RecordVersion> ordered = versions.stream()
                .sorted((left, right) -> Integer.compare(right.version(), left.version()))
                .toList();

        List<SpfRecord> records = new ArrayList<>();
        for (String text : queryResult.texts(type)) {
            SpfRecord record = null;
            for (RecordVersion version : ordered) {
                try {
                    record = version.parse(text);
                    break;
                } catch (InvalidRecordVersionException e) {
                    log.trace("Skipping answer for version {}: {}", version.versionTag(), e.getMessage());
                }
            }
            if (record != null && record.covers(scope)) {
                records.add(record);
            }
        }
        return records;
    }

    /**
     * Queries DNS for a domain after canonicalizing it.
     *
     * @return the answer; NXDOMAIN is returned as an empty answer
     * @throws DnsTimeoutException on a time-out
     * @throws DnsException        on any other failure
     */
    public DnsResolver.QueryResult dnsLookup(String domain, int type) {
        String name = DomainNames.canonicalize(domain);
        String typeName = Type.string(type);

        DnsResolver.QueryResult result = dnsResolver.query(name, type);
        metricsRecorder.recordDnsQuery(typeName, result.status().name());
        log.debug("DNS lookup: name={}, type={}, status={}, answers={}",
                name, typeName, result.status(), result.answers().size());

        return switch (result.status()) {
            case SUCCESS, NOT_FOUND -> result;
            case TIMEOUT -> throw new DnsTimeoutException(
                    "Time-out on DNS '" + typeName + "' lookup of '" + name + "'");
            case NO_RESPONSE -> throw new DnsException(
                    "Unknown error on DNS '" + typeName + "' lookup of '" + name + "'");
            case SERVER_ERROR -> throw new DnsException(
                    "'" + result.detail() + "' error on DNS '" + typeName + "' lookup of '" + name + "'");
        };
    }

    /**
     * Expands a domain-spec for the request and queries it.
     */
    public DnsResolver.QueryResult dnsLookup(MacroString domain, SpfRequest request, int type) {
        return dnsLookup(domain.expand(this, request), type);
    }

    /**
     * Counts a term that is about to query DNS against the root request's limit.
     *
     * @throws ProcessingLimitExceededException once the count exceeds the limit
     */
    public void countDnsInteractiveTerm(SpfRequest request) {
        int count = request.getLimitTracker().countDnsInteractiveTerm();
        if (maxDnsInteractiveTerms > 0 && count > maxDnsInteractiveTerms) {
            throw limitExceeded("dns-interactive-terms",
                    "Maximum DNS-interactive terms limit (" + maxDnsInteractiveTerms + ") exceeded");
        }
    }

    /**
     * Counts a lookup that returned nothing against the root request's limit.
     *
     * @throws ProcessingLimitExceededException once the count exceeds the limit
     */
    public void countVoidDnsLookup(SpfRequest request) {
        int count = request.getLimitTracker().countVoidDnsLookup();
        if (maxVoidDnsLookups > 0 && count > maxVoidDnsLookups) {
            throw limitExceeded("void-dns-lookups",
                    "Maximum void DNS look-ups limit (" + maxVoidDnsLookups + ") exceeded");
        }
    }

    /**
     * Records a tripped limit and returns the exception for the caller to throw.
     */
    public ProcessingLimitExceededException limitExceeded(String limit, String message) {
        log.warn("SPF processing limit exceeded: limit={}, message={}", limit, message);
        metricsRecorder.recordLimitExceeded(limit);
        return new ProcessingLimitExceededException(message);
    }

    public SpfResult.Code resultCode(String name) {
        return SpfResult.Code.byName(name);
    }

    public SpfResult newResult(SpfResult.Code code, SpfRequest request, String text) {
        return code.create(this, request, text);
    }

    /**
     * Expands the default explanation for a {@code fail} verdict that has none of its own.
     */
    public String defaultAuthorityExplanation(SpfRequest request) {
        return defaultAuthorityExplanation.expand(this, request);
    }

    private static MacroString parseExplanation(String text) {
        try {
            return MacroString.explanation(text == null ? SpfServerOptions.DEFAULT_AUTHORITY_EXPLANATION : text);
        } catch (RecordSyntaxException e) {
            throw new IllegalArgumentException("Invalid default authority explanation: " + e.getMessage(), e);
        }
    }

    private static String detectHostname() {
        try {
            return InetAddress.getLocalHost().getCanonicalHostName();
        } catch (UnknownHostException e) {
            log.warn("Could not detect local host name, using '{}': {}", FALLBACK_HOSTNAME, e.getMessage());
            return FALLBACK_HOSTNAME;
        }
    }
}
