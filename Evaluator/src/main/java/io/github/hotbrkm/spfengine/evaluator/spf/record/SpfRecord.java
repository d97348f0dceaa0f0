package io.github.hotbrkm.spfengine.evaluator.spf.record;

import io.github.hotbrkm.spfengine.evaluator.spf.Scope;
import io.github.hotbrkm.spfengine.evaluator.spf.SpfRequest;
import io.github.hotbrkm.spfengine.evaluator.spf.SpfServer;
import io.github.hotbrkm.spfengine.evaluator.spf.exception.DnsException;
import io.github.hotbrkm.spfengine.evaluator.spf.exception.RecordSyntaxException;
import io.github.hotbrkm.spfengine.evaluator.spf.macro.MacroString;
import io.github.hotbrkm.spfengine.evaluator.spf.record.mechanism.Mechanism;
import io.github.hotbrkm.spfengine.evaluator.spf.result.SpfResult;
import io.github.hotbrkm.spfengine.evaluator.spf.util.DomainNames;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import org.xbill.DNS.Type;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * A parsed sender policy. Created by {@link RecordVersion#parse(String)}.
 */
@Slf4j
@Getter
public class SpfRecord {

    private final RecordVersion version;
    private final Set<Scope> scopes;
    private final String text;
    private final List<Mechanism> mechanisms;
    private final MacroString redirect;
    private final MacroString explanation;
    private final Map<String, MacroString> unknownModifiers;

    SpfRecord(RecordVersion version, Set<Scope> scopes, String text, List<Mechanism> mechanisms,
              MacroString redirect, MacroString explanation, Map<String, MacroString> unknownModifiers) {
        this.version = version;
        this.scopes = Collections.unmodifiableSet(scopes);
        this.text = text;
        this.mechanisms = List.copyOf(mechanisms);
        this.redirect = redirect;
        this.explanation = explanation;
        this.unknownModifiers = Collections.unmodifiableMap(new LinkedHashMap<>(unknownModifiers));
    }

    /**
     * Version tag including the scopes for {@code spf2.0} records, e.g. {@code spf2.0/mfrom,pra}.
     */
    public String getVersionTag() {
        if (version == RecordVersion.V1) {
            return version.versionTag();
        }
        StringBuilder tag = new StringBuilder(version.versionTag()).append('/');
        String separator = "";
        for (Scope scope : scopes) {
            tag.append(separator).append(scope.scopeName());
            separator = ",";
        }
        return tag.toString();
    }

    public boolean covers(Scope scope) {
        return scopes.contains(scope);
    }

    /**
     * Evaluates the directives in order, then {@code redirect=}, then the default.
     *
     * @throws DnsException                on a failing lookup
     * @throws io.github.hotbrkm.spfengine.evaluator.spf.exception.ProcessingLimitExceededException on a tripped limit
     * @throws RecordSyntaxException       if the {@code redirect=} target expands to an empty name
     */
    public SpfResult eval(SpfServer server, SpfRequest request) {
        for (Mechanism mechanism : mechanisms) {
            TermOutcome outcome = mechanism.evaluate(server, request);
            if (outcome.isTerminal()) {
                return outcome.result();
            }
            if (outcome.match()) {
                log.debug("Mechanism matched: domain={}, mechanism={}", request.getAuthorityDomain(), mechanism);
                SpfResult.Code code = mechanism.getQualifier().getResultCode();
                if (code == SpfResult.Code.FAIL) {
                    request.setAuthorityExplanation(retrieveExplanation(server, request));
                }
                return server.newResult(code, request, "Mechanism '" + mechanism + "' matched");
            }
        }

        if (redirect != null) {
            server.countDnsInteractiveTerm(request);
            String target = DomainNames.canonicalize(redirect.expand(server, request));
            if (target.isEmpty()) {
                throw new RecordSyntaxException("Domain-spec '" + redirect + "' expands to an empty domain name");
            }
            SpfRequest redirectRequest = request.newSubRequest(target);
            SpfResult result = server.process(redirectRequest);
            if (result.code() == SpfResult.Code.NONE) {
                // RFC 4408, 6.1/4
                return server.newResult(SpfResult.Code.PERMERROR, request,
                        "Redirect domain '" + redirectRequest.getAuthorityDomain() + "' has no applicable sender policy");
            }
            return result;
        }

        // RFC 4408, 4.7/1
        return server.newResult(SpfResult.Code.NEUTRAL, request, "Default neutral result due to no mechanism matches");
    }

    /**
     * Fetches and expands the {@code exp=} explanation, null when there is none or it cannot be used.
     */
    private String retrieveExplanation(SpfServer server, SpfRequest request) {
        if (explanation == null) {
            return null;
        }
        try {
            List<String> texts = server.dnsLookup(explanation, request, Type.TXT).texts(Type.TXT);
            if (texts.size() != 1) {
                log.debug("Explanation ignored: domain={}, txtRecords={}", explanation.expand(server, request), texts.size());
                return null;
            }
            return MacroString.explanation(texts.get(0)).expand(server, request);
        } catch (DnsException | RecordSyntaxException e) {
            log.debug("Explanation lookup failed, using default: domain={}, message={}",
                    request.getAuthorityDomain(), e.getMessage());
            return null;
        }
    }

    @Override
    public String toString() {
        return text;
    }
}
