package io.github.hotbrkm.spfengine.evaluator.spf.record.mechanism;

import io.github.hotbrkm.spfengine.evaluator.spf.SpfRequest;
import io.github.hotbrkm.spfengine.evaluator.spf.SpfServer;
import io.github.hotbrkm.spfengine.evaluator.spf.macro.MacroString;
import io.github.hotbrkm.spfengine.evaluator.spf.record.Qualifier;
import io.github.hotbrkm.spfengine.evaluator.spf.record.TermOutcome;
import org.xbill.DNS.MXRecord;
import org.xbill.DNS.Record;
import org.xbill.DNS.Type;

import java.util.Comparator;
import java.util.List;

/**
 * {@code mx}: matches a client that is one of the mail exchangers of the target domain.
 */
public class MxMechanism extends AddressMechanism {

    public MxMechanism(Qualifier qualifier, MacroString domainSpec, int ipv4PrefixLength, int ipv6PrefixLength) {
        super(qualifier, domainSpec, ipv4PrefixLength, ipv6PrefixLength);
    }

    @Override
    public String getName() {
        return "mx";
    }

    @Override
    public TermOutcome evaluate(SpfServer server, SpfRequest request) {
        server.countDnsInteractiveTerm(request);
        String target = targetDomain(getDomainSpec(), server, request);
        List<Record> exchangers = lookupCountingVoid(server, request, target, Type.MX);

        int maxNames = server.getMaxNameLookupsPerMxMech();
        if (maxNames > 0 && exchangers.size() > maxNames) {
            // RFC 4408, 10.1/7
            throw server.limitExceeded("mx-names",
                    "Maximum name look-ups per 'mx' mechanism limit (" + maxNames + ") exceeded for '" + target + "'");
        }

        int type = addressType(request);
        List<String> hosts = exchangers.stream()
                .map(MXRecord.class::cast)
                .sorted(Comparator.comparingInt(MXRecord::getPriority))
                .map(mx -> mx.getTarget().toString())
                .toList();
        for (String host : hosts) {
            if (matchesAny(request, server.dnsLookup(host, type).answers(type))) {
                return TermOutcome.MATCH;
            }
        }
        return TermOutcome.NO_MATCH;
    }
}
