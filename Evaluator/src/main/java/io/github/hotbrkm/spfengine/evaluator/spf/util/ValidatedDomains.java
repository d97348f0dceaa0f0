package io.github.hotbrkm.spfengine.evaluator.spf.util;

import io.github.hotbrkm.spfengine.evaluator.spf.SpfRequest;
import io.github.hotbrkm.spfengine.evaluator.spf.SpfServer;
import io.github.hotbrkm.spfengine.evaluator.spf.exception.DnsException;
import lombok.extern.slf4j.Slf4j;
import org.xbill.DNS.ARecord;
import org.xbill.DNS.AAAARecord;
import org.xbill.DNS.PTRRecord;
import org.xbill.DNS.Record;
import org.xbill.DNS.ReverseMap;
import org.xbill.DNS.Type;

import java.net.InetAddress;
import java.util.List;

/**
 * Forward-confirmed reverse DNS of the client address (RFC 7208, 5.5).
 */
@Slf4j
public final class ValidatedDomains {

    private ValidatedDomains() {
        // Prevent instantiation
    }

    /**
     * Name of the reverse-mapping zone entry of an address, e.g. {@code 3.2.0.192.in-addr.arpa}.
     */
    public static String reverseName(InetAddress ip) {
        return DomainNames.canonicalize(ReverseMap.fromAddress(ip).toString());
    }

    /**
     * Extracts at most {@code maxNames} host names from PTR answers, in answer order.
     *
     * @param maxNames name limit; zero or less keeps every name
     */
    public static List<String> ptrNames(List<Record> ptrAnswers, int maxNames) {
        return ptrAnswers.stream()
                .filter(PTRRecord.class::isInstance)
                .map(record -> DomainNames.canonicalize(((PTRRecord) record).getTarget().toString()))
                .limit(maxNames > 0 ? maxNames : Long.MAX_VALUE)
                .toList();
    }

    /**
     * Looks up the PTR names of the client and returns the first one that is forward-confirmed and
     * equal to or below {@code domain}.
     *
     * @param acceptAnyDomain when no name below {@code domain} confirms, fall back to any confirmed name
     * @return the validated name, or null if none
     * @throws DnsException if the PTR lookup itself fails
     */
    public static String find(SpfServer server, SpfRequest request, String domain, int maxNames,
                              boolean acceptAnyDomain) {
        List<Record> answers = server.dnsLookup(reverseName(request.getIpAddress()), Type.PTR).answers(Type.PTR);
        return find(server, request, ptrNames(answers, maxNames), domain, acceptAnyDomain);
    }

    /**
     * Same as {@link #find(SpfServer, SpfRequest, String, int, boolean)} for names that were already looked up.
     */
    public static String find(SpfServer server, SpfRequest request, List<String> names, String domain,
                              boolean acceptAnyDomain) {
        for (String name : names) {
            if (DomainNames.isSubdomainOrSelf(name, domain) && isForwardConfirmed(server, request.getIpAddress(), name)) {
                return name;
            }
        }
        if (!acceptAnyDomain) {
            return null;
        }
        for (String name : names) {
            if (!DomainNames.isSubdomainOrSelf(name, domain) && isForwardConfirmed(server, request.getIpAddress(), name)) {
                return name;
            }
        }
        return null;
    }

    /**
     * Checks whether one of the addresses of {@code name} is {@code ip}. A failing lookup skips the name.
     */
    public static boolean isForwardConfirmed(SpfServer server, InetAddress ip, String name) {
        int type = IpAddressUtil.isIpv6(ip) ? Type.AAAA : Type.A;
        try {
            return server.dnsLookup(name, type).answers(type).stream()
                    .map(ValidatedDomains::address)
                    .anyMatch(ip::equals);
        } catch (DnsException e) {
            log.debug("Forward lookup skipped: name={}, message={}", name, e.getMessage());
            return false;
        }
    }

    /**
     * Address of an A or AAAA record, null for any other record type.
     */
    public static InetAddress address(Record record) {
        if (record instanceof ARecord a) {
            return a.getAddress();
        }
        if (record instanceof AAAARecord aaaa) {
            return aaaa.getAddress();
        }
        return null;
    }
}
