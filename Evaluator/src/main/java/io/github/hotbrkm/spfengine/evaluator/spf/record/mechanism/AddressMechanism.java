package io.github.hotbrkm.spfengine.evaluator.spf.record.mechanism;

import io.github.hotbrkm.spfengine.evaluator.spf.SpfRequest;
import io.github.hotbrkm.spfengine.evaluator.spf.macro.MacroString;
import io.github.hotbrkm.spfengine.evaluator.spf.record.Qualifier;
import io.github.hotbrkm.spfengine.evaluator.spf.util.IpAddressUtil;
import io.github.hotbrkm.spfengine.evaluator.spf.util.ValidatedDomains;
import org.xbill.DNS.Record;

import java.net.InetAddress;
import java.util.List;

/**
 * Base of the mechanisms that compare the client against host addresses with a dual CIDR length
 * ({@code a} and {@code mx}).
 */
public abstract class AddressMechanism extends Mechanism {

    private static final int IPV4_FULL_PREFIX = 32;
    private static final int IPV6_FULL_PREFIX = 128;

    private final MacroString domainSpec;
    private final int ipv4PrefixLength;
    private final int ipv6PrefixLength;

    protected AddressMechanism(Qualifier qualifier, MacroString domainSpec, int ipv4PrefixLength, int ipv6PrefixLength) {
        super(qualifier);
        this.domainSpec = domainSpec;
        this.ipv4PrefixLength = ipv4PrefixLength;
        this.ipv6PrefixLength = ipv6PrefixLength;
    }

    public MacroString getDomainSpec() {
        return domainSpec;
    }

    public int getIpv4PrefixLength() {
        return ipv4PrefixLength;
    }

    public int getIpv6PrefixLength() {
        return ipv6PrefixLength;
    }

    /**
     * Checks whether the client lies in the network of any of the A/AAAA records.
     */
    protected boolean matchesAny(SpfRequest request, List<Record> addressRecords) {
        InetAddress ip = request.getIpAddress();
        int prefix = IpAddressUtil.isIpv6(ip) ? ipv6PrefixLength : ipv4PrefixLength;
        return addressRecords.stream()
                .map(ValidatedDomains::address)
                .anyMatch(address -> address != null && IpAddressUtil.inNetwork(ip, address.getAddress(), prefix));
    }

    @Override
    protected String params() {
        StringBuilder params = new StringBuilder();
        if (domainSpec != null) {
            params.append(':').append(domainSpec);
        }
        if (ipv4PrefixLength != IPV4_FULL_PREFIX) {
            params.append('/').append(ipv4PrefixLength);
        }
        if (ipv6PrefixLength != IPV6_FULL_PREFIX) {
            params.append("//").append(ipv6PrefixLength);
        }
        return params.toString();
    }
}
