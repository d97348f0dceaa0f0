package io.github.hotbrkm.spfengine.evaluator.spf.record.mechanism;

import io.github.hotbrkm.spfengine.evaluator.spf.SpfRequest;
import io.github.hotbrkm.spfengine.evaluator.spf.SpfServer;
import io.github.hotbrkm.spfengine.evaluator.spf.record.Qualifier;
import io.github.hotbrkm.spfengine.evaluator.spf.record.TermOutcome;
import io.github.hotbrkm.spfengine.evaluator.spf.util.IpAddressUtil;

import java.net.InetAddress;
import java.net.UnknownHostException;

/**
 * {@code ip4} and {@code ip6}: matches a client inside the network. An address of the other family never matches.
 */
public class IpMechanism extends Mechanism {

    private final String name;
    private final byte[] network;
    private final int prefixLength;

    public IpMechanism(Qualifier qualifier, String name, byte[] network, int prefixLength) {
        super(qualifier);
        this.name = name;
        this.network = network.clone();
        this.prefixLength = prefixLength;
    }

    @Override
    public String getName() {
        return name;
    }

    public int getPrefixLength() {
        return prefixLength;
    }

    @Override
    public TermOutcome evaluate(SpfServer server, SpfRequest request) {
        return TermOutcome.of(IpAddressUtil.inNetwork(request.getIpAddress(), network, prefixLength));
    }

    @Override
    protected String params() {
        String address;
        try {
            address = IpAddressUtil.toReadableForm(InetAddress.getByAddress(network));
        } catch (UnknownHostException e) {
            throw new IllegalStateException("Invalid network address length: " + network.length, e);
        }
        return ":" + address + (prefixLength == network.length * 8 ? "" : "/" + prefixLength);
    }
}
