package io.github.hotbrkm.spfengine.evaluator.spf.util;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.net.InetAddress;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("IpAddressUtil test")
class IpAddressUtilTest {

    @DisplayName("IPv4 CIDR matching")
    @Test
    void testInNetworkIpv4() throws Exception {
        byte[] network = InetAddress.getByName("192.0.2.0").getAddress();

        assertThat(IpAddressUtil.inNetwork(InetAddress.getByName("192.0.2.200"), network, 24)).isTrue();
        assertThat(IpAddressUtil.inNetwork(InetAddress.getByName("192.0.3.1"), network, 24)).isFalse();
        assertThat(IpAddressUtil.inNetwork(InetAddress.getByName("192.0.3.1"), network, 23)).isTrue();
        assertThat(IpAddressUtil.inNetwork(InetAddress.getByName("10.0.0.1"), network, 0)).isTrue();
    }

    @DisplayName("IPv6 CIDR matching and family mismatch")
    @Test
    void testInNetworkIpv6() throws Exception {
        byte[] network = InetAddress.getByName("2001:db8::").getAddress();

        assertThat(IpAddressUtil.inNetwork(InetAddress.getByName("2001:db8::10"), network, 32)).isTrue();
        assertThat(IpAddressUtil.inNetwork(InetAddress.getByName("2001:db9::10"), network, 32)).isFalse();
        assertThat(IpAddressUtil.inNetwork(InetAddress.getByName("192.0.2.1"), network, 0)).isFalse();
    }

    @DisplayName("Macro form uses nibbles for IPv6")
    @Test
    void testToMacroForm() throws Exception {
        assertThat(IpAddressUtil.toMacroForm(InetAddress.getByName("192.0.2.3"))).isEqualTo("192.0.2.3");
        assertThat(IpAddressUtil.toMacroForm(InetAddress.getByName("2001:db8::cb01")))
                .isEqualTo("2.0.0.1.0.d.b.8.0.0.0.0.0.0.0.0.0.0.0.0.0.0.0.0.0.0.0.0.c.b.0.1");
    }

    @DisplayName("Readable form compresses the longest zero run")
    @Test
    void testToReadableForm() throws Exception {
        assertThat(IpAddressUtil.toReadableForm(InetAddress.getByName("2001:db8::cb01"))).isEqualTo("2001:db8::cb01");
        assertThat(IpAddressUtil.toReadableForm(InetAddress.getByName("::1"))).isEqualTo("::1");
        assertThat(IpAddressUtil.toReadableForm(InetAddress.getByName("2001:db8:0:1:0:0:0:1"))).isEqualTo("2001:db8:0:1::1");
        assertThat(IpAddressUtil.toReadableForm(InetAddress.getByName("192.0.2.3"))).isEqualTo("192.0.2.3");
    }
}
