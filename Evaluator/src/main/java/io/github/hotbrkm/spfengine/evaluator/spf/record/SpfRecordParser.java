package io.github.hotbrkm.spfengine.evaluator.spf.record;

import io.github.hotbrkm.spfengine.evaluator.spf.Scope;
import io.github.hotbrkm.spfengine.evaluator.spf.exception.InvalidRecordVersionException;
import io.github.hotbrkm.spfengine.evaluator.spf.exception.RecordSyntaxException;
import io.github.hotbrkm.spfengine.evaluator.spf.macro.MacroString;
import io.github.hotbrkm.spfengine.evaluator.spf.record.mechanism.AMechanism;
import io.github.hotbrkm.spfengine.evaluator.spf.record.mechanism.AllMechanism;
import io.github.hotbrkm.spfengine.evaluator.spf.record.mechanism.ExistsMechanism;
import io.github.hotbrkm.spfengine.evaluator.spf.record.mechanism.IncludeMechanism;
import io.github.hotbrkm.spfengine.evaluator.spf.record.mechanism.IpMechanism;
import io.github.hotbrkm.spfengine.evaluator.spf.record.mechanism.Mechanism;
import io.github.hotbrkm.spfengine.evaluator.spf.record.mechanism.MxMechanism;
import io.github.hotbrkm.spfengine.evaluator.spf.record.mechanism.PtrMechanism;
import io.github.hotbrkm.spfengine.evaluator.spf.util.DomainNames;
import org.xbill.DNS.Address;

import java.util.ArrayList;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parser for {@code v=spf1} and {@code spf2.0} record texts.
 */
final class SpfRecordParser {

    private static final Pattern MODIFIER = Pattern.compile("^([A-Za-z][A-Za-z0-9_.\\-]*)=(.*)$");
    private static final Pattern MECHANISM = Pattern.compile("^([+\\-~?]?)([A-Za-z][A-Za-z0-9_.\\-]*)(.*)$");
    private static final Pattern DUAL_CIDR = Pattern.compile("^(.*?)(?:/(0|[1-9]\\d{0,2}))?(?://(0|[1-9]\\d{0,2}))?$");
    private static final Pattern IP_NETWORK = Pattern.compile("^(.+?)(?:/(0|[1-9]\\d{0,2}))?$");

    private static final int IPV4_MAX_PREFIX = 32;
    private static final int IPV6_MAX_PREFIX = 128;

    private SpfRecordParser() {
        // Prevent instantiation
    }

    static SpfRecord parse(RecordVersion version, String text) {
        if (text == null) {
            throw new InvalidRecordVersionException("Record text is missing");
        }
        Matcher tag = version.versionTagPattern().matcher(text);
        if (!tag.find()) {
            throw new InvalidRecordVersionException("Not a '" + version.versionTag() + "' record: '" + text + "'");
        }

        Set<Scope> scopes = version == RecordVersion.V1
                ? EnumSet.copyOf(version.validScopes())
                : parseScopes(version, tag.group(1), text);

        List<Mechanism> mechanisms = new ArrayList<>();
        MacroString redirect = null;
        MacroString explanation = null;
        Map<String, MacroString> unknownModifiers = new LinkedHashMap<>();

        for (String term : text.substring(tag.end()).split("\\x20+")) {
            if (term.isEmpty()) {
                continue;
            }
            Matcher modifier = MODIFIER.matcher(term);
            if (modifier.matches()) {
                String name = modifier.group(1).toLowerCase(Locale.ROOT);
                MacroString value = MacroString.domainSpec(modifier.group(2));
                switch (name) {
                    case "redirect" -> {
                        if (redirect != null) {
                            throw new RecordSyntaxException("Duplicate 'redirect=' modifier in '" + text + "'");
                        }
                        redirect = requireDomainSpec(value, term);
                    }
                    case "exp" -> {
                        if (explanation != null) {
                            throw new RecordSyntaxException("Duplicate 'exp=' modifier in '" + text + "'");
                        }
                        explanation = requireDomainSpec(value, term);
                    }
                    default -> unknownModifiers.put(name, value);
                }
                continue;
            }
            mechanisms.add(parseMechanism(version, term));
        }

        return new SpfRecord(version, scopes, text, mechanisms, redirect, explanation, unknownModifiers);
    }

    private static Set<Scope> parseScopes(RecordVersion version, String scopeList, String text) {
        Set<Scope> scopes = EnumSet.noneOf(Scope.class);
        for (String name : scopeList.split(",", -1)) {
            Scope scope;
            try {
                scope = Scope.byName(name);
            } catch (IllegalArgumentException e) {
                throw new RecordSyntaxException("Invalid scope '" + name + "' in '" + text + "'");
            }
            if (!version.supports(scope)) {
                throw new RecordSyntaxException("Invalid scope '" + name + "' for '" + version.versionTag() + "' record");
            }
            scopes.add(scope);
        }
        return scopes;
    }

    private static Mechanism parseMechanism(RecordVersion version, String term) {
        Matcher matcher = MECHANISM.matcher(term);
        if (!matcher.matches()) {
            throw new RecordSyntaxException("Invalid term '" + term + "'");
        }
        Qualifier qualifier = Qualifier.of(matcher.group(1));
        String name = matcher.group(2).toLowerCase(Locale.ROOT);
        String argument = matcher.group(3);

        return switch (name) {
            case "all" -> {
                if (!argument.isEmpty()) {
                    throw new RecordSyntaxException("Junk encountered in 'all' mechanism: '" + term + "'");
                }
                yield new AllMechanism(qualifier);
            }
            case "include" -> new IncludeMechanism(qualifier, requiredDomainSpec(argument, term));
            case "exists" -> new ExistsMechanism(qualifier, requiredDomainSpec(argument, term));
            case "ptr" -> new PtrMechanism(qualifier, optionalDomainSpec(argument, term));
            case "a", "mx" -> {
                Matcher cidr = DUAL_CIDR.matcher(argument);
                if (!cidr.matches()) {
                    throw new RecordSyntaxException("Invalid '" + name + "' mechanism: '" + term + "'");
                }
                MacroString domainSpec = optionalDomainSpec(cidr.group(1), term);
                int ipv4Prefix = prefix(cidr.group(2), IPV4_MAX_PREFIX, term);
                int ipv6Prefix = prefix(cidr.group(3), IPV6_MAX_PREFIX, term);
                yield "a".equals(name)
                        ? new AMechanism(qualifier, domainSpec, ipv4Prefix, ipv6Prefix)
                        : new MxMechanism(qualifier, domainSpec, ipv4Prefix, ipv6Prefix);
            }
            case "ip4" -> parseIpNetwork(qualifier, name, argument, Address.IPv4, IPV4_MAX_PREFIX, term);
            case "ip6" -> parseIpNetwork(qualifier, name, argument, Address.IPv6, IPV6_MAX_PREFIX, term);
            default -> throw new RecordSyntaxException(
                    "Unknown mechanism type '" + name + "' in '" + version.versionTag() + "' record");
        };
    }

    private static Mechanism parseIpNetwork(Qualifier qualifier, String name, String argument, int family,
                                            int maxPrefix, String term) {
        if (!argument.startsWith(":") || argument.length() < 2) {
            throw new RecordSyntaxException("Missing network address in '" + term + "'");
        }
        Matcher matcher = IP_NETWORK.matcher(argument.substring(1));
        if (!matcher.matches()) {
            throw new RecordSyntaxException("Invalid network in '" + term + "'");
        }
        byte[] network = Address.toByteArray(matcher.group(1), family);
        if (network == null) {
            throw new RecordSyntaxException("Invalid " + name + " address in '" + term + "'");
        }
        return new IpMechanism(qualifier, name, network, prefix(matcher.group(2), maxPrefix, term));
    }

    private static int prefix(String value, int maxPrefix, String term) {
        if (value == null) {
            return maxPrefix;
        }
        int prefix = Integer.parseInt(value);
        if (prefix > maxPrefix) {
            throw new RecordSyntaxException("Invalid CIDR prefix length '/" + value + "' in '" + term + "'");
        }
        return prefix;
    }

    private static MacroString requiredDomainSpec(String argument, String term) {
        if (!argument.startsWith(":") || argument.length() < 2) {
            throw new RecordSyntaxException("Missing domain-spec in '" + term + "'");
        }
        return requireDomainSpec(MacroString.domainSpec(argument.substring(1)), term);
    }

    private static MacroString optionalDomainSpec(String argument, String term) {
        if (argument.isEmpty()) {
            return null;
        }
        return requiredDomainSpec(argument, term);
    }

    private static MacroString requireDomainSpec(MacroString value, String term) {
        if (value.getText().isEmpty()) {
            throw new RecordSyntaxException("Missing domain-spec in '" + term + "'");
        }
        // A literal domain-spec made of dots only names no domain
        if (!value.hasMacros() && DomainNames.canonicalize(value.getText()).isEmpty()) {
            throw new RecordSyntaxException("Invalid domain-spec '" + value + "' in '" + term + "'");
        }
        return value;
    }
}
