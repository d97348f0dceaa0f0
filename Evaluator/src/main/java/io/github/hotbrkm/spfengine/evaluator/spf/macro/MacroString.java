package io.github.hotbrkm.spfengine.evaluator.spf.macro;

import io.github.hotbrkm.spfengine.evaluator.spf.SpfRequest;
import io.github.hotbrkm.spfengine.evaluator.spf.SpfServer;
import io.github.hotbrkm.spfengine.evaluator.spf.exception.DnsException;
import io.github.hotbrkm.spfengine.evaluator.spf.exception.RecordSyntaxException;
import io.github.hotbrkm.spfengine.evaluator.spf.util.IpAddressUtil;
import io.github.hotbrkm.spfengine.evaluator.spf.util.ValidatedDomains;
import lombok.extern.slf4j.Slf4j;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * A domain-spec or explanation string with RFC 7208 section 7 macros.
 * <p>
 * The text is parsed once on construction, so syntax errors surface while the record is parsed.
 * Expansion needs the server (host name, DNS for {@code %{p}}) and the request being evaluated.
 *
 * <pre>
 * %{ir}.%{v}._spf.%{d2}   on 192.0.2.3 for example.com  -&gt; 3.2.0.192.in-addr._spf.example.com
 * %{l-}                   on user-name@example.com      -&gt; user.name
 * </pre>
 */
@Slf4j
public final class MacroString {

    private static final String DOMAIN_SPEC_LETTERS = "slodipvh";
    private static final String EXPLANATION_LETTERS = "slodipvhcrt";
    private static final String SCOPE_MACRO = "_scope";
    private static final String UNKNOWN = "unknown";
    private static final String VALIDATED_DOMAIN_STATE_PREFIX = "macro.validated-domain:";

    private static final Pattern MACRO = Pattern.compile("^([A-Za-z])(\\d{0,9})([rR]?)([.\\-+,/_=]*)$");

    private final String text;
    private final boolean explanation;
    private final List<Part> parts;

    private MacroString(String text, boolean explanation) {
        this.text = text;
        this.explanation = explanation;
        this.parts = parse(text, explanation);
    }

    /**
     * Parses a domain-spec, the argument of mechanisms, {@code redirect=} and {@code exp=}.
     *
     * @throws RecordSyntaxException on an invalid escape, an unterminated macro or a letter that is only
     *                               allowed in explanations
     */
    public static MacroString domainSpec(String text) {
        return new MacroString(text, false);
    }

    /**
     * Parses an explanation string, which additionally allows {@code c}, {@code r}, {@code t} and {@code _scope}.
     */
    public static MacroString explanation(String text) {
        return new MacroString(text, true);
    }

    public String getText() {
        return text;
    }

    public boolean isExplanation() {
        return explanation;
    }

    public boolean hasMacros() {
        return parts.stream().anyMatch(part -> part instanceof Macro);
    }

    /**
     * Expands every macro for the given request.
     */
    public String expand(SpfServer server, SpfRequest request) {
        StringBuilder sb = new StringBuilder(text.length() + 32);
        for (Part part : parts) {
            if (part instanceof Literal literal) {
                sb.append(literal.value());
            } else if (part instanceof Macro macro) {
                sb.append(expandMacro(macro, server, request));
            }
        }
        return sb.toString();
    }

    private String expandMacro(Macro macro, SpfServer server, SpfRequest request) {
        if (macro.scope()) {
            return request.getScope().scopeName();
        }
        String value = macroValue(Character.toLowerCase(macro.letter()), server, request);
        value = transform(value, macro);
        return Character.isUpperCase(macro.letter()) ? urlEscape(value) : value;
    }

    private String macroValue(char letter, SpfServer server, SpfRequest request) {
        return switch (letter) {
            case 's' -> request.getSender();
            case 'l' -> request.getLocalPart();
            case 'o' -> request.getDomain();
            case 'd' -> request.getAuthorityDomain();
            case 'i' -> IpAddressUtil.toMacroForm(request.getIpAddress());
            case 'p' -> validatedDomain(server, request);
            case 'v' -> IpAddressUtil.isIpv6(request.getIpAddress()) ? "ip6" : "in-addr";
            case 'h' -> request.getHeloIdentity() == null ? UNKNOWN : request.getHeloIdentity();
            case 'c' -> IpAddressUtil.toReadableForm(request.getIpAddress());
            case 'r' -> server.getHostname();
            case 't' -> Long.toString(System.currentTimeMillis() / 1000L);
            default -> throw new IllegalStateException("Unexpected macro letter: " + letter);
        };
    }

    private String validatedDomain(SpfServer server, SpfRequest request) {
        String key = VALIDATED_DOMAIN_STATE_PREFIX + request.getAuthorityDomain();
        String cached = request.getState(key, null);
        if (cached != null) {
            return cached;
        }
        String domain;
        try {
            domain = ValidatedDomains.find(server, request, request.getAuthorityDomain(),
                    server.getMaxNameLookupsPerTerm(), true);
        } catch (DnsException e) {
            log.debug("PTR lookup for macro 'p' failed: ip={}, message={}",
                    request.getIpAddress().getHostAddress(), e.getMessage());
            domain = null;
        }
        String value = domain == null ? UNKNOWN : domain;
        request.setState(key, value);
        return value;
    }

    private static String transform(String value, Macro macro) {
        if (macro.digits() == 0 && !macro.reverse() && macro.delimiters().isEmpty()) {
            return value;
        }
        String delimiters = macro.delimiters().isEmpty() ? "." : macro.delimiters();
        StringBuilder delimiterClass = new StringBuilder("[");
        for (char delimiter : delimiters.toCharArray()) {
            delimiterClass.append('\\').append(delimiter);
        }
        delimiterClass.append(']');
        List<String> labels = new ArrayList<>(Arrays.asList(value.split(delimiterClass.toString(), -1)));
        if (macro.reverse()) {
            Collections.reverse(labels);
        }
        if (macro.digits() > 0 && macro.digits() < labels.size()) {
            labels = labels.subList(labels.size() - macro.digits(), labels.size());
        }
        return String.join(".", labels);
    }

    /**
     * Percent-encodes everything but the RFC 3986 unreserved characters.
     */
    private static String urlEscape(String value) {
        StringBuilder sb = new StringBuilder(value.length() * 2);
        for (byte b : value.getBytes(StandardCharsets.UTF_8)) {
            int c = b & 0xFF;
            if ((c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z') || (c >= '0' && c <= '9')
                    || c == '-' || c == '.' || c == '_' || c == '~') {
                sb.append((char) c);
            } else {
                sb.append('%').append(String.format(Locale.ROOT, "%02X", c));
            }
        }
        return sb.toString();
    }

    private static List<Part> parse(String text, boolean explanation) {
        if (text == null) {
            throw new RecordSyntaxException("Macro string must not be null");
        }
        List<Part> parts = new ArrayList<>();
        StringBuilder literal = new StringBuilder();
        int i = 0;
        while (i < text.length()) {
            char c = text.charAt(i);
            if (c != '%') {
                literal.append(c);
                i++;
                continue;
            }
            if (i + 1 >= text.length()) {
                throw new RecordSyntaxException("Unterminated macro escape in '" + text + "'");
            }
            char next = text.charAt(i + 1);
            switch (next) {
                case '%' -> literal.append('%');
                case '_' -> literal.append(' ');
                case '-' -> literal.append("%20");
                case '{' -> {
                    int close = text.indexOf('}', i + 2);
                    if (close < 0) {
                        throw new RecordSyntaxException("Unterminated macro in '" + text + "'");
                    }
                    if (literal.length() > 0) {
                        parts.add(new Literal(literal.toString()));
                        literal.setLength(0);
                    }
                    parts.add(parseMacro(text.substring(i + 2, close), text, explanation));
                    i = close + 1;
                    continue;
                }
                default -> throw new RecordSyntaxException(
                        "Invalid macro escape '%" + next + "' in '" + text + "'");
            }
            i += 2;
        }
        if (literal.length() > 0) {
            parts.add(new Literal(literal.toString()));
        }
        return List.copyOf(parts);
    }

    private static Macro parseMacro(String body, String text, boolean explanation) {
        if (SCOPE_MACRO.equals(body)) {
            if (!explanation) {
                throw new RecordSyntaxException("Macro '%{" + body + "}' is only allowed in explanations: '" + text + "'");
            }
            return new Macro('_', 0, false, "", true);
        }
        Matcher matcher = MACRO.matcher(body);
        if (!matcher.matches()) {
            throw new RecordSyntaxException("Invalid macro '%{" + body + "}' in '" + text + "'");
        }
        char letter = matcher.group(1).charAt(0);
        String allowed = explanation ? EXPLANATION_LETTERS : DOMAIN_SPEC_LETTERS;
        if (allowed.indexOf(Character.toLowerCase(letter)) < 0) {
            throw new RecordSyntaxException("Invalid macro letter '" + letter + "' in '" + text + "'");
        }
        int digits = 0;
        if (!matcher.group(2).isEmpty()) {
            digits = Integer.parseInt(matcher.group(2));
            if (digits == 0) {
                throw new RecordSyntaxException("Invalid macro transformer '0' in '" + text + "'");
            }
        }
        return new Macro(letter, digits, !matcher.group(3).isEmpty(), matcher.group(4), false);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof MacroString other)) {
            return false;
        }
        return explanation == other.explanation && text.equals(other.text);
    }

    @Override
    public int hashCode() {
        return text.hashCode() * 31 + (explanation ? 1 : 0);
    }

    @Override
    public String toString() {
        return text;
    }

    private interface Part {
    }

    private record Literal(String value) implements Part {
    }

    private record Macro(char letter, int digits, boolean reverse, String delimiters, boolean scope) implements Part {
    }
}
