package io.github.hotbrkm.spfengine.evaluator.spf.result;

import io.github.hotbrkm.spfengine.evaluator.spf.SpfRequest;
import io.github.hotbrkm.spfengine.evaluator.spf.SpfServer;
import io.github.hotbrkm.spfengine.evaluator.spf.util.IpAddressUtil;

import java.util.Arrays;
import java.util.Locale;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Verdict of one evaluation.
 * <p>
 * Instances are only created through {@link Code#create(SpfServer, SpfRequest, String)}. A {@code fail}
 * verdict carries the authority explanation: the one retrieved through the record's {@code exp=} modifier
 * if any, the server default otherwise.
 */
public final class SpfResult {

    public enum Code {
        PASS("pass"),
        FAIL("fail"),
        SOFTFAIL("softfail"),
        NEUTRAL("neutral"),
        NONE("none"),
        TEMPERROR("temperror"),
        PERMERROR("permerror");

        private static final Map<String, Code> BY_NAME = Arrays.stream(values())
                .collect(Collectors.toUnmodifiableMap(Code::getName, Function.identity()));

        private final String name;

        Code(String name) {
            this.name = name;
        }

        public String getName() {
            return name;
        }

        /**
         * Resolves a verdict by its lower-case name.
         *
         * @throws IllegalArgumentException for anything outside the seven verdicts
         */
        public static Code byName(String name) {
            Code code = name == null ? null : BY_NAME.get(name.toLowerCase(Locale.ROOT));
            if (code == null) {
                throw new IllegalArgumentException("Unknown SPF result: " + name);
            }
            return code;
        }

        public SpfResult create(SpfServer server, SpfRequest request, String text) {
            String authorityExplanation = null;
            if (this == FAIL) {
                authorityExplanation = request.getAuthorityExplanation() != null
                        ? request.getAuthorityExplanation()
                        : server.defaultAuthorityExplanation(request);
            }
            return new SpfResult(this, request, text, authorityExplanation, server.getHostname());
        }
    }

    private final Code code;
    private final SpfRequest request;
    private final String text;
    private final String authorityExplanation;
    private final String receiver;

    private SpfResult(Code code, SpfRequest request, String text, String authorityExplanation, String receiver) {
        this.code = code;
        this.request = request;
        this.text = text;
        this.authorityExplanation = authorityExplanation;
        this.receiver = receiver;
    }

    public Code code() {
        return code;
    }

    public SpfRequest request() {
        return request;
    }

    public String text() {
        return text;
    }

    /**
     * Explanation published by the sender's domain, only present on {@code fail}.
     */
    public String authorityExplanation() {
        return authorityExplanation;
    }

    /**
     * Explanation meant for the receiver's logs, prefixed with the domain whose policy produced it.
     */
    public String localExplanation() {
        String explanation = text == null || text.isBlank() ? comment() : text;
        return request.getAuthorityDomain() + ": " + explanation;
    }

    /**
     * Builds a {@code Received-SPF} header field (RFC 7208, 9.1), without a trailing line break.
     */
    public String receivedSpfHeader() {
        SpfRequest root = request.getRootRequest();
        StringBuilder header = new StringBuilder("Received-SPF: ")
                .append(code.getName())
                .append(" (")
                .append(receiver)
                .append(": ")
                .append(comment())
                .append(") client-ip=")
                .append(IpAddressUtil.toReadableForm(root.getIpAddress()))
                .append("; envelope-from=\"")
                .append(root.getSender())
                .append('"');
        if (root.getHeloIdentity() != null) {
            header.append("; helo=").append(root.getHeloIdentity());
        }
        header.append("; identity=").append(root.getScope().receivedSpfIdentity())
                .append("; receiver=").append(receiver)
                .append(';');
        return header.toString();
    }

    private String comment() {
        SpfRequest root = request.getRootRequest();
        String identity = root.getIdentity();
        String ip = IpAddressUtil.toReadableForm(root.getIpAddress());
        return switch (code) {
            case PASS -> "domain of " + identity + " designates " + ip + " as permitted sender";
            case FAIL -> "domain of " + identity + " does not designate " + ip + " as permitted sender";
            case SOFTFAIL -> "transitioning domain of " + identity + " does not designate " + ip + " as permitted sender";
            case NEUTRAL -> ip + " is neither permitted nor denied by domain of " + identity;
            case NONE -> "domain of " + identity + " does not provide an SPF record";
            case TEMPERROR -> "error in processing during lookup of " + identity + ": " + text;
            case PERMERROR -> "permanent error in processing domain of " + identity + ": " + text;
        };
    }

    @Override
    public String toString() {
        return code.getName() + " (" + text + ")";
    }
}
