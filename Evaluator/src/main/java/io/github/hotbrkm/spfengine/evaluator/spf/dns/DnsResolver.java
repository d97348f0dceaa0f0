package io.github.hotbrkm.spfengine.evaluator.spf.dns;

import lombok.extern.slf4j.Slf4j;
import org.xbill.DNS.DClass;
import org.xbill.DNS.ExtendedResolver;
import org.xbill.DNS.Message;
import org.xbill.DNS.Name;
import org.xbill.DNS.Rcode;
import org.xbill.DNS.Record;
import org.xbill.DNS.Resolver;
import org.xbill.DNS.SPFRecord;
import org.xbill.DNS.Section;
import org.xbill.DNS.TXTRecord;
import org.xbill.DNS.TextParseException;
import org.xbill.DNS.Type;

import java.io.IOException;
import java.net.SocketTimeoutException;
import java.net.UnknownHostException;
import java.time.Duration;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * Issues single DNS queries through a dnsjava {@link Resolver} and classifies the outcome.
 * <p>
 * The resolver never throws: timeouts, missing answers and error RCODEs are reported through
 * {@link QueryStatus} so that callers decide how each one maps onto the SPF result taxonomy.
 * NXDOMAIN is reported as {@link QueryStatus#NOT_FOUND}, a valid but empty answer.
 */
@Slf4j
public class DnsResolver {

    private final Resolver resolver;

    /**
     * Creates a resolver backed by the name servers of the system configuration.
     */
    public DnsResolver() {
        this(new ExtendedResolver());
    }

    public DnsResolver(Resolver resolver) {
        this.resolver = Objects.requireNonNull(resolver, "resolver must not be null");
    }

    /**
     * Creates a resolver for an explicit list of name servers.
     *
     * @param servers name server hosts; an empty or null list selects the system configuration
     * @param timeout per-query timeout, or null to keep the dnsjava default
     * @return the configured resolver
     * @throws IllegalArgumentException if the list only holds blank entries or an entry cannot be resolved
     */
    public static DnsResolver forServers(List<String> servers, Duration timeout) {
        List<String> sanitizedServers = servers == null ? List.of() : servers.stream()
                .filter(Objects::nonNull)
                .map(String::trim)
                .filter(s -> !s.isBlank())
                .toList();
        if (servers != null && !servers.isEmpty() && sanitizedServers.isEmpty()) {
            throw new IllegalArgumentException("dns servers must contain at least one valid DNS server");
        }

        ExtendedResolver resolver;
        if (sanitizedServers.isEmpty()) {
            resolver = new ExtendedResolver();
        } else {
            try {
                resolver = new ExtendedResolver(sanitizedServers.toArray(new String[0]));
            } catch (UnknownHostException e) {
                throw new IllegalArgumentException("Invalid DNS server host in " + sanitizedServers, e);
            }
        }

        if (timeout != null && !timeout.isZero() && !timeout.isNegative()) {
            resolver.setTimeout(timeout);
        }
        log.debug("DNS resolver configured: servers={}, timeout={}",
                sanitizedServers.isEmpty() ? "system" : sanitizedServers, timeout);
        return new DnsResolver(resolver);
    }

    /**
     * Sends one query for {@code name} and {@code type} (a dnsjava {@link Type} code).
     *
     * @param name fully qualified or relative-to-root domain name
     * @param type resource record type
     * @return the classified outcome, never null
     */
    public QueryResult query(String name, int type) {
        Message request;
        try {
            Record question = Record.newRecord(Name.fromString(name, Name.root), type, DClass.IN);
            request = Message.newQuery(question);
        } catch (TextParseException e) {
            log.debug("DNS query name is not valid: name={}, type={}, message={}", name, Type.string(type), e.getMessage());
            return new QueryResult(QueryStatus.NOT_FOUND, Collections.emptyList(), e.getMessage());
        }

        try {
            Message response = resolver.send(request);
            if (response == null) {
                return new QueryResult(QueryStatus.NO_RESPONSE, Collections.emptyList(), null);
            }
            List<Record> answers = response.getSection(Section.ANSWER);
            int rcode = response.getRcode();
            return switch (rcode) {
                case Rcode.NOERROR -> new QueryResult(QueryStatus.SUCCESS, answers, Rcode.string(rcode));
                case Rcode.NXDOMAIN -> new QueryResult(QueryStatus.NOT_FOUND, answers, Rcode.string(rcode));
                default -> new QueryResult(QueryStatus.SERVER_ERROR, Collections.emptyList(), Rcode.string(rcode));
            };
        } catch (IOException e) {
            if (isTimeout(e)) {
                log.debug("DNS query timed out: name={}, type={}", name, Type.string(type));
                return new QueryResult(QueryStatus.TIMEOUT, Collections.emptyList(), e.getMessage());
            }
            log.debug("DNS query failed: name={}, type={}, message={}", name, Type.string(type), e.getMessage());
            return new QueryResult(QueryStatus.NO_RESPONSE, Collections.emptyList(), e.getMessage());
        }
    }

    private static boolean isTimeout(Throwable error) {
        for (Throwable current = error; current != null; current = current.getCause()) {
            if (current instanceof SocketTimeoutException) {
                return true;
            }
            String message = current.getMessage();
            if (message != null && message.toLowerCase(Locale.ROOT).contains("timed out")) {
                return true;
            }
        }
        return false;
    }

    public enum QueryStatus {
        /** RCODE NOERROR. */
        SUCCESS,
        /** RCODE NXDOMAIN, or a name that cannot be queried. */
        NOT_FOUND,
        /** Any other RCODE; {@link QueryResult#detail()} holds its mnemonic. */
        SERVER_ERROR,
        TIMEOUT,
        /** No answer message was received. */
        NO_RESPONSE
    }

    public record QueryResult(QueryStatus status, List<Record> answers, String detail) {

        public QueryResult {
            answers = answers == null ? List.of() : List.copyOf(answers);
        }

        /**
         * Returns the answer records of the given type, skipping CNAMEs and other chaff.
         */
        public List<Record> answers(int type) {
            return answers.stream()
                    .filter(record -> record.getType() == type)
                    .toList();
        }

        /**
         * Returns the TXT or SPF answers of the given type, each with its character-strings concatenated.
         */
        public List<String> texts(int type) {
            return answers(type).stream()
                    .map(QueryResult::text)
                    .filter(Objects::nonNull)
                    .toList();
        }

        private static String text(Record record) {
            if (record instanceof TXTRecord txt) {
                return String.join("", txt.getStrings());
            }
            if (record instanceof SPFRecord spf) {
                return String.join("", spf.getStrings());
            }
            return null;
        }
    }
}
