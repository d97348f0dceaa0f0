package io.github.hotbrkm.spfengine.evaluator.runner;

import io.github.hotbrkm.spfengine.evaluator.spf.Scope;
import io.github.hotbrkm.spfengine.evaluator.spf.SpfRequest;
import io.github.hotbrkm.spfengine.evaluator.spf.SpfServer;
import io.github.hotbrkm.spfengine.evaluator.spf.result.SpfResult;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.stereotype.Component;
import org.xbill.DNS.Address;

import java.net.InetAddress;
import java.net.UnknownHostException;
import java.util.List;

/**
 * Evaluates one request given on the command line and logs the verdict.
 *
 * <pre>
 * java -jar evaluator.jar --identity=user@example.com --ip-address=192.0.2.1 [--scope=mfrom] [--helo-identity=mx.example.com]
 * </pre>
 *
 * Does nothing when {@code --identity} is absent, so the application can also start without a query.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class SpfQueryRunner implements ApplicationRunner {

    static final String OPTION_IDENTITY = "identity";
    static final String OPTION_IP_ADDRESS = "ip-address";
    static final String OPTION_SCOPE = "scope";
    static final String OPTION_HELO_IDENTITY = "helo-identity";

    private final SpfServer spfServer;

    @Override
    public void run(ApplicationArguments args) {
        SpfResult result = query(args);
        if (result != null) {
            log.info("{}", result.receivedSpfHeader());
            if (result.authorityExplanation() != null) {
                log.info("Explanation: {}", result.authorityExplanation());
            }
        }
    }

    /**
     * Builds the request from the options and evaluates it.
     *
     * @return the verdict, or null when no identity was given
     * @throws IllegalArgumentException on a missing or invalid IP address or an unknown scope
     */
    public SpfResult query(ApplicationArguments args) {
        String identity = optionValue(args, OPTION_IDENTITY);
        if (identity == null) {
            log.debug("No --{} option given, skipping SPF query", OPTION_IDENTITY);
            return null;
        }

        String ipAddress = optionValue(args, OPTION_IP_ADDRESS);
        if (ipAddress == null) {
            throw new IllegalArgumentException("--" + OPTION_IP_ADDRESS + " is required");
        }
        String scope = optionValue(args, OPTION_SCOPE);

        SpfRequest request = SpfRequest.builder()
                .scope(scope == null ? Scope.MFROM : Scope.byName(scope))
                .identity(identity)
                .ipAddress(parseAddress(ipAddress))
                .heloIdentity(optionValue(args, OPTION_HELO_IDENTITY))
                .build();

        SpfResult result = spfServer.process(request);
        log.debug("SPF query finished: request={}, result={}", request, result);
        return result;
    }

    private static InetAddress parseAddress(String value) {
        try {
            return Address.getByAddress(value);
        } catch (UnknownHostException e) {
            throw new IllegalArgumentException("Invalid IP address: " + value, e);
        }
    }

    private static String optionValue(ApplicationArguments args, String name) {
        List<String> values = args.getOptionValues(name);
        if (values == null || values.isEmpty() || values.get(0).isBlank()) {
            return null;
        }
        return values.get(0).trim();
    }
}
