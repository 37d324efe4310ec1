package com.quorum.tools;

import com.quorum.core.store.StoreKind;
import com.quorum.core.update.PemKeys;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.security.GeneralSecurityException;
import java.security.PrivateKey;
import java.util.Arrays;

/**
 * Command-line entry point for the authoring workstation.
 *
 * <h3>Commands</h3>
 *
 * <pre>
 *   keygen &lt;directory&gt;
 *     writes quorum-signing.key.pem / quorum-signing.pub.pem
 *
 *   build &lt;packageVersion&gt; &lt;outFile&gt; &lt;kind&gt;[:&lt;storeVersion&gt;]=&lt;payloadFile&gt; ...
 *     kind is indicator, rule, pattern or anomaly-model; storeVersion
 *     defaults to the package version
 * </pre>
 *
 * <h3>Configuration</h3>
 * <p>
 * Resolved from environment variables via {@link ToolConfig}; {@code build}
 * requires {@value ToolConfig#ENV_SIGNING_KEY}.
 * </p>
 *
 * @since 1.0.0
 */
public final class PackageToolMain {

    private static final Logger LOG = LoggerFactory.getLogger(PackageToolMain.class);

    static final int EXIT_OK = 0;
    static final int EXIT_FAILURE = 1;
    static final int EXIT_USAGE = 2;

    static final String USAGE = String.join(System.lineSeparator(),
            "usage:",
            "  keygen <directory>",
            "  build <packageVersion> <outFile> <kind>[:<storeVersion>]=<payloadFile> ...");

    private PackageToolMain() {
        // entry-point class, not instantiable
    }

    public static void main(String[] args) {
        int code = run(args, ToolConfig.fromEnvironment());
        if (code != EXIT_OK) {
            System.exit(code);
        }
    }

    /**
     * @param args   command line
     * @param config tool configuration
     * @return process exit code
     */
    static int run(String[] args, ToolConfig config) {
        if (args.length == 0) {
            System.err.println(USAGE);
            return EXIT_USAGE;
        }
        LOG.debug("Running '{}' with {}", args[0], config);
        try {
            return switch (args[0]) {
                case "keygen" -> keygen(Arrays.copyOfRange(args, 1, args.length), config);
                case "build" -> build(Arrays.copyOfRange(args, 1, args.length), config);
                default -> {
                    System.err.println("Unknown command: " + args[0]);
                    System.err.println(USAGE);
                    yield EXIT_USAGE;
                }
            };
        } catch (IllegalArgumentException e) {
            System.err.println(e.getMessage());
            System.err.println(USAGE);
            return EXIT_USAGE;
        } catch (IOException | GeneralSecurityException | IllegalStateException e) {
            LOG.error("'{}' failed: {}", args[0], e.getMessage(), e);
            return EXIT_FAILURE;
        }
    }

    // ---------------------------------------------------------------
    // Commands
    // ---------------------------------------------------------------

    private static int keygen(String[] args, ToolConfig config) throws IOException, GeneralSecurityException {
        if (args.length != 1) {
            throw new IllegalArgumentException("keygen takes exactly one directory");
        }
        Path publicKey = SigningKeyGenerator.writeKeyPair(Path.of(args[0]), config.getKeySize());
        System.out.println("Provision " + publicKey + " onto appliances; keep the private key offline.");
        return EXIT_OK;
    }

    private static int build(String[] args, ToolConfig config) throws IOException, GeneralSecurityException {
        if (args.length < 3) {
            throw new IllegalArgumentException("build needs a version, an output file and at least one payload");
        }
        if (!config.hasSigningKey()) {
            throw new IllegalStateException(ToolConfig.ENV_SIGNING_KEY + " must point to the PEM private key");
        }

        String packageVersion = args[0];
        Path outFile = Path.of(args[1]);
        UpdatePackageBuilder builder = new UpdatePackageBuilder(packageVersion)
                .maxPackageBytes(config.getMaxPackageBytes());
        for (int i = 2; i < args.length; i++) {
            PayloadArg payload = PayloadArg.parse(args[i], packageVersion);
            builder.payloadFile(payload.kind, payload.storeVersion, payload.file);
        }

        PrivateKey key = PemKeys.readPrivateKey(Path.of(config.getSigningKeyPath()));
        Path written = builder.writeTo(outFile, key);
        System.out.println("Wrote " + written);
        return EXIT_OK;
    }

    /** One {@code <kind>[:<storeVersion>]=<payloadFile>} argument. */
    static final class PayloadArg {
        final StoreKind kind;
        final String storeVersion;
        final Path file;

        private PayloadArg(StoreKind kind, String storeVersion, Path file) {
            this.kind = kind;
            this.storeVersion = storeVersion;
            this.file = file;
        }

        static PayloadArg parse(String arg, String defaultVersion) {
            int eq = arg.indexOf('=');
            if (eq <= 0 || eq == arg.length() - 1) {
                throw new IllegalArgumentException("Payload must look like <kind>[:<version>]=<file>, got: " + arg);
            }
            String spec = arg.substring(0, eq);
            String version = defaultVersion;
            int colon = spec.indexOf(':');
            if (colon >= 0) {
                version = spec.substring(colon + 1);
                spec = spec.substring(0, colon);
                if (version.isBlank()) {
                    throw new IllegalArgumentException("Empty store version in: " + arg);
                }
            }
            return new PayloadArg(StoreKind.fromWireName(spec), version, Path.of(arg.substring(eq + 1)));
        }
    }
}
