package io.graphsight.core.oracle.stub;

import io.graphsight.core.oracle.OracleConfig;
import io.graphsight.core.oracle.VisionOracle;
import io.graphsight.core.oracle.spi.OracleProvider;
import java.util.Map;
import java.util.logging.Logger;

/// Oracle provider that answers with {@link StubVisionOracle} instead of a real model.
///
/// ### Enabling Stub Mode
/// Checked in order:
/// - Credentials map: `GRAPHSIGHT_STUB_ENABLED=true` or `graphsight.stub.enabled=true`
/// - System property: `-Dgraphsight.stub.enabled=true`
/// - Environment variable: `GRAPHSIGHT_STUB_ENABLED=true`
///
/// When enabled the provider supports every model with priority 1000; when disabled it
/// supports none with priority -1.
///
/// @implNote Thread-safe and stateless.
public class StubOracleProvider implements OracleProvider {

    private static final Logger logger = Logger.getLogger(StubOracleProvider.class.getName());

    public static final String ENABLED_KEY = "GRAPHSIGHT_STUB_ENABLED";
    public static final String ENABLED_PROPERTY = "graphsight.stub.enabled";

    @Override
    public String getName() {
        return "stub";
    }

    @Override
    public boolean supportsModel(String modelName) {
        return isEnabledGlobally();
    }

    /// Creates a stub oracle.
    ///
    /// @throws IllegalStateException if stub mode is not enabled
    @Override
    public VisionOracle createOracle(OracleConfig config, Map<String, String> credentials) {
        if (!isEnabled(credentials)) {
            throw new IllegalStateException("Stub oracle provider called but stub mode is disabled");
        }
        logger.info("[STUB] Creating stub oracle for model: " + config.getModel());
        return new StubVisionOracle(config.getModel());
    }

    @Override
    public int getPriority() {
        return isEnabledGlobally() ? 1000 : -1;
    }

    private boolean isEnabled(Map<String, String> credentials) {
        if ("true".equalsIgnoreCase(credentials.get(ENABLED_KEY))
                || "true".equalsIgnoreCase(credentials.get(ENABLED_PROPERTY))) {
            return true;
        }
        return isEnabledGlobally();
    }

    private static boolean isEnabledGlobally() {
        return "true".equalsIgnoreCase(System.getProperty(ENABLED_PROPERTY))
                || "true".equalsIgnoreCase(System.getenv(ENABLED_KEY));
    }
}
