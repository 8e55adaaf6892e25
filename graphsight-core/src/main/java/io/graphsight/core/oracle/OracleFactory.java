package io.graphsight.core.oracle;

import io.graphsight.core.oracle.spi.OracleProvider;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.ServiceLoader;
import java.util.logging.Logger;

/// Creates vision oracles through the highest-priority provider supporting a model.
///
/// Providers come from the constructor argument plus anything registered under
/// `META-INF/services/io.graphsight.core.oracle.spi.OracleProvider`.
///
/// @implNote Thread-safe after construction.
public class OracleFactory {

    private static final Logger logger = Logger.getLogger(OracleFactory.class.getName());

    private final List<OracleProvider> providers;
    private final Map<String, String> credentials;

    /// Creates a factory over explicit and discovered providers.
    ///
    /// @param credentials API keys and flags, not null
    /// @param explicitProviders providers to use in addition to discovered ones, not null
    public OracleFactory(Map<String, String> credentials, List<OracleProvider> explicitProviders) {
        this.credentials = new HashMap<>(credentials);
        List<OracleProvider> all = new ArrayList<>(explicitProviders);
        for (OracleProvider discovered : ServiceLoader.load(OracleProvider.class)) {
            boolean known =
                    all.stream().anyMatch(p -> p.getClass().equals(discovered.getClass()));
            if (!known) {
                all.add(discovered);
                logger.fine("Discovered oracle provider: " + discovered.getName());
            }
        }
        this.providers = List.copyOf(all);

        logger.info(
                "Loaded "
                        + providers.size()
                        + " oracle providers: "
                        + providers.stream().map(OracleProvider::getName).toList());
    }

    /// Creates an oracle for the configured model.
    ///
    /// @param config model settings, not null
    /// @return the oracle, never null
    /// @throws IllegalStateException if no provider supports the model
    public VisionOracle createOracle(OracleConfig config) {
        String modelName = config.getModel();

        OracleProvider provider =
                providers.stream()
                        .filter(p -> p.supportsModel(modelName))
                        .max(Comparator.comparingInt(OracleProvider::getPriority))
                        .orElseThrow(
                                () ->
                                        new IllegalStateException(
                                                "No oracle provider found for model: "
                                                        + modelName
                                                        + ". Available providers: "
                                                        + providers.stream()
                                                                .map(OracleProvider::getName)
                                                                .toList()));

        logger.info("Creating oracle for model " + modelName + " with provider: " + provider.getName());
        return provider.createOracle(config, credentials);
    }

    public List<OracleProvider> getProviders() {
        return Collections.unmodifiableList(providers);
    }

    public boolean isModelSupported(String modelName) {
        return providers.stream().anyMatch(p -> p.supportsModel(modelName));
    }
}
