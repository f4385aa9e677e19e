package in.spreadarb.infrastructure.strategy;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import in.spreadarb.application.port.output.StrategyStore;
import in.spreadarb.domain.strategy.TradingStrategy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;

/**
 * Read-only strategy store backed by *.json files in a directory.
 *
 * The bundled default strategy (classpath strategies/default.json) is always available,
 * so the engine can start without any strategy files on disk.
 * Files that fail to parse or validate are skipped with a warning.
 */
public final class FileStrategyStore implements StrategyStore {
    private static final Logger log = LoggerFactory.getLogger(FileStrategyStore.class);
    private static final ObjectMapper MAPPER = new ObjectMapper()
        .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

    static final String BUNDLED_DEFAULT = "/strategies/default.json";

    private final Path directory;

    public FileStrategyStore(Path directory) {
        this.directory = directory;
    }

    @Override
    public Optional<TradingStrategy> find(String strategyId) {
        return findAll().stream()
            .filter(s -> s.id().equals(strategyId))
            .max(Comparator.comparingInt(TradingStrategy::version));
    }

    @Override
    public List<TradingStrategy> findAll() {
        List<TradingStrategy> strategies = new ArrayList<>();
        loadBundledDefault().ifPresent(strategies::add);

        if (directory == null || !Files.isDirectory(directory)) {
            return strategies;
        }
        try (DirectoryStream<Path> files = Files.newDirectoryStream(directory, "*.json")) {
            for (Path file : files) {
                read(file).ifPresent(strategies::add);
            }
        } catch (IOException e) {
            log.error("Failed to list strategy directory {}: {}", directory, e.getMessage());
        }
        return strategies;
    }

    private Optional<TradingStrategy> read(Path file) {
        try {
            TradingStrategy strategy = MAPPER.readValue(Files.readString(file), TradingStrategy.class);
            if (!strategy.isValid()) {
                log.warn("⚠️ Skipping invalid strategy file: {}", file);
                return Optional.empty();
            }
            log.debug("Loaded strategy {} v{} from {}", strategy.id(), strategy.version(), file);
            return Optional.of(strategy);
        } catch (IOException e) {
            log.warn("⚠️ Skipping unreadable strategy file {}: {}", file, e.getMessage());
            return Optional.empty();
        }
    }

    private Optional<TradingStrategy> loadBundledDefault() {
        try (InputStream in = FileStrategyStore.class.getResourceAsStream(BUNDLED_DEFAULT)) {
            if (in == null) {
                return Optional.of(TradingStrategy.defaults());
            }
            TradingStrategy strategy = MAPPER.readValue(in, TradingStrategy.class);
            return strategy.isValid() ? Optional.of(strategy) : Optional.of(TradingStrategy.defaults());
        } catch (IOException e) {
            log.warn("⚠️ Bundled default strategy unreadable, using built-in defaults: {}", e.getMessage());
            return Optional.of(TradingStrategy.defaults());
        }
    }
}
