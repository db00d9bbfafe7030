package fr.lapetina.mesh.infrastructure.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.Constructor;
import org.yaml.snakeyaml.error.YAMLException;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.FileSystems;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardWatchEventKinds;
import java.nio.file.WatchEvent;
import java.nio.file.WatchKey;
import java.nio.file.WatchService;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Loads {@link MeshGatewayConfig} from YAML and reloads it when the file changes.
 *
 * <p>The file system is tried first, then the classpath. Every loaded document
 * is validated before it replaces the current one; a reload that fails parsing
 * or validation is logged and the previous configuration stays in effect.
 */
public final class ConfigLoader implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(ConfigLoader.class);

    private final AtomicReference<MeshGatewayConfig> currentConfig = new AtomicReference<>();
    private final List<ConfigChangeListener> listeners = new CopyOnWriteArrayList<>();
    private final Path configPath;

    private WatchService watchService;
    private ScheduledExecutorService watchExecutor;
    private volatile long lastModified;

    public ConfigLoader(String configPath) {
        this.configPath = Paths.get(configPath);
    }

    /**
     * Loads, validates and publishes the configuration.
     *
     * @throws ConfigurationException if the document cannot be found, parsed or validated
     */
    public MeshGatewayConfig load() {
        MeshGatewayConfig config = validate(loadFromPath());
        publish(config);
        return config;
    }

    /**
     * Loads configuration from an input stream.
     */
    public MeshGatewayConfig loadFromStream(InputStream inputStream) {
        MeshGatewayConfig config = validate(parse(inputStream, "stream"));
        publish(config);
        return config;
    }

    private MeshGatewayConfig loadFromPath() {
        if (Files.exists(configPath)) {
            return loadFromFile(configPath);
        }

        String classpathResource = configPath.toString().replace('\\', '/');
        if (classpathResource.startsWith("/")) {
            classpathResource = classpathResource.substring(1);
        }

        try (InputStream is = getClass().getClassLoader().getResourceAsStream(classpathResource)) {
            if (is != null) {
                log.info("Loading configuration from classpath: resource={}", classpathResource);
                return parse(is, classpathResource);
            }
        } catch (IOException e) {
            throw new ConfigurationException("Failed to load from classpath: " + classpathResource, e);
        }

        throw new ConfigurationException("Configuration file not found: " + configPath);
    }

    private MeshGatewayConfig loadFromFile(Path path) {
        log.info("Loading configuration from file: path={}", path);
        try (InputStream is = Files.newInputStream(path)) {
            lastModified = Files.getLastModifiedTime(path).toMillis();
            return parse(is, path.toString());
        } catch (IOException e) {
            throw new ConfigurationException("Failed to load configuration from: " + path, e);
        }
    }

    private static MeshGatewayConfig parse(InputStream is, String source) {
        Yaml yaml = new Yaml(new Constructor(MeshGatewayConfig.class, new LoaderOptions()));
        try {
            MeshGatewayConfig config = yaml.load(is);
            if (config == null) {
                throw new ConfigurationException("Configuration document is empty: " + source);
            }
            return config;
        } catch (YAMLException e) {
            throw new ConfigurationException("Malformed configuration in " + source + ": " + e.getMessage(), e);
        }
    }

    /**
     * Checks the values a running mesh cannot recover from.
     */
    static MeshGatewayConfig validate(MeshGatewayConfig config) {
        MeshGatewayConfig.ServerConfig server = config.getServer();
        if (server == null || server.getPort() < 0 || server.getPort() > 65535) {
            throw new ConfigurationException("server.port must be between 0 and 65535");
        }
        if (server.getWorkerThreads() < 1) {
            throw new ConfigurationException("server.workerThreads must be at least 1");
        }
        MeshGatewayConfig.GatewayConfig gateway = config.getGateway();
        if (gateway == null || Integer.bitCount(gateway.getRingBufferSize()) != 1) {
            throw new ConfigurationException("gateway.ringBufferSize must be a power of 2");
        }
        if (config.getRegistry() == null || config.getRegistry().getUnhealthyThreshold() < 1) {
            throw new ConfigurationException("registry.unhealthyThreshold must be at least 1");
        }
        config.getRegistry().resolveDefaultStrategy();

        String secret = config.getAuth() == null ? null : config.getAuth().getSigningSecret();
        if (secret != null && !secret.isBlank() && secret.length() < 32) {
            throw new ConfigurationException("auth.signingSecret must be at least 32 characters");
        }

        Set<String> routeKeys = new HashSet<>();
        for (MeshGatewayConfig.RouteConfig route : gateway.getRoutes()) {
            if (route.getPath() == null || !route.getPath().startsWith("/")) {
                throw new ConfigurationException("gateway route path must start with '/': " + route.getPath());
            }
            String method = route.getMethod() == null ? "GET" : route.getMethod().toUpperCase(Locale.ROOT);
            if (!routeKeys.add(method + ":" + route.getPath())) {
                throw new ConfigurationException("Duplicate gateway route: " + method + ":" + route.getPath());
            }
        }
        return config;
    }

    private void publish(MeshGatewayConfig config) {
        MeshGatewayConfig previous = currentConfig.getAndSet(config);
        notifyListeners(previous, config);
    }

    public MeshGatewayConfig getCurrentConfig() {
        return currentConfig.get();
    }

    /**
     * Starts watching the configuration file for changes. Classpath configurations are not watched.
     */
    public void startWatching() {
        if (!Files.exists(configPath)) {
            log.warn("Config file does not exist, hot reload disabled: path={}", configPath);
            return;
        }

        try {
            watchService = FileSystems.getDefault().newWatchService();
            Path parent = configPath.toAbsolutePath().getParent();
            if (parent == null) {
                parent = Paths.get(".");
            }
            parent.register(watchService, StandardWatchEventKinds.ENTRY_MODIFY, StandardWatchEventKinds.ENTRY_CREATE);

            watchExecutor = Executors.newSingleThreadScheduledExecutor(r -> {
                Thread t = new Thread(r, "config-watcher");
                t.setDaemon(true);
                return t;
            });
            watchExecutor.scheduleWithFixedDelay(this::checkForChanges, 1, 1, TimeUnit.SECONDS);

            log.info("Configuration hot-reload enabled: path={}", configPath);
        } catch (IOException e) {
            log.error("Failed to start config watcher: path={}", configPath, e);
        }
    }

    private void checkForChanges() {
        try {
            WatchKey key = watchService.poll();
            if (key == null) {
                return;
            }

            boolean relevant = false;
            for (WatchEvent<?> event : key.pollEvents()) {
                Object context = event.context();
                if (context instanceof Path && configPath.getFileName().equals(context)) {
                    relevant = true;
                }
            }
            key.reset();

            // Editors often fire several events per save
            if (relevant) {
                long newLastModified = Files.getLastModifiedTime(configPath).toMillis();
                if (newLastModified > lastModified) {
                    log.info("Configuration file changed, reloading: path={}", configPath);
                    reload();
                }
            }
        } catch (Exception e) {
            log.error("Error checking for config changes", e);
        }
    }

    /**
     * Forces a configuration reload, keeping the current configuration on failure.
     */
    public MeshGatewayConfig reload() {
        try {
            return load();
        } catch (RuntimeException e) {
            log.error("Failed to reload configuration, keeping current: reason={}", e.getMessage(), e);
            return currentConfig.get();
        }
    }

    public void addListener(ConfigChangeListener listener) {
        listeners.add(listener);
    }

    public void removeListener(ConfigChangeListener listener) {
        listeners.remove(listener);
    }

    private void notifyListeners(MeshGatewayConfig oldConfig, MeshGatewayConfig newConfig) {
        for (ConfigChangeListener listener : listeners) {
            try {
                listener.onConfigChanged(oldConfig, newConfig);
            } catch (Exception e) {
                log.error("Error notifying config change listener", e);
            }
        }
    }

    @Override
    public void close() {
        if (watchExecutor != null) {
            watchExecutor.shutdown();
            try {
                watchExecutor.awaitTermination(5, TimeUnit.SECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }
        if (watchService != null) {
            try {
                watchService.close();
            } catch (IOException e) {
                log.warn("Error closing watch service", e);
            }
        }
    }

    /**
     * Configuration could not be found, parsed or validated.
     */
    public static class ConfigurationException extends RuntimeException {
        public ConfigurationException(String message) {
            super(message);
        }

        public ConfigurationException(String message, Throwable cause) {
            super(message, cause);
        }
    }
}
