package com.msgrelay.app;

import com.msgrelay.core.config.ConfigException;
import com.msgrelay.core.config.RelayConfig;
import com.msgrelay.core.config.RelayConfigLoader;
import lombok.Value;
import lombok.extern.slf4j.Slf4j;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;
import java.util.Map;

/**
 * Entry point. Runs both units by default, or a single one so that the HTTP front and the
 * socket listener can be deployed as separate processes.
 *
 * <pre>
 * java -jar relay-app.jar [all|http|socket] [--config relay.yml]
 * </pre>
 */
@Slf4j
public class RelayMain {

    static final String MODE_ALL = "all";
    static final String USAGE = "Usage: relay [all|http|socket] [--config <file>]";

    public static void main(String[] args) throws Exception {
        System.exit(run(args, System.getenv()));
    }

    static int run(String[] args, Map<String, String> env) throws InterruptedException {
        LaunchOptions options;
        RelayConfig config;
        try {
            options = LaunchOptions.parse(args);
            config = options.getConfigFile() == null
                    ? RelayConfigLoader.loadDefault(env)
                    : RelayConfigLoader.load(options.getConfigFile(), env);
        } catch (IllegalArgumentException e) {
            log.error("{}. {}", e.getMessage(), USAGE);
            return 1;
        } catch (ConfigException e) {
            log.error("Invalid configuration: {}", e.getMessage());
            return 1;
        }

        ProcessSupervisor supervisor = new ProcessSupervisor(createUnits(options.getMode(), config));
        Thread shutdownHook = new Thread(() -> {
            log.info("Shutdown requested, stopping units");
            supervisor.stopAll();
        }, "relay-shutdown");
        Runtime.getRuntime().addShutdownHook(shutdownHook);

        supervisor.runAll();
        try {
            Runtime.getRuntime().removeShutdownHook(shutdownHook);
        } catch (IllegalStateException e) {
            log.debug("JVM already shutting down, hook stays registered");
        }
        return 0;
    }

    static List<RelayUnit> createUnits(String mode, RelayConfig config) {
        return switch (mode) {
            case HttpFrontUnit.NAME -> List.of(new HttpFrontUnit(config));
            case SocketListenerUnit.NAME -> List.of(new SocketListenerUnit(config));
            case MODE_ALL -> List.of(new HttpFrontUnit(config), new SocketListenerUnit(config));
            default -> throw new IllegalArgumentException("Unknown mode '" + mode + "'");
        };
    }

    @Value
    static class LaunchOptions {

        String mode;
        Path configFile;

        static LaunchOptions parse(String[] args) {
            String mode = MODE_ALL;
            Path configFile = null;
            boolean modeSeen = false;
            for (int i = 0; i < args.length; i++) {
                String arg = args[i];
                if ("--config".equals(arg)) {
                    if (i + 1 >= args.length) {
                        throw new IllegalArgumentException("--config requires a file");
                    }
                    configFile = Paths.get(args[++i]);
                } else if (arg.startsWith("--")) {
                    throw new IllegalArgumentException("Unknown option '" + arg + "'");
                } else if (!modeSeen) {
                    mode = arg;
                    modeSeen = true;
                } else {
                    throw new IllegalArgumentException("Unexpected argument '" + arg + "'");
                }
            }
            if (!List.of(MODE_ALL, HttpFrontUnit.NAME, SocketListenerUnit.NAME).contains(mode)) {
                throw new IllegalArgumentException("Unknown mode '" + mode + "'");
            }
            return new LaunchOptions(mode, configFile);
        }
    }
}
