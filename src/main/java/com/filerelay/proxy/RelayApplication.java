package com.filerelay.proxy;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

import java.util.ArrayList;
import java.util.List;

@SpringBootApplication
public class RelayApplication {

    public static void main(String[] args) {
        SpringApplication.run(RelayApplication.class, launchArguments(args));
    }

    /**
     * Maps the short launch flags onto Spring properties; anything else is passed through.
     * <p>
     * {@code --client}/{@code --server} select the profile, {@code -p/--port N} the listener
     * port and {@code --cache-picky} the strict cache policy.
     */
    static String[] launchArguments(String... args) {
        List<String> out = new ArrayList<>();
        String profile = null;
        for (int i = 0; i < args.length; i++) {
            String arg = args[i];
            switch (arg) {
                case "--client", "--server" -> {
                    String requested = arg.substring(2);
                    if (profile != null && !profile.equals(requested)) {
                        throw new IllegalArgumentException("--client and --server are mutually exclusive");
                    }
                    profile = requested;
                }
                case "-p", "--port" -> {
                    if (i + 1 >= args.length) {
                        throw new IllegalArgumentException(arg + " requires a port number");
                    }
                    out.add("--server.port=" + port(args[++i]));
                }
                case "--cache-picky" -> out.add("--relay.cache-policy=strict");
                default -> {
                    if (arg.startsWith("--port=")) {
                        out.add("--server.port=" + port(arg.substring("--port=".length())));
                    } else {
                        out.add(arg);
                    }
                }
            }
        }
        if (profile != null) {
            out.add("--spring.profiles.active=" + profile);
        }
        return out.toArray(String[]::new);
    }

    private static int port(String value) {
        try {
            return Integer.parseInt(value);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("invalid port: " + value, e);
        }
    }
}
