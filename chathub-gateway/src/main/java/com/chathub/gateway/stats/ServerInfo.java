package com.chathub.gateway.stats;

/**
 * Static description of the running server process.
 */
public record ServerInfo(String version, String javaVersion, String os, int cpuCores) {

    public static final String DEFAULT_VERSION = "0.1.0";

    public static ServerInfo current() {
        String version = ServerInfo.class.getPackage().getImplementationVersion();
        return new ServerInfo(
                version != null ? version : DEFAULT_VERSION,
                System.getProperty("java.version", "unknown"),
                System.getProperty("os.name", "unknown").toLowerCase(),
                Runtime.getRuntime().availableProcessors());
    }
}
