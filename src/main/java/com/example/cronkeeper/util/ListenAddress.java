package com.example.cronkeeper.util;

/**
 * {@code host:port} pair of the control plane, as persisted in the config file.
 */
public record ListenAddress(String host, int port) {

    public static ListenAddress parse(String address) {
        if (address == null) {
            throw new IllegalArgumentException("No daemon address configured");
        }
        var separator = address.lastIndexOf(':');
        if (separator <= 0 || separator == address.length() - 1) {
            throw new IllegalArgumentException("Invalid daemon address: " + address);
        }
        try {
            var port = Integer.parseInt(address.substring(separator + 1));
            if (port < 1 || port > 65535) {
                throw new IllegalArgumentException("Invalid daemon port: " + address);
            }
            return new ListenAddress(address.substring(0, separator), port);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid daemon port: " + address, e);
        }
    }

    /**
     * Base URL a client on the same machine uses. A wildcard bind address is
     * reached through loopback.
     */
    public String clientUrl() {
        var target = "0.0.0.0".equals(host) ? "127.0.0.1" : host;
        return "http://" + target + ":" + port;
    }
}
