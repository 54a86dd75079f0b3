package com.fluxreader.api;

/**
 * Builds a fresh gateway from credentials. Background workers use this so
 * they never share a client with the caller.
 */
@FunctionalInterface
public interface GatewayFactory {

    EntryGateway create(String serverAddress, String apiToken);
}
