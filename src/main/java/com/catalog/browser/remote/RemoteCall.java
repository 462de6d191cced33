package com.catalog.browser.remote;

/**
 * One blocking call to the remote catalog service.
 *
 * @param <T> the raw model type returned
 */
@FunctionalInterface
public interface RemoteCall<T> {

    T call() throws Exception;
}
