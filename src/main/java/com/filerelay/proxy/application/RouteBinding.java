package com.filerelay.proxy.application;

import com.filerelay.proxy.infrastructure.http.HttpClientGateway;
import com.filerelay.proxy.queue.FolderQueue;

/**
 * Everything attached to one route: its backend, its folders and the way to reach the backend.
 */
public record RouteBinding(String name, String backend, FolderQueue queue, HttpClientGateway gateway) {

    public String targetUrl(String path, String queryString) {
        String base = backend.endsWith("/") ? backend.substring(0, backend.length() - 1) : backend;
        String url = base + "/" + (path == null ? "" : path);
        return queryString == null || queryString.isEmpty() ? url : url + "?" + queryString;
    }
}
