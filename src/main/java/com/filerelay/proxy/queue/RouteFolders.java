package com.filerelay.proxy.queue;

import java.nio.file.Path;

/**
 * The three directories backing one route: {@code <base>/<route>/{drafts,inbox,sent}}.
 */
public record RouteFolders(Path drafts, Path inbox, Path sent) {

    public static RouteFolders under(Path base, String route) {
        Path root = base.resolve(route);
        return new RouteFolders(root.resolve("drafts"), root.resolve("inbox"), root.resolve("sent"));
    }
}
