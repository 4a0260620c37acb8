package com.structds.core.model;

import java.util.Objects;

/**
 * Identity of a checked-out repository as supplied by the mining and cloning step.
 *
 * @param name package name (e.g., the PyPI project name)
 * @param url source URL
 * @param tag release tag the revision corresponds to
 * @param revision exact revision identifier (commit hash)
 */
public record RepositoryIdentity(
    String name,
    String url,
    String tag,
    String revision
) {
    public RepositoryIdentity {
        Objects.requireNonNull(name, "name must not be null");
        url = url != null ? url : "";
        tag = tag != null ? tag : "";
        revision = revision != null ? revision : "";
    }
}
