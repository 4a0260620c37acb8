package com.structds.core.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * A repository at one exact revision together with its modules.
 *
 * @param name package name
 * @param url source URL
 * @param pypiTag release tag
 * @param gitCommitHash revision identifier
 * @param modules modules in discovery order; file paths are unique
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record Repository(
    @JsonProperty("name") String name,
    @JsonProperty("url") String url,
    @JsonProperty("pypi_tag") String pypiTag,
    @JsonProperty("git_commit_hash") String gitCommitHash,
    @JsonProperty("modules") List<SourceModule> modules
) {
    public Repository {
        Objects.requireNonNull(name, "name must not be null");
        modules = modules != null ? List.copyOf(modules) : List.of();

        Set<String> paths = new HashSet<>();
        for (SourceModule module : modules) {
            if (!paths.add(module.filePath())) {
                throw new IllegalArgumentException(
                    "Duplicate module path in repository " + name + ": " + module.filePath());
            }
        }
    }

    /**
     * Creates a repository from its identity.
     *
     * @param identity repository identity
     * @param modules assembled modules
     * @return new repository
     */
    public static Repository of(RepositoryIdentity identity, List<SourceModule> modules) {
        return new Repository(identity.name(), identity.url(), identity.tag(), identity.revision(), modules);
    }

    /**
     * Returns the identity part of this repository.
     *
     * @return identity without modules
     */
    public RepositoryIdentity identity() {
        return new RepositoryIdentity(name, url, pypiTag, gitCommitHash);
    }

    /**
     * Returns a copy of this repository holding the given modules.
     *
     * @param retained modules to keep
     * @return this instance if the list is unchanged, a new repository otherwise
     */
    public Repository withModules(List<SourceModule> retained) {
        if (retained.equals(modules)) {
            return this;
        }
        return new Repository(name, url, pypiTag, gitCommitHash, retained);
    }
}
