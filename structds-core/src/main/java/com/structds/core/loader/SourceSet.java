package com.structds.core.loader;

import java.util.List;

/**
 * Everything the loader found below a repository root.
 *
 * @param units readable source files ordered by relative path
 * @param unreadable files that were found but could not be read
 */
public record SourceSet(List<SourceUnit> units, List<UnreadableSource> unreadable) {
    public SourceSet {
        units = units != null ? List.copyOf(units) : List.of();
        unreadable = unreadable != null ? List.copyOf(unreadable) : List.of();
    }

    /**
     * Gets the number of discovered files, readable or not.
     *
     * @return discovered file count
     */
    public int discovered() {
        return units.size() + unreadable.size();
    }
}
