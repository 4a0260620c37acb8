package com.structds.cli;

import com.structds.core.filter.DatasetFilter;
import com.structds.core.filter.FilterRegistry;
import com.structds.core.filter.FilterScope;
import picocli.CommandLine.Command;

import java.util.Locale;
import java.util.concurrent.Callable;
import java.util.stream.Collectors;

/**
 * Command to list the available filters.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * structds list
 * }</pre>
 */
@Command(
    name = "list",
    description = "List available filters",
    mixinStandardHelpOptions = true
)
public class ListCommand implements Callable<Integer> {

    @Override
    public Integer call() {
        System.out.println("Available Filters:");
        System.out.println();

        for (DatasetFilter filter : FilterRegistry.defaults().filters()) {
            String scopes = filter.scopes().stream()
                .map(FilterScope::name)
                .map(scope -> scope.toLowerCase(Locale.ROOT))
                .collect(Collectors.joining(", "));
            System.out.printf("  • %s%n", filter.name());
            System.out.printf("    Scope: %s%n", scopes);
            System.out.printf("    %s%n", filter.description());
            System.out.println();
        }
        return ExitCodes.OK;
    }
}
