package com.structds.core.filter;

import com.structds.core.filter.ScopedFilter.ClassFilter;
import com.structds.core.filter.ScopedFilter.FunctionFilter;
import com.structds.core.filter.ScopedFilter.ModuleFilter;
import com.structds.core.filter.ScopedFilter.RepositoryFilter;
import com.structds.core.model.SourceModule;

import java.util.List;
import java.util.Locale;

/**
 * Filters shipped with the dataset builder.
 *
 * <table>
 *   <caption>Built-in filters</caption>
 *   <tr><th>Name</th><th>Scope</th><th>Removes</th></tr>
 *   <tr><td>PrivateModuleFilter</td><td>module</td><td>modules with an underscore-prefixed name part</td></tr>
 *   <tr><td>TestModuleFilter</td><td>module</td><td>test modules and fixtures</td></tr>
 *   <tr><td>NonCoreModuleFilter</td><td>module</td><td>modules outside the package directory</td></tr>
 *   <tr><td>NoStringTypeFilter</td><td>function</td><td>callables without any declared type</td></tr>
 *   <tr><td>StrTypeFilter</td><td>function</td><td>callables without a {@code str} parameter or return</td></tr>
 *   <tr><td>EmptyFilter</td><td>repository, module, class</td><td>containers left without children</td></tr>
 * </table>
 */
public final class BuiltinFilters {

    public static final DatasetFilter PRIVATE_MODULE = DatasetFilter.of(
        "PrivateModuleFilter",
        "Removes modules whose dotted name has a part starting with '_' (dunder names excepted)",
        new ModuleFilter((module, context) -> !isPrivate(module))
    );

    public static final DatasetFilter TEST_MODULE = DatasetFilter.of(
        "TestModuleFilter",
        "Removes test modules: test*.py, *_test.py, conftest.py and anything under test/ or tests/",
        new ModuleFilter((module, context) -> !isTest(module))
    );

    public static final DatasetFilter NON_CORE_MODULE = DatasetFilter.of(
        "NonCoreModuleFilter",
        "Keeps only modules under <package>/ or src/<package>/, <package> derived from the repository name",
        new ModuleFilter((module, context) -> isCore(module, context.repository().name()))
    );

    public static final DatasetFilter NO_STRING_TYPE = DatasetFilter.of(
        "NoStringTypeFilter",
        "Keeps only functions and methods with at least one declared parameter or return type",
        new FunctionFilter((callable, context) -> callable.hasTypeInformation())
    );

    public static final DatasetFilter STR_TYPE = DatasetFilter.of(
        "StrTypeFilter",
        "Keeps only functions and methods with a parameter or return type of exactly str",
        new FunctionFilter((callable, context) -> callable.hasStrType())
    );

    public static final DatasetFilter EMPTY = DatasetFilter.of(
        "EmptyFilter",
        "Removes classes without methods, modules without functions and classes, repositories without modules",
        new RepositoryFilter((repository, context) -> !repository.modules().isEmpty()),
        new ModuleFilter((module, context) -> !module.hasNoDeclarations()),
        new ClassFilter((type, context) -> !type.methods().isEmpty())
    );

    private BuiltinFilters() {
        // Utility class
    }

    /**
     * Gets every built-in filter in listing order.
     *
     * @return built-in filters
     */
    public static List<DatasetFilter> all() {
        return List.of(PRIVATE_MODULE, TEST_MODULE, NON_CORE_MODULE, NO_STRING_TYPE, STR_TYPE, EMPTY);
    }

    static boolean isPrivate(SourceModule module) {
        for (String part : module.name().split("\\.")) {
            if (part.startsWith("_") && !isDunder(part)) {
                return true;
            }
        }
        return false;
    }

    private static boolean isDunder(String name) {
        return name.length() > 4 && name.startsWith("__") && name.endsWith("__");
    }

    static boolean isTest(SourceModule module) {
        String[] parts = module.filePath().split("/");
        String fileName = parts[parts.length - 1];
        if (fileName.startsWith("test") || fileName.endsWith("_test.py") || fileName.equals("conftest.py")) {
            return true;
        }
        for (int i = 0; i < parts.length - 1; i++) {
            if (parts[i].equals("test") || parts[i].equals("tests")) {
                return true;
            }
        }
        return false;
    }

    static boolean isCore(SourceModule module, String repositoryName) {
        String packageName = packageName(repositoryName);
        String path = module.filePath();
        return path.startsWith(packageName + "/") || path.startsWith("src/" + packageName + "/");
    }

    /**
     * Derives the import name of a distribution, e.g. {@code Flask-Login} gives {@code flask_login}.
     *
     * @param repositoryName distribution or repository name
     * @return expected top-level package directory
     */
    static String packageName(String repositoryName) {
        return repositoryName.toLowerCase(Locale.ROOT).replace('-', '_').replace('.', '_');
    }
}
