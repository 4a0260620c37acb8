package com.structds.core;

import com.structds.core.assembler.EntityAssembler;
import com.structds.core.config.ConfigurationException;
import com.structds.core.config.DatasetConfig;
import com.structds.core.extraction.ExtractionEngine;
import com.structds.core.extraction.ExtractionResult;
import com.structds.core.extractor.SourceExtractor;
import com.structds.core.extractor.python.PythonSourceExtractor;
import com.structds.core.filter.FilterChain;
import com.structds.core.filter.FilterRegistry;
import com.structds.core.filter.FilterReport;
import com.structds.core.loader.SourceSet;
import com.structds.core.loader.SourceUnitLoader;
import com.structds.core.model.Repository;
import com.structds.core.model.RepositoryIdentity;
import com.structds.core.serializer.RunReport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Builds the dataset entry of one repository checkout.
 *
 * <p>Runs the stages in order: the filter chain is resolved first, so an unknown filter name
 * fails before any file is read; then sources are loaded, extracted in parallel, assembled and
 * filtered.
 *
 * <p><b>Usage Example:</b>
 * <pre>{@code
 * DatasetConfig config = ConfigLoader.load(Path.of("structds.yaml"))
 *     .withFilters(List.of("TestModuleFilter", "NoStringTypeFilter", "EmptyFilter"));
 * DatasetBuilder builder = new DatasetBuilder(config);
 * DatasetBuilder.Result result = builder.build(
 *     Path.of("/tmp/checkout/requests"),
 *     new RepositoryIdentity("requests", "https://github.com/psf/requests", "v2.32.3", "0e322af8"));
 * result.repository().ifPresent(repo -> writer.write(List.of(repo), out));
 * }</pre>
 */
public class DatasetBuilder {

    private static final Logger log = LoggerFactory.getLogger(DatasetBuilder.class);

    private final SourceExtractor extractor;
    private final FilterRegistry registry;
    private final DatasetConfig config;

    /**
     * Creates a builder for Python sources with the built-in filters.
     *
     * @param config run configuration
     */
    public DatasetBuilder(DatasetConfig config) {
        this(new PythonSourceExtractor(), FilterRegistry.defaults(), config);
    }

    /**
     * Creates a builder.
     *
     * @param extractor language extractor
     * @param registry filter registry used to resolve {@link DatasetConfig#filters()}
     * @param config run configuration
     */
    public DatasetBuilder(SourceExtractor extractor, FilterRegistry registry, DatasetConfig config) {
        this.extractor = Objects.requireNonNull(extractor, "extractor must not be null");
        this.registry = Objects.requireNonNull(registry, "registry must not be null");
        this.config = Objects.requireNonNull(config, "config must not be null");
    }

    /**
     * Resolves the configured filter chain without running anything.
     *
     * @return resolved chain
     * @throws ConfigurationException if a filter name is unknown or a setting is out of range
     */
    public FilterChain validate() {
        config.validate();
        return registry.resolve(config.filters());
    }

    /**
     * Extracts and filters one repository.
     *
     * @param root checkout directory
     * @param identity repository identity
     * @return filtered repository with failures and exclusions
     * @throws ConfigurationException before any file is read, if the configuration is invalid
     */
    public Result build(Path root, RepositoryIdentity identity) {
        FilterChain chain = validate();
        log.info("Building dataset entry for {} from {} with filters [{}]", identity.name(), root, chain);

        SourceSet sources = new SourceUnitLoader(extractor.getFileExtension(), config.extraction().exclude())
            .load(root);
        ExtractionEngine engine = new ExtractionEngine(
            extractor,
            new EntityAssembler(extractor.getInitializerName()),
            config.extraction().workers(),
            config.extraction().timeout()
        );
        ExtractionResult extraction = engine.extract(identity, sources);
        FilterReport filtering = chain.applyWithReport(extraction.repository());

        log.info("Filters removed {} entities from {}{}", filtering.exclusions().size(), identity.name(),
            filtering.retained().isPresent() ? "" : " (repository removed)");
        return new Result(extraction, filtering, chain.names());
    }

    /**
     * Outcome of {@link #build(Path, RepositoryIdentity)}.
     *
     * @param extraction unfiltered extraction result
     * @param filtering filter chain output
     * @param filters names of the applied filters
     */
    public record Result(ExtractionResult extraction, FilterReport filtering, List<String> filters) {

        public Result {
            Objects.requireNonNull(extraction, "extraction must not be null");
            Objects.requireNonNull(filtering, "filtering must not be null");
            filters = filters != null ? List.copyOf(filters) : List.of();
        }

        /**
         * Gets the filtered repository.
         *
         * @return filtered repository, empty if a filter removed it
         */
        public Optional<Repository> repository() {
            return filtering.retained();
        }

        /**
         * Builds the audit report of this run.
         *
         * @return run report
         */
        public RunReport toRunReport() {
            return new RunReport(
                extraction.repository().name(),
                filters,
                extraction.statistics(),
                extraction.failures(),
                filtering.exclusions()
            );
        }
    }
}
