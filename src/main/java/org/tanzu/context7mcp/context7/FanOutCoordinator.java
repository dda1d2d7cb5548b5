package org.tanzu.context7mcp.context7;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.tanzu.context7mcp.config.Context7Config;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.List;

/**
 * Runs several independent catalog lookups concurrently for the multi-library tools.
 * 
 * Both operations return a list aligned with their input: element i always
 * belongs to input i, whatever order the calls complete in. This relies on
 * {@link Flux#flatMapSequential}, which subscribes to inner calls eagerly but
 * emits their results in source order. At most {@link Context7Config#getMaxConcurrency()}
 * calls are in flight per batch.
 * 
 * The two operations differ in failure policy:
 * - resolveMany is all-or-nothing: one name without hits fails the batch, the
 *   remaining calls are cancelled and results already received are dropped.
 * - fetchMany is best-effort: a missing document becomes a placeholder string
 *   at its own index and the other calls are unaffected.
 */
@Component
public class FanOutCoordinator {

    private static final Logger logger = LoggerFactory.getLogger(FanOutCoordinator.class);

    private final CatalogClient catalogClient;
    private final ResultFormatter resultFormatter;
    private final Context7Config context7Config;

    public FanOutCoordinator(CatalogClient catalogClient, ResultFormatter resultFormatter, Context7Config context7Config) {
        this.catalogClient = catalogClient;
        this.resultFormatter = resultFormatter;
        this.context7Config = context7Config;
    }

    /**
     * Resolves several library names, failing the whole batch if any name has no hits.
     * 
     * @param names library names, in the order results should be returned
     * @param clientAddress caller address for the identity header, or null
     * @param credential bearer credential, or null
     * @return formatted search results aligned with {@code names}; errors with
     *         {@link LibraryNotFoundException} naming the full input list
     */
    public Mono<List<String>> resolveMany(List<String> names, String clientAddress, String credential) {
        logger.info("Resolving {} library names concurrently (max {} in flight)", names.size(), maxConcurrency());
        // One search per name; flatMapSequential emits in input order and an error cancels the rest
        return Flux.fromIterable(names)
            .flatMapSequential(name -> catalogClient.search(name, clientAddress, credential)
                .map(CatalogSearchResult::toLookup)
                .flatMap(lookup -> {
                    // Any name without hits fails the whole batch
                    if (!lookup.isFound()) {
                        logger.warn("Library name '{}' did not resolve: {}", name, lookup.getDetail());
                        return Mono.<String>error(new LibraryNotFoundException(
                            "No matching library ids found for names " + names));
                    }
                    return Mono.just(resultFormatter.format(lookup.getValue()));
                }), maxConcurrency())
            .collectList();
    }

    /**
     * Fetches documentation for several libraries, substituting a placeholder for
     * each one that has none.
     * 
     * The three lists are index-aligned and must have the same length; this is
     * checked before anything is sent.
     * 
     * @param libraryIds library ids
     * @param tokens token budget per library; a null entry uses the default budget
     * @param topics topic filter per library
     * @param clientAddress caller address for the identity header, or null
     * @param credential bearer credential, or null
     * @return documentation texts or placeholders aligned with {@code libraryIds}
     * @throws BatchValidationException if the list lengths differ
     */
    public Mono<List<String>> fetchMany(List<String> libraryIds, List<Integer> tokens, List<String> topics,
                                        String clientAddress, String credential) {
        // Validate the aligned lists before anything is dispatched
        if (libraryIds.size() != tokens.size() || libraryIds.size() != topics.size()) {
            logger.warn("Rejected documentation batch: {} ids, {} token budgets, {} topics",
                       libraryIds.size(), tokens.size(), topics.size());
            throw new BatchValidationException("Lengths of library_ids, tokens, and topics must match.");
        }

        logger.info("Fetching documentation for {} libraries concurrently (max {} in flight)",
                   libraryIds.size(), maxConcurrency());
        // Build one request per index; a missing token budget falls back to the default
        return Flux.range(0, libraryIds.size())
            .map(i -> new DocumentationRequest(
                libraryIds.get(i),
                tokens.get(i) != null ? tokens.get(i) : context7Config.getDefaultTokens(),
                topics.get(i)))
            // Missing documentation is replaced at its own index only
            .flatMapSequential(request -> catalogClient.fetchDocs(request, clientAddress, credential)
                .map(lookup -> lookup.isFound() ? lookup.getValue() : placeholder(request)), maxConcurrency())
            .collectList();
    }

    static String placeholder(DocumentationRequest request) {
        return "Documentation not found for " + request.getLibraryId() + " with topic '" + request.getTopic() + "'.";
    }

    private int maxConcurrency() {
        return Math.max(1, context7Config.getMaxConcurrency());
    }
}
