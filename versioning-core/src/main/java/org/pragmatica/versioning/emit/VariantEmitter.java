package org.pragmatica.versioning.emit;

import io.vavr.control.Either;
import io.vavr.control.Option;
import org.pragmatica.versioning.error.VersioningError;
import org.pragmatica.versioning.extract.AnnotationExtractor;
import org.pragmatica.versioning.transform.TreeFilter;
import org.pragmatica.versioning.transform.VisibilityPolicy;
import org.pragmatica.versioning.tree.Attribute;
import org.pragmatica.versioning.tree.Container;
import org.pragmatica.versioning.tree.Declaration;
import org.pragmatica.versioning.tree.Visibility;
import org.pragmatica.versioning.version.Version;
import org.pragmatica.versioning.version.VersionRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;

/**
 * Builds one variant of a declaration per registered version.
 *
 * <p>Before anything is emitted every filter annotation in the tree is verified, so an invalid
 * reference aborts the whole invocation. Variants come out in registry order; a version for which
 * the root itself is filtered away is omitted.
 *
 * <p>Packaging: a root container is renamed to the version name, unless {@code nestTopLevel} is
 * set. Any other root, or every root with {@code nestTopLevel}, is wrapped in a new container
 * named after the version that has the root's visibility, and the filtered root inside it is made
 * public.
 */
public interface VariantEmitter {
    Either<VersioningError, List<Variant>> emit(Declaration root, VersionRegistry registry, EmitOptions options);

    /**
     * Same as {@link #emit(Declaration, VersionRegistry, EmitOptions)}, filtering every version as a
     * separate task on {@code executor}. Versions share only the immutable source tree. The future
     * fails with {@link java.util.concurrent.RejectedExecutionException} when the executor refuses a task.
     */
    CompletableFuture<Either<VersioningError, List<Variant>>> emitParallel(Declaration root,
                                                                            VersionRegistry registry,
                                                                            EmitOptions options,
                                                                            Executor executor);

    default Either<VersioningError, List<Variant>> emit(Declaration root, VersionRegistry registry) {
        return emit(root, registry, EmitOptions.emitOptions());
    }

    static VariantEmitter variantEmitter() {
        return new VariantEmitterImpl(AnnotationExtractor.annotationExtractor());
    }

    static VariantEmitter variantEmitter(AnnotationExtractor extractor) {
        return new VariantEmitterImpl(extractor);
    }
}

class VariantEmitterImpl implements VariantEmitter {
    private static final Logger log = LoggerFactory.getLogger(VariantEmitterImpl.class);

    private final AnnotationExtractor extractor;

    VariantEmitterImpl(AnnotationExtractor extractor) {
        this.extractor = extractor;
    }

    @Override
    public Either<VersioningError, List<Variant>> emit(Declaration root,
                                                       VersionRegistry registry,
                                                       EmitOptions options) {
        var prepared = prepare(root, registry, options);
        if (prepared.isLeft()) {
            return Either.left(prepared.getLeft());
        }

        var filter = prepared.get();
        var variants = new ArrayList<Variant>(registry.size());

        for (var version : registry.versions()) {
            var variant = emitVersion(filter, root, registry, version, options);
            if (variant.isLeft()) {
                log.debug("Emission of {} aborted at version {}: {}",
                          root.describe(),
                          version,
                          variant.getLeft().message());
                return Either.left(variant.getLeft());
            }
            variant.get()
                   .forEach(variants::add);
        }

        return Either.right(summarize(root, registry, variants));
    }

    @Override
    public CompletableFuture<Either<VersioningError, List<Variant>>> emitParallel(Declaration root,
                                                                                   VersionRegistry registry,
                                                                                   EmitOptions options,
                                                                                   Executor executor) {
        var prepared = prepare(root, registry, options);
        if (prepared.isLeft()) {
            return CompletableFuture.completedFuture(Either.left(prepared.getLeft()));
        }

        var filter = prepared.get();
        var tasks = new ArrayList<CompletableFuture<Either<VersioningError, Option<Variant>>>>(registry.size());

        try{
            for (var version : registry.versions()) {
                tasks.add(CompletableFuture.supplyAsync(() -> emitVersion(filter, root, registry, version, options),
                                                        executor));
            }
        } catch (RejectedExecutionException e) {
            log.warn("Executor rejected variant emission for {}: {}", root.describe(), e.getMessage());
            tasks.forEach(task -> task.cancel(false));
            return CompletableFuture.failedFuture(e);
        }

        return CompletableFuture.allOf(tasks.toArray(new CompletableFuture<?>[0]))
                                .thenApply(completed -> collect(root, registry, tasks));
    }

    private Either<VersioningError, List<Variant>> collect(Declaration root,
                                                           VersionRegistry registry,
                                                           List<CompletableFuture<Either<VersioningError, Option<Variant>>>> tasks) {
        var variants = new ArrayList<Variant>(tasks.size());

        for (var task : tasks) {
            var variant = task.join();
            if (variant.isLeft()) {
                return Either.left(variant.getLeft());
            }
            variant.get()
                   .forEach(variants::add);
        }
        return Either.right(summarize(root, registry, variants));
    }

    private Either<VersioningError, TreeFilter> prepare(Declaration root, VersionRegistry registry, EmitOptions options) {
        if (registry.isEmpty()) {
            log.warn("No versions registered for {}, nothing will be emitted", root.describe());
        }

        var policy = wraps(root, options)
                     ? VisibilityPolicy.FORCE_PUBLIC
                     : VisibilityPolicy.PRESERVE;
        var filter = TreeFilter.treeFilter(extractor, policy);

        return filter.verify(root, registry)
                     .map(count -> {
                         log.debug("Verified {} filter annotation(s) in {} against {} version(s)",
                                   count,
                                   root.describe(),
                                   registry.size());
                         return filter;
                     });
    }

    private static Either<VersioningError, Option<Variant>> emitVersion(TreeFilter filter,
                                                                        Declaration root,
                                                                        VersionRegistry registry,
                                                                        Version version,
                                                                        EmitOptions options) {
        var filtered = filter.filter(root, registry, version, true);
        if (filtered.isLeft()) {
            return Either.left(filtered.getLeft());
        }
        if (filtered.get().isEmpty()) {
            log.debug("{} does not exist in version {}, omitting it", root.describe(), version);
            return Either.right(Option.none());
        }

        var packaged = wrap(root, filtered.get().get(), version, options);
        var tagged = options.features()
                     ? tag(packaged, version)
                     : packaged;

        var variant = Variant.variant(version, tagged);
        if (log.isDebugEnabled()) {
            log.debug("Built variant {} of {}:\n{}", version, root.describe(), variant.outline());
        }
        return Either.right(Option.some(variant));
    }

    private static boolean wraps(Declaration root, EmitOptions options) {
        return options.nestTopLevel() || !(root instanceof Container);
    }

    private static Declaration wrap(Declaration root, Declaration filtered, Version version, EmitOptions options) {
        if (!wraps(root, options) && filtered instanceof Container container) {
            return container.withName(version.name());
        }
        var visibility = root.declaredVisibility()
                             .getOrElse(Visibility.INHERITED);
        return Container.container(version.name(), visibility, List.of(filtered));
    }

    private static Declaration tag(Declaration declaration, Version version) {
        var attributes = new ArrayList<>(declaration.attributes());
        attributes.add(Attribute.featureGate(version.name()));
        return declaration.withAttributes(attributes);
    }

    private static List<Variant> summarize(Declaration root, VersionRegistry registry, List<Variant> variants) {
        log.info("Emitted {} of {} variant(s) for {}", variants.size(), registry.size(), root.describe());
        return List.copyOf(variants);
    }
}
