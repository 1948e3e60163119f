package org.pragmatica.versioning.config;

import io.vavr.control.Either;
import org.pragmatica.versioning.emit.EmitOptions;
import org.pragmatica.versioning.emit.VariantEmitter;
import org.pragmatica.versioning.emit.Variant;
import org.pragmatica.versioning.error.VersioningError;
import org.pragmatica.versioning.extract.AnnotationExtractor;
import org.pragmatica.versioning.tree.Declaration;
import org.pragmatica.versioning.version.VersionRegistry;

import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;

/**
 * Versioning settings loaded from a {@code [versioning]} TOML table.
 *
 * @param versions    version names, oldest first
 * @param annotation  name of the annotation carrying filter expressions
 * @param emitOptions packaging options for emitted variants
 * @param parallel    emit versions concurrently
 */
public record VersioningConfig(List<String> versions,
                               String annotation,
                               EmitOptions emitOptions,
                               boolean parallel) {
    public VersioningConfig {
        versions = List.copyOf(versions);
        Objects.requireNonNull(annotation, "annotation");
        Objects.requireNonNull(emitOptions, "emitOptions");
    }

    public static VersioningConfig versioningConfig(List<String> versions) {
        return new VersioningConfig(versions, AnnotationExtractor.DEFAULT_ANNOTATION, EmitOptions.emitOptions(), false);
    }

    public VersioningConfig withAnnotation(String annotation) {
        return new VersioningConfig(versions, annotation, emitOptions, parallel);
    }

    public VersioningConfig withFeatures(boolean features) {
        return new VersioningConfig(versions, annotation, emitOptions.withFeatures(features), parallel);
    }

    public VersioningConfig withNestTopLevel(boolean nestTopLevel) {
        return new VersioningConfig(versions, annotation, emitOptions.withNestTopLevel(nestTopLevel), parallel);
    }

    public VersioningConfig withParallel(boolean parallel) {
        return new VersioningConfig(versions, annotation, emitOptions, parallel);
    }

    public Either<VersioningError, VersionRegistry> registry() {
        return VersionRegistry.versionRegistry(versions);
    }

    public Either<VersioningError, VariantEmitter> emitter() {
        return AnnotationExtractor.annotationExtractor(annotation)
                                  .map(extractor -> VariantEmitter.variantEmitter(extractor));
    }

    /**
     * Emit variants of {@code root} for every configured version. Sequential configurations
     * complete before returning; parallel ones run one task per version on {@code executor}.
     */
    public CompletableFuture<Either<VersioningError, List<Variant>>> emit(Declaration root, Executor executor) {
        var prepared = registry().flatMap(registry -> emitter().map(emitter -> new Prepared(registry, emitter)));

        if (prepared.isLeft()) {
            return CompletableFuture.completedFuture(Either.left(prepared.getLeft()));
        }

        var registry = prepared.get().registry();
        var emitter = prepared.get().emitter();

        return parallel
               ? emitter.emitParallel(root, registry, emitOptions, executor)
               : CompletableFuture.completedFuture(emitter.emit(root, registry, emitOptions));
    }

    private record Prepared(VersionRegistry registry, VariantEmitter emitter) {}
}
