package org.pragmatica.versioning.transform;

import io.vavr.control.Either;
import io.vavr.control.Option;
import org.pragmatica.versioning.error.VersioningError;
import org.pragmatica.versioning.error.VersioningError.UnsupportedVisibilityOverride;
import org.pragmatica.versioning.extract.AnnotationExtractor;
import org.pragmatica.versioning.extract.Extraction;
import org.pragmatica.versioning.tree.Attribute;
import org.pragmatica.versioning.tree.BehaviorDefinition;
import org.pragmatica.versioning.tree.Container;
import org.pragmatica.versioning.tree.Declaration;
import org.pragmatica.versioning.tree.EnumDefinition;
import org.pragmatica.versioning.tree.EnumVariant;
import org.pragmatica.versioning.tree.Field;
import org.pragmatica.versioning.tree.Leaf;
import org.pragmatica.versioning.tree.Node;
import org.pragmatica.versioning.tree.StructDefinition;
import org.pragmatica.versioning.tree.Visibility;
import org.pragmatica.versioning.version.Version;
import org.pragmatica.versioning.version.VersionRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Produces the variant of a declaration tree for one version.
 *
 * <p>Every node's filter annotation is extracted, verified against the registry and evaluated
 * for the version. A node whose filter does not hold is dropped together with its subtree; nodes
 * without a filter are always kept. Surviving nodes are rebuilt with their remaining attributes,
 * children in original order. The source tree is never modified.
 */
public interface TreeFilter {
    /**
     * Filter a declaration for one version.
     *
     * @param node     declaration to filter
     * @param registry all versions of this invocation
     * @param version  version to build the variant for
     * @param topLevel whether {@code node} is the root handed to the emitter, the only node the
     *                 visibility policy applies to
     * @return the filtered copy, none when the declaration does not exist in {@code version}
     */
    Either<VersioningError, Option<Declaration>> filter(Declaration node,
                                                        VersionRegistry registry,
                                                        Version version,
                                                        boolean topLevel);

    /**
     * Parse and verify every filter annotation in the tree, including those inside subtrees that
     * a filter would prune.
     *
     * @return number of filter annotations found
     */
    Either<VersioningError, Integer> verify(Node root, VersionRegistry registry);

    VisibilityPolicy visibilityPolicy();

    AnnotationExtractor extractor();

    static TreeFilter treeFilter() {
        return new TreeFilterImpl(AnnotationExtractor.annotationExtractor(), VisibilityPolicy.PRESERVE);
    }

    static TreeFilter treeFilter(AnnotationExtractor extractor, VisibilityPolicy visibilityPolicy) {
        return new TreeFilterImpl(extractor, visibilityPolicy);
    }
}

class TreeFilterImpl implements TreeFilter {
    private static final Logger log = LoggerFactory.getLogger(TreeFilterImpl.class);

    private final AnnotationExtractor extractor;
    private final VisibilityPolicy visibilityPolicy;

    TreeFilterImpl(AnnotationExtractor extractor, VisibilityPolicy visibilityPolicy) {
        this.extractor = extractor;
        this.visibilityPolicy = visibilityPolicy;
    }

    @Override
    public VisibilityPolicy visibilityPolicy() {
        return visibilityPolicy;
    }

    @Override
    public AnnotationExtractor extractor() {
        return extractor;
    }

    @Override
    public Either<VersioningError, Option<Declaration>> filter(Declaration node,
                                                               VersionRegistry registry,
                                                               Version version,
                                                               boolean topLevel) {
        boolean forcePublic = topLevel && visibilityPolicy == VisibilityPolicy.FORCE_PUBLIC;

        if (forcePublic && !node.hasVisibility()) {
            return new UnsupportedVisibilityOverride(node.describe()).result();
        }

        var selected = select(node, registry, version);
        if (selected.isLeft()) {
            return Either.left(selected.getLeft());
        }
        if (selected.get().isEmpty()) {
            log.debug("Dropping {} from version {}", node.describe(), version);
            return Either.right(Option.none());
        }

        var remaining = selected.get().get();
        var rebuilt = rebuild(node, remaining, registry, version);

        if (!forcePublic) {
            return rebuilt.map(Option::some);
        }
        return rebuilt.map(declaration -> declaration.withVisibility(Visibility.PUBLIC));
    }

    @Override
    public Either<VersioningError, Integer> verify(Node root, VersionRegistry registry) {
        var extraction = extractor.extract(root);
        if (extraction.isLeft()) {
            return Either.left(extraction.getLeft());
        }

        int found = 0;
        var filter = extraction.get().filter();
        if (filter.isDefined()) {
            var verified = filter.get().verify(registry);
            if (verified.isLeft()) {
                return Either.left(verified.getLeft());
            }
            found++;
        }

        for (var child : root.children()) {
            var nested = verify(child, registry);
            if (nested.isLeft()) {
                return nested;
            }
            found += nested.get();
        }
        return Either.right(found);
    }

    /// Attributes to keep when the node exists in {@code version}, none when it is filtered out.
    private Either<VersioningError, Option<List<Attribute>>> select(Node node,
                                                                    VersionRegistry registry,
                                                                    Version version) {
        var extraction = extractor.extract(node);
        if (extraction.isLeft()) {
            return Either.left(extraction.getLeft());
        }

        var applies = applies(extraction.get(), registry, version);
        if (applies.isLeft()) {
            return Either.left(applies.getLeft());
        }

        return applies.get()
               ? Either.right(Option.some(extraction.get().remaining()))
               : Either.right(Option.none());
    }

    private static Either<VersioningError, Boolean> applies(Extraction extraction,
                                                            VersionRegistry registry,
                                                            Version version) {
        if (extraction.filter().isEmpty()) {
            return Either.right(true);
        }
        return extraction.filter()
                         .get()
                         .verify(registry)
                         .map(filter -> filter.evaluate(registry, version));
    }

    private Either<VersioningError, Declaration> rebuild(Declaration node,
                                                         List<Attribute> remaining,
                                                         VersionRegistry registry,
                                                         Version version) {
        if (node instanceof Container container) {
            return filterDeclarations(container.children(), registry, version)
                    .map(children -> container.withChildren(children)
                                              .withAttributes(remaining));
        }
        if (node instanceof StructDefinition struct) {
            return filterFields(struct.fields(), registry, version)
                    .map(fields -> struct.withFields(fields)
                                         .withAttributes(remaining));
        }
        if (node instanceof EnumDefinition enumeration) {
            return filterVariants(enumeration.variants(), registry, version)
                    .map(variants -> enumeration.withVariants(variants)
                                                .withAttributes(remaining));
        }
        if (node instanceof BehaviorDefinition behavior) {
            return filterDeclarations(behavior.members(), registry, version)
                    .map(members -> behavior.withMembers(members)
                                            .withAttributes(remaining));
        }
        if (node instanceof Leaf leaf) {
            return Either.right(leaf.withAttributes(remaining));
        }
        throw new IllegalStateException("Unexpected declaration type: " + node.getClass());
    }

    private Either<VersioningError, List<Declaration>> filterDeclarations(List<Declaration> declarations,
                                                                          VersionRegistry registry,
                                                                          Version version) {
        var kept = new ArrayList<Declaration>(declarations.size());

        for (var declaration : declarations) {
            var filtered = filter(declaration, registry, version, false);
            if (filtered.isLeft()) {
                return Either.left(filtered.getLeft());
            }
            filtered.get()
                    .forEach(kept::add);
        }
        return Either.right(kept);
    }

    private Either<VersioningError, List<Field>> filterFields(List<Field> fields,
                                                              VersionRegistry registry,
                                                              Version version) {
        var kept = new ArrayList<Field>(fields.size());

        for (var field : fields) {
            var selected = select(field, registry, version);
            if (selected.isLeft()) {
                return Either.left(selected.getLeft());
            }
            selected.get()
                    .map(field::withAttributes)
                    .forEach(kept::add);
        }
        return Either.right(kept);
    }

    private Either<VersioningError, List<EnumVariant>> filterVariants(List<EnumVariant> variants,
                                                                      VersionRegistry registry,
                                                                      Version version) {
        var kept = new ArrayList<EnumVariant>(variants.size());

        for (var variant : variants) {
            var selected = select(variant, registry, version);
            if (selected.isLeft()) {
                return Either.left(selected.getLeft());
            }
            if (selected.get().isEmpty()) {
                continue;
            }

            var remaining = selected.get().get();
            var fields = filterFields(variant.fields(), registry, version);
            if (fields.isLeft()) {
                return Either.left(fields.getLeft());
            }
            kept.add(variant.withFields(fields.get())
                            .withAttributes(remaining));
        }
        return Either.right(kept);
    }
}
