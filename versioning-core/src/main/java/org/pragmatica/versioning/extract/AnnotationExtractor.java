package org.pragmatica.versioning.extract;

import io.vavr.control.Either;
import io.vavr.control.Option;
import org.pragmatica.versioning.error.VersioningError;
import org.pragmatica.versioning.error.VersioningError.ConfigurationError;
import org.pragmatica.versioning.filter.FilterExpression;
import org.pragmatica.versioning.tree.Attribute;
import org.pragmatica.versioning.tree.Node;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Locates and detaches the version filter annotation of a node, whatever the node kind.
 *
 * <p>Attributes are scanned in order. The first one carrying the filter annotation name is
 * parsed and returned; the others keep their relative order. Further filter annotations on
 * the same node are ignored and detached as well, so extracting from an already extracted
 * attribute list never yields a filter.
 */
public interface AnnotationExtractor {
    String DEFAULT_ANNOTATION = "version";

    /// Name of the annotation recognized as the filter.
    String annotation();

    Either<VersioningError, Extraction> extract(List<Attribute> attributes);

    default Either<VersioningError, Extraction> extract(Node node) {
        return extract(node.attributes());
    }

    static AnnotationExtractor annotationExtractor() {
        return new AnnotationExtractorImpl(DEFAULT_ANNOTATION);
    }

    static Either<VersioningError, AnnotationExtractor> annotationExtractor(String annotation) {
        if (annotation == null || annotation.isBlank()) {
            return ConfigurationError.configurationError("Filter annotation name must not be blank")
                                     .result();
        }
        return Either.right(new AnnotationExtractorImpl(annotation.trim()));
    }
}

class AnnotationExtractorImpl implements AnnotationExtractor {
    private static final Logger log = LoggerFactory.getLogger(AnnotationExtractorImpl.class);

    private final String annotation;

    AnnotationExtractorImpl(String annotation) {
        this.annotation = annotation;
    }

    @Override
    public String annotation() {
        return annotation;
    }

    @Override
    public Either<VersioningError, Extraction> extract(List<Attribute> attributes) {
        var remaining = new ArrayList<Attribute>(attributes.size());
        Option<Attribute> found = Option.none();

        for (var attribute : attributes) {
            if (!attribute.isNamed(annotation)) {
                remaining.add(attribute);
            } else if (found.isEmpty()) {
                found = Option.some(attribute);
            } else {
                log.warn("Ignoring repeated #[{}] annotation at {}, only the first one applies",
                         annotation,
                         attribute.location()
                                  .asString());
            }
        }

        if (found.isEmpty()) {
            return Either.right(Extraction.unfiltered(attributes));
        }

        var filterAttribute = found.get();
        return FilterExpression.parse(filterAttribute.arguments(), filterAttribute.location())
                               .map(filter -> new Extraction(remaining, Option.some(filter)));
    }

    @Override
    public String toString() {
        return "AnnotationExtractor[" + annotation + "]";
    }
}
