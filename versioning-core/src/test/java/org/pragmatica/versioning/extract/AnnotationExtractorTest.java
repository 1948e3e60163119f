package org.pragmatica.versioning.extract;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;
import org.pragmatica.versioning.error.VersioningError.ConfigurationError;
import org.pragmatica.versioning.error.VersioningError.ParseError;
import org.pragmatica.versioning.filter.FilterExpression;
import org.pragmatica.versioning.syntax.SourceLocation;
import org.pragmatica.versioning.tree.Attribute;
import org.pragmatica.versioning.tree.Field;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class AnnotationExtractorTest {
    private final AnnotationExtractor extractor = AnnotationExtractor.annotationExtractor();

    private static final Attribute DOC = Attribute.attribute("doc", "\"Some field\"");
    private static final Attribute DERIVE = Attribute.attribute("derive", "Debug, Clone");

    @Test
    void extract_detachesFilterAndKeepsOtherAttributesInOrder() {
        var attributes = List.of(DOC, Attribute.attribute("version", "min(\"v2\")"), DERIVE);

        extractor.extract(attributes)
                 .peekLeft(error -> Assertions.fail(error.message()))
                 .peek(extraction -> {
                     assertThat(extraction.remaining()).containsExactly(DOC, DERIVE);
                     assertThat(extraction.filter().get()).isEqualTo(FilterExpression.atLeast("v2"));
                 });
    }

    @Test
    void extract_withoutFilter_returnsAttributesUnchanged() {
        var attributes = List.of(DOC, DERIVE);

        extractor.extract(attributes)
                 .peekLeft(error -> Assertions.fail(error.message()))
                 .peek(extraction -> {
                     assertThat(extraction.remaining()).containsExactly(DOC, DERIVE);
                     assertThat(extraction.filter().isEmpty()).isTrue();
                 });
    }

    @Test
    void extract_honorsOnlyFirstOfRepeatedFilters() {
        var attributes = List.of(Attribute.attribute("version", "\"v1\""),
                                 DOC,
                                 Attribute.attribute("version", "\"v2\""));

        extractor.extract(attributes)
                 .peekLeft(error -> Assertions.fail(error.message()))
                 .peek(extraction -> {
                     assertThat(extraction.filter().get()).isEqualTo(FilterExpression.match("v1"));
                     assertThat(extraction.remaining()).containsExactly(DOC);
                 });
    }

    @Test
    void extract_isIdempotent() {
        var field = Field.field("foo", "String", DOC, Attribute.attribute("version", "\"v1\""));

        extractor.extract(field)
                 .map(extraction -> field.withAttributes(extraction.remaining()))
                 .flatMap(stripped -> extractor.extract(stripped.attributes()))
                 .peekLeft(error -> Assertions.fail(error.message()))
                 .peek(second -> {
                     assertThat(second.filter().isEmpty()).isTrue();
                     assertThat(second.remaining()).containsExactly(DOC);
                 });
    }

    @Test
    void extract_fails_onMalformedFilterWithSourceLocation() {
        var attributes = List.of(Attribute.attribute("version", "min(v2)", SourceLocation.sourceLocation(12, 15)));

        extractor.extract(attributes)
                 .peek(extraction -> Assertions.fail("Expected failure"))
                 .peekLeft(error -> {
                     assertThat(error).isInstanceOf(ParseError.class);
                     assertThat(((ParseError) error).location()).isEqualTo(SourceLocation.sourceLocation(12, 19));
                 });
    }

    @Test
    void annotationExtractor_recognizesCustomName() {
        AnnotationExtractor.annotationExtractor("since")
                           .flatMap(custom -> custom.extract(List.of(Attribute.attribute("version", "\"v1\""),
                                                                     Attribute.attribute("since", "\"v2\""))))
                           .peekLeft(error -> Assertions.fail(error.message()))
                           .peek(extraction -> {
                               assertThat(extraction.filter().get()).isEqualTo(FilterExpression.match("v2"));
                               assertThat(extraction.remaining()).extracting(Attribute::name)
                                                                 .containsExactly("version");
                           });
    }

    @Test
    void annotationExtractor_fails_onBlankName() {
        AnnotationExtractor.annotationExtractor("  ")
                           .peek(created -> Assertions.fail("Expected failure"))
                           .peekLeft(error -> assertThat(error).isInstanceOf(ConfigurationError.class));
    }
}
