package org.pragmatica.versioning.transform;

import io.vavr.control.Option;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.pragmatica.versioning.error.VersioningError.ParseError;
import org.pragmatica.versioning.error.VersioningError.UnknownVersionReference;
import org.pragmatica.versioning.error.VersioningError.UnsupportedVisibilityOverride;
import org.pragmatica.versioning.extract.AnnotationExtractor;
import org.pragmatica.versioning.tree.Attribute;
import org.pragmatica.versioning.tree.BehaviorDefinition;
import org.pragmatica.versioning.tree.Container;
import org.pragmatica.versioning.tree.Declaration;
import org.pragmatica.versioning.tree.EnumDefinition;
import org.pragmatica.versioning.tree.EnumVariant;
import org.pragmatica.versioning.tree.Field;
import org.pragmatica.versioning.tree.FieldShape;
import org.pragmatica.versioning.tree.Leaf;
import org.pragmatica.versioning.tree.Node;
import org.pragmatica.versioning.tree.StructDefinition;
import org.pragmatica.versioning.tree.Visibility;
import org.pragmatica.versioning.version.Version;
import org.pragmatica.versioning.version.VersionRegistry;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class TreeFilterTest {
    private final TreeFilter filter = TreeFilter.treeFilter();

    private static Attribute version(String expression) {
        return Attribute.attribute("version", expression);
    }

    private static VersionRegistry registry(String... names) {
        return VersionRegistry.versionRegistry(names)
                              .get();
    }

    private Option<Declaration> filtered(Declaration node, VersionRegistry registry, String version) {
        return filter.filter(node, registry, Version.version(version), false)
                     .peekLeft(error -> Assertions.fail(error.message()))
                     .get();
    }

    private static List<String> names(List<? extends Node> nodes) {
        return nodes.stream()
                    .map(Node::name)
                    .toList();
    }

    @Nested
    class Structs {

        @Test
        void filter_keepsOnlyFieldsOfRequestedVersion() {
            var registry = registry("v1", "v2");
            var struct = StructDefinition.struct("Example",
                                                 Visibility.PUBLIC,
                                                 List.of(Field.field("foo", "String", version("\"v1\"")),
                                                         Field.field("bar", "u64", version("\"v2\""))));

            var v1 = (StructDefinition) filtered(struct, registry, "v1").get();
            var v2 = (StructDefinition) filtered(struct, registry, "v2").get();

            assertThat(names(v1.fields())).containsExactly("foo");
            assertThat(names(v2.fields())).containsExactly("bar");
        }

        @Test
        void filter_appliesPositionalBounds() {
            var registry = registry("v1_0_0", "v1_0_1", "v1_1_0", "v2_0_0");
            var struct = StructDefinition.struct("Example",
                                                 Visibility.PUBLIC,
                                                 List.of(Field.field("a", "String", version("max(\"v1_0_1\")")),
                                                         Field.field("b", "u64", version("min(\"v1_1_0\")")),
                                                         Field.field("c", "bool")));

            assertThat(names(((StructDefinition) filtered(struct, registry, "v1_0_0").get()).fields()))
                    .containsExactly("a", "c");
            assertThat(names(((StructDefinition) filtered(struct, registry, "v1_0_1").get()).fields()))
                    .containsExactly("a", "c");
            assertThat(names(((StructDefinition) filtered(struct, registry, "v1_1_0").get()).fields()))
                    .containsExactly("b", "c");
            assertThat(names(((StructDefinition) filtered(struct, registry, "v2_0_0").get()).fields()))
                    .containsExactly("b", "c");
        }

        @Test
        void filter_keepsStructWithoutSurvivingFields() {
            var registry = registry("v1", "v2");
            var struct = StructDefinition.struct("Marker",
                                                 Visibility.INHERITED,
                                                 List.of(Field.field("only", "u8", version("\"v2\""))));

            var v1 = filtered(struct, registry, "v1");

            assertThat(v1.isDefined()).isTrue();
            assertThat(((StructDefinition) v1.get()).fields()).isEmpty();
        }

        @Test
        void filter_reattachesNonFilterAttributes() {
            var registry = registry("v1");
            var doc = Attribute.attribute("doc", "\"A field\"");
            var derive = Attribute.attribute("derive", "Debug");
            var struct = StructDefinition.struct("Example",
                                                 Visibility.PUBLIC,
                                                 List.of(derive, version("\"\"")),
                                                 List.of(Field.field("foo", "String", doc, version("\"v1\""))));

            var v1 = (StructDefinition) filtered(struct, registry, "v1").get();

            assertThat(v1.attributes()).containsExactly(derive);
            assertThat(v1.fields().get(0).attributes()).containsExactly(doc);
            assertThat(v1.fields().get(0).payload()).isEqualTo(struct.fields().get(0).payload());
        }

        @Test
        void filter_dropsStructWhoseFilterFails() {
            var registry = registry("v1", "v2");
            var struct = StructDefinition.struct("Example",
                                                 Visibility.PUBLIC,
                                                 List.of(version("not(\"v1\")")),
                                                 List.of(Field.field("foo", "String")));

            assertThat(filtered(struct, registry, "v1").isEmpty()).isTrue();
            assertThat(filtered(struct, registry, "v2").isDefined()).isTrue();
        }
    }

    @Nested
    class Enums {
        private final VersionRegistry registry = registry("v1_0_0", "v2_0_0", "v3_0_0", "v4_0_0", "v5_0_0");

        private final EnumDefinition example = EnumDefinition.enumDefinition(
                "Example",
                Visibility.INHERITED,
                List.of(EnumVariant.unit("Variant1", version("\"v1_0_0\"")),
                        EnumVariant.enumVariant("Variant2",
                                                FieldShape.POSITIONAL,
                                                List.of(version("any(\"v2_0_0\", \"v3_0_0\")")),
                                                List.of(Field.positional("String", version("\"v2_0_0\"")),
                                                        Field.positional("u64", version("\"v3_0_0\"")))),
                        EnumVariant.enumVariant("Variant3",
                                                FieldShape.NAMED,
                                                List.of(version("any(\"v4_0_0\", \"v5_0_0\")")),
                                                List.of(Field.field("foo", "String", version("\"v4_0_0\"")),
                                                        Field.field("bar", "u64", version("\"v5_0_0\""))))));

        @Test
        void filter_keepsMatchingVariantsOnly() {
            assertThat(names(((EnumDefinition) filtered(example, registry, "v1_0_0").get()).variants()))
                    .containsExactly("Variant1");
            assertThat(names(((EnumDefinition) filtered(example, registry, "v3_0_0").get()).variants()))
                    .containsExactly("Variant2");
            assertThat(names(((EnumDefinition) filtered(example, registry, "v5_0_0").get()).variants()))
                    .containsExactly("Variant3");
        }

        @Test
        void filter_filtersFieldsOfSurvivingVariant() {
            var v2 = (EnumDefinition) filtered(example, registry, "v2_0_0").get();
            var v4 = (EnumDefinition) filtered(example, registry, "v4_0_0").get();

            assertThat(v2.variants().get(0).fields()).extracting(field -> field.payload().summary())
                                                     .containsExactly("String");
            assertThat(v2.variants().get(0).attributes()).isEmpty();
            assertThat(names(v4.variants().get(0).fields())).containsExactly("foo");
            assertThat(v4.variants().get(0).shape()).isEqualTo(FieldShape.NAMED);
        }
    }

    @Nested
    class Behaviors {
        private final VersionRegistry registry = registry("v1_0_0", "v2_0_0");

        @Test
        void filter_keepsUnannotatedMembersAndFiltersAnnotatedOnes() {
            var impl = BehaviorDefinition.implementation("Example1",
                                                         List.of(Leaf.function("new", Visibility.PUBLIC),
                                                                 Leaf.function("foo", Visibility.PUBLIC, version("\"v1_0_0\"")),
                                                                 Leaf.function("bar", Visibility.PUBLIC, version("\"v2_0_0\""))));

            var v1 = (BehaviorDefinition) filtered(impl, registry, "v1_0_0").get();
            var v2 = (BehaviorDefinition) filtered(impl, registry, "v2_0_0").get();

            assertThat(names(v1.members())).containsExactly("new", "foo");
            assertThat(names(v2.members())).containsExactly("new", "bar");
            assertThat(v1.kind()).isEqualTo(BehaviorDefinition.Kind.IMPLEMENTATION);
        }

        @Test
        void filter_dropsWholeBlockByItsOwnFilter() {
            var impl = BehaviorDefinition.implementation("Example1",
                                                         List.of(version("\"v1_0_0\"")),
                                                         List.of(Leaf.function("new", Visibility.PUBLIC)));

            assertThat(filtered(impl, registry, "v1_0_0").isDefined()).isTrue();
            assertThat(filtered(impl, registry, "v2_0_0").isEmpty()).isTrue();
        }

        @Test
        void filter_failsWhenForcingPublicOnTopLevelBlock() {
            var publicFilter = TreeFilter.treeFilter(AnnotationExtractor.annotationExtractor(),
                                                     VisibilityPolicy.FORCE_PUBLIC);
            var trait = BehaviorDefinition.trait("Greeter", List.of(Leaf.hidden(Leaf.Kind.FUNCTION, "greet")));

            publicFilter.filter(trait, registry, Version.version("v1_0_0"), true)
                        .peek(result -> Assertions.fail("Expected failure"))
                        .peekLeft(error -> {
                            assertThat(error).isInstanceOf(UnsupportedVisibilityOverride.class);
                            assertThat(error.message()).contains("trait 'Greeter'");
                        });
        }
    }

    @Nested
    class Containers {
        private final VersionRegistry registry = registry("v1_0_0", "v2_0_0");

        private final Container defs = Container.container(
                "defs",
                Visibility.INHERITED,
                List.of(StructDefinition.struct("Kept", Visibility.PUBLIC, List.of()),
                        Leaf.leaf(Leaf.Kind.CONSTANT, "OLD", Visibility.PUBLIC, version("max(\"v1_0_0\")")),
                        Container.container("nested",
                                            Visibility.PUBLIC,
                                            List.of(version("min(\"v2_0_0\")")),
                                            List.of(Leaf.leaf(Leaf.Kind.TYPE_ALIAS, "Alias", Visibility.PUBLIC))),
                        Leaf.leaf(Leaf.Kind.IMPORT, "std::fmt", Visibility.INHERITED)));

        @Test
        void filter_prunesChildrenAndKeepsOrder() {
            var v1 = (Container) filtered(defs, registry, "v1_0_0").get();
            var v2 = (Container) filtered(defs, registry, "v2_0_0").get();

            assertThat(names(v1.children())).containsExactly("Kept", "OLD", "std::fmt");
            assertThat(names(v2.children())).containsExactly("Kept", "nested", "std::fmt");
            assertThat(((Container) v2.children().get(1)).attributes()).isEmpty();
        }

        @Test
        void filter_leavesSourceTreeUntouched() {
            var before = defs.toString();

            filtered(defs, registry, "v1_0_0");
            filtered(defs, registry, "v2_0_0");

            assertThat(defs.toString()).isEqualTo(before);
            assertThat(defs.children()).hasSize(4);
        }

        @Test
        void filter_withoutAnnotations_keepsTreeEqualInEveryVersion() {
            var plain = Container.container("plain",
                                            Visibility.PUBLIC,
                                            List.of(StructDefinition.struct("S",
                                                                            Visibility.PUBLIC,
                                                                            List.of(Field.field("x", "i32"))),
                                                    Leaf.function("f", Visibility.INHERITED)));

            assertThat(filtered(plain, registry, "v1_0_0").get()).isEqualTo(plain);
            assertThat(filtered(plain, registry, "v2_0_0").get()).isEqualTo(plain);
        }

        @Test
        void filter_forcesPublicOnTopLevelOnly() {
            var publicFilter = TreeFilter.treeFilter(AnnotationExtractor.annotationExtractor(),
                                                     VisibilityPolicy.FORCE_PUBLIC);

            publicFilter.filter(defs, registry, Version.version("v1_0_0"), true)
                        .peekLeft(error -> Assertions.fail(error.message()))
                        .peek(result -> {
                            var container = (Container) result.get();
                            assertThat(container.visibility()).isEqualTo(Visibility.PUBLIC);
                            assertThat(container.children()
                                                .get(2)
                                                .declaredVisibility()
                                                .get()).isEqualTo(Visibility.INHERITED);
                        });
        }

        @Test
        void filter_fails_onUnknownVersionReference() {
            var broken = Container.container("defs",
                                             Visibility.INHERITED,
                                             List.of(Leaf.function("f", Visibility.PUBLIC, version("max(\"v9_9_9\")"))));

            filter.filter(broken, registry, Version.version("v1_0_0"), false)
                  .peek(result -> Assertions.fail("Expected failure"))
                  .peekLeft(error -> assertThat(error).isInstanceOf(UnknownVersionReference.class));
        }
    }

    @Nested
    class Verification {
        private final VersionRegistry registry = registry("v1", "v2");

        @Test
        void verify_countsFiltersInWholeTree() {
            var tree = Container.container("defs",
                                           Visibility.INHERITED,
                                           List.of(version("\"\"")),
                                           List.of(StructDefinition.struct("S",
                                                                           Visibility.PUBLIC,
                                                                           List.of(Field.field("a", "u8", version("\"v1\"")),
                                                                                   Field.field("b", "u8"))),
                                                   Leaf.function("f", Visibility.PUBLIC, version("min(\"v2\")"))));

            filter.verify(tree, registry)
                  .peekLeft(error -> Assertions.fail(error.message()))
                  .peek(count -> assertThat(count).isEqualTo(3));
        }

        @Test
        void verify_reachesIntoSubtreesPrunedForEveryVersion() {
            var tree = Container.container("defs",
                                           Visibility.INHERITED,
                                           List.of(Container.container("gone",
                                                                       Visibility.INHERITED,
                                                                       List.of(version("all()")),
                                                                       List.of(Leaf.function("f",
                                                                                             Visibility.PUBLIC,
                                                                                             version("min(\"v7\")"))))));

            filter.verify(tree, registry)
                  .peek(count -> Assertions.fail("Expected failure"))
                  .peekLeft(error -> assertThat(((UnknownVersionReference) error).literal()).isEqualTo("v7"));
        }

        @Test
        void verify_reportsParseErrorInsidePrunedSubtree() {
            var tree = Container.container("defs",
                                           Visibility.INHERITED,
                                           List.of(Container.container("gone",
                                                                       Visibility.INHERITED,
                                                                       List.of(version("all()")),
                                                                       List.of(Leaf.function("f",
                                                                                             Visibility.PUBLIC,
                                                                                             version("bogus(\"v1\")"))))));

            filter.verify(tree, registry)
                  .peek(count -> Assertions.fail("Expected failure"))
                  .peekLeft(error -> {
                      assertThat(error).isInstanceOf(ParseError.class);
                      assertThat(error.message()).contains("Unknown operator 'bogus'");
                  });
        }
    }
}
