package gql.lite;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ExecutorTest extends GqlLiteTestBase {

    private Executor executor;

    @BeforeEach
    void setUp() {
        executor = new Executor(TestSchemas.schema());
    }

    private Map<String, Object> run(String query) {
        return run(query, null);
    }

    private Map<String, Object> run(String query, Object rootValue) {
        return executor.execute(QueryParser.parse(query), rootValue);
    }

    @SuppressWarnings("unchecked")
    private static Map<String, Object> child(Map<String, Object> result, String key) {
        return (Map<String, Object>) result.get(key);
    }

    // ========== Root fields ==========

    @Test
    void basicScalarQuery() {
        assertThat(run("{ hello }")).isEqualTo(Map.of("hello", "World"));
    }

    @Test
    void objectFieldReturnsOnlyRequestedSubfields() {
        assertThat(run("{ user { id name email } }"))
                .isEqualTo(Map.of("user", Map.of("id", "1", "name", "Alice", "email", "alice@example.com")));
    }

    @Test
    void partialObjectSelectionOmitsUnrequestedFields() {
        assertThat(run("{ user { name } }")).isEqualTo(Map.of("user", Map.of("name", "Alice")));
    }

    @Test
    void multipleRootFieldsKeepSelectionOrder() {
        final var result = run("{ user { name email } hello }");
        assertThat(result).containsOnlyKeys("user", "hello");
        assertThat(result.keySet()).containsExactly("user", "hello");
        assertThat(child(result, "user").keySet()).containsExactly("name", "email");
        assertThat(result.get("hello")).isEqualTo("World");
    }

    @Test
    void listOfObjectsResolvesEachElement() {
        assertThat(run("{ users { id name } }")).isEqualTo(Map.of("users", List.of(
                Map.of("id", "1", "name", "Alice"),
                Map.of("id", "2", "name", "Bob"))));
    }

    @Test
    void customResolverRunsOnNestedField() {
        assertThat(run("{ user { age } }")).isEqualTo(Map.of("user", Map.of("age", 30)));
    }

    @Test
    void rootValueIsHandedToRootResolvers() {
        final var result = run("{ user { name } }", Map.of("user", TestSchemas.CHARLIE));
        assertThat(result).isEqualTo(Map.of("user", Map.of("name", "Charlie")));
    }

    @Test
    void objectFieldWithoutSelectionReturnsWholeValue() {
        final var result = run("{ product }");
        assertThat(child(result, "product")).containsEntry("name", "Laptop").containsEntry("price", 1200.50);
    }

    // ========== Mutations and operations ==========

    @Test
    void mutationWithObjectResult() {
        final var created = child(run("mutation { createUser { id name email } }"), "createUser");
        assertThat(created).containsOnlyKeys("id", "name", "email");
        assertThat(created.get("name")).isEqualTo("New User");
        assertThat(created.get("email")).isEqualTo("new@example.com");
    }

    @Test
    void mutationWithScalarResult() {
        assertThat(run("mutation { updateUserStatus }")).isEqualTo(Map.of("updateUserStatus", true));
    }

    @Test
    void mutationWithoutMutationRootFails() {
        final var queryOnly = new Executor(new Schema(TestSchemas.queryType()));
        assertThatThrownBy(() -> queryOnly.execute(QueryParser.parse("mutation { updateUserStatus }"), null))
                .isInstanceOf(GqlException.class)
                .hasMessage("Schema does not define a Mutation type.");
    }

    @Test
    void unsupportedOperationKeywordFails() {
        assertThatThrownBy(() -> executor.execute("subscription", SelectionSet.builder().leaf("hello").build(), null))
                .isInstanceOf(GqlException.class)
                .hasMessage("Unsupported operation type: subscription")
                .extracting(e -> ((GqlException) e).error())
                .isEqualTo(GqlError.UNSUPPORTED_OPERATION);
    }

    @Test
    void operationKeywordOverloadExecutesQuery() {
        final var selections = SelectionSet.builder().leaf("hello").build();
        assertThat(executor.execute("query", selections, null)).isEqualTo(Map.of("hello", "World"));
    }

    // ========== Lookup failures ==========

    @Test
    void nonExistentRootFieldNamesFieldAndType() {
        assertThatThrownBy(() -> run("{ nonExistentField }"))
                .isInstanceOf(GqlException.class)
                .hasMessage("Cannot query field \"nonExistentField\" on type \"Query\".");
    }

    @Test
    void nonExistentNestedFieldNamesNestedType() {
        assertThatThrownBy(() -> run("{ user { id invalidField } }"))
                .isInstanceOf(GqlException.class)
                .hasMessage("Cannot query field \"invalidField\" on type \"User\".");
    }

    @Test
    void selectionOnScalarTypeFails() {
        assertThatThrownBy(() -> executor.resolveSelections(SelectionSet.builder().leaf("x").build(), GqlType.STRING, "v"))
                .isInstanceOf(GqlException.class)
                .hasMessage("Cannot resolve selections on a non-object type (String).");
    }

    // ========== Coercion through execution ==========

    @Test
    void nullableStringResolvesToNull() {
        final var result = run("{ nullableString }");
        assertThat(result).containsKey("nullableString");
        assertThat(result.get("nullableString")).isNull();
    }

    @Test
    void nonNullableStringReturningValue() {
        assertThat(run("{ nonNullableString }")).isEqualTo(Map.of("nonNullableString", "I am not null"));
    }

    @Test
    void nonNullableFieldReturningNullFails() {
        assertThatThrownBy(() -> run("{ nonNullableStringNullResolver }"))
                .isInstanceOf(GqlException.class)
                .hasMessage("Cannot return null for non-nullable type String!.")
                .extracting(e -> ((GqlException) e).category())
                .isEqualTo(GqlError.Category.COERCION);
    }

    @Test
    void coercedScalarTypes() {
        assertThat(child(run("{ user { age } }"), "user").get("age")).isInstanceOf(Integer.class);
        assertThat(child(run("{ product { price } }"), "product").get("price")).isInstanceOf(Double.class);
        assertThat(child(run("{ user { isActive } }"), "user").get("isActive")).isEqualTo(true);
    }

    @Test
    void listOfStrings() {
        assertThat(run("{ listOfString }").get("listOfString")).isEqualTo(List.of("apple", "banana", "cherry"));
    }

    @Test
    void listOfNonNullStrings() {
        assertThat(run("{ listOfNonNullString }").get("listOfNonNullString")).isEqualTo(List.of("one", "two", "three"));
    }

    @Test
    void listOfNonNullStringsWithNullElementFails() {
        assertThatThrownBy(() -> run("{ listOfNonNullStringWithNull }"))
                .isInstanceOf(GqlException.class)
                .hasMessage("Cannot return null for non-nullable type String!.");
    }

    // ========== Resolver errors ==========

    @Test
    void resolverExceptionIsWrappedWithFieldName() {
        assertThatThrownBy(() -> run("{ errorField }"))
                .isInstanceOf(GqlException.class)
                .hasMessage("Resolver for field \"errorField\" threw an exception: Something went wrong in the resolver!")
                .hasCauseInstanceOf(Exception.class)
                .extracting(e -> ((GqlException) e).error())
                .isEqualTo(GqlError.RESOLVER_FAILED);
    }

    @Test
    void resolverGqlExceptionPassesThroughUnwrapped() {
        final var own = GqlException.of(GqlError.INVALID_INT, "'x'");
        final var query = GqlType.object("Query", Map.of(
                "broken", FieldDefinition.of(GqlType.INT, (root, args) -> {
                    throw own;
                })));
        final var local = new Executor(new Schema(query));
        assertThatThrownBy(() -> local.execute(QueryParser.parse("{ broken }"), null)).isSameAs(own);
    }

    @Test
    void firstErrorAbortsWholeRequest() {
        assertThatThrownBy(() -> run("{ hello errorField nonNullableStringNullResolver }"))
                .isInstanceOf(GqlException.class)
                .hasMessageContaining("errorField");
    }

    // ========== Lists of objects ==========

    @Test
    void listOfObjectsWithNullValueIsNull() {
        final var query = GqlType.object("Query", Map.of(
                "users", FieldDefinition.of(GqlType.listOf(TestSchemas.userType()), (root, args) -> null)));
        final var result = new Executor(new Schema(query)).execute(QueryParser.parse("{ users { name } }"), null);
        assertThat(result).containsEntry("users", null);
    }

    @Test
    void listOfObjectsKeepsNullElements() {
        final var query = GqlType.object("Query", Map.of(
                "users", FieldDefinition.of(GqlType.listOf(TestSchemas.userType()),
                        (root, args) -> Arrays.asList(TestSchemas.ALICE, null))));
        final var result = new Executor(new Schema(query)).execute(QueryParser.parse("{ users { name } }"), null);
        @SuppressWarnings("unchecked")
        final var users = (List<Object>) result.get("users");
        assertThat(users).containsExactly(Map.of("name", "Alice"), null);
    }

    @Test
    void listOfObjectsRejectsNonIterableValue() {
        final var query = GqlType.object("Query", Map.of(
                "users", FieldDefinition.of(GqlType.listOf(TestSchemas.userType()), (root, args) -> "nope")));
        final var local = new Executor(new Schema(query));
        assertThatThrownBy(() -> local.execute(QueryParser.parse("{ users { name } }"), null))
                .isInstanceOf(GqlException.class)
                .hasMessage("Value is not iterable for List type [User]: 'nope'");
    }

    @Test
    void listOfObjectsAcceptsArrays() {
        final var query = GqlType.object("Query", Map.of(
                "users", FieldDefinition.of(GqlType.listOf(TestSchemas.userType()),
                        (root, args) -> new Object[]{TestSchemas.BOB})));
        final var result = new Executor(new Schema(query)).execute(QueryParser.parse("{ users { id } }"), null);
        assertThat(result.get("users")).isEqualTo(List.of(Map.of("id", "2")));
    }

    @Test
    void listOfNonNullObjectsRejectsNullElement() {
        final var query = GqlType.object("Query", Map.of(
                "users", FieldDefinition.of(GqlType.listOf(GqlType.nonNull(TestSchemas.userType())),
                        (root, args) -> Arrays.asList(TestSchemas.ALICE, null))));
        final var local = new Executor(new Schema(query));
        assertThatThrownBy(() -> local.execute(QueryParser.parse("{ users { name } }"), null))
                .isInstanceOf(GqlException.class)
                .hasMessage("Cannot return null for non-nullable type User!.");
    }

    @Test
    void nonNullObjectFieldIsWalkedByItsSelection() {
        final var query = GqlType.object("Query", Map.of(
                "me", FieldDefinition.of(GqlType.nonNull(TestSchemas.userType()), (root, args) -> TestSchemas.BOB)));
        final var result = new Executor(new Schema(query)).execute(QueryParser.parse("{ me { name } }"), null);
        assertThat(result).isEqualTo(Map.of("me", Map.of("name", "Bob")));
    }

    @Test
    void nonNullObjectFieldResolvingToNullFails() {
        final var query = GqlType.object("Query", Map.of(
                "me", FieldDefinition.of(GqlType.nonNull(TestSchemas.userType()), (root, args) -> null)));
        final var local = new Executor(new Schema(query));
        assertThatThrownBy(() -> local.execute(QueryParser.parse("{ me { name } }"), null))
                .isInstanceOf(GqlException.class)
                .hasMessage("Cannot return null for non-nullable type User!.");
    }

    @Test
    void nestedNonNullFieldOnNullableParentIsNotChecked() {
        final var query = GqlType.object("Query", Map.of(
                "user", FieldDefinition.of(TestSchemas.userType(), (root, args) -> null)));
        final var result = new Executor(new Schema(query)).execute(QueryParser.parse("{ user { id email } }"), null);
        assertThat(result).containsEntry("user", null);
    }

    @Test
    void missingNonNullPropertyOnParentFails() {
        final var partial = new HashMap<String, Object>();
        partial.put("name", "Nameless");
        assertThatThrownBy(() -> run("{ user { name email } }", Map.of("user", partial)))
                .isInstanceOf(GqlException.class)
                .hasMessage("Cannot return null for non-nullable type String!.");
    }

    // ========== Default resolution ==========

    record Book(String title, int pages) {
    }

    @Test
    void defaultResolutionReadsRecordComponents() {
        final var book = GqlType.object("Book", Map.of(
                "title", FieldDefinition.of(GqlType.STRING),
                "pages", FieldDefinition.of(GqlType.INT)));
        final var query = GqlType.object("Query", Map.of(
                "book", FieldDefinition.of(book, (root, args) -> new Book("Moby Dick", 635))));
        final var result = new Executor(new Schema(query)).execute(QueryParser.parse("{ book { title pages } }"), null);
        assertThat(result).isEqualTo(Map.of("book", Map.of("title", "Moby Dick", "pages", 635)));
    }

    @Test
    void customLookupReplacesDefaultResolution() {
        final var query = GqlType.object("Query", Map.of("shout", FieldDefinition.of(GqlType.STRING)));
        final FieldLookup upper = (source, fieldName) -> Optional.of(fieldName.toUpperCase());
        final var result = new Executor(new Schema(query), upper).execute(QueryParser.parse("{ shout }"), null);
        assertThat(result).isEqualTo(Map.of("shout", "SHOUT"));
    }

    @Test
    void failingLookupIsAttributedToField() {
        final var query = GqlType.object("Query", Map.of("boom", FieldDefinition.of(GqlType.STRING)));
        final FieldLookup failing = (source, fieldName) -> {
            throw new IllegalStateException("store offline");
        };
        final var local = new Executor(new Schema(query), failing);
        assertThatThrownBy(() -> local.execute(QueryParser.parse("{ boom }"), null))
                .isInstanceOf(GqlException.class)
                .hasMessage("Default resolution of field \"boom\" failed: store offline")
                .hasCauseInstanceOf(IllegalStateException.class);
    }

    @Test
    void jdkEntrySourceResolvesThroughEntryInterface() {
        final var entryType = GqlType.object("Entry", Map.of(
                "key", FieldDefinition.of(GqlType.STRING),
                "value", FieldDefinition.of(GqlType.STRING)));
        final var query = GqlType.object("Query", Map.of(
                "entry", FieldDefinition.of(entryType, (root, args) -> Map.entry("k", "v"))));
        final var result = new Executor(new Schema(query)).execute(QueryParser.parse("{ entry { key value } }"), null);
        assertThat(result).isEqualTo(Map.of("entry", Map.of("key", "k", "value", "v")));
    }

    @Test
    void immutableListSourceResolvesThroughListInterface() {
        final var sizedType = GqlType.object("Sized", Map.of(
                "size", FieldDefinition.of(GqlType.INT),
                "empty", FieldDefinition.of(GqlType.BOOLEAN)));
        final var query = GqlType.object("Query", Map.of(
                "numbers", FieldDefinition.of(sizedType, (root, args) -> List.of(1, 2, 3))));
        final var result = new Executor(new Schema(query)).execute(QueryParser.parse("{ numbers { size empty } }"), null);
        assertThat(result).isEqualTo(Map.of("numbers", Map.of("size", 3, "empty", false)));
    }

    @Test
    void unknownMemberOfJdkValueResolvesToNull() {
        final var entryType = GqlType.object("Entry", Map.of("owner", FieldDefinition.of(GqlType.STRING)));
        final var query = GqlType.object("Query", Map.of(
                "entry", FieldDefinition.of(entryType, (root, args) -> Map.entry("k", "v"))));
        final var result = new Executor(new Schema(query)).execute(QueryParser.parse("{ entry { owner } }"), null);
        assertThat(child(result, "entry")).containsEntry("owner", null);
    }

    // ========== Result shape ==========

    @Test
    void resultTreeIsUnmodifiable() {
        final var result = run("{ hello listOfString }");
        assertThatThrownBy(() -> result.put("extra", 1)).isInstanceOf(UnsupportedOperationException.class);
    }

    @Test
    void executionIsRepeatable() {
        final var parsed = QueryParser.parse("{ hello users { name age } user { email } }");
        final var first = executor.execute(parsed, null);
        final var second = executor.execute(parsed, null);
        assertThat(second).isEqualTo(first);
    }
}
