package org.strata.migration;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.strata.migration.operation.ColumnDefinition;
import org.strata.migration.operation.CreateTableOperation;
import org.strata.migration.spi.SchemaIntrospector;
import org.strata.migration.spi.SqlExecutor;
import org.strata.model.FieldModel;
import org.strata.model.FieldType;
import org.strata.model.LiveColumnMetadata;
import org.strata.model.LiveTableMetadata;
import org.strata.model.ReferenceModel;
import org.strata.model.TableFragment;
import org.strata.naming.DefaultNaming;
import org.strata.schema.SchemaAssembler;

import java.sql.Connection;
import java.sql.DatabaseMetaData;
import java.sql.SQLException;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.startsWith;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class MigrationServiceTest {

    @Mock Connection connection;
    @Mock DatabaseMetaData metaData;
    @Mock SchemaIntrospector introspector;
    @Mock SqlExecutor sqlExecutor;

    private MigrationService service;

    @BeforeEach
    void setUp() {
        service = new MigrationService(new SchemaAssembler(), introspector, new DefaultNaming());
    }

    /** user(email) at order 1, post(authorId → user.id, title) at order 2. */
    private static List<TableFragment> blogSchema() {
        Map<String, FieldModel> user = new LinkedHashMap<>();
        user.put("email", FieldModel.of(FieldType.STRING));
        Map<String, FieldModel> post = new LinkedHashMap<>();
        post.put("authorId", FieldModel.builder().type(FieldType.STRING)
                .reference(ReferenceModel.to("user", "id")).build());
        post.put("title", FieldModel.of(FieldType.STRING));
        return List.of(
                TableFragment.builder().key("post").order(2).fields(post).build(),
                TableFragment.builder().key("user").order(1).fields(user).build());
    }

    @Nested
    @DisplayName("Reconciliation scenarios")
    class Scenarios {

        @Test
        @DisplayName("Empty database: both tables created, referenced one first")
        void emptyDatabase() throws SQLException {
            when(introspector.introspect(connection)).thenReturn(List.of());

            MigrationResult r = service.plan(connection, blogSchema(), DatabaseType.POSTGRES);

            assertThat(r.getToBeCreated()).containsExactly("user", "post");
            assertThat(r.getToBeAdded()).isEmpty();
            CreateTableOperation user = (CreateTableOperation) r.getOperations().get(0);
            CreateTableOperation post = (CreateTableOperation) r.getOperations().get(1);
            assertThat(user.columns()).extracting(ColumnDefinition::getName).containsExactly("id", "email");
            assertThat(post.columns()).extracting(ColumnDefinition::getName).containsExactly("id", "authorId", "title");
            assertThat(post.columns().get(1).getReferencedTable()).isEqualTo("user");
            assertThat(post.columns().get(1).getReferencedColumn()).isEqualTo("id");
        }

        @Test
        @DisplayName("Referenced table exists: only the other one is created")
        void partialDatabase() throws SQLException {
            when(introspector.introspect(connection)).thenReturn(List.of(LiveTableMetadata.of("user",
                    new LiveColumnMetadata("id", "text"), new LiveColumnMetadata("email", "text"))));

            MigrationResult r = service.plan(connection, blogSchema(), DatabaseType.POSTGRES);

            assertThat(r.getToBeCreated()).containsExactly("post");
            assertThat(r.getToBeAdded()).isEmpty();
        }

        @Test
        @DisplayName("Missing column: exactly one column addition")
        void missingColumn() throws SQLException {
            when(introspector.introspect(connection)).thenReturn(List.of(
                    LiveTableMetadata.of("user", new LiveColumnMetadata("id", "text")),
                    LiveTableMetadata.of("post", new LiveColumnMetadata("id", "text"),
                            new LiveColumnMetadata("authorId", "text"), new LiveColumnMetadata("title", "text"))));

            MigrationResult r = service.plan(connection, blogSchema(), DatabaseType.POSTGRES);

            assertThat(r.getToBeCreated()).isEmpty();
            assertThat(r.getToBeAdded()).containsExactly(new MigrationResult.PendingColumns("user", List.of("email")));
        }

        @Test
        @DisplayName("Fully migrated database plans nothing")
        void upToDate() throws SQLException {
            when(introspector.introspect(connection)).thenReturn(List.of(
                    LiveTableMetadata.of("user", new LiveColumnMetadata("id", "text"), new LiveColumnMetadata("email", "text")),
                    LiveTableMetadata.of("post", new LiveColumnMetadata("id", "text"),
                            new LiveColumnMetadata("authorId", "text"), new LiveColumnMetadata("title", "text"))));

            MigrationResult r = service.plan(connection, blogSchema(), DatabaseType.POSTGRES);

            assertThat(r.isUpToDate()).isTrue();
            assertThat(r.compile()).isEmpty();
        }
    }

    @Test
    @DisplayName("No connection is a capability error before anything else happens")
    void missingConnection() {
        assertThatThrownBy(() -> service.plan(null, blogSchema(), DatabaseType.MYSQL))
                .isInstanceOf(MigrationCapabilityException.class);
        verifyNoInteractions(introspector);
    }

    @Test
    @DisplayName("Introspection failure is a capability error")
    void introspectionFailure() throws SQLException {
        SQLException cause = new SQLException("permission denied");
        when(introspector.introspect(connection)).thenThrow(cause);

        assertThatThrownBy(() -> service.plan(connection, blogSchema(), DatabaseType.POSTGRES))
                .isInstanceOf(MigrationCapabilityException.class)
                .hasCause(cause);
    }

    @Test
    @DisplayName("Dialect is detected from the product name when not given")
    void detectsDialect() throws SQLException {
        when(connection.getMetaData()).thenReturn(metaData);
        when(metaData.getDatabaseProductName()).thenReturn("MySQL");
        when(introspector.introspect(connection)).thenReturn(List.of());

        MigrationResult r = service.plan(connection, blogSchema(), null);

        assertThat(r.getDatabaseType()).isEqualTo(DatabaseType.MYSQL);
        assertThat(r.compile()).contains("ENGINE=InnoDB");
    }

    @Test
    @DisplayName("Unknown product falls back to SQLite")
    void fallbackToSqlite() throws SQLException {
        when(connection.getMetaData()).thenReturn(metaData);
        when(metaData.getDatabaseProductName()).thenReturn("H2");

        assertThat(MigrationService.detect(connection)).isEqualTo(DatabaseType.SQLITE);
    }

    @Test
    @DisplayName("run() executes the compiled statements through the given executor")
    void runUsesExecutor() throws SQLException {
        MigrationResult r = service.plan(new SchemaAssembler().assemble(blogSchema()), List.of(),
                DatabaseType.SQLITE, sqlExecutor);

        r.run();

        verify(sqlExecutor).execute(startsWith("CREATE TABLE \"user\""));
        verify(sqlExecutor).execute(startsWith("CREATE TABLE \"post\""));
    }

    @Test
    @DisplayName("A plan without an executor cannot be run")
    void runWithoutExecutor() {
        MigrationResult r = service.plan(new SchemaAssembler().assemble(blogSchema()), List.of(),
                DatabaseType.SQLITE, null);

        assertThatThrownBy(r::run).isInstanceOf(MigrationCapabilityException.class);
    }
}
