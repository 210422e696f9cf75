package br.edu.ifba.graphrag.storage.impl;

import io.quarkus.arc.properties.IfBuildProperty;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.SQLException;
import java.sql.Statement;

/**
 * Connection setup for the Apache AGE backend. All tenants share one graph; isolation is
 * carried by the {@code group_id} property on every node and edge.
 */
@ApplicationScoped
@IfBuildProperty(name = "graphrag.storage.backend", stringValue = "age")
public class AgeConfig {

    private static final Logger logger = LoggerFactory.getLogger(AgeConfig.class);

    private static final int VALIDATION_TIMEOUT_SECONDS = 5;

    @Inject
    DataSource dataSource;

    @ConfigProperty(name = "graphrag.storage.age.graph-name", defaultValue = "knowledge_graph")
    String graphName;

    public AgeConfig() {
    }

    public String getGraphName() {
        return graphName;
    }

    /**
     * Returns a validated connection with the AGE extension loaded and the search path set.
     *
     * @throws SQLException if no healthy connection can be obtained
     */
    public Connection getConnection() throws SQLException {
        Connection connection = dataSource.getConnection();
        try {
            if (!connection.isValid(VALIDATION_TIMEOUT_SECONDS)) {
                throw new SQLException("Connection validation failed", "08006");
            }
            try (Statement stmt = connection.createStatement()) {
                stmt.execute("LOAD 'age'");
                stmt.execute("SET search_path = ag_catalog, \"$user\", public");
            }
            return connection;
        } catch (SQLException e) {
            try {
                connection.close();
            } catch (SQLException closeError) {
                logger.warn("Failed to close invalid connection: {}", closeError.getMessage());
                e.addSuppressed(closeError);
            }
            throw e;
        }
    }
}
