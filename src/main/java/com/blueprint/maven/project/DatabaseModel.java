package com.blueprint.maven.project;

import java.util.List;

/**
 * Connection settings of the database chosen for a new project.
 */
public class DatabaseModel {

    private final DatabaseKind kind;
    private final String label;
    private final String username;
    private final String connectionParams;

    /**
     * @param index   zero-based index of the chosen database
     * @param labels  database labels, ordered like {@link DatabaseKind}
     * @param projectName name of the project, used as Oracle user
     * @throws IllegalStateException if the index does not denote a supported database
     */
    public DatabaseModel(int index, List<String> labels, String projectName) {
        DatabaseKind[] kinds = DatabaseKind.values();
        if (index < 0 || index >= kinds.length || index >= labels.size()) {
            throw new IllegalStateException("Unsupported database");
        }
        this.kind = kinds[index];
        this.label = labels.get(index);
        this.username = kind.getUsername() == null ? projectName : kind.getUsername();
        // Rendered into XML descriptors, hence the escaped ampersand
        this.connectionParams = kind == DatabaseKind.MYSQL ? "?useSSL=false&amp;allowMultiQueries=true" : "";
    }

    public DatabaseKind getKind() {
        return kind;
    }

    public String getDatabase() {
        return label;
    }

    public String getSchema() {
        return kind.getSchema();
    }

    public String getDriver() {
        return kind.getDriver();
    }

    public String getDriverDependency() {
        return kind.getDriverDependency();
    }

    public String getDriverDependencyName() {
        return kind.getDriverDependencyName();
    }

    public String getUsername() {
        return username;
    }

    public String getPassword() {
        return kind.getPassword();
    }

    public String getConnectionParams() {
        return connectionParams;
    }
}
